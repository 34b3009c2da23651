package com.polcard.engine.card;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Trigger {
    @JsonProperty("event")
    private TriggerEvent event = TriggerEvent.ALWAYS;

    @JsonProperty("conditions")
    private List<Condition> conditions = new ArrayList<>();

    public TriggerEvent getEvent() {
        return event;
    }

    public void setEvent(TriggerEvent event) {
        this.event = event != null ? event : TriggerEvent.ALWAYS;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public void setConditions(List<Condition> conditions) {
        this.conditions = conditions != null ? conditions : new ArrayList<>();
    }
}
