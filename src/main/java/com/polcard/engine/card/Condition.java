package com.polcard.engine.card;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.ArrayList;
import java.util.List;

/**
 * A single trigger condition. Which fields are meaningful depends on the type:
 * name checks read {@code value} as text, hand counts read it as a number,
 * {@code zoneEmpty} reads {@code zone}, {@code or} reads {@code conditions}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Condition {
    @JsonProperty("type")
    private ConditionType type;

    @JsonProperty("value")
    private JsonNode value = NullNode.getInstance();

    @JsonProperty("zone")
    private String zone;

    @JsonProperty("operator")
    private String operator;

    @JsonProperty("conditions")
    private List<Condition> conditions = new ArrayList<>();

    public ConditionType getType() {
        return type;
    }

    public void setType(ConditionType type) {
        this.type = type;
    }

    public JsonNode getValue() {
        return value;
    }

    public void setValue(JsonNode value) {
        this.value = value != null ? value : NullNode.getInstance();
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = operator;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public void setConditions(List<Condition> conditions) {
        this.conditions = conditions != null ? conditions : new ArrayList<>();
    }

    @JsonIgnore
    public String textValue() {
        return value.isNull() || value.isMissingNode() ? "" : value.asText();
    }

    @JsonIgnore
    public int intValue() {
        return value.asInt();
    }
}
