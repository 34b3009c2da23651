package com.polcard.engine.card;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Effect block of a card: its rules plus the neutralization immunity flag.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CardEffects {
    @JsonProperty("rules")
    private List<EffectRule> rules = new ArrayList<>();

    @JsonProperty("immuneToNeutralization")
    private boolean immuneToNeutralization;

    public List<EffectRule> getRules() {
        return rules;
    }

    public void setRules(List<EffectRule> rules) {
        this.rules = rules != null ? rules : new ArrayList<>();
    }

    public boolean isImmuneToNeutralization() {
        return immuneToNeutralization;
    }

    public void setImmuneToNeutralization(boolean immuneToNeutralization) {
        this.immuneToNeutralization = immuneToNeutralization;
    }
}
