package com.polcard.engine.card;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Declarative effect rule: when (trigger), on what (target), doing what (effect).
 * The JSON key for the rule kind is "type".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EffectRule {
    @JsonProperty("id")
    private String id;

    @JsonProperty("type")
    private RuleKind kind = RuleKind.CONTINUOUS;

    @JsonProperty("trigger")
    private Trigger trigger = new Trigger();

    @JsonProperty("target")
    private TargetSpec target = new TargetSpec();

    @JsonProperty("effect")
    private EffectSpec effect = new EffectSpec();

    @JsonProperty("description")
    private String description;

    @JsonProperty("unremovable")
    private boolean unremovable;

    public String getId() {
        return id;
    }

    public RuleKind getKind() {
        return kind;
    }

    public Trigger getTrigger() {
        return trigger;
    }

    public TargetSpec getTarget() {
        return target;
    }

    public EffectSpec getEffect() {
        return effect;
    }

    public String getDescription() {
        return description;
    }

    public boolean isUnremovable() {
        return unremovable;
    }

    public void setId(String id) {
        this.id = id;
    }

    public void setKind(RuleKind kind) {
        this.kind = kind;
    }

    public void setTrigger(Trigger trigger) {
        this.trigger = trigger != null ? trigger : new Trigger();
    }

    public void setTarget(TargetSpec target) {
        this.target = target != null ? target : new TargetSpec();
    }

    public void setEffect(EffectSpec effect) {
        this.effect = effect != null ? effect : new EffectSpec();
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public void setUnremovable(boolean unremovable) {
        this.unremovable = unremovable;
    }

    @JsonIgnore
    public EffectType getEffectType() {
        return effect.getType();
    }

    @JsonIgnore
    public TriggerEvent getEvent() {
        return trigger.getEvent();
    }

    /**
     * True if the rule leaves derived state behind (power changes, restrictions,
     * flags) rather than acting once, and so is recomputed on every replay.
     */
    @JsonIgnore
    public boolean isPersistent() {
        return effect.getType() != null
                && !effect.getType().isOneShot()
                && !target.isRequiresSelection();
    }
}
