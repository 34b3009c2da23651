package com.polcard.engine.card;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Properties shared by all card categories.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BaseCard {
    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("gameType")
    private String gameType;

    @JsonProperty("power")
    private int power;

    @JsonProperty("traits")
    private List<String> traits = new ArrayList<>();

    @JsonProperty("effects")
    private CardEffects effects = new CardEffects();

    @JsonProperty("description")
    private String description;

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getGameType() {
        return gameType;
    }

    public int getPower() {
        return power;
    }

    public List<String> getTraits() {
        return traits;
    }

    public CardEffects getEffects() {
        return effects;
    }

    public String getDescription() {
        return description;
    }

    public void setId(String id) {
        this.id = id;
    }

    public void setName(String name) {
        this.name = name;
    }

    public void setGameType(String gameType) {
        this.gameType = gameType;
    }

    public void setPower(int power) {
        this.power = power;
    }

    public void setTraits(List<String> traits) {
        this.traits = traits != null ? traits : new ArrayList<>();
    }

    public void setEffects(CardEffects effects) {
        this.effects = effects != null ? effects : new CardEffects();
    }

    public void setDescription(String description) {
        this.description = description;
    }

    /**
     * Check if the card carries a trait. The universal trait "all" matches any value.
     */
    public boolean hasTrait(String trait) {
        return traits.contains(trait) || traits.contains("all");
    }

    public boolean hasEffectRules() {
        return !effects.getRules().isEmpty();
    }
}
