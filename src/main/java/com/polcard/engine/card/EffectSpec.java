package com.polcard.engine.card;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Effect clause of a rule. {@code value} is numeric for power effects and may be
 * a boolean for flag effects (true reads as 1).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EffectSpec {
    @JsonProperty("type")
    private EffectType type;

    @JsonProperty("value")
    private JsonNode value = NullNode.getInstance();

    @JsonProperty("allowedTypes")
    private List<String> allowedTypes = new ArrayList<>();

    @JsonProperty("destination")
    private SearchDestination destination;

    @JsonProperty("searchCount")
    private Integer searchCount;

    @JsonProperty("selectCount")
    private Integer selectCount;

    @JsonProperty("cardTypeFilter")
    private CardCategory cardTypeFilter;

    public EffectType getType() {
        return type;
    }

    public void setType(EffectType type) {
        this.type = type;
    }

    public JsonNode getValue() {
        return value;
    }

    public void setValue(JsonNode value) {
        this.value = value != null ? value : NullNode.getInstance();
    }

    @JsonIgnore
    public int intValue() {
        if (value.isBoolean()) {
            return value.asBoolean() ? 1 : 0;
        }
        return value.asInt();
    }

    public List<String> getAllowedTypes() {
        return allowedTypes;
    }

    public void setAllowedTypes(List<String> allowedTypes) {
        this.allowedTypes = allowedTypes != null ? allowedTypes : new ArrayList<>();
    }

    public SearchDestination getDestination() {
        return destination;
    }

    public void setDestination(SearchDestination destination) {
        this.destination = destination;
    }

    public Integer getSearchCount() {
        return searchCount;
    }

    public void setSearchCount(Integer searchCount) {
        this.searchCount = searchCount;
    }

    public Integer getSelectCount() {
        return selectCount;
    }

    public void setSelectCount(Integer selectCount) {
        this.selectCount = selectCount;
    }

    public CardCategory getCardTypeFilter() {
        return cardTypeFilter;
    }

    public void setCardTypeFilter(CardCategory cardTypeFilter) {
        this.cardTypeFilter = cardTypeFilter;
    }
}
