package com.polcard.engine.card;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Target filter. {@code value} accepts a single string or an array;
 * {@code values} is the array form used by {@code gameTypeOr}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TargetFilter {
    @JsonProperty("type")
    private FilterType type;

    @JsonProperty("value")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> value = new ArrayList<>();

    @JsonProperty("values")
    private List<String> values = new ArrayList<>();

    public TargetFilter() {
    }

    public TargetFilter(FilterType type, List<String> values) {
        this.type = type;
        this.values = new ArrayList<>(values);
    }

    public FilterType getType() {
        return type;
    }

    public void setType(FilterType type) {
        this.type = type;
    }

    public List<String> getValue() {
        return value;
    }

    public void setValue(List<String> value) {
        this.value = value != null ? value : new ArrayList<>();
    }

    public List<String> getValues() {
        return values;
    }

    public void setValues(List<String> values) {
        this.values = values != null ? values : new ArrayList<>();
    }

    /**
     * All accepted values of this filter, from either key.
     */
    public List<String> acceptedValues() {
        List<String> all = new ArrayList<>(value);
        all.addAll(values);
        return all;
    }
}
