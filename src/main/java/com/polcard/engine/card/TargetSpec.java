package com.polcard.engine.card;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.polcard.engine.game.ZoneName;

import java.util.ArrayList;
import java.util.List;

/**
 * Target clause of a rule. An empty zone list means the character zones.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TargetSpec {
    @JsonProperty("owner")
    private TargetOwner owner = TargetOwner.SELF;

    @JsonProperty("zones")
    private List<ZoneName> zones = new ArrayList<>();

    @JsonProperty("filters")
    private List<TargetFilter> filters = new ArrayList<>();

    @JsonProperty("limit")
    private Integer limit;

    @JsonProperty("requiresSelection")
    private boolean requiresSelection;

    public TargetOwner getOwner() {
        return owner;
    }

    public void setOwner(TargetOwner owner) {
        this.owner = owner != null ? owner : TargetOwner.SELF;
    }

    public List<ZoneName> getZones() {
        return zones;
    }

    public void setZones(List<ZoneName> zones) {
        this.zones = zones != null ? zones : new ArrayList<>();
    }

    /**
     * Zones to enumerate, defaulting to the character zones.
     */
    public List<ZoneName> effectiveZones() {
        return zones.isEmpty() ? ZoneName.CHARACTER_ZONES : zones;
    }

    public List<TargetFilter> getFilters() {
        return filters;
    }

    public void setFilters(List<TargetFilter> filters) {
        this.filters = filters != null ? filters : new ArrayList<>();
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public boolean isRequiresSelection() {
        return requiresSelection;
    }

    public void setRequiresSelection(boolean requiresSelection) {
        this.requiresSelection = requiresSelection;
    }
}
