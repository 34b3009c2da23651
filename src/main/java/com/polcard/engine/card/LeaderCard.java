package com.polcard.engine.card;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Leader card. Leaders impose zone compatibility on their player's character zones
 * and carry an initial point used for first-player choice and SP ordering.
 */
public class LeaderCard extends BaseCard {
    @JsonProperty("initialPoint")
    private int initialPoint;

    @JsonProperty("zoneCompatibility")
    private ZoneCompatibility zoneCompatibility = new ZoneCompatibility();

    public int getInitialPoint() {
        return initialPoint;
    }

    public ZoneCompatibility getZoneCompatibility() {
        return zoneCompatibility;
    }

    public void setInitialPoint(int initialPoint) {
        this.initialPoint = initialPoint;
    }

    public void setZoneCompatibility(ZoneCompatibility zoneCompatibility) {
        this.zoneCompatibility = zoneCompatibility != null ? zoneCompatibility : new ZoneCompatibility();
    }
}
