package com.polcard.engine.game;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Field zones of a player. Field index 0..4 maps to top, left, right, help, sp.
 * The leader zone has no field index.
 */
public enum ZoneName {
    TOP("top", 0),
    LEFT("left", 1),
    RIGHT("right", 2),
    HELP("help", 3),
    SP("sp", 4),
    LEADER("leader", -1);

    public static final List<ZoneName> CHARACTER_ZONES = List.of(TOP, LEFT, RIGHT);
    public static final List<ZoneName> FIELD_ZONES = List.of(TOP, LEFT, RIGHT, HELP, SP);

    private final String jsonValue;
    private final int fieldIndex;

    ZoneName(String jsonValue, int fieldIndex) {
        this.jsonValue = jsonValue;
        this.fieldIndex = fieldIndex;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public int getFieldIndex() {
        return fieldIndex;
    }

    public boolean isCharacterZone() {
        return this == TOP || this == LEFT || this == RIGHT;
    }

    /**
     * Key used in zone restriction tables ("TOP", "HELP", ...).
     */
    public String restrictionKey() {
        return name();
    }

    /**
     * Resolve an action's field index.
     * @return the zone, or null if the index is out of range
     */
    public static ZoneName fromFieldIndex(int index) {
        for (ZoneName zone : FIELD_ZONES) {
            if (zone.fieldIndex == index) {
                return zone;
            }
        }
        return null;
    }

    @JsonCreator
    public static ZoneName fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Zone cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "top" -> TOP;
            case "left" -> LEFT;
            case "right" -> RIGHT;
            case "help" -> HELP;
            case "sp" -> SP;
            case "leader" -> LEADER;
            default -> throw new IllegalArgumentException("Unknown zone: " + value);
        };
    }
}
