package com.polcard.engine.card;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.polcard.engine.game.ZoneName;

import java.util.List;

/**
 * Faction tags a leader allows in each character zone. A missing entry allows everything.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ZoneCompatibility {
    public static final String ALL = "ALL";

    @JsonProperty("top")
    private List<String> top;

    @JsonProperty("left")
    private List<String> left;

    @JsonProperty("right")
    private List<String> right;

    public ZoneCompatibility() {
    }

    public ZoneCompatibility(List<String> top, List<String> left, List<String> right) {
        this.top = top;
        this.left = left;
        this.right = right;
    }

    public List<String> getTop() {
        return top;
    }

    public List<String> getLeft() {
        return left;
    }

    public List<String> getRight() {
        return right;
    }

    /**
     * Allowed faction tags for a zone; ["ALL"] when the leader does not restrict it.
     */
    public List<String> allowedFor(ZoneName zone) {
        List<String> allowed = switch (zone) {
            case TOP -> top;
            case LEFT -> left;
            case RIGHT -> right;
            default -> null;
        };
        return allowed == null || allowed.isEmpty() ? List.of(ALL) : List.copyOf(allowed);
    }
}
