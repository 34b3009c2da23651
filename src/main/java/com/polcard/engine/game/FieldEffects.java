package com.polcard.engine.game;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.polcard.engine.card.ZoneCompatibility;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-player state derived by replaying the play sequence. Never edited by hand:
 * the simulator produces a fresh instance and the caller assigns it.
 *
 * @param zoneRestrictions      allowed faction tags per zone key (TOP..SP), ["ALL"] when open
 * @param activeEffects         effects in force, in application order
 * @param calculatedPowers      final power of each face-up character, never negative
 * @param disabledCards         cards of this player whose effects are suppressed
 * @param victoryPointModifiers signed operand applied to total power after combos
 * @param specialStates         flags derived from placement and play-restriction effects
 */
public record FieldEffects(
    @JsonProperty("zoneRestrictions") Map<String, List<String>> zoneRestrictions,
    @JsonProperty("activeEffects") List<ActiveEffect> activeEffects,
    @JsonProperty("calculatedPowers") Map<String, Integer> calculatedPowers,
    @JsonProperty("disabledCards") List<DisabledCard> disabledCards,
    @JsonProperty("victoryPointModifiers") int victoryPointModifiers,
    @JsonProperty("specialStates") SpecialStates specialStates
) {
    public FieldEffects {
        zoneRestrictions = zoneRestrictions == null ? Map.of() : Collections.unmodifiableMap(copyRestrictions(zoneRestrictions));
        activeEffects = activeEffects == null ? List.of() : List.copyOf(activeEffects);
        calculatedPowers = calculatedPowers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(calculatedPowers));
        disabledCards = disabledCards == null ? List.of() : List.copyOf(disabledCards);
        specialStates = specialStates == null ? SpecialStates.none() : specialStates;
    }

    /**
     * Reset state: every zone open, nothing active.
     */
    public static FieldEffects defaults() {
        Map<String, List<String>> open = new LinkedHashMap<>();
        for (ZoneName zone : ZoneName.FIELD_ZONES) {
            open.put(zone.restrictionKey(), List.of(ZoneCompatibility.ALL));
        }
        return new FieldEffects(open, List.of(), Map.of(), List.of(), 0, SpecialStates.none());
    }

    public List<String> restrictionFor(ZoneName zone) {
        return zoneRestrictions.getOrDefault(zone.restrictionKey(), List.of(ZoneCompatibility.ALL));
    }

    public int powerOf(String cardId) {
        return calculatedPowers.getOrDefault(cardId, 0);
    }

    public boolean isDisabled(String cardId) {
        return disabledCards.stream().anyMatch(d -> d.cardId().equals(cardId));
    }

    private static Map<String, List<String>> copyRestrictions(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, List.copyOf(value)));
        return copy;
    }
}
