package com.polcard.engine.sequence;

import java.util.Map;

public record SequenceStatistics(
    int totalPlays,
    Map<String, Integer> byPlayer,
    Map<PlayAction, Integer> byAction,
    Map<String, Integer> byPhase
) {
}
