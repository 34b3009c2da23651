package com.polcard.engine.sequence;

import java.util.List;

/**
 * Result of {@link PlaySequence#validate()}.
 *
 * @param gaps          sequence ids missing between consecutive records
 * @param duplicates    sequence ids used more than once
 * @param missingFields sequence ids of records lacking player, card or action
 */
public record SequenceValidation(List<Integer> gaps, List<Integer> duplicates, List<Integer> missingFields) {

    public SequenceValidation {
        gaps = List.copyOf(gaps);
        duplicates = List.copyOf(duplicates);
        missingFields = List.copyOf(missingFields);
    }

    public boolean isValid() {
        return gaps.isEmpty() && duplicates.isEmpty() && missingFields.isEmpty();
    }

    public String describe() {
        if (isValid()) {
            return "valid";
        }
        return "gaps=" + gaps + ", duplicates=" + duplicates + ", missingFields=" + missingFields;
    }
}
