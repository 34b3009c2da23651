package com.polcard.engine.sequence;

/**
 * Thrown when a play sequence has gaps or duplicate ids. The game it belongs to
 * can no longer be replayed and must not accept further actions.
 */
public class SequenceCorruptedException extends RuntimeException {
    private final SequenceValidation validation;

    public SequenceCorruptedException(SequenceValidation validation) {
        super("Play sequence corrupted: " + validation.describe());
        this.validation = validation;
    }

    public SequenceValidation getValidation() {
        return validation;
    }
}
