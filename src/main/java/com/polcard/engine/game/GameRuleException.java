package com.polcard.engine.game;

/**
 * Thrown when an action breaks a game rule. The action is rejected and the stored
 * game state stays unchanged.
 */
public class GameRuleException extends Exception {
    private final ErrorType errorType;

    public GameRuleException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public GameRuleException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
