package com.polcard.engine.game;

/**
 * Machine-readable cause of a rejected action.
 */
public enum ErrorType {
    // Structural
    INVALID_ACTION_TYPE,
    NOT_YOUR_TURN,
    GAME_NOT_FOUND,
    INVALID_PHASE,
    ROOM_NOT_AVAILABLE,
    GAME_ENDED,
    SEQUENCE_CORRUPTED,

    // Gate
    CARD_SELECTION_PENDING,
    WAITING_FOR_PLAYER,

    // Placement
    INVALID_CARD_INDEX,
    INVALID_POSITION,
    CARD_NOT_FOUND,
    CARD_TYPE_ZONE_ERROR,
    ZONE_OCCUPIED_ERROR,
    PHASE_RESTRICTION_ERROR,
    SP_PHASE_RESTRICTION,
    ZONE_COMPATIBILITY_ERROR,
    FIELD_EFFECT_RESTRICTION,
    PLAY_PREVENTED,

    // Selection
    INVALID_SELECTION,
    INVALID_SELECTION_COUNT,
    INVALID_CARD_SELECTION,
    UNAUTHORIZED_SELECTION,
    CARD_SELECTION_TIMEOUT
}
