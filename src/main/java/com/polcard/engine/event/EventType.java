package com.polcard.engine.event;

/**
 * Types of events appended to a game's event stream.
 */
public enum EventType {
    ROOM_CREATED,
    PLAYER_JOINED,
    GAME_STARTED,
    INITIAL_HAND_DEALT,
    PLAYER_READY,
    HAND_REDRAWN,
    GAME_PHASE_START,
    DRAW_PHASE_COMPLETE,
    PHASE_CHANGE,
    TURN_SWITCH,
    CARD_PLAYED,
    ZONE_FILLED,
    CARD_EFFECT_TRIGGERED,
    CARD_SELECTION_REQUIRED,
    CARD_SELECTION_COMPLETED,
    CARD_MOVED_TO_HAND,
    CARD_MOVED_TO_SP_ZONE,
    CARD_MOVED_TO_HELP_ZONE,
    CARDS_DRAWN,
    CARDS_DISCARDED,
    CARD_NEUTRALIZED,
    ALL_MAIN_ZONES_FILLED,
    ALL_SP_ZONES_FILLED,
    SP_CARDS_REVEALED,
    BATTLE_RESULT,
    ROUND_END,
    LEADER_CHANGED,
    PLAYER_PASSED,
    GAME_END,
    ERROR_OCCURRED
}
