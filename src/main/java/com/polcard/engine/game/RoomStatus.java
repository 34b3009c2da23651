package com.polcard.engine.game;

/**
 * Room lifecycle, ahead of and around the game phases.
 */
public enum RoomStatus {
    WAITING_FOR_PLAYERS,
    BOTH_JOINED,
    READY_PHASE,
    IN_GAME,
    GAME_OVER
}
