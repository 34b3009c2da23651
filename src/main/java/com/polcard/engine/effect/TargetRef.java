package com.polcard.engine.effect;

import com.polcard.engine.game.ZoneName;

/**
 * A face-up card on the field, identified by owner and zone.
 */
public record TargetRef(String playerId, String cardId, ZoneName zone) {
}
