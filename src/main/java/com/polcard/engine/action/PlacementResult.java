package com.polcard.engine.action;

import com.polcard.engine.game.ZoneName;

/**
 * A committed placement.
 *
 * @param selectionOpened the card's trigger opened a selection the player must resolve
 */
public record PlacementResult(String cardId, ZoneName zone, boolean faceDown, boolean selectionOpened) {
}
