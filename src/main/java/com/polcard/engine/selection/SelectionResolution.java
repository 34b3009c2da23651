package com.polcard.engine.selection;

import com.polcard.engine.game.PendingSelection;

import java.util.List;

/**
 * Outcome of a completed selection.
 *
 * @param helpCardPlaced id of a help card a deck search put face-up into the help zone,
 *                       whose onPlay rules still have to run; null otherwise
 */
public record SelectionResolution(
        String selectionId,
        String playerId,
        PendingSelection.Kind kind,
        List<String> selectedCardIds,
        String helpCardPlaced
) {
    public SelectionResolution {
        selectedCardIds = List.copyOf(selectedCardIds);
    }

    public boolean placedHelpCard() {
        return helpCardPlaced != null;
    }
}
