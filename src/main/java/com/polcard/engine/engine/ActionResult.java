package com.polcard.engine.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.polcard.engine.event.GameEvent;
import com.polcard.engine.game.ErrorType;
import com.polcard.engine.game.GameRuleException;
import com.polcard.engine.game.GameState;

import java.util.List;

/**
 * Response envelope of the engine: the updated state with the events the call
 * produced, or an error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionResult(
    @JsonProperty("gameState") GameState gameState,
    @JsonProperty("events") List<GameEvent> events,
    @JsonProperty("error") String error,
    @JsonProperty("errorType") ErrorType errorType
) {
    public ActionResult {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static ActionResult success(GameState state, List<GameEvent> events) {
        return new ActionResult(state, events, null, null);
    }

    public static ActionResult failure(ErrorType type, String message) {
        return new ActionResult(null, List.of(), message, type);
    }

    public static ActionResult failure(GameRuleException e) {
        return failure(e.getErrorType(), e.getMessage());
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }
}
