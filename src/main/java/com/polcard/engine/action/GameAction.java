package com.polcard.engine.action;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.polcard.engine.game.ErrorType;
import com.polcard.engine.game.GameRuleException;

import java.util.List;

/**
 * Inbound player action, keyed on the JSON "type" property.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "type"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = GameAction.PlayCard.class, name = "PlayCard"),
    @JsonSubTypes.Type(value = GameAction.PlayCardBack.class, name = "PlayCardBack"),
    @JsonSubTypes.Type(value = GameAction.SelectCard.class, name = "SelectCard"),
    @JsonSubTypes.Type(value = GameAction.Pass.class, name = "Pass")
})
public sealed interface GameAction
        permits GameAction.PlayCard, GameAction.PlayCardBack, GameAction.SelectCard, GameAction.Pass {

    ObjectMapper MAPPER = new ObjectMapper();

    @JsonIgnore
    String typeName();

    /**
     * Parse an action envelope.
     *
     * @throws GameRuleException INVALID_ACTION_TYPE for a missing or unknown type or a malformed body
     */
    static GameAction fromJson(String json) throws GameRuleException {
        try {
            return MAPPER.readValue(json, GameAction.class);
        } catch (InvalidTypeIdException e) {
            throw new GameRuleException(ErrorType.INVALID_ACTION_TYPE, "Invalid action type: " + e.getTypeId(), e);
        } catch (JsonProcessingException e) {
            throw new GameRuleException(ErrorType.INVALID_ACTION_TYPE, "Malformed action: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Face-up placement of the hand card at {@code card_idx} into field zone {@code field_idx}.
     */
    record PlayCard(
        @JsonProperty("field_idx") int fieldIdx,
        @JsonProperty("card_idx") int cardIdx
    ) implements GameAction {
        @Override
        public String typeName() {
            return "PlayCard";
        }
    }

    /**
     * Face-down variant of {@link PlayCard}.
     */
    record PlayCardBack(
        @JsonProperty("field_idx") int fieldIdx,
        @JsonProperty("card_idx") int cardIdx
    ) implements GameAction {
        @Override
        public String typeName() {
            return "PlayCardBack";
        }
    }

    record SelectCard(
        @JsonProperty("selectionId") String selectionId,
        @JsonProperty("selectedCardIds") List<String> selectedCardIds
    ) implements GameAction {
        public SelectCard {
            selectedCardIds = selectedCardIds == null ? List.of() : List.copyOf(selectedCardIds);
        }

        @Override
        public String typeName() {
            return "SelectCard";
        }
    }

    record Pass() implements GameAction {
        @Override
        public String typeName() {
            return "Pass";
        }
    }
}
