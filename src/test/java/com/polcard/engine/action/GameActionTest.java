package com.polcard.engine.action;

import com.polcard.engine.game.ErrorType;
import com.polcard.engine.game.GameRuleException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GameActionTest {

    @Test
    void testParsePlayCard() throws GameRuleException {
        GameAction action = GameAction.fromJson("{\"type\": \"PlayCard\", \"field_idx\": 2, \"card_idx\": 1}");
        assertEquals(new GameAction.PlayCard(2, 1), action);
        assertEquals("PlayCard", action.typeName());
    }

    @Test
    void testParsePlayCardBack() throws GameRuleException {
        GameAction action = GameAction.fromJson("{\"type\": \"PlayCardBack\", \"field_idx\": 4, \"card_idx\": 0}");
        assertInstanceOf(GameAction.PlayCardBack.class, action);
        assertEquals(4, ((GameAction.PlayCardBack) action).fieldIdx());
    }

    @Test
    void testParseSelectCard() throws GameRuleException {
        GameAction action = GameAction.fromJson(
                "{\"type\": \"SelectCard\", \"selectionId\": \"p1_100\", \"selectedCardIds\": [\"c-1\", \"c-2\"]}");
        GameAction.SelectCard select = assertInstanceOf(GameAction.SelectCard.class, action);
        assertEquals("p1_100", select.selectionId());
        assertEquals(List.of("c-1", "c-2"), select.selectedCardIds());
    }

    @Test
    void testSelectCardWithoutIds() throws GameRuleException {
        GameAction.SelectCard select = (GameAction.SelectCard) GameAction.fromJson(
                "{\"type\": \"SelectCard\", \"selectionId\": \"p1_100\"}");
        assertTrue(select.selectedCardIds().isEmpty());
    }

    @Test
    void testParsePass() throws GameRuleException {
        assertInstanceOf(GameAction.Pass.class, GameAction.fromJson("{\"type\": \"Pass\"}"));
    }

    @Test
    void testUnknownType() {
        GameRuleException e = assertThrows(GameRuleException.class,
                () -> GameAction.fromJson("{\"type\": \"Surrender\"}"));
        assertEquals(ErrorType.INVALID_ACTION_TYPE, e.getErrorType());
        assertTrue(e.getMessage().contains("Surrender"));
    }

    @Test
    void testMissingTypeAndMalformedJson() {
        GameRuleException missing = assertThrows(GameRuleException.class,
                () -> GameAction.fromJson("{\"field_idx\": 0, \"card_idx\": 0}"));
        assertEquals(ErrorType.INVALID_ACTION_TYPE, missing.getErrorType());

        GameRuleException malformed = assertThrows(GameRuleException.class,
                () -> GameAction.fromJson("{\"type\": "));
        assertEquals(ErrorType.INVALID_ACTION_TYPE, malformed.getErrorType());
    }
}
