package com.polcard.engine.sequence;

import com.polcard.engine.game.GameStateCodec;
import com.polcard.engine.game.Phase;
import com.polcard.engine.game.ZoneName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlaySequenceTest {

    private static PlaySequence sample() {
        PlaySequence sequence = new PlaySequence();
        sequence.append("a", "s-1", PlayAction.PLAY_LEADER, ZoneName.LEADER, PlayData.leader(0, true, false),
                100, 1, Phase.MAIN_PHASE);
        sequence.append("b", "s-2", PlayAction.PLAY_LEADER, ZoneName.LEADER, PlayData.leader(0, true, false),
                100, 1, Phase.MAIN_PHASE);
        sequence.append("a", "c-1", PlayAction.PLAY_CARD, ZoneName.TOP, PlayData.placement(false),
                200, 1, Phase.MAIN_PHASE);
        sequence.append("b", "h-2", PlayAction.PLAY_CARD, ZoneName.HELP, PlayData.placement(false),
                300, 1.5, Phase.MAIN_PHASE);
        sequence.append("b", "h-2", PlayAction.APPLY_SET_POWER, ZoneName.TOP,
                PlayData.appliedSelection("sel", List.of("c-1"), "a", 0), 310, 1.5, Phase.MAIN_PHASE);
        return sequence;
    }

    @Test
    void testIdsAreConsecutive() {
        PlaySequence sequence = sample();
        assertEquals(5, sequence.size());
        assertEquals(5, sequence.getGlobalSequence());
        List<PlayRecord> all = sequence.all();
        for (int i = 0; i < all.size(); i++) {
            assertEquals(i + 1, all.get(i).sequenceId(), "Sequence ids should start at 1 without gaps");
        }
        assertTrue(sequence.validate().isValid());
    }

    @Test
    void testQueries() {
        PlaySequence sequence = sample();
        assertEquals(2, sequence.byPlayer("a").size());
        assertEquals(2, sequence.byTurn(1.5).size());
        assertEquals("h-2", sequence.lastPlayByPlayer("b").orElseThrow().cardId());
        assertEquals(PlayAction.APPLY_SET_POWER, sequence.lastPlayByPlayer("b").orElseThrow().action());
        assertTrue(sequence.lastPlayByPlayer("nobody").isEmpty());
        assertTrue(sequence.hasLeaderPlay("a", "s-1"));
        assertFalse(sequence.hasLeaderPlay("a", "s-2"));
    }

    @Test
    void testStatistics() {
        SequenceStatistics stats = sample().statistics();
        assertEquals(5, stats.totalPlays());
        assertEquals(2, stats.byPlayer().get("a"));
        assertEquals(3, stats.byPlayer().get("b"));
        assertEquals(2, stats.byAction().get(PlayAction.PLAY_LEADER));
        assertEquals(2, stats.byAction().get(PlayAction.PLAY_CARD));
        assertEquals(1, stats.byAction().get(PlayAction.APPLY_SET_POWER));
        assertEquals(5, stats.byPhase().get("MAIN_PHASE"));
    }

    @Test
    void testValidateReportsGapsDuplicatesAndMissingFields() {
        PlaySequence sequence = new PlaySequence();
        sequence.setPlays(List.of(
                new PlayRecord(1, "a", "s-1", PlayAction.PLAY_LEADER, ZoneName.LEADER, null, 0, 1, Phase.MAIN_PHASE),
                new PlayRecord(3, "a", "c-1", PlayAction.PLAY_CARD, ZoneName.TOP, null, 0, 1, Phase.MAIN_PHASE),
                new PlayRecord(3, "a", "c-2", PlayAction.PLAY_CARD, ZoneName.LEFT, null, 0, 1, Phase.MAIN_PHASE),
                new PlayRecord(4, null, "c-3", PlayAction.PLAY_CARD, ZoneName.RIGHT, null, 0, 1, Phase.MAIN_PHASE)));

        SequenceValidation validation = sequence.validate();
        assertFalse(validation.isValid());
        assertEquals(List.of(2), validation.gaps());
        assertEquals(List.of(3), validation.duplicates());
        assertEquals(List.of(4), validation.missingFields());
        assertThrows(SequenceCorruptedException.class, sequence::requireConsistent);
    }

    @Test
    void testClearKeepingLeadersRenumbers() {
        PlaySequence sequence = sample();
        sequence.clear(true);
        assertEquals(2, sequence.size());
        assertEquals(List.of(1, 2), sequence.all().stream().map(PlayRecord::sequenceId).toList());

        PlayRecord next = sequence.append("a", "c-5", PlayAction.PLAY_CARD, ZoneName.LEFT, PlayData.placement(false),
                400, 2, Phase.MAIN_PHASE);
        assertEquals(3, next.sequenceId());

        sequence.clear(false);
        assertTrue(sequence.isEmpty());
        assertEquals(0, sequence.getGlobalSequence());
    }

    @Test
    void testSurvivesJsonRoundTrip() throws Exception {
        PlaySequence sequence = sample();
        String json = GameStateCodec.mapper().writeValueAsString(sequence);
        PlaySequence restored = GameStateCodec.mapper().readValue(json, PlaySequence.class);
        assertEquals(sequence.all(), restored.all());
        assertEquals(5, restored.getGlobalSequence());
        assertFalse(json.contains("\"empty\""), "Derived flags should not be serialized");
    }
}
