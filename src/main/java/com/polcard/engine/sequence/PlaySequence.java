package com.polcard.engine.sequence;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.polcard.engine.game.Phase;
import com.polcard.engine.game.ZoneName;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Append-only, ordered log of every leader summon, card play and applied selection
 * of a game. Sequence ids start at 1 and increase by 1 with no gaps.
 */
public class PlaySequence {
    @JsonProperty("globalSequence")
    private int globalSequence;

    @JsonProperty("plays")
    private List<PlayRecord> plays = new ArrayList<>();

    public int getGlobalSequence() {
        return globalSequence;
    }

    public void setGlobalSequence(int globalSequence) {
        this.globalSequence = globalSequence;
    }

    public List<PlayRecord> getPlays() {
        return List.copyOf(plays);
    }

    public void setPlays(List<PlayRecord> plays) {
        this.plays = plays != null ? new ArrayList<>(plays) : new ArrayList<>();
    }

    /**
     * Append a record, assigning the next sequence id.
     */
    public PlayRecord append(String playerId, String cardId, PlayAction action, ZoneName zone,
                             PlayData data, long timestamp, double turnNumber, Phase phase) {
        globalSequence++;
        PlayRecord record = new PlayRecord(globalSequence, playerId, cardId, action, zone, data,
                timestamp, turnNumber, phase);
        plays.add(record);
        return record;
    }

    /**
     * All records sorted by sequence id.
     */
    public List<PlayRecord> all() {
        List<PlayRecord> sorted = new ArrayList<>(plays);
        sorted.sort(Comparator.comparingInt(PlayRecord::sequenceId));
        return sorted;
    }

    public List<PlayRecord> byPlayer(String playerId) {
        return filtered(r -> playerId.equals(r.playerId()));
    }

    public List<PlayRecord> byPhase(Phase phase) {
        return filtered(r -> r.phaseWhenPlayed() == phase);
    }

    public List<PlayRecord> byTurn(double turn) {
        return filtered(r -> r.turnNumber() == turn);
    }

    public Optional<PlayRecord> lastPlayByPlayer(String playerId) {
        List<PlayRecord> own = byPlayer(playerId);
        return own.isEmpty() ? Optional.empty() : Optional.of(own.get(own.size() - 1));
    }

    public boolean hasLeaderPlay(String playerId, String leaderId) {
        return plays.stream().anyMatch(r -> r.action() == PlayAction.PLAY_LEADER
                && playerId.equals(r.playerId()) && leaderId.equals(r.cardId()));
    }

    public int size() {
        return plays.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return plays.isEmpty();
    }

    private List<PlayRecord> filtered(Predicate<PlayRecord> predicate) {
        return all().stream().filter(predicate).toList();
    }

    /**
     * Check that ids run 1..n in order, without gaps or duplicates, and that every
     * record names a player, card and action.
     */
    public SequenceValidation validate() {
        List<Integer> gaps = new ArrayList<>();
        List<Integer> duplicates = new ArrayList<>();
        List<Integer> missing = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();

        int expected = 1;
        for (PlayRecord record : all()) {
            int id = record.sequenceId();
            if (!seen.add(id)) {
                duplicates.add(id);
                continue;
            }
            while (expected < id) {
                gaps.add(expected++);
            }
            expected = id + 1;
            if (record.hasMissingFields()) {
                missing.add(id);
            }
        }
        return new SequenceValidation(gaps, duplicates, missing);
    }

    /**
     * @throws SequenceCorruptedException if the sequence has gaps or duplicate ids
     */
    public void requireConsistent() {
        SequenceValidation validation = validate();
        if (!validation.gaps().isEmpty() || !validation.duplicates().isEmpty()) {
            throw new SequenceCorruptedException(validation);
        }
    }

    /**
     * Drop records on a round transition. With {@code keepLeaders} the leader plays
     * survive; the survivors are renumbered from 1 so ids stay gap-free.
     */
    public void clear(boolean keepLeaders) {
        List<PlayRecord> kept = keepLeaders
                ? all().stream().filter(r -> r.action() == PlayAction.PLAY_LEADER).toList()
                : List.of();
        plays = new ArrayList<>();
        for (int i = 0; i < kept.size(); i++) {
            plays.add(kept.get(i).withSequenceId(i + 1));
        }
        globalSequence = plays.size();
    }

    public SequenceStatistics statistics() {
        Map<String, Integer> byPlayer = new LinkedHashMap<>();
        Map<PlayAction, Integer> byAction = new LinkedHashMap<>();
        Map<String, Integer> byPhase = new LinkedHashMap<>();
        for (PlayRecord record : all()) {
            byPlayer.merge(record.playerId(), 1, Integer::sum);
            byAction.merge(record.action(), 1, Integer::sum);
            String phase = record.phaseWhenPlayed() == null ? "UNKNOWN" : record.phaseWhenPlayed().name();
            byPhase.merge(phase, 1, Integer::sum);
        }
        return new SequenceStatistics(plays.size(), byPlayer, byAction, byPhase);
    }
}
