package com.polcard.engine.effect;

import com.polcard.engine.card.Card;
import com.polcard.engine.card.Catalog;
import com.polcard.engine.card.EffectRule;
import com.polcard.engine.card.EffectType;
import com.polcard.engine.card.TriggerEvent;
import com.polcard.engine.card.ZoneCompatibility;
import com.polcard.engine.game.ActiveEffect;
import com.polcard.engine.game.DisabledCard;
import com.polcard.engine.game.FieldEffects;
import com.polcard.engine.game.GameState;
import com.polcard.engine.game.PlacedCard;
import com.polcard.engine.game.PlayerZones;
import com.polcard.engine.game.SpecialStates;
import com.polcard.engine.game.ZoneName;
import com.polcard.engine.sequence.PlayData;
import com.polcard.engine.sequence.PlayRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Derives every player's {@link FieldEffects} by replaying the play sequence.
 *
 * <p>{@link #simulate(GameState)} is a pure function of the catalog, the zones and
 * the play sequence: it reads the state and returns fresh field effects. Only
 * {@link #apply(GameState)} writes them back.
 *
 * <p>Replay walks the sequence in id order and stages an effect for every leader
 * rule and every persistent rule of a face-up card whose conditions hold, plus one
 * effect per applied selection record. Staged effects are applied by priority,
 * then by the source leader's initialPoint, then with the first player first.
 */
public class EffectSimulator {
    private static final Logger log = LoggerFactory.getLogger(EffectSimulator.class);

    private final Catalog catalog;
    private final EffectRegistry registry;

    public EffectSimulator(Catalog catalog, EffectRegistry registry) {
        this.catalog = catalog;
        this.registry = registry;
    }

    public EffectRegistry getRegistry() {
        return registry;
    }

    /**
     * Replay the sequence and assign the resulting field effects to every player.
     */
    public void apply(GameState state) {
        Map<String, FieldEffects> result = simulate(state);
        result.forEach((playerId, effects) -> state.player(playerId).setFieldEffects(effects));
    }

    /**
     * Replay the sequence without touching the state.
     *
     * @return field effects per player id, in join order
     * @throws com.polcard.engine.sequence.SequenceCorruptedException if the sequence has gaps or duplicates
     */
    public Map<String, FieldEffects> simulate(GameState state) {
        state.getPlaySequence().requireConsistent();

        Map<String, Accumulator> acc = new LinkedHashMap<>();
        for (String playerId : state.playerIds()) {
            acc.put(playerId, new Accumulator());
        }

        List<StagedEffect> staged = stage(state, acc);
        staged = dropSilencedSummons(state, staged);
        staged.sort(applicationOrder(state));

        for (StagedEffect effect : staged) {
            applyEffect(state, acc, effect);
        }

        Map<String, FieldEffects> result = new LinkedHashMap<>();
        for (Map.Entry<String, Accumulator> entry : acc.entrySet()) {
            result.put(entry.getKey(), entry.getValue().toFieldEffects(state.zonesOf(entry.getKey())));
        }
        log.debug("Simulated {} staged effects over {} plays", staged.size(), state.getPlaySequence().size());
        return result;
    }

    // ---- Staging ----

    private List<StagedEffect> stage(GameState state, Map<String, Accumulator> acc) {
        List<StagedEffect> staged = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (PlayRecord play : state.getPlaySequence().all()) {
            if (!acc.containsKey(play.playerId())) {
                continue;
            }
            switch (play.action()) {
                case PLAY_LEADER -> stageLeader(state, acc, play, staged, seen);
                case PLAY_CARD -> stageCard(state, play, staged, seen);
                default -> stageAppliedSelection(state, play, staged, seen);
            }
        }
        return staged;
    }

    private void stageLeader(GameState state, Map<String, Accumulator> acc, PlayRecord play,
                             List<StagedEffect> staged, Set<String> seen) {
        String leaderId = currentLeaderOf(state, play.playerId());
        if (!play.cardId().equals(leaderId)) {
            return;
        }
        Optional<Card.Leader> leader = catalog.findLeader(leaderId);
        if (leader.isEmpty()) {
            return;
        }
        ZoneCompatibility compatibility = leader.get().getZoneCompatibility();
        Accumulator player = acc.get(play.playerId());
        for (ZoneName zone : ZoneName.CHARACTER_ZONES) {
            List<String> allowed = compatibility == null ? List.of(ZoneCompatibility.ALL) : compatibility.allowedFor(zone);
            player.restrictions.put(zone.restrictionKey(), new ArrayList<>(allowed));
        }
        for (EffectRule rule : leader.get().getEffects().getRules()) {
            if (rule.isPersistent() && registry.conditionsMet(rule, state, play.playerId())) {
                addStaged(staged, seen, fromRule(play, rule, false));
            }
        }
    }

    private void stageCard(GameState state, PlayRecord play, List<StagedEffect> staged, Set<String> seen) {
        PlayerZones zones = state.zonesOf(play.playerId());
        Optional<ZoneName> zone = zones.zoneOf(play.cardId());
        if (zone.isEmpty() || !isFaceUp(zones, zone.get(), play.cardId())) {
            return;
        }
        boolean character = zone.get().isCharacterZone();
        for (EffectRule rule : catalog.effectsOf(play.cardId())) {
            if (rule.isPersistent() && registry.conditionsMet(rule, state, play.playerId())) {
                addStaged(staged, seen, fromRule(play, rule, character));
            }
        }
    }

    private void stageAppliedSelection(GameState state, PlayRecord play, List<StagedEffect> staged, Set<String> seen) {
        PlayData data = play.data();
        if (data.selectedCardIds() == null || data.selectedCardIds().isEmpty() || !state.hasPlayer(data.targetPlayerId())) {
            log.warn("Applied selection #{} has no targets, skipping", play.sequenceId());
            return;
        }
        EffectType type = play.action().appliedEffectType();
        String effectId = play.cardId() + "_" + play.action().name() + "_" + play.sequenceId();
        addStaged(staged, seen, new StagedEffect(effectId, play.cardId(), play.playerId(), type,
                data.value() == null ? 0 : data.value(), registry.priority(type), false,
                play.sequenceId(), null, data.targetPlayerId(), data.selectedCardIds(), false));
    }

    private StagedEffect fromRule(PlayRecord play, EffectRule rule, boolean fromCharacter) {
        EffectType type = rule.getEffectType();
        return new StagedEffect(play.cardId() + "_" + rule.getId(), play.cardId(), play.playerId(), type,
                rule.getEffect().intValue(), registry.priority(type), rule.isUnremovable(),
                play.sequenceId(), rule, null, List.of(),
                fromCharacter && rule.getEvent() == TriggerEvent.ON_SUMMON);
    }

    private static void addStaged(List<StagedEffect> staged, Set<String> seen, StagedEffect effect) {
        if (seen.add(effect.sourcePlayerId() + "|" + effect.effectId())) {
            staged.add(effect);
        }
    }

    /**
     * onSummon rules of characters are not replayed for a player under an opponent's silence.
     */
    private List<StagedEffect> dropSilencedSummons(GameState state, List<StagedEffect> staged) {
        Set<String> silenced = new HashSet<>();
        for (StagedEffect effect : staged) {
            if (effect.type() == EffectType.SILENCE_ON_SUMMON && effect.rule() != null) {
                for (String target : registry.targetPlayers(effect.rule().getTarget().getOwner(), state, effect.sourcePlayerId())) {
                    if (!target.equals(effect.sourcePlayerId())) {
                        silenced.add(target);
                    }
                }
            }
        }
        if (silenced.isEmpty()) {
            return staged;
        }
        List<StagedEffect> kept = new ArrayList<>();
        for (StagedEffect effect : staged) {
            if (!(effect.summonRule() && silenced.contains(effect.sourcePlayerId()))) {
                kept.add(effect);
            }
        }
        return kept;
    }

    private Comparator<StagedEffect> applicationOrder(GameState state) {
        Map<String, Integer> initialPoints = new LinkedHashMap<>();
        for (String playerId : state.playerIds()) {
            initialPoints.put(playerId, catalog.findLeader(currentLeaderOf(state, playerId))
                    .map(Card.Leader::getInitialPoint).orElse(0));
        }
        return Comparator.comparingInt(StagedEffect::priority).reversed()
                .thenComparing(Comparator.comparingInt(
                        (StagedEffect e) -> initialPoints.getOrDefault(e.sourcePlayerId(), 0)).reversed())
                .thenComparing(e -> state.isFirstPlayer(e.sourcePlayerId()) ? 0 : 1)
                .thenComparing(StagedEffect::sourcePlayerId)
                .thenComparing(StagedEffect::sourceCardId)
                .thenComparingInt(StagedEffect::sequenceId);
    }

    // ---- Application ----

    private void applyEffect(GameState state, Map<String, Accumulator> acc, StagedEffect effect) {
        Accumulator source = acc.get(effect.sourcePlayerId());
        String disabledBy = source.disablerOf(effect.sourceCardId());
        if (disabledBy != null && !effect.unremovable() && !registry.isImmune(effect.sourceCardId())) {
            source.activeEffects.add(effect.toActiveEffect(false, List.of(), List.of(), disabledBy));
            return;
        }

        List<String> targetPlayers = effect.explicitTargetPlayer() != null
                ? List.of(effect.explicitTargetPlayer())
                : registry.targetPlayers(effect.rule().getTarget().getOwner(), state, effect.sourcePlayerId());
        List<TargetRef> targetCards = new ArrayList<>();

        switch (effect.type()) {
            case NEUTRALIZE_EFFECT -> {
                for (TargetRef target : cardTargets(state, effect, targetPlayers)) {
                    if (registry.isImmune(target.cardId())) {
                        continue;
                    }
                    Accumulator owner = acc.get(target.playerId());
                    if (owner != null && owner.disablerOf(target.cardId()) == null) {
                        owner.disabled.add(new DisabledCard(target.cardId(), target.zone(), effect.sourceCardId()));
                    }
                    targetCards.add(target);
                }
            }
            case SET_POWER -> {
                for (TargetRef target : cardTargets(state, effect, targetPlayers)) {
                    acc.get(target.playerId()).pins.put(target.cardId(), effect.value());
                    targetCards.add(target);
                }
            }
            case POWER_BOOST, POWER_NERF, MODIFY_POWER -> {
                int delta = effect.type() == EffectType.POWER_NERF ? -effect.value() : effect.value();
                for (TargetRef target : cardTargets(state, effect, targetPlayers)) {
                    Accumulator owner = acc.get(target.playerId());
                    Map<String, Integer> bucket = effect.unremovable() ? owner.fixedModifiers : owner.modifiers;
                    bucket.merge(target.cardId(), delta, Integer::sum);
                    targetCards.add(target);
                }
            }
            case ZONE_RESTRICTION -> {
                List<String> allowed = effect.rule().getEffect().getAllowedTypes();
                for (String playerId : targetPlayers) {
                    for (ZoneName zone : effect.rule().getTarget().effectiveZones()) {
                        if (zone != ZoneName.LEADER) {
                            acc.get(playerId).narrow(zone, allowed);
                        }
                    }
                }
            }
            case SILENCE_ON_SUMMON -> targetPlayers.forEach(p -> acc.get(p).summonSilenced = true);
            case ZONE_PLACEMENT_FREEDOM -> targetPlayers.forEach(p -> acc.get(p).zonePlacementFreedom = true);
            case DISABLE_COMBO_BONUS -> targetPlayers.forEach(p -> acc.get(p).disableComboBonus = true);
            case FORCE_PLAY_SP -> targetPlayers.forEach(p -> acc.get(p).forcedSpPlay = true);
            case PREVENT_PLAY -> {
                List<ZoneName> zones = effect.rule().getTarget().effectiveZones();
                targetPlayers.forEach(p -> acc.get(p).preventedZones.addAll(zones));
            }
            case TOTAL_POWER_NERF -> targetPlayers.forEach(p -> acc.get(p).victoryPointModifiers -= effect.value());
            default -> {
                log.debug("Effect {} of type {} has no persistent state", effect.effectId(), effect.type());
                return;
            }
        }

        source.activeEffects.add(effect.toActiveEffect(true, targetPlayers,
                targetCards.stream().map(TargetRef::cardId).toList(), null));
    }

    private List<TargetRef> cardTargets(GameState state, StagedEffect effect, List<String> targetPlayers) {
        if (effect.rule() != null) {
            return registry.targets(effect.rule(), state, targetPlayers);
        }
        List<TargetRef> targets = new ArrayList<>();
        PlayerZones zones = state.zonesOf(effect.explicitTargetPlayer());
        for (String cardId : effect.explicitTargetCards()) {
            zones.zoneOf(cardId)
                    .filter(zone -> isFaceUp(zones, zone, cardId))
                    .ifPresent(zone -> targets.add(new TargetRef(effect.explicitTargetPlayer(), cardId, zone)));
        }
        return targets;
    }

    private static boolean isFaceUp(PlayerZones zones, ZoneName zone, String cardId) {
        return zones.cardsIn(zone).stream().anyMatch(c -> c.cardId().equals(cardId) && !c.faceDown());
    }

    private static String currentLeaderOf(GameState state, String playerId) {
        String leader = state.zonesOf(playerId).getLeader();
        return leader != null ? leader : state.player(playerId).getDeck().currentLeaderId();
    }

    // ---- Internal state ----

    private record StagedEffect(
            String effectId,
            String sourceCardId,
            String sourcePlayerId,
            EffectType type,
            int value,
            int priority,
            boolean unremovable,
            int sequenceId,
            EffectRule rule,
            String explicitTargetPlayer,
            List<String> explicitTargetCards,
            boolean summonRule
    ) {
        ActiveEffect toActiveEffect(boolean enabled, List<String> targetPlayers, List<String> targetCards,
                                    String disabledBy) {
            return new ActiveEffect(effectId, sourceCardId, sourcePlayerId, type, value, priority,
                    unremovable, enabled, targetPlayers, targetCards, disabledBy);
        }
    }

    /**
     * Mutable per-player working set, frozen into a {@link FieldEffects} at the end.
     */
    private final class Accumulator {
        final Map<String, List<String>> restrictions = new LinkedHashMap<>();
        final List<ActiveEffect> activeEffects = new ArrayList<>();
        final List<DisabledCard> disabled = new ArrayList<>();
        final Map<String, Integer> pins = new LinkedHashMap<>();
        final Map<String, Integer> modifiers = new LinkedHashMap<>();
        final Map<String, Integer> fixedModifiers = new LinkedHashMap<>();
        final Set<ZoneName> preventedZones = new LinkedHashSet<>();
        int victoryPointModifiers;
        boolean zonePlacementFreedom;
        boolean forcedSpPlay;
        boolean disableComboBonus;
        boolean summonSilenced;

        Accumulator() {
            FieldEffects.defaults().zoneRestrictions()
                    .forEach((zone, allowed) -> restrictions.put(zone, new ArrayList<>(allowed)));
        }

        String disablerOf(String cardId) {
            for (DisabledCard card : disabled) {
                if (card.cardId().equals(cardId)) {
                    return card.disabledBy();
                }
            }
            return null;
        }

        void narrow(ZoneName zone, List<String> allowed) {
            if (allowed.contains(ZoneCompatibility.ALL)) {
                return;
            }
            List<String> current = restrictions.get(zone.restrictionKey());
            if (current == null || current.contains(ZoneCompatibility.ALL)) {
                restrictions.put(zone.restrictionKey(), new ArrayList<>(allowed));
            } else {
                current.retainAll(allowed);
            }
        }

        FieldEffects toFieldEffects(PlayerZones zones) {
            Map<String, Integer> powers = new LinkedHashMap<>();
            for (ZoneName zone : ZoneName.CHARACTER_ZONES) {
                for (PlacedCard placed : zones.cardsIn(zone)) {
                    if (placed.faceDown()) {
                        continue;
                    }
                    String cardId = placed.cardId();
                    Integer pin = pins.get(cardId);
                    int power = pin != null
                            ? pin
                            : catalog.findCard(cardId).map(Card::getPower).orElse(0) + modifiers.getOrDefault(cardId, 0);
                    power += fixedModifiers.getOrDefault(cardId, 0);
                    powers.put(cardId, Math.max(0, power));
                }
            }
            SpecialStates states = new SpecialStates(zonePlacementFreedom, forcedSpPlay, disableComboBonus,
                    summonSilenced, new ArrayList<>(preventedZones));
            return new FieldEffects(restrictions, activeEffects, powers, disabled, victoryPointModifiers, states);
        }
    }
}
