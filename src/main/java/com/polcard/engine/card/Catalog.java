package com.polcard.engine.card;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polcard.engine.game.PlayerDeck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable card catalog loaded from three JSON tables: character cards (with the
 * combo table), utility cards (help and sp) and leader cards. Shared read-only by all games.
 */
public class Catalog {
    private static final Logger log = LoggerFactory.getLogger(Catalog.class);

    public static final String CHARACTER_TABLE = "characterCards.json";
    public static final String UTILITY_TABLE = "utilityCards.json";
    public static final String LEADER_TABLE = "leaderCards.json";
    public static final String DEFAULT_RESOURCE_DIR = "cards/";

    private final Map<String, Card> cards;
    private final Map<ComboType, ComboRule> combos;

    private Catalog(Map<String, Card> cards, Map<ComboType, ComboRule> combos) {
        this.cards = Collections.unmodifiableMap(cards);
        this.combos = Collections.unmodifiableMap(combos);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static final class CharacterTable {
        @JsonProperty("cards")
        Map<String, Card> cards = new LinkedHashMap<>();
        @JsonProperty("combos")
        Map<String, ComboRule> combos = new LinkedHashMap<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static final class UtilityTable {
        @JsonProperty("cards")
        Map<String, Card> cards = new LinkedHashMap<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static final class LeaderTable {
        @JsonProperty("leaders")
        Map<String, Card> leaders = new LinkedHashMap<>();
    }

    /**
     * Load the bundled catalog from the classpath.
     */
    public static Catalog fromResources() throws CatalogException {
        return fromResources(DEFAULT_RESOURCE_DIR);
    }

    /**
     * Load the three tables from a classpath directory.
     */
    public static Catalog fromResources(String resourceDir) throws CatalogException {
        return fromJson(
                readResource(resourceDir + CHARACTER_TABLE),
                readResource(resourceDir + UTILITY_TABLE),
                readResource(resourceDir + LEADER_TABLE));
    }

    /**
     * Load the three tables from a directory on disk.
     */
    public static Catalog fromDirectory(Path dir) throws CatalogException {
        try {
            return fromJson(
                    Files.readString(dir.resolve(CHARACTER_TABLE)),
                    Files.readString(dir.resolve(UTILITY_TABLE)),
                    Files.readString(dir.resolve(LEADER_TABLE)));
        } catch (IOException e) {
            throw new CatalogException("IO error: " + e.getMessage(), e);
        }
    }

    /**
     * Load the catalog from the JSON text of the three tables.
     */
    public static Catalog fromJson(String characterJson, String utilityJson, String leaderJson)
            throws CatalogException {
        ObjectMapper mapper = new ObjectMapper();
        try {
            CharacterTable characters = mapper.readValue(characterJson, CharacterTable.class);
            UtilityTable utilities = mapper.readValue(utilityJson, UtilityTable.class);
            LeaderTable leaders = mapper.readValue(leaderJson, LeaderTable.class);

            Map<String, Card> all = new LinkedHashMap<>();
            register(all, characters.cards);
            register(all, utilities.cards);
            register(all, leaders.leaders);

            Map<ComboType, ComboRule> combos = new EnumMap<>(ComboType.class);
            for (Map.Entry<String, ComboRule> entry : characters.combos.entrySet()) {
                combos.put(ComboType.fromString(entry.getKey()), entry.getValue());
            }
            log.info("Loaded {} cards and {} combos", all.size(), combos.size());
            return new Catalog(all, combos);
        } catch (IOException | IllegalArgumentException e) {
            throw new CatalogException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    private static void register(Map<String, Card> target, Map<String, Card> table) throws CatalogException {
        for (Map.Entry<String, Card> entry : table.entrySet()) {
            Card card = entry.getValue();
            if (card.getId() == null) {
                ((BaseCard) card).setId(entry.getKey());
            } else if (!card.getId().equals(entry.getKey())) {
                throw new CatalogException("Card key " + entry.getKey() + " does not match id " + card.getId());
            }
            if (target.put(card.getId(), card) != null) {
                throw new CatalogException("Duplicate card id: " + card.getId());
            }
        }
    }

    private static String readResource(String resourcePath) throws CatalogException {
        try (InputStream is = Catalog.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new CatalogException("Resource not found: " + resourcePath);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CatalogException("IO error: " + e.getMessage(), e);
        }
    }

    /**
     * Look up a card. A miss is logged and returned as empty.
     */
    public Optional<Card> findCard(String id) {
        Card card = id == null ? null : cards.get(id);
        if (card == null) {
            log.warn("Card not found in catalog: {}", id);
        }
        return Optional.ofNullable(card);
    }

    /**
     * Get a card by id.
     * @throws CatalogException if the card is not found
     */
    public Card getCard(String id) throws CatalogException {
        Card card = cards.get(id);
        if (card == null) {
            throw new CatalogException("Card not found: " + id);
        }
        return card;
    }

    public Optional<Card.Leader> findLeader(String id) {
        return findCard(id)
                .filter(Card.Leader.class::isInstance)
                .map(Card.Leader.class::cast);
    }

    /**
     * The leader currently active for a deck, from its leader list and index.
     */
    public Optional<Card.Leader> currentLeader(PlayerDeck deck) {
        String leaderId = deck.currentLeaderId();
        return leaderId == null ? Optional.empty() : findLeader(leaderId);
    }

    public List<EffectRule> effectsOf(String cardId) {
        Card card = cards.get(cardId);
        return card == null ? List.of() : card.getEffects().getRules();
    }

    public Map<ComboType, ComboRule> getCombos() {
        return combos;
    }

    public Optional<ComboRule> combo(ComboType type) {
        return Optional.ofNullable(combos.get(type));
    }

    public Collection<Card> allCards() {
        return cards.values();
    }

    public int cardCount() {
        return cards.size();
    }

    public boolean hasCard(String id) {
        return cards.containsKey(id);
    }
}
