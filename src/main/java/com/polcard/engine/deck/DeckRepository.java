package com.polcard.engine.deck;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the deck file, keyed by player id. Players without an entry
 * play the "default" collection.
 */
public class DeckRepository {
    private static final Logger log = LoggerFactory.getLogger(DeckRepository.class);

    public static final String DEFAULT_RESOURCE = "decks/decks.json";
    public static final String DEFAULT_PLAYER = "default";

    private final Map<String, PlayerDecks> playerDecks;

    private DeckRepository(Map<String, PlayerDecks> playerDecks) {
        this.playerDecks = Collections.unmodifiableMap(playerDecks);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static final class DeckFile {
        @JsonProperty("playerDecks")
        Map<String, PlayerDecks> playerDecks = new LinkedHashMap<>();
    }

    public static DeckRepository fromResources() throws DeckException {
        try (InputStream is = DeckRepository.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                throw new DeckException("Resource not found: " + DEFAULT_RESOURCE);
            }
            return fromJson(new String(is.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new DeckException("Failed to read deck file: " + e.getMessage(), e);
        }
    }

    public static DeckRepository fromFile(Path path) throws DeckException {
        try {
            return fromJson(Files.readString(path));
        } catch (IOException e) {
            throw new DeckException("Failed to read deck file: " + e.getMessage(), e);
        }
    }

    public static DeckRepository fromJson(String json) throws DeckException {
        try {
            DeckFile file = new ObjectMapper().readValue(json, DeckFile.class);
            log.info("Loaded decks for {} players", file.playerDecks.size());
            return new DeckRepository(new LinkedHashMap<>(file.playerDecks));
        } catch (IOException e) {
            throw new DeckException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    public List<String> playerIds() {
        return new ArrayList<>(playerDecks.keySet());
    }

    public Optional<PlayerDecks> playerDecks(String playerId) {
        return Optional.ofNullable(playerDecks.get(playerId));
    }

    /**
     * A copy of the player's active deck, falling back to the default collection.
     *
     * @throws DeckException if neither the player nor the default has an active deck
     */
    public Deck activeDeck(String playerId) throws DeckException {
        PlayerDecks decks = playerDecks.get(playerId);
        if (decks == null) {
            log.info("No decks for {}, using {}", playerId, DEFAULT_PLAYER);
            decks = playerDecks.get(DEFAULT_PLAYER);
        }
        if (decks == null) {
            throw new DeckException("Player Deck not found: " + playerId);
        }
        return decks.activeDeck()
                .map(Deck::copy)
                .orElseThrow(() -> new DeckException("No active deck found for " + playerId));
    }

    /**
     * Validate every deck in the file.
     *
     * @return errors keyed "playerId/deckId"; decks without errors are left out
     */
    public Map<String, List<String>> validateAll() {
        Map<String, List<String>> problems = new LinkedHashMap<>();
        playerDecks.forEach((playerId, decks) -> decks.getDecks().forEach((deckId, deck) -> {
            List<String> errors = deck.validate();
            if (!errors.isEmpty()) {
                problems.put(playerId + "/" + deckId, errors);
            }
        }));
        return problems;
    }
}
