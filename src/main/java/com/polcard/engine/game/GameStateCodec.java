package com.polcard.engine.game;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.UncheckedIOException;

/**
 * JSON form of {@link GameState}, used for persistence and for deep copies.
 */
public final class GameStateCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final ObjectMapper PRETTY = MAPPER.copy()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private GameStateCodec() {
        // Utility class - prevent instantiation
    }

    public static String toJson(GameState state) {
        try {
            return MAPPER.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize game " + state.getGameId(), e);
        }
    }

    public static String toPrettyJson(Object value) {
        try {
            return PRETTY.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public static GameState fromJson(String json) {
        try {
            return MAPPER.readValue(json, GameState.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to parse game state", e);
        }
    }

    /**
     * Deep copy through the persisted form.
     */
    public static GameState copy(GameState state) {
        return fromJson(toJson(state));
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
