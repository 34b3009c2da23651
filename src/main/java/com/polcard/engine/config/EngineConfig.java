package com.polcard.engine.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Engine tunables. Loaded from {@code engine-config.json} on the classpath;
 * any key that is missing keeps its default.
 */
public record EngineConfig(
        int victoryPointThreshold,
        int initialHandSize,
        int maxRedraws,
        long eventTtlMillis,
        long selectionTimeoutMillis,
        int defaultSearchSelectCount
) {
    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    public static final String DEFAULT_RESOURCE = "engine-config.json";

    public static EngineConfig defaults() {
        return new EngineConfig(50, 7, 1, 3000L, 60_000L, 1);
    }

    /**
     * Load the default resource, falling back to built-in defaults when it is absent.
     */
    public static EngineConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    public static EngineConfig load(String resourcePath) {
        try (InputStream is = EngineConfig.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                log.info("No {} on classpath, using defaults", resourcePath);
                return defaults();
            }
            return fromJson(new ObjectMapper().readTree(is));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read engine config " + resourcePath, e);
        }
    }

    static EngineConfig fromJson(JsonNode node) {
        EngineConfig d = defaults();
        return new EngineConfig(
                node.path("victoryPointThreshold").asInt(d.victoryPointThreshold()),
                node.path("initialHandSize").asInt(d.initialHandSize()),
                node.path("maxRedraws").asInt(d.maxRedraws()),
                node.path("eventTtlMillis").asLong(d.eventTtlMillis()),
                node.path("selectionTimeoutMillis").asLong(d.selectionTimeoutMillis()),
                node.path("defaultSearchSelectCount").asInt(d.defaultSearchSelectCount()));
    }
}
