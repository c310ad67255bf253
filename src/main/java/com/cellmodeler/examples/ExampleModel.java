package com.cellmodeler.examples;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Ready-made automata shipped as configuration text under {@code examples/} on the classpath.
 */
public enum ExampleModel {
    GAME_OF_LIFE("game-of-life", "Game of Life"),
    WIREWORLD("wireworld", "Wireworld"),
    GREENBERG("greenberg", "Greenberg"),
    TURING_PATTERNS("turing-patterns", "Turing Patterns"),
    FOREST_FIRE("forest-fire", "Forest Fire");

    private final String id;
    private final String displayName;

    ExampleModel(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public String loadText() {
        String resource = "examples/" + id + ".ca";
        try (InputStream in = ExampleModel.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing example resource " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read example resource " + resource, ex);
        }
    }

    public static ExampleModel fromId(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Example id must not be empty");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ExampleModel model : values()) {
            if (model.id.equals(normalized)) {
                return model;
            }
        }
        throw new IllegalArgumentException("Unknown example: " + raw);
    }
}
