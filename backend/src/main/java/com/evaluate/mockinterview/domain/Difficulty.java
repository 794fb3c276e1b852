package com.evaluate.mockinterview.domain;

import java.util.Locale;

/**
 * Question difficulty, declared from easiest to hardest.
 */
public enum Difficulty {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED,
    EXPERT;

    public static Difficulty fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Difficulty label is empty");
        }
        return Difficulty.valueOf(label.trim().toUpperCase(Locale.ROOT));
    }

    /** Lenient variant used for LLM output; unknown labels map to {@code fallback}. */
    public static Difficulty fromLabel(String label, Difficulty fallback) {
        try {
            return fromLabel(label);
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }

    public boolean isEasy() {
        return this == BEGINNER || this == INTERMEDIATE;
    }

    public boolean isHard() {
        return this == ADVANCED || this == EXPERT;
    }

    public Difficulty harder() {
        Difficulty[] all = values();
        return all[Math.min(ordinal() + 1, all.length - 1)];
    }

    public Difficulty easier() {
        return values()[Math.max(ordinal() - 1, 0)];
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
