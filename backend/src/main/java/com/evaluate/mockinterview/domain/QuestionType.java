package com.evaluate.mockinterview.domain;

import java.util.Locale;

public enum QuestionType {
    TECHNICAL,
    BEHAVIORAL,
    SITUATIONAL,
    PROBLEM_SOLVING,
    CULTURAL_FIT;

    /**
     * Parses labels such as "technical", "problem-solving" or "Cultural Fit".
     */
    public static QuestionType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Question type label is empty");
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return QuestionType.valueOf(normalized);
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
