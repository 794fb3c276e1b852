package com.evaluate.mockinterview.domain;

public enum StopReason {
    NONE("Interview continues"),
    MAX_QUESTIONS("Maximum number of questions reached"),
    PLATEAU("Performance plateau detected"),
    POOR_PERFORMANCE("Consistently low technical scores"),
    MANUAL("Ended on request");

    private final String description;

    StopReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
