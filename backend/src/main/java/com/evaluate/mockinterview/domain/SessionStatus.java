package com.evaluate.mockinterview.domain;

public enum SessionStatus {
    CREATED,
    IN_PROGRESS,
    PAUSED,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
