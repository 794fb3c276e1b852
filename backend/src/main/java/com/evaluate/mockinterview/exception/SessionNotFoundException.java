package com.evaluate.mockinterview.exception;

import lombok.Getter;

@Getter
public class SessionNotFoundException extends InterviewException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }
}
