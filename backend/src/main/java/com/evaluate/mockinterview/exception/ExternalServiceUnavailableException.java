package com.evaluate.mockinterview.exception;

import lombok.Getter;

/**
 * An external collaborator (LLM, speech, store, microphone) failed or timed out.
 */
@Getter
public class ExternalServiceUnavailableException extends InterviewException {

    private final String service;

    public ExternalServiceUnavailableException(String service, String message) {
        super(service + ": " + message);
        this.service = service;
    }

    public ExternalServiceUnavailableException(String service, String message, Throwable cause) {
        super(service + ": " + message, cause);
        this.service = service;
    }
}
