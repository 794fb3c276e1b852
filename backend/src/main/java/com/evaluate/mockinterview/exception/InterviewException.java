package com.evaluate.mockinterview.exception;

/**
 * Base type for failures raised by the interview engine.
 */
public abstract class InterviewException extends RuntimeException {

    protected InterviewException(String message) {
        super(message);
    }

    protected InterviewException(String message, Throwable cause) {
        super(message, cause);
    }
}
