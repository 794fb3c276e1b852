package com.evaluate.mockinterview.exception;

public class ValidationException extends InterviewException {

    public ValidationException(String message) {
        super(message);
    }
}
