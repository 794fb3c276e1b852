package com.evaluate.mockinterview.exception;

import com.evaluate.mockinterview.domain.SessionEvent;
import com.evaluate.mockinterview.domain.SessionStatus;
import lombok.Getter;

@Getter
public class InvalidStateTransitionException extends InterviewException {

    private final String sessionId;
    private final SessionStatus currentStatus;
    private final SessionEvent event;

    public InvalidStateTransitionException(String sessionId, SessionStatus currentStatus, SessionEvent event) {
        super("Cannot " + event + " session " + sessionId + ": current state " + currentStatus
                + event.target().map(target -> ", attempted " + target).orElse(""));
        this.sessionId = sessionId;
        this.currentStatus = currentStatus;
        this.event = event;
    }
}
