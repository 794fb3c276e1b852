package com.evaluate.mockinterview.domain;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Everything that can happen to a session, with the states it is allowed from and the state it leads to.
 * Events without a target leave the status unchanged.
 */
public enum SessionEvent {
    START(SessionStatus.IN_PROGRESS, EnumSet.of(SessionStatus.CREATED)),
    PAUSE(SessionStatus.PAUSED, EnumSet.of(SessionStatus.IN_PROGRESS)),
    RESUME(SessionStatus.IN_PROGRESS, EnumSet.of(SessionStatus.PAUSED)),
    ASK_QUESTION(null, EnumSet.of(SessionStatus.IN_PROGRESS)),
    RECORD_ANSWER(null, EnumSet.of(SessionStatus.IN_PROGRESS)),
    COMPLETE(SessionStatus.COMPLETED, EnumSet.of(SessionStatus.IN_PROGRESS)),
    CANCEL(SessionStatus.CANCELLED,
            EnumSet.of(SessionStatus.CREATED, SessionStatus.IN_PROGRESS, SessionStatus.PAUSED));

    private final SessionStatus target;
    private final Set<SessionStatus> allowedFrom;

    SessionEvent(SessionStatus target, Set<SessionStatus> allowedFrom) {
        this.target = target;
        this.allowedFrom = allowedFrom;
    }

    public boolean isAllowedFrom(SessionStatus status) {
        return allowedFrom.contains(status);
    }

    public Optional<SessionStatus> target() {
        return Optional.ofNullable(target);
    }
}
