package com.evaluate.mockinterview.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Lightweight view of where a session stands, for polling clients.
 */
@Value
@Builder
public class SessionProgress {
    String sessionId;
    SessionStatus status;
    int questionsAsked;
    int answersRecorded;
    int currentIndex;
    int maxQuestions;
    double averageTechnical;
    boolean awaitingAnswer;
    StopReason stopReason;
}
