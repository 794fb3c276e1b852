package com.evaluate.mockinterview.service;

import com.evaluate.mockinterview.domain.Answer;
import com.evaluate.mockinterview.domain.Question;
import com.evaluate.mockinterview.domain.SessionStatus;
import com.evaluate.mockinterview.domain.TerminationDecision;
import lombok.Value;

/**
 * What happened after an answer was scored and recorded.
 */
@Value
public class AnswerOutcome {
    Question question;
    Answer answer;
    TerminationDecision decision;
    SessionStatus status;
    int answeredCount;

    public boolean isFinished() {
        return decision.isStop() || status.isTerminal();
    }
}
