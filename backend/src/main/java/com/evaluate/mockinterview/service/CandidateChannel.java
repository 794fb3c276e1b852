package com.evaluate.mockinterview.service;

import com.evaluate.mockinterview.domain.Question;

import java.util.Optional;

/**
 * The candidate's side of a conducted interview: questions go out, recorded answers come back.
 */
public interface CandidateChannel {

    void deliver(Question question, Optional<byte[]> speech);

    /**
     * Blocks until the candidate has answered.
     *
     * @return the recorded answer, or {@code null} if the candidate left
     */
    byte[] awaitResponse(Question question);
}
