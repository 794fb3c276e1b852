package com.evaluate.mockinterview.gateway;

import com.evaluate.mockinterview.domain.InterviewSession;

import java.util.List;
import java.util.Optional;

/**
 * System of record for sessions. In-memory state is a cache over this store.
 */
public interface SessionStore {

    void persist(InterviewSession session);

    Optional<InterviewSession> load(String sessionId);

    List<InterviewSession> findByCandidate(String candidateId);
}
