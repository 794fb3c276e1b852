package com.evaluate.mockinterview.domain;

/**
 * Where a question came from. Kept on every question so degraded sourcing can be audited.
 */
public enum QuestionSource {
    /** Seeded into the session's pool at creation. */
    POOL,
    /** Synthesized on demand from the interview context. */
    GENERATED,
    /** Template substituted because the generator was unavailable. */
    FALLBACK
}
