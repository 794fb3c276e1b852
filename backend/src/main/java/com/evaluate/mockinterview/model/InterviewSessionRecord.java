package com.evaluate.mockinterview.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Stored form of a session: a few queryable columns plus the whole session as a JSON document.
 */
@Entity
@Table(name = "interview_sessions", indexes = @Index(name = "idx_sessions_candidate", columnList = "candidate_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InterviewSessionRecord {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "candidate_id", nullable = false)
    private String candidateId;

    @Column(nullable = false, length = 20)
    private String status;

    @Column(name = "schema_version", nullable = false)
    private int schemaVersion;

    @Column(nullable = false)
    private long version;

    @Lob
    @Column(nullable = false)
    private String document;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        updatedAt = Instant.now();
    }
}
