package com.evaluate.mockinterview.repository;

import com.evaluate.mockinterview.config.InterviewProperties;
import com.evaluate.mockinterview.domain.Difficulty;
import com.evaluate.mockinterview.domain.InterviewSession;
import com.evaluate.mockinterview.domain.QuestionSource;
import com.evaluate.mockinterview.domain.QuestionType;
import com.evaluate.mockinterview.domain.SessionStatus;
import com.evaluate.mockinterview.domain.StopReason;
import com.evaluate.mockinterview.engine.BanditSelector;
import com.evaluate.mockinterview.engine.PerformanceSummarizer;
import com.evaluate.mockinterview.exception.ExternalServiceUnavailableException;
import com.evaluate.mockinterview.gateway.QuestionGenerator;
import com.evaluate.mockinterview.model.InterviewSessionRecord;
import com.evaluate.mockinterview.support.Fixtures;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.json.AutoConfigureJson;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DataJpaTest
@AutoConfigureJson
@Import(JpaSessionStore.class)
class JpaSessionStoreTest {

    @Autowired
    private JpaSessionStore store;

    @Autowired
    private InterviewSessionRecordRepository repository;

    private static InterviewSession completedSession(String id, String candidateId, long version) {
        InterviewSession answered = Fixtures.answered(0.7, 0.9);
        BanditSelector selector = new BanditSelector(mock(QuestionGenerator.class), new InterviewProperties());
        InterviewSession withArms = answered.toBuilder()
                .id(id)
                .candidateId(candidateId)
                .poolEntry(Fixtures.question("p1", QuestionType.BEHAVIORAL, Difficulty.BEGINNER))
                .question(Fixtures.question("g3", QuestionType.SITUATIONAL, Difficulty.ADVANCED)
                        .toBuilder().source(QuestionSource.GENERATED).build())
                .arms(selector.seed(answered.getJob()))
                .build();
        return withArms.toBuilder()
                .status(SessionStatus.COMPLETED)
                .metrics(new PerformanceSummarizer().summarize(withArms))
                .stopReason(StopReason.PLATEAU)
                .completedAt(Fixtures.NOW.plus(Duration.ofMinutes(30)))
                .version(version)
                .build();
    }

    @Test
    void storesAndLoadsTheWholeSession() {
        InterviewSession session = completedSession("s-1", "candidate-1", 7);

        store.persist(session);

        assertEquals(session, store.load("s-1").orElseThrow());
        InterviewSessionRecord record = repository.findById("s-1").orElseThrow();
        assertEquals("COMPLETED", record.getStatus());
        assertEquals(SessionDocument.SCHEMA_VERSION, record.getSchemaVersion());
        assertTrue(record.getDocument().contains("\"candidate_id\""));
    }

    @Test
    void olderSnapshotDoesNotOverwriteNewer() {
        InterviewSession newer = completedSession("s-2", "candidate-1", 5);
        InterviewSession older = Fixtures.answered(0.4).toBuilder().id("s-2").version(4).build();

        store.persist(newer);
        store.persist(older);

        InterviewSession loaded = store.load("s-2").orElseThrow();
        assertEquals(5, loaded.getVersion());
        assertEquals(SessionStatus.COMPLETED, loaded.getStatus());
    }

    @Test
    void newerSnapshotReplacesOlder() {
        InterviewSession first = Fixtures.answered(0.4).toBuilder().id("s-3").version(1).build();
        InterviewSession second = first.toBuilder().status(SessionStatus.PAUSED).version(2).build();

        store.persist(first);
        store.persist(second);

        assertEquals(SessionStatus.PAUSED, store.load("s-3").orElseThrow().getStatus());
    }

    @Test
    void listsCandidateSessionsNewestFirst() {
        InterviewSession earlier = Fixtures.answered(0.5).toBuilder().id("old").candidateId("c-9").build();
        InterviewSession later = earlier.toBuilder().id("new").createdAt(Fixtures.NOW.plus(Duration.ofHours(1))).build();
        store.persist(earlier);
        store.persist(later);
        store.persist(earlier.toBuilder().id("other").candidateId("c-10").build());

        List<InterviewSession> sessions = store.findByCandidate("c-9");

        assertEquals(List.of("new", "old"), sessions.stream().map(InterviewSession::getId).toList());
        assertTrue(store.findByCandidate("nobody").isEmpty());
    }

    @Test
    void unknownSessionIsEmpty() {
        assertTrue(store.load("missing").isEmpty());
    }

    @Test
    void newerSchemaIsRejected() {
        store.persist(Fixtures.answered(0.5).toBuilder().id("s-4").build());
        InterviewSessionRecord record = repository.findById("s-4").orElseThrow();
        record.setSchemaVersion(SessionDocument.SCHEMA_VERSION + 1);
        repository.save(record);

        ExternalServiceUnavailableException error = assertThrows(ExternalServiceUnavailableException.class,
                () -> store.load("s-4"));
        assertEquals(JpaSessionStore.SERVICE, error.getService());
    }
}
