package com.evaluate.mockinterview.support;

import com.evaluate.mockinterview.domain.Answer;
import com.evaluate.mockinterview.domain.Difficulty;
import com.evaluate.mockinterview.domain.InterviewSession;
import com.evaluate.mockinterview.domain.JobContext;
import com.evaluate.mockinterview.domain.Question;
import com.evaluate.mockinterview.domain.QuestionType;
import com.evaluate.mockinterview.domain.SessionStatus;
import com.evaluate.mockinterview.domain.StopReason;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

public final class Fixtures {

    public static final Instant NOW = Instant.parse("2026-01-05T10:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private Fixtures() {
    }

    /** A 20-byte WAV whose fmt chunk header announces 16 bytes that never arrive. */
    public static byte[] truncatedWav() {
        return ByteBuffer.allocate(20).order(ByteOrder.LITTLE_ENDIAN)
                .put("RIFF".getBytes(StandardCharsets.US_ASCII))
                .putInt(12)
                .put("WAVE".getBytes(StandardCharsets.US_ASCII))
                .put("fmt ".getBytes(StandardCharsets.US_ASCII))
                .putInt(16)
                .array();
    }

    public static JobContext job(Difficulty level, String... skills) {
        JobContext.JobContextBuilder job = JobContext.builder()
                .title("Backend Engineer")
                .description("Build and operate Java services on Spring Boot")
                .experienceLevel(level);
        for (String skill : skills) {
            job.keySkill(skill);
        }
        return job.build();
    }

    public static Question question(String id, QuestionType type, Difficulty difficulty) {
        return Question.builder()
                .id(id)
                .text("Question " + id)
                .type(type)
                .difficulty(difficulty)
                .category("General")
                .expectedKeyword("keyword")
                .build();
    }

    public static Answer answer(String questionId, double technical) {
        return Answer.builder()
                .questionId(questionId)
                .transcript("answer to " + questionId)
                .technical(technical)
                .fluency(0.6)
                .confidence(0.6)
                .sentiment(0.2)
                .emotionWeight("neutral", 1.0)
                .audioDuration(10.0)
                .timestamp(NOW)
                .build();
    }

    /** An in-progress session whose answered questions carry the given technical scores. */
    public static InterviewSession answered(double... technicalScores) {
        InterviewSession.InterviewSessionBuilder session = InterviewSession.builder()
                .id("session-1")
                .candidateId("candidate-1")
                .job(job(Difficulty.INTERMEDIATE, "java", "spring", "sql"))
                .status(SessionStatus.IN_PROGRESS)
                .createdAt(NOW)
                .startedAt(NOW)
                .stopReason(StopReason.NONE)
                .currentIndex(technicalScores.length)
                .version(1);
        for (int i = 0; i < technicalScores.length; i++) {
            String id = "q" + (i + 1);
            session.question(question(id, QuestionType.TECHNICAL, Difficulty.INTERMEDIATE));
            session.answer(answer(id, technicalScores[i]));
        }
        return session.build();
    }
}
