package com.evaluate.mockinterview.repository;

import com.evaluate.mockinterview.domain.Answer;
import com.evaluate.mockinterview.domain.ArmStats;
import com.evaluate.mockinterview.domain.BanditState;
import com.evaluate.mockinterview.domain.Difficulty;
import com.evaluate.mockinterview.domain.InterviewSession;
import com.evaluate.mockinterview.domain.JobContext;
import com.evaluate.mockinterview.domain.PerformanceMetrics;
import com.evaluate.mockinterview.domain.Question;
import com.evaluate.mockinterview.domain.QuestionSource;
import com.evaluate.mockinterview.domain.QuestionType;
import com.evaluate.mockinterview.domain.SessionStatus;
import com.evaluate.mockinterview.domain.StopReason;
import com.evaluate.mockinterview.exception.ExternalServiceUnavailableException;
import com.evaluate.mockinterview.gateway.SessionStore;
import com.evaluate.mockinterview.model.InterviewSessionRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link SessionStore} over the {@code interview_sessions} table. This is the only place that knows
 * the stored document shape.
 */
@Component
@Slf4j
public class JpaSessionStore implements SessionStore {

    static final String SERVICE = "session-store";

    private final InterviewSessionRecordRepository repository;
    private final ObjectMapper documentMapper;

    public JpaSessionStore(InterviewSessionRecordRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.documentMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public void persist(InterviewSession session) {
        try {
            InterviewSessionRecord record = repository.findById(session.getId()).orElseGet(InterviewSessionRecord::new);
            if (record.getId() != null && record.getVersion() > session.getVersion()) {
                log.debug("Not overwriting session {} v{} with older v{}", session.getId(), record.getVersion(),
                        session.getVersion());
                return;
            }
            record.setId(session.getId());
            record.setCandidateId(session.getCandidateId());
            record.setStatus(session.getStatus().name());
            record.setSchemaVersion(SessionDocument.SCHEMA_VERSION);
            record.setVersion(session.getVersion());
            record.setCreatedAt(session.getCreatedAt());
            record.setDocument(documentMapper.writeValueAsString(toDocument(session)));
            repository.save(record);
        } catch (JsonProcessingException e) {
            throw new ExternalServiceUnavailableException(SERVICE, "could not serialize session " + session.getId(), e);
        } catch (DataAccessException e) {
            log.error("Failed to persist session {}: {}", session.getId(), e.getMessage());
            throw new ExternalServiceUnavailableException(SERVICE, "could not persist session " + session.getId(), e);
        }
    }

    @Override
    public Optional<InterviewSession> load(String sessionId) {
        try {
            return repository.findById(sessionId).map(this::fromRecord);
        } catch (DataAccessException e) {
            throw new ExternalServiceUnavailableException(SERVICE, "could not load session " + sessionId, e);
        }
    }

    @Override
    public List<InterviewSession> findByCandidate(String candidateId) {
        try {
            return repository.findByCandidateIdOrderByCreatedAtDesc(candidateId).stream()
                    .map(this::fromRecord)
                    .toList();
        } catch (DataAccessException e) {
            throw new ExternalServiceUnavailableException(SERVICE, "could not list sessions of " + candidateId, e);
        }
    }

    private InterviewSession fromRecord(InterviewSessionRecord record) {
        if (record.getSchemaVersion() > SessionDocument.SCHEMA_VERSION) {
            throw new ExternalServiceUnavailableException(SERVICE, "session " + record.getId()
                    + " uses unsupported schema version " + record.getSchemaVersion());
        }
        try {
            return toSession(documentMapper.readValue(record.getDocument(), SessionDocument.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ExternalServiceUnavailableException(SERVICE, "corrupt document for session " + record.getId(), e);
        }
    }

    SessionDocument toDocument(InterviewSession session) {
        SessionDocument document = new SessionDocument();
        document.setId(session.getId());
        document.setCandidateId(session.getCandidateId());
        document.setJob(toDocument(session.getJob()));
        document.setStatus(session.getStatus().name());
        session.getQuestionPool().forEach(q -> document.getQuestionPool().add(toDocument(q)));
        session.getQuestions().forEach(q -> document.getQuestions().add(toDocument(q)));
        session.getAnswers().forEach(a -> document.getAnswers().add(toDocument(a)));
        document.setCurrentIndex(session.getCurrentIndex());
        document.setCreatedAt(session.getCreatedAt());
        document.setStartedAt(session.getStartedAt());
        document.setCompletedAt(session.getCompletedAt());
        if (session.getArms() != null) {
            session.getArms().getTypeArms().forEach((type, arm) -> document.getTypeArms().put(type.name(), toDocument(arm)));
            session.getArms().getDifficultyArms()
                    .forEach((difficulty, arm) -> document.getDifficultyArms().put(difficulty.name(), toDocument(arm)));
        }
        if (session.getMetrics() != null) {
            document.setMetrics(toDocument(session.getMetrics()));
        }
        document.setStopReason(session.getStopReason() == null ? null : session.getStopReason().name());
        document.setVersion(session.getVersion());
        return document;
    }

    InterviewSession toSession(SessionDocument document) {
        InterviewSession.InterviewSessionBuilder session = InterviewSession.builder()
                .id(document.getId())
                .candidateId(document.getCandidateId())
                .job(toJob(document.getJob()))
                .status(SessionStatus.valueOf(document.getStatus()))
                .currentIndex(document.getCurrentIndex())
                .createdAt(document.getCreatedAt())
                .startedAt(document.getStartedAt())
                .completedAt(document.getCompletedAt())
                .stopReason(document.getStopReason() == null ? StopReason.NONE : StopReason.valueOf(document.getStopReason()))
                .version(document.getVersion());
        document.getQuestionPool().forEach(q -> session.poolEntry(toQuestion(q)));
        document.getQuestions().forEach(q -> session.question(toQuestion(q)));
        document.getAnswers().forEach(a -> session.answer(toAnswer(a)));

        if (!document.getTypeArms().isEmpty() || !document.getDifficultyArms().isEmpty()) {
            Map<QuestionType, ArmStats> types = new EnumMap<>(QuestionType.class);
            document.getTypeArms().forEach((type, arm) -> types.put(QuestionType.valueOf(type), toArm(arm)));
            Map<Difficulty, ArmStats> difficulties = new EnumMap<>(Difficulty.class);
            document.getDifficultyArms().forEach((level, arm) -> difficulties.put(Difficulty.valueOf(level), toArm(arm)));
            session.arms(BanditState.of(types, difficulties));
        }
        if (document.getMetrics() != null) {
            session.metrics(toMetrics(document.getMetrics()));
        }
        return session.build();
    }

    private static SessionDocument.JobDocument toDocument(JobContext job) {
        SessionDocument.JobDocument document = new SessionDocument.JobDocument();
        document.setTitle(job.getTitle());
        document.setDescription(job.getDescription());
        document.setKeySkills(new ArrayList<>(job.getKeySkills()));
        document.setExperienceLevel(job.getExperienceLevel().name());
        document.setResponsibilities(new ArrayList<>(job.getResponsibilities()));
        document.setPreferredQualifications(new ArrayList<>(job.getPreferredQualifications()));
        return document;
    }

    private static JobContext toJob(SessionDocument.JobDocument document) {
        return JobContext.builder()
                .title(document.getTitle())
                .description(document.getDescription())
                .keySkills(document.getKeySkills())
                .experienceLevel(Difficulty.valueOf(document.getExperienceLevel()))
                .responsibilities(document.getResponsibilities())
                .preferredQualifications(document.getPreferredQualifications())
                .build();
    }

    private static SessionDocument.QuestionDocument toDocument(Question question) {
        SessionDocument.QuestionDocument document = new SessionDocument.QuestionDocument();
        document.setId(question.getId());
        document.setText(question.getText());
        document.setType(question.getType().name());
        document.setDifficulty(question.getDifficulty().name());
        document.setCategory(question.getCategory());
        document.setExpectedKeywords(new ArrayList<>(question.getExpectedKeywords()));
        document.setSource(question.getSource().name());
        return document;
    }

    private static Question toQuestion(SessionDocument.QuestionDocument document) {
        return Question.builder()
                .id(document.getId())
                .text(document.getText())
                .type(QuestionType.valueOf(document.getType()))
                .difficulty(Difficulty.valueOf(document.getDifficulty()))
                .category(document.getCategory())
                .expectedKeywords(document.getExpectedKeywords())
                .source(document.getSource() == null ? QuestionSource.POOL : QuestionSource.valueOf(document.getSource()))
                .build();
    }

    private static SessionDocument.AnswerDocument toDocument(Answer answer) {
        SessionDocument.AnswerDocument document = new SessionDocument.AnswerDocument();
        document.setQuestionId(answer.getQuestionId());
        document.setTranscript(answer.getTranscript());
        document.setTechnical(answer.getTechnical());
        document.setFluency(answer.getFluency());
        document.setConfidence(answer.getConfidence());
        document.setSentiment(answer.getSentiment());
        document.getEmotionWeights().putAll(answer.getEmotionWeights());
        document.setAudioDuration(answer.getAudioDuration());
        document.setTimestamp(answer.getTimestamp());
        document.setDegraded(answer.isDegraded());
        return document;
    }

    private static Answer toAnswer(SessionDocument.AnswerDocument document) {
        return Answer.builder()
                .questionId(document.getQuestionId())
                .transcript(document.getTranscript())
                .technical(document.getTechnical())
                .fluency(document.getFluency())
                .confidence(document.getConfidence())
                .sentiment(document.getSentiment())
                .emotionWeights(document.getEmotionWeights())
                .audioDuration(document.getAudioDuration())
                .timestamp(document.getTimestamp())
                .degraded(document.isDegraded())
                .build();
    }

    private static SessionDocument.ArmDocument toDocument(ArmStats arm) {
        SessionDocument.ArmDocument document = new SessionDocument.ArmDocument();
        document.setSuccesses(arm.getSuccessCount());
        document.setFailures(arm.getFailureCount());
        return document;
    }

    private static ArmStats toArm(SessionDocument.ArmDocument document) {
        return ArmStats.of(document.getSuccesses(), document.getFailures());
    }

    private static SessionDocument.MetricsDocument toDocument(PerformanceMetrics metrics) {
        SessionDocument.MetricsDocument document = new SessionDocument.MetricsDocument();
        document.setTechnical(metrics.getTechnical());
        document.setCommunication(metrics.getCommunication());
        document.setEmotionalIntelligence(metrics.getEmotionalIntelligence());
        document.setBehavioral(metrics.getBehavioral());
        document.setOverall(metrics.getOverall());
        document.setStrengths(new ArrayList<>(metrics.getStrengths()));
        document.setWeaknesses(new ArrayList<>(metrics.getWeaknesses()));
        document.setRecommendations(new ArrayList<>(metrics.getRecommendations()));
        return document;
    }

    private static PerformanceMetrics toMetrics(SessionDocument.MetricsDocument document) {
        return PerformanceMetrics.builder()
                .technical(document.getTechnical())
                .communication(document.getCommunication())
                .emotionalIntelligence(document.getEmotionalIntelligence())
                .behavioral(document.getBehavioral())
                .overall(document.getOverall())
                .strengths(document.getStrengths())
                .weaknesses(document.getWeaknesses())
                .recommendations(document.getRecommendations())
                .build();
    }
}
