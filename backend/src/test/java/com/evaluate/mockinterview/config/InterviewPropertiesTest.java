package com.evaluate.mockinterview.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class InterviewPropertiesTest {

    @Test
    void defaultDrainCoversTheWholeAudioScoringRun() {
        InterviewProperties.Scoring scoring = new InterviewProperties().getScoring();

        // two sequential calls of 30s + 500ms backoff + 30s, plus jitter and the record step
        assertEquals(Duration.ofSeconds(123), scoring.scoringBound());
        assertEquals(scoring.scoringBound(), scoring.effectiveDrainTimeout());
        assertTrue(scoring.effectiveDrainTimeout().compareTo(Duration.ofMillis(2 * 60_500)) > 0);
    }

    @Test
    void shortDrainTimeoutIsRaisedToTheScoringBound() {
        InterviewProperties.Scoring scoring = new InterviewProperties().getScoring();
        scoring.setTimeout(Duration.ofMillis(300));
        scoring.setRetryBackoff(Duration.ofMillis(10));
        scoring.setDrainTimeout(Duration.ofMillis(350));

        assertEquals(Duration.ofMillis(2240), scoring.effectiveDrainTimeout());
    }

    @Test
    void longerDrainTimeoutIsKept() {
        InterviewProperties.Scoring scoring = new InterviewProperties().getScoring();
        scoring.setDrainTimeout(Duration.ofMinutes(5));

        assertEquals(Duration.ofMinutes(5), scoring.effectiveDrainTimeout());
    }
}
