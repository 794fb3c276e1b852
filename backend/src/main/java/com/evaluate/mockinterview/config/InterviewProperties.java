package com.evaluate.mockinterview.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Policy constants of the interview engine, bound from {@code interview.*}.
 */
@Data
@ConfigurationProperties(prefix = "interview")
public class InterviewProperties {

    private final Termination termination = new Termination();
    private final Bandit bandit = new Bandit();
    private final Scoring scoring = new Scoring();
    private final Recording recording = new Recording();

    @Data
    public static class Termination {
        /** Hard cap on answered questions. */
        private int maxQuestions = 20;
        private int plateauWindow = 5;
        /** Population standard deviation below which the plateau rule fires. */
        private double plateauStdDev = 0.1;
        private int poorWindow = 3;
        private double poorMean = 0.4;
    }

    @Data
    public static class Bandit {
        /** Technical score at or above which an answer counts as an arm success. */
        private double successThreshold = 0.7;
        /** How many recent answers feed the performance level. */
        private int performanceWindow = 5;
        private double highPerformance = 0.8;
        private double lowPerformance = 0.6;
        /** Multiplier applied to the difficulty sample of arms that are off-pace. */
        private double offPacePenalty = 0.7;
        /** Q/A exchanges passed to the contextual generator. */
        private int historySize = 3;
    }

    @Data
    public static class Scoring {
        /** Time left for recording a scored answer once every external call has returned. */
        static final Duration RECORD_SLACK = Duration.ofSeconds(1);

        private Duration timeout = Duration.ofSeconds(30);
        private Duration retryBackoff = Duration.ofMillis(500);
        /**
         * How long cancel/pause wait for in-flight scoring. Unset or shorter values are raised to
         * {@link #scoringBound()}.
         */
        private Duration drainTimeout;

        /**
         * Longest a scoring run can take. An audio answer makes two calls in sequence (features and
         * transcription, then text analysis), each timing out twice with a jittered backoff between.
         */
        public Duration scoringBound() {
            Duration call = timeout.multipliedBy(2).plus(retryBackoff.multipliedBy(2));
            return call.multipliedBy(2).plus(RECORD_SLACK);
        }

        public Duration effectiveDrainTimeout() {
            Duration bound = scoringBound();
            return drainTimeout != null && drainTimeout.compareTo(bound) > 0 ? drainTimeout : bound;
        }
    }

    @Data
    public static class Recording {
        private boolean enabled = false;
        private int sampleRate = 16000;
        /** Bytes per captured buffer; 3200 bytes is 100 ms of 16-bit mono audio at 16 kHz. */
        private int bufferSize = 3200;
        /** Buffers held before capture starts dropping; 1200 buffers is two minutes. */
        private int queueCapacity = 1200;
        private Duration stopTimeout = Duration.ofSeconds(2);
    }
}
