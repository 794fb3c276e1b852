package com.evaluate.mockinterview.service;

import com.evaluate.mockinterview.domain.AudioFeatures;
import com.evaluate.mockinterview.exception.ExternalServiceUnavailableException;
import com.evaluate.mockinterview.gateway.AudioFeatureExtractor;
import com.evaluate.mockinterview.util.WavAudio;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Signal-level features of a recorded answer: zero-crossing pitch, pause-based fluency and duration.
 * Emotion weights are a fixed distribution until a classifier is wired in.
 */
@Service
@Slf4j
public class AudioFeatureService implements AudioFeatureExtractor {

    static final String SERVICE = "audio-features";

    private static final int FRAME_SIZE = 512;
    private static final int FRAME_STEP = 256;
    private static final int SILENCE_THRESHOLD = 1000;

    @Override
    public AudioFeatures extract(byte[] audio) {
        WavAudio.PcmAudio pcm;
        try {
            pcm = WavAudio.decode(audio);
        } catch (RuntimeException e) {
            throw new ExternalServiceUnavailableException(SERVICE, "unreadable audio: " + e.getMessage(), e);
        }

        short[] samples = pcm.getSamples();
        int sampleRate = pcm.getSampleRate();
        double duration = pcm.durationSeconds();
        double fluency = fluency(samples, sampleRate, duration);
        double pitch = pitch(samples, sampleRate);

        log.debug("Audio features: duration={}s pitch={}Hz fluency={}", duration, pitch, fluency);
        return AudioFeatures.builder()
                .duration(duration)
                .pitch(pitch)
                .fluency(fluency)
                .emotionWeight("confident", 0.7)
                .emotionWeight("nervous", 0.2)
                .emotionWeight("neutral", 0.1)
                .build();
    }

    /** Mean zero-crossing pitch estimate over half-overlapping frames. */
    static double pitch(short[] samples, int sampleRate) {
        double total = 0;
        int frames = 0;
        for (int start = 0; start < samples.length - FRAME_SIZE; start += FRAME_STEP) {
            int crossings = 0;
            for (int i = start + 1; i < start + FRAME_SIZE; i++) {
                if (Integer.signum(samples[i]) != Integer.signum(samples[i - 1])) {
                    crossings++;
                }
            }
            total += crossings * (double) sampleRate / (2.0 * FRAME_SIZE);
            frames++;
        }
        return frames == 0 ? 0.0 : total / frames;
    }

    /** One minus the number of 100 ms silent stretches per second of audio, floored at zero. */
    static double fluency(short[] samples, int sampleRate, double duration) {
        long silent = 0;
        for (short sample : samples) {
            if (Math.abs(sample) < SILENCE_THRESHOLD) {
                silent++;
            }
        }
        long pauses = silent / Math.max(1, sampleRate / 10);
        return Math.max(0.0, 1.0 - pauses / Math.max(duration, 1.0));
    }
}
