package com.evaluate.mockinterview.service;

import com.evaluate.mockinterview.domain.AudioFeatures;
import com.evaluate.mockinterview.exception.ExternalServiceUnavailableException;
import com.evaluate.mockinterview.support.Fixtures;
import com.evaluate.mockinterview.util.WavAudio;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.junit.jupiter.api.Assertions.*;

class AudioFeatureServiceTest {

    private static final int RATE = 16000;

    private final AudioFeatureService service = new AudioFeatureService();

    private static short[] sine(double frequency, double seconds, int amplitude) {
        short[] samples = new short[(int) (RATE * seconds)];
        for (int i = 0; i < samples.length; i++) {
            // phase offset keeps samples off exact zero
            samples[i] = (short) (amplitude * Math.sin(2 * Math.PI * frequency * i / RATE + 0.3));
        }
        return samples;
    }

    private static byte[] wav(short[] samples) {
        ByteBuffer pcm = ByteBuffer.allocate(samples.length * 2).order(ByteOrder.LITTLE_ENDIAN);
        for (short sample : samples) {
            pcm.putShort(sample);
        }
        return WavAudio.wrapPcm(pcm.array(), RATE);
    }

    @Test
    void steadyToneIsFluentWithMatchingPitch() {
        AudioFeatures features = service.extract(wav(sine(200, 1.0, 20000)));

        assertEquals(200, features.getPitch(), 20);
        assertTrue(features.getFluency() > 0.9, "fluency " + features.getFluency());
        assertEquals(1.0, features.getDuration(), 1e-9);
    }

    @Test
    void silenceHasNoFluency() {
        AudioFeatures features = service.extract(wav(new short[2 * RATE]));

        assertEquals(0.0, features.getFluency());
        assertEquals(2.0, features.getDuration(), 1e-9);
    }

    @Test
    void emotionWeightsSumToOne() {
        AudioFeatures features = service.extract(wav(sine(150, 0.5, 8000)));

        assertEquals(0.7, features.getEmotionWeights().get("confident").doubleValue());
        assertEquals(1.0, features.getEmotionWeights().values().stream().mapToDouble(Double::doubleValue).sum(), 1e-9);
    }

    @Test
    void pitchOfTooShortAudioIsZero() {
        assertEquals(0.0, AudioFeatureService.pitch(new short[100], RATE));
    }

    @Test
    void fluencyDropsWithPauses() {
        short[] speech = sine(200, 1.0, 20000);
        short[] withPause = new short[speech.length + RATE / 2];
        System.arraycopy(speech, 0, withPause, 0, speech.length);

        double fluent = AudioFeatureService.fluency(speech, RATE, 1.0);
        double paused = AudioFeatureService.fluency(withPause, RATE, 1.5);

        assertTrue(paused < fluent);
    }

    @Test
    void unreadableAudioIsReportedAsUnavailable() {
        byte[] corrupt = WavAudio.wrapPcm(new byte[]{1, 2, 3, 4}, RATE);
        corrupt[34] = 24;

        ExternalServiceUnavailableException error = assertThrows(ExternalServiceUnavailableException.class,
                () -> service.extract(corrupt));
        assertEquals(AudioFeatureService.SERVICE, error.getService());
    }

    @Test
    void truncatedUploadIsReportedAsUnavailable() {
        ExternalServiceUnavailableException error = assertThrows(ExternalServiceUnavailableException.class,
                () -> service.extract(Fixtures.truncatedWav()));
        assertEquals(AudioFeatureService.SERVICE, error.getService());
    }
}
