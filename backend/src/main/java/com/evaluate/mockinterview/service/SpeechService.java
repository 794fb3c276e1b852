package com.evaluate.mockinterview.service;

import com.evaluate.mockinterview.exception.ExternalServiceUnavailableException;
import com.evaluate.mockinterview.gateway.SpeechSynthesizer;
import com.evaluate.mockinterview.gateway.Transcriber;
import com.evaluate.mockinterview.util.WavAudio;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Azure Speech transcription and synthesis. The SDK is optional at runtime and driven through
 * reflection; without it (or without credentials) transcription reports the service as unavailable
 * and synthesis returns nothing.
 */
@Service
@Slf4j
public class SpeechService implements Transcriber, SpeechSynthesizer {

    static final String SERVICE = "azure-speech";
    private static final String SDK = "com.microsoft.cognitiveservices.speech.";

    @Value("${azure.speech.key:}")
    private String speechKey;

    @Value("${azure.speech.region:}")
    private String speechRegion;

    @Value("${azure.speech.voice:en-US-TonyNeural}")
    private String voice;

    @Value("${azure.speech.language:en-US}")
    private String language;

    private boolean azureSpeechAvailable = false;
    private Object speechConfig;

    @PostConstruct
    public void initialize() {
        try {
            if (speechKey != null && !speechKey.isEmpty() && speechRegion != null && !speechRegion.isEmpty()) {
                Class<?> speechConfigClass = Class.forName(SDK + "SpeechConfig");
                var fromSubscription = speechConfigClass.getMethod("fromSubscription", String.class, String.class);
                speechConfig = fromSubscription.invoke(null, speechKey, speechRegion);

                speechConfigClass.getMethod("setSpeechSynthesisVoiceName", String.class).invoke(speechConfig, voice);
                speechConfigClass.getMethod("setSpeechRecognitionLanguage", String.class).invoke(speechConfig, language);

                azureSpeechAvailable = true;
                log.info("SpeechService initialized with Azure Speech Services ({}, {})", speechRegion, voice);
            } else {
                log.info("SpeechService initialized (Azure Speech credentials not configured)");
            }
        } catch (ClassNotFoundException e) {
            log.info("SpeechService initialized (Azure Speech SDK not available)");
        } catch (ReflectiveOperationException | RuntimeException e) {
            log.warn("Failed to initialize Azure Speech: {}", e.getMessage());
        }
    }

    public boolean isAvailable() {
        return azureSpeechAvailable && speechConfig != null;
    }

    @Override
    public Optional<byte[]> synthesize(String text) {
        if (!isAvailable()) {
            log.debug("TTS requested but Azure Speech not available: {}...", preview(text));
            return Optional.empty();
        }

        try {
            Class<?> synthesizerClass = Class.forName(SDK + "SpeechSynthesizer");
            Class<?> speechConfigClass = Class.forName(SDK + "SpeechConfig");
            Object synthesizer = synthesizerClass.getConstructor(speechConfigClass).newInstance(speechConfig);
            try {
                Object result = synthesizerClass.getMethod("SpeakText", String.class).invoke(synthesizer, text);
                Object reason = result.getClass().getMethod("getReason").invoke(result);

                if ("SynthesizingAudioCompleted".equals(reason.toString())) {
                    byte[] audioData = (byte[]) result.getClass().getMethod("getAudioData").invoke(result);
                    log.info("TTS completed for: {}...", preview(text));
                    return Optional.of(WavAudio.toWav(audioData, WavAudio.DEFAULT_SAMPLE_RATE));
                }
                log.warn("TTS failed: {}", reason);
                return Optional.empty();
            } finally {
                close(synthesizer);
            }
        } catch (ReflectiveOperationException | RuntimeException e) {
            log.error("Error in text to speech: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @return recognized text, or an empty string when the recording contains no speech
     */
    @Override
    public String transcribe(byte[] audio) {
        if (audio == null || audio.length == 0) {
            return "";
        }
        if (!isAvailable()) {
            throw new ExternalServiceUnavailableException(SERVICE, "speech recognition is not configured");
        }

        Path tempFile = null;
        try {
            tempFile = Files.createTempFile("interview-answer-", ".wav");
            Files.write(tempFile, WavAudio.toWav(audio, WavAudio.DEFAULT_SAMPLE_RATE));

            Class<?> audioConfigClass = Class.forName(SDK + "audio.AudioConfig");
            Object audioConfig = audioConfigClass.getMethod("fromWavFileInput", String.class)
                    .invoke(null, tempFile.toString());

            Class<?> recognizerClass = Class.forName(SDK + "SpeechRecognizer");
            Class<?> speechConfigClass = Class.forName(SDK + "SpeechConfig");
            Object recognizer = recognizerClass.getConstructor(speechConfigClass, audioConfigClass)
                    .newInstance(speechConfig, audioConfig);
            try {
                Object future = recognizerClass.getMethod("recognizeOnceAsync").invoke(recognizer);
                Object result = future.getClass().getMethod("get").invoke(future);
                String reason = result.getClass().getMethod("getReason").invoke(result).toString();

                if ("RecognizedSpeech".equals(reason)) {
                    String text = (String) result.getClass().getMethod("getText").invoke(result);
                    log.info("STT recognized {} characters", text == null ? 0 : text.length());
                    return text == null ? "" : text.trim();
                }
                if ("NoMatch".equals(reason)) {
                    log.info("STT found no speech in {} bytes of audio", audio.length);
                    return "";
                }
                throw new ExternalServiceUnavailableException(SERVICE, "recognition ended with " + reason);
            } finally {
                close(recognizer);
                close(audioConfig);
            }
        } catch (IOException | ReflectiveOperationException e) {
            throw new ExternalServiceUnavailableException(SERVICE, "recognition failed: " + e.getMessage(), e);
        } finally {
            deleteQuietly(tempFile);
        }
    }

    private static void close(Object sdkObject) {
        if (sdkObject instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.debug("Could not release speech SDK object: {}", e.getMessage());
            }
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temp audio {}: {}", file, e.getMessage());
        }
    }

    private static String preview(String text) {
        return text == null ? "" : text.substring(0, Math.min(50, text.length()));
    }
}
