package com.evaluate.mockinterview.audio;

import lombok.extern.slf4j.Slf4j;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.TargetDataLine;
import java.io.IOException;

/**
 * The default system microphone.
 */
@Slf4j
public class LineAudioSource implements AudioSource {

    private final AudioFormat format;
    private volatile TargetDataLine line;

    public LineAudioSource(int sampleRate) {
        this.format = new AudioFormat(sampleRate, 16, 1, true, false);
    }

    @Override
    public void open() throws IOException {
        DataLine.Info info = new DataLine.Info(TargetDataLine.class, format);
        if (!AudioSystem.isLineSupported(info)) {
            throw new IOException("No microphone supports " + format);
        }
        try {
            TargetDataLine opened = (TargetDataLine) AudioSystem.getLine(info);
            opened.open(format);
            opened.start();
            line = opened;
            log.info("Microphone opened: {}", format);
        } catch (LineUnavailableException | SecurityException e) {
            throw new IOException("Microphone unavailable: " + e.getMessage(), e);
        }
    }

    @Override
    public int read(byte[] buffer) {
        TargetDataLine current = line;
        if (current == null || !current.isOpen()) {
            return -1;
        }
        return current.read(buffer, 0, buffer.length - buffer.length % format.getFrameSize());
    }

    @Override
    public int sampleRate() {
        return (int) format.getSampleRate();
    }

    @Override
    public void close() {
        TargetDataLine current = line;
        line = null;
        if (current != null) {
            current.stop();
            current.close();
        }
    }
}
