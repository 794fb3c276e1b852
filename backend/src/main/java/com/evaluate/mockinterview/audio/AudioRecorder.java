package com.evaluate.mockinterview.audio;

import com.evaluate.mockinterview.config.InterviewProperties;
import com.evaluate.mockinterview.exception.ExternalServiceUnavailableException;
import com.evaluate.mockinterview.util.WavAudio;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Captures one answer at a time from an {@link AudioSource}. A daemon producer copies fixed-size
 * buffers into a bounded queue until {@link #stop()} clears the recording flag; the queue is then
 * drained into a single WAV recording.
 *
 * <p>{@code start} while recording and {@code stop} while idle are no-ops. When the queue is full
 * the newest buffer is dropped and counted.</p>
 */
@Slf4j
public class AudioRecorder implements AutoCloseable {

    public static final String SERVICE = "microphone";

    private final AudioSource source;
    private final InterviewProperties.Recording settings;
    private final AtomicBoolean recording = new AtomicBoolean();
    private final AtomicLong dropped = new AtomicLong();

    private BlockingQueue<byte[]> buffers;
    private Thread producer;

    public AudioRecorder(AudioSource source, InterviewProperties.Recording settings) {
        this.source = source;
        this.settings = settings;
    }

    /**
     * @return {@code true} if capture started, {@code false} if a recording was already running
     * @throws ExternalServiceUnavailableException if the source cannot be opened
     */
    public synchronized boolean start() {
        if (recording.get()) {
            log.debug("start() ignored, already recording");
            return false;
        }
        try {
            source.open();
        } catch (IOException e) {
            throw new ExternalServiceUnavailableException(SERVICE, e.getMessage(), e);
        }
        buffers = new ArrayBlockingQueue<>(settings.getQueueCapacity());
        dropped.set(0);
        recording.set(true);

        BlockingQueue<byte[]> queue = buffers;
        producer = new Thread(() -> capture(queue), "audio-recorder");
        producer.setDaemon(true);
        producer.start();
        log.info("Recording started at {} Hz", source.sampleRate());
        return true;
    }

    /**
     * Stops capture and returns everything recorded since {@link #start()} as WAV.
     *
     * @return the recording, or empty when idle or nothing was captured
     */
    public synchronized Optional<byte[]> stop() {
        if (!recording.compareAndSet(true, false)) {
            return Optional.empty();
        }
        awaitProducer();
        source.close();

        List<byte[]> chunks = new ArrayList<>(buffers.size());
        buffers.drainTo(chunks);
        ByteArrayOutputStream pcm = new ByteArrayOutputStream();
        for (byte[] chunk : chunks) {
            pcm.writeBytes(chunk);
        }
        if (dropped.get() > 0) {
            log.warn("Recording dropped {} buffer(s) after the queue filled up", dropped.get());
        }
        log.info("Recording stopped: {} bytes in {} buffer(s)", pcm.size(), chunks.size());
        return pcm.size() == 0
                ? Optional.empty()
                : Optional.of(WavAudio.wrapPcm(pcm.toByteArray(), source.sampleRate()));
    }

    public boolean isRecording() {
        return recording.get();
    }

    long droppedBuffers() {
        return dropped.get();
    }

    @Override
    public void close() {
        stop();
    }

    private void capture(BlockingQueue<byte[]> queue) {
        byte[] buffer = new byte[settings.getBufferSize()];
        while (recording.get()) {
            int read;
            try {
                read = source.read(buffer);
            } catch (IOException e) {
                log.warn("Audio capture failed: {}", e.getMessage());
                return;
            }
            if (read < 0) {
                return;
            }
            if (read > 0 && !queue.offer(Arrays.copyOf(buffer, read))) {
                dropped.incrementAndGet();
            }
        }
    }

    private void awaitProducer() {
        try {
            producer.join(settings.getStopTimeout().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping the recorder");
        }
        if (producer.isAlive()) {
            log.warn("Recorder thread did not stop within {}", settings.getStopTimeout());
            producer.interrupt();
        }
    }
}
