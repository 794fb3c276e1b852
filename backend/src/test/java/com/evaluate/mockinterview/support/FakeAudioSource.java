package com.evaluate.mockinterview.support;

import com.evaluate.mockinterview.audio.AudioSource;

import java.io.IOException;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Emits a fixed number of constant-valued chunks, then reports no data until closed.
 */
public class FakeAudioSource implements AudioSource {

    private final int chunks;
    private final byte value;
    private final boolean failOnOpen;
    private final AtomicInteger emitted = new AtomicInteger();
    private final AtomicInteger opened = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();

    public FakeAudioSource(int chunks, byte value, boolean failOnOpen) {
        this.chunks = chunks;
        this.value = value;
        this.failOnOpen = failOnOpen;
    }

    public FakeAudioSource(int chunks) {
        this(chunks, (byte) 0x20, false);
    }

    @Override
    public void open() throws IOException {
        if (failOnOpen) {
            throw new IOException("no capture device");
        }
        opened.incrementAndGet();
        emitted.set(0);
        closed.set(false);
    }

    @Override
    public int read(byte[] buffer) throws IOException {
        if (closed.get()) {
            return -1;
        }
        if (emitted.get() < chunks) {
            emitted.incrementAndGet();
            Arrays.fill(buffer, value);
            return buffer.length;
        }
        try {
            Thread.sleep(5);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return -1;
        }
        return 0;
    }

    @Override
    public int sampleRate() {
        return 16000;
    }

    @Override
    public void close() {
        closed.set(true);
    }

    public boolean drained() {
        return emitted.get() >= chunks;
    }

    public int openCount() {
        return opened.get();
    }

    public boolean isClosed() {
        return closed.get();
    }
}
