package com.evaluate.mockinterview.util;

import lombok.Value;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Minimal RIFF/WAVE support: 16-bit PCM only, which is what the recorder and the speech service
 * produce and consume.
 */
public final class WavAudio {

    public static final int DEFAULT_SAMPLE_RATE = 16000;
    private static final int BITS_PER_SAMPLE = 16;
    private static final int HEADER_SIZE = 44;

    private WavAudio() {
    }

    public static boolean isWav(byte[] audio) {
        return audio != null && audio.length >= 12
                && audio[0] == 'R' && audio[1] == 'I' && audio[2] == 'F' && audio[3] == 'F'
                && audio[8] == 'W' && audio[9] == 'A' && audio[10] == 'V' && audio[11] == 'E';
    }

    /** Returns WAV bytes unchanged and wraps anything else as 16-bit mono PCM. */
    public static byte[] toWav(byte[] audio, int sampleRate) {
        return isWav(audio) ? audio : wrapPcm(audio, sampleRate);
    }

    /** Wraps little-endian 16-bit mono PCM into a WAV container. */
    public static byte[] wrapPcm(byte[] pcm, int sampleRate) {
        int channels = 1;
        int dataSize = pcm.length;

        ByteArrayOutputStream baos = new ByteArrayOutputStream(HEADER_SIZE + dataSize);
        try (DataOutputStream dos = new DataOutputStream(baos)) {
            dos.writeBytes("RIFF");
            writeIntLE(dos, 36 + dataSize);
            dos.writeBytes("WAVE");
            dos.writeBytes("fmt ");
            writeIntLE(dos, 16);
            writeShortLE(dos, (short) 1);
            writeShortLE(dos, (short) channels);
            writeIntLE(dos, sampleRate);
            writeIntLE(dos, sampleRate * channels * BITS_PER_SAMPLE / 8);
            writeShortLE(dos, (short) (channels * BITS_PER_SAMPLE / 8));
            writeShortLE(dos, (short) BITS_PER_SAMPLE);
            dos.writeBytes("data");
            writeIntLE(dos, dataSize);
            dos.write(pcm);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not build WAV container", e);
        }
        return baos.toByteArray();
    }

    /**
     * Decodes WAV (or headerless 16 kHz PCM) into mono samples. Multi-channel audio is mixed down.
     *
     * @throws IllegalArgumentException for empty input, non-PCM encodings or a corrupt header
     */
    public static PcmAudio decode(byte[] audio) {
        if (audio == null || audio.length < 2) {
            throw new IllegalArgumentException("Audio is empty");
        }
        if (!isWav(audio)) {
            return new PcmAudio(DEFAULT_SAMPLE_RATE, samples(ByteBuffer.wrap(audio).order(ByteOrder.LITTLE_ENDIAN),
                    audio.length, 1));
        }

        ByteBuffer buffer = ByteBuffer.wrap(audio).order(ByteOrder.LITTLE_ENDIAN);
        buffer.position(12);
        int sampleRate = 0;
        int channels = 0;
        int bits = 0;
        while (buffer.remaining() >= 8) {
            String chunkId = chunkId(buffer);
            int chunkSize = buffer.getInt();
            if (chunkSize < 0 || chunkSize > buffer.remaining()) {
                // some writers leave the data size unset while streaming
                chunkSize = buffer.remaining();
            }
            if ("fmt ".equals(chunkId)) {
                if (chunkSize < 16 || buffer.remaining() < 16) {
                    throw new IllegalArgumentException("WAV fmt chunk is truncated (" + buffer.remaining()
                            + " bytes left)");
                }
                int format = buffer.getShort(buffer.position()) & 0xFFFF;
                channels = buffer.getShort(buffer.position() + 2) & 0xFFFF;
                sampleRate = buffer.getInt(buffer.position() + 4);
                bits = buffer.getShort(buffer.position() + 14) & 0xFFFF;
                if (format != 1 || bits != BITS_PER_SAMPLE) {
                    throw new IllegalArgumentException("Only 16-bit PCM WAV is supported (format " + format
                            + ", " + bits + " bits)");
                }
            } else if ("data".equals(chunkId)) {
                if (sampleRate <= 0 || channels <= 0) {
                    throw new IllegalArgumentException("WAV data chunk precedes a valid fmt chunk");
                }
                ByteBuffer data = buffer.slice().order(ByteOrder.LITTLE_ENDIAN);
                return new PcmAudio(sampleRate, samples(data, chunkSize, channels));
            }
            buffer.position(Math.min(buffer.limit(), buffer.position() + chunkSize + (chunkSize & 1)));
        }
        throw new IllegalArgumentException("WAV has no data chunk");
    }

    private static short[] samples(ByteBuffer data, int size, int channels) {
        int frames = size / (2 * channels);
        short[] mono = new short[frames];
        for (int frame = 0; frame < frames; frame++) {
            int sum = 0;
            for (int channel = 0; channel < channels; channel++) {
                sum += data.getShort();
            }
            mono[frame] = (short) (sum / channels);
        }
        return mono;
    }

    private static String chunkId(ByteBuffer buffer) {
        byte[] id = new byte[4];
        buffer.get(id);
        return new String(id, StandardCharsets.US_ASCII);
    }

    private static void writeIntLE(DataOutputStream dos, int value) throws IOException {
        dos.write(value & 0xFF);
        dos.write((value >> 8) & 0xFF);
        dos.write((value >> 16) & 0xFF);
        dos.write((value >> 24) & 0xFF);
    }

    private static void writeShortLE(DataOutputStream dos, short value) throws IOException {
        dos.write(value & 0xFF);
        dos.write((value >> 8) & 0xFF);
    }

    /** Decoded mono samples. */
    @Value
    public static class PcmAudio {
        int sampleRate;
        short[] samples;

        public double durationSeconds() {
            return sampleRate == 0 ? 0.0 : (double) samples.length / sampleRate;
        }
    }
}
