package com.evaluate.mockinterview.audio;

import java.io.IOException;

/**
 * A capture device producing little-endian 16-bit mono PCM.
 */
public interface AudioSource extends AutoCloseable {

    void open() throws IOException;

    /**
     * Blocks until audio is available.
     *
     * @return the number of bytes read, or -1 once the source is exhausted or closed
     */
    int read(byte[] buffer) throws IOException;

    int sampleRate();

    @Override
    void close();
}
