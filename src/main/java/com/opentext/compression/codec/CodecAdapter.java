package com.opentext.compression.codec;

import com.opentext.compression.model.CodecId;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Bridge to one compression library.
 * <p>
 * Implementations are stateless and thread-safe. Level validation happens upstream when the
 * {@link com.opentext.compression.model.AlgorithmSpec} is built; adapters trust the level they get.
 * </p>
 */
public interface CodecAdapter {

    /** @return the codec this adapter implements */
    CodecId codec();

    /** @return true if the backing library (and any native part of it) can be used */
    boolean isAvailable();

    /** Compress a whole buffer. */
    byte[] compress(byte[] input, int level) throws IOException;

    /**
     * Compress everything readable from {@code input} into {@code output}. The output stream is
     * flushed but left open; the input is not closed.
     *
     * @return number of compressed bytes written
     */
    long compress(InputStream input, OutputStream output, int level) throws IOException;

    /** Reverse of {@link #compress(byte[], int)}. */
    byte[] decompress(byte[] compressed) throws IOException;

    /** @return true if {@link #compress(InputStream, OutputStream, int)} runs in constant memory */
    default boolean supportsStreaming() {
        return true;
    }
}
