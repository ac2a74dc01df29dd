package com.opentext.compression.model;

import java.io.IOException;
import java.io.InputStream;

/**
 * One logical item to compress, identified by a stable id.
 * <p>
 * Implementations are immutable. The pipeline only borrows an input for the duration of a
 * compression call; every {@link #openStream()} returns a fresh stream positioned at the start,
 * which the caller must close.
 * </p>
 */
public interface CompressionInput {

    /** @return the stable identifier of this item */
    String id();

    /** @return the uncompressed size in bytes */
    long sizeBytes();

    /** Open a new stream over the full content. */
    InputStream openStream() throws IOException;

    /** Read the full content into memory. */
    byte[] readAll() throws IOException;

    /** @return true if the content lives in a file and should be streamed rather than buffered */
    boolean isStreamBacked();

    /** @return the name used for output files of this item */
    String basename();
}
