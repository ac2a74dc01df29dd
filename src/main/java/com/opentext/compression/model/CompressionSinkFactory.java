package com.opentext.compression.model;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Supplies the caller's destination streams for streaming output. One stream is opened per
 * item and codec; the pipeline closes it once the codec has finished.
 */
@FunctionalInterface
public interface CompressionSinkFactory {
    OutputStream open(String itemId, CodecId codec) throws IOException;
}
