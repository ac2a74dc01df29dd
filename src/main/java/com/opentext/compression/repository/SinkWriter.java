package com.opentext.compression.repository;

import java.io.IOException;
import java.io.OutputStream;

/** Streams one payload into a staging sink. */
@FunctionalInterface
public interface SinkWriter {
    void writeTo(OutputStream sink) throws IOException;
}
