package com.opentext.compression.model;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Buffer-backed input. The bytes are copied on construction and on every read.
 */
public final class DataInput implements CompressionInput {

    private final String id;
    private final byte[] data;

    public DataInput(String id, byte[] data) {
        if (id == null || id.isBlank()) {
            throw CompressionException.invalid("Input id must not be blank");
        }
        this.id = id;
        this.data = Objects.requireNonNull(data, "data").clone();
    }

    public static DataInput of(String id, String text) {
        return new DataInput(id, text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public long sizeBytes() {
        return data.length;
    }

    @Override
    public InputStream openStream() {
        return new ByteArrayInputStream(data);
    }

    @Override
    public byte[] readAll() {
        return data.clone();
    }

    @Override
    public boolean isStreamBacked() {
        return false;
    }

    @Override
    public String basename() {
        return id;
    }

    @Override
    public String toString() {
        return "DataInput[" + id + ", " + data.length + " bytes]";
    }
}
