package com.opentext.compression.model;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * What happened when one codec ran against one item.
 * <p>
 * A successful outcome carries either the compressed bytes (in-memory output) or the path the
 * bytes were committed to (directory output); streamed outcomes carry neither. A failed outcome
 * carries only the error.
 * </p>
 * The buffer is copied on the way in and out, so a returned outcome cannot be changed.
 */
public record CodecOutcome(byte[] data, Path location, long sizeBytes, double elapsedMs,
                           CompressionException error) {

    public CodecOutcome {
        data = data == null ? null : data.clone();
    }

    public static CodecOutcome inMemory(byte[] data, double elapsedMs) {
        return new CodecOutcome(data, null, data.length, elapsedMs, null);
    }

    public static CodecOutcome streamed(long sizeBytes, double elapsedMs) {
        return new CodecOutcome(null, null, sizeBytes, elapsedMs, null);
    }

    public static CodecOutcome failed(CompressionException error, double elapsedMs) {
        return new CodecOutcome(null, null, 0, elapsedMs, error);
    }

    /** Same outcome, pointing at the file it was committed to, with the buffer released. */
    public CodecOutcome committedTo(Path target) {
        return new CodecOutcome(null, target, sizeBytes, elapsedMs, error);
    }

    @Override
    public byte[] data() {
        return data == null ? null : data.clone();
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<byte[]> bytes() {
        return Optional.ofNullable(data).map(byte[]::clone);
    }

    public Optional<Path> path() {
        return Optional.ofNullable(location);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CodecOutcome other)) {
            return false;
        }
        return sizeBytes == other.sizeBytes
                && Double.compare(elapsedMs, other.elapsedMs) == 0
                && Arrays.equals(data, other.data)
                && Objects.equals(location, other.location)
                && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(location, sizeBytes, elapsedMs, error) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "CodecOutcome[" + (isSuccess() ? sizeBytes + " bytes" : "error=" + error.getMessage())
                + (location != null ? ", location=" + location : "")
                + ", elapsedMs=" + elapsedMs + "]";
    }
}
