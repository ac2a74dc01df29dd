package com.opentext.compression.model;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Per-item compression settings: which codecs to run and an optional input byte ceiling.
 * Immutable and safe to share across concurrent compressions.
 */
public record ItemConfig(AlgorithmSet algorithms, Long maxBytes) {

    public ItemConfig {
        Objects.requireNonNull(algorithms, "algorithms");
        if (maxBytes != null && maxBytes < 0) {
            throw CompressionException.invalid("maxBytes must not be negative: " + maxBytes);
        }
    }

    public static ItemConfig of(AlgorithmSet algorithms) {
        return new ItemConfig(algorithms, null);
    }

    public static ItemConfig of(AlgorithmSet algorithms, long maxBytes) {
        return new ItemConfig(algorithms, maxBytes);
    }

    public OptionalLong limit() {
        return maxBytes == null ? OptionalLong.empty() : OptionalLong.of(maxBytes);
    }
}
