package com.opentext.compression.model;

import java.util.Objects;

/**
 * One codec at one level. The level is validated on construction, so an instance is always
 * usable. A non-required spec does not block item success when its codec fails.
 */
public record AlgorithmSpec(CodecId codec, int level, boolean required) {

    public AlgorithmSpec {
        Objects.requireNonNull(codec, "codec");
        codec.validateLevel(level);
    }

    public static AlgorithmSpec of(CodecId codec, int level) {
        return new AlgorithmSpec(codec, level, true);
    }

    public static AlgorithmSpec of(CodecId codec) {
        return new AlgorithmSpec(codec, codec.defaultLevel(), true);
    }

    public static AlgorithmSpec optional(CodecId codec, int level) {
        return new AlgorithmSpec(codec, level, false);
    }
}
