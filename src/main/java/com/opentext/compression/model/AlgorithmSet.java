package com.opentext.compression.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, ordered set of {@link AlgorithmSpec}s, unique by codec.
 * <p>
 * Iteration order is insertion order. When the same codec is given twice the later spec
 * replaces the earlier one but keeps its original position. A set is never empty.
 * </p>
 */
public final class AlgorithmSet {

    private final Map<CodecId, AlgorithmSpec> specs;

    private AlgorithmSet(Map<CodecId, AlgorithmSpec> specs) {
        if (specs.isEmpty()) {
            throw CompressionException.invalid("At least one algorithm required");
        }
        this.specs = Collections.unmodifiableMap(specs);
    }

    public static AlgorithmSet of(AlgorithmSpec... specs) {
        return of(List.of(specs));
    }

    public static AlgorithmSet of(Collection<AlgorithmSpec> specs) {
        Map<CodecId, AlgorithmSpec> normalized = new LinkedHashMap<>();
        for (AlgorithmSpec spec : specs) {
            normalized.put(spec.codec(), spec);
        }
        return new AlgorithmSet(normalized);
    }

    /** Every codec at its default level. */
    public static AlgorithmSet defaults() {
        List<AlgorithmSpec> all = new ArrayList<>();
        for (CodecId id : CodecId.values()) {
            all.add(AlgorithmSpec.of(id));
        }
        return of(all);
    }

    public static AlgorithmSet gzip(int level) {
        return of(AlgorithmSpec.of(CodecId.GZIP, level));
    }

    public static AlgorithmSet brotli(int level) {
        return of(AlgorithmSpec.of(CodecId.BROTLI, level));
    }

    public static AlgorithmSet zstd(int level) {
        return of(AlgorithmSpec.of(CodecId.ZSTD, level));
    }

    /** New set where {@code other}'s entries override this set's on conflict. */
    public AlgorithmSet merge(AlgorithmSet other) {
        Map<CodecId, AlgorithmSpec> merged = new LinkedHashMap<>(specs);
        merged.putAll(other.specs);
        return new AlgorithmSet(merged);
    }

    public boolean has(CodecId codec) {
        return specs.containsKey(codec);
    }

    public Optional<AlgorithmSpec> get(CodecId codec) {
        return Optional.ofNullable(specs.get(codec));
    }

    public int levelOf(CodecId codec) {
        AlgorithmSpec spec = specs.get(codec);
        if (spec == null) {
            throw new IllegalArgumentException("Algorithm not in set: " + codec);
        }
        return spec.level();
    }

    public List<AlgorithmSpec> specs() {
        return List.copyOf(specs.values());
    }

    public List<CodecId> codecs() {
        return List.copyOf(specs.keySet());
    }

    public int size() {
        return specs.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AlgorithmSet other && specs.equals(other.specs);
    }

    @Override
    public int hashCode() {
        return specs.hashCode();
    }

    @Override
    public String toString() {
        return "AlgorithmSet" + specs.values();
    }
}
