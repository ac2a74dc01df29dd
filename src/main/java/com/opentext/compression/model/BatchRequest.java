package com.opentext.compression.model;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Everything one batch run needs: inputs, the config per item id, the output target, the
 * error policy and the file extensions to leave alone.
 */
public record BatchRequest(List<CompressionInput> inputs, Function<String, ItemConfig> configFor,
                           OutputTarget target, boolean failFast, Set<String> skipExtensions) {

    public BatchRequest {
        inputs = List.copyOf(Objects.requireNonNull(inputs, "inputs"));
        Objects.requireNonNull(configFor, "configFor");
        Objects.requireNonNull(target, "target");
        skipExtensions = skipExtensions == null ? Set.of() : skipExtensions.stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public static BatchRequest inMemory(List<CompressionInput> inputs, ItemConfig config, boolean failFast) {
        return new BatchRequest(inputs, id -> config, OutputTarget.inMemory(), failFast, Set.of());
    }

    public BatchRequest withTarget(OutputTarget newTarget) {
        return new BatchRequest(inputs, configFor, newTarget, failFast, skipExtensions);
    }

    /** Adds extensions to the skip list; earlier entries are kept. */
    public BatchRequest skipping(Set<String> extensions) {
        Set<String> merged = new HashSet<>(skipExtensions);
        merged.addAll(extensions);
        return new BatchRequest(inputs, configFor, target, failFast, merged);
    }

    public BatchRequest skippingAlreadyCompressed() {
        return skipping(PrecompressedExtensions.DEFAULTS);
    }
}
