package com.opentext.compression.repository;

import com.opentext.compression.model.CodecId;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a streaming multi-target write: the producer's value and the targets that were
 * renamed into place, by codec.
 */
public record CommittedWrite<T>(T value, Map<CodecId, Path> committed) {

    public CommittedWrite {
        committed = Collections.unmodifiableMap(new LinkedHashMap<>(committed));
    }
}
