package com.opentext.compression.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only statistics derived from a {@link BatchResult}.
 *
 * @param perCodec statistics for every codec that produced output for at least one item
 */
public record BatchSummary(int totalItems, int successCount, int failureCount, long totalOriginalBytes,
                           Map<CodecId, CodecStats> perCodec) {

    public BatchSummary {
        perCodec = Collections.unmodifiableMap(perCodec.isEmpty()
                ? new EnumMap<>(CodecId.class) : new EnumMap<>(perCodec));
    }

    public double successRate() {
        return totalItems == 0 ? 0.0 : (double) successCount / totalItems;
    }

    public Optional<CodecStats> codec(CodecId codec) {
        return Optional.ofNullable(perCodec.get(codec));
    }

    /**
     * Aggregates for one codec over the items it succeeded on. Ratios are compressed/original.
     */
    public record CodecStats(CodecId codec, int itemCount, long originalBytes, long compressedBytes,
                             double averageRatio, double medianRatio, double p95Ratio,
                             double averageTimeMs, double medianTimeMs, double p95TimeMs, double totalTimeMs) {

        public long bytesSaved() {
            return originalBytes - compressedBytes;
        }
    }
}
