package com.opentext.compression.service;

import com.opentext.compression.model.BatchResult;
import com.opentext.compression.model.BatchSummary;
import com.opentext.compression.model.BatchSummary.CodecStats;
import com.opentext.compression.model.CodecId;
import com.opentext.compression.model.ItemResult;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Derives statistics from a finished batch. Read-only; the batch is never modified.
 */
@Service
public class ResultAggregator {

    public BatchSummary summarize(BatchResult batch) {
        int total = 0;
        int ok = 0;
        long originalBytes = 0;
        for (ItemResult item : batch) {
            total++;
            if (item.isOk()) {
                ok++;
            }
            originalBytes += item.originalSize();
        }

        Map<CodecId, CodecStats> perCodec = new EnumMap<>(CodecId.class);
        for (CodecId codec : CodecId.values()) {
            CodecStats stats = codecStats(batch, codec);
            if (stats != null) {
                perCodec.put(codec, stats);
            }
        }
        return new BatchSummary(total, ok, total - ok, originalBytes, perCodec);
    }

    private static CodecStats codecStats(BatchResult batch, CodecId codec) {
        List<Double> ratios = new ArrayList<>();
        List<Double> times = new ArrayList<>();
        long original = 0;
        long compressed = 0;
        for (ItemResult item : batch) {
            if (!item.has(codec)) {
                continue;
            }
            ratios.add(item.ratio(codec));
            times.add(item.elapsedMs(codec));
            original += item.originalSize();
            compressed += item.size(codec);
        }
        if (ratios.isEmpty()) {
            return null;
        }
        Collections.sort(ratios);
        Collections.sort(times);
        double totalTime = times.stream().mapToDouble(Double::doubleValue).sum();
        return new CodecStats(codec, ratios.size(), original, compressed,
                average(ratios), percentile(ratios, 50), percentile(ratios, 95),
                totalTime / times.size(), percentile(times, 50), percentile(times, 95), totalTime);
    }

    /**
     * Nearest-rank percentile over an ascending list: element {@code ceil(n * p / 100) - 1},
     * clamped to the first element. An empty list yields 0.
     */
    static double percentile(List<Double> sorted, int percentile) {
        if (sorted.isEmpty()) {
            return 0.0;
        }
        int index = (int) Math.ceil(sorted.size() * percentile / 100.0) - 1;
        return sorted.get(Math.min(sorted.size() - 1, Math.max(0, index)));
    }

    private static double average(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
