package com.opentext.compression.service;

import com.opentext.compression.codec.CodecRegistry;
import com.opentext.compression.model.CodecId;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Picks a content encoding from an {@code Accept-Encoding}-style header.
 * <p>
 * Grammar: comma-separated {@code name[;q=weight]} tokens. Weights are decimals in [0,1] with at
 * most three fractional digits; anything else is read as 1.0 rather than rejecting the header.
 * {@code *} covers every codec not named explicitly, and a weight of 0 rejects the name.
 * </p>
 * An empty result means "send the content uncompressed".
 */
@Component
@RequiredArgsConstructor
public class EncodingNegotiator {

    private static final String WILDCARD = "*";
    private static final String IDENTITY = "identity";
    private static final Pattern QVALUE = Pattern.compile("0(\\.\\d{0,3})?|1(\\.0{0,3})?");

    private final CodecRegistry codecRegistry;

    /** Negotiate against the codecs available on this platform, in declaration order. */
    public Optional<CodecId> negotiate(String header) {
        return negotiate(header, codecRegistry.available());
    }

    /**
     * @param available candidate codecs in server preference order; earlier entries win ties
     */
    public static Optional<CodecId> negotiate(String header, List<CodecId> available) {
        Map<String, Double> weights = parse(header);
        Double wildcard = weights.get(WILDCARD);

        List<Candidate> candidates = new ArrayList<>();
        for (CodecId codec : available) {
            Double weight = weights.getOrDefault(codec.contentEncoding(), wildcard);
            if (weight != null && weight > 0.0) {
                candidates.add(new Candidate(codec, weight));
            }
        }
        // List.sort is stable, so equal weights keep the caller's priority order
        candidates.sort(Comparator.comparingDouble(Candidate::weight).reversed());
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        Candidate best = candidates.get(0);
        Double identity = weights.get(IDENTITY);
        if (identity != null && identity > 0.0 && identity >= best.weight()) {
            return Optional.empty();
        }
        return Optional.of(best.codec());
    }

    /** @return lower-cased coding name to weight; a repeated name keeps its last weight */
    static Map<String, Double> parse(String header) {
        Map<String, Double> weights = new HashMap<>();
        if (header == null || header.isBlank()) {
            return weights;
        }
        for (String token : header.split(",")) {
            String[] parts = token.split(";");
            String name = parts[0].trim().toLowerCase(Locale.ROOT);
            if (name.isEmpty()) {
                continue;
            }
            double weight = 1.0;
            for (int i = 1; i < parts.length; i++) {
                String param = parts[i].trim();
                if (param.length() > 1 && (param.charAt(0) == 'q' || param.charAt(0) == 'Q') && param.charAt(1) == '=') {
                    weight = parseWeight(param.substring(2).trim());
                }
            }
            weights.put(name, weight);
        }
        return weights;
    }

    private static double parseWeight(String raw) {
        if (!QVALUE.matcher(raw).matches()) {
            return 1.0;
        }
        return Double.parseDouble(raw.endsWith(".") ? raw + "0" : raw);
    }

    private record Candidate(CodecId codec, double weight) {
    }
}
