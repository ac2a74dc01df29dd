package com.opentext.compression.codec;

import com.opentext.compression.model.CodecId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the adapter for each {@link CodecId}. Spring hands in every {@link CodecAdapter}
 * bean; tests build it with whatever adapters they need. A codec without an adapter counts
 * as unavailable.
 */
@Slf4j
@Component
public class CodecRegistry {

    private final Map<CodecId, CodecAdapter> adapters;

    public CodecRegistry(List<CodecAdapter> adapters) {
        Map<CodecId, CodecAdapter> byCodec = new EnumMap<>(CodecId.class);
        for (CodecAdapter adapter : adapters) {
            CodecAdapter previous = byCodec.put(adapter.codec(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two adapters registered for " + adapter.codec()
                        + ": " + previous + ", " + adapter);
            }
        }
        this.adapters = Collections.unmodifiableMap(byCodec);
        if (log.isDebugEnabled()) {
            log.debug("Registered codec adapters: {}", this.adapters.keySet());
        }
    }

    public static CodecRegistry of(CodecAdapter... adapters) {
        return new CodecRegistry(List.of(adapters));
    }

    /** Registry with the three library-backed adapters. */
    public static CodecRegistry standard() {
        return of(new GzipCodecAdapter(), new BrotliCodecAdapter(), new ZstdCodecAdapter());
    }

    public Optional<CodecAdapter> adapter(CodecId codec) {
        return Optional.ofNullable(adapters.get(codec));
    }

    public boolean isAvailable(CodecId codec) {
        CodecAdapter adapter = adapters.get(codec);
        return adapter != null && adapter.isAvailable();
    }

    /** Available codecs in declaration order. */
    public List<CodecId> available() {
        List<CodecId> result = new ArrayList<>();
        for (CodecId codec : CodecId.values()) {
            if (isAvailable(codec)) {
                result.add(codec);
            }
        }
        return result;
    }
}
