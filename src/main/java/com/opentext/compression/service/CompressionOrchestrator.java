package com.opentext.compression.service;

import com.opentext.compression.codec.CodecAdapter;
import com.opentext.compression.codec.CodecRegistry;
import com.opentext.compression.model.AlgorithmSpec;
import com.opentext.compression.model.CodecId;
import com.opentext.compression.model.CodecOutcome;
import com.opentext.compression.model.CompressionException;
import com.opentext.compression.model.CompressionInput;
import com.opentext.compression.model.ErrorCode;
import com.opentext.compression.model.ItemConfig;
import com.opentext.compression.model.ItemResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Compresses one item with every codec in its {@link ItemConfig}.
 * <p>
 * Size ceilings are checked once per item before any codec runs. Each codec then runs in
 * configuration order, timed and isolated: in graceful mode a failing codec is recorded and the
 * next one still runs; in fail-fast mode the first failure is thrown.
 * </p>
 * Stateless; safe to call concurrently for different items.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompressionOrchestrator {

    private final CodecRegistry codecRegistry;

    /** Compress into memory; every successful outcome carries its bytes. */
    public ItemResult compressItem(CompressionInput input, ItemConfig config, boolean failFast) {
        return compressItem(input, config, failFast, OptionalLong.empty());
    }

    /**
     * Compress into memory, additionally failing the item when its size exceeds
     * {@code memoryCeiling}.
     */
    public ItemResult compressItem(CompressionInput input, ItemConfig config, boolean failFast,
                                   OptionalLong memoryCeiling) {
        return compressInMemory(input, config, failFast, memoryCeiling, config.algorithms().specs());
    }

    /**
     * Compress into memory with only the configured codecs listed in {@code codecs}. The others
     * are not attempted and do not count towards success.
     */
    public ItemResult compressItem(CompressionInput input, ItemConfig config, boolean failFast,
                                   Collection<CodecId> codecs) {
        List<AlgorithmSpec> attempted = config.algorithms().specs().stream()
                .filter(spec -> codecs.contains(spec.codec()))
                .toList();
        return compressInMemory(input, config, failFast, OptionalLong.empty(), attempted);
    }

    private ItemResult compressInMemory(CompressionInput input, ItemConfig config, boolean failFast,
                                        OptionalLong memoryCeiling, List<AlgorithmSpec> attempted) {
        ItemCheck check = checkItem(input, config, memoryCeiling, failFast);
        if (check.failure() != null) {
            return check.failure();
        }

        Map<CodecId, CodecOutcome> perCodec = new LinkedHashMap<>();
        for (AlgorithmSpec spec : attempted) {
            long start = System.nanoTime();
            try {
                CodecAdapter adapter = requireAvailable(spec.codec());
                byte[] compressed = compressToBytes(adapter, input, spec.level());
                perCodec.put(spec.codec(), CodecOutcome.inMemory(compressed, elapsedMs(start)));
                logOutcome(input, spec, compressed.length, check.originalSize(), start);
            } catch (Exception | LinkageError e) {
                perCodec.put(spec.codec(), codecFailure(input, spec, e, start, failFast));
            }
        }
        return assemble(input.id(), check.originalSize(), attempted, perCodec);
    }

    /**
     * Compress each configured codec straight into its sink. Codecs without a sink are not
     * attempted and do not count towards success. Sinks are flushed, never closed.
     */
    public ItemResult compressItemToSinks(CompressionInput input, ItemConfig config,
                                          Map<CodecId, ? extends OutputStream> sinks, boolean failFast) {
        ItemCheck check = checkItem(input, config, OptionalLong.empty(), failFast);
        if (check.failure() != null) {
            return check.failure();
        }

        Map<CodecId, CodecOutcome> perCodec = new LinkedHashMap<>();
        List<AlgorithmSpec> attempted = config.algorithms().specs().stream()
                .filter(spec -> sinks.containsKey(spec.codec()))
                .toList();
        for (AlgorithmSpec spec : attempted) {
            long start = System.nanoTime();
            try {
                CodecAdapter adapter = requireAvailable(spec.codec());
                OutputStream sink = sinks.get(spec.codec());
                long written;
                try (InputStream in = input.openStream()) {
                    written = adapter.compress(in, sink, spec.level());
                }
                sink.flush();
                perCodec.put(spec.codec(), CodecOutcome.streamed(written, elapsedMs(start)));
                logOutcome(input, spec, written, check.originalSize(), start);
            } catch (Exception | LinkageError e) {
                perCodec.put(spec.codec(), codecFailure(input, spec, e, start, failFast));
            }
        }
        return assemble(input.id(), check.originalSize(), attempted, perCodec);
    }

    private ItemCheck checkItem(CompressionInput input, ItemConfig config, OptionalLong memoryCeiling,
                                boolean failFast) {
        long originalSize;
        try {
            originalSize = input.sizeBytes();
        } catch (UncheckedIOException e) {
            return new ItemCheck(0, itemFailure(input, 0, new CompressionException(ErrorCode.INPUT_UNREADABLE,
                    "Failed to read size of " + input.id(), e), failFast));
        }

        OptionalLong limit = config.limit();
        if (limit.isPresent() && originalSize > limit.getAsLong()) {
            return new ItemCheck(originalSize, itemFailure(input, originalSize,
                    new CompressionException(ErrorCode.PAYLOAD_TOO_LARGE, String.format(
                            "Input size (%d bytes) exceeds limit (%d bytes)", originalSize, limit.getAsLong())),
                    failFast));
        }
        if (memoryCeiling.isPresent() && originalSize > memoryCeiling.getAsLong()) {
            return new ItemCheck(originalSize, itemFailure(input, originalSize,
                    new CompressionException(ErrorCode.MEMORY_LIMIT_EXCEEDED, String.format(
                            "Input size (%d bytes) exceeds in-memory limit (%d bytes); write to a directory instead",
                            originalSize, memoryCeiling.getAsLong())),
                    failFast));
        }
        return new ItemCheck(originalSize, null);
    }

    private static ItemResult itemFailure(CompressionInput input, long originalSize, CompressionException error,
                                          boolean failFast) {
        if (failFast) {
            throw error;
        }
        log.warn("Item {} failed before compression: {}", input.id(), error.getMessage());
        return ItemResult.failed(input.id(), originalSize, error);
    }

    private CodecAdapter requireAvailable(CodecId codec) {
        CodecAdapter adapter = codecRegistry.adapter(codec).orElseThrow(() ->
                new CompressionException(ErrorCode.CODEC_UNAVAILABLE, "No adapter registered for " + codec));
        if (!adapter.isAvailable()) {
            throw new CompressionException(ErrorCode.CODEC_UNAVAILABLE,
                    "Codec " + codec + " is not available on this platform");
        }
        return adapter;
    }

    /** Streams file-backed inputs through the codec so the input is never buffered whole. */
    private static byte[] compressToBytes(CodecAdapter adapter, CompressionInput input, int level)
            throws IOException {
        if (input.isStreamBacked() && adapter.supportsStreaming()) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            try (InputStream in = input.openStream()) {
                adapter.compress(in, buffer, level);
            }
            return buffer.toByteArray();
        }
        return adapter.compress(input.readAll(), level);
    }

    private static CodecOutcome codecFailure(CompressionInput input, AlgorithmSpec spec, Throwable e, long start,
                                             boolean failFast) {
        CompressionException error = toCompressionException(spec.codec(), e);
        if (failFast) {
            log.error("{} failed for {}, aborting item", spec.codec(), input.id());
            throw error;
        }
        log.warn("{} failed for {}: {}", spec.codec(), input.id(), error.getMessage());
        return CodecOutcome.failed(error, elapsedMs(start));
    }

    private static CompressionException toCompressionException(CodecId codec, Throwable e) {
        if (e instanceof CompressionException ce) {
            return ce;
        }
        if (e instanceof LinkageError) {
            return new CompressionException(ErrorCode.CODEC_UNAVAILABLE,
                    "Codec " + codec + " library failed to load: " + e.getMessage(), e);
        }
        return new CompressionException(ErrorCode.COMPRESSION_FAILED,
                codec + " compression failed: " + e.getMessage(), e);
    }

    /**
     * Success needs every required attempted codec to succeed, and at least one success when
     * anything was attempted.
     */
    private static ItemResult assemble(String id, long originalSize, List<AlgorithmSpec> attempted,
                                       Map<CodecId, CodecOutcome> perCodec) {
        boolean requiredOk = attempted.stream()
                .filter(AlgorithmSpec::required)
                .allMatch(spec -> perCodec.containsKey(spec.codec()) && perCodec.get(spec.codec()).isSuccess());
        boolean anySucceeded = perCodec.values().stream().anyMatch(CodecOutcome::isSuccess);
        boolean success = requiredOk && (attempted.isEmpty() || anySucceeded);
        return new ItemResult(id, originalSize, success, perCodec, null);
    }

    private static void logOutcome(CompressionInput input, AlgorithmSpec spec, long compressedSize,
                                   long originalSize, long start) {
        if (log.isDebugEnabled()) {
            log.debug("{} level {} compressed {}: {} -> {} bytes in {} ms", spec.codec(), spec.level(),
                    input.id(), originalSize, compressedSize, String.format("%.2f", elapsedMs(start)));
        }
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private record ItemCheck(long originalSize, ItemResult failure) {
    }
}
