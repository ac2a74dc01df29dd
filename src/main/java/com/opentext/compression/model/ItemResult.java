package com.opentext.compression.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Terminal, immutable result of compressing one item with every configured codec.
 */
public final class ItemResult {

    private final String id;
    private final long originalSize;
    private final boolean success;
    private final Map<CodecId, CodecOutcome> perCodec;
    private final CompressionException itemError;

    public ItemResult(String id, long originalSize, boolean success,
                      Map<CodecId, CodecOutcome> perCodec, CompressionException itemError) {
        this.id = id;
        this.originalSize = originalSize;
        this.success = success;
        this.perCodec = Collections.unmodifiableMap(new LinkedHashMap<>(perCodec));
        this.itemError = itemError;
    }

    /** An item that failed as a whole before any codec ran. */
    public static ItemResult failed(String id, long originalSize, CompressionException error) {
        return new ItemResult(id, originalSize, false, Map.of(), error);
    }

    public String id() {
        return id;
    }

    public long originalSize() {
        return originalSize;
    }

    public boolean isSuccess() {
        return success;
    }

    /** @return true when the item succeeded and no codec, optional or not, reported an error */
    public boolean isOk() {
        return success && errors().isEmpty();
    }

    public Map<CodecId, CodecOutcome> perCodec() {
        return perCodec;
    }

    public Optional<CompressionException> itemError() {
        return Optional.ofNullable(itemError);
    }

    /** @return true if the codec produced output for this item */
    public boolean has(CodecId codec) {
        CodecOutcome outcome = perCodec.get(codec);
        return outcome != null && outcome.isSuccess();
    }

    public byte[] data(CodecId codec) {
        return successful(codec).bytes()
                .orElseThrow(() -> new NoSuchElementException("No in-memory data for " + codec + " on " + id));
    }

    public Optional<Path> location(CodecId codec) {
        return has(codec) ? perCodec.get(codec).path() : Optional.empty();
    }

    public long size(CodecId codec) {
        return successful(codec).sizeBytes();
    }

    /** Compressed size divided by original size; 0 for an empty original. */
    public double ratio(CodecId codec) {
        if (originalSize == 0) {
            return 0.0;
        }
        return (double) size(codec) / originalSize;
    }

    public long savedBytes(CodecId codec) {
        return originalSize - size(codec);
    }

    public double elapsedMs(CodecId codec) {
        CodecOutcome outcome = perCodec.get(codec);
        return outcome == null ? 0.0 : outcome.elapsedMs();
    }

    public Optional<CompressionException> error(CodecId codec) {
        CodecOutcome outcome = perCodec.get(codec);
        return outcome == null ? Optional.empty() : Optional.ofNullable(outcome.error());
    }

    /** Per-codec errors in attempt order. The item-level error is reported by {@link #itemError()}. */
    public Map<CodecId, CompressionException> errors() {
        Map<CodecId, CompressionException> errors = new LinkedHashMap<>();
        perCodec.forEach((codec, outcome) -> {
            if (!outcome.isSuccess()) {
                errors.put(codec, outcome.error());
            }
        });
        return errors;
    }

    /** The first error recorded for a failed item, item-level first. */
    public Optional<CompressionException> failureReason() {
        if (success) {
            return Optional.empty();
        }
        if (itemError != null) {
            return Optional.of(itemError);
        }
        return errors().values().stream().findFirst();
    }

    /** Copy of this result with the given outcomes replacing existing ones. */
    public ItemResult withOutcomes(Map<CodecId, CodecOutcome> replacements) {
        Map<CodecId, CodecOutcome> merged = new LinkedHashMap<>(perCodec);
        merged.putAll(replacements);
        return new ItemResult(id, originalSize, success, merged, itemError);
    }

    private CodecOutcome successful(CodecId codec) {
        CodecOutcome outcome = perCodec.get(codec);
        if (outcome == null || !outcome.isSuccess()) {
            throw new NoSuchElementException("No output for " + codec + " on " + id);
        }
        return outcome;
    }

    @Override
    public String toString() {
        return "ItemResult[" + id + ", success=" + success + ", codecs=" + perCodec.keySet() + "]";
    }
}
