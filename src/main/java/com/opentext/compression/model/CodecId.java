package com.opentext.compression.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Supported codecs with their static metadata: content-encoding token, file extension and
 * valid level range.
 */
public enum CodecId {
    GZIP("gzip", "gz", 1, 9, 6),
    BROTLI("br", "br", 0, 11, 4),
    ZSTD("zstd", "zst", 1, 22, 3);

    private final String contentEncoding;
    private final String fileExtension;
    private final int minLevel;
    private final int maxLevel;
    private final int defaultLevel;

    CodecId(String contentEncoding, String fileExtension, int minLevel, int maxLevel, int defaultLevel) {
        this.contentEncoding = contentEncoding;
        this.fileExtension = fileExtension;
        this.minLevel = minLevel;
        this.maxLevel = maxLevel;
        this.defaultLevel = defaultLevel;
    }

    public String contentEncoding() {
        return contentEncoding;
    }

    public String fileExtension() {
        return fileExtension;
    }

    public int minLevel() {
        return minLevel;
    }

    public int maxLevel() {
        return maxLevel;
    }

    public int defaultLevel() {
        return defaultLevel;
    }

    public boolean isValidLevel(int level) {
        return level >= minLevel && level <= maxLevel;
    }

    /** @throws CompressionException with INVALID_CONFIGURATION when the level is out of range */
    public void validateLevel(int level) {
        if (!isValidLevel(level)) {
            throw CompressionException.invalid(String.format(
                    "%s level out of range: level=%d, allowed=[%d..%d]", name(), level, minLevel, maxLevel));
        }
    }

    /** Lookup by content-encoding token, case-insensitive. */
    public static Optional<CodecId> fromContentEncoding(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        for (CodecId id : values()) {
            if (id.contentEncoding.equals(normalized)) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }
}
