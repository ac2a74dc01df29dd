package com.opentext.compression.model;

import java.util.Locale;

/** What a writer does when the target file already exists. */
public enum OverwritePolicy {
    FAIL,
    REPLACE,
    SKIP;

    /** Parse a configuration value; null means FAIL. */
    public static OverwritePolicy fromOption(String value) {
        if (value == null || value.isBlank()) {
            return FAIL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new CompressionException(ErrorCode.INVALID_CONFIGURATION, "Invalid overwrite policy: " + value, e);
        }
    }
}
