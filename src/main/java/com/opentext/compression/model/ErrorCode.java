package com.opentext.compression.model;

/**
 * Machine-readable failure categories attached to every {@link CompressionException}.
 */
public enum ErrorCode {
    /** Input exceeds the configured byte ceiling. */
    PAYLOAD_TOO_LARGE,
    /** Input exceeds the in-memory output ceiling. */
    MEMORY_LIMIT_EXCEEDED,
    /** The codec's library is not present or failed to load. */
    CODEC_UNAVAILABLE,
    COMPRESSION_FAILED,
    /** Target exists and the overwrite policy is FAIL. */
    TARGET_ALREADY_EXISTS,
    /** I/O error while staging, renaming or preparing a directory. */
    WRITE_FAILED,
    INPUT_UNREADABLE,
    /** Programmer error caught at construction time (bad level, empty set, bad basename...). */
    INVALID_CONFIGURATION
}
