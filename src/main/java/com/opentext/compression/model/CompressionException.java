package com.opentext.compression.model;

import lombok.Getter;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Unchecked failure raised by the compression pipeline. The {@link ErrorCode} tells callers
 * which category of problem occurred; the optional path points at the file involved.
 */
@Getter
public class CompressionException extends RuntimeException {

    private final ErrorCode code;
    private final Path path;

    public CompressionException(ErrorCode code, String message) {
        this(code, message, null, null);
    }

    public CompressionException(ErrorCode code, String message, Throwable cause) {
        this(code, message, null, cause);
    }

    public CompressionException(ErrorCode code, String message, Path path, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.path = path;
    }

    public Optional<Path> path() {
        return Optional.ofNullable(path);
    }

    static CompressionException invalid(String message) {
        return new CompressionException(ErrorCode.INVALID_CONFIGURATION, message);
    }
}
