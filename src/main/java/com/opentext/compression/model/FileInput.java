package com.opentext.compression.model;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * File-backed input.
 * <p>
 * The path is checked when the input is built, so a missing or unreadable file is reported
 * before any compression starts. Content is never cached; every read goes to the file.
 * </p>
 */
public final class FileInput implements CompressionInput {

    private final String id;
    private final Path path;

    public FileInput(String id, Path path) {
        if (id == null || id.isBlank()) {
            throw CompressionException.invalid("Input id must not be blank");
        }
        if (!Files.exists(path)) {
            throw new CompressionException(ErrorCode.INPUT_UNREADABLE, "File not found: " + path, path, null);
        }
        if (!Files.isRegularFile(path)) {
            throw new CompressionException(ErrorCode.INPUT_UNREADABLE, "Path is not a file: " + path, path, null);
        }
        if (!Files.isReadable(path)) {
            throw new CompressionException(ErrorCode.INPUT_UNREADABLE, "File not readable: " + path, path, null);
        }
        this.id = id;
        this.path = path;
    }

    /** Uses the path itself as the id. */
    public static FileInput of(Path path) {
        return new FileInput(path.toString(), path);
    }

    public Path path() {
        return path;
    }

    /** @return lower-cased extension without the dot, or an empty string */
    public String extension() {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public long sizeBytes() {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to get file size: " + path, e);
        }
    }

    @Override
    public InputStream openStream() throws IOException {
        return Files.newInputStream(path);
    }

    @Override
    public byte[] readAll() throws IOException {
        return Files.readAllBytes(path);
    }

    @Override
    public boolean isStreamBacked() {
        return true;
    }

    @Override
    public String basename() {
        return path.getFileName().toString();
    }

    @Override
    public String toString() {
        return "FileInput[" + id + ", " + path + "]";
    }
}
