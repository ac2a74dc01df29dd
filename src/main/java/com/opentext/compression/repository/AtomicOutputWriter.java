package com.opentext.compression.repository;

import com.opentext.compression.model.CodecId;
import com.opentext.compression.model.CompressionException;
import com.opentext.compression.model.ErrorCode;
import com.opentext.compression.model.OverwritePolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * File-system writer for compressed outputs.
 * <p>
 * Key properties:
 * - Every payload goes to a uniquely named temp file in the target directory first, then is
 *   moved over the target with an atomic rename, so readers never see a partial file.
 * - Multi-target writes stage every entry before the first rename. A staging failure leaves
 *   no new target behind.
 * - With {@code atomicAll}, a failed rename also removes the targets this call already renamed.
 *   A target that existed before and was replaced cannot be restored.
 * - Streaming writes hand {@link StagingSink}s to a producer, so large inputs are compressed
 *   straight to disk.
 * </p>
 * Holds no per-call state; one instance is shared across concurrent batch workers.
 */
@Slf4j
@Repository
public class AtomicOutputWriter {

    private static final String TEMP_SUFFIX = ".tmp";

    @Value("${compression.io.buffer-size:65536}")
    private int bufferSize;

    /** POSIX permission string applied after rename, e.g. {@code rw-r--r--}. Empty means leave as created. */
    @Value("${compression.output.permissions:}")
    private String permissions;

    /**
     * Atomically write one payload to {@code target}.
     *
     * @return false if the target existed and the policy is SKIP
     */
    public boolean writeOne(Path target, byte[] data, OverwritePolicy policy, boolean createDirs) {
        return writeOneWithSink(target, policy, createDirs, sink -> sink.write(data));
    }

    /**
     * Single-target streaming write. The writer stages whatever {@code writer} produces and
     * renames it over the target once the writer returns.
     *
     * @return false if the target existed and the policy is SKIP
     */
    public boolean writeOneWithSink(Path target, OverwritePolicy policy, boolean createDirs, SinkWriter writer) {
        Path fileName = target.getFileName();
        if (fileName == null) {
            throw new CompressionException(ErrorCode.INVALID_CONFIGURATION, "Invalid target filename: " + target);
        }
        Path parent = target.toAbsolutePath().getParent();
        Path dir = prepareDirectory(parent, createDirs);
        Path resolved = dir.resolve(fileName.toString());

        if (Files.exists(resolved) && !admit(resolved, policy)) {
            return false;
        }

        StagingSink sink = openSink(null, dir, fileName.toString(), resolved);
        try {
            writer.writeTo(sink);
            sink.close();
        } catch (IOException | RuntimeException e) {
            sink.closeQuietly();
            deleteQuietly(sink.tempPath());
            throw asWriteFailure("Failed to write temp file for " + resolved, resolved, e);
        }
        commitAll(List.of(sink), true);
        return true;
    }

    /**
     * Write one payload per codec as {@code <dir>/<basename>.<ext>}, all or nothing.
     *
     * @param entries payloads by codec, in write order
     * @return committed target per codec; SKIPped codecs are absent
     */
    public Map<CodecId, Path> writeAll(Path directory, String basename, Map<CodecId, byte[]> entries,
                                       OverwritePolicy policy, boolean atomicAll, boolean createDirs) {
        validateBasename(basename);
        Path dir = prepareDirectory(directory, createDirs);
        Map<CodecId, Path> targets = admittedTargets(dir, basename, entries.keySet(), policy);

        List<StagingSink> staged = new ArrayList<>();
        try {
            for (Map.Entry<CodecId, Path> entry : targets.entrySet()) {
                CodecId codec = entry.getKey();
                StagingSink sink = openSink(codec, dir, basename, entry.getValue());
                staged.add(sink);
                stage(sink, entries.get(codec));
                sink.close();
            }
        } catch (IOException | RuntimeException e) {
            discardAll(staged);
            log.error("Staging failed for {} in {}, no target was touched", basename, dir);
            throw asWriteFailure("Failed to stage outputs for " + basename, dir, e);
        }
        return commitAll(staged, atomicAll);
    }

    /**
     * Streaming variant of {@link #writeAll}: the producer receives one staging sink per admitted
     * codec and writes compressed output into them. Discarded and empty sinks are not published;
     * the rest are renamed into place with the same all-or-nothing rules.
     */
    public <T> CommittedWrite<T> writeAllWithSinks(Path directory, String basename, List<CodecId> codecs,
                                                  OverwritePolicy policy, boolean atomicAll, boolean createDirs,
                                                  SinksProducer<T> producer) {
        validateBasename(basename);
        Path dir = prepareDirectory(directory, createDirs);
        Map<CodecId, Path> targets = admittedTargets(dir, basename, codecs, policy);

        Map<CodecId, StagingSink> sinks = new LinkedHashMap<>();
        T value;
        try {
            for (Map.Entry<CodecId, Path> entry : targets.entrySet()) {
                sinks.put(entry.getKey(), openSink(entry.getKey(), dir, basename, entry.getValue()));
            }
            value = producer.produce(Collections.unmodifiableMap(sinks));
            for (StagingSink sink : sinks.values()) {
                if (!sink.isDiscarded()) {
                    sink.close();
                }
            }
        } catch (IOException | RuntimeException e) {
            discardAll(sinks.values());
            throw asWriteFailure("Failed to stream outputs for " + basename, dir, e);
        }

        List<StagingSink> publishable = new ArrayList<>();
        for (StagingSink sink : sinks.values()) {
            if (sink.isPublishable()) {
                publishable.add(sink);
            } else {
                if (log.isDebugEnabled()) {
                    log.debug("Dropping {} output for {} ({} bytes, discarded={})",
                            sink.codec(), basename, sink.bytesWritten(), sink.isDiscarded());
                }
                deleteQuietly(sink.tempPath());
            }
        }
        return new CommittedWrite<>(value, commitAll(publishable, atomicAll));
    }

    /**
     * Codecs whose {@code <dir>/<basename>.<ext>} target a write with {@code policy} would touch.
     * SKIPped targets are left out; an existing target under FAIL throws as the write would.
     */
    public List<CodecId> admittedCodecs(Path directory, String basename, Collection<CodecId> codecs,
                                        OverwritePolicy policy) {
        validateBasename(basename);
        return new ArrayList<>(admittedTargets(directory, basename, codecs, policy).keySet());
    }

    /** Writes the payload into a staged temp file. Override point for fault injection in tests. */
    protected void stage(StagingSink sink, byte[] data) throws IOException {
        sink.write(data);
    }

    /** Moves a staged temp file over its target. Override point for fault injection in tests. */
    protected void rename(Path temp, Path target) throws IOException {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /**
     * Resolve and ensure the directory exists.
     *
     * @throws CompressionException WRITE_FAILED if missing and not allowed to create, or not writable
     */
    Path prepareDirectory(Path directory, boolean createDirs) {
        if (!Files.isDirectory(directory)) {
            if (!createDirs) {
                throw new CompressionException(ErrorCode.WRITE_FAILED,
                        "Directory does not exist: " + directory, directory, null);
            }
            try {
                Files.createDirectories(directory);
            } catch (IOException e) {
                throw new CompressionException(ErrorCode.WRITE_FAILED,
                        "Failed to create directory: " + directory, directory, e);
            }
        }
        if (!Files.isWritable(directory)) {
            throw new CompressionException(ErrorCode.WRITE_FAILED,
                    "Directory is not writable: " + directory, directory, null);
        }
        return directory;
    }

    private Map<CodecId, Path> admittedTargets(Path dir, String basename, Iterable<CodecId> codecs,
                                               OverwritePolicy policy) {
        Map<CodecId, Path> targets = new LinkedHashMap<>();
        for (CodecId codec : codecs) {
            Path target = dir.resolve(basename + "." + codec.fileExtension());
            if (Files.exists(target) && !admit(target, policy)) {
                continue;
            }
            targets.put(codec, target);
        }
        return targets;
    }

    /** @return true to write over an existing target, false to skip it */
    private static boolean admit(Path existing, OverwritePolicy policy) {
        return switch (policy) {
            case SKIP -> {
                log.debug("Target exists, skipping: {}", existing);
                yield false;
            }
            case FAIL -> throw new CompressionException(ErrorCode.TARGET_ALREADY_EXISTS,
                    "Target already exists: " + existing, existing, null);
            case REPLACE -> true;
        };
    }

    private StagingSink openSink(CodecId codec, Path dir, String basename, Path target) {
        String prefix = "." + target.getFileName() + ".";
        try {
            Path temp = Files.createTempFile(dir, prefix, TEMP_SUFFIX);
            OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp), Math.max(1024, bufferSize));
            return new StagingSink(codec, temp, target, out);
        } catch (IOException e) {
            throw new CompressionException(ErrorCode.WRITE_FAILED,
                    "Failed to create temp file for " + basename + " in " + dir, dir, e);
        }
    }

    /**
     * Rename every staged sink into place. On failure, remaining temp files are removed and,
     * with {@code atomicAll}, the targets renamed by this call are deleted again.
     */
    private Map<CodecId, Path> commitAll(List<StagingSink> staged, boolean atomicAll) {
        Map<CodecId, Path> committed = new LinkedHashMap<>();
        List<Path> renamed = new ArrayList<>();
        for (int i = 0; i < staged.size(); i++) {
            StagingSink sink = staged.get(i);
            try {
                rename(sink.tempPath(), sink.target());
            } catch (IOException | RuntimeException e) {
                CompressionException failure = asWriteFailure(
                        "Failed to move temp file to target: " + sink.target(), sink.target(), e);
                discardAll(staged.subList(i, staged.size()));
                if (atomicAll) {
                    for (Path target : renamed) {
                        rollback(target, failure);
                    }
                }
                log.error("Commit aborted at {}, {} target(s) rolled back", sink.target(),
                        atomicAll ? renamed.size() : 0);
                throw failure;
            }
            renamed.add(sink.target());
            if (sink.codec() != null) {
                committed.put(sink.codec(), sink.target());
            }
            applyPermissions(sink.target());
            log.info("Committed {} ({} bytes)", sink.target(), sink.bytesWritten());
        }
        return committed;
    }

    private void applyPermissions(Path target) {
        if (permissions == null || permissions.isBlank()) {
            return;
        }
        try {
            Set<PosixFilePermission> perms = PosixFilePermissions.fromString(permissions.trim());
            Files.setPosixFilePermissions(target, perms);
        } catch (UnsupportedOperationException e) {
            log.debug("POSIX permissions not supported for {}", target);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to set permissions {} on {}: {}", permissions, target, e.getMessage());
        }
    }

    private static void rollback(Path target, CompressionException failure) {
        try {
            Files.deleteIfExists(target);
            log.debug("Rolled back {}", target);
        } catch (IOException e) {
            failure.addSuppressed(e);
            log.warn("Failed to roll back {}: {}", target, e.getMessage());
        }
    }

    private static void discardAll(Iterable<StagingSink> sinks) {
        for (StagingSink sink : sinks) {
            sink.closeQuietly();
            deleteQuietly(sink.tempPath());
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            if (Files.deleteIfExists(temp)) {
                log.debug("Cleaned up temp file: {}", temp);
            }
        } catch (IOException e) {
            log.warn("Failed to delete temp file {}: {}", temp, e.getMessage());
        }
    }

    private static CompressionException asWriteFailure(String message, Path path, Exception e) {
        if (e instanceof CompressionException ce) {
            return ce;
        }
        return new CompressionException(ErrorCode.WRITE_FAILED, message, path, e);
    }

    static void validateBasename(String basename) {
        if (basename == null || basename.isEmpty() || basename.equals(".") || basename.equals("..")
                || basename.contains("/") || basename.contains("\\")) {
            throw new CompressionException(ErrorCode.INVALID_CONFIGURATION, "Invalid basename: " + basename);
        }
    }
}
