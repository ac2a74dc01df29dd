package com.opentext.compression.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where a batch run puts its compressed output. Chosen once per run.
 */
public sealed interface OutputTarget permits OutputTarget.InMemory, OutputTarget.Directory, OutputTarget.Stream {

    long DEFAULT_MAX_MEMORY_BYTES = 5_000_000L;

    static InMemory inMemory() {
        return new InMemory(DEFAULT_MAX_MEMORY_BYTES);
    }

    static InMemory inMemory(long maxBytesPerItem) {
        return new InMemory(maxBytesPerItem);
    }

    static Directory toDirectory(Path path) {
        return new Directory(path, false, null, OverwritePolicy.FAIL, true);
    }

    static Stream toSinks(CompressionSinkFactory sinkFactory) {
        return new Stream(sinkFactory);
    }

    /** Results keep compressed bytes; inputs above the ceiling fail. */
    record InMemory(long maxBytesPerItem) implements OutputTarget {
        public InMemory {
            if (maxBytesPerItem <= 0) {
                throw CompressionException.invalid("maxBytesPerItem must be positive for in-memory mode");
            }
        }
    }

    /**
     * Results are committed as {@code <basename>.<ext>} files. With {@code keepSourceStructure},
     * a file input's parent directory relative to {@code sourceRoot} (working directory when
     * null) is recreated under {@code path}.
     */
    record Directory(Path path, boolean keepSourceStructure, Path sourceRoot,
                     OverwritePolicy overwritePolicy, boolean atomicAll) implements OutputTarget {
        public Directory {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(overwritePolicy, "overwritePolicy");
        }

        public Directory keepingStructure(Path root) {
            return new Directory(path, true, root, overwritePolicy, atomicAll);
        }

        public Directory withPolicy(OverwritePolicy policy) {
            return new Directory(path, keepSourceStructure, sourceRoot, policy, atomicAll);
        }

        public Directory withAtomicAll(boolean atomic) {
            return new Directory(path, keepSourceStructure, sourceRoot, overwritePolicy, atomic);
        }
    }

    /** Results are written into caller-supplied streams. */
    record Stream(CompressionSinkFactory sinkFactory) implements OutputTarget {
        public Stream {
            Objects.requireNonNull(sinkFactory, "sinkFactory");
        }
    }
}
