package com.opentext.compression.repository;

import com.opentext.compression.model.CodecId;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;

/**
 * Output stream backed by a temp file next to its final target.
 * <p>
 * Producers write compressed bytes into the sink; the writer decides afterwards whether the
 * temp file is renamed into place. A producer calls {@link #discard()} to drop output it knows
 * is bad; a sink that never received a byte is dropped too.
 * </p>
 */
@Slf4j
public final class StagingSink extends OutputStream {

    private final CodecId codec;
    private final Path tempPath;
    private final Path target;
    private final OutputStream delegate;
    private long bytesWritten;
    private boolean discarded;
    private boolean closed;

    StagingSink(CodecId codec, Path tempPath, Path target, OutputStream delegate) {
        this.codec = codec;
        this.tempPath = tempPath;
        this.target = target;
        this.delegate = delegate;
    }

    public CodecId codec() {
        return codec;
    }

    public long bytesWritten() {
        return bytesWritten;
    }

    public boolean isDiscarded() {
        return discarded;
    }

    Path tempPath() {
        return tempPath;
    }

    Path target() {
        return target;
    }

    /** Drop everything written so far; the target will not be published. */
    public void discard() {
        discarded = true;
        closeQuietly();
    }

    /** @return true if the writer should publish this sink */
    boolean isPublishable() {
        return !discarded && bytesWritten > 0;
    }

    @Override
    public void write(int b) throws IOException {
        ensureWritable();
        delegate.write(b);
        bytesWritten++;
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        ensureWritable();
        delegate.write(b, off, len);
        bytesWritten += len;
    }

    @Override
    public void flush() throws IOException {
        if (!closed) {
            delegate.flush();
        }
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            delegate.close();
        }
    }

    void closeQuietly() {
        try {
            close();
        } catch (IOException e) {
            log.warn("Failed to close staging file {}: {}", tempPath, e.getMessage());
        }
    }

    private void ensureWritable() throws IOException {
        if (discarded) {
            throw new IOException("Sink for " + codec + " was discarded");
        }
        if (closed) {
            throw new IOException("Sink for " + codec + " is closed");
        }
    }
}
