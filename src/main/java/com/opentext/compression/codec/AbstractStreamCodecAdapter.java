package com.opentext.compression.codec;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Base for adapters whose library exposes compressing/decompressing stream wrappers.
 * Subclasses only provide the wrappers; buffering and byte counting live here.
 */
abstract class AbstractStreamCodecAdapter implements CodecAdapter {

    private static final int COPY_BUFFER_SIZE = 64 * 1024;

    /** Wrap {@code out} so that bytes written to the result are compressed into it. */
    protected abstract OutputStream wrapOutputStream(OutputStream out, int level) throws IOException;

    /** Wrap {@code in} so that reading the result yields decompressed bytes. */
    protected abstract InputStream wrapInputStream(InputStream in) throws IOException;

    @Override
    public byte[] compress(byte[] input, int level) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(64, input.length / 3));
        compress(new ByteArrayInputStream(input), buffer, level);
        return buffer.toByteArray();
    }

    @Override
    public long compress(InputStream input, OutputStream output, int level) throws IOException {
        CountingOutputStream counter = new CountingOutputStream(output);
        // closing the codec stream writes its trailer; the counter keeps the caller's stream open
        try (OutputStream codecStream = wrapOutputStream(counter, level)) {
            byte[] buffer = new byte[COPY_BUFFER_SIZE];
            int read;
            while ((read = input.read(buffer)) != -1) {
                codecStream.write(buffer, 0, read);
            }
        }
        return counter.count;
    }

    @Override
    public byte[] decompress(byte[] compressed) throws IOException {
        try (InputStream in = wrapInputStream(new ByteArrayInputStream(compressed))) {
            return in.readAllBytes();
        }
    }

    @Override
    public String toString() {
        return codec() + " adapter";
    }

    /** Counts bytes and turns close() into flush(). */
    private static final class CountingOutputStream extends FilterOutputStream {
        private long count;

        CountingOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(int b) throws IOException {
            out.write(b);
            count++;
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
            count += len;
        }

        @Override
        public void close() throws IOException {
            out.flush();
        }
    }
}
