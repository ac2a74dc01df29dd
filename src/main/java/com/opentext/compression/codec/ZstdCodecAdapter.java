package com.opentext.compression.codec;

import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;
import com.opentext.compression.model.CodecId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Zstandard through zstd-jni. Availability depends on the bundled native library loading on
 * this platform; it is probed once with a tiny round trip.
 */
@Slf4j
@Component
public class ZstdCodecAdapter extends AbstractStreamCodecAdapter {

    private volatile Boolean available;

    @Override
    public CodecId codec() {
        return CodecId.ZSTD;
    }

    @Override
    public boolean isAvailable() {
        Boolean result = available;
        if (result == null) {
            result = probe();
            available = result;
        }
        return result;
    }

    private static boolean probe() {
        try {
            byte[] sample = "zstd availability probe".getBytes(StandardCharsets.US_ASCII);
            byte[] restored = Zstd.decompress(Zstd.compress(sample, CodecId.ZSTD.defaultLevel()), sample.length);
            return Arrays.equals(sample, restored);
        } catch (UnsatisfiedLinkError | NoClassDefFoundError | RuntimeException e) {
            log.warn("zstd-jni native library unavailable: {}", e.toString());
            return false;
        }
    }

    @Override
    public byte[] compress(byte[] input, int level) {
        return Zstd.compress(input, level);
    }

    @Override
    protected OutputStream wrapOutputStream(OutputStream out, int level) throws IOException {
        return new ZstdOutputStream(out, level);
    }

    @Override
    protected InputStream wrapInputStream(InputStream in) throws IOException {
        return new ZstdInputStream(in);
    }
}
