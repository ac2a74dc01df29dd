package com.opentext.compression.codec;

import com.aayushatharva.brotli4j.Brotli4jLoader;
import com.aayushatharva.brotli4j.decoder.BrotliInputStream;
import com.aayushatharva.brotli4j.encoder.BrotliOutputStream;
import com.aayushatharva.brotli4j.encoder.Encoder;
import com.opentext.compression.model.CodecId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Brotli through brotli4j. Needs the platform's native library; when it cannot be loaded the
 * adapter reports itself unavailable instead of failing at startup.
 */
@Slf4j
@Component
public class BrotliCodecAdapter extends AbstractStreamCodecAdapter {

    private volatile Boolean available;

    @Override
    public CodecId codec() {
        return CodecId.BROTLI;
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
            boolean loaded = Brotli4jLoader.isAvailable();
            if (!loaded) {
                log.warn("brotli4j native library unavailable: {}", String.valueOf(Brotli4jLoader.getUnavailabilityCause()));
            }
            return loaded;
        } catch (LinkageError e) {
            log.warn("brotli4j could not be loaded: {}", e.toString());
            return false;
        }
    }

    @Override
    public byte[] compress(byte[] input, int level) throws IOException {
        return Encoder.compress(input, parameters(level));
    }

    @Override
    protected OutputStream wrapOutputStream(OutputStream out, int level) throws IOException {
        return new BrotliOutputStream(out, parameters(level));
    }

    @Override
    protected InputStream wrapInputStream(InputStream in) throws IOException {
        return new BrotliInputStream(in);
    }

    private static Encoder.Parameters parameters(int level) {
        return new Encoder.Parameters().setQuality(level);
    }
}
