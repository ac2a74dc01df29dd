package com.opentext.compression.codec;

import com.opentext.compression.model.CodecId;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipParameters;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * GZIP through Apache Commons Compress. Pure Java, so always available.
 */
@Component
public class GzipCodecAdapter extends AbstractStreamCodecAdapter {

    @Override
    public CodecId codec() {
        return CodecId.GZIP;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    protected OutputStream wrapOutputStream(OutputStream out, int level) throws IOException {
        GzipParameters parameters = new GzipParameters();
        parameters.setCompressionLevel(level);
        return new GzipCompressorOutputStream(out, parameters);
    }

    @Override
    protected InputStream wrapInputStream(InputStream in) throws IOException {
        return new GzipCompressorInputStream(in, true);
    }
}
