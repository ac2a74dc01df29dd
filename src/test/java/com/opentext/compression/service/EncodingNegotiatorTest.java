package com.opentext.compression.service;

import com.opentext.compression.codec.CodecRegistry;
import com.opentext.compression.model.CodecId;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EncodingNegotiatorTest {

    private static final List<CodecId> GZIP_BR = List.of(CodecId.GZIP, CodecId.BROTLI);

    @Test
    void testHighestWeightWins() {
        assertEquals(Optional.of(CodecId.BROTLI), EncodingNegotiator.negotiate("br;q=1.0, gzip;q=0.8", GZIP_BR));
    }

    @Test
    void testAllRefused() {
        assertEquals(Optional.empty(), EncodingNegotiator.negotiate("gzip;q=0, br;q=0", GZIP_BR));
    }

    @Test
    void testWildcardTieKeepsServerPriority() {
        assertEquals(Optional.of(CodecId.GZIP), EncodingNegotiator.negotiate("*;q=0.1", GZIP_BR));
    }

    @Test
    void testPreferredIdentityMeansNoEncoding() {
        assertEquals(Optional.empty(), EncodingNegotiator.negotiate("identity;q=1.0, gzip;q=0.5", GZIP_BR));
        assertEquals(Optional.empty(), EncodingNegotiator.negotiate("identity, gzip", GZIP_BR));
        assertEquals(Optional.of(CodecId.GZIP), EncodingNegotiator.negotiate("identity;q=0.2, gzip", GZIP_BR));
    }

    @Test
    void testEmptyOrMissingHeader() {
        assertEquals(Optional.empty(), EncodingNegotiator.negotiate(null, GZIP_BR));
        assertEquals(Optional.empty(), EncodingNegotiator.negotiate("  ", GZIP_BR));
    }

    @Test
    void testExplicitWeightOverridesWildcard() {
        assertEquals(Optional.of(CodecId.BROTLI), EncodingNegotiator.negotiate("*;q=0.5, gzip;q=0", GZIP_BR));
    }

    @Test
    void testUnsupportedCodingsIgnored() {
        assertEquals(Optional.empty(), EncodingNegotiator.negotiate("deflate, compress", GZIP_BR));
        assertEquals(Optional.of(CodecId.GZIP), EncodingNegotiator.negotiate("zstd, gzip;q=0.4", GZIP_BR));
    }

    @Test
    void testMalformedWeightReadAsOne() {
        Map<String, Double> weights = EncodingNegotiator.parse("gzip;q=abc, BR;Q=0.25, zstd;q=1.5");
        assertEquals(1.0, weights.get("gzip"));
        assertEquals(0.25, weights.get("br"));
        assertEquals(1.0, weights.get("zstd"));
    }

    @Test
    void testInstanceUsesAvailableCodecs() {
        EncodingNegotiator negotiator = new EncodingNegotiator(CodecRegistry.of(
                FakeCodecAdapter.working(CodecId.GZIP), FakeCodecAdapter.unavailable(CodecId.BROTLI)));
        assertEquals(Optional.of(CodecId.GZIP), negotiator.negotiate("br, gzip;q=0.1"));
    }
}
