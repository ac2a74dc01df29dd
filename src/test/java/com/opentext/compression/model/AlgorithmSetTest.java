package com.opentext.compression.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AlgorithmSetTest {

    @Test
    void testDefaultsCoverEveryCodecAtDefaultLevel() {
        AlgorithmSet set = AlgorithmSet.defaults();
        assertEquals(List.of(CodecId.GZIP, CodecId.BROTLI, CodecId.ZSTD), set.codecs());
        assertEquals(6, set.levelOf(CodecId.GZIP));
        assertEquals(4, set.levelOf(CodecId.BROTLI));
        assertEquals(3, set.levelOf(CodecId.ZSTD));
    }

    @Test
    void testDuplicateCodecKeepsPositionTakesLastLevel() {
        AlgorithmSet set = AlgorithmSet.of(
                AlgorithmSpec.of(CodecId.ZSTD, 5),
                AlgorithmSpec.of(CodecId.GZIP, 1),
                AlgorithmSpec.of(CodecId.ZSTD, 19));
        assertEquals(List.of(CodecId.ZSTD, CodecId.GZIP), set.codecs());
        assertEquals(19, set.levelOf(CodecId.ZSTD));
        assertEquals(2, set.size());
    }

    @Test
    void testMergeOtherWins() {
        AlgorithmSet merged = AlgorithmSet.gzip(1).merge(AlgorithmSet.of(
                AlgorithmSpec.of(CodecId.GZIP, 9), AlgorithmSpec.of(CodecId.BROTLI, 11)));
        assertEquals(9, merged.levelOf(CodecId.GZIP));
        assertTrue(merged.has(CodecId.BROTLI));
        assertFalse(merged.has(CodecId.ZSTD));
        assertTrue(merged.get(CodecId.ZSTD).isEmpty());
    }

    @Test
    void testSingleCodecFactories() {
        assertEquals(List.of(CodecId.BROTLI), AlgorithmSet.brotli(11).codecs());
        assertEquals(19, AlgorithmSet.zstd(19).levelOf(CodecId.ZSTD));
        assertTrue(AlgorithmSet.gzip(1).get(CodecId.GZIP).orElseThrow().required());
        assertFalse(CodecId.GZIP.isValidLevel(0));
    }

    @Test
    void testEmptySetRejected() {
        CompressionException e = assertThrows(CompressionException.class, () -> AlgorithmSet.of(List.of()));
        assertEquals(ErrorCode.INVALID_CONFIGURATION, e.getCode());
    }

    @Test
    void testLevelOutOfRangeRejected() {
        assertThrows(CompressionException.class, () -> AlgorithmSpec.of(CodecId.GZIP, 0));
        assertThrows(CompressionException.class, () -> AlgorithmSpec.of(CodecId.GZIP, 10));
        assertThrows(CompressionException.class, () -> AlgorithmSpec.of(CodecId.BROTLI, 12));
        assertThrows(CompressionException.class, () -> AlgorithmSpec.of(CodecId.ZSTD, 23));
        assertDoesNotThrow(() -> AlgorithmSpec.of(CodecId.BROTLI, 0));
        assertDoesNotThrow(() -> AlgorithmSpec.of(CodecId.ZSTD, 22));
    }

    @Test
    void testEqualityIsOrderSensitive() {
        AlgorithmSet a = AlgorithmSet.of(AlgorithmSpec.of(CodecId.GZIP), AlgorithmSpec.of(CodecId.ZSTD));
        AlgorithmSet b = AlgorithmSet.of(AlgorithmSpec.of(CodecId.GZIP), AlgorithmSpec.of(CodecId.ZSTD));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void testContentEncodingLookup() {
        assertEquals(CodecId.BROTLI, CodecId.fromContentEncoding("BR").orElseThrow());
        assertEquals(CodecId.ZSTD, CodecId.fromContentEncoding("zstd").orElseThrow());
        assertTrue(CodecId.fromContentEncoding("deflate").isEmpty());
    }

    @Test
    void testItemConfigRejectsNegativeLimit() {
        assertThrows(CompressionException.class, () -> ItemConfig.of(AlgorithmSet.defaults(), -1));
        assertEquals(100L, ItemConfig.of(AlgorithmSet.defaults(), 100).limit().getAsLong());
        assertTrue(ItemConfig.of(AlgorithmSet.defaults()).limit().isEmpty());
    }
}
