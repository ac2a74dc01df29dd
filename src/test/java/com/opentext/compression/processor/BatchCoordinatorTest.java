package com.opentext.compression.processor;

import com.opentext.compression.codec.CodecRegistry;
import com.opentext.compression.codec.GzipCodecAdapter;
import com.opentext.compression.model.AlgorithmSet;
import com.opentext.compression.model.AlgorithmSpec;
import com.opentext.compression.model.BatchRequest;
import com.opentext.compression.model.BatchResult;
import com.opentext.compression.model.CodecId;
import com.opentext.compression.model.CompressionException;
import com.opentext.compression.model.CompressionInput;
import com.opentext.compression.model.DataInput;
import com.opentext.compression.model.ErrorCode;
import com.opentext.compression.model.FileInput;
import com.opentext.compression.model.ItemConfig;
import com.opentext.compression.model.ItemResult;
import com.opentext.compression.model.OutputTarget;
import com.opentext.compression.model.OverwritePolicy;
import com.opentext.compression.repository.AtomicOutputWriter;
import com.opentext.compression.service.CompressionOrchestrator;
import com.opentext.compression.service.FakeCodecAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

class BatchCoordinatorTest {

    private static final ItemConfig GZIP = ItemConfig.of(AlgorithmSet.gzip(6));

    private BatchCoordinator coordinator;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        coordinator = coordinatorWith(CodecRegistry.of(new GzipCodecAdapter()));
    }

    @Test
    void testResultsFollowInputOrder() {
        List<CompressionInput> inputs = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            // vary sizes so items finish out of order
            inputs.add(DataInput.of("item-" + i, "x".repeat((60 - i) * 2000)));
        }

        BatchResult result = coordinator.run(inputs, id -> GZIP, false);

        assertEquals(60, result.size());
        assertEquals(List.copyOf(result.asMap().keySet()), result.ids());
        for (int i = 0; i < 60; i++) {
            assertEquals("item-" + i, result.ids().get(i));
        }
        assertTrue(result.allOk());
    }

    @Test
    void testGracefulModeRecordsFailuresAndContinues() {
        List<CompressionInput> inputs = List.of(
                DataInput.of("small", "abc"),
                DataInput.of("big", "0123456789ABCDEF"),
                DataInput.of("other", "def"));

        BatchResult result = coordinator.run(inputs, id -> ItemConfig.of(AlgorithmSet.gzip(6), 10), false);

        assertEquals(List.of("small", "big", "other"), result.ids());
        assertEquals(2, result.successes().size());
        ItemResult big = result.get("big");
        assertFalse(big.isSuccess());
        assertEquals(ErrorCode.PAYLOAD_TOO_LARGE, big.failureReason().orElseThrow().getCode());
    }

    @Test
    void testFailFastPropagatesFirstError() {
        List<CompressionInput> inputs = List.of(DataInput.of("ok", "abc"), DataInput.of("big", "0123456789ABCDEF"));

        CompressionException e = assertThrows(CompressionException.class,
                () -> coordinator.run(inputs, id -> ItemConfig.of(AlgorithmSet.gzip(6), 10), true));

        assertEquals(ErrorCode.PAYLOAD_TOO_LARGE, e.getCode());
    }

    @Test
    void testFailFastSkipsItemsQueuedAfterFailure() {
        FakeCodecAdapter gzip = FakeCodecAdapter.working(CodecId.GZIP);
        BatchCoordinator coordinator = coordinatorWith(CodecRegistry.of(gzip));
        ReflectionTestUtils.setField(coordinator, "threadPoolSize", 1);
        Path out = tempDir.resolve("out");
        List<CompressionInput> inputs = new ArrayList<>();
        inputs.add(DataInput.of("oversized", "0123456789ABCDEF"));
        for (int i = 0; i < 50; i++) {
            inputs.add(DataInput.of("item-" + i, "ok"));
        }
        BatchRequest request = new BatchRequest(inputs, id -> ItemConfig.of(AlgorithmSet.gzip(6), 10),
                OutputTarget.toDirectory(out), true, Set.of());

        CompressionException e = assertThrows(CompressionException.class, () -> coordinator.run(request));

        assertEquals(ErrorCode.PAYLOAD_TOO_LARGE, e.getCode());
        assertEquals(0, gzip.calls.get());
        assertFalse(Files.exists(out));
    }

    @Test
    void testPerItemConfig() {
        BatchCoordinator coordinator = coordinatorWith(CodecRegistry.of(
                FakeCodecAdapter.working(CodecId.GZIP), FakeCodecAdapter.working(CodecId.ZSTD)));
        ItemConfig both = ItemConfig.of(AlgorithmSet.of(AlgorithmSpec.of(CodecId.GZIP), AlgorithmSpec.of(CodecId.ZSTD)));

        BatchResult result = coordinator.run(List.of(DataInput.of("a", "aaa"), DataInput.of("b", "bbb")),
                id -> id.equals("a") ? both : ItemConfig.of(AlgorithmSet.zstd(3)), false);

        assertTrue(result.get("a").has(CodecId.GZIP));
        assertTrue(result.get("a").has(CodecId.ZSTD));
        assertFalse(result.get("b").has(CodecId.GZIP));
        assertTrue(result.get("b").has(CodecId.ZSTD));
    }

    @Test
    void testEmptyAndDuplicateInputsRejected() {
        CompressionException empty = assertThrows(CompressionException.class,
                () -> coordinator.run(List.of(), id -> GZIP, false));
        assertEquals(ErrorCode.INVALID_CONFIGURATION, empty.getCode());

        CompressionException duplicate = assertThrows(CompressionException.class,
                () -> coordinator.run(List.of(DataInput.of("a", "1"), DataInput.of("a", "2")), id -> GZIP, false));
        assertEquals(ErrorCode.INVALID_CONFIGURATION, duplicate.getCode());
    }

    @Test
    void testMissingConfigRejected() {
        CompressionException e = assertThrows(CompressionException.class,
                () -> coordinator.run(List.of(DataInput.of("a", "1")), id -> null, false));
        assertEquals(ErrorCode.INVALID_CONFIGURATION, e.getCode());
    }

    @Test
    void testInMemoryCeiling() {
        BatchRequest request = BatchRequest.inMemory(List.of(DataInput.of("a", "0123456789")), GZIP, false)
                .withTarget(OutputTarget.inMemory(5));

        BatchResult result = coordinator.run(request);

        assertEquals(ErrorCode.MEMORY_LIMIT_EXCEEDED, result.first().failureReason().orElseThrow().getCode());
    }

    @Test
    void testDirectoryModeStreamsFiles() throws IOException {
        Path source = Files.writeString(tempDir.resolve("index.html"), "<p>hello</p>".repeat(1000));
        Path out = tempDir.resolve("out");

        BatchResult result = coordinator.run(BatchRequest.inMemory(List.of(FileInput.of(source)), GZIP, false)
                .withTarget(OutputTarget.toDirectory(out)));

        ItemResult item = result.first();
        Path written = out.resolve("index.html.gz");
        assertTrue(item.isOk());
        assertEquals(written, item.location(CodecId.GZIP).orElseThrow());
        assertEquals(Files.size(written), item.size(CodecId.GZIP));
        assertArrayEquals(Files.readAllBytes(source),
                new GzipCodecAdapter().decompress(Files.readAllBytes(written)));
    }

    @Test
    void testDirectoryModeWritesBuffers() throws IOException {
        Path out = tempDir.resolve("out");

        BatchResult result = coordinator.run(BatchRequest.inMemory(List.of(DataInput.of("payload", "abc".repeat(100))),
                GZIP, false).withTarget(OutputTarget.toDirectory(out)));

        assertTrue(Files.exists(out.resolve("payload.gz")));
        assertEquals(out.resolve("payload.gz"), result.first().location(CodecId.GZIP).orElseThrow());
        assertTrue(result.first().perCodec().get(CodecId.GZIP).bytes().isEmpty());
    }

    @Test
    void testDirectoryModeDropsFailedCodecOutput() throws IOException {
        BatchCoordinator coordinator = coordinatorWith(CodecRegistry.of(
                FakeCodecAdapter.working(CodecId.GZIP), FakeCodecAdapter.failing(CodecId.ZSTD)));
        Path source = Files.writeString(tempDir.resolve("data.txt"), "content");
        Path out = tempDir.resolve("out");
        ItemConfig config = ItemConfig.of(AlgorithmSet.of(
                AlgorithmSpec.of(CodecId.GZIP), AlgorithmSpec.optional(CodecId.ZSTD, 3)));

        BatchResult result = coordinator.run(BatchRequest.inMemory(List.of(FileInput.of(source)), config, false)
                .withTarget(OutputTarget.toDirectory(out)));

        assertTrue(result.first().isSuccess());
        assertEquals("content", Files.readString(out.resolve("data.txt.gz")));
        assertFalse(Files.exists(out.resolve("data.txt.zst")));
    }

    @Test
    void testDirectoryModeExistingTargetFailsItemGracefully() throws IOException {
        Path source = Files.writeString(tempDir.resolve("a.txt"), "aaaa");
        Path out = Files.createDirectories(tempDir.resolve("out"));
        Files.writeString(out.resolve("a.txt.gz"), "old");

        BatchResult result = coordinator.run(BatchRequest.inMemory(List.of(FileInput.of(source)), GZIP, false)
                .withTarget(OutputTarget.toDirectory(out)));

        assertEquals(ErrorCode.TARGET_ALREADY_EXISTS, result.first().failureReason().orElseThrow().getCode());
        assertEquals("old", Files.readString(out.resolve("a.txt.gz")));
    }

    @Test
    void testDirectoryModeSkipPolicy() throws IOException {
        Path source = Files.writeString(tempDir.resolve("a.txt"), "aaaa");
        Path out = Files.createDirectories(tempDir.resolve("out"));
        Files.writeString(out.resolve("a.txt.gz"), "old");

        BatchResult result = coordinator.run(BatchRequest.inMemory(List.of(FileInput.of(source)), GZIP, false)
                .withTarget(OutputTarget.toDirectory(out).withPolicy(OverwritePolicy.SKIP)));

        assertTrue(result.first().isSuccess());
        assertFalse(result.first().perCodec().containsKey(CodecId.GZIP));
        assertEquals("old", Files.readString(out.resolve("a.txt.gz")));
    }

    @Test
    void testSkipPolicyLeavesBufferCodecOutOfResult() throws IOException {
        FakeCodecAdapter gzip = FakeCodecAdapter.working(CodecId.GZIP);
        FakeCodecAdapter zstd = FakeCodecAdapter.working(CodecId.ZSTD);
        BatchCoordinator coordinator = coordinatorWith(CodecRegistry.of(gzip, zstd));
        Path out = Files.createDirectories(tempDir.resolve("out"));
        Files.writeString(out.resolve("payload.gz"), "old");
        ItemConfig config = ItemConfig.of(AlgorithmSet.of(AlgorithmSpec.of(CodecId.GZIP), AlgorithmSpec.of(CodecId.ZSTD)));

        BatchResult result = coordinator.run(BatchRequest.inMemory(List.of(DataInput.of("payload", "fresh")), config, false)
                .withTarget(OutputTarget.toDirectory(out).withPolicy(OverwritePolicy.SKIP)));

        ItemResult item = result.first();
        assertTrue(item.isOk());
        assertFalse(item.perCodec().containsKey(CodecId.GZIP));
        assertEquals(0, gzip.calls.get());
        assertEquals(out.resolve("payload.zst"), item.location(CodecId.ZSTD).orElseThrow());
        assertEquals("old", Files.readString(out.resolve("payload.gz")));
        assertEquals("fresh", Files.readString(out.resolve("payload.zst")));
    }

    @Test
    void testNonAtomicDirectoryWriteStillCommits() throws IOException {
        Path source = Files.writeString(tempDir.resolve("b.txt"), "bbbb");
        Path out = tempDir.resolve("out");

        BatchResult result = coordinator.run(BatchRequest.inMemory(List.of(FileInput.of(source)), GZIP, false)
                .withTarget(OutputTarget.toDirectory(out).withAtomicAll(false).withPolicy(OverwritePolicy.REPLACE)));

        assertTrue(result.first().isOk());
        assertTrue(Files.exists(out.resolve("b.txt.gz")));
    }

    @Test
    void testKeepSourceStructure() throws IOException {
        Path root = tempDir.resolve("site");
        Path nested = Files.createDirectories(root.resolve("css/vendor"));
        Path source = Files.writeString(nested.resolve("lib.css"), "body{}".repeat(50));
        Path out = tempDir.resolve("out");

        coordinator.run(BatchRequest.inMemory(List.of(FileInput.of(source)), GZIP, false)
                .withTarget(OutputTarget.toDirectory(out).keepingStructure(root)));

        assertTrue(Files.exists(out.resolve("css/vendor/lib.css.gz")));
    }

    @Test
    void testSkipsAlreadyCompressedFiles() throws IOException {
        Path image = Files.write(tempDir.resolve("logo.PNG"), new byte[]{1, 2, 3});
        Path text = Files.writeString(tempDir.resolve("notes.txt"), "notes");

        BatchResult result = coordinator.run(BatchRequest.inMemory(
                List.of(FileInput.of(image), FileInput.of(text)), GZIP, false).skippingAlreadyCompressed());

        assertEquals(1, result.size());
        assertFalse(result.contains(image.toString()));
        assertTrue(result.contains(text.toString()));
    }

    @Test
    void testStreamTargetClosesCallerSinks() {
        Map<String, ByteArrayOutputStream> sinks = new ConcurrentHashMap<>();
        Set<String> closed = ConcurrentHashMap.newKeySet();

        BatchResult result = coordinator.run(BatchRequest.inMemory(
                List.of(DataInput.of("a", "aaaa".repeat(100)), DataInput.of("b", "bbbb".repeat(100))), GZIP, false)
                .withTarget(OutputTarget.toSinks((id, codec) -> {
                    ByteArrayOutputStream sink = new ByteArrayOutputStream() {
                        @Override
                        public void close() throws IOException {
                            closed.add(id);
                            super.close();
                        }
                    };
                    sinks.put(id, sink);
                    return sink;
                })));

        assertTrue(result.allOk());
        assertEquals(Set.of("a", "b"), closed);
        assertEquals(sinks.get("a").size(), result.get("a").size(CodecId.GZIP));
    }

    @Test
    void testDestinationOutsideRootFallsBackToFlat() throws IOException {
        Path source = Files.writeString(tempDir.resolve("x.txt"), "x");
        OutputTarget.Directory directory = OutputTarget.toDirectory(tempDir.resolve("out"))
                .keepingStructure(tempDir.resolve("elsewhere"));

        assertEquals(tempDir.resolve("out"), BatchCoordinator.destinationFor(FileInput.of(source), directory));
    }

    private static BatchCoordinator coordinatorWith(CodecRegistry registry) {
        BatchCoordinator coordinator = new BatchCoordinator(new CompressionOrchestrator(registry), new AtomicOutputWriter());
        ReflectionTestUtils.setField(coordinator, "threadPoolSize", 4);
        ReflectionTestUtils.setField(coordinator, "shutdownTimeoutSeconds", 5L);
        return coordinator;
    }
}
