package com.opentext.compression.processor;

import com.opentext.compression.model.BatchRequest;
import com.opentext.compression.model.BatchResult;
import com.opentext.compression.model.CodecId;
import com.opentext.compression.model.CodecOutcome;
import com.opentext.compression.model.CompressionException;
import com.opentext.compression.model.CompressionInput;
import com.opentext.compression.model.ErrorCode;
import com.opentext.compression.model.FileInput;
import com.opentext.compression.model.ItemConfig;
import com.opentext.compression.model.ItemResult;
import com.opentext.compression.model.OutputTarget;
import com.opentext.compression.repository.AtomicOutputWriter;
import com.opentext.compression.repository.CommittedWrite;
import com.opentext.compression.service.CompressionOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Runs a batch of inputs through the {@link CompressionOrchestrator} and, depending on the
 * output target, the {@link AtomicOutputWriter}.
 * <p>
 * Items are independent and are fanned out over a fixed worker pool; codecs within one item run
 * sequentially on the worker. Results are reassembled by input index, so the returned
 * {@link BatchResult} is always in input order.
 * </p>
 * In fail-fast mode the first item-level exception cancels outstanding work and is rethrown;
 * no partial result is returned. Outputs already committed for other items stay on disk.
 * In graceful mode every input is attempted and failures are recorded in the result.
 */
@Slf4j
@Component
public class BatchCoordinator {

    private final CompressionOrchestrator orchestrator;
    private final AtomicOutputWriter writer;

    @Value("${compression.worker.threads:0}")
    private int threadPoolSize;

    @Value("${compression.shutdown.timeout.seconds:60}")
    private long shutdownTimeoutSeconds;

    @Value("${compression.output.create-dirs:true}")
    private boolean createDirs = true;

    @Autowired
    public BatchCoordinator(CompressionOrchestrator orchestrator, AtomicOutputWriter writer) {
        this.orchestrator = orchestrator;
        this.writer = writer;
    }

    /** In-memory run with the default per-item ceiling. */
    public BatchResult run(List<CompressionInput> inputs, Function<String, ItemConfig> configFor, boolean failFast) {
        return run(new BatchRequest(inputs, configFor, OutputTarget.inMemory(), failFast, Set.of()));
    }

    public BatchResult run(BatchRequest request) {
        validate(request.inputs());
        List<CompressionInput> inputs = applySkipList(request);
        // resolve every config up front: a missing config is a programmer error, not a runtime failure
        List<ItemConfig> configs = new ArrayList<>(inputs.size());
        for (CompressionInput input : inputs) {
            ItemConfig config = request.configFor().apply(input.id());
            if (config == null) {
                throw new CompressionException(ErrorCode.INVALID_CONFIGURATION,
                        "No configuration for input " + input.id());
            }
            configs.add(config);
        }
        if (inputs.isEmpty()) {
            log.info("All inputs skipped by extension filter, nothing to compress");
            return new BatchResult(List.of());
        }

        ExecutorService executor = newExecutor(inputs.size());
        boolean aborted = false;
        try {
            ItemResult[] results = request.failFast()
                    ? collectFailFast(executor, inputs, configs, request)
                    : collectGraceful(executor, inputs, configs, request);
            BatchResult batch = new BatchResult(Arrays.asList(results));
            if (log.isInfoEnabled()) {
                log.info("Batch of {} item(s) finished: {} ok, {} failed",
                        batch.size(), batch.successes().size(), batch.failures().size());
            }
            return batch;
        } catch (RuntimeException e) {
            aborted = true;
            executor.shutdownNow();
            log.error("Batch aborted: {}", e.getMessage());
            throw e;
        } finally {
            if (!aborted) {
                shutdown(executor);
            }
        }
    }

    private ItemResult[] collectFailFast(ExecutorService executor, List<CompressionInput> inputs,
                                         List<ItemConfig> configs, BatchRequest request) {
        CompletionService<Indexed> completion = new ExecutorCompletionService<>(executor);
        List<Future<Indexed>> futures = new ArrayList<>(inputs.size());
        // set by the first failing worker so queued items are skipped before the caller wakes up
        AtomicBoolean aborted = new AtomicBoolean();
        for (int i = 0; i < inputs.size(); i++) {
            int index = i;
            futures.add(completion.submit(() -> {
                if (aborted.get()) {
                    return null;
                }
                try {
                    return new Indexed(index, processItem(inputs.get(index), configs.get(index), request));
                } catch (RuntimeException | Error e) {
                    aborted.set(true);
                    throw e;
                }
            }));
        }
        ItemResult[] results = new ItemResult[inputs.size()];
        try {
            for (int done = 0; done < inputs.size(); done++) {
                Indexed next = completion.take().get();
                if (next == null) {
                    // skipped after an abort; the failing item's future is still to come
                    continue;
                }
                results[next.index()] = next.result();
            }
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            throw unwrap(e);
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw interrupted(e);
        }
        return results;
    }

    private ItemResult[] collectGraceful(ExecutorService executor, List<CompressionInput> inputs,
                                         List<ItemConfig> configs, BatchRequest request) {
        List<Future<ItemResult>> futures = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            CompressionInput input = inputs.get(i);
            ItemConfig config = configs.get(i);
            futures.add(executor.submit(() -> processItem(input, config, request)));
        }
        ItemResult[] results = new ItemResult[inputs.size()];
        try {
            for (int i = 0; i < futures.size(); i++) {
                results[i] = futures.get(i).get();
            }
        } catch (ExecutionException e) {
            // processItem records every failure in graceful mode; reaching here is a bug
            throw unwrap(e);
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw interrupted(e);
        }
        return results;
    }

    /** Compress one item and deliver it to the target. Never throws in graceful mode. */
    ItemResult processItem(CompressionInput input, ItemConfig config, BatchRequest request) {
        boolean failFast = request.failFast();
        try {
            OutputTarget target = request.target();
            if (target instanceof OutputTarget.InMemory memory) {
                return orchestrator.compressItem(input, config, failFast, OptionalLong.of(memory.maxBytesPerItem()));
            }
            if (target instanceof OutputTarget.Directory directory) {
                return writeToDirectory(input, config, directory, failFast);
            }
            if (target instanceof OutputTarget.Stream stream) {
                return writeToSinks(input, config, stream, failFast);
            }
            throw new IllegalStateException("Unsupported output target: " + target);
        } catch (CompressionException e) {
            if (failFast) {
                throw e;
            }
            log.warn("Item {} failed: {}", input.id(), e.getMessage());
            return ItemResult.failed(input.id(), safeSize(input), e);
        } catch (RuntimeException e) {
            if (failFast) {
                throw e;
            }
            log.warn("Item {} failed unexpectedly", input.id(), e);
            return ItemResult.failed(input.id(), safeSize(input),
                    new CompressionException(ErrorCode.COMPRESSION_FAILED, "Unexpected failure: " + e.getMessage(), e));
        }
    }

    /**
     * File inputs are streamed through staging sinks so neither input nor output is held in
     * memory; buffer inputs are compressed first and written with the byte-based path.
     */
    private ItemResult writeToDirectory(CompressionInput input, ItemConfig config, OutputTarget.Directory directory,
                                        boolean failFast) {
        Path destination = destinationFor(input, directory);
        List<CodecId> codecs = config.algorithms().codecs();

        if (input.isStreamBacked()) {
            CommittedWrite<ItemResult> write = writer.writeAllWithSinks(destination, input.basename(), codecs,
                    directory.overwritePolicy(), directory.atomicAll(), createDirs, sinks -> {
                        ItemResult result = orchestrator.compressItemToSinks(input, config, sinks, failFast);
                        result.errors().keySet().forEach(codec -> sinks.get(codec).discard());
                        return result;
                    });
            return withLocations(write.value(), write.committed());
        }

        // same SKIP outcome as the streaming path: codecs with a kept target are not attempted
        List<CodecId> admitted = writer.admittedCodecs(destination, input.basename(), codecs,
                directory.overwritePolicy());
        ItemResult result = orchestrator.compressItem(input, config, failFast, admitted);
        Map<CodecId, byte[]> payloads = new LinkedHashMap<>();
        result.perCodec().forEach((codec, outcome) -> outcome.bytes().ifPresent(bytes -> payloads.put(codec, bytes)));
        if (payloads.isEmpty()) {
            return result;
        }
        Map<CodecId, Path> committed = writer.writeAll(destination, input.basename(), payloads,
                directory.overwritePolicy(), directory.atomicAll(), createDirs);
        return withLocations(result, committed);
    }

    private ItemResult writeToSinks(CompressionInput input, ItemConfig config, OutputTarget.Stream stream,
                                    boolean failFast) {
        Map<CodecId, OutputStream> sinks = new LinkedHashMap<>();
        try {
            for (CodecId codec : config.algorithms().codecs()) {
                sinks.put(codec, stream.sinkFactory().open(input.id(), codec));
            }
            ItemResult result = orchestrator.compressItemToSinks(input, config, sinks, failFast);
            closeAll(sinks.values());
            return result;
        } catch (IOException e) {
            closeAfterFailure(sinks.values(), e);
            throw new CompressionException(ErrorCode.WRITE_FAILED, "Sink I/O failed for " + input.id(), e);
        } catch (RuntimeException e) {
            closeAfterFailure(sinks.values(), e);
            throw e;
        }
    }

    /** Mirrors a file input's directory relative to the source root when structure is kept. */
    static Path destinationFor(CompressionInput input, OutputTarget.Directory directory) {
        if (!directory.keepSourceStructure() || !(input instanceof FileInput file)) {
            return directory.path();
        }
        Path root = (directory.sourceRoot() != null ? directory.sourceRoot() : Path.of(""))
                .toAbsolutePath().normalize();
        Path parent = file.path().toAbsolutePath().normalize().getParent();
        if (parent == null || !parent.startsWith(root)) {
            return directory.path();
        }
        Path relative = root.relativize(parent);
        return relative.toString().isEmpty() ? directory.path() : directory.path().resolve(relative);
    }

    private static ItemResult withLocations(ItemResult result, Map<CodecId, Path> committed) {
        if (committed.isEmpty()) {
            return result;
        }
        Map<CodecId, CodecOutcome> located = new LinkedHashMap<>();
        committed.forEach((codec, path) -> located.put(codec, result.perCodec().get(codec).committedTo(path)));
        return result.withOutcomes(located);
    }

    private static void validate(List<CompressionInput> inputs) {
        if (inputs.isEmpty()) {
            throw new CompressionException(ErrorCode.INVALID_CONFIGURATION, "No inputs to compress");
        }
        Set<String> ids = new HashSet<>();
        for (CompressionInput input : inputs) {
            if (!ids.add(input.id())) {
                throw new CompressionException(ErrorCode.INVALID_CONFIGURATION, "Duplicate input id: " + input.id());
            }
        }
    }

    private static List<CompressionInput> applySkipList(BatchRequest request) {
        if (request.skipExtensions().isEmpty()) {
            return request.inputs();
        }
        List<CompressionInput> kept = new ArrayList<>();
        for (CompressionInput input : request.inputs()) {
            if (input instanceof FileInput file && request.skipExtensions().contains(file.extension())) {
                log.debug("Skipping {} (extension {})", input.id(), file.extension());
                continue;
            }
            kept.add(input);
        }
        return kept;
    }

    private ExecutorService newExecutor(int itemCount) {
        int effectiveSize = threadPoolSize > 0 ? threadPoolSize : Math.max(1, Runtime.getRuntime().availableProcessors());
        effectiveSize = Math.min(effectiveSize, itemCount);
        if (log.isDebugEnabled()) {
            log.debug("Created worker pool with {} threads (compression.worker.threads={})", effectiveSize, threadPoolSize);
        }
        return Executors.newFixedThreadPool(effectiveSize);
    }

    private void shutdown(ExecutorService executor) {
        executor.shutdown();
        long effectiveTimeout = shutdownTimeoutSeconds > 0 ? shutdownTimeoutSeconds : 60L;
        try {
            if (!executor.awaitTermination(effectiveTimeout, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate within {} seconds", effectiveTimeout);
            }
        } catch (InterruptedException e) {
            log.error("Worker pool shutdown interrupted", e);
            Thread.currentThread().interrupt();
        }
    }

    private static void closeAll(Iterable<OutputStream> sinks) throws IOException {
        IOException failure = null;
        for (OutputStream sink : sinks) {
            try {
                sink.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private static void closeAfterFailure(Iterable<OutputStream> sinks, Exception primary) {
        for (OutputStream sink : sinks) {
            try {
                sink.close();
            } catch (IOException e) {
                primary.addSuppressed(e);
            }
        }
    }

    private static long safeSize(CompressionInput input) {
        try {
            return input.sizeBytes();
        } catch (RuntimeException e) {
            return 0;
        }
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException re) {
            return re;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new CompressionException(ErrorCode.COMPRESSION_FAILED, "Item processing failed", cause);
    }

    private static CancellationException interrupted(InterruptedException e) {
        CancellationException cancelled = new CancellationException("Batch interrupted");
        cancelled.initCause(e);
        return cancelled;
    }

    private record Indexed(int index, ItemResult result) {
    }
}
