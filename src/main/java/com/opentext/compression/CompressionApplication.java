package com.opentext.compression;

import com.opentext.compression.model.AlgorithmSet;
import com.opentext.compression.model.BatchRequest;
import com.opentext.compression.model.BatchResult;
import com.opentext.compression.model.BatchSummary;
import com.opentext.compression.model.CompressionInput;
import com.opentext.compression.model.DataInput;
import com.opentext.compression.model.FileInput;
import com.opentext.compression.model.ItemConfig;
import com.opentext.compression.model.OutputTarget;
import com.opentext.compression.processor.BatchCoordinator;
import com.opentext.compression.service.ResultAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ApplicationContext;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Spring Boot entry point. Compresses the files named on the command line into
 * {@code compression.demo.output-dir} with every default codec; with no arguments a small
 * demo buffer is compressed in memory so the pipeline can be seen end-to-end.
 */
@Slf4j
@SpringBootApplication
public class CompressionApplication {

    static final String DEMO_TEXT = "The quick brown fox jumps over the lazy dog. ".repeat(200);

    public static void main(String[] args) {
        ApplicationContext context = SpringApplication.run(CompressionApplication.class, args);
        BatchCoordinator coordinator = context.getBean(BatchCoordinator.class);
        ResultAggregator aggregator = context.getBean(ResultAggregator.class);
        String outputDir = context.getEnvironment().getProperty("compression.demo.output-dir", "./compressed");

        BatchResult result = coordinator.run(requestFor(args, Path.of(outputDir)));
        logSummary(aggregator.summarize(result));
    }

    static BatchRequest requestFor(String[] args, Path outputDir) {
        ItemConfig config = ItemConfig.of(AlgorithmSet.defaults());
        if (args.length == 0) {
            List<CompressionInput> demo = List.of(DataInput.of("demo", DEMO_TEXT));
            return BatchRequest.inMemory(demo, config, false);
        }
        List<CompressionInput> inputs = new ArrayList<>();
        for (String arg : args) {
            inputs.add(FileInput.of(Path.of(arg)));
        }
        return BatchRequest.inMemory(inputs, config, false)
                .withTarget(OutputTarget.toDirectory(outputDir))
                .skippingAlreadyCompressed();
    }

    static void logSummary(BatchSummary summary) {
        log.info("Compressed {} item(s): {} ok, {} failed, {} bytes in",
                summary.totalItems(), summary.successCount(), summary.failureCount(), summary.totalOriginalBytes());
        summary.perCodec().values().forEach(stats -> log.info("  {}: avg ratio {}, p95 ratio {}, {} bytes saved, {} ms",
                stats.codec().contentEncoding(),
                String.format("%.3f", stats.averageRatio()),
                String.format("%.3f", stats.p95Ratio()),
                stats.bytesSaved(),
                String.format("%.1f", stats.totalTimeMs())));
    }
}
