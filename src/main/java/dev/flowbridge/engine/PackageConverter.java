package dev.flowbridge.engine;

import dev.flowbridge.model.ConversionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Converts many flows in parallel, one independent task per flow. A failure
 * in one flow never affects another.
 */
public final class PackageConverter {

    private static final Logger log = LoggerFactory.getLogger(PackageConverter.class);

    private final FlowTranspiler transpiler;
    private final int threads;

    public PackageConverter(FlowTranspiler transpiler, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got " + threads);
        }
        this.transpiler = transpiler;
        this.threads = threads;
    }

    public PackageReport convertAll(List<Path> flows) throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, Math.max(1, flows.size())));
        try {
            var futures = new ArrayList<Future<PackageReport.Entry>>();
            for (Path flow : flows) {
                futures.add(pool.submit(() -> convertOne(flow)));
            }
            var entries = new ArrayList<PackageReport.Entry>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    entries.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    log.error("Conversion of {} failed unexpectedly", flows.get(i), cause);
                    entries.add(new PackageReport.Failed(flows.get(i), null, String.valueOf(cause)));
                }
            }
            PackageReport report = new PackageReport(entries);
            log.info("Package done: {} validated, {} rejected, {} failed",
                report.validated().size(), report.rejected().size(), report.failed().size());
            return report;
        } catch (InterruptedException e) {
            pool.shutdownNow();
            throw e;
        } finally {
            pool.shutdown();
        }
    }

    PackageReport.Entry convertOne(Path flow) {
        try {
            String xml = Files.readString(flow, StandardCharsets.UTF_8);
            ConversionOutcome outcome = transpiler.convert(xml);
            return new PackageReport.Converted(flow, outcome);
        } catch (FlowParseException e) {
            log.warn("Cannot parse {}: {}", flow, e.getMessage());
            return new PackageReport.Failed(flow, e.locator(), e.getMessage());
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", flow, e.getMessage());
            return new PackageReport.Failed(flow, null, e.getMessage());
        }
    }
}
