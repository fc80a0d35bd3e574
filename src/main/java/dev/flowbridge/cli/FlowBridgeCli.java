package dev.flowbridge.cli;

import ch.qos.logback.classic.Level;
import dev.flowbridge.catalog.CatalogLoader;
import dev.flowbridge.catalog.PatternCatalog;
import dev.flowbridge.catalog.PatternTemplate;
import dev.flowbridge.catalog.ServiceCatalog;
import dev.flowbridge.engine.FlowTranspiler;
import dev.flowbridge.engine.PackageConverter;
import dev.flowbridge.engine.PackageReport;
import dev.flowbridge.engine.SettingsLoader;
import dev.flowbridge.model.ConversionOutcome;
import dev.flowbridge.model.ConversionResult;
import dev.flowbridge.model.ConversionSettings;
import dev.flowbridge.model.ReviewNote;
import dev.flowbridge.model.ValidationIssue;
import dev.flowbridge.publish.DirectoryPublisher;
import dev.flowbridge.publish.ProcessPublisher;
import dev.flowbridge.publish.PublishReceipt;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point for flow-bridge.
 */
@Command(
    name = "flow-bridge",
    mixinStandardHelpOptions = true,
    description = "Convert webMethods flow services into wired Boomi process components."
)
public class FlowBridgeCli implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "0..*", paramLabel = "FLOW", description = "flow.xml files to convert")
    private List<Path> flows = new ArrayList<>();

    @Option(names = "--out", defaultValue = "out", description = "Output directory for processes and reports")
    private Path outputDir;

    @Option(names = "--catalog", description = "Extra service catalog merged over the built-in one (repeatable)")
    private List<Path> catalogs = new ArrayList<>();

    @Option(names = "--patterns", description = "Pattern catalog replacing the built-in one")
    private Path patternsFile;

    @Option(names = "--settings", description = "JSON file overriding conversion settings")
    private Path settingsFile;

    @Option(names = "--threads", defaultValue = "4", description = "Flows converted in parallel")
    private int threads;

    @Option(names = "--threshold", description = "Override the unattended-deployment confidence threshold")
    private Integer threshold;

    @Option(names = "--dry-run", description = "Convert and report without writing any files")
    private boolean dryRun;

    @Option(names = "--list-patterns", description = "List the loaded pattern templates")
    private boolean listPatterns;

    @Option(names = "--verbose", description = "Log every conversion stage")
    private boolean verbose;

    @Override
    public Integer call() throws InterruptedException {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("dev.flowbridge")).setLevel(Level.DEBUG);
        }

        ServiceCatalog services;
        PatternCatalog patterns;
        ConversionSettings settings;
        try {
            services = CatalogLoader.servicesWithOverlays(catalogs);
            patterns = patternsFile != null ? CatalogLoader.loadPatterns(patternsFile) : CatalogLoader.builtInPatterns();
            settings = settingsFile != null ? SettingsLoader.loadFromFile(settingsFile) : ConversionSettings.defaults();
            if (threshold != null) {
                settings = settings.withUnattendedThreshold(threshold);
            }
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        if (listPatterns) {
            out.printf("Pattern catalog %s:%n", patterns.version());
            for (PatternTemplate pattern : patterns.patterns()) {
                out.printf("  %-32s %3d  %s%n", pattern.id(), pattern.confidence(), pattern.description());
            }
            return 0;
        }

        if (flows.isEmpty()) {
            err.println("Error: at least one flow.xml is required. Use --help for usage.");
            return 1;
        }

        var transpiler = new FlowTranspiler(services, patterns, settings);
        PackageReport report = new PackageConverter(transpiler, threads).convertAll(flows);

        ProcessPublisher publisher = dryRun ? null : new DirectoryPublisher(outputDir);
        boolean publishFailed = false;
        for (PackageReport.Entry entry : report.entries()) {
            if (entry instanceof PackageReport.Failed failed) {
                out.printf("FAILED    %s: %s%n", failed.source(), failed.message());
            } else if (entry instanceof PackageReport.Converted converted) {
                ConversionOutcome outcome = converted.outcome();
                if (outcome instanceof ConversionOutcome.Validated validated) {
                    printValidated(out, validated.result());
                    if (publisher != null) {
                        try {
                            PublishReceipt receipt = publisher.publish(validated);
                            out.printf("          -> %s%n", receipt.processFile());
                        } catch (IOException e) {
                            err.printf("Error: could not publish %s: %s%n", outcome.flowName(), e.getMessage());
                            publishFailed = true;
                        }
                    }
                } else {
                    out.printf("REJECTED  %s%n", outcome.flowName());
                    for (ValidationIssue issue : outcome.report().errors()) {
                        out.printf("          %s %s%n", issue.kind(), issue.message());
                    }
                }
            }
        }
        out.printf("%d flow(s): %d validated, %d rejected, %d failed%n", report.entries().size(),
            report.validated().size(), report.rejected().size(), report.failed().size());
        out.flush();
        return report.allValidated() && !publishFailed ? 0 : 1;
    }

    private void printValidated(PrintWriter out, ConversionResult result) {
        out.printf("VALIDATED %s  confidence %d%s  complexity %s%n", result.flowName(),
            result.aggregateConfidence(), result.readyForUnattendedDeployment() ? "" : " (review)",
            result.statistics().complexity());
        if (!result.patterns().isEmpty()) {
            out.printf("          patterns: %s%n", String.join(", ", result.patterns()));
        }
        if (verbose) {
            for (ReviewNote note : result.reviewNotes()) {
                out.printf("          note %s%n", note);
            }
        }
    }
}
