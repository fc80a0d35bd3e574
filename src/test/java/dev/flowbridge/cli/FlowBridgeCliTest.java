package dev.flowbridge.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FlowBridgeCliTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new FlowBridgeCli());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private static String fixture(String name) throws URISyntaxException {
        return Path.of(FlowBridgeCliTest.class.getResource("/flows/" + name).toURI()).toString();
    }

    @Test
    void convertsAndPublishesValidFlows(@TempDir Path dir) throws Exception {
        int exit = run("--out", dir.toString(), fixture("orders-sync.xml"), fixture("customer-routing.xml"));

        assertThat(exit).isZero();
        assertThat(out.toString())
            .contains("VALIDATED orders.sync:syncOrders")
            .contains("patterns: fetch-iterate-send")
            .contains("2 flow(s): 2 validated, 0 rejected, 0 failed");
        assertThat(dir.resolve("orders.sync_syncOrders.xml")).exists();
        assertThat(dir.resolve("customers.route_routeByTier.report.json")).exists();
    }

    @Test
    void failedFlowGivesNonZeroExit(@TempDir Path dir) throws Exception {
        int exit = run("--out", dir.toString(), fixture("broken.xml"), fixture("orders-sync.xml"));

        assertThat(exit).isEqualTo(1);
        assertThat(out.toString())
            .contains("FAILED")
            .contains("2 flow(s): 1 validated, 0 rejected, 1 failed");
        // the good flow is still published
        assertThat(dir.resolve("orders.sync_syncOrders.xml")).exists();
    }

    @Test
    void dryRunWritesNothing(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("out");

        int exit = run("--dry-run", "--out", target.toString(), fixture("orders-sync.xml"));

        assertThat(exit).isZero();
        assertThat(target).doesNotExist();
    }

    @Test
    void thresholdOverrideChangesReadiness() throws Exception {
        int exit = run("--dry-run", "--threshold", "95", fixture("orders-sync.xml"));

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("(review)");
    }

    @Test
    void listsPatterns() {
        int exit = run("--list-patterns");

        assertThat(exit).isZero();
        assertThat(out.toString())
            .contains("Pattern catalog 2024.2")
            .contains("fetch-iterate-send")
            .contains("lookup-enrich");
    }

    @Test
    void requiresAtLeastOneFlow() {
        int exit = run();

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).contains("at least one flow.xml is required");
    }

    @Test
    void reportsBadSettingsFile(@TempDir Path dir) throws Exception {
        Path settings = Files.writeString(dir.resolve("settings.json"), "{ \"unattendedThreshold\": 10 }");

        int exit = run("--settings", settings.toString(), fixture("orders-sync.xml"));

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).startsWith("Error:");
    }
}
