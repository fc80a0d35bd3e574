package dev.flowbridge;

import dev.flowbridge.cli.FlowBridgeCli;
import picocli.CommandLine;

/** Entry point of the {@code flow-bridge} jar. */
public final class Main {

    private Main() {}

    public static void main(String[] args) {
        CommandLine cli = new CommandLine(new FlowBridgeCli())
            .setUsageHelpAutoWidth(true);
        System.exit(cli.execute(args));
    }
}
