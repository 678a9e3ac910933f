package org.srm.alerting.config;

import org.srm.alerting.config.cli.AddEmailCommand;
import org.srm.alerting.config.cli.AddGroupListCommand;
import org.srm.alerting.config.cli.PruneCommand;
import org.srm.alerting.config.cli.SummaryCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "alerting-config",
        mixinStandardHelpOptions = true,
        version = "alerting-config 1.0",
        description = "Inspect and rewrite alerting configuration files",
        subcommands = {
                SummaryCommand.class,
                PruneCommand.class,
                AddEmailCommand.class,
                AddGroupListCommand.class
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    public static CommandLine commandLine() {
        return new CommandLine(new Main())
                .setExecutionExceptionHandler((e, commandLine, parseResult) -> {
                    commandLine.getErr().println("[ERROR] " + e.getMessage());
                    if (e.getCause() != null) {
                        commandLine.getErr().println("        caused by: " + e.getCause().getMessage());
                    }
                    return 1;
                });
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }
}
