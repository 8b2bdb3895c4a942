package com.gridcast.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Gridcast.
 * Routes to subcommands: ask, history, capabilities, health, serve.
 */
@Command(
        name = "gridcast",
        mixinStandardHelpOptions = true,
        version = "Gridcast 0.1.0",
        description = "Autonomous electricity demand forecasting agent",
        subcommands = {
                AskCommand.class,
                HistoryCommand.class,
                CapabilitiesCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class GridcastCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
