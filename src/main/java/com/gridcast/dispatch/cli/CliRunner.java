package com.gridcast.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Bridges picocli with the Spring Boot lifecycle: parses the arguments, runs the subcommand and
 * hands its exit code to Spring.
 * <p>
 * A subcommand that throws (ledger or data source unreachable, oracle misconfigured) is reported
 * as a one-line error with exit code 1 instead of a stack trace; the trace goes to the log.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final GridcastCommand gridcastCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(GridcastCommand gridcastCommand, IFactory factory) {
        this.gridcastCommand = gridcastCommand;
        this.factory = factory;
    }

    /**
     * True when the subcommand is {@code serve}. Spring options such as {@code --server.port=9090}
     * may precede it.
     */
    public static boolean isServeMode(String... args) {
        return Arrays.stream(args)
                .filter(arg -> !arg.startsWith("-"))
                .findFirst()
                .map("serve"::equals)
                .orElse(false);
    }

    @Override
    public void run(String... args) {
        // The embedded web server keeps the JVM alive in serve mode; picocli would return immediately.
        if (isServeMode(args)) {
            log.debug("Serve mode, CLI dispatch skipped");
            return;
        }
        CommandLine commandLine = new CommandLine(gridcastCommand, factory)
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    log.error("Command '{}' failed", cmd.getCommandName(), ex);
                    ConsoleOutput.error(cmd.getCommandName() + " failed: " + ex.getMessage());
                    return cmd.getCommandSpec().exitCodeOnExecutionException();
                });
        exitCode = commandLine.execute(args);
        log.debug("Command {} exited with {}", Arrays.toString(args), exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
