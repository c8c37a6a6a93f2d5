package com.polygen;

import ch.qos.logback.classic.Level;
import com.polygen.cli.CompileCommand;
import com.polygen.cli.ListCommand;
import com.polygen.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for Polygen.
 *
 * <p>Polygen compiles {@code .poly} schema files into an intermediate representation and
 * runs the bundled generators over it.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code compile} - Compile a schema and write generated artifacts</li>
 *   <li>{@code validate} - Check a schema and print diagnostics</li>
 *   <li>{@code list} - List available generators or renderers</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * polygen compile schemas/game.poly -o generated
 * polygen -v validate schemas/game.poly
 * polygen list generators
 * }</pre>
 */
@Command(
    name = "polygen",
    mixinStandardHelpOptions = true,
    version = "Polygen 1.0.0-SNAPSHOT",
    description = "Schema compiler for .poly data definitions",
    subcommands = {
        CompileCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class PolygenCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PolygenCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("Polygen - Schema Compiler");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'polygen --help' to see available commands");
        System.out.println("Use 'polygen <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Root log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        PolygenCLI cli = new PolygenCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
