package com.architekt;

import com.architekt.cli.CommandErrorHandler;
import com.architekt.cli.ComponentCommand;
import com.architekt.cli.DataModelCommand;
import com.architekt.cli.FlowCommand;
import com.architekt.cli.ProjectCommand;
import com.architekt.cli.RegexCommand;
import com.architekt.cli.SystemCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for Architekt.
 *
 * <p>Architekt models a software architecture as projects made of a system hierarchy,
 * interaction flows, data models and deployable components with their entry points.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code project} - List, create, show and delete projects</li>
 *   <li>{@code system} - Edit a project's system hierarchy</li>
 *   <li>{@code flow} - Validate, save and delete flows</li>
 *   <li>{@code datamodel} - Save and delete data models</li>
 *   <li>{@code component} - Save and delete components and their entry points</li>
 *   <li>{@code regex} - Build a regex constraint from character options</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Create a project
 * architekt project create "Web Shop"
 *
 * # Add a system under the root
 * architekt system add -p <projectId> Billing
 *
 * # Save a flow document
 * architekt flow save -p <projectId> checkout.json
 * }</pre>
 *
 * <p><b>Exit codes:</b> 0 success, 1 unexpected failure, 2 validation failure, 3 not found.
 */
@Command(
    name = "architekt",
    mixinStandardHelpOptions = true,
    version = "Architekt 1.0.0-SNAPSHOT",
    description = "Architecture modeling tool for systems, flows, data models and components",
    subcommands = {
        ProjectCommand.class,
        SystemCommand.class,
        FlowCommand.class,
        DataModelCommand.class,
        ComponentCommand.class,
        RegexCommand.class
    }
)
public class ArchitektCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ArchitektCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("Architekt - Architecture Modeling Tool");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'architekt --help' to see available commands");
        System.out.println("Use 'architekt <command> --help' for command-specific help");
    }

    /**
     * Creates a configured command line: logging is set up from the global options before any
     * subcommand runs, and engine errors are mapped to exit codes.
     *
     * @return command line ready to execute
     */
    public static CommandLine commandLine() {
        ArchitektCLI cli = new ArchitektCLI();
        CommandErrorHandler errorHandler = new CommandErrorHandler();
        return new CommandLine(cli)
            .setExecutionStrategy(cli::executionStrategy)
            .setExecutionExceptionHandler(errorHandler)
            .setExitCodeExceptionMapper(errorHandler);
    }

    private int executionStrategy(ParseResult parseResult) {
        configureLogging();
        log.debug("Executing: {}", parseResult.originalArgs());
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
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
