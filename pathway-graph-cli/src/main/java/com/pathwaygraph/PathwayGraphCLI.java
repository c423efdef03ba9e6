package com.pathwaygraph;

import com.pathwaygraph.cli.ConvertCommand;
import com.pathwaygraph.cli.ExportCommand;
import com.pathwaygraph.cli.RenderCommand;
import com.pathwaygraph.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for pathway-graph.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Render a node list as Mermaid and DOT diagrams</li>
 *   <li>{@code convert} - Convert between pathway JSON and node-list JSON</li>
 *   <li>{@code validate} - Summarize a node list and report structural issues</li>
 *   <li>{@code export} - Write a Markdown pathway document</li>
 * </ul>
 *
 * <p>The global {@code -v} and {@code -q} options set the Logback root level before any
 * subcommand runs.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * pathway-graph render nodes.json -o diagrams
 * pathway-graph -v validate nodes.json
 * pathway-graph convert chest-pain.json -o nodes.json
 * }</pre>
 */
@Command(
    name = "pathway-graph",
    mixinStandardHelpOptions = true,
    version = "pathway-graph 1.0.0-SNAPSHOT",
    description = "Clinical pathway graph synthesis and diagram rendering",
    subcommands = {
        RenderCommand.class,
        ConvertCommand.class,
        ValidateCommand.class,
        ExportCommand.class
    }
)
public class PathwayGraphCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("pathway-graph - Clinical pathway diagram generator");
        System.out.println();
        System.out.println("Use 'pathway-graph --help' to see available commands");
        System.out.println("Use 'pathway-graph <command> --help' for command-specific help");
    }

    /**
     * Sets the Logback root level from the global options.
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
    }

    /**
     * Creates the command line with logging configured ahead of the executed subcommand.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        PathwayGraphCLI cli = new PathwayGraphCLI();
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
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
