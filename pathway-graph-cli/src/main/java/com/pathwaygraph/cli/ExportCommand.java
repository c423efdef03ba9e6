package com.pathwaygraph.cli;

import com.pathwaygraph.core.document.PathwayMarkdownWriter;
import com.pathwaygraph.core.model.NodeList;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Writes a Markdown pathway document with an embedded Mermaid flowchart.
 */
@Command(
    name = "export",
    description = "Export a pathway as a Markdown document",
    mixinStandardHelpOptions = true
)
public class ExportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExportCommand.class);

    @Parameters(index = "0", description = "Node-list JSON file (or pathway JSON with --pathway)")
    private Path inputFile;

    @Option(names = "--pathway", description = "Input is a structured pathway JSON")
    private boolean pathwayJson;

    @Option(names = "--condition", description = "Condition name (node-list input)")
    private String conditionName;

    @Option(names = "--setting", description = "Clinical setting (node-list input)", defaultValue = "ED")
    private String setting;

    @Option(names = {"-o", "--output"}, description = "Output file (default: standard output)")
    private Path outputFile;

    @Override
    public Integer call() {
        try {
            PathwayMarkdownWriter writer = new PathwayMarkdownWriter();
            String markdown;
            if (pathwayJson) {
                markdown = writer.write(NodeInput.readPathway(inputFile));
            } else {
                NodeList nodes = NodeInput.readNodes(inputFile, false);
                markdown = writer.write(nodes, conditionName, setting);
            }

            if (outputFile != null) {
                NodeInput.writeString(outputFile, markdown);
                System.out.println("✓ Wrote: " + outputFile.toAbsolutePath());
            } else {
                System.out.println(markdown);
            }
            return 0;
        } catch (Exception e) {
            log.error("Export failed", e);
            System.err.println("✗ Export failed: " + e.getMessage());
            return 1;
        }
    }
}
