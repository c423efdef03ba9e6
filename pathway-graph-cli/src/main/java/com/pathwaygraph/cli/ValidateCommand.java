package com.pathwaygraph.cli;

import com.pathwaygraph.core.graph.IssueSeverity;
import com.pathwaygraph.core.graph.StructuralIssue;
import com.pathwaygraph.core.graph.StructuralValidator;
import com.pathwaygraph.core.model.NodeList;
import com.pathwaygraph.core.util.PathwaySummarizer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Summarizes a node list and reports its structural issues. Exits with 1 when any issue is
 * an error.
 */
@Command(
    name = "validate",
    description = "Summarize a pathway and report structural issues",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Node-list JSON file (or pathway JSON with --pathway)")
    private Path inputFile;

    @Option(names = "--pathway", description = "Input is a structured pathway JSON")
    private boolean pathwayJson;

    @Override
    public Integer call() {
        try {
            log.info("Validating pathway: {}", inputFile);
            NodeList nodes = NodeInput.readNodes(inputFile, pathwayJson);
            System.out.println(PathwaySummarizer.summarize(nodes));
            System.out.println();

            List<StructuralIssue> issues = StructuralValidator.validate(nodes);
            for (StructuralIssue issue : issues) {
                String where = issue.position() >= 0 ? " at position " + issue.position() : "";
                System.out.println("  " + issue.severity() + " " + issue.kind() + where + ": " + issue.message());
            }

            long errors = issues.stream().filter(issue -> issue.severity() == IssueSeverity.ERROR).count();
            if (errors > 0) {
                System.out.println("✗ " + errors + " error(s), " + (issues.size() - errors) + " warning(s)");
                return 1;
            }
            System.out.println("✓ No structural errors (" + issues.size() + " warning(s))");
            return 0;
        } catch (Exception e) {
            log.error("Validation failed", e);
            System.err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }
}
