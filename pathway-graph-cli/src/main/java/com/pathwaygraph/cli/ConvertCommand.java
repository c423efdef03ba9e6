package com.pathwaygraph.cli;

import com.pathwaygraph.core.convert.PathwayNodeConverter;
import com.pathwaygraph.core.convert.PathwayReconstruction;
import com.pathwaygraph.core.json.NodeListReader;
import com.pathwaygraph.core.json.NodeListWriter;
import com.pathwaygraph.core.json.PathwayJsonCodec;
import com.pathwaygraph.core.model.ClinicalPathway;
import com.pathwaygraph.core.model.NodeList;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Converts a structured pathway into a node list, or with {@code --reverse} a node list back
 * into a best-effort pathway.
 */
@Command(
    name = "convert",
    description = "Convert pathway JSON to node-list JSON, or back with --reverse",
    mixinStandardHelpOptions = true
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Parameters(index = "0", description = "Input JSON file")
    private Path inputFile;

    @Option(names = "--reverse", description = "Convert a node list into pathway JSON")
    private boolean reverse;

    @Option(names = {"-o", "--output"}, description = "Output file (default: standard output)")
    private Path outputFile;

    @Option(names = "--condition", description = "Condition name for --reverse")
    private String conditionName;

    @Option(names = "--setting", description = "Clinical setting for --reverse")
    private String setting;

    @Override
    public Integer call() {
        try {
            String result = reverse ? toPathway() : toNodes();
            if (outputFile != null) {
                NodeInput.writeString(outputFile, result);
                System.out.println("✓ Wrote: " + outputFile.toAbsolutePath());
            } else {
                System.out.println(result);
            }
            return 0;
        } catch (Exception e) {
            log.error("Conversion failed", e);
            System.err.println("✗ Conversion failed: " + e.getMessage());
            return 1;
        }
    }

    private String toNodes() {
        ClinicalPathway pathway = NodeInput.readPathway(inputFile);
        NodeList nodes = PathwayNodeConverter.pathwayToNodes(pathway);
        log.info("Converted pathway '{}' to {} nodes", pathway.conditionName(), nodes.size());
        return new NodeListWriter().write(nodes);
    }

    private String toPathway() {
        NodeList nodes = new NodeListReader().read(inputFile);
        PathwayReconstruction reconstruction = PathwayNodeConverter.nodesToPathway(nodes, conditionName, setting);
        System.err.println("Reconstruction confidence: " + reconstruction.confidence());
        for (String warning : reconstruction.warnings()) {
            System.err.println("  ! " + warning);
        }
        return new PathwayJsonCodec().export(reconstruction.pathway());
    }
}
