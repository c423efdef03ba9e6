package com.pathwaygraph.cli;

import com.pathwaygraph.core.config.ConfigLoader;
import com.pathwaygraph.core.config.ProjectConfig;
import com.pathwaygraph.core.generator.DiagramGenerator;
import com.pathwaygraph.core.generator.GeneratedDiagram;
import com.pathwaygraph.core.generator.GeneratorConfig;
import com.pathwaygraph.core.generator.Orientation;
import com.pathwaygraph.core.graph.PathwayGraph;
import com.pathwaygraph.core.graph.StructuralIssue;
import com.pathwaygraph.core.graph.StructuralValidator;
import com.pathwaygraph.core.model.NodeList;
import com.pathwaygraph.core.renderer.GeneratedFile;
import com.pathwaygraph.core.renderer.GeneratedOutput;
import com.pathwaygraph.core.renderer.OutputRenderer;
import com.pathwaygraph.core.renderer.RenderContext;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Renders a node list (or a structured pathway) with every enabled diagram generator.
 *
 * <p>Command-line options override the corresponding {@code pathwaygraph.yaml} settings.
 * Generators and renderers are discovered through {@link ServiceLoader}.
 */
@Command(
    name = "render",
    description = "Render a pathway as Mermaid and Graphviz DOT diagrams",
    mixinStandardHelpOptions = true
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    @Parameters(index = "0", description = "Node-list JSON file (or pathway JSON with --pathway)")
    private Path inputFile;

    @Option(names = "--pathway", description = "Input is a structured pathway JSON")
    private boolean pathwayJson;

    @Option(names = {"-c", "--config"}, description = "Configuration file")
    private Path configFile = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides output.directory)")
    private Path outputDir;

    @Option(names = "--stdout", description = "Print diagrams instead of writing files")
    private boolean stdout;

    @Option(names = "--orientation", description = "vertical (TD) or horizontal (LR)")
    private String orientation;

    @Option(names = "--no-styling", description = "Omit Mermaid style classes")
    private boolean noStyling;

    @Option(names = {"-f", "--format"}, split = ",", description = "Generator ids to run, e.g. mermaid,dot")
    private List<String> formats;

    @Option(names = "--name", description = "Base file name of the diagrams")
    private String diagramName = GeneratorConfig.DEFAULT_NAME;

    @Override
    public Integer call() {
        try {
            ProjectConfig config = ConfigLoader.load(configFile);
            boolean toConsole = stdout || config.output().isConsole();

            NodeList nodes = NodeInput.readNodes(inputFile, pathwayJson);
            PathwayGraph graph = PathwayGraph.of(nodes);
            for (StructuralIssue issue : StructuralValidator.validate(nodes)) {
                log.warn("{} at position {}: {}", issue.kind(), issue.position(), issue.message());
            }
            status(toConsole, "✓ Loaded " + nodes.size() + " nodes, synthesized " + graph.edges().size() + " edges");

            GeneratorConfig generatorConfig = generatorConfig(config);
            boolean formatsGiven = formats != null && !formats.isEmpty();
            List<String> enabled = formatsGiven ? formats : config.diagrams().formats();
            List<GeneratedFile> files = new ArrayList<>();
            for (DiagramGenerator generator : discoverGenerators()) {
                boolean selected = formatsGiven
                    ? formats.contains(generator.getId())
                    : config.diagrams().isEnabled(generator.getId());
                if (!selected) {
                    log.debug("Skipping disabled generator: {}", generator.getId());
                    continue;
                }
                GeneratedDiagram diagram = generator.generate(graph, generatorConfig);
                files.add(GeneratedFile.of(diagram));
                status(toConsole, "  → " + generator.getDisplayName() + ": " + diagram.fileName());
            }
            if (files.isEmpty()) {
                throw new IllegalStateException("No diagram generator matches formats " + enabled);
            }

            String outputDirectory = outputDir != null ? outputDir.toString() : config.output().directory();
            OutputRenderer renderer = findRenderer(toConsole ? "console" : "filesystem");
            renderer.render(new GeneratedOutput(files), new RenderContext(outputDirectory, Map.of()));

            status(toConsole, "✓ Wrote " + files.size() + " diagrams to: " + Paths.get(outputDirectory).toAbsolutePath());
            return 0;
        } catch (Exception e) {
            log.error("Render failed", e);
            System.err.println("✗ Render failed: " + e.getMessage());
            return 1;
        }
    }

    private GeneratorConfig generatorConfig(ProjectConfig config) {
        GeneratorConfig base = config.diagrams().toGeneratorConfig(diagramName);
        Orientation effectiveOrientation = orientation != null ? Orientation.fromValue(orientation) : base.orientation();
        return new GeneratorConfig(base.includeStyling() && !noStyling, effectiveOrientation, base.customSettings());
    }

    private static List<DiagramGenerator> discoverGenerators() {
        List<DiagramGenerator> generators = new ArrayList<>();
        ServiceLoader.load(DiagramGenerator.class).forEach(generators::add);
        log.debug("Discovered {} diagram generators", generators.size());
        return generators;
    }

    private static OutputRenderer findRenderer(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (id.equals(renderer.getId())) {
                return renderer;
            }
        }
        throw new IllegalStateException("Output renderer not found: " + id);
    }

    /**
     * Prints a progress line unless diagrams go to standard output.
     */
    private static void status(boolean toConsole, String message) {
        if (!toConsole) {
            System.out.println(message);
        }
    }
}
