package com.pathwaygraph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pathwaygraph.core.generator.GeneratorConfig;
import com.pathwaygraph.core.generator.Orientation;

import java.util.List;
import java.util.Map;

/**
 * Root configuration for pathway-graph runs.
 *
 * <p>Loaded from {@code pathwaygraph.yaml}. Sections that are absent take their defaults, so
 * a file containing only {@code output.console} is valid. Unknown sections are ignored.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * diagrams:
 *   styling: true
 *   orientation: horizontal
 *   formats:
 *     - mermaid
 *     - dot
 *
 * output:
 *   directory: "./pathway-diagrams"
 *   console: false
 * }</pre>
 *
 * @param diagrams diagram generation settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("diagrams") DiagramSettings diagrams,
    @JsonProperty("output") OutputConfig output
) {
    public ProjectConfig {
        if (diagrams == null) {
            diagrams = DiagramSettings.defaults();
        }
        if (output == null) {
            output = OutputConfig.defaults();
        }
    }

    /**
     * Creates the default configuration: both formats, styled, vertical, written to
     * {@code ./pathway-diagrams}.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(DiagramSettings.defaults(), OutputConfig.defaults());
    }

    /**
     * Diagram generation settings.
     *
     * @param styling whether the flowchart emits style classes (default true)
     * @param orientation {@code vertical} or {@code horizontal} (default vertical)
     * @param formats generator ids to run (default mermaid and dot)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DiagramSettings(
        @JsonProperty("styling") Boolean styling,
        @JsonProperty("orientation") String orientation,
        @JsonProperty("formats") List<String> formats
    ) {
        public DiagramSettings {
            formats = formats == null || formats.isEmpty() ? List.of("mermaid", "dot") : List.copyOf(formats);
        }

        static DiagramSettings defaults() {
            return new DiagramSettings(true, "vertical", null);
        }

        public boolean isEnabled(String generatorId) {
            return formats.contains(generatorId);
        }

        /**
         * Builds the generator configuration for these settings.
         *
         * @param diagramName base file name of the generated diagrams
         * @return generator config
         * @throws IllegalArgumentException if the orientation is not recognized
         */
        public GeneratorConfig toGeneratorConfig(String diagramName) {
            return new GeneratorConfig(styling == null || styling, Orientation.fromValue(orientation),
                Map.of("name", diagramName));
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory path
     * @param console whether to print diagrams instead of writing files
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("console") Boolean console
    ) {
        /** Output directory used when none is configured. */
        public static final String DEFAULT_DIRECTORY = "./pathway-diagrams";

        public OutputConfig {
            if (directory == null || directory.isBlank()) {
                directory = DEFAULT_DIRECTORY;
            }
        }

        static OutputConfig defaults() {
            return new OutputConfig(DEFAULT_DIRECTORY, false);
        }

        public boolean isConsole() {
            return console != null && console;
        }
    }
}
