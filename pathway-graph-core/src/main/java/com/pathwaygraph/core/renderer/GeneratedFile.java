package com.pathwaygraph.core.renderer;

import java.util.Objects;

import com.pathwaygraph.core.generator.GeneratedDiagram;

/**
 * A generated text file awaiting output.
 *
 * @param relativePath path relative to the output directory, e.g. "pathway.mmd"
 * @param content file content
 * @param contentType media type, e.g. "text/vnd.mermaid"
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Wraps a generated diagram, deriving the media type from its file extension.
     *
     * @param diagram generated diagram
     * @return file named after the diagram
     */
    public static GeneratedFile of(GeneratedDiagram diagram) {
        return new GeneratedFile(diagram.fileName(), diagram.content(), contentTypeFor(diagram.fileExtension()));
    }

    static String contentTypeFor(String extension) {
        return switch (extension) {
            case "mmd" -> "text/vnd.mermaid";
            case "dot" -> "text/vnd.graphviz";
            case "md" -> "text/markdown";
            case "json" -> "application/json";
            default -> "text/plain";
        };
    }
}
