package com.pathwaygraph.core.generator;

import java.util.Objects;

/**
 * Diagram source text produced by a {@link DiagramGenerator}.
 *
 * @param name base file name, e.g. "pathway"
 * @param content diagram source (Mermaid, DOT)
 * @param fileExtension extension without leading dot, e.g. "mmd"
 */
public record GeneratedDiagram(
    String name,
    String content,
    String fileExtension
) {
    public GeneratedDiagram {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }

    /**
     * Returns the file name the diagram is written to.
     *
     * @return name plus extension, e.g. "pathway.dot"
     */
    public String fileName() {
        return name + "." + fileExtension;
    }
}
