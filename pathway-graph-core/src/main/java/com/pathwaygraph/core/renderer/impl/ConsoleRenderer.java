package com.pathwaygraph.core.renderer.impl;

import com.pathwaygraph.core.renderer.GeneratedFile;
import com.pathwaygraph.core.renderer.GeneratedOutput;
import com.pathwaygraph.core.renderer.OutputRenderer;
import com.pathwaygraph.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Prints generated files to a stream, standard output by default.
 *
 * <p><b>Settings:</b>
 * <ul>
 *   <li>{@code console.headers} - print a {@code %% file: name} style header before each file
 *       ("true"/"false", default "true")</li>
 * </ul>
 * Headers use the comment syntax of the file's content type ({@code %%} for Mermaid, {@code //}
 * for DOT), so that the printed text can still be piped into the diagram tools.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRenderer.class);

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.headers", "true"));
        log.debug("Printing {} files (headers: {})", output.files().size(), showHeaders);

        for (int i = 0; i < output.files().size(); i++) {
            GeneratedFile file = output.files().get(i);
            if (i > 0) {
                out.println();
            }
            if (showHeaders) {
                out.println(commentPrefix(file) + " file: " + file.relativePath());
            }
            out.println(file.content());
        }
        out.flush();
    }

    private static String commentPrefix(GeneratedFile file) {
        if (file.contentType() == null) {
            return "#";
        }
        return switch (file.contentType()) {
            case "text/vnd.mermaid" -> "%%";
            case "text/vnd.graphviz" -> "//";
            default -> "#";
        };
    }
}
