package com.pathwaygraph.core.renderer.impl;

import com.pathwaygraph.core.renderer.GeneratedFile;
import com.pathwaygraph.core.renderer.RendererTestBase;
import com.pathwaygraph.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest extends RendererTestBase {

    private ByteArrayOutputStream buffer;
    private ConsoleRenderer renderer;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        renderer = new ConsoleRenderer(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return buffer.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_printsHeadersInFileCommentSyntax() {
        renderer.render(output(mermaidFile("pathway", "graph TD"), dotFile("pathway", "digraph G {}")), context);

        assertThat(printed()).isEqualTo("%% file: pathway.mmd\ngraph TD\n\n// file: pathway.dot\ndigraph G {}\n");
    }

    @Test
    void render_withOtherExtension_usesHashHeader() {
        renderer.render(output(new GeneratedFile("pathway.md", "# Sepsis", "text/markdown")), context);

        assertThat(printed()).startsWith("# file: pathway.md\n");
    }

    @Test
    void render_choosesHeaderFromContentType() {
        renderer.render(output(
            new GeneratedFile("diagram.txt", "digraph G {}", "text/vnd.graphviz"),
            new GeneratedFile("notes.mmd", "plain", "text/plain"),
            new GeneratedFile("untyped.mmd", "plain", null)), context);

        assertThat(printed()).isEqualTo(
            "// file: diagram.txt\ndigraph G {}\n\n# file: notes.mmd\nplain\n\n# file: untyped.mmd\nplain\n");
    }

    @Test
    void render_withHeadersDisabled_printsContentOnly() {
        RenderContext quiet = new RenderContext(tempDir.toString(), Map.of("console.headers", "false"));

        renderer.render(output(mermaidFile("pathway", "graph TD")), quiet);

        assertThat(printed()).isEqualTo("graph TD\n");
    }

    @Test
    void render_doesNotWriteFiles() {
        renderer.render(output(mermaidFile("pathway", "graph TD")), context);

        assertThat(fileExists("pathway.mmd")).isFalse();
    }
}
