package com.pathwaygraph.cli;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RenderCommand}.
 */
class RenderCommandTest extends CommandTestBase {

    @Test
    void render_writesMermaidAndDotFiles() throws IOException {
        Path input = write("syncope.json", SYNCOPE_NODES);
        Path outputDir = tempDir.resolve("diagrams");

        int exitCode = run("render", input.toString(), "-c", missingConfig(), "-o", outputDir.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(outputDir.resolve("pathway.mmd")))
            .startsWith("graph TD")
            .contains("-->|\"Yes\"|");
        assertThat(Files.readString(outputDir.resolve("pathway.dot")))
            .startsWith("digraph G {")
            .contains("rankdir=TB");
        assertThat(stdout()).contains("✓ Loaded 5 nodes", "✓ Wrote 2 diagrams");
    }

    @Test
    void render_withFormatAndName_writesOnlySelectedGenerator() {
        Path outputDir = tempDir.resolve("out");

        int exitCode = run("render", writeQuietly("syncope.json", SYNCOPE_NODES).toString(),
            "-c", missingConfig(), "-o", outputDir.toString(), "-f", "dot", "--name", "syncope");

        assertThat(exitCode).isZero();
        assertThat(outputDir.resolve("syncope.dot")).exists();
        assertThat(outputDir.resolve("syncope.mmd")).doesNotExist();
    }

    @Test
    void render_withStdout_printsDiagramsWithoutStatusLines() {
        int exitCode = run("render", writeQuietly("syncope.json", SYNCOPE_NODES).toString(),
            "-c", missingConfig(), "--stdout", "--orientation", "horizontal", "--no-styling");

        assertThat(exitCode).isZero();
        assertThat(stdout())
            .startsWith("%% file: pathway.mmd\ngraph LR")
            .contains("// file: pathway.dot", "rankdir=LR")
            .doesNotContain("classDef")
            .doesNotContain("✓");
    }

    @Test
    void render_withPathwayInput_flattensPathwayFirst() {
        int exitCode = run("render", writeQuietly("sepsis.json", SEPSIS_PATHWAY).toString(), "--pathway",
            "-c", missingConfig(), "--stdout", "-f", "mermaid");

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("Patient presents to ED with fever", "ERU/Critical Care");
    }

    @Test
    void render_withConfigFile_usesConfiguredFormatsAndDirectory() throws IOException {
        Path outputDir = tempDir.resolve("configured");
        Path config = write("pathwaygraph.yaml", """
            diagrams:
              formats: [mermaid]
            output:
              directory: "%s"
            """.formatted(outputDir.toString().replace("\\", "/")));

        int exitCode = run("render", writeQuietly("syncope.json", SYNCOPE_NODES).toString(), "-c", config.toString());

        assertThat(exitCode).isZero();
        assertThat(outputDir.resolve("pathway.mmd")).exists();
        assertThat(outputDir.resolve("pathway.dot")).doesNotExist();
    }

    @Test
    void render_withOutputSectionWithoutDirectory_succeeds() throws IOException {
        Path config = write("pathwaygraph.yaml", """
            output:
              console: true
            """);

        int exitCode = run("render", writeQuietly("syncope.json", SYNCOPE_NODES).toString(), "-c", config.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("%% file: pathway.mmd", "// file: pathway.dot");
        assertThat(stderr()).doesNotContain("✗");
    }

    @Test
    void render_withUnknownFormat_fails() {
        int exitCode = run("render", writeQuietly("syncope.json", SYNCOPE_NODES).toString(),
            "-c", missingConfig(), "--stdout", "-f", "svg");

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("✗ Render failed: No diagram generator matches formats [svg]");
    }

    @Test
    void render_withMalformedInput_fails() {
        int exitCode = run("render", writeQuietly("broken.json", "[{").toString(), "-c", missingConfig());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("✗ Render failed: Malformed node list JSON");
    }

    private Path writeQuietly(String fileName, String content) {
        try {
            return write(fileName, content);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}
