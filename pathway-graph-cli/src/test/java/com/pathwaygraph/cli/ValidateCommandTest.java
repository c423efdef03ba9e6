package com.pathwaygraph.cli;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest extends CommandTestBase {

    @Test
    void validate_validList_printsSummaryAndSucceeds() throws IOException {
        Path input = write("syncope.json", SYNCOPE_NODES);

        int exitCode = run("validate", input.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout())
            .contains("Pathway with 5 nodes (1 Start, 1 Decision, 1 Process, 2 End)")
            .contains("✓ No structural errors");
    }

    @Test
    void validate_unknownBranchTarget_reportsErrorAndFails() throws IOException {
        Path input = write("broken.json", """
            [
              {"type": "Start", "label": "Patient presents with fever"},
              {"type": "Decision", "label": "Septic?", "branches": [{"label": "Yes", "target": 9}]},
              {"type": "End", "label": "Discharge"}
            ]
            """);

        int exitCode = run("validate", input.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stdout())
            .contains("ERROR INVALID_TARGET at position 1")
            .contains("✗ 1 error(s)");
    }

    @Test
    void validate_pathwayInput_validatesFlattenedList() throws IOException {
        Path input = write("sepsis.json", SEPSIS_PATHWAY);

        int exitCode = run("validate", input.toString(), "--pathway");

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("Starts with: 'Patient presents to ED with fever'");
    }

    @Test
    void validate_missingFile_fails() {
        int exitCode = run("validate", tempDir.resolve("missing.json").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("✗ Validation failed: Cannot read node list file");
    }
}
