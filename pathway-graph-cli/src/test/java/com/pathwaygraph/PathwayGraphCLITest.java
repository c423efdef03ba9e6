package com.pathwaygraph;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PathwayGraphCLI}.
 */
class PathwayGraphCLITest {

    private final PrintStream originalOut = System.out;
    private ByteArrayOutputStream out;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        rootLogger().setLevel(ch.qos.logback.classic.Level.INFO);
    }

    private static ch.qos.logback.classic.Logger rootLogger() {
        return (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    }

    @Test
    void noSubcommand_printsUsageHint() {
        int exitCode = PathwayGraphCLI.createCommandLine().execute();

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("Use 'pathway-graph --help'");
    }

    @Test
    void createCommandLine_registersAllSubcommands() {
        CommandLine commandLine = PathwayGraphCLI.createCommandLine();

        assertThat(commandLine.getSubcommands()).containsKeys("render", "convert", "validate", "export");
    }

    @Test
    void verboseFlag_setsDebugLevel() {
        PathwayGraphCLI.createCommandLine().execute("-v");

        assertThat(rootLogger().getLevel()).isEqualTo(ch.qos.logback.classic.Level.DEBUG);
    }

    @Test
    void quietFlag_setsErrorLevelAndPrintsNothing() {
        PathwayGraphCLI.createCommandLine().execute("-q");

        assertThat(rootLogger().getLevel()).isEqualTo(ch.qos.logback.classic.Level.ERROR);
        assertThat(out.toString(StandardCharsets.UTF_8)).isEmpty();
    }
}
