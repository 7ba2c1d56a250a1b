package org.ember.cli;

import org.ember.config.LoggingConfigurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains integration tests that run the command line entry point against script files
 * and check the output streams and exit codes.
 */
public class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        out = new StringWriter();
        err = new StringWriter();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    private int execute(String... args) {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private Path script(String source) throws IOException {
        Path file = tempDir.resolve("script.em");
        Files.writeString(file, source, StandardCharsets.UTF_8);
        return file;
    }

    /**
     * Verifies that a script runs and its print output goes to stdout.
     */
    @Test
    @Tag("integration")
    void testRunsScript() throws IOException {
        // Arrange
        Path file = script("for (var i = 1; i <= 3; i = i + 1) print i * i;");

        // Act
        int exitCode = execute(file.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("1", "4", "9");
        assertThat(err.toString()).isEmpty();
    }

    /**
     * Verifies that syntax errors go to stderr with exit code 65.
     */
    @Test
    @Tag("integration")
    void testSyntaxErrorExitCode() throws IOException {
        // Arrange
        Path file = script("print 1\nprint 2;");

        // Act
        int exitCode = execute(file.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_SYNTAX_ERROR);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).contains("[line 2] Error: Expect ';' after value. Found 'print'.");
    }

    /**
     * Verifies that a runtime error goes to stderr with exit code 70, after the output
     * of the statements before it.
     */
    @Test
    @Tag("integration")
    void testRuntimeErrorExitCode() throws IOException {
        // Arrange
        Path file = script("print \"before\";\nprint -nil;");

        // Act
        int exitCode = execute(file.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_RUNTIME_ERROR);
        assertThat(out.toString().lines()).containsExactly("before");
        assertThat(err.toString()).contains("[line 2] Runtime Error: Operand must be a number.");
    }

    @Test
    @Tag("integration")
    void testMissingScriptFile() {
        // Act
        int exitCode = execute(tempDir.resolve("absent.em").toString());

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_IO_ERROR);
        assertThat(err.toString()).contains("Could not read script");
    }

    /**
     * Verifies that {@code --dump-ast} prints the parsed program without running it.
     */
    @Test
    @Tag("integration")
    void testDumpAst() throws IOException {
        // Arrange
        Path file = script("var x = 1 + 2; print x;");

        // Act
        int exitCode = execute("--dump-ast", file.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("(var x (+ 1 2))", "(print x)");
    }

    /**
     * Verifies that a {@code --config} path that does not exist gives exit code 78
     * and the script is not run.
     */
    @Test
    @Tag("integration")
    void testMissingConfigFile() throws IOException {
        // Arrange
        Path file = script("print 1;");

        // Act
        int exitCode = execute("--config", tempDir.resolve("nope.conf").toString(), file.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_CONFIG_ERROR);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @Tag("integration")
    void testExplicitConfigFileIsAccepted() throws IOException {
        // Arrange
        Path config = tempDir.resolve("custom.conf");
        Files.writeString(config, "ember.repl.prompt = \"ember> \"\n", StandardCharsets.UTF_8);
        Path file = script("print \"configured\";");

        // Act
        int exitCode = execute("-c", config.toString(), file.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("configured");
    }
}
