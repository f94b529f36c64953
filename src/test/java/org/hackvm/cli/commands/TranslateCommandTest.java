package org.hackvm.cli.commands;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.hackvm.cli.CommandLineInterface;
import org.hackvm.cli.config.LoggingConfigurator;
import org.hackvm.translator.diagnostics.TranslatorLogger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the {@code translate} subcommand through picocli against files in a temporary directory.
 */
public class TranslateCommandTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        LoggingConfigurator.reset();
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(LoggingConfigurator.APPLICATION_LOGGER).setLevel(null);
        TranslatorLogger.setLevel(TranslatorLogger.INFO);
    }

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new CommandLineInterface());
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    @Test
    @Tag("unit")
    void translatesFileNextToInput() throws Exception {
        // Arrange
        Path file = Files.writeString(tempDir.resolve("SimpleAdd.vm"), "push constant 7\npush constant 8\nadd\n");
        Path expected = tempDir.toAbsolutePath().normalize().resolve("SimpleAdd.asm");

        // Act
        int exitCode = run("translate", file.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(expected).exists();
        assertThat(Files.readAllLines(expected)).contains("// push constant 7", "(HACKVM.END)").doesNotContain("// bootstrap");
        assertThat(out.toString()).contains("Translated: " + expected);
    }

    @Test
    @Tag("unit")
    void translatesDirectoryIntoGivenOutput() throws Exception {
        // Arrange
        Path dir = Files.createDirectory(tempDir.resolve("Prog"));
        Files.writeString(dir.resolve("Sys.vm"), "function Sys.init 0\nlabel L\ngoto L\n");
        Path output = tempDir.resolve("build").resolve("prog.asm");

        // Act
        int exitCode = run("translate", dir.toString(), "-o", output.toString());

        // Assert
        assertThat(exitCode).isZero();
        List<String> lines = Files.readAllLines(output);
        assertThat(lines.subList(0, 2)).containsExactly("// bootstrap", "@256");
        assertThat(dir.resolve("Prog.asm")).doesNotExist();
    }

    @Test
    @Tag("unit")
    void optionsOverrideConfiguration() throws Exception {
        Path dir = Files.createDirectory(tempDir.resolve("Prog"));
        Files.writeString(dir.resolve("Main.vm"), "push constant 1\n");

        int exitCode = run("translate", dir.toString(), "--bootstrap", "never", "--no-annotate");

        assertThat(exitCode).isZero();
        List<String> lines = Files.readAllLines(dir.resolve("Prog.asm"));
        assertThat(lines).noneMatch(l -> l.startsWith("//"));
        assertThat(lines.get(0)).isEqualTo("@1");
    }

    @Test
    @Tag("unit")
    void verboseFlagsRaiseLogDetail() throws Exception {
        Path file = Files.writeString(tempDir.resolve("Main.vm"), "push constant 1\n");

        int exitCode = run("translate", file.toString(), "-vv");

        assertThat(exitCode).isZero();
        assertThat(TranslatorLogger.getLevel()).isEqualTo(TranslatorLogger.TRACE);
        assertThat(((LoggerContext) LoggerFactory.getILoggerFactory())
                .getLogger(LoggingConfigurator.APPLICATION_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    @Tag("unit")
    void readsConfigurationFile() throws Exception {
        Path config = Files.writeString(tempDir.resolve("custom.conf"), "translator { annotate = false, end-loop = false }");
        Path file = Files.writeString(tempDir.resolve("Main.vm"), "push constant 1\n");

        int exitCode = run("-c", config.toString(), "translate", file.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readAllLines(tempDir.resolve("Main.asm")))
                .containsExactly("@1", "D=A", "@SP", "A=M", "M=D", "@SP", "M=M+1");
    }

    @Test
    @Tag("unit")
    void reportsTranslationErrorWithLocation() throws Exception {
        Path file = Files.writeString(tempDir.resolve("Bad.vm"), "push constant 1\nmul\n");

        int exitCode = run("translate", file.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("[UNKNOWN_COMMAND] Bad.vm:2: Unknown command 'mul' (mul)");
        assertThat(tempDir.resolve("Bad.asm")).doesNotExist();
    }

    @Test
    @Tag("unit")
    void reportsMissingInput() {
        int exitCode = run("translate", tempDir.resolve("Nope.vm").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("[NO_SOURCES_FOUND]");
    }

    @Test
    @Tag("unit")
    void rejectsUnknownBootstrapMode() throws Exception {
        Path file = Files.writeString(tempDir.resolve("Main.vm"), "push constant 1\n");

        int exitCode = run("translate", file.toString(), "--bootstrap", "sometimes");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Invalid configuration");
    }

    @Test
    @Tag("unit")
    void rejectsMissingConfigurationFile() throws Exception {
        Path file = Files.writeString(tempDir.resolve("Main.vm"), "push constant 1\n");

        int exitCode = run("-c", tempDir.resolve("missing.conf").toString(), "translate", file.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("missing.conf");
    }
}
