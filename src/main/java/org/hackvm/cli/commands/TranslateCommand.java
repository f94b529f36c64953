package org.hackvm.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.hackvm.cli.CommandLineInterface;
import org.hackvm.cli.config.ConfigLoader;
import org.hackvm.cli.config.LoggingConfigurator;
import org.hackvm.translator.VmTranslator;
import org.hackvm.translator.api.AssemblyProgram;
import org.hackvm.translator.api.AssemblyProgramWriter;
import org.hackvm.translator.api.BootstrapMode;
import org.hackvm.translator.api.TranslationException;
import org.hackvm.translator.api.TranslatorErrorCode;
import org.hackvm.translator.api.TranslatorOptions;
import org.hackvm.translator.diagnostics.TranslatorLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "translate", description = "Translates a .vm file or a directory of .vm files into Hack assembly.")
public class TranslateCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(TranslateCommand.class);

    @Parameters(index = "0", paramLabel = "PATH", description = "A .vm file, or a directory whose .vm files form one program.")
    private File input;

    @Option(names = {"-o", "--output"}, description = "The assembly file to write (default: next to the input).")
    private File output;

    @Option(names = {"-b", "--bootstrap"}, description = "Bootstrap policy: auto, always or never (default: from configuration).")
    private String bootstrap;

    @Option(names = "--no-annotate", description = "Do not emit a comment line before each command's code.")
    private boolean noAnnotate;

    @Option(names = {"-v", "--verbose"}, description = "Increase log verbosity; repeat for more detail.")
    private boolean[] verbose = new boolean[0];

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final TranslatorOptions options;
        try {
            options = resolveOptions();
        } catch (ConfigException | IllegalArgumentException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            spec.commandLine().getErr().println("Invalid configuration: " + e.getMessage());
            return 1;
        }

        LoggingConfigurator.applyVerbosity(verbose.length);
        VmTranslator translator = new VmTranslator(options);
        translator.setVerbosity(TranslatorLogger.INFO + verbose.length);

        Path inputPath = input.toPath();
        Path outputPath = output != null ? output.toPath() : AssemblyProgramWriter.defaultOutputFor(inputPath);
        try {
            AssemblyProgram program = translator.translate(inputPath);
            write(program, outputPath);
        } catch (TranslationException e) {
            LOG.error(e.getMessage());
            spec.commandLine().getErr().println(e.getMessage());
            return 1;
        }

        spec.commandLine().getOut().println("Translated: " + outputPath);
        return 0;
    }

    private TranslatorOptions resolveOptions() {
        Config config = parent != null ? parent.getConfig() : ConfigLoader.load(null);
        TranslatorOptions options = TranslatorOptions.fromConfig(config);
        if (bootstrap != null) {
            options = options.withBootstrapMode(BootstrapMode.parse(bootstrap));
        }
        if (noAnnotate) {
            options = options.withAnnotate(false);
        }
        return options;
    }

    private static void write(AssemblyProgram program, Path outputPath) throws TranslationException {
        try {
            AssemblyProgramWriter.write(program, outputPath);
        } catch (IOException e) {
            throw new TranslationException(TranslatorErrorCode.IO_ERROR_WRITING_FILE,
                    "Cannot write " + outputPath + ": " + e.getMessage(), e);
        }
    }
}
