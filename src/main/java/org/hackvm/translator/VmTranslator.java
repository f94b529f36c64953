package org.hackvm.translator;

import org.hackvm.translator.api.AssemblyProgram;
import org.hackvm.translator.api.ITranslator;
import org.hackvm.translator.api.SourceInfo;
import org.hackvm.translator.api.TranslationException;
import org.hackvm.translator.api.TranslatorOptions;
import org.hackvm.translator.api.VmSource;
import org.hackvm.translator.backend.emit.CodeWriter;
import org.hackvm.translator.diagnostics.TranslatorLogger;
import org.hackvm.translator.frontend.parser.Parser;
import org.hackvm.translator.frontend.source.SourceLoader;
import org.hackvm.translator.ir.Command;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * The main translator implementation. This class drives a whole translation:
 * it feeds every line of every source through the {@link Parser} into one shared
 * {@link CodeWriter}, and prepends bootstrap code for multi-file programs.
 * <p>
 * The first error aborts the translation; no partial program is returned.
 * Each call to {@code translate} uses a fresh {@link CodeWriter}, so translations never share state.
 */
public class VmTranslator implements ITranslator {

    private final TranslatorOptions options;
    private final SourceLoader sourceLoader;
    private final Parser parser = new Parser();
    private int verbosity = -1;

    /**
     * Creates a translator with default options.
     */
    public VmTranslator() {
        this(TranslatorOptions.defaults());
    }

    /**
     * @param options The translator options.
     */
    public VmTranslator(TranslatorOptions options) {
        this(options, new SourceLoader());
    }

    /**
     * @param options The translator options.
     * @param sourceLoader Reads the sources of path inputs.
     */
    public VmTranslator(TranslatorOptions options, SourceLoader sourceLoader) {
        this.options = options;
        this.sourceLoader = sourceLoader;
    }

    /**
     * {@inheritDoc}
     * <p>
     * The program is named after the input: the directory name, or the file name without extension.
     */
    @Override
    public AssemblyProgram translate(Path input) throws TranslationException {
        List<VmSource> sources = sourceLoader.load(input);
        boolean directory = sourceLoader.isDirectory(input);
        boolean bootstrap = options.bootstrapMode().appliesTo(directory);
        String programName = programNameOf(input, directory);
        TranslatorLogger.debug("Translator: " + programName + " (" + sources.size() + " file(s), bootstrap=" + bootstrap + ")");
        return translate(sources, programName, bootstrap);
    }

    @Override
    public AssemblyProgram translate(List<VmSource> sources, String programName, boolean bootstrap) throws TranslationException {
        if (verbosity >= 0) {
            TranslatorLogger.setLevel(verbosity);
        }

        CodeWriter writer = new CodeWriter(options.annotate());
        if (bootstrap) {
            writer.writeBootstrap(options.stackOrigin(), options.entryFunction());
        }

        int commandCount = 0;
        for (VmSource source : sources) {
            writer.setFileName(source.moduleName());
            int fileCommands = translateSource(source, writer);
            TranslatorLogger.debug("Translated " + source.fileName() + ": " + fileCommands + " command(s)");
            commandCount += fileCommands;
        }

        if (options.endLoop()) {
            writer.writeEndLoop();
        }

        AssemblyProgram program = new AssemblyProgram(programName, writer.lines(), bootstrap, commandCount);
        TranslatorLogger.info("Translated " + programName + ": " + commandCount + " VM commands into "
                + program.instructionCount() + " instructions");
        return program;
    }

    private int translateSource(VmSource source, CodeWriter writer) throws TranslationException {
        int count = 0;
        List<String> lines = source.lines();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            try {
                Optional<Command> command = parser.parse(line);
                if (command.isPresent()) {
                    writer.write(command.get());
                    count++;
                }
            } catch (TranslationException e) {
                throw e.at(new SourceInfo(source.fileName(), i + 1, line));
            }
        }
        return count;
    }

    private static String programNameOf(Path input, boolean directory) {
        Path fileName = input.toAbsolutePath().normalize().getFileName();
        if (fileName == null) {
            return "program";
        }
        String name = fileName.toString();
        if (!directory && name.endsWith(".vm")) {
            return name.substring(0, name.length() - 3);
        }
        return name;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    public TranslatorOptions options() {
        return options;
    }
}
