package org.hackvm.translator.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface of the VM translator.
 */
public interface ITranslator {

    /**
     * Translates the given source units into one assembly program.
     *
     * @param sources The source units, translated in the given order.
     * @param programName A name for the program, used for diagnostics and the result.
     * @param bootstrap Whether bootstrap code calling the entry function is prepended.
     * @return The translated program.
     * @throws TranslationException if any line cannot be translated.
     */
    AssemblyProgram translate(List<VmSource> sources, String programName, boolean bootstrap) throws TranslationException;

    /**
     * Translates a single {@code .vm} file or a directory of {@code .vm} files. Whether bootstrap
     * code is emitted is decided by the configured {@link BootstrapMode}.
     *
     * @param input The file or directory.
     * @return The translated program.
     * @throws TranslationException if no sources are found, a file cannot be read or a line cannot be translated.
     */
    AssemblyProgram translate(Path input) throws TranslationException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (e.g., 0=quiet, 1=normal, 2=verbose, 3=trace).
     */
    void setVerbosity(int level);

    /**
     * Translates a single source given as text.
     * @param fileName The file name of the source, e.g. {@code Main.vm}.
     * @param source The VM source text.
     * @return The translated program, without bootstrap code.
     * @throws TranslationException if any line cannot be translated.
     */
    default AssemblyProgram translate(String fileName, String source) throws TranslationException {
        return translate(List.of(new VmSource(fileName, source.lines().toList())), fileName, false);
    }

    /**
     * Translates the input and writes the program next to it.
     * @param input The file or directory.
     * @return The path of the written assembly file.
     * @throws TranslationException if translation fails.
     * @throws IOException if the output cannot be written.
     */
    default Path translateToFile(Path input) throws TranslationException, IOException {
        Path output = AssemblyProgramWriter.defaultOutputFor(input);
        AssemblyProgramWriter.write(translate(input), output);
        return output;
    }
}
