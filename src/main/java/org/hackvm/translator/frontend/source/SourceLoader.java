package org.hackvm.translator.frontend.source;

import org.hackvm.translator.api.TranslationException;
import org.hackvm.translator.api.TranslatorErrorCode;
import org.hackvm.translator.api.VmSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads the VM sources of a translation input: a single {@code .vm} file or all {@code .vm} files
 * directly inside a directory. Directory entries are ordered by file name so the output does not
 * depend on the file system's listing order.
 */
public class SourceLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SourceLoader.class);
    private static final String EXTENSION = ".vm";

    /**
     * @param input The translation input.
     * @return {@code true} if the input is a directory, i.e. a multi-file program.
     */
    public boolean isDirectory(Path input) {
        return Files.isDirectory(input);
    }

    /**
     * Loads all source units of the input.
     *
     * @param input A {@code .vm} file or a directory.
     * @return The sources, never empty.
     * @throws TranslationException with {@link TranslatorErrorCode#NO_SOURCES_FOUND} if the input holds
     *         no {@code .vm} file, or {@link TranslatorErrorCode#IO_ERROR_READING_FILE} if reading fails.
     */
    public List<VmSource> load(Path input) throws TranslationException {
        List<Path> files = enumerate(input);
        List<VmSource> sources = new ArrayList<>(files.size());
        for (Path file : files) {
            sources.add(read(file));
        }
        return sources;
    }

    /**
     * Lists the {@code .vm} files of the input in translation order.
     *
     * @param input A {@code .vm} file or a directory.
     * @return The files, never empty.
     * @throws TranslationException if the input holds no {@code .vm} file or cannot be listed.
     */
    public List<Path> enumerate(Path input) throws TranslationException {
        if (Files.isDirectory(input)) {
            List<Path> files;
            try (Stream<Path> entries = Files.list(input)) {
                files = entries
                        .filter(Files::isRegularFile)
                        .filter(SourceLoader::isVmFile)
                        .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                        .collect(Collectors.toList());
            } catch (IOException e) {
                throw new TranslationException(TranslatorErrorCode.IO_ERROR_READING_FILE,
                        "Cannot list directory " + input + ": " + e.getMessage(), e);
            }
            if (files.isEmpty()) {
                throw new TranslationException(TranslatorErrorCode.NO_SOURCES_FOUND,
                        "Directory " + input + " contains no " + EXTENSION + " files");
            }
            LOG.debug("Found {} source files in {}", files.size(), input);
            return files;
        }
        if (Files.isRegularFile(input) && isVmFile(input)) {
            return List.of(input);
        }
        throw new TranslationException(TranslatorErrorCode.NO_SOURCES_FOUND,
                input + " is neither a " + EXTENSION + " file nor a directory");
    }

    private VmSource read(Path file) throws TranslationException {
        try {
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            LOG.debug("Read {} lines from {}", lines.size(), file);
            return new VmSource(file.getFileName().toString(), lines);
        } catch (IOException e) {
            throw new TranslationException(TranslatorErrorCode.IO_ERROR_READING_FILE,
                    "Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    private static boolean isVmFile(Path path) {
        return path.getFileName().toString().endsWith(EXTENSION);
    }
}
