package org.hackvm.translator.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes assembly programs to disk.
 */
public final class AssemblyProgramWriter {

    private static final String VM_EXTENSION = ".vm";
    private static final String ASM_EXTENSION = ".asm";

    private AssemblyProgramWriter() {}

    /**
     * Computes the conventional output path: {@code Foo.vm} becomes {@code Foo.asm} in the same
     * directory, a directory {@code Prog} becomes {@code Prog/Prog.asm}.
     *
     * @param input The translated file or directory.
     * @return The output path.
     */
    public static Path defaultOutputFor(Path input) {
        Path absolute = input.toAbsolutePath().normalize();
        if (Files.isDirectory(absolute)) {
            return absolute.resolve(absolute.getFileName() + ASM_EXTENSION);
        }
        String name = absolute.getFileName().toString();
        String stem = name.endsWith(VM_EXTENSION) ? name.substring(0, name.length() - VM_EXTENSION.length()) : name;
        return absolute.resolveSibling(stem + ASM_EXTENSION);
    }

    /**
     * Writes the program, replacing an existing file.
     *
     * @param program The program to write.
     * @param output The target file.
     * @throws IOException if the file cannot be written.
     */
    public static void write(AssemblyProgram program, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, program.toText(), StandardCharsets.UTF_8);
    }
}
