package org.hackvm.translator.api;

import java.util.List;

/**
 * The result of a translation: a complete Hack assembly program.
 *
 * @param programName The name of the translated program (file or directory name).
 * @param lines The assembly lines in emission order, including comment lines when annotating.
 * @param bootstrapped Whether bootstrap code was prepended.
 * @param commandCount The number of VM commands translated.
 */
public record AssemblyProgram(String programName, List<String> lines, boolean bootstrapped, int commandCount) {

    public AssemblyProgram {
        lines = List.copyOf(lines);
    }

    /**
     * @return The number of real instructions, i.e. lines that are neither comments nor label declarations.
     */
    public long instructionCount() {
        return lines.stream()
                .filter(line -> !line.isBlank() && !line.startsWith("//") && !line.startsWith("("))
                .count();
    }

    /**
     * @return The program text, one line per instruction, each terminated by a newline.
     */
    public String toText() {
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }
}
