package org.hackvm.translator.api;

import java.util.List;
import java.util.Objects;

/**
 * One VM source unit: the lines of a single {@code .vm} file.
 *
 * @param fileName The file name including its extension, e.g. {@code Main.vm}.
 * @param lines The raw source lines.
 */
public record VmSource(String fileName, List<String> lines) {

    private static final String EXTENSION = ".vm";

    public VmSource {
        Objects.requireNonNull(fileName, "fileName");
        lines = List.copyOf(lines);
    }

    /**
     * The file name without the {@code .vm} extension. Static variables of this unit
     * are qualified with it.
     *
     * @return The module name, e.g. {@code Main} for {@code Main.vm}.
     */
    public String moduleName() {
        return fileName.endsWith(EXTENSION)
                ? fileName.substring(0, fileName.length() - EXTENSION.length())
                : fileName;
    }
}
