package org.hackvm.translator.api;

/**
 * A pure data class representing a position in VM source code.
 *
 * @param fileName The file where the code is located.
 * @param lineNumber The 1-based line number.
 * @param lineContent The raw content of the line.
 */
public record SourceInfo(String fileName, int lineNumber, String lineContent) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber;
    }
}
