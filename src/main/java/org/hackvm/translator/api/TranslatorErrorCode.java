package org.hackvm.translator.api;

/**
 * Defines unique, testable error codes for all errors that can occur during translation.
 * This decouples the test logic from the error messages.
 */
public enum TranslatorErrorCode {
    // region Parser Errors
    /** A known mnemonic was used with the wrong number or type of operands. */
    MALFORMED_COMMAND,
    /** The mnemonic is not part of the VM command vocabulary. */
    UNKNOWN_COMMAND,
    // endregion

    // region Code Generation Errors
    /** A segment was used in a way it does not support, e.g. {@code pop constant 0} or {@code push temp 8}. */
    INVALID_SEGMENT_OPERATION,
    // endregion

    // region Driver Errors
    /** The input path is neither a .vm file nor a directory containing .vm files. */
    NO_SOURCES_FOUND,
    /** An I/O error occurred while reading a source file. */
    IO_ERROR_READING_FILE,
    /** An I/O error occurred while writing the assembly file. */
    IO_ERROR_WRITING_FILE
    // endregion
}
