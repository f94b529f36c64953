package org.hackvm.translator.api;

import java.util.Locale;

/**
 * Decides whether bootstrap code is prepended to a translation.
 */
public enum BootstrapMode {
    /** Bootstrap when translating a directory, raw translation for a single file. */
    AUTO,
    /** Always prepend bootstrap code. */
    ALWAYS,
    /** Never prepend bootstrap code. */
    NEVER;

    /**
     * Resolves the policy for an input.
     *
     * @param directoryInput Whether the input is a directory of files.
     * @return {@code true} if bootstrap code must be emitted.
     */
    public boolean appliesTo(boolean directoryInput) {
        return switch (this) {
            case AUTO -> directoryInput;
            case ALWAYS -> true;
            case NEVER -> false;
        };
    }

    /**
     * Parses a mode name case-insensitively.
     *
     * @param value The name, e.g. {@code "auto"}.
     * @return The mode.
     * @throws IllegalArgumentException if the name does not denote a mode.
     */
    public static BootstrapMode parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
