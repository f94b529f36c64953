package org.hackvm.translator.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Immutable translator settings, read from the {@code translator} block of the configuration.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * translator {
 *   bootstrap = auto            # auto | always | never
 *   entry-function = "Sys.init"
 *   stack-origin = 256
 *   annotate = true             # emit a comment line before each command's code
 *   end-loop = true             # terminate the program with an infinite loop
 * }
 * </pre>
 *
 * @param bootstrapMode When bootstrap code is prepended.
 * @param entryFunction The function the bootstrap code calls.
 * @param stackOrigin The initial stack pointer set by the bootstrap code.
 * @param annotate Whether each command's code is preceded by a comment.
 * @param endLoop Whether the program ends with an infinite loop.
 */
public record TranslatorOptions(
        BootstrapMode bootstrapMode,
        String entryFunction,
        int stackOrigin,
        boolean annotate,
        boolean endLoop
) {
    /** The configuration path of the translator block. */
    public static final String CONFIG_PATH = "translator";

    /** Lowest legal stack origin: RAM[0..15] are the virtual registers. */
    public static final int MIN_STACK_ORIGIN = 16;
    /** Highest value an A-instruction can load. */
    public static final int MAX_STACK_ORIGIN = 32767;

    public TranslatorOptions {
        if (bootstrapMode == null) {
            throw new IllegalArgumentException("bootstrapMode must not be null");
        }
        if (entryFunction == null || entryFunction.isBlank()) {
            throw new IllegalArgumentException("entryFunction must not be blank");
        }
        if (stackOrigin < MIN_STACK_ORIGIN || stackOrigin > MAX_STACK_ORIGIN) {
            throw new IllegalArgumentException("stackOrigin must be in [" + MIN_STACK_ORIGIN + ", "
                    + MAX_STACK_ORIGIN + "] but was " + stackOrigin);
        }
    }

    /**
     * @return The options used when no configuration is given.
     */
    public static TranslatorOptions defaults() {
        return new TranslatorOptions(BootstrapMode.AUTO, "Sys.init", 256, true, true);
    }

    /**
     * Reads the options from the {@code translator} block. Missing keys fall back to {@link #defaults()}.
     *
     * @param config The application configuration.
     * @return The options.
     * @throws ConfigException.BadValue if a value is present but invalid.
     */
    public static TranslatorOptions fromConfig(Config config) {
        TranslatorOptions defaults = defaults();
        if (!config.hasPath(CONFIG_PATH)) {
            return defaults;
        }
        Config c = config.getConfig(CONFIG_PATH);
        try {
            return new TranslatorOptions(
                    c.hasPath("bootstrap") ? BootstrapMode.parse(c.getString("bootstrap")) : defaults.bootstrapMode(),
                    c.hasPath("entry-function") ? c.getString("entry-function") : defaults.entryFunction(),
                    c.hasPath("stack-origin") ? c.getInt("stack-origin") : defaults.stackOrigin(),
                    c.hasPath("annotate") ? c.getBoolean("annotate") : defaults.annotate(),
                    c.hasPath("end-loop") ? c.getBoolean("end-loop") : defaults.endLoop());
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(c.origin(), CONFIG_PATH, e.getMessage(), e);
        }
    }

    public TranslatorOptions withBootstrapMode(BootstrapMode mode) {
        return new TranslatorOptions(mode, entryFunction, stackOrigin, annotate, endLoop);
    }

    public TranslatorOptions withAnnotate(boolean enabled) {
        return new TranslatorOptions(bootstrapMode, entryFunction, stackOrigin, enabled, endLoop);
    }
}
