package org.hackvm.translator.ir;

import java.util.Objects;

/**
 * Declares a function and the number of its local variables.
 *
 * @param name The fully qualified function name, e.g. {@code Main.main}.
 * @param localCount The number of locals to initialize with zero.
 */
public record FunctionCommand(String name, int localCount) implements Command {

    public FunctionCommand {
        Objects.requireNonNull(name, "name");
        if (localCount < 0) {
            throw new IllegalArgumentException("Local count must not be negative: " + localCount);
        }
    }

    @Override
    public String toVmString() {
        return "function " + name + " " + localCount;
    }
}
