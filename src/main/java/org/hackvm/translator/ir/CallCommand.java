package org.hackvm.translator.ir;

import java.util.Objects;

/**
 * Calls a function after its arguments have been pushed.
 *
 * @param name The called function.
 * @param argumentCount The number of arguments already on the stack.
 */
public record CallCommand(String name, int argumentCount) implements Command {

    public CallCommand {
        Objects.requireNonNull(name, "name");
        if (argumentCount < 0) {
            throw new IllegalArgumentException("Argument count must not be negative: " + argumentCount);
        }
    }

    @Override
    public String toVmString() {
        return "call " + name + " " + argumentCount;
    }
}
