package org.hackvm.translator.ir;

/**
 * Returns from the current function.
 */
public record ReturnCommand() implements Command {

    @Override
    public String toVmString() {
        return "return";
    }
}
