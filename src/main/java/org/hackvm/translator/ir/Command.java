package org.hackvm.translator.ir;

/**
 * Base type for all VM commands produced by the parser and consumed by the
 * code writer. The command vocabulary of the VM is closed, so the hierarchy is sealed.
 * <p>
 * Commands are immutable values; they carry no translation state.
 */
public sealed interface Command
        permits ArithmeticCommand, MemoryAccessCommand, BranchCommand, FunctionCommand, CallCommand, ReturnCommand {

    /**
     * Renders the command back into its canonical VM source form, e.g. {@code push constant 7}.
     *
     * @return The canonical VM text of this command.
     */
    String toVmString();
}
