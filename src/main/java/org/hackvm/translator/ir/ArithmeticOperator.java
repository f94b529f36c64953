package org.hackvm.translator.ir;

import java.util.Arrays;
import java.util.Optional;

/**
 * The arithmetic, logical and comparison operators of the VM.
 */
public enum ArithmeticOperator {
    ADD("add", Kind.BINARY, "D+M"),
    SUB("sub", Kind.BINARY, "M-D"),
    AND("and", Kind.BINARY, "D&M"),
    OR("or", Kind.BINARY, "D|M"),
    NEG("neg", Kind.UNARY, "-M"),
    NOT("not", Kind.UNARY, "!M"),
    EQ("eq", Kind.COMPARISON, "JEQ"),
    GT("gt", Kind.COMPARISON, "JGT"),
    LT("lt", Kind.COMPARISON, "JLT");

    /**
     * How an operator consumes the operand stack.
     */
    public enum Kind {
        /** Pops two operands and pushes one result. */
        BINARY,
        /** Replaces the top of stack in place. */
        UNARY,
        /** Pops two operands and pushes a boolean (-1 or 0). */
        COMPARISON
    }

    private final String mnemonic;
    private final Kind kind;
    private final String assembly;

    ArithmeticOperator(String mnemonic, Kind kind, String assembly) {
        this.mnemonic = mnemonic;
        this.kind = kind;
        this.assembly = assembly;
    }

    public String mnemonic() {
        return mnemonic;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * The Hack fragment implementing the operator: a computation for binary and
     * unary operators (with the second operand in D and the first in M), a jump
     * mnemonic for comparisons.
     *
     * @return The assembly fragment.
     */
    public String assembly() {
        return assembly;
    }

    /**
     * Looks up an operator by its VM mnemonic.
     *
     * @param mnemonic The mnemonic, e.g. {@code add}.
     * @return The operator if the mnemonic names one.
     */
    public static Optional<ArithmeticOperator> fromMnemonic(String mnemonic) {
        return Arrays.stream(values()).filter(op -> op.mnemonic.equals(mnemonic)).findFirst();
    }
}
