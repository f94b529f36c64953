package org.hackvm.translator.ir;

import java.util.Objects;

/**
 * An arithmetic, logical or comparison command without operands.
 *
 * @param operator The operator.
 */
public record ArithmeticCommand(ArithmeticOperator operator) implements Command {

    public ArithmeticCommand {
        Objects.requireNonNull(operator, "operator");
    }

    @Override
    public String toVmString() {
        return operator.mnemonic();
    }
}
