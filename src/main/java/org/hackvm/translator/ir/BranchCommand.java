package org.hackvm.translator.ir;

import java.util.Objects;

/**
 * A label definition or a jump to a label.
 *
 * @param kind The branch kind.
 * @param symbol The unscoped label name as written in the source.
 */
public record BranchCommand(BranchKind kind, String symbol) implements Command {

    public BranchCommand {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(symbol, "symbol");
    }

    @Override
    public String toVmString() {
        return kind.mnemonic() + " " + symbol;
    }
}
