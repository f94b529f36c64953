package org.hackvm.translator.ir;

import java.util.Arrays;
import java.util.Optional;

/**
 * The program flow commands.
 */
public enum BranchKind {
    LABEL("label"),
    GOTO("goto"),
    IF_GOTO("if-goto");

    private final String mnemonic;

    BranchKind(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    public String mnemonic() {
        return mnemonic;
    }

    public static Optional<BranchKind> fromMnemonic(String mnemonic) {
        return Arrays.stream(values()).filter(k -> k.mnemonic.equals(mnemonic)).findFirst();
    }
}
