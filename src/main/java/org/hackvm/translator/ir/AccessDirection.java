package org.hackvm.translator.ir;

import java.util.Arrays;
import java.util.Optional;

/**
 * Direction of a memory access command.
 */
public enum AccessDirection {
    PUSH("push"),
    POP("pop");

    private final String mnemonic;

    AccessDirection(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    public String mnemonic() {
        return mnemonic;
    }

    public static Optional<AccessDirection> fromMnemonic(String mnemonic) {
        return Arrays.stream(values()).filter(d -> d.mnemonic.equals(mnemonic)).findFirst();
    }
}
