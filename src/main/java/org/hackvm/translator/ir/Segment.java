package org.hackvm.translator.ir;

import java.util.Arrays;
import java.util.Optional;

/**
 * The virtual memory segments addressable by push and pop.
 */
public enum Segment {
    CONSTANT("constant"),
    LOCAL("local"),
    ARGUMENT("argument"),
    THIS("this"),
    THAT("that"),
    POINTER("pointer"),
    TEMP("temp"),
    STATIC("static");

    private final String vmName;

    Segment(String vmName) {
        this.vmName = vmName;
    }

    public String vmName() {
        return vmName;
    }

    public static Optional<Segment> fromVmName(String name) {
        return Arrays.stream(values()).filter(s -> s.vmName.equals(name)).findFirst();
    }
}
