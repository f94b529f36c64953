package org.hackvm.translator.ir;

import java.util.Objects;

/**
 * A {@code push} or {@code pop} on a memory segment.
 *
 * @param direction The access direction.
 * @param segment The addressed segment.
 * @param index The non-negative index within the segment.
 */
public record MemoryAccessCommand(AccessDirection direction, Segment segment, int index) implements Command {

    public MemoryAccessCommand {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(segment, "segment");
        if (index < 0) {
            throw new IllegalArgumentException("Segment index must not be negative: " + index);
        }
    }

    public static MemoryAccessCommand push(Segment segment, int index) {
        return new MemoryAccessCommand(AccessDirection.PUSH, segment, index);
    }

    public static MemoryAccessCommand pop(Segment segment, int index) {
        return new MemoryAccessCommand(AccessDirection.POP, segment, index);
    }

    @Override
    public String toVmString() {
        return direction.mnemonic() + " " + segment.vmName() + " " + index;
    }
}
