package org.hackvm.translator.backend.emit;

/**
 * Predefined symbols and fixed addresses of the Hack platform used by the generated code.
 * <pre>
 *   RAM[0]      SP    stack pointer
 *   RAM[1]      LCL   base of the local segment
 *   RAM[2]      ARG   base of the argument segment
 *   RAM[3]      THIS  base of the this segment (pointer 0)
 *   RAM[4]      THAT  base of the that segment (pointer 1)
 *   RAM[5-12]         temp segment
 *   RAM[13-15]  R13-R15 scratch registers of the translator
 *   RAM[16-255]       static variables, allocated by the assembler
 *   RAM[256-]         stack
 * </pre>
 */
public final class HackSymbols {

    public static final String SP = "SP";
    public static final String LCL = "LCL";
    public static final String ARG = "ARG";
    public static final String THIS = "THIS";
    public static final String THAT = "THAT";

    /** Holds the frame base during {@code return}, the pop destination during {@code pop}. */
    public static final String R13 = "R13";
    /** Holds the return address during {@code return}. */
    public static final String R14 = "R14";

    public static final int TEMP_BASE = 5;
    public static final int TEMP_SIZE = 8;

    /** Number of words saved by {@code call}: return address, LCL, ARG, THIS, THAT. */
    public static final int FRAME_SIZE = 5;

    /** Prefix of labels generated by the translator itself. */
    public static final String INTERNAL_PREFIX = "HACKVM.";

    /** Prefix of the return labels placed after each {@code call}, followed by {@code callee.n}. */
    public static final String RETURN_PREFIX = INTERNAL_PREFIX + "RET.";

    /** Label of the terminating infinite loop. */
    public static final String END_LABEL = INTERNAL_PREFIX + "END";

    private HackSymbols() {}
}
