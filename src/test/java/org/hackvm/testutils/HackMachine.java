package org.hackvm.testutils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A small Hack computer for tests: assembles Hack assembly text with the usual two passes
 * (labels first, then variables from RAM[16] upward) and interprets the resulting program.
 * <p>
 * Values are 16-bit two's complement like on the real machine. Execution stops at the first
 * tight self-loop {@code (L) @L 0;JMP}, which is how translated programs halt, or when the
 * program counter runs past the end of the program.
 */
public final class HackMachine {

    public static final int SP = 0;
    public static final int LCL = 1;
    public static final int ARG = 2;
    public static final int THIS = 3;
    public static final int THAT = 4;

    private static final int RAM_SIZE = 32768;
    private static final int FIRST_VARIABLE = 16;

    private sealed interface Instruction permits AInstruction, CInstruction {}

    private record AInstruction(int value) implements Instruction {}

    private record CInstruction(String dest, String comp, String jump) implements Instruction {}

    private final List<Instruction> rom;
    private final Map<String, Integer> symbols;
    private final int[] ram = new int[RAM_SIZE];
    private int a;
    private int d;
    private int pc;
    private long steps;

    private HackMachine(List<Instruction> rom, Map<String, Integer> symbols) {
        this.rom = rom;
        this.symbols = symbols;
    }

    /**
     * Assembles a program.
     *
     * @param lines The assembly lines; comments, blank lines and whitespace are ignored.
     * @return A machine with the program loaded and all registers and RAM set to zero.
     * @throws IllegalArgumentException if a label is declared twice or an instruction is malformed.
     */
    public static HackMachine assemble(List<String> lines) {
        Map<String, Integer> symbols = predefinedSymbols();
        List<String> code = new ArrayList<>();

        // Pass 1: label addresses
        for (String raw : lines) {
            String line = clean(raw);
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith("(")) {
                String label = line.substring(1, line.length() - 1);
                if (symbols.containsKey(label)) {
                    throw new IllegalArgumentException("Duplicate label: " + label);
                }
                symbols.put(label, code.size());
            } else {
                code.add(line);
            }
        }

        // Pass 2: resolve symbols, allocate variables
        List<Instruction> rom = new ArrayList<>(code.size());
        int nextVariable = FIRST_VARIABLE;
        for (String line : code) {
            if (line.startsWith("@")) {
                String operand = line.substring(1);
                if (Character.isDigit(operand.charAt(0))) {
                    rom.add(new AInstruction(Integer.parseInt(operand)));
                } else {
                    Integer address = symbols.get(operand);
                    if (address == null) {
                        address = nextVariable++;
                        symbols.put(operand, address);
                    }
                    rom.add(new AInstruction(address));
                }
            } else {
                rom.add(parseC(line));
            }
        }
        return new HackMachine(rom, symbols);
    }

    private static String clean(String raw) {
        int comment = raw.indexOf("//");
        String line = comment >= 0 ? raw.substring(0, comment) : raw;
        return line.replaceAll("\\s", "");
    }

    private static CInstruction parseC(String line) {
        String dest = "";
        String rest = line;
        int eq = rest.indexOf('=');
        if (eq >= 0) {
            dest = rest.substring(0, eq);
            rest = rest.substring(eq + 1);
        }
        String jump = "";
        int semi = rest.indexOf(';');
        if (semi >= 0) {
            jump = rest.substring(semi + 1);
            rest = rest.substring(0, semi);
        }
        if (rest.isEmpty()) {
            throw new IllegalArgumentException("Missing computation: " + line);
        }
        return new CInstruction(dest, rest, jump);
    }

    private static Map<String, Integer> predefinedSymbols() {
        Map<String, Integer> symbols = new HashMap<>();
        symbols.put("SP", 0);
        symbols.put("LCL", 1);
        symbols.put("ARG", 2);
        symbols.put("THIS", 3);
        symbols.put("THAT", 4);
        for (int i = 0; i < 16; i++) {
            symbols.put("R" + i, i);
        }
        symbols.put("SCREEN", 16384);
        symbols.put("KBD", 24576);
        return symbols;
    }

    /**
     * Runs until the program halts.
     *
     * @param maxSteps Upper bound on executed instructions.
     * @return This machine.
     * @throws IllegalStateException if the program does not halt within {@code maxSteps}.
     */
    public HackMachine run(long maxSteps) {
        while (pc < rom.size()) {
            if (steps >= maxSteps) {
                throw new IllegalStateException("Program did not halt within " + maxSteps + " steps (pc=" + pc + ")");
            }
            if (isHaltLoop(pc)) {
                return this;
            }
            step();
        }
        return this;
    }

    public HackMachine run() {
        return run(1_000_000);
    }

    private boolean isHaltLoop(int address) {
        if (address + 1 >= rom.size()) {
            return false;
        }
        return rom.get(address) instanceof AInstruction ai
                && ai.value() == address
                && rom.get(address + 1) instanceof CInstruction ci
                && ci.dest().isEmpty()
                && "JMP".equals(ci.jump());
    }

    private void step() {
        Instruction instruction = rom.get(pc);
        steps++;
        if (instruction instanceof AInstruction ai) {
            a = ai.value();
            pc++;
            return;
        }
        CInstruction ci = (CInstruction) instruction;
        int addressM = a;
        int value = compute(ci.comp());
        if (ci.dest().contains("M")) {
            ram[checkAddress(addressM)] = value;
        }
        if (ci.dest().contains("D")) {
            d = value;
        }
        if (ci.dest().contains("A")) {
            a = value;
        }
        pc = jumps(ci.jump(), value) ? addressM : pc + 1;
    }

    private int compute(String comp) {
        if (comp.length() == 1) {
            return operand(comp.charAt(0));
        }
        if (comp.length() == 2) {
            int x = operand(comp.charAt(1));
            return switch (comp.charAt(0)) {
                case '!' -> toWord(~x);
                case '-' -> toWord(-x);
                default -> throw new IllegalArgumentException("Unsupported computation: " + comp);
            };
        }
        if (comp.length() == 3) {
            int x = operand(comp.charAt(0));
            int y = operand(comp.charAt(2));
            return switch (comp.charAt(1)) {
                case '+' -> toWord(x + y);
                case '-' -> toWord(x - y);
                case '&' -> toWord(x & y);
                case '|' -> toWord(x | y);
                default -> throw new IllegalArgumentException("Unsupported computation: " + comp);
            };
        }
        throw new IllegalArgumentException("Unsupported computation: " + comp);
    }

    private int operand(char c) {
        return switch (c) {
            case 'A' -> a;
            case 'D' -> d;
            case 'M' -> ram[checkAddress(a)];
            case '0' -> 0;
            case '1' -> 1;
            default -> throw new IllegalArgumentException("Unsupported operand: " + c);
        };
    }

    private static boolean jumps(String jump, int value) {
        return switch (jump) {
            case "" -> false;
            case "JGT" -> value > 0;
            case "JEQ" -> value == 0;
            case "JGE" -> value >= 0;
            case "JLT" -> value < 0;
            case "JNE" -> value != 0;
            case "JLE" -> value <= 0;
            case "JMP" -> true;
            default -> throw new IllegalArgumentException("Unsupported jump: " + jump);
        };
    }

    private static int toWord(int value) {
        return (short) value;
    }

    private static int checkAddress(int address) {
        if (address < 0 || address >= RAM_SIZE) {
            throw new IllegalStateException("RAM access out of range: " + address);
        }
        return address;
    }

    // --- State access ---

    public int ram(int address) {
        return ram[checkAddress(address)];
    }

    public HackMachine setRam(int address, int value) {
        ram[checkAddress(address)] = toWord(value);
        return this;
    }

    public int sp() {
        return ram[SP];
    }

    /**
     * @return The value on top of the stack, i.e. {@code RAM[SP - 1]}.
     */
    public int stackTop() {
        return ram(ram[SP] - 1);
    }

    /**
     * @param name A label or variable of the program.
     * @return Its address, if the program declares or uses it.
     */
    public Optional<Integer> symbol(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    /**
     * @param name A variable of the program, e.g. {@code Main.0}.
     * @return The variable's current value.
     * @throws IllegalArgumentException if the program does not use the variable.
     */
    public int variable(String name) {
        return ram(symbol(name).orElseThrow(() -> new IllegalArgumentException("Unknown symbol: " + name)));
    }

    public long steps() {
        return steps;
    }

    public int pc() {
        return pc;
    }
}
