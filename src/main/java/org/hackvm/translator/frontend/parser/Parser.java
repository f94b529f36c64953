package org.hackvm.translator.frontend.parser;

import org.hackvm.translator.api.TranslationException;
import org.hackvm.translator.api.TranslatorErrorCode;
import org.hackvm.translator.ir.AccessDirection;
import org.hackvm.translator.ir.ArithmeticCommand;
import org.hackvm.translator.ir.ArithmeticOperator;
import org.hackvm.translator.ir.BranchCommand;
import org.hackvm.translator.ir.BranchKind;
import org.hackvm.translator.ir.CallCommand;
import org.hackvm.translator.ir.Command;
import org.hackvm.translator.ir.FunctionCommand;
import org.hackvm.translator.ir.MemoryAccessCommand;
import org.hackvm.translator.ir.ReturnCommand;
import org.hackvm.translator.ir.Segment;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Converts single lines of VM source text into {@link Command}s.
 * <p>
 * The parser is stateless: it never sees more than one line and never touches translation state,
 * so one instance can be shared between files.
 */
public class Parser {

    /** Everything from this marker to the end of the line is a comment. */
    public static final String COMMENT_START = "//";

    /** Largest index or count accepted; the largest value an A-instruction can load. */
    public static final int MAX_OPERAND = 32767;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SYMBOL = Pattern.compile("[A-Za-z_.$:][A-Za-z0-9_.$:]*");

    /**
     * Parses one line of VM source.
     *
     * @param line The raw line, possibly with a trailing comment.
     * @return The command, or empty if the line is blank or a comment.
     * @throws TranslationException with {@link TranslatorErrorCode#UNKNOWN_COMMAND} if the mnemonic is not
     *         part of the vocabulary, or {@link TranslatorErrorCode#MALFORMED_COMMAND} if the operands do not
     *         match the mnemonic.
     */
    public Optional<Command> parse(String line) throws TranslationException {
        String text = stripComment(line).strip();
        if (text.isEmpty()) {
            return Optional.empty();
        }

        String[] tokens = WHITESPACE.split(text);
        String mnemonic = tokens[0];

        Optional<ArithmeticOperator> operator = ArithmeticOperator.fromMnemonic(mnemonic);
        if (operator.isPresent()) {
            expectOperands(tokens, 0);
            return Optional.of(new ArithmeticCommand(operator.get()));
        }

        Optional<AccessDirection> direction = AccessDirection.fromMnemonic(mnemonic);
        if (direction.isPresent()) {
            expectOperands(tokens, 2);
            Segment segment = Segment.fromVmName(tokens[1]).orElseThrow(() -> malformed(
                    "Unknown segment '" + tokens[1] + "'"));
            return Optional.of(new MemoryAccessCommand(direction.get(), segment, number(tokens[2], "index")));
        }

        Optional<BranchKind> branch = BranchKind.fromMnemonic(mnemonic);
        if (branch.isPresent()) {
            expectOperands(tokens, 1);
            return Optional.of(new BranchCommand(branch.get(), symbol(tokens[1])));
        }

        switch (mnemonic) {
            case "function":
                expectOperands(tokens, 2);
                return Optional.of(new FunctionCommand(symbol(tokens[1]), number(tokens[2], "local count")));
            case "call":
                expectOperands(tokens, 2);
                return Optional.of(new CallCommand(symbol(tokens[1]), number(tokens[2], "argument count")));
            case "return":
                expectOperands(tokens, 0);
                return Optional.of(new ReturnCommand());
            default:
                throw new TranslationException(TranslatorErrorCode.UNKNOWN_COMMAND, "Unknown command '" + mnemonic + "'");
        }
    }

    private static String stripComment(String line) {
        int comment = line.indexOf(COMMENT_START);
        return comment >= 0 ? line.substring(0, comment) : line;
    }

    private static void expectOperands(String[] tokens, int expected) throws TranslationException {
        int actual = tokens.length - 1;
        if (actual != expected) {
            throw malformed("'" + tokens[0] + "' expects " + expected + " operand(s) but got " + actual);
        }
    }

    private static int number(String token, String what) throws TranslationException {
        // digits only, no sign
        if (token.isEmpty() || !token.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw malformed("Expected a non-negative integer as " + what + " but got '" + token + "'");
        }
        try {
            int value = Integer.parseInt(token);
            if (value > MAX_OPERAND) {
                throw malformed("The " + what + " " + value + " exceeds " + MAX_OPERAND);
            }
            return value;
        } catch (NumberFormatException e) {
            throw malformed("The " + what + " '" + token + "' exceeds " + MAX_OPERAND);
        }
    }

    private static String symbol(String token) throws TranslationException {
        if (!SYMBOL.matcher(token).matches()) {
            throw malformed("Invalid symbol '" + token + "'");
        }
        return token;
    }

    private static TranslationException malformed(String detail) {
        return new TranslationException(TranslatorErrorCode.MALFORMED_COMMAND, detail);
    }
}
