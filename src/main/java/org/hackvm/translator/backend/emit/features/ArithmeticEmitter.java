package org.hackvm.translator.backend.emit.features;

import org.hackvm.translator.backend.emit.EmissionContext;
import org.hackvm.translator.backend.emit.HackSymbols;
import org.hackvm.translator.backend.emit.ICommandEmitter;
import org.hackvm.translator.ir.ArithmeticCommand;
import org.hackvm.translator.ir.ArithmeticOperator;

import java.util.Locale;

/**
 * Emits arithmetic, logical and comparison commands.
 * <p>
 * Binary operators leave {@code x op y} in place of the two operands, where y is the top of stack.
 * Comparisons push -1 (true) or 0 (false) and need two fresh labels each.
 */
public final class ArithmeticEmitter implements ICommandEmitter<ArithmeticCommand> {

	@Override
	public void emit(ArithmeticCommand command, EmissionContext ctx) {
		ArithmeticOperator op = command.operator();
		switch (op.kind()) {
			case BINARY -> emitBinary(op, ctx);
			case UNARY -> ctx.emit("@" + HackSymbols.SP, "A=M-1", "M=" + op.assembly());
			case COMPARISON -> emitComparison(op, ctx);
		}
	}

	private void emitBinary(ArithmeticOperator op, EmissionContext ctx) {
		// D = y, then combine with x in place
		ctx.popD();
		ctx.emit("@" + HackSymbols.SP, "AM=M-1", "M=" + op.assembly(), "@" + HackSymbols.SP, "M=M+1");
	}

	private void emitComparison(ArithmeticOperator op, EmissionContext ctx) {
		int id = ctx.nextLabelId();
		String name = op.mnemonic().toUpperCase(Locale.ROOT);
		String trueLabel = HackSymbols.INTERNAL_PREFIX + name + "_TRUE." + id;
		String endLabel = HackSymbols.INTERNAL_PREFIX + name + "_END." + id;

		ctx.popD();
		ctx.emit("@" + HackSymbols.SP, "AM=M-1", "D=M-D", "@" + trueLabel, "D;" + op.assembly());
		ctx.emit("@" + HackSymbols.SP, "A=M", "M=0");
		ctx.jump(endLabel);
		ctx.label(trueLabel);
		ctx.emit("@" + HackSymbols.SP, "A=M", "M=-1");
		ctx.label(endLabel);
		ctx.emit("@" + HackSymbols.SP, "M=M+1");
	}
}
