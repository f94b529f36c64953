package org.hackvm.translator.backend.emit.features;

import org.hackvm.translator.backend.emit.EmissionContext;
import org.hackvm.translator.backend.emit.HackSymbols;
import org.hackvm.translator.backend.emit.ICommandEmitter;
import org.hackvm.translator.ir.ReturnCommand;

/**
 * Emits a function return.
 * <p>
 * The return address is saved before the return value is stored at ARG[0]: with zero arguments
 * ARG[0] is the very slot holding the return address.
 */
public final class ReturnEmitter implements ICommandEmitter<ReturnCommand> {

	private static final String[] RESTORE_ORDER = {HackSymbols.THAT, HackSymbols.THIS, HackSymbols.ARG, HackSymbols.LCL};

	@Override
	public void emit(ReturnCommand command, EmissionContext ctx) {
		// R13 = frame = LCL
		ctx.emit("@" + HackSymbols.LCL, "D=M", "@" + HackSymbols.R13, "M=D");
		// R14 = RAM[frame - 5]
		ctx.emit("@" + HackSymbols.FRAME_SIZE, "A=D-A", "D=M", "@" + HackSymbols.R14, "M=D");
		// RAM[ARG] = pop()
		ctx.popD();
		ctx.emit("@" + HackSymbols.ARG, "A=M", "M=D");
		// SP = ARG + 1
		ctx.emit("@" + HackSymbols.ARG, "D=M+1", "@" + HackSymbols.SP, "M=D");
		// THAT, THIS, ARG, LCL = RAM[frame - 1 .. frame - 4]
		for (String register : RESTORE_ORDER) {
			ctx.emit("@" + HackSymbols.R13, "AM=M-1", "D=M", "@" + register, "M=D");
		}
		ctx.emit("@" + HackSymbols.R14, "A=M", "0;JMP");
	}
}
