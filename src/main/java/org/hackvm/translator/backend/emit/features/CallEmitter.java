package org.hackvm.translator.backend.emit.features;

import org.hackvm.translator.backend.emit.EmissionContext;
import org.hackvm.translator.backend.emit.HackSymbols;
import org.hackvm.translator.backend.emit.ICommandEmitter;
import org.hackvm.translator.ir.CallCommand;

/**
 * Emits a function call.
 * <p>
 * Saves the caller's frame on the stack (return address, LCL, ARG, THIS, THAT), points ARG at the
 * first of the already pushed arguments, points LCL at the new top of stack and jumps to the callee.
 * Control comes back at the return label emitted right after the jump.
 */
public final class CallEmitter implements ICommandEmitter<CallCommand> {

	@Override
	public void emit(CallCommand command, EmissionContext ctx) {
		String returnLabel = HackSymbols.RETURN_PREFIX + command.name() + "." + ctx.nextLabelId();

		ctx.emit("@" + returnLabel, "D=A");
		ctx.pushD();
		for (String register : new String[] {HackSymbols.LCL, HackSymbols.ARG, HackSymbols.THIS, HackSymbols.THAT}) {
			ctx.emit("@" + register, "D=M");
			ctx.pushD();
		}

		// ARG = SP - 5 - nArgs
		ctx.emit("@" + HackSymbols.SP, "D=M", "@" + (HackSymbols.FRAME_SIZE + command.argumentCount()), "D=D-A",
				"@" + HackSymbols.ARG, "M=D");
		// LCL = SP
		ctx.emit("@" + HackSymbols.SP, "D=M", "@" + HackSymbols.LCL, "M=D");

		ctx.jump(command.name());
		ctx.label(returnLabel);
	}
}
