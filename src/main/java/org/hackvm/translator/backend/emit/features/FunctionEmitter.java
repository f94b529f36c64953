package org.hackvm.translator.backend.emit.features;

import org.hackvm.translator.backend.emit.EmissionContext;
import org.hackvm.translator.backend.emit.HackSymbols;
import org.hackvm.translator.backend.emit.ICommandEmitter;
import org.hackvm.translator.ir.FunctionCommand;

/**
 * Emits a function entry point and zero-initializes its locals.
 * Also makes the function the scope of all following labels.
 */
public final class FunctionEmitter implements ICommandEmitter<FunctionCommand> {

	@Override
	public void emit(FunctionCommand command, EmissionContext ctx) {
		ctx.label(command.name());
		ctx.setCurrentFunction(command.name());
		for (int i = 0; i < command.localCount(); i++) {
			ctx.emit("@" + HackSymbols.SP, "A=M", "M=0", "@" + HackSymbols.SP, "M=M+1");
		}
	}
}
