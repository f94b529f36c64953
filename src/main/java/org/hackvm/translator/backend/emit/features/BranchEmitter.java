package org.hackvm.translator.backend.emit.features;

import org.hackvm.translator.backend.emit.EmissionContext;
import org.hackvm.translator.backend.emit.ICommandEmitter;
import org.hackvm.translator.ir.BranchCommand;

/**
 * Emits {@code label}, {@code goto} and {@code if-goto}. All three use the label scoped to the
 * enclosing function, so equal label names in different functions never collide.
 */
public final class BranchEmitter implements ICommandEmitter<BranchCommand> {

	@Override
	public void emit(BranchCommand command, EmissionContext ctx) {
		String target = ctx.scopedLabel(command.symbol());
		switch (command.kind()) {
			case LABEL -> ctx.label(target);
			case GOTO -> ctx.jump(target);
			case IF_GOTO -> {
				ctx.popD();
				ctx.emit("@" + target, "D;JNE");
			}
		}
	}
}
