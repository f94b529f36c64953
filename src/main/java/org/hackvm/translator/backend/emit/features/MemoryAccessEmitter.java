package org.hackvm.translator.backend.emit.features;

import org.hackvm.translator.api.TranslationException;
import org.hackvm.translator.api.TranslatorErrorCode;
import org.hackvm.translator.backend.emit.EmissionContext;
import org.hackvm.translator.backend.emit.HackSymbols;
import org.hackvm.translator.backend.emit.ICommandEmitter;
import org.hackvm.translator.ir.AccessDirection;
import org.hackvm.translator.ir.MemoryAccessCommand;
import org.hackvm.translator.ir.Segment;

/**
 * Emits {@code push} and {@code pop} for all segments.
 * <p>
 * Segments fall into three addressing classes: {@code constant} (immediate value),
 * {@code local/argument/this/that} (base register plus index, dereferenced) and
 * {@code pointer/temp/static} (a fixed symbol known at translation time).
 */
public final class MemoryAccessEmitter implements ICommandEmitter<MemoryAccessCommand> {

	@Override
	public void emit(MemoryAccessCommand command, EmissionContext ctx) throws TranslationException {
		Segment segment = command.segment();
		int index = command.index();

		if (segment == Segment.CONSTANT) {
			if (command.direction() == AccessDirection.POP) {
				throw invalid("Cannot pop into the constant segment");
			}
			ctx.emit("@" + index, "D=A");
			ctx.pushD();
			return;
		}

		String baseRegister = baseRegisterOf(segment);
		if (baseRegister != null) {
			if (command.direction() == AccessDirection.PUSH) {
				ctx.emit("@" + index, "D=A", "@" + baseRegister, "A=D+M", "D=M");
				ctx.pushD();
			} else {
				ctx.emit("@" + index, "D=A", "@" + baseRegister, "D=D+M", "@" + HackSymbols.R13, "M=D");
				ctx.popD();
				ctx.emit("@" + HackSymbols.R13, "A=M", "M=D");
			}
			return;
		}

		String address = fixedAddressOf(segment, index, ctx);
		if (command.direction() == AccessDirection.PUSH) {
			ctx.emit("@" + address, "D=M");
			ctx.pushD();
		} else {
			ctx.popD();
			ctx.emit("@" + address, "M=D");
		}
	}

	private static String baseRegisterOf(Segment segment) {
		return switch (segment) {
			case LOCAL -> HackSymbols.LCL;
			case ARGUMENT -> HackSymbols.ARG;
			case THIS -> HackSymbols.THIS;
			case THAT -> HackSymbols.THAT;
			default -> null;
		};
	}

	private static String fixedAddressOf(Segment segment, int index, EmissionContext ctx) throws TranslationException {
		switch (segment) {
			case POINTER:
				if (index > 1) {
					throw invalid("The pointer segment has only indices 0 and 1, got " + index);
				}
				return index == 0 ? HackSymbols.THIS : HackSymbols.THAT;
			case TEMP:
				if (index >= HackSymbols.TEMP_SIZE) {
					throw invalid("The temp segment has only " + HackSymbols.TEMP_SIZE + " slots, got index " + index);
				}
				return String.valueOf(HackSymbols.TEMP_BASE + index);
			case STATIC:
				return ctx.staticSymbol(index);
			default:
				throw new IllegalArgumentException("Not a fixed-address segment: " + segment);
		}
	}

	private static TranslationException invalid(String detail) {
		return new TranslationException(TranslatorErrorCode.INVALID_SEGMENT_OPERATION, detail);
	}
}
