package org.hackvm.translator.backend.emit;

import org.hackvm.translator.api.TranslationException;
import org.hackvm.translator.ir.Command;

/**
 * Emits the Hack assembly for one specific command type.
 * <p>
 * Implementations are stateless. All output and all translation state go through the
 * provided {@link EmissionContext}.
 *
 * @param <T> The concrete command type handled by this emitter.
 */
public interface ICommandEmitter<T extends Command> {

	/**
	 * Emits the assembly for the given command.
	 *
	 * @param command The command to translate.
	 * @param ctx     The emission context receiving the instructions.
	 * @throws TranslationException if the command cannot be translated.
	 */
	void emit(T command, EmissionContext ctx) throws TranslationException;
}
