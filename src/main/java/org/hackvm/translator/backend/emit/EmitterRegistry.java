package org.hackvm.translator.backend.emit;

import org.hackvm.translator.backend.emit.features.ArithmeticEmitter;
import org.hackvm.translator.backend.emit.features.BranchEmitter;
import org.hackvm.translator.backend.emit.features.CallEmitter;
import org.hackvm.translator.backend.emit.features.FunctionEmitter;
import org.hackvm.translator.backend.emit.features.MemoryAccessEmitter;
import org.hackvm.translator.backend.emit.features.ReturnEmitter;
import org.hackvm.translator.ir.ArithmeticCommand;
import org.hackvm.translator.ir.BranchCommand;
import org.hackvm.translator.ir.CallCommand;
import org.hackvm.translator.ir.Command;
import org.hackvm.translator.ir.FunctionCommand;
import org.hackvm.translator.ir.MemoryAccessCommand;
import org.hackvm.translator.ir.ReturnCommand;

import java.util.HashMap;
import java.util.Map;

/**
 * Registry mapping command classes to emitter instances.
 * <p>
 * Command types are records, so lookup is by exact class; there is no hierarchy to walk.
 */
public final class EmitterRegistry {

	private final Map<Class<? extends Command>, ICommandEmitter<? extends Command>> byClass = new HashMap<>();

	/**
	 * Registers an emitter for the given command class, replacing any previous one.
	 *
	 * @param commandType The command record class.
	 * @param emitter     The emitter handling that class.
	 * @param <T>         Concrete command type parameter.
	 */
	public <T extends Command> void register(Class<T> commandType, ICommandEmitter<T> emitter) {
		byClass.put(commandType, emitter);
	}

	/**
	 * Resolves the emitter for a command.
	 *
	 * @param command The command to translate.
	 * @return The emitter registered for the command's class.
	 * @throws IllegalStateException if no emitter is registered for it.
	 */
	@SuppressWarnings("unchecked")
	public ICommandEmitter<Command> resolve(Command command) {
		ICommandEmitter<?> found = byClass.get(command.getClass());
		if (found == null) {
			throw new IllegalStateException("No emitter registered for " + command.getClass().getSimpleName());
		}
		return (ICommandEmitter<Command>) found;
	}

	/**
	 * Initializes a registry with an emitter for every command type.
	 *
	 * @return A registry covering the complete VM command set.
	 */
	public static EmitterRegistry initializeWithDefaults() {
		EmitterRegistry reg = new EmitterRegistry();
		reg.register(ArithmeticCommand.class, new ArithmeticEmitter());
		reg.register(MemoryAccessCommand.class, new MemoryAccessEmitter());
		reg.register(BranchCommand.class, new BranchEmitter());
		reg.register(FunctionCommand.class, new FunctionEmitter());
		reg.register(CallCommand.class, new CallEmitter());
		reg.register(ReturnCommand.class, new ReturnEmitter());
		return reg;
	}
}
