package org.hackvm.translator.backend.emit;

import org.hackvm.translator.api.TranslationException;
import org.hackvm.translator.ir.CallCommand;
import org.hackvm.translator.ir.Command;

import java.util.List;

/**
 * Translates a stream of VM commands into Hack assembly.
 * <p>
 * One instance translates one complete program: all files of the program go through the same
 * writer so labels generated for comparisons and calls stay unique across the whole output.
 * Call {@link #setFileName(String)} before the first command of each file. This class is not thread-safe.
 */
public class CodeWriter {

    private final EmissionContext ctx;
    private final EmitterRegistry registry;

    /**
     * Creates a writer with the default emitters.
     * @param annotate Whether each command's code is preceded by a comment line.
     */
    public CodeWriter(boolean annotate) {
        this(annotate, EmitterRegistry.initializeWithDefaults());
    }

    /**
     * Creates a writer with a custom emitter registry.
     * @param annotate Whether each command's code is preceded by a comment line.
     * @param registry The emitters to use.
     */
    public CodeWriter(boolean annotate, EmitterRegistry registry) {
        this.ctx = new EmissionContext(annotate);
        this.registry = registry;
    }

    /**
     * Informs the writer that the commands of a new source file follow. The current function is
     * not reset: functions of all files form one flat namespace.
     *
     * @param moduleName The file name without extension; qualifies static variables.
     */
    public void setFileName(String moduleName) {
        ctx.setCurrentFile(moduleName);
        ctx.comment("file: " + moduleName + ".vm");
    }

    /**
     * Translates one command.
     *
     * @param command The command.
     * @throws TranslationException if the command is invalid for code generation,
     *         e.g. {@code pop constant 0}.
     */
    public void write(Command command) throws TranslationException {
        ctx.comment(command.toVmString());
        registry.resolve(command).emit(command, ctx);
    }

    /**
     * Emits the bootstrap code: set the stack pointer, then call the entry function.
     *
     * @param stackOrigin The initial value of SP.
     * @param entryFunction The function to call, usually {@code Sys.init}.
     * @throws TranslationException if the registered call emitter rejects the call.
     */
    public void writeBootstrap(int stackOrigin, String entryFunction) throws TranslationException {
        ctx.comment("bootstrap");
        ctx.emit("@" + stackOrigin, "D=A", "@" + HackSymbols.SP, "M=D");
        CallCommand call = new CallCommand(entryFunction, 0);
        ctx.comment(call.toVmString());
        registry.resolve(call).emit(call, ctx);
    }

    /**
     * Emits the terminating infinite loop. A well-formed program with bootstrap never gets here;
     * a single translated file runs into it after its last command.
     */
    public void writeEndLoop() {
        ctx.comment("end");
        ctx.label(HackSymbols.END_LABEL);
        ctx.jump(HackSymbols.END_LABEL);
    }

    /**
     * @return The assembly emitted so far.
     */
    public List<String> lines() {
        return ctx.lines();
    }

    public String currentFile() {
        return ctx.currentFile();
    }

    public String currentFunction() {
        return ctx.currentFunction();
    }

    public int labelCounter() {
        return ctx.labelCounter();
    }
}
