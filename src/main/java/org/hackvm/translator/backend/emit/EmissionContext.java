package org.hackvm.translator.backend.emit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable context shared by all emitters of one translation.
 * <p>
 * Owns the translation state (current file, current function, label counter) and the emitted
 * assembly lines, and offers the instruction sequences the emitters have in common.
 * One instance belongs to exactly one {@link CodeWriter}; it is not thread-safe.
 */
public final class EmissionContext {

	private final List<String> out = new ArrayList<>();
	private final boolean annotate;
	private String currentFile = "";
	private String currentFunction;
	private int labelCounter;

	/**
	 * @param annotate Whether {@link #comment(String)} writes comment lines.
	 */
	public EmissionContext(boolean annotate) {
		this.annotate = annotate;
	}

	// --- Output ---

	/**
	 * Emits instructions verbatim, one line each.
	 * @param instructions The instructions, e.g. {@code "@SP"}, {@code "M=M+1"}.
	 */
	public void emit(String... instructions) {
		Collections.addAll(out, instructions);
	}

	/**
	 * Emits a label declaration {@code (name)}.
	 * @param name The label.
	 */
	public void label(String name) {
		out.add("(" + name + ")");
	}

	/**
	 * Emits a comment line if annotation is enabled.
	 * @param text The comment text without the comment marker.
	 */
	public void comment(String text) {
		if (annotate) {
			out.add("// " + text);
		}
	}

	/** Pushes D onto the stack: {@code RAM[SP] = D; SP++}. */
	public void pushD() {
		emit("@" + HackSymbols.SP, "A=M", "M=D", "@" + HackSymbols.SP, "M=M+1");
	}

	/** Pops the stack into D: {@code SP--; D = RAM[SP]}. */
	public void popD() {
		emit("@" + HackSymbols.SP, "AM=M-1", "D=M");
	}

	/**
	 * Emits an unconditional jump.
	 * @param target The label to jump to.
	 */
	public void jump(String target) {
		emit("@" + target, "0;JMP");
	}

	/**
	 * @return An unmodifiable view of the lines emitted so far.
	 */
	public List<String> lines() {
		return Collections.unmodifiableList(out);
	}

	// --- Translation state ---

	/**
	 * Returns the current value of the label counter and increments it.
	 * @return A number never returned before by this context.
	 */
	public int nextLabelId() {
		return labelCounter++;
	}

	public int labelCounter() {
		return labelCounter;
	}

	public String currentFile() {
		return currentFile;
	}

	public void setCurrentFile(String currentFile) {
		this.currentFile = currentFile;
	}

	/**
	 * @return The most recently declared function, or {@code null} before the first declaration.
	 */
	public String currentFunction() {
		return currentFunction;
	}

	public void setCurrentFunction(String currentFunction) {
		this.currentFunction = currentFunction;
	}

	/**
	 * Qualifies a user label with the enclosing function, or with the current file for code
	 * outside any function.
	 *
	 * @param symbol The label as written in the source.
	 * @return The scoped label, e.g. {@code Main.loop$WHILE_EXP0}.
	 */
	public String scopedLabel(String symbol) {
		String scope = currentFunction != null ? currentFunction : currentFile;
		return scope + "$" + symbol;
	}

	/**
	 * @param index The static index.
	 * @return The assembler variable backing {@code static index} of the current file.
	 */
	public String staticSymbol(int index) {
		return currentFile + "." + index;
	}
}
