package org.hackvm.translator.api;

/**
 * An exception that is thrown when translation of a VM program fails.
 * <p>
 * Every error is fatal for the whole translation, so the exception carries at most one
 * source position: the line that caused it.
 */
public class TranslationException extends Exception {

    private final TranslatorErrorCode errorCode;
    private final transient SourceInfo sourceInfo;
    private final String detail;

    /**
     * Constructs a new translation exception without source position.
     * @param errorCode The error code.
     * @param detail The detail message.
     */
    public TranslationException(TranslatorErrorCode errorCode, String detail) {
        this(errorCode, detail, null, null);
    }

    /**
     * Constructs a new translation exception with the specified cause.
     * @param errorCode The error code.
     * @param detail The detail message.
     * @param cause The cause.
     */
    public TranslationException(TranslatorErrorCode errorCode, String detail, Throwable cause) {
        this(errorCode, detail, null, cause);
    }

    private TranslationException(TranslatorErrorCode errorCode, String detail, SourceInfo sourceInfo, Throwable cause) {
        super(format(errorCode, detail, sourceInfo), cause);
        this.errorCode = errorCode;
        this.detail = detail;
        this.sourceInfo = sourceInfo;
    }

    /**
     * Returns a copy of this exception located at the given source line.
     * The stack trace and cause of this exception are preserved.
     *
     * @param source The line the error originates from.
     * @return The located exception.
     */
    public TranslationException at(SourceInfo source) {
        TranslationException located = new TranslationException(errorCode, detail, source, getCause());
        located.setStackTrace(getStackTrace());
        return located;
    }

    public TranslatorErrorCode errorCode() {
        return errorCode;
    }

    /**
     * @return The source position of the error, or {@code null} if it is not tied to a line.
     */
    public SourceInfo sourceInfo() {
        return sourceInfo;
    }

    public String detail() {
        return detail;
    }

    private static String format(TranslatorErrorCode errorCode, String detail, SourceInfo sourceInfo) {
        if (sourceInfo == null) {
            return String.format("[%s] %s", errorCode, detail);
        }
        return String.format("[%s] %s: %s (%s)", errorCode, sourceInfo, detail, sourceInfo.lineContent().trim());
    }
}
