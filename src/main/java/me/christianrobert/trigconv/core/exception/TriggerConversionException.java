package me.christianrobert.trigconv.core.exception;

/**
 * Base class for errors that abort the conversion of a single trigger.
 * Captures the position of the failure so the input can be fixed without a debugger.
 */
public class TriggerConversionException extends RuntimeException {

    private final int lineNumber;
    private final int nestingDepth;
    private final String rawText;

    public TriggerConversionException(String message) {
        this(message, -1, -1, null);
    }

    public TriggerConversionException(String message, int lineNumber, int nestingDepth, String rawText) {
        super(message);
        this.lineNumber = lineNumber;
        this.nestingDepth = nestingDepth;
        this.rawText = rawText;
    }

    public TriggerConversionException(String message, Throwable cause) {
        super(message, cause);
        this.lineNumber = -1;
        this.nestingDepth = -1;
        this.rawText = null;
    }

    /**
     * Short name of the error kind, used in conversion results and REST responses.
     */
    public String getErrorKind() {
        return "CONVERSION_ERROR";
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public int getNestingDepth() {
        return nestingDepth;
    }

    public String getRawText() {
        return rawText;
    }

    /**
     * Gets a detailed error message including position and offending text.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (lineNumber > 0) {
            sb.append("\nLine: ").append(lineNumber);
        }
        if (nestingDepth >= 0) {
            sb.append("\nNesting depth: ").append(nestingDepth);
        }
        if (rawText != null) {
            sb.append("\nText: ").append(rawText);
        }
        return sb.toString();
    }
}
