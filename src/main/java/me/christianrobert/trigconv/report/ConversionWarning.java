package me.christianrobert.trigconv.report;

/**
 * A non-fatal finding with enough position context to fix the input or the mapping tables.
 */
public class ConversionWarning {

    private final WarningKind kind;
    private final String message;
    private final int lineNumber;
    private final int nestingDepth;
    private final String identifier;
    private final String rawText;

    public ConversionWarning(WarningKind kind, String message, int lineNumber, int nestingDepth,
                             String identifier, String rawText) {
        if (kind == null) {
            throw new IllegalArgumentException("Warning kind cannot be null");
        }
        this.kind = kind;
        this.message = message;
        this.lineNumber = lineNumber;
        this.nestingDepth = nestingDepth;
        this.identifier = identifier;
        this.rawText = rawText;
    }

    public WarningKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    /**
     * 1-based source line, or -1 when the warning is not tied to a line.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public int getNestingDepth() {
        return nestingDepth;
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getRawText() {
        return rawText;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name()).append(": ").append(message);
        if (lineNumber > 0) {
            sb.append(" (line ").append(lineNumber).append(")");
        }
        return sb.toString();
    }
}
