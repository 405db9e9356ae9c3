package me.christianrobert.trigconv.core.exception;

/**
 * Thrown when the statement structure of a trigger body cannot be recognized:
 * an unmatched block opener or closer, a closer of the wrong kind, a missing
 * THEN/LOOP, or a statement that never reaches its terminating semicolon.
 */
public class StructuralParseException extends TriggerConversionException {

    public StructuralParseException(String message, int lineNumber, int nestingDepth, String rawText) {
        super(message, lineNumber, nestingDepth, rawText);
    }

    @Override
    public String getErrorKind() {
        return "STRUCTURAL_PARSE_ERROR";
    }
}
