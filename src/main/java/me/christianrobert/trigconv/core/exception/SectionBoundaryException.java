package me.christianrobert.trigconv.core.exception;

/**
 * Thrown when the outermost DECLARE/BEGIN/END sections cannot be located,
 * e.g. DECLARE without a following BEGIN or a BEGIN whose END is missing.
 */
public class SectionBoundaryException extends TriggerConversionException {

    public SectionBoundaryException(String message, int lineNumber, String rawText) {
        super(message, lineNumber, 0, rawText);
    }

    @Override
    public String getErrorKind() {
        return "SECTION_BOUNDARY_ERROR";
    }
}
