package me.christianrobert.trigconv.report;

/**
 * Kinds of non-fatal findings. None of them aborts a conversion.
 */
public enum WarningKind {
    MALFORMED_DECLARATION,
    DUPLICATE_DECLARATION,
    UNMAPPED_FUNCTION,
    UNMAPPED_TYPE,
    UNMAPPED_EXCEPTION,
    EMPTY_MAPPING_TABLE,
    AMBIGUOUS_HANDLER,
    UNRECOGNIZED_HEADER,
    TRAILING_CONTENT;

    /**
     * Unmapped identifiers are listed separately in the report.
     */
    public boolean isUnmappedIdentifier() {
        return this == UNMAPPED_FUNCTION || this == UNMAPPED_TYPE || this == UNMAPPED_EXCEPTION;
    }
}
