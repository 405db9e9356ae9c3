package me.christianrobert.trigconv.core.exception;

/**
 * Thrown before parsing starts when an input exceeds the configured
 * line-count or nesting-depth limit.
 */
public class InputSizeException extends TriggerConversionException {

    private final int limit;
    private final int actual;

    public InputSizeException(String message, int limit, int actual, int lineNumber) {
        super(message, lineNumber, -1, null);
        this.limit = limit;
        this.actual = actual;
    }

    @Override
    public String getErrorKind() {
        return "INPUT_SIZE_ERROR";
    }

    public int getLimit() {
        return limit;
    }

    public int getActual() {
        return actual;
    }

    @Override
    public String getDetailedMessage() {
        return super.getDetailedMessage() + "\nLimit: " + limit + ", actual: " + actual;
    }
}
