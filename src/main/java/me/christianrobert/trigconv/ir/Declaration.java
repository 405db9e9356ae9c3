package me.christianrobert.trigconv.ir;

/**
 * One entry of a DECLARE section. Subclasses are the recognized declaration shapes;
 * {@link RawUnparsed} keeps anything else verbatim so no declaration is ever dropped.
 */
public abstract class Declaration {

    private final int lineNumber;

    protected Declaration(int lineNumber) {
        this.lineNumber = lineNumber;
    }

    /**
     * Line of the first physical line of the declaration.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Declared name, or null for raw declarations.
     */
    public abstract String getName();
}
