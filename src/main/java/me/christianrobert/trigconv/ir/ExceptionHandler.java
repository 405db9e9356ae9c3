package me.christianrobert.trigconv.ir;

import java.util.Collections;
import java.util.List;

/**
 * One {@code WHEN name [OR name]* THEN ...} handler of an EXCEPTION section.
 */
public class ExceptionHandler {

    private final List<String> exceptionNames;
    private final List<Statement> handlerStatements;
    private final int lineNumber;

    public ExceptionHandler(List<String> exceptionNames, List<Statement> handlerStatements, int lineNumber) {
        if (exceptionNames == null || exceptionNames.isEmpty()) {
            throw new IllegalArgumentException("Exception handler requires at least one exception name");
        }
        this.exceptionNames = Collections.unmodifiableList(exceptionNames);
        this.handlerStatements = Collections.unmodifiableList(handlerStatements);
        this.lineNumber = lineNumber;
    }

    public List<String> getExceptionNames() {
        return exceptionNames;
    }

    public List<Statement> getHandlerStatements() {
        return handlerStatements;
    }

    /**
     * Line of the WHEN keyword.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public boolean catchesOthers() {
        return exceptionNames.stream().anyMatch(n -> n.equalsIgnoreCase("OTHERS"));
    }

    @Override
    public String toString() {
        return "ExceptionHandler{" + exceptionNames + ", statements=" + handlerStatements.size() + "}";
    }
}
