package me.christianrobert.trigconv.ir;

import java.util.Collections;
import java.util.List;

/**
 * An ELSIF branch: its condition and statements.
 */
public class ConditionalBranch {

    private final String condition;
    private final List<Statement> statements;
    private final int lineNumber;

    public ConditionalBranch(String condition, List<Statement> statements, int lineNumber) {
        this.condition = condition;
        this.statements = Collections.unmodifiableList(statements);
        this.lineNumber = lineNumber;
    }

    public String getCondition() {
        return condition;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
