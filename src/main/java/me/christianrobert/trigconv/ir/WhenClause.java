package me.christianrobert.trigconv.ir;

import java.util.Collections;
import java.util.List;

/**
 * One {@code WHEN expr THEN ...} clause of a CASE statement.
 */
public class WhenClause {

    private final String matchExpr;
    private final List<Statement> statements;
    private final int lineNumber;

    public WhenClause(String matchExpr, List<Statement> statements, int lineNumber) {
        this.matchExpr = matchExpr;
        this.statements = Collections.unmodifiableList(statements);
        this.lineNumber = lineNumber;
    }

    public String getMatchExpr() {
        return matchExpr;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
