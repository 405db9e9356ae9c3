package me.christianrobert.trigconv.ir;

import java.util.Collections;
import java.util.List;

/**
 * CASE statement in selector form ({@code CASE x WHEN 1 THEN ...}) or searched form
 * ({@code CASE WHEN x = 1 THEN ...}), closed by {@code END CASE;}.
 */
public class CaseWhen implements Statement {

    private final String selector;
    private final List<WhenClause> whenClauses;
    private final List<Statement> elseBranch;
    private final int lineNumber;
    private final int elseLine;
    private final int endLine;

    public CaseWhen(String selector, List<WhenClause> whenClauses, List<Statement> elseBranch,
                    int lineNumber, int elseLine, int endLine) {
        if (whenClauses == null || whenClauses.isEmpty()) {
            throw new IllegalArgumentException("CASE statement requires at least one WHEN clause");
        }
        this.selector = selector;
        this.whenClauses = Collections.unmodifiableList(whenClauses);
        this.elseBranch = elseBranch != null ? Collections.unmodifiableList(elseBranch) : null;
        this.lineNumber = lineNumber;
        this.elseLine = elseLine;
        this.endLine = endLine;
    }

    /**
     * Selector expression, or null for the searched form.
     */
    public String getSelector() {
        return selector;
    }

    public boolean isSearched() {
        return selector == null;
    }

    public List<WhenClause> getWhenClauses() {
        return whenClauses;
    }

    public List<Statement> getElseBranch() {
        return elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    public int getElseLine() {
        return elseLine;
    }

    @Override
    public int getLineNumber() {
        return lineNumber;
    }

    @Override
    public int getEndLine() {
        return endLine;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitCaseWhen(this);
    }

    @Override
    public String toString() {
        return "CaseWhen{selector=" + selector + ", when=" + whenClauses.size() + ", else=" + hasElse() + "}";
    }
}
