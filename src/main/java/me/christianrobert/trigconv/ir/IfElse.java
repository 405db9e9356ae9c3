package me.christianrobert.trigconv.ir;

import java.util.Collections;
import java.util.List;

/**
 * {@code IF condition THEN ... [ELSIF condition THEN ...]* [ELSE ...] END IF;}
 */
public class IfElse implements Statement {

    private final String condition;
    private final List<Statement> thenBranch;
    private final List<ConditionalBranch> elifBranches;
    private final List<Statement> elseBranch;
    private final int lineNumber;
    private final int elseLine;
    private final int endLine;

    public IfElse(String condition, List<Statement> thenBranch, List<ConditionalBranch> elifBranches,
                  List<Statement> elseBranch, int lineNumber, int elseLine, int endLine) {
        if (condition == null || condition.isEmpty()) {
            throw new IllegalArgumentException("IF condition cannot be null or empty");
        }
        this.condition = condition;
        this.thenBranch = Collections.unmodifiableList(thenBranch);
        this.elifBranches = Collections.unmodifiableList(elifBranches);
        this.elseBranch = elseBranch != null ? Collections.unmodifiableList(elseBranch) : null;
        this.lineNumber = lineNumber;
        this.elseLine = elseLine;
        this.endLine = endLine;
    }

    public String getCondition() {
        return condition;
    }

    public List<Statement> getThenBranch() {
        return thenBranch;
    }

    public List<ConditionalBranch> getElifBranches() {
        return elifBranches;
    }

    /**
     * Statements of the ELSE branch, or null when there is no ELSE.
     */
    public List<Statement> getElseBranch() {
        return elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    /**
     * Line of the ELSE keyword, or -1.
     */
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
        return visitor.visitIfElse(this);
    }

    @Override
    public String toString() {
        return "IfElse{condition='" + condition + "', then=" + thenBranch.size()
                + ", elsif=" + elifBranches.size() + ", else=" + hasElse() + "}";
    }
}
