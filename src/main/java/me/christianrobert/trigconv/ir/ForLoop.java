package me.christianrobert.trigconv.ir;

import java.util.Collections;
import java.util.List;

/**
 * {@code FOR var IN [REVERSE] iterable LOOP ... END LOOP;}
 *
 * <p>The iterable is kept verbatim: a numeric range ({@code 1..10}), a cursor name,
 * or a parenthesized query.</p>
 */
public class ForLoop implements Statement {

    private final String loopVar;
    private final String iterableExpr;
    private final boolean reverse;
    private final List<Statement> body;
    private final int lineNumber;
    private final int endLine;

    public ForLoop(String loopVar, String iterableExpr, boolean reverse, List<Statement> body,
                   int lineNumber, int endLine) {
        if (loopVar == null || loopVar.isEmpty()) {
            throw new IllegalArgumentException("Loop variable cannot be null or empty");
        }
        if (iterableExpr == null || iterableExpr.isEmpty()) {
            throw new IllegalArgumentException("Loop iterable cannot be null or empty");
        }
        this.loopVar = loopVar;
        this.iterableExpr = iterableExpr;
        this.reverse = reverse;
        this.body = Collections.unmodifiableList(body);
        this.lineNumber = lineNumber;
        this.endLine = endLine;
    }

    public String getLoopVar() {
        return loopVar;
    }

    public String getIterableExpr() {
        return iterableExpr;
    }

    public boolean isReverse() {
        return reverse;
    }

    /**
     * True when the iterable is a numeric range rather than a query or cursor.
     */
    public boolean isNumericRange() {
        return iterableExpr.contains("..");
    }

    public List<Statement> getBody() {
        return body;
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
        return visitor.visitForLoop(this);
    }

    @Override
    public String toString() {
        return "ForLoop{" + loopVar + " IN " + (reverse ? "REVERSE " : "") + iterableExpr + ", body=" + body.size() + "}";
    }
}
