package me.christianrobert.trigconv.ir;

import java.util.Collections;
import java.util.List;

/**
 * Unconditional {@code LOOP ... END LOOP;}, left through EXIT.
 */
public class BasicLoop implements Statement {

    private final List<Statement> body;
    private final int lineNumber;
    private final int endLine;

    public BasicLoop(List<Statement> body, int lineNumber, int endLine) {
        this.body = Collections.unmodifiableList(body);
        this.lineNumber = lineNumber;
        this.endLine = endLine;
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
        return visitor.visitBasicLoop(this);
    }

    @Override
    public String toString() {
        return "BasicLoop{body=" + body.size() + "}";
    }
}
