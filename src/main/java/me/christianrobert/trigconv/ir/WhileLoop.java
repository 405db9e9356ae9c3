package me.christianrobert.trigconv.ir;

import java.util.Collections;
import java.util.List;

public class WhileLoop implements Statement {

    private final String condition;
    private final List<Statement> body;
    private final int lineNumber;
    private final int endLine;

    public WhileLoop(String condition, List<Statement> body, int lineNumber, int endLine) {
        if (condition == null || condition.isEmpty()) {
            throw new IllegalArgumentException("WHILE condition cannot be null or empty");
        }
        this.condition = condition;
        this.body = Collections.unmodifiableList(body);
        this.lineNumber = lineNumber;
        this.endLine = endLine;
    }

    public String getCondition() {
        return condition;
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
        return visitor.visitWhileLoop(this);
    }

    @Override
    public String toString() {
        return "WhileLoop{condition='" + condition + "', body=" + body.size() + "}";
    }
}
