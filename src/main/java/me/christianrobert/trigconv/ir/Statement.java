package me.christianrobert.trigconv.ir;

/**
 * A node of the statement tree. Nodes are immutable and own their children outright.
 *
 * <p>The node kind is decided once while parsing; consumers dispatch through
 * {@link StatementVisitor} instead of re-inspecting source text.</p>
 */
public interface Statement {

    /**
     * Line on which the statement (or its opening keyword) starts.
     */
    int getLineNumber();

    /**
     * Line on which the statement (or its closing keyword) ends.
     */
    int getEndLine();

    <R> R accept(StatementVisitor<R> visitor);
}
