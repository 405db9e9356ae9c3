package me.christianrobert.trigconv.ir;

/**
 * A single statement kept as opaque source text.
 *
 * <p>{@code sourceText} excludes the terminating semicolon. Multi-line statements keep
 * their line breaks, with continuation lines indented relative to the first line.
 * {@code id} is stable per trigger ({@code stmt_1}, {@code stmt_2}, ... in source order).</p>
 */
public class SqlLeaf implements Statement {

    private final String id;
    private final LeafKind kind;
    private final String sourceText;
    private final int lineNumber;
    private final int endLine;

    public SqlLeaf(String id, LeafKind kind, String sourceText, int lineNumber, int endLine) {
        if (kind == null) {
            throw new IllegalArgumentException("Leaf kind cannot be null");
        }
        if (sourceText == null) {
            throw new IllegalArgumentException("Source text cannot be null");
        }
        this.id = id;
        this.kind = kind;
        this.sourceText = sourceText;
        this.lineNumber = lineNumber;
        this.endLine = endLine;
    }

    public String getId() {
        return id;
    }

    public LeafKind getKind() {
        return kind;
    }

    public String getSourceText() {
        return sourceText;
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
        return visitor.visitLeaf(this);
    }

    @Override
    public String toString() {
        return "SqlLeaf{" + id + ", " + kind + "@" + lineNumber + ": '" + sourceText + "'}";
    }
}
