package me.christianrobert.trigconv.ir;

import java.util.Collections;
import java.util.List;

/**
 * {@code [DECLARE ...] BEGIN ... [EXCEPTION WHEN ... THEN ...] END;}
 *
 * <p>The exception section belongs strictly to this block: its handlers never
 * contain statements of the main section, and the EXCEPTION keyword of a nested
 * block is never reported here.</p>
 */
public class BeginEndBlock implements Statement {

    private final Declarations declarations;
    private final List<Statement> mainStatements;
    private final List<ExceptionHandler> exceptionHandlers;
    private final int beginLine;
    private final int endLine;
    private final Integer exceptionLine;

    public BeginEndBlock(Declarations declarations, List<Statement> mainStatements,
                         List<ExceptionHandler> exceptionHandlers,
                         int beginLine, int endLine, Integer exceptionLine) {
        if (endLine < beginLine) {
            throw new IllegalArgumentException("Block ends (line " + endLine + ") before it begins (line " + beginLine + ")");
        }
        if (exceptionLine != null && (exceptionLine < beginLine || exceptionLine > endLine)) {
            throw new IllegalArgumentException("EXCEPTION line " + exceptionLine
                    + " lies outside its block (" + beginLine + ".." + endLine + ")");
        }
        if (exceptionLine == null && exceptionHandlers != null && !exceptionHandlers.isEmpty()) {
            throw new IllegalArgumentException("Exception handlers require an EXCEPTION line");
        }
        this.declarations = declarations != null ? declarations : Declarations.empty();
        this.mainStatements = Collections.unmodifiableList(mainStatements);
        this.exceptionHandlers = exceptionHandlers != null
                ? Collections.unmodifiableList(exceptionHandlers)
                : Collections.emptyList();
        this.beginLine = beginLine;
        this.endLine = endLine;
        this.exceptionLine = exceptionLine;
    }

    /**
     * Declarations of a nested {@code DECLARE ... BEGIN} block. Empty for plain blocks;
     * the trigger's own DECLARE section lives on {@link TriggerIR}.
     */
    public Declarations getDeclarations() {
        return declarations;
    }

    public List<Statement> getMainStatements() {
        return mainStatements;
    }

    public List<ExceptionHandler> getExceptionHandlers() {
        return exceptionHandlers;
    }

    public int getBeginLine() {
        return beginLine;
    }

    /**
     * Line of the EXCEPTION keyword, or null when the block has no exception section.
     */
    public Integer getExceptionLine() {
        return exceptionLine;
    }

    public boolean hasExceptionSection() {
        return exceptionLine != null;
    }

    @Override
    public int getLineNumber() {
        return beginLine;
    }

    @Override
    public int getEndLine() {
        return endLine;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }

    @Override
    public String toString() {
        return "BeginEndBlock{lines " + beginLine + ".." + endLine
                + (exceptionLine != null ? ", exception@" + exceptionLine : "")
                + ", statements=" + mainStatements.size() + ", handlers=" + exceptionHandlers.size() + "}";
    }
}
