package me.christianrobert.trigconv.parser;

/**
 * Token positions of the outermost sections of a trigger body.
 *
 * <pre>
 * [header] [DECLARE decls] BEGIN main [EXCEPTION handlers] END [label] ; [/]
 * </pre>
 */
public class TriggerSections {

    private final int headerEnd;
    private final int declareIndex;
    private final int beginIndex;
    private final int exceptionIndex;
    private final int closerIndex;
    private final int terminatorIndex;
    private final int maxDepth;

    public TriggerSections(int headerEnd, int declareIndex, int beginIndex, int exceptionIndex,
                           int closerIndex, int terminatorIndex, int maxDepth) {
        this.headerEnd = headerEnd;
        this.declareIndex = declareIndex;
        this.beginIndex = beginIndex;
        this.exceptionIndex = exceptionIndex;
        this.closerIndex = closerIndex;
        this.terminatorIndex = terminatorIndex;
        this.maxDepth = maxDepth;
    }

    /**
     * Exclusive end of the header tokens; 0 when the body has no header clause.
     */
    public int getHeaderEnd() {
        return headerEnd;
    }

    public boolean hasHeader() {
        return headerEnd > 0;
    }

    public int getDeclareIndex() {
        return declareIndex;
    }

    public boolean hasDeclareSection() {
        return declareIndex >= 0;
    }

    public int getBeginIndex() {
        return beginIndex;
    }

    public int getExceptionIndex() {
        return exceptionIndex;
    }

    public int getCloserIndex() {
        return closerIndex;
    }

    public int getTerminatorIndex() {
        return terminatorIndex;
    }

    /**
     * Deepest construct nesting of the main block, the main block itself counting as 1.
     */
    public int getMaxDepth() {
        return maxDepth;
    }
}
