package me.christianrobert.trigconv.parser;

/**
 * Input ceilings checked before parsing starts.
 */
public class ParseLimits {

    public static final int DEFAULT_MAX_LINES = 20000;
    public static final int DEFAULT_MAX_NESTING_DEPTH = 64;
    /** Upper bound for any configured nesting depth; the statement parser recurses once per level. */
    public static final int HARD_MAX_NESTING_DEPTH = 256;

    private final int maxLines;
    private final int maxNestingDepth;

    public ParseLimits(int maxLines, int maxNestingDepth) {
        if (maxLines < 1) {
            throw new IllegalArgumentException("Max lines must be positive: " + maxLines);
        }
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("Max nesting depth must be positive: " + maxNestingDepth);
        }
        if (maxNestingDepth > HARD_MAX_NESTING_DEPTH) {
            throw new IllegalArgumentException("Max nesting depth cannot exceed " + HARD_MAX_NESTING_DEPTH
                    + ": " + maxNestingDepth);
        }
        this.maxLines = maxLines;
        this.maxNestingDepth = maxNestingDepth;
    }

    public static ParseLimits defaults() {
        return new ParseLimits(DEFAULT_MAX_LINES, DEFAULT_MAX_NESTING_DEPTH);
    }

    public int getMaxLines() {
        return maxLines;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    @Override
    public String toString() {
        return "ParseLimits{maxLines=" + maxLines + ", maxNestingDepth=" + maxNestingDepth + "}";
    }
}
