package me.christianrobert.trigconv.parser;

import me.christianrobert.trigconv.core.exception.InputSizeException;

/**
 * Rejects oversized inputs before any structural parsing starts.
 */
public class InputGuard {

    public static void checkLineCount(PreprocessedSource source, ParseLimits limits) {
        int lines = source.getPhysicalLineCount();
        if (lines > limits.getMaxLines()) {
            throw new InputSizeException("Trigger body has " + lines + " lines, the limit is " + limits.getMaxLines(),
                    limits.getMaxLines(), lines, -1);
        }
    }

    public static void checkNestingDepth(TriggerSections sections, ParseLimits limits, TokenSequence tokens) {
        int depth = sections.getMaxDepth();
        if (depth > limits.getMaxNestingDepth()) {
            throw new InputSizeException("Trigger body nests " + depth + " levels deep, the limit is "
                    + limits.getMaxNestingDepth(), limits.getMaxNestingDepth(), depth,
                    tokens.lineOf(sections.getBeginIndex()));
        }
    }
}
