package me.christianrobert.trigconv.parser;

import java.util.Collections;
import java.util.List;

/**
 * Token indices of one construct found by the boundary lookahead: opener, end of the
 * opening header, the construct's own separators and its closer. No content is built.
 */
public class ConstructBoundaries {

    /**
     * A separator keyword at the construct's own depth: ELSIF/ELSE for IF,
     * WHEN/ELSE for CASE, EXCEPTION and handler WHENs for blocks.
     */
    public static class Separator {
        private final String keyword;
        private final int index;
        private final int headerEnd;

        public Separator(String keyword, int index, int headerEnd) {
            this.keyword = keyword;
            this.index = index;
            this.headerEnd = headerEnd;
        }

        public String getKeyword() {
            return keyword;
        }

        public int getIndex() {
            return index;
        }

        /**
         * Index of the THEN closing a WHEN/ELSIF header, or the separator index itself.
         */
        public int getHeaderEnd() {
            return headerEnd;
        }

        @Override
        public String toString() {
            return keyword + "@" + index;
        }
    }

    private final ConstructKind kind;
    private final int openerIndex;
    private final int headerEnd;
    private final List<Separator> separators;
    private final int closerIndex;
    private final int terminatorIndex;

    public ConstructBoundaries(ConstructKind kind, int openerIndex, int headerEnd, List<Separator> separators,
                               int closerIndex, int terminatorIndex) {
        this.kind = kind;
        this.openerIndex = openerIndex;
        this.headerEnd = headerEnd;
        this.separators = Collections.unmodifiableList(separators);
        this.closerIndex = closerIndex;
        this.terminatorIndex = terminatorIndex;
    }

    public ConstructKind getKind() {
        return kind;
    }

    public int getOpenerIndex() {
        return openerIndex;
    }

    /**
     * Last token of the opening header: THEN of an IF, LOOP of a loop, the token before
     * the first WHEN of a CASE, the BEGIN of a block.
     */
    public int getHeaderEnd() {
        return headerEnd;
    }

    public List<Separator> getSeparators() {
        return separators;
    }

    public Separator findSeparator(String keyword) {
        for (Separator separator : separators) {
            if (separator.getKeyword().equals(keyword)) {
                return separator;
            }
        }
        return null;
    }

    public int getCloserIndex() {
        return closerIndex;
    }

    /**
     * Index of the {@code ;} that ends the closer; the last token of the construct.
     */
    public int getTerminatorIndex() {
        return terminatorIndex;
    }

    @Override
    public String toString() {
        return "ConstructBoundaries{" + kind + " " + openerIndex + ".." + closerIndex + ", separators=" + separators + "}";
    }
}
