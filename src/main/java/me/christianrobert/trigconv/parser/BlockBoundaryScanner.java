package me.christianrobert.trigconv.parser;

import me.christianrobert.trigconv.core.exception.StructuralParseException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Lookahead pass that finds where a construct ends without building any content.
 *
 * <p>Starting at an opener (BEGIN, IF, CASE, FOR, WHILE, LOOP) the scanner walks forward
 * one statement at a time, keeping a stack of the constructs opened in between. Keywords
 * are only interpreted at statement starts; everything up to the next {@code ;} of a
 * plain statement is skipped, so CASE expressions, strings and subqueries never
 * influence the structure.</p>
 *
 * <p>Separators (EXCEPTION and handler WHENs of a block, ELSIF/ELSE of an IF, WHEN/ELSE
 * of a CASE) are recorded only while the stack holds the scanned construct alone,
 * i.e. at its own depth. A closer of the wrong kind fails immediately.</p>
 *
 * <h3>Example</h3>
 * <pre>
 * BEGIN                      -- opener (scanned)
 *   BEGIN                    -- nested, pushed
 *     x := 1;
 *   EXCEPTION                -- nested depth: not recorded
 *     WHEN OTHERS THEN NULL;
 *   END;                     -- nested, popped
 * EXCEPTION                  -- own depth: recorded
 *   WHEN NO_DATA_FOUND THEN  -- own depth: recorded
 *     NULL;
 * END;                       -- closer (scanned)
 * </pre>
 */
public class BlockBoundaryScanner {

    private static final Set<String> THEN = Set.of("THEN");
    private static final Set<String> LOOP = Set.of("LOOP");
    private static final Set<String> WHEN = Set.of("WHEN");

    private final TokenSequence tokens;

    public BlockBoundaryScanner(TokenSequence tokens) {
        this.tokens = tokens;
    }

    private static class Frame {
        private final ConstructKind kind;
        private final int openerIndex;
        private boolean inExceptionSection;

        Frame(ConstructKind kind, int openerIndex) {
            this.kind = kind;
            this.openerIndex = openerIndex;
        }
    }

    /**
     * Result of a lenient walk: maximum nesting depth and, when found, the closer of the opener.
     */
    public static class NestingProfile {
        private final int maxDepth;
        private final int closerIndex;
        private final int terminatorIndex;
        private final int exceptionIndex;

        NestingProfile(int maxDepth, int closerIndex, int terminatorIndex, int exceptionIndex) {
            this.maxDepth = maxDepth;
            this.closerIndex = closerIndex;
            this.terminatorIndex = terminatorIndex;
            this.exceptionIndex = exceptionIndex;
        }

        public int getMaxDepth() {
            return maxDepth;
        }

        /**
         * Index of the END that brings the depth back to zero, or -1 when it never does.
         */
        public int getCloserIndex() {
            return closerIndex;
        }

        public int getTerminatorIndex() {
            return terminatorIndex;
        }

        /**
         * Index of the EXCEPTION keyword at depth one, or -1.
         */
        public int getExceptionIndex() {
            return exceptionIndex;
        }

        public boolean isClosed() {
            return closerIndex >= 0;
        }
    }

    /**
     * Scans the construct opened at {@code openerIndex}, which must close before {@code limit}.
     *
     * @param depth nesting depth of the construct, used for error reporting
     * @throws StructuralParseException if the construct is unbalanced or never closed
     */
    public ConstructBoundaries scan(int openerIndex, int limit, int depth) {
        SqlToken opener = tokens.get(openerIndex);
        ConstructKind kind = kindOf(opener);
        if (kind == null) {
            throw new IllegalArgumentException("Not a construct opener: " + opener);
        }

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(kind, openerIndex));
        int headerEnd = headerEnd(openerIndex, limit, depth);
        List<ConstructBoundaries.Separator> separators = new ArrayList<>();

        int i = headerEnd + 1;
        while (i < limit) {
            SqlToken token = tokens.get(i);
            int currentDepth = depth + stack.size() - 1;
            boolean ownDepth = stack.size() == 1;

            if (token.isSymbol(";")) {
                i++;
                continue;
            }
            if (token.isSymbol("<<")) {
                i = skipLabel(i, limit);
                continue;
            }
            if (!token.isWord()) {
                i = findStatementEnd(i, limit, currentDepth) + 1;
                continue;
            }

            Frame top = stack.peek();
            switch (token.getUpper()) {
                case "BEGIN" -> {
                    stack.push(new Frame(ConstructKind.BLOCK, i));
                    i++;
                }
                case "DECLARE" -> i++;
                case "IF" -> {
                    stack.push(new Frame(ConstructKind.IF, i));
                    i = requireKeyword(i, limit, THEN, currentDepth + 1) + 1;
                }
                case "CASE" -> {
                    stack.push(new Frame(ConstructKind.CASE, i));
                    i = requireKeyword(i, limit, WHEN, currentDepth + 1);
                }
                case "FOR", "WHILE" -> {
                    stack.push(new Frame(ConstructKind.LOOP, i));
                    i = requireKeyword(i, limit, LOOP, currentDepth + 1) + 1;
                }
                case "LOOP" -> {
                    stack.push(new Frame(ConstructKind.LOOP, i));
                    i++;
                }
                case "ELSIF" -> {
                    requireTop(top, token, currentDepth, ConstructKind.IF);
                    int then = requireKeyword(i, limit, THEN, currentDepth);
                    if (ownDepth) {
                        separators.add(new ConstructBoundaries.Separator("ELSIF", i, then));
                    }
                    i = then + 1;
                }
                case "ELSE" -> {
                    requireTop(top, token, currentDepth, ConstructKind.IF, ConstructKind.CASE);
                    if (ownDepth) {
                        separators.add(new ConstructBoundaries.Separator("ELSE", i, i));
                    }
                    i++;
                }
                case "WHEN" -> {
                    boolean handler = top.kind == ConstructKind.BLOCK && top.inExceptionSection;
                    if (!handler && top.kind != ConstructKind.CASE) {
                        throw error("WHEN outside of a CASE statement or EXCEPTION section", i, currentDepth);
                    }
                    int then = requireKeyword(i, limit, THEN, currentDepth);
                    if (ownDepth) {
                        separators.add(new ConstructBoundaries.Separator("WHEN", i, then));
                    }
                    i = then + 1;
                }
                case "EXCEPTION" -> {
                    requireTop(top, token, currentDepth, ConstructKind.BLOCK);
                    if (top.inExceptionSection) {
                        throw error("Second EXCEPTION section in the same block", i, currentDepth);
                    }
                    top.inExceptionSection = true;
                    if (ownDepth) {
                        separators.add(new ConstructBoundaries.Separator("EXCEPTION", i, i));
                    }
                    i++;
                }
                case "END" -> {
                    ConstructKind closing = ConstructKind.BLOCK;
                    int next = i + 1;
                    if (tokens.isWord(next, "IF")) {
                        closing = ConstructKind.IF;
                        next++;
                    } else if (tokens.isWord(next, "LOOP")) {
                        closing = ConstructKind.LOOP;
                        next++;
                    } else if (tokens.isWord(next, "CASE")) {
                        closing = ConstructKind.CASE;
                        next++;
                    }

                    stack.pop();
                    if (top.kind != closing) {
                        throw error(closing.closerText() + " does not match " + top.kind.getKeyword()
                                + " opened at line " + tokens.lineOf(top.openerIndex), i, currentDepth);
                    }

                    // optional label: END my_block; / END LOOP outer;
                    if (next + 1 < limit && tokens.get(next).isWord() && tokens.isSymbol(next + 1, ";")) {
                        next++;
                    }
                    int terminator;
                    if (next < limit && tokens.isSymbol(next, ";")) {
                        terminator = next;
                    } else if (next >= limit && stack.isEmpty()) {
                        terminator = next - 1;
                    } else {
                        throw error("Missing ';' after " + closing.closerText(), i, currentDepth);
                    }

                    if (stack.isEmpty()) {
                        return new ConstructBoundaries(kind, openerIndex, headerEnd, separators, i, terminator);
                    }
                    i = terminator + 1;
                }
                default -> i = findStatementEnd(i, limit, currentDepth) + 1;
            }
        }

        Frame unclosed = stack.peek();
        throw error(tokens.get(unclosed.openerIndex).getUpper() + " opened at line "
                        + tokens.lineOf(unclosed.openerIndex) + " is never closed by " + unclosed.kind.closerText(),
                unclosed.openerIndex, depth + stack.size() - 1);
    }

    /**
     * Index of the {@code ;} ending the plain statement that starts at {@code from}.
     *
     * <p>Fails when the input (or {@code limit}) is reached first, or when a line starts with a
     * keyword that can only follow a complete statement (ELSIF, EXCEPTION, BEGIN, END IF,
     * END LOOP, END CASE), which means the statement's own {@code ;} is missing. A line at
     * the statement's own indentation that opens an assignment counts as such a start too.</p>
     */
    public int findStatementEnd(int from, int limit, int depth) {
        for (int i = from; i < limit; i++) {
            SqlToken token = tokens.get(i);
            if (token.isSymbol(";")) {
                return i;
            }
            if (i > from && startsNextStatement(from, i)) {
                throw error("Statement is not terminated by ';' before line " + token.getLineNumber(), from, depth);
            }
        }
        throw error("Statement is not terminated by ';'", from, depth);
    }

    private boolean startsNextStatement(int from, int i) {
        SqlToken token = tokens.get(i);
        if (!token.isFirstOnLine()) {
            return false;
        }
        if (token.isWord("ELSIF") || token.isWord("EXCEPTION") || token.isWord("BEGIN")) {
            return true;
        }
        if (token.isWord("END")) {
            return tokens.isWord(i + 1, "IF") || tokens.isWord(i + 1, "LOOP") || tokens.isWord(i + 1, "CASE");
        }
        SqlToken start = tokens.get(from);
        return start.isFirstOnLine() && token.getLineIndent() == start.getLineIndent() && opensAssignment(i);
    }

    // target := ..., where target is a (qualified) name or a :NEW/:OLD reference
    private boolean opensAssignment(int i) {
        int j = i;
        if (tokens.isSymbol(j, ":")) {
            j++;
        }
        if (j >= tokens.size() || !tokens.get(j).isWord()) {
            return false;
        }
        j++;
        while (tokens.isSymbol(j, ".") && j + 1 < tokens.size() && tokens.get(j + 1).isWord()) {
            j += 2;
        }
        return tokens.isSymbol(j, ":=");
    }

    /**
     * Lenient walk from {@code openerIndex} used before parsing: never fails, only measures.
     */
    public NestingProfile measure(int openerIndex, int limit) {
        int depth = 0;
        int maxDepth = 0;
        int exceptionIndex = -1;
        int i = openerIndex;

        while (i < limit) {
            SqlToken token = tokens.get(i);
            if (token.isSymbol("<<")) {
                i = skipLabel(i, limit);
                continue;
            }
            if (!token.isWord()) {
                i = skipLeniently(i, limit);
                continue;
            }
            switch (token.getUpper()) {
                case "BEGIN", "LOOP" -> {
                    depth++;
                    i++;
                }
                case "IF" -> {
                    depth++;
                    i = afterKeyword(i, limit, THEN);
                }
                case "FOR", "WHILE" -> {
                    depth++;
                    i = afterKeyword(i, limit, LOOP);
                }
                case "CASE" -> {
                    depth++;
                    int when = tokens.findTopLevelKeyword(i + 1, limit, WHEN);
                    i = when < 0 ? i + 1 : when;
                }
                case "ELSIF", "WHEN" -> i = afterKeyword(i, limit, THEN);
                case "ELSE", "DECLARE" -> i++;
                case "EXCEPTION" -> {
                    if (depth == 1 && exceptionIndex < 0) {
                        exceptionIndex = i;
                    }
                    i++;
                }
                case "END" -> {
                    depth--;
                    int next = i + 1;
                    if (tokens.isWord(next, "IF") || tokens.isWord(next, "LOOP") || tokens.isWord(next, "CASE")) {
                        next++;
                    }
                    if (next + 1 < limit && tokens.get(next).isWord() && tokens.isSymbol(next + 1, ";")) {
                        next++;
                    }
                    int terminator = next < limit && tokens.isSymbol(next, ";") ? next : next - 1;
                    if (depth <= 0) {
                        return new NestingProfile(maxDepth, i, terminator, exceptionIndex);
                    }
                    i = terminator + 1;
                }
                default -> i = skipLeniently(i, limit);
            }
            maxDepth = Math.max(maxDepth, depth);
        }
        return new NestingProfile(maxDepth, -1, -1, exceptionIndex);
    }

    /**
     * Maps a statement-start word to the construct it opens, or null.
     */
    public static ConstructKind kindOf(SqlToken token) {
        if (!token.isWord()) {
            return null;
        }
        return switch (token.getUpper()) {
            case "BEGIN" -> ConstructKind.BLOCK;
            case "IF" -> ConstructKind.IF;
            case "CASE" -> ConstructKind.CASE;
            case "FOR", "WHILE", "LOOP" -> ConstructKind.LOOP;
            default -> null;
        };
    }

    private int headerEnd(int openerIndex, int limit, int depth) {
        return switch (tokens.get(openerIndex).getUpper()) {
            case "IF" -> requireKeyword(openerIndex, limit, THEN, depth);
            case "CASE" -> requireKeyword(openerIndex, limit, WHEN, depth) - 1;
            case "FOR", "WHILE" -> requireKeyword(openerIndex, limit, LOOP, depth);
            default -> openerIndex;
        };
    }

    private int requireKeyword(int headerStart, int limit, Set<String> keyword, int depth) {
        int index = tokens.findTopLevelKeyword(headerStart + 1, limit, keyword);
        if (index < 0) {
            throw error(tokens.get(headerStart).getUpper() + " without " + keyword.iterator().next(),
                    headerStart, depth);
        }
        return index;
    }

    private void requireTop(Frame top, SqlToken token, int depth, ConstructKind... allowed) {
        for (ConstructKind kind : allowed) {
            if (top.kind == kind) {
                return;
            }
        }
        throw new StructuralParseException(token.getUpper() + " is not allowed inside "
                + top.kind.getKeyword() + " opened at line " + tokens.lineOf(top.openerIndex),
                token.getLineNumber(), depth, tokens.lineText(tokens.getTokens().indexOf(token)));
    }

    private int afterKeyword(int from, int limit, Set<String> keyword) {
        int index = tokens.findTopLevelKeyword(from + 1, limit, keyword);
        return index < 0 ? from + 1 : index + 1;
    }

    private int skipLeniently(int from, int limit) {
        for (int i = from; i < limit; i++) {
            if (tokens.get(i).isSymbol(";")) {
                return i + 1;
            }
            if (i > from && startsNextStatement(from, i)) {
                return i;
            }
        }
        return limit;
    }

    private int skipLabel(int from, int limit) {
        for (int i = from + 1; i < limit; i++) {
            if (tokens.get(i).isSymbol(">>")) {
                return i + 1;
            }
        }
        return from + 1;
    }

    private StructuralParseException error(String message, int index, int depth) {
        return new StructuralParseException(message, tokens.lineOf(index), depth, tokens.lineText(index));
    }
}
