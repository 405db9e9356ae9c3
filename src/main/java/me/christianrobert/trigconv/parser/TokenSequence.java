package me.christianrobert.trigconv.parser;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Random-access view over the tokens of a trigger body, with helpers to locate
 * terminators and to rebuild the source text of a token range.
 */
public class TokenSequence {

    private final List<SqlToken> tokens;

    public TokenSequence(List<SqlToken> tokens) {
        this.tokens = Collections.unmodifiableList(tokens);
    }

    public static TokenSequence of(List<SourceLine> lines) {
        return new TokenSequence(SqlLexer.tokenize(lines));
    }

    public int size() {
        return tokens.size();
    }

    public SqlToken get(int index) {
        return tokens.get(index);
    }

    public List<SqlToken> getTokens() {
        return tokens;
    }

    public boolean isWord(int index, String keyword) {
        return index >= 0 && index < tokens.size() && tokens.get(index).isWord(keyword);
    }

    public boolean isSymbol(int index, String symbol) {
        return index >= 0 && index < tokens.size() && tokens.get(index).isSymbol(symbol);
    }

    public int lineOf(int index) {
        if (tokens.isEmpty()) {
            return 1;
        }
        return tokens.get(Math.min(index, tokens.size() - 1)).getLineNumber();
    }

    /**
     * Flat text of all tokens sharing the physical line of the token at {@code index}.
     */
    public String lineText(int index) {
        if (tokens.isEmpty()) {
            return "";
        }
        int anchor = Math.min(Math.max(index, 0), tokens.size() - 1);
        int line = tokens.get(anchor).getLineNumber();
        int from = anchor;
        while (from > 0 && tokens.get(from - 1).getLineNumber() == line) {
            from--;
        }
        int to = anchor;
        while (to + 1 < tokens.size() && tokens.get(to + 1).getLineNumber() == line) {
            to++;
        }
        return flatText(from, to);
    }

    /**
     * Index of the first {@code ;} in {@code [from, limit)}, or -1.
     */
    public int findSemicolon(int from, int limit) {
        for (int i = from; i < limit; i++) {
            if (tokens.get(i).isSymbol(";")) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Index of the first word in {@code keywords} outside parentheses and CASE expressions,
     * searching {@code [from, limit)}. A {@code ;} ends the search unsuccessfully.
     */
    public int findTopLevelKeyword(int from, int limit, Set<String> keywords) {
        int parenDepth = 0;
        int caseDepth = 0;
        for (int i = from; i < limit; i++) {
            SqlToken token = tokens.get(i);
            if (token.isSymbol("(")) {
                parenDepth++;
            } else if (token.isSymbol(")")) {
                parenDepth = Math.max(0, parenDepth - 1);
            } else if (token.isSymbol(";")) {
                return -1;
            } else if (token.isWord()) {
                if (token.isWord("CASE")) {
                    caseDepth++;
                } else if (token.isWord("END") && caseDepth > 0) {
                    caseDepth--;
                } else if (parenDepth == 0 && caseDepth == 0 && keywords.contains(token.getUpper())) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Source text of the inclusive token range with its line structure. Continuation
     * lines keep their indentation relative to the line of the first token.
     */
    public String text(int from, int to) {
        if (from > to) {
            return "";
        }
        SqlToken first = tokens.get(from);
        int baseIndent = first.getLineIndent();
        StringBuilder sb = new StringBuilder(first.getText());
        for (int i = from + 1; i <= to; i++) {
            SqlToken previous = tokens.get(i - 1);
            SqlToken token = tokens.get(i);
            if (token.isFirstOnLine()) {
                sb.append('\n').append(" ".repeat(Math.max(0, token.getLineIndent() - baseIndent)));
            } else {
                sb.append(" ".repeat(Math.max(0, token.getStart() - previous.getEnd())));
            }
            sb.append(token.getText());
        }
        return sb.toString();
    }

    /**
     * Source text of the inclusive token range on a single line; line breaks become one space.
     */
    public String flatText(int from, int to) {
        if (from > to) {
            return "";
        }
        StringBuilder sb = new StringBuilder(tokens.get(from).getText());
        for (int i = from + 1; i <= to; i++) {
            SqlToken previous = tokens.get(i - 1);
            SqlToken token = tokens.get(i);
            if (token.isFirstOnLine()) {
                sb.append(' ');
            } else if (token.getStart() > previous.getEnd()) {
                sb.append(' ');
            }
            sb.append(token.getText());
        }
        return sb.toString();
    }
}
