package me.christianrobert.trigconv.parser;

import java.util.Locale;

/**
 * A lexical token of PL/SQL text.
 *
 * <p>{@code start} and {@code end} are offsets into the text the token was read from
 * (the trimmed line text for line records, the whole string for free text).
 * {@code firstOnLine} marks tokens that open a line record and {@code lineIndent} is the
 * indentation of the record a token was read from; together they give multi-line
 * statements their line structure back when they are re-assembled.</p>
 */
public class SqlToken {

    private final SqlTokenType type;
    private final String text;
    private final String upper;
    private final int lineNumber;
    private final int start;
    private final int end;
    private final boolean firstOnLine;
    private final int lineIndent;

    public SqlToken(SqlTokenType type, String text, int lineNumber, int start, int end,
                    boolean firstOnLine, int lineIndent) {
        this.type = type;
        this.text = text;
        this.upper = type == SqlTokenType.WORD ? text.toUpperCase(Locale.ROOT) : text;
        this.lineNumber = lineNumber;
        this.start = start;
        this.end = end;
        this.firstOnLine = firstOnLine;
        this.lineIndent = lineIndent;
    }

    SqlToken onLine(boolean first, int indent) {
        return new SqlToken(type, text, lineNumber, start, end, first, indent);
    }

    public SqlTokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    /**
     * Upper-cased text for words, the text itself for every other token type.
     */
    public String getUpper() {
        return upper;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public boolean isFirstOnLine() {
        return firstOnLine;
    }

    public int getLineIndent() {
        return lineIndent;
    }

    public boolean isWord() {
        return type == SqlTokenType.WORD;
    }

    public boolean isWord(String keyword) {
        return type == SqlTokenType.WORD && upper.equals(keyword);
    }

    public boolean isSymbol(String symbol) {
        return type == SqlTokenType.SYMBOL && text.equals(symbol);
    }

    public boolean isString() {
        return type == SqlTokenType.STRING;
    }

    @Override
    public String toString() {
        return type + "('" + text + "'@" + lineNumber + ":" + start + ")";
    }
}
