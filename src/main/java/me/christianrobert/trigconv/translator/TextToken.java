package me.christianrobert.trigconv.translator;

import me.christianrobert.trigconv.parser.SqlToken;
import me.christianrobert.trigconv.parser.SqlTokenType;

import java.util.Locale;

/**
 * A token of expression text together with the whitespace that preceded it.
 *
 * <p>Rewriters replace tokens and keep the leading whitespace of the first replaced token,
 * so untouched parts of a statement keep their original layout.</p>
 */
public final class TextToken {

    private final SqlTokenType type;
    private final String text;
    private final String upper;
    private final String leading;

    public TextToken(SqlTokenType type, String text, String leading) {
        this.type = type;
        this.text = text;
        this.upper = type == SqlTokenType.WORD ? text.toUpperCase(Locale.ROOT) : text;
        this.leading = leading == null ? "" : leading;
    }

    static TextToken of(SqlToken token, String leading) {
        return new TextToken(token.getType(), token.getText(), leading);
    }

    public static TextToken word(String text, String leading) {
        return new TextToken(SqlTokenType.WORD, text, leading);
    }

    public TextToken withLeading(String newLeading) {
        return new TextToken(type, text, newLeading);
    }

    public TextToken withText(String newText) {
        return new TextToken(type, newText, leading);
    }

    public SqlTokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public String getUpper() {
        return upper;
    }

    public String getLeading() {
        return leading;
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

    public boolean isNumber() {
        return type == SqlTokenType.NUMBER;
    }

    @Override
    public String toString() {
        return leading + text;
    }
}
