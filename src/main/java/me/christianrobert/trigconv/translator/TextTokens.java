package me.christianrobert.trigconv.translator;

import me.christianrobert.trigconv.parser.SqlLexer;
import me.christianrobert.trigconv.parser.SqlToken;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for working on token lists of expression text.
 */
public final class TextTokens {

    private TextTokens() {
    }

    /**
     * Tokenizes text, attaching to each token the whitespace in front of it.
     * Whitespace after the last token is dropped.
     */
    public static List<TextToken> tokenize(String text) {
        List<TextToken> result = new ArrayList<>();
        int previousEnd = 0;
        for (SqlToken token : SqlLexer.tokenize(text)) {
            result.add(TextToken.of(token, text.substring(previousEnd, token.getStart())));
            previousEnd = token.getEnd();
        }
        return result;
    }

    /**
     * Tokenizes a generated fragment; its first token takes {@code leading} as whitespace.
     */
    public static List<TextToken> fragment(String text, String leading) {
        List<TextToken> tokens = tokenize(text.trim());
        if (!tokens.isEmpty()) {
            tokens.set(0, tokens.get(0).withLeading(leading));
        }
        return tokens;
    }

    public static String render(List<TextToken> tokens) {
        StringBuilder sb = new StringBuilder();
        for (TextToken token : tokens) {
            sb.append(token.getLeading()).append(token.getText());
        }
        return sb.toString();
    }

    /**
     * Renders without the whitespace in front of the first token.
     */
    public static String renderTrimmed(List<TextToken> tokens) {
        return render(tokens).trim();
    }

    /**
     * @return index of the parenthesis closing the one at {@code open}, or -1
     */
    public static int matchingParen(List<TextToken> tokens, int open) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            if (tokens.get(i).isSymbol("(")) {
                depth++;
            } else if (tokens.get(i).isSymbol(")")) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Splits the tokens strictly between {@code open} and {@code close} at top-level commas.
     * An empty argument list yields an empty result.
     */
    public static List<List<TextToken>> splitArguments(List<TextToken> tokens, int open, int close) {
        List<List<TextToken>> args = new ArrayList<>();
        if (close - open <= 1) {
            return args;
        }
        int depth = 0;
        List<TextToken> current = new ArrayList<>();
        for (int i = open + 1; i < close; i++) {
            TextToken token = tokens.get(i);
            if (token.isSymbol("(")) {
                depth++;
            } else if (token.isSymbol(")")) {
                depth--;
            } else if (depth == 0 && token.isSymbol(",")) {
                args.add(current);
                current = new ArrayList<>();
                continue;
            }
            current.add(token);
        }
        args.add(current);
        return args;
    }

    /**
     * @return index of the first occurrence of {@code symbol} outside parentheses, or -1
     */
    public static int indexOfTopLevel(List<TextToken> tokens, String symbol) {
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            TextToken token = tokens.get(i);
            if (token.isSymbol("(")) {
                depth++;
            } else if (token.isSymbol(")")) {
                depth--;
            } else if (depth == 0 && token.isSymbol(symbol)) {
                return i;
            }
        }
        return -1;
    }

    static boolean isWordAt(List<TextToken> tokens, int index, String keyword) {
        return index >= 0 && index < tokens.size() && tokens.get(index).isWord(keyword);
    }

    static boolean isSymbolAt(List<TextToken> tokens, int index, String symbol) {
        return index >= 0 && index < tokens.size() && tokens.get(index).isSymbol(symbol);
    }
}
