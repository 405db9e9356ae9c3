package me.christianrobert.trigconv.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits PL/SQL text into words, numbers, string literals, quoted identifiers and symbols.
 *
 * <p>Whitespace is not tokenized; its extent is recoverable from token offsets.
 * String literals may span line records: the lexer carries the open-string state
 * from one line to the next and emits one STRING fragment per line.</p>
 */
public class SqlLexer {

    private static final Set<String> TWO_CHAR_SYMBOLS = Set.of(
            ":=", "..", "=>", "<>", "!=", "^=", "~=", "<=", ">=", "||", "<<", ">>", "**");

    private enum Mode { CODE, STRING, QUOTED_IDENTIFIER }

    /**
     * Tokenizes free text. Offsets refer to the text itself, line numbers start at 1.
     */
    public static List<SqlToken> tokenize(String text) {
        List<SqlToken> tokens = new ArrayList<>();
        scan(text, 1, Mode.CODE, tokens);
        return tokens;
    }

    /**
     * Tokenizes line records. Offsets refer to each line's trimmed text.
     */
    public static List<SqlToken> tokenize(List<SourceLine> lines) {
        List<SqlToken> tokens = new ArrayList<>();
        Mode mode = Mode.CODE;
        for (SourceLine line : lines) {
            int before = tokens.size();
            mode = scan(line.getText(), line.getLineNumber(), mode, tokens);
            for (int i = before; i < tokens.size(); i++) {
                tokens.set(i, tokens.get(i).onLine(i == before, line.getIndent()));
            }
        }
        return tokens;
    }

    /**
     * Whether a single-quoted literal is still open at the end of {@code text}.
     *
     * @param startsInside whether {@code text} begins inside an open literal
     */
    public static boolean endsInsideString(String text, boolean startsInside) {
        int i = 0;
        if (startsInside) {
            int end = findClosingQuote(text, 0, '\'');
            if (end < 0) {
                return true;
            }
            i = end + 1;
        }
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"') {
                int end = findClosingQuote(text, i + 1, c);
                if (end < 0) {
                    return c == '\'';
                }
                i = end + 1;
            } else {
                i++;
            }
        }
        return false;
    }

    private static Mode scan(String text, int firstLineNumber, Mode startMode, List<SqlToken> out) {
        int lineNumber = firstLineNumber;
        int i = 0;
        int n = text.length();

        if (startMode != Mode.CODE) {
            char close = startMode == Mode.STRING ? '\'' : '"';
            int end = findClosingQuote(text, 0, close);
            SqlTokenType type = startMode == Mode.STRING ? SqlTokenType.STRING : SqlTokenType.QUOTED_IDENTIFIER;
            if (end < 0) {
                out.add(new SqlToken(type, text, lineNumber, 0, n, false, 0));
                return startMode;
            }
            out.add(new SqlToken(type, text.substring(0, end + 1), lineNumber, 0, end + 1, false, 0));
            i = end + 1;
        }

        while (i < n) {
            char c = text.charAt(i);

            if (c == '\n') {
                lineNumber++;
                i++;
                continue;
            }
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            if (c == '\'' || c == '"') {
                int end = findClosingQuote(text, i + 1, c);
                SqlTokenType type = c == '\'' ? SqlTokenType.STRING : SqlTokenType.QUOTED_IDENTIFIER;
                if (end < 0) {
                    out.add(new SqlToken(type, text.substring(i), lineNumber, i, n, false, 0));
                    return c == '\'' ? Mode.STRING : Mode.QUOTED_IDENTIFIER;
                }
                String literal = text.substring(i, end + 1);
                out.add(new SqlToken(type, literal, lineNumber, i, end + 1, false, 0));
                lineNumber += countNewlines(literal);
                i = end + 1;
                continue;
            }

            if (Character.isLetter(c) || c == '_') {
                int j = i + 1;
                while (j < n && isWordPart(text.charAt(j))) {
                    j++;
                }
                out.add(new SqlToken(SqlTokenType.WORD, text.substring(i, j), lineNumber, i, j, false, 0));
                i = j;
                continue;
            }

            if (Character.isDigit(c) || (c == '.' && i + 1 < n && Character.isDigit(text.charAt(i + 1)))) {
                int j = scanNumber(text, i);
                out.add(new SqlToken(SqlTokenType.NUMBER, text.substring(i, j), lineNumber, i, j, false, 0));
                i = j;
                continue;
            }

            if (i + 1 < n && TWO_CHAR_SYMBOLS.contains(text.substring(i, i + 2))) {
                out.add(new SqlToken(SqlTokenType.SYMBOL, text.substring(i, i + 2), lineNumber, i, i + 2, false, 0));
                i += 2;
                continue;
            }

            out.add(new SqlToken(SqlTokenType.SYMBOL, String.valueOf(c), lineNumber, i, i + 1, false, 0));
            i++;
        }
        return Mode.CODE;
    }

    private static int findClosingQuote(String text, int from, char quote) {
        int i = from;
        while (i < text.length()) {
            if (text.charAt(i) == quote) {
                if (quote == '\'' && i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                    i += 2;
                    continue;
                }
                return i;
            }
            i++;
        }
        return -1;
    }

    private static int scanNumber(String text, int from) {
        int n = text.length();
        int j = from;
        while (j < n && Character.isDigit(text.charAt(j))) {
            j++;
        }
        // "1..10" is a range, not a decimal
        if (j < n && text.charAt(j) == '.' && !(j + 1 < n && text.charAt(j + 1) == '.')) {
            j++;
            while (j < n && Character.isDigit(text.charAt(j))) {
                j++;
            }
        }
        if (j < n && (text.charAt(j) == 'e' || text.charAt(j) == 'E')) {
            int k = j + 1;
            if (k < n && (text.charAt(k) == '+' || text.charAt(k) == '-')) {
                k++;
            }
            if (k < n && Character.isDigit(text.charAt(k))) {
                j = k;
                while (j < n && Character.isDigit(text.charAt(j))) {
                    j++;
                }
            }
        }
        return j;
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '#';
    }

    private static int countNewlines(String s) {
        int count = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }
}
