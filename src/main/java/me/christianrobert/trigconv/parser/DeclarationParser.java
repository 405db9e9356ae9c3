package me.christianrobert.trigconv.parser;

import me.christianrobert.trigconv.ir.ConstantDecl;
import me.christianrobert.trigconv.ir.CursorDecl;
import me.christianrobert.trigconv.ir.Declaration;
import me.christianrobert.trigconv.ir.Declarations;
import me.christianrobert.trigconv.ir.ExceptionDecl;
import me.christianrobert.trigconv.ir.RawUnparsed;
import me.christianrobert.trigconv.ir.VariableDecl;
import me.christianrobert.trigconv.report.WarningCollector;
import me.christianrobert.trigconv.report.WarningKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Classifies the declarations between DECLARE and BEGIN.
 *
 * <p>Each declaration runs up to its terminating {@code ;} (string literals never terminate
 * it), so declarations spanning several physical lines are reassembled naturally.
 * Recognized shapes:</p>
 * <pre>
 * v_count   PLS_INTEGER;                         -- VariableDecl
 * v_name    emp.ename%TYPE NOT NULL := 'x';      -- VariableDecl (verbatim %TYPE)
 * c_max     CONSTANT NUMBER := 100;              -- ConstantDecl
 * e_invalid EXCEPTION;                           -- ExceptionDecl
 * PRAGMA EXCEPTION_INIT(e_invalid, -20001);      -- links the code to e_invalid
 * CURSOR c_emp (p_id NUMBER) IS SELECT ...;      -- CursorDecl
 * </pre>
 *
 * <p>Anything else is kept verbatim as {@link RawUnparsed} with a
 * {@link WarningKind#MALFORMED_DECLARATION} warning, never dropped. When a name is declared
 * twice the first declaration wins and {@link WarningKind#DUPLICATE_DECLARATION} is reported.</p>
 */
public class DeclarationParser {

    private static final Logger log = LoggerFactory.getLogger(DeclarationParser.class);

    private final TokenSequence tokens;
    private final WarningCollector warnings;

    public DeclarationParser(TokenSequence tokens, WarningCollector warnings) {
        this.tokens = tokens;
        this.warnings = warnings;
    }

    /**
     * Parses the declarations in token range {@code [from, to)}.
     *
     * @param depth nesting depth of the owning block, for warning context
     */
    public Declarations parse(int from, int to, int depth) {
        List<Declaration> result = new ArrayList<>();
        Map<String, Integer> indexByName = new HashMap<>();

        int i = from;
        while (i < to) {
            if (tokens.isSymbol(i, ";")) {
                i++;
                continue;
            }

            int semicolon = tokens.findSemicolon(i, to);
            if (semicolon < 0) {
                String text = tokens.text(i, to - 1);
                warn(WarningKind.MALFORMED_DECLARATION, "Declaration is not terminated by ';' before BEGIN",
                        i, depth, null, text);
                result.add(new RawUnparsed(text, tokens.lineOf(i)));
                break;
            }

            if (tokens.isWord(i, "PRAGMA") && tokens.isWord(i + 1, "EXCEPTION_INIT")) {
                linkExceptionCode(i, semicolon - 1, depth, result, indexByName);
            } else {
                Declaration declaration = classify(i, semicolon - 1, depth);
                String key = declaration instanceof RawUnparsed ? null : nameKey(declaration.getName());
                if (key != null && indexByName.containsKey(key)) {
                    warn(WarningKind.DUPLICATE_DECLARATION,
                            "'" + declaration.getName() + "' is already declared at line "
                                    + result.get(indexByName.get(key)).getLineNumber() + "; first declaration wins",
                            i, depth, declaration.getName(), tokens.text(i, semicolon));
                } else {
                    if (key != null) {
                        indexByName.put(key, result.size());
                    }
                    result.add(declaration);
                }
            }
            i = semicolon + 1;
        }

        log.debug("Parsed {} declarations", result.size());
        return new Declarations(result);
    }

    private Declaration classify(int from, int to, int depth) {
        int line = tokens.lineOf(from);
        SqlToken first = tokens.get(from);
        String raw = tokens.text(from, to) + ";";

        if (first.isWord("PRAGMA")) {
            return malformed("Unsupported PRAGMA is kept verbatim", from, depth, raw);
        }
        if (first.isWord("TYPE") || first.isWord("SUBTYPE")) {
            return malformed("Type declarations are kept verbatim", from, depth, raw);
        }
        if (first.isWord("CURSOR")) {
            Declaration cursor = parseCursor(from, to);
            return cursor != null ? cursor : malformed("Unrecognized cursor declaration", from, depth, raw);
        }
        if (!isName(first) || from == to) {
            return malformed("Unrecognized declaration", from, depth, raw);
        }

        String name = first.getText();
        if (tokens.isWord(from + 1, "EXCEPTION") && to == from + 1) {
            return new ExceptionDecl(name, null, line);
        }

        if (tokens.isWord(from + 1, "CONSTANT")) {
            int assign = findAssignment(from + 2, to);
            if (assign < 0 || assign == from + 2 || assign == to) {
                return malformed("Constant declaration without type or value", from, depth, raw);
            }
            return new ConstantDecl(name, tokens.flatText(from + 2, assign - 1), tokens.text(assign + 1, to), line);
        }

        int assign = findAssignment(from + 1, to);
        int typeEnd = assign < 0 ? to : assign - 1;
        boolean notNull = false;
        if (typeEnd - 1 > from + 1 && tokens.isWord(typeEnd, "NULL") && tokens.isWord(typeEnd - 1, "NOT")) {
            notNull = true;
            typeEnd -= 2;
        }
        if (typeEnd < from + 1 || !tokens.get(from + 1).isWord() || (assign >= 0 && assign == to)) {
            return malformed("Unrecognized declaration", from, depth, raw);
        }
        String defaultExpr = assign < 0 ? null : tokens.text(assign + 1, to);
        return new VariableDecl(name, tokens.flatText(from + 1, typeEnd), defaultExpr, notNull, line);
    }

    // CURSOR name [(params)] IS query
    private Declaration parseCursor(int from, int to) {
        if (from + 1 > to || !isName(tokens.get(from + 1))) {
            return null;
        }
        String name = tokens.get(from + 1).getText();
        int i = from + 2;
        String parameters = null;
        if (tokens.isSymbol(i, "(")) {
            int close = matchingParen(i, to);
            if (close < 0) {
                return null;
            }
            parameters = tokens.flatText(i + 1, close - 1);
            i = close + 1;
        }
        if (!tokens.isWord(i, "IS") || i + 1 > to) {
            return null;
        }
        return new CursorDecl(name, parameters, tokens.text(i + 1, to), tokens.lineOf(from));
    }

    // PRAGMA EXCEPTION_INIT(name, -20001)
    private void linkExceptionCode(int from, int to, int depth, List<Declaration> result,
                                   Map<String, Integer> indexByName) {
        String raw = tokens.text(from, to) + ";";
        int i = from + 2;
        Integer code = null;
        String name = null;
        if (tokens.isSymbol(i, "(") && i + 1 <= to && isName(tokens.get(i + 1)) && tokens.isSymbol(i + 2, ",")) {
            name = tokens.get(i + 1).getText();
            int n = i + 3;
            boolean negative = false;
            if (tokens.isSymbol(n, "-")) {
                negative = true;
                n++;
            }
            if (n <= to && tokens.get(n).getType() == SqlTokenType.NUMBER && tokens.isSymbol(n + 1, ")")) {
                try {
                    int value = Integer.parseInt(tokens.get(n).getText());
                    code = negative ? -value : value;
                } catch (NumberFormatException e) {
                    code = null;
                }
            }
        }

        Integer index = name != null ? indexByName.get(nameKey(name)) : null;
        if (code == null || index == null || !(result.get(index) instanceof ExceptionDecl)) {
            String reason = code == null ? "Malformed PRAGMA EXCEPTION_INIT"
                    : "PRAGMA EXCEPTION_INIT refers to undeclared exception '" + name + "'";
            result.add(malformed(reason, from, depth, raw));
            return;
        }
        ExceptionDecl exception = (ExceptionDecl) result.get(index);
        result.set(index, exception.withErrorCode(code));
    }

    private int findAssignment(int from, int to) {
        int parenDepth = 0;
        for (int i = from; i <= to; i++) {
            SqlToken token = tokens.get(i);
            if (token.isSymbol("(")) {
                parenDepth++;
            } else if (token.isSymbol(")")) {
                parenDepth--;
            } else if (parenDepth == 0 && (token.isSymbol(":=") || token.isWord("DEFAULT"))) {
                return i;
            }
        }
        return -1;
    }

    private int matchingParen(int open, int to) {
        int depth = 0;
        for (int i = open; i <= to; i++) {
            if (tokens.isSymbol(i, "(")) {
                depth++;
            } else if (tokens.isSymbol(i, ")") && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private RawUnparsed malformed(String reason, int index, int depth, String raw) {
        warn(WarningKind.MALFORMED_DECLARATION, reason, index, depth, null, raw);
        return new RawUnparsed(raw, tokens.lineOf(index));
    }

    private void warn(WarningKind kind, String message, int index, int depth, String identifier, String raw) {
        warnings.add(kind, message, tokens.lineOf(index), depth, identifier, raw);
    }

    private static boolean isName(SqlToken token) {
        return token.isWord() || token.getType() == SqlTokenType.QUOTED_IDENTIFIER;
    }

    private static String nameKey(String name) {
        return name.startsWith("\"") ? name : name.toUpperCase(Locale.ROOT);
    }
}
