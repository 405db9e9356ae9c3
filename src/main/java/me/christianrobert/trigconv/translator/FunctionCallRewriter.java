package me.christianrobert.trigconv.translator;

import me.christianrobert.trigconv.report.WarningKind;
import me.christianrobert.trigconv.translator.mapping.MappingTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rewrites built-in function calls through the function table.
 *
 * <p>A call is a (possibly dotted) name directly followed by an opening parenthesis. Keywords,
 * declared names (cursors, collections) and table names after INTO/FROM/JOIN/UPDATE/TABLE are
 * not calls. Arguments are rewritten recursively before the call itself.</p>
 *
 * <h3>Target handling:</h3>
 * <ul>
 *   <li>an identifier-like target renames the function: {@code NVL(a, b)} → {@code COALESCE(a, b)}</li>
 *   <li>{@code NULL} replaces the whole call: {@code EMPTY_CLOB()} → {@code NULL}</li>
 *   <li>structural targets reorder arguments (TRUNC, SUBSTR, INSTR, NVL2, DECODE)</li>
 *   <li>no entry: passed through unchanged with an UNMAPPED_FUNCTION warning per occurrence,
 *       unless the name already is a target spelling</li>
 * </ul>
 *
 * <p>Niladic built-ins ({@code SYSDATE}, {@code USER}, ...) are looked up without parentheses and
 * replaced by their target text verbatim, so a target may be an expression such as
 * {@code current_setting('timezone')}.</p>
 */
class FunctionCallRewriter {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*(\\.[A-Za-z_][A-Za-z0-9_$]*)*");

    private static final Set<String> NILADIC = Set.of(
            "SYSDATE", "SYSTIMESTAMP", "USER", "UID", "SQLCODE", "SQLERRM", "SESSIONTIMEZONE", "DBTIMEZONE");

    // words that may stand before "(" without being a function
    private static final Set<String> KEYWORDS = Set.of(
            "IN", "EXISTS", "VALUES", "AND", "OR", "NOT", "IF", "ELSIF", "WHEN", "THEN", "ELSE", "CASE", "END",
            "SELECT", "FROM", "WHERE", "ON", "USING", "OVER", "PARTITION", "ANY", "ALL", "SOME", "RETURN",
            "RETURNING", "SET", "AS", "BY", "IS", "LIKE", "BETWEEN", "LOOP", "WHILE", "FOR", "INTO", "JOIN",
            "UPDATE", "DELETE", "INSERT", "MERGE", "TABLE", "WITH", "UNION", "INTERSECT", "MINUS", "EXCEPT",
            "DISTINCT", "HAVING", "GROUP", "ORDER", "NULL", "PRIOR", "OF", "OUT", "CURSOR", "EXECUTE",
            "IMMEDIATE", "RAISE", "EXCEPTION", "MATCHED", "ESCAPE", "DEFAULT", "KEY", "CHECK", "PRIMARY",
            "FOREIGN", "UNIQUE", "REFERENCES", "CONSTRAINT", "DAY", "MONTH", "YEAR", "HOUR", "MINUTE",
            "SECOND", "TO", "WITHIN", "FILTER", "KEEP", "PERFORM", "OPEN", "FETCH", "CLOSE", "EXIT",
            "CONTINUE", "RAISE_APPLICATION_ERROR", "ROWTYPE", "TYPE");

    private static final Set<String> TABLE_CONTEXT = Set.of("INTO", "FROM", "JOIN", "UPDATE", "TABLE", "AS", "REFERENCES");

    private static final Set<String> FORMAT_FUNCTIONS = Set.of("TO_DATE", "TO_CHAR", "TO_TIMESTAMP");

    private static final Set<String> DATE_HINTS = Set.of(
            "SYSDATE", "SYSTIMESTAMP", "CURRENT_DATE", "CURRENT_TIMESTAMP", "LOCALTIMESTAMP",
            "TO_DATE", "TO_TIMESTAMP", "ADD_MONTHS", "LAST_DAY", "DATE_TRUNC");

    private static final Map<String, String> TRUNC_UNITS = Map.ofEntries(
            Map.entry("DD", "day"), Map.entry("DDD", "day"), Map.entry("J", "day"),
            Map.entry("MM", "month"), Map.entry("MON", "month"), Map.entry("MONTH", "month"), Map.entry("RM", "month"),
            Map.entry("YYYY", "year"), Map.entry("YYY", "year"), Map.entry("YY", "year"), Map.entry("Y", "year"),
            Map.entry("YEAR", "year"), Map.entry("SYYYY", "year"), Map.entry("RRRR", "year"), Map.entry("RR", "year"),
            Map.entry("Q", "quarter"),
            Map.entry("IW", "week"), Map.entry("WW", "week"), Map.entry("W", "week"),
            Map.entry("HH", "hour"), Map.entry("HH12", "hour"), Map.entry("HH24", "hour"),
            Map.entry("MI", "minute"), Map.entry("SS", "second"));

    private final TranslationContext context;
    private final MappingTable functions;

    FunctionCallRewriter(TranslationContext context) {
        this.context = context;
        this.functions = context.getTables().getFunctions();
    }

    List<TextToken> rewrite(List<TextToken> tokens, int line) {
        List<TextToken> out = new ArrayList<>(tokens.size());
        int i = 0;
        while (i < tokens.size()) {
            TextToken token = tokens.get(i);
            if (!token.isWord() || TextTokens.isSymbolAt(tokens, i - 1, ".")) {
                out.add(token);
                i++;
                continue;
            }

            int nameEnd = i;
            while (TextTokens.isSymbolAt(tokens, nameEnd + 1, ".") && nameEnd + 2 < tokens.size()
                    && tokens.get(nameEnd + 2).isWord()) {
                nameEnd += 2;
            }

            if (TextTokens.isSymbolAt(tokens, nameEnd + 1, "(") && isCallCandidate(tokens, i, nameEnd)) {
                int close = TextTokens.matchingParen(tokens, nameEnd + 1);
                if (close > 0) {
                    out.addAll(rewriteCall(tokens, i, nameEnd, close, line));
                    i = close + 1;
                    continue;
                }
            } else if (nameEnd == i && isNiladicCandidate(tokens, i)) {
                out.addAll(rewriteNiladic(token, line));
                i++;
                continue;
            }

            out.addAll(tokens.subList(i, nameEnd + 1));
            i = nameEnd + 1;
        }
        return out;
    }

    private boolean isCallCandidate(List<TextToken> tokens, int start, int nameEnd) {
        TextToken first = tokens.get(start);
        if (nameEnd == start && KEYWORDS.contains(first.getUpper())) {
            return false;
        }
        if (start > 0 && tokens.get(start - 1).isWord() && TABLE_CONTEXT.contains(tokens.get(start - 1).getUpper())) {
            return false;
        }
        String name = nameOf(tokens, start, nameEnd);
        return !context.isDeclared(name) && !context.isDeclared(first.getText());
    }

    private boolean isNiladicCandidate(List<TextToken> tokens, int index) {
        TextToken token = tokens.get(index);
        return NILADIC.contains(token.getUpper())
                && !context.isDeclared(token.getText())
                && !TextTokens.isSymbolAt(tokens, index + 1, ".")
                && !TextTokens.isSymbolAt(tokens, index - 1, ":");
    }

    private List<TextToken> rewriteNiladic(TextToken token, int line) {
        String target = functions.lookup(token.getText());
        if (target == null || target.trim().isEmpty()) {
            warnUnmapped(token.getText(), line, "No mapping for built-in " + token.getText());
            return List.of(token);
        }
        return TextTokens.fragment(target, token.getLeading());
    }

    private List<TextToken> rewriteCall(List<TextToken> tokens, int start, int nameEnd, int close, int line) {
        String name = nameOf(tokens, start, nameEnd);
        String upperName = name.toUpperCase(Locale.ROOT);
        String leading = tokens.get(start).getLeading();
        int open = nameEnd + 1;

        List<TextToken> parenthesized = new ArrayList<>(tokens.subList(open, close + 1));
        if (FORMAT_FUNCTIONS.contains(upperName)) {
            normalizeFormatArgument(parenthesized);
        }

        String target = functions.lookup(name);
        if (target == null) {
            if (!context.isKnownTargetFunction(name)) {
                warnUnmapped(name, line, "No mapping for function " + name);
            }
            return passThrough(tokens.subList(start, nameEnd + 1), parenthesized, line);
        }

        String upperTarget = target.trim().toUpperCase(Locale.ROOT);
        List<List<TextToken>> originalArgs = TextTokens.splitArguments(parenthesized, 0, parenthesized.size() - 1);
        String form = structuralForm(upperName, upperTarget);

        if (form != null) {
            if ("TRUNC".equals(form) && !isDateTrunc(originalArgs)) {
                return passThrough(tokens.subList(start, nameEnd + 1), parenthesized, line);
            }
            if (!accepts(form, originalArgs)) {
                warnUnmapped(name, line, name + " with " + originalArgs.size() + " arguments has no "
                        + target.trim() + " form");
                return passThrough(tokens.subList(start, nameEnd + 1), parenthesized, line);
            }
            List<List<TextToken>> args = new ArrayList<>();
            for (List<TextToken> arg : originalArgs) {
                args.add(rewrite(arg, line));
            }
            return TextTokens.fragment(buildStructural(form, args, originalArgs), leading);
        }

        if ("NULL".equals(upperTarget)) {
            return TextTokens.fragment("NULL", leading);
        }
        if (IDENTIFIER.matcher(target.trim()).matches()) {
            List<TextToken> renamed = new ArrayList<>();
            renamed.add(TextToken.word(target.trim(), leading));
            renamed.addAll(rewrite(parenthesized, line));
            return renamed;
        }
        warnUnmapped(name, line, "Mapping target '" + target + "' for " + name + " is not a function name");
        return passThrough(tokens.subList(start, nameEnd + 1), parenthesized, line);
    }

    private static String structuralForm(String upperName, String upperTarget) {
        if ("NVL2".equals(upperName) && upperTarget.startsWith("CASE")) {
            return "NVL2";
        }
        if ("DECODE".equals(upperName) && upperTarget.startsWith("CASE")) {
            return "DECODE";
        }
        if ("SUBSTR".equals(upperName) && "SUBSTRING".equals(upperTarget)) {
            return "SUBSTR";
        }
        if ("INSTR".equals(upperName) && "POSITION".equals(upperTarget)) {
            return "INSTR";
        }
        if ("TRUNC".equals(upperName) && "DATE_TRUNC".equals(upperTarget)) {
            return "TRUNC";
        }
        return null;
    }

    private boolean accepts(String form, List<List<TextToken>> args) {
        switch (form) {
            case "NVL2":
                return args.size() == 3;
            case "DECODE":
                return args.size() >= 3;
            case "SUBSTR":
                return args.size() == 2 || args.size() == 3;
            case "INSTR":
                return args.size() == 2 || args.size() == 3
                        || (args.size() == 4 && "1".equals(text(args.get(2))) && "1".equals(text(args.get(3))));
            case "TRUNC":
                return truncUnit(args) != null;
            default:
                return false;
        }
    }

    private String buildStructural(String form, List<List<TextToken>> args, List<List<TextToken>> originalArgs) {
        switch (form) {
            case "NVL2":
                return nvl2(args);
            case "DECODE":
                return decode(args);
            case "SUBSTR":
                return substr(args);
            case "INSTR":
                return instr(args);
            default:
                return "DATE_TRUNC('" + truncUnit(originalArgs) + "', " + text(args.get(0)) + ")";
        }
    }

    private List<TextToken> passThrough(List<TextToken> nameTokens, List<TextToken> parenthesized, int line) {
        List<TextToken> out = new ArrayList<>(nameTokens);
        out.addAll(rewrite(parenthesized, line));
        return out;
    }

    private void normalizeFormatArgument(List<TextToken> parenthesized) {
        List<List<TextToken>> args = TextTokens.splitArguments(parenthesized, 0, parenthesized.size() - 1);
        if (args.size() < 2 || args.get(1).size() != 1 || !args.get(1).get(0).isString()) {
            return;
        }
        TextToken format = args.get(1).get(0);
        int index = parenthesized.indexOf(format);
        parenthesized.set(index, format.withText(context.getLiterals().normalizeDateFormat(format.getText())));
    }

    // NVL2(a, b, c) → CASE WHEN a IS NOT NULL THEN b ELSE c END
    private String nvl2(List<List<TextToken>> args) {
        if (args.size() != 3) {
            return null;
        }
        return "CASE WHEN " + text(args.get(0)) + " IS NOT NULL THEN " + text(args.get(1))
                + " ELSE " + text(args.get(2)) + " END";
    }

    // DECODE(e, s1, r1, ..., [default]); a NULL search value matches a NULL expression as in Oracle
    private String decode(List<List<TextToken>> args) {
        if (args.size() < 3) {
            return null;
        }
        String expr = text(args.get(0));
        boolean searchesNull = false;
        for (int i = 1; i + 1 < args.size(); i += 2) {
            if ("NULL".equalsIgnoreCase(text(args.get(i)))) {
                searchesNull = true;
            }
        }

        StringBuilder sb = new StringBuilder("CASE");
        if (!searchesNull) {
            sb.append(' ').append(expr);
        }
        int i = 1;
        for (; i + 1 < args.size(); i += 2) {
            String search = text(args.get(i));
            sb.append(" WHEN ");
            if (searchesNull) {
                sb.append(expr).append("NULL".equalsIgnoreCase(search) ? " IS NULL" : " = " + search);
            } else {
                sb.append(search);
            }
            sb.append(" THEN ").append(text(args.get(i + 1)));
        }
        if (i < args.size()) {
            sb.append(" ELSE ").append(text(args.get(i)));
        }
        return sb.append(" END").toString();
    }

    // SUBSTR(s, p[, n]) → SUBSTRING(s FROM p [FOR n])
    private String substr(List<List<TextToken>> args) {
        if (args.size() < 2 || args.size() > 3) {
            return null;
        }
        StringBuilder sb = new StringBuilder("SUBSTRING(")
                .append(text(args.get(0))).append(" FROM ").append(text(args.get(1)));
        if (args.size() == 3) {
            sb.append(" FOR ").append(text(args.get(2)));
        }
        return sb.append(')').toString();
    }

    // INSTR(s, t) → POSITION(t IN s); INSTR(s, t, 1, 1) is the same search
    private String instr(List<List<TextToken>> args) {
        if (args.size() == 2 || (args.size() == 4 && "1".equals(text(args.get(2))) && "1".equals(text(args.get(3))))) {
            return "POSITION(" + text(args.get(1)) + " IN " + text(args.get(0)) + ")";
        }
        if (args.size() == 3) {
            String s = text(args.get(0));
            String t = text(args.get(1));
            String p = text(args.get(2));
            return "CASE WHEN " + p + " > 0 AND " + p + " <= LENGTH(" + s + ") THEN POSITION(" + t
                    + " IN SUBSTRING(" + s + " FROM " + p + ")) + " + p + " - 1 ELSE 0 END";
        }
        return null;
    }

    private boolean isDateTrunc(List<List<TextToken>> originalArgs) {
        if (originalArgs.size() == 2) {
            List<TextToken> unit = originalArgs.get(1);
            return unit.size() == 1 && unit.get(0).isString();
        }
        return originalArgs.size() == 1 && containsDateExpression(originalArgs.get(0));
    }

    // TRUNC(d) → DATE_TRUNC('day', d); TRUNC(d, 'MM') → DATE_TRUNC('month', d)
    private static String truncUnit(List<List<TextToken>> originalArgs) {
        if (originalArgs.size() == 1) {
            return "day";
        }
        if (originalArgs.size() != 2) {
            return null;
        }
        String literal = originalArgs.get(1).get(0).getText();
        String format = literal.substring(1, literal.length() - 1).trim().toUpperCase(Locale.ROOT);
        return TRUNC_UNITS.get(format);
    }

    private boolean containsDateExpression(List<TextToken> arg) {
        for (int i = 0; i < arg.size(); i++) {
            TextToken token = arg.get(i);
            if (!token.isWord()) {
                continue;
            }
            if (DATE_HINTS.contains(token.getUpper())) {
                return true;
            }
            if (arg.size() == 1 && context.isDateVariable(token.getText())) {
                return true;
            }
            // NEW.hire_date, :old.created_at
            if (TextTokens.isSymbolAt(arg, i - 1, ".") && i == arg.size() - 1 && looksLikeDateColumnName(token.getUpper())) {
                return true;
            }
        }
        return false;
    }

    static boolean looksLikeDateColumnName(String upperName) {
        return upperName.contains("DATE") || upperName.contains("TIME")
                || upperName.startsWith("CREATED") || upperName.startsWith("MODIFIED") || upperName.startsWith("UPDATED")
                || upperName.endsWith("_AT") || upperName.endsWith("_ON");
    }

    private void warnUnmapped(String name, int line, String message) {
        context.warn(WarningKind.UNMAPPED_FUNCTION, message, line, name, name);
    }

    private static String nameOf(List<TextToken> tokens, int start, int nameEnd) {
        StringBuilder sb = new StringBuilder();
        for (int i = start; i <= nameEnd; i++) {
            sb.append(tokens.get(i).getText());
        }
        return sb.toString();
    }

    private static String text(List<TextToken> tokens) {
        return TextTokens.renderTrimmed(tokens);
    }
}
