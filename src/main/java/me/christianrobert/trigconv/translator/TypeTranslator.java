package me.christianrobert.trigconv.translator;

import me.christianrobert.trigconv.report.WarningKind;
import me.christianrobert.trigconv.translator.mapping.MappingTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps declared Oracle types through the type table.
 *
 * <p>The lookup key is the base name with size and precision removed, multi-word types
 * matched whole; the size is carried over to the target:</p>
 * <pre>
 * VARCHAR2(100 CHAR)           → varchar(100)
 * NUMBER(10,2)                 → numeric(10,2)
 * TIMESTAMP(6) WITH TIME ZONE  → timestamp(6) with time zone
 * emp.salary%TYPE              → emp.salary%TYPE   (verbatim)
 * </pre>
 */
public class TypeTranslator {

    private final TranslationContext context;
    private final MappingTable types;

    public TypeTranslator(TranslationContext context) {
        this.context = context;
        this.types = context.getTables().getTypes();
    }

    public String translate(String declaredType, int line) {
        if (declaredType == null || declaredType.trim().isEmpty()) {
            return declaredType;
        }
        String trimmed = declaredType.trim();
        if (trimmed.contains("%")) {
            return trimmed;
        }

        List<String> words = new ArrayList<>();
        String size = null;
        List<TextToken> tokens = TextTokens.tokenize(trimmed);
        for (int i = 0; i < tokens.size(); i++) {
            TextToken token = tokens.get(i);
            if (token.isSymbol("(")) {
                int close = TextTokens.matchingParen(tokens, i);
                if (close < 0) {
                    return unmapped(trimmed, line);
                }
                // INTERVAL DAY(3) TO SECOND(2): only the first precision is carried over
                if (size == null) {
                    size = sizeOf(tokens.subList(i + 1, close));
                }
                i = close;
            } else if (token.isWord()) {
                words.add(token.getText().toLowerCase(Locale.ROOT));
            } else {
                // qualified or otherwise unusual type names are not table keys
                return unmapped(trimmed, line);
            }
        }
        if (words.isEmpty()) {
            return unmapped(trimmed, line);
        }

        String baseName = String.join(" ", words);
        String target = types.lookup(baseName);
        if (target == null) {
            return unmapped(trimmed, line);
        }
        target = target.trim();
        if (size == null || size.isEmpty() || target.contains("(")) {
            return target;
        }
        int space = target.indexOf(' ');
        if (space > 0 && !"double precision".equalsIgnoreCase(target)) {
            return target.substring(0, space) + "(" + size + ")" + target.substring(space);
        }
        if ("double precision".equalsIgnoreCase(target) || "text".equalsIgnoreCase(target)
                || "bytea".equalsIgnoreCase(target) || "integer".equalsIgnoreCase(target)
                || "real".equalsIgnoreCase(target)) {
            // these targets take no size
            return target;
        }
        return target + "(" + size + ")";
    }

    // "100 CHAR" → "100", "*, 0" → "38,0"
    private static String sizeOf(List<TextToken> inner) {
        StringBuilder sb = new StringBuilder();
        for (TextToken token : inner) {
            if (token.isWord("CHAR") || token.isWord("BYTE")) {
                continue;
            }
            if (token.isSymbol("*")) {
                sb.append("38");
                continue;
            }
            sb.append(token.getText());
        }
        return sb.toString();
    }

    private String unmapped(String declaredType, int line) {
        context.warn(WarningKind.UNMAPPED_TYPE, "No mapping for type " + declaredType, line, declaredType, declaredType);
        return declaredType;
    }
}
