package me.christianrobert.trigconv.translator;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes numeric literals and date-format strings, once per distinct literal.
 *
 * <p>One instance lives in one translation context; every later occurrence of a literal is
 * answered from the cache.</p>
 *
 * <h3>Date-format elements:</h3>
 * <pre>
 * RRRR  → YYYY     RR    → YY
 * SYYYY → YYYY     SSSSS → SSSS
 * FF, FF7-FF9 → US   FF1-FF6 kept
 * TZR   → TZ
 * </pre>
 * Text inside double quotes of a format is literal and left alone.
 */
public class LiteralNormalizer {

    private static final Pattern FORMAT_ELEMENT = Pattern.compile(
            "(?i)\"[^\"]*\"|SYYYY|RRRR|RR|SSSSS|FF[1-9]?|TZR");

    private final Map<String, String> numbers = new HashMap<>();
    private final Map<String, String> formats = new HashMap<>();
    private int normalizations;

    public String normalizeNumber(String literal) {
        return numbers.computeIfAbsent(literal, this::computeNumber);
    }

    /**
     * @param quotedFormat a string literal including its quotes, e.g. {@code 'DD-MON-RR'}
     */
    public String normalizeDateFormat(String quotedFormat) {
        return formats.computeIfAbsent(quotedFormat, this::computeFormat);
    }

    /**
     * Number of distinct literals normalized so far.
     */
    public int getNormalizationCount() {
        return normalizations;
    }

    private String computeNumber(String literal) {
        normalizations++;
        String result = literal;
        if (result.startsWith(".")) {
            result = "0" + result;
        }
        if (result.endsWith(".")) {
            result = result + "0";
        }
        return result.replace('e', 'E');
    }

    private String computeFormat(String quoted) {
        normalizations++;
        if (quoted.length() < 2 || !quoted.startsWith("'") || !quoted.endsWith("'")) {
            return quoted;
        }
        String body = quoted.substring(1, quoted.length() - 1);
        Matcher m = FORMAT_ELEMENT.matcher(body);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(replacementFor(m.group())));
        }
        m.appendTail(sb);
        return "'" + sb + "'";
    }

    private static String replacementFor(String element) {
        if (element.startsWith("\"")) {
            return element;
        }
        String upper = element.toUpperCase(Locale.ROOT);
        switch (upper) {
            case "SYYYY":
            case "RRRR":
                return "YYYY";
            case "RR":
                return "YY";
            case "SSSSS":
                return "SSSS";
            case "TZR":
                return "TZ";
            default:
                break;
        }
        if (upper.startsWith("FF")) {
            if (upper.length() == 3 && upper.charAt(2) <= '6') {
                return element;
            }
            return "US";
        }
        return element;
    }
}
