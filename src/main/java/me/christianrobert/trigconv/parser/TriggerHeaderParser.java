package me.christianrobert.trigconv.parser;

import me.christianrobert.trigconv.ir.TriggerMetadata;
import me.christianrobert.trigconv.report.WarningCollector;
import me.christianrobert.trigconv.report.WarningKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Reads trigger metadata from an optional header clause preceding the body.
 *
 * <p>Recognized grammar:</p>
 * <pre>
 * CREATE [OR REPLACE] [EDITIONABLE | NONEDITIONABLE] TRIGGER [schema.]name
 *   { BEFORE | AFTER | INSTEAD OF }
 *   event [OR event]*            -- INSERT | DELETE | UPDATE [OF col [, col]*]
 *   ON [schema.]table
 *   [REFERENCING { NEW [AS] n | OLD [AS] o }*]
 *   [FOR EACH ROW]
 *   [WHEN (condition)]
 * </pre>
 *
 * <p>Names are lower-cased as they are when extracted from the Oracle data dictionary.
 * A header that does not follow the grammar yields whatever was read up to the point of
 * deviation plus an {@link WarningKind#UNRECOGNIZED_HEADER} warning.</p>
 */
public class TriggerHeaderParser {

    private static final Logger log = LoggerFactory.getLogger(TriggerHeaderParser.class);

    private final TokenSequence tokens;
    private final int end;
    private int pos;

    private TriggerHeaderParser(TokenSequence tokens, int from, int end) {
        this.tokens = tokens;
        this.pos = from;
        this.end = end;
    }

    /**
     * Parses the header tokens in {@code [from, end)}. Returns empty metadata for an empty range.
     */
    public static TriggerMetadata parse(TokenSequence tokens, int from, int end, WarningCollector warnings) {
        if (from >= end) {
            return TriggerMetadata.empty();
        }
        TriggerHeaderParser parser = new TriggerHeaderParser(tokens, from, end);
        TriggerMetadata.Builder builder = TriggerMetadata.builder();
        String problem = parser.parseInto(builder);
        if (problem != null) {
            log.warn("Unrecognized trigger header at line {}: {}", tokens.lineOf(parser.pos), problem);
            warnings.add(WarningKind.UNRECOGNIZED_HEADER, problem, tokens.lineOf(Math.min(parser.pos, end - 1)), 0,
                    null, tokens.flatText(from, end - 1));
        }
        TriggerMetadata metadata = builder.build();
        log.debug("Parsed trigger header: {}", metadata);
        return metadata;
    }

    // returns a problem description, or null when the whole header was understood
    private String parseInto(TriggerMetadata.Builder builder) {
        if (!accept("CREATE")) {
            return "Header does not start with CREATE";
        }
        if (accept("OR") && !accept("REPLACE")) {
            return "Expected REPLACE after CREATE OR";
        }
        if (!accept("EDITIONABLE")) {
            accept("NONEDITIONABLE");
        }
        if (!accept("TRIGGER")) {
            return "Expected TRIGGER";
        }

        String[] name = qualifiedName();
        if (name == null) {
            return "Expected trigger name";
        }
        builder.schema(name[0]).triggerName(name[1]);

        String timing = parseTiming();
        if (timing == null) {
            return "Expected BEFORE, AFTER or INSTEAD OF";
        }
        builder.timing(timing);
        if ("INSTEAD OF".equals(timing)) {
            // INSTEAD OF triggers are always row-level
            builder.level("ROW");
        }

        String problem = parseEvents(builder);
        if (problem != null) {
            return problem;
        }

        if (!accept("ON")) {
            return "Expected ON after trigger events";
        }
        String[] table = qualifiedName();
        if (table == null) {
            return "Expected table name after ON";
        }
        builder.tableSchema(table[0]).tableName(table[1]);

        if (accept("REFERENCING")) {
            while (pos < end && (peek("NEW") || peek("OLD") || peek("PARENT"))) {
                String which = tokens.get(pos++).getUpper();
                accept("AS");
                if (!atName()) {
                    return "Expected alias after REFERENCING " + which;
                }
                String alias = tokens.get(pos++).getText();
                if ("NEW".equals(which)) {
                    builder.newAlias(alias);
                } else if ("OLD".equals(which)) {
                    builder.oldAlias(alias);
                }
            }
        }

        if (accept("FOR")) {
            if (!accept("EACH") || !accept("ROW")) {
                return "Expected FOR EACH ROW";
            }
            builder.level("ROW");
        } else if (!"INSTEAD OF".equals(timing)) {
            builder.level("STATEMENT");
        }

        if (accept("WHEN")) {
            if (pos >= end) {
                return "Expected condition after WHEN";
            }
            builder.whenClause(cleanWhenClause(tokens.flatText(pos, end - 1)));
            pos = end;
        }

        if (pos < end) {
            return "Unexpected '" + tokens.get(pos).getText() + "' in trigger header";
        }
        return null;
    }

    private String parseTiming() {
        if (accept("BEFORE")) {
            return "BEFORE";
        }
        if (accept("AFTER")) {
            return "AFTER";
        }
        if (accept("INSTEAD")) {
            return accept("OF") ? "INSTEAD OF" : null;
        }
        return null;
    }

    private String parseEvents(TriggerMetadata.Builder builder) {
        do {
            if (accept("INSERT")) {
                builder.event("INSERT");
            } else if (accept("DELETE")) {
                builder.event("DELETE");
            } else if (accept("UPDATE")) {
                builder.event("UPDATE");
                if (accept("OF")) {
                    do {
                        if (!atName()) {
                            return "Expected column name after UPDATE OF";
                        }
                        builder.updateColumn(normalize(tokens.get(pos++).getText()));
                    } while (acceptSymbol(","));
                }
            } else {
                return "Expected INSERT, UPDATE or DELETE";
            }
        } while (accept("OR"));
        return null;
    }

    /**
     * Removes the surrounding parentheses of a WHEN condition: {@code (new.sal > 0)} becomes {@code new.sal > 0}.
     */
    static String cleanWhenClause(String whenClause) {
        String cleaned = whenClause.trim();
        while (cleaned.startsWith("(") && cleaned.endsWith(")") && wrapsWhole(cleaned)) {
            cleaned = cleaned.substring(1, cleaned.length() - 1).trim();
        }
        return cleaned;
    }

    // "(a) OR (b)" starts and ends with parens that do not belong together
    private static boolean wrapsWhole(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0 && i < text.length() - 1) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    private String[] qualifiedName() {
        if (!atName()) {
            return null;
        }
        String first = normalize(tokens.get(pos++).getText());
        if (pos + 1 < end && tokens.isSymbol(pos, ".") && atName(pos + 1)) {
            pos++;
            String second = normalize(tokens.get(pos++).getText());
            return new String[]{first, second};
        }
        return new String[]{null, first};
    }

    private boolean accept(String keyword) {
        if (pos < end && tokens.isWord(pos, keyword)) {
            pos++;
            return true;
        }
        return false;
    }

    private boolean acceptSymbol(String symbol) {
        if (pos < end && tokens.isSymbol(pos, symbol)) {
            pos++;
            return true;
        }
        return false;
    }

    private boolean peek(String keyword) {
        return pos < end && tokens.isWord(pos, keyword);
    }

    private boolean atName() {
        return atName(pos);
    }

    private boolean atName(int index) {
        return index < end && (tokens.get(index).isWord()
                || tokens.get(index).getType() == SqlTokenType.QUOTED_IDENTIFIER);
    }

    private static String normalize(String name) {
        if (name.startsWith("\"") && name.endsWith("\"") && name.length() > 1) {
            return name.substring(1, name.length() - 1);
        }
        return name.toLowerCase(Locale.ROOT);
    }
}
