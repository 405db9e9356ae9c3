package me.christianrobert.trigconv.translator;

import me.christianrobert.trigconv.ir.Declaration;
import me.christianrobert.trigconv.ir.Declarations;
import me.christianrobert.trigconv.ir.ExceptionDecl;
import me.christianrobert.trigconv.report.WarningKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps Oracle exceptions to PostgreSQL conditions and SQLSTATE codes.
 *
 * <h3>SQLSTATE assignment for declared exceptions:</h3>
 * <pre>
 * PRAGMA EXCEPTION_INIT(e, -20001)  → 'P0001'   ('P' + LPAD(abs(code) - 20000, 4, '0'))
 * PRAGMA EXCEPTION_INIT(e, -1)      → '23505'   (well-known Oracle errors)
 * e EXCEPTION;                      → 'P9001', 'P9002', ... per trigger
 * </pre>
 *
 * <h3>Statements and handlers:</h3>
 * <pre>
 * RAISE e;                          → RAISE EXCEPTION 'message' USING ERRCODE = 'P9001';
 * RAISE zero_divide;                → RAISE division_by_zero;
 * RAISE_APPLICATION_ERROR(-20001, 'Bad')
 *   → RAISE EXCEPTION 'Bad' USING ERRCODE = 'P0001', HINT = 'Original Oracle error code: -20001';
 * WHEN e THEN                       → WHEN SQLSTATE 'P9001' THEN
 * WHEN NO_DATA_FOUND THEN           → WHEN no_data_found THEN
 * </pre>
 *
 * <p>Declared exceptions are scoped to their block: the generator opens a scope per block and
 * lookups search from the innermost scope outwards, so an inner declaration shadows an outer
 * one of the same name.</p>
 */
public class ExceptionMapper {

    private static final Logger log = LoggerFactory.getLogger(ExceptionMapper.class);

    static final Map<String, String> STANDARD_EXCEPTIONS = Map.ofEntries(
            Map.entry("NO_DATA_FOUND", "no_data_found"),
            Map.entry("TOO_MANY_ROWS", "too_many_rows"),
            Map.entry("ZERO_DIVIDE", "division_by_zero"),
            Map.entry("VALUE_ERROR", "invalid_text_representation"),
            Map.entry("INVALID_NUMBER", "invalid_text_representation"),
            Map.entry("DUP_VAL_ON_INDEX", "unique_violation"),
            Map.entry("FOREIGN_KEY_VIOLATION", "foreign_key_violation"),
            Map.entry("CHECK_VIOLATION", "check_violation"),
            Map.entry("INVALID_CURSOR", "invalid_cursor_state"),
            Map.entry("CURSOR_ALREADY_OPEN", "duplicate_cursor"),
            Map.entry("TIMEOUT_ON_RESOURCE", "lock_not_available"),
            Map.entry("LOGIN_DENIED", "invalid_authorization_specification"),
            Map.entry("NOT_LOGGED_ON", "connection_does_not_exist"),
            Map.entry("PROGRAM_ERROR", "internal_error"),
            Map.entry("STORAGE_ERROR", "out_of_memory"),
            Map.entry("ROWTYPE_MISMATCH", "datatype_mismatch"),
            Map.entry("COLLECTION_IS_NULL", "null_value_not_allowed"),
            Map.entry("SUBSCRIPT_BEYOND_COUNT", "array_subscript_error"),
            Map.entry("SUBSCRIPT_OUTSIDE_LIMIT", "array_subscript_error"),
            Map.entry("TRANSACTION_BACKED_OUT", "transaction_rollback"));

    private static final Map<Integer, String> ORACLE_ERROR_SQLSTATES = Map.ofEntries(
            Map.entry(-1, "23505"),
            Map.entry(-1400, "23502"),
            Map.entry(-2290, "23514"),
            Map.entry(-2291, "23503"),
            Map.entry(-2292, "23503"),
            Map.entry(-1476, "22012"),
            Map.entry(-1403, "P0002"),
            Map.entry(-1422, "P0003"),
            Map.entry(-54, "55P03"),
            Map.entry(-60, "40P01"));

    private static final Set<String> RAISE_LEVELS = Set.of("EXCEPTION", "NOTICE", "WARNING", "INFO", "LOG", "DEBUG");

    private static final Pattern INTEGER = Pattern.compile("-?\\s*\\d+");

    private static final Set<String> PG_CONDITIONS = new HashSet<>(STANDARD_EXCEPTIONS.values());

    private final TranslationContext context;
    private final ExpressionTranslator expressions;
    private final Deque<Map<String, String>> scopes = new ArrayDeque<>();
    private int nextAutoCode = 9001;

    public ExceptionMapper(TranslationContext context, ExpressionTranslator expressions) {
        this.context = context;
        this.expressions = expressions;
    }

    /**
     * Opens the scope of a block and assigns SQLSTATEs to the exceptions it declares.
     */
    public void enterScope(Declarations declarations) {
        Map<String, String> scope = new HashMap<>();
        if (declarations != null) {
            for (Declaration declaration : declarations.getAll()) {
                if (declaration instanceof ExceptionDecl) {
                    ExceptionDecl exception = (ExceptionDecl) declaration;
                    String sqlState = assignSqlState(exception);
                    scope.put(exception.getName().toUpperCase(Locale.ROOT), sqlState);
                    log.debug("Exception {} mapped to SQLSTATE '{}'", exception.getName(), sqlState);
                }
            }
        }
        scopes.push(scope);
    }

    public void exitScope() {
        scopes.pop();
    }

    private String assignSqlState(ExceptionDecl exception) {
        Integer code = exception.getErrorCode();
        if (code != null && code <= -20000 && code >= -20999) {
            return String.format("P%04d", -code - 20000);
        }
        if (code != null && ORACLE_ERROR_SQLSTATES.containsKey(code)) {
            return ORACLE_ERROR_SQLSTATES.get(code);
        }
        return String.format("P%04d", nextAutoCode++);
    }

    /**
     * SQLSTATE of a declared exception visible in the current scope, or null.
     */
    public String sqlStateOf(String exceptionName) {
        String key = exceptionName.trim().toUpperCase(Locale.ROOT);
        for (Map<String, String> scope : scopes) {
            String sqlState = scope.get(key);
            if (sqlState != null) {
                return sqlState;
            }
        }
        return null;
    }

    /**
     * Comment that replaces an exception declaration in the DECLARE section.
     */
    public String declarationComment(ExceptionDecl exception) {
        StringBuilder sb = new StringBuilder("-- ").append(exception.getName()).append(" EXCEPTION;");
        if (exception.getErrorCode() != null) {
            sb.append(" PRAGMA EXCEPTION_INIT(").append(exception.getErrorCode()).append(");");
        }
        return sb.append(" (mapped to SQLSTATE '").append(sqlStateOf(exception.getName())).append("')").toString();
    }

    /**
     * Condition for one name of a {@code WHEN a OR b THEN} handler.
     */
    public String handlerCondition(String exceptionName, int line) {
        String name = exceptionName.trim();
        String upper = name.toUpperCase(Locale.ROOT);
        if ("OTHERS".equals(upper)) {
            return "OTHERS";
        }
        String sqlState = sqlStateOf(name);
        if (sqlState != null) {
            return "SQLSTATE '" + sqlState + "'";
        }
        String standard = STANDARD_EXCEPTIONS.get(upper);
        if (standard != null) {
            return standard;
        }
        if (upper.startsWith("SQLSTATE") || PG_CONDITIONS.contains(name.toLowerCase(Locale.ROOT))) {
            return name;
        }
        context.warn(WarningKind.UNMAPPED_EXCEPTION, "No mapping for exception " + name, line, name, name);
        return name;
    }

    /**
     * Translates a RAISE or RAISE_APPLICATION_ERROR statement (without its semicolon).
     */
    public String translateRaise(String statement, int line) {
        List<TextToken> tokens = TextTokens.tokenize(statement);
        if (tokens.isEmpty()) {
            return statement;
        }
        if (tokens.get(0).isWord("RAISE_APPLICATION_ERROR")) {
            return raiseApplicationError(statement, tokens, line);
        }
        if (!tokens.get(0).isWord("RAISE") || tokens.size() == 1) {
            return statement.trim();
        }

        TextToken second = tokens.get(1);
        if (second.isString() || second.isWord("USING") || (second.isWord() && RAISE_LEVELS.contains(second.getUpper()))) {
            // already PL/pgSQL
            return expressions.translate(statement, line).trim();
        }

        String name = TextTokens.renderTrimmed(tokens.subList(1, tokens.size()));
        String sqlState = sqlStateOf(name);
        if (sqlState != null) {
            String message = context.getTables().getExceptions().lookup(name);
            if (message == null) {
                context.warn(WarningKind.UNMAPPED_EXCEPTION, "No message template for exception " + name,
                        line, name, statement.trim());
                message = name;
            }
            return "RAISE EXCEPTION '" + escapeFormat(message) + "' USING ERRCODE = '" + sqlState + "'";
        }

        String standard = STANDARD_EXCEPTIONS.get(name.toUpperCase(Locale.ROOT));
        if (standard != null) {
            return "RAISE " + standard;
        }
        if (!PG_CONDITIONS.contains(name.toLowerCase(Locale.ROOT))) {
            context.warn(WarningKind.UNMAPPED_EXCEPTION, "No mapping for exception " + name, line, name, statement.trim());
        }
        return "RAISE " + name;
    }

    private String raiseApplicationError(String statement, List<TextToken> tokens, int line) {
        int close = TextTokens.isSymbolAt(tokens, 1, "(") ? TextTokens.matchingParen(tokens, 1) : -1;
        List<List<TextToken>> args = close > 0 ? TextTokens.splitArguments(tokens, 1, close) : List.of();
        if (args.size() < 2) {
            context.warn(WarningKind.UNMAPPED_EXCEPTION, "RAISE_APPLICATION_ERROR needs an error code and a message",
                    line, "RAISE_APPLICATION_ERROR", statement.trim());
            return expressions.translate(statement, line).trim();
        }

        String codeText = TextTokens.renderTrimmed(args.get(0));
        String sqlState;
        String hint;
        if (INTEGER.matcher(codeText).matches()) {
            int code = Integer.parseInt(codeText.replaceAll("\\s", ""));
            if (code <= -20000 && code >= -20999) {
                sqlState = String.format("P%04d", -code - 20000);
            } else {
                sqlState = "P0001";
            }
            hint = "Original Oracle error code: " + code;
        } else {
            sqlState = "P0001";
            hint = "Original Oracle error code expression: " + codeText;
        }

        List<TextToken> messageArg = args.get(1);
        String using = "ERRCODE = '" + sqlState + "', HINT = '" + hint.replace("'", "''") + "'";
        if (messageArg.size() == 1 && messageArg.get(0).isString()) {
            String literal = messageArg.get(0).getText();
            return "RAISE EXCEPTION " + literal.replace("%", "%%") + " USING " + using;
        }
        String message = expressions.translate(TextTokens.renderTrimmed(messageArg), line).trim();
        return "RAISE EXCEPTION USING MESSAGE = " + message + ", " + using;
    }

    // RAISE format strings treat % as a placeholder
    private static String escapeFormat(String message) {
        return message.replace("'", "''").replace("%", "%%");
    }
}
