package me.christianrobert.trigconv.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Name and arguments of a procedure call statement such as
 * {@code pkg.log_change(p_id => :NEW.id, 'UPDATE')}.
 *
 * <p>Arguments are split at top-level commas; an argument of the form {@code name => value}
 * is named, every other one positional. Argument values keep their source text.</p>
 */
public class ProcedureCall {

    public static class Argument {
        private final String name;
        private final String value;

        Argument(String name, String value) {
            this.name = name;
            this.value = value;
        }

        /**
         * Parameter name of a named argument, null for a positional one.
         */
        public String getName() {
            return name;
        }

        public String getValue() {
            return value;
        }

        public boolean isNamed() {
            return name != null;
        }
    }

    private final String functionName;
    private final List<Argument> arguments;
    private final String rawArguments;

    private ProcedureCall(String functionName, List<Argument> arguments, String rawArguments) {
        this.functionName = functionName;
        this.arguments = Collections.unmodifiableList(arguments);
        this.rawArguments = rawArguments;
    }

    /**
     * Splits a call statement (without its {@code ;}) into name and arguments.
     *
     * @return the call, or null when the text is not a plain (qualified) name optionally
     *         followed by one parenthesized argument list
     */
    public static ProcedureCall parse(String text) {
        List<SqlToken> tokens = SqlLexer.tokenize(text);
        if (tokens.isEmpty() || !tokens.get(0).isWord()) {
            return null;
        }
        int i = 1;
        while (i + 1 < tokens.size() && tokens.get(i).isSymbol(".") && tokens.get(i + 1).isWord()) {
            i += 2;
        }
        String name = text.substring(tokens.get(0).getStart(), tokens.get(i - 1).getEnd());
        if (i == tokens.size()) {
            return new ProcedureCall(name, new ArrayList<>(), "");
        }
        if (!tokens.get(i).isSymbol("(") || !tokens.get(tokens.size() - 1).isSymbol(")")) {
            return null;
        }

        int open = i;
        int close = tokens.size() - 1;
        List<Argument> arguments = new ArrayList<>();
        int depth = 0;
        int argumentStart = open + 1;
        for (int j = open + 1; j <= close; j++) {
            SqlToken token = tokens.get(j);
            if (token.isSymbol("(")) {
                depth++;
            } else if (token.isSymbol(")") && depth > 0) {
                depth--;
            } else if (token.isSymbol(")") && j != close) {
                return null;
            } else if (depth == 0 && (token.isSymbol(",") || j == close)) {
                if (j > argumentStart) {
                    arguments.add(argument(text, tokens, argumentStart, j - 1));
                } else if (token.isSymbol(",")) {
                    return null;
                }
                argumentStart = j + 1;
            }
        }
        if (depth != 0) {
            return null;
        }
        String raw = close > open + 1
                ? text.substring(tokens.get(open + 1).getStart(), tokens.get(close - 1).getEnd())
                : "";
        return new ProcedureCall(name, arguments, raw);
    }

    private static Argument argument(String text, List<SqlToken> tokens, int from, int to) {
        if (to > from + 1 && tokens.get(from).isWord() && tokens.get(from + 1).isSymbol("=>")) {
            return new Argument(tokens.get(from).getText(),
                    text.substring(tokens.get(from + 2).getStart(), tokens.get(to).getEnd()));
        }
        return new Argument(null, text.substring(tokens.get(from).getStart(), tokens.get(to).getEnd()));
    }

    public String getFunctionName() {
        return functionName;
    }

    public List<Argument> getArguments() {
        return arguments;
    }

    /**
     * Source text between the parentheses, empty when there are none.
     */
    public String getRawArguments() {
        return rawArguments;
    }

    /**
     * "empty", "positional", "named" or "mixed".
     */
    public String getParameterType() {
        if (arguments.isEmpty()) {
            return "empty";
        }
        long named = arguments.stream().filter(Argument::isNamed).count();
        if (named == 0) {
            return "positional";
        }
        return named == arguments.size() ? "named" : "mixed";
    }
}
