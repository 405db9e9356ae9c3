package me.christianrobert.trigconv.translator;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites the trigger operation predicates to tests of the operation variable.
 *
 * <pre>
 * INSERTING                    → TG_OP = 'INSERT'
 * INSERTING OR UPDATING        → TG_OP IN ('INSERT', 'UPDATE')
 * UPDATING('SAL')              → (TG_OP = 'UPDATE' AND NEW.SAL IS DISTINCT FROM OLD.SAL)
 * </pre>
 *
 * <p>A run of predicates joined by OR is merged only when no AND or NOT binds to either end
 * of it; otherwise every predicate is rewritten on its own, which keeps operator precedence
 * as written.</p>
 */
class OperationPredicateRewriter {

    private static final Map<String, String> OPERATIONS = Map.of(
            "INSERTING", "INSERT",
            "UPDATING", "UPDATE",
            "DELETING", "DELETE");

    private final TranslationContext context;
    private final String operationVariable;

    OperationPredicateRewriter(TranslationContext context) {
        this.context = context;
        this.operationVariable = context.getOptions().getOperationVariable();
    }

    List<TextToken> rewrite(List<TextToken> tokens) {
        List<TextToken> out = new ArrayList<>(tokens.size());
        int i = 0;
        while (i < tokens.size()) {
            if (!isPredicate(tokens, i)) {
                out.add(tokens.get(i));
                i++;
                continue;
            }

            if (isColumnPredicate(tokens, i)) {
                out.addAll(columnTest(tokens, i));
                i += 4;
                continue;
            }

            // collect a run P OR P OR ... of plain predicates
            List<Integer> run = new ArrayList<>();
            run.add(i);
            int last = i;
            while (TextTokens.isWordAt(tokens, last + 1, "OR") && isPlainPredicate(tokens, last + 2)) {
                last += 2;
                run.add(last);
            }

            boolean boundBefore = TextTokens.isWordAt(tokens, i - 1, "AND") || TextTokens.isWordAt(tokens, i - 1, "NOT");
            boolean boundAfter = TextTokens.isWordAt(tokens, last + 1, "AND");
            if (run.size() > 1 && !boundBefore && !boundAfter) {
                out.addAll(membershipTest(tokens, run));
                i = last + 1;
                continue;
            }

            out.addAll(equalityTest(tokens.get(i)));
            i++;
        }
        return out;
    }

    private boolean isPredicate(List<TextToken> tokens, int index) {
        if (index >= tokens.size()) {
            return false;
        }
        TextToken token = tokens.get(index);
        return token.isWord() && OPERATIONS.containsKey(token.getUpper())
                && !context.isDeclared(token.getText())
                && !TextTokens.isSymbolAt(tokens, index - 1, ".")
                && !TextTokens.isSymbolAt(tokens, index + 1, ".");
    }

    private boolean isPlainPredicate(List<TextToken> tokens, int index) {
        return isPredicate(tokens, index) && !isColumnPredicate(tokens, index);
    }

    // UPDATING ( 'col' )
    private boolean isColumnPredicate(List<TextToken> tokens, int index) {
        return tokens.get(index).isWord("UPDATING")
                && TextTokens.isSymbolAt(tokens, index + 1, "(")
                && index + 2 < tokens.size() && tokens.get(index + 2).isString()
                && TextTokens.isSymbolAt(tokens, index + 3, ")");
    }

    private List<TextToken> equalityTest(TextToken predicate) {
        return TextTokens.fragment(operationVariable + " = '" + OPERATIONS.get(predicate.getUpper()) + "'",
                predicate.getLeading());
    }

    private List<TextToken> membershipTest(List<TextToken> tokens, List<Integer> run) {
        Set<String> operations = new LinkedHashSet<>();
        for (int index : run) {
            operations.add("'" + OPERATIONS.get(tokens.get(index).getUpper()) + "'");
        }
        if (operations.size() == 1) {
            return equalityTest(tokens.get(run.get(0)));
        }
        return TextTokens.fragment(operationVariable + " IN (" + String.join(", ", operations) + ")",
                tokens.get(run.get(0)).getLeading());
    }

    private List<TextToken> columnTest(List<TextToken> tokens, int index) {
        String literal = tokens.get(index + 2).getText();
        String column = literal.substring(1, literal.length() - 1).trim();
        ConversionOptions options = context.getOptions();
        String test = "(" + operationVariable + " = 'UPDATE' AND "
                + options.getNewRecordName() + "." + column + " IS DISTINCT FROM "
                + options.getOldRecordName() + "." + column + ")";
        return TextTokens.fragment(test, tokens.get(index).getLeading());
    }
}
