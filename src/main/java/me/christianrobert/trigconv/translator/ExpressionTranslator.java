package me.christianrobert.trigconv.translator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates an expression or a statement kept as opaque text, token-wise.
 *
 * <p>Rewrites, in order:</p>
 * <ol>
 *   <li>row pseudo-variables ({@link RowReferenceRewriter})</li>
 *   <li>operation predicates ({@link OperationPredicateRewriter})</li>
 *   <li>function calls and niladic built-ins ({@link FunctionCallRewriter})</li>
 *   <li>sequence references ({@link SequenceReferenceRewriter})</li>
 *   <li>inequality spellings {@code != ^= ~=} → {@code <>}, {@code FROM DUAL} dropped</li>
 *   <li>numeric literals ({@link LiteralNormalizer})</li>
 * </ol>
 *
 * <p>Text matching none of the patterns comes back unchanged, so translating already
 * translated text is a no-op.</p>
 */
public class ExpressionTranslator {

    private static final Logger log = LoggerFactory.getLogger(ExpressionTranslator.class);

    private final TranslationContext context;
    private final RowReferenceRewriter rowReferences;
    private final OperationPredicateRewriter operationPredicates;
    private final FunctionCallRewriter functionCalls;
    private final SequenceReferenceRewriter sequenceReferences = new SequenceReferenceRewriter();

    public ExpressionTranslator(TranslationContext context) {
        this.context = context;
        this.rowReferences = new RowReferenceRewriter(context.getOptions(), context.getMetadata());
        this.operationPredicates = new OperationPredicateRewriter(context);
        this.functionCalls = new FunctionCallRewriter(context);
    }

    public String translate(String text, int line) {
        return translate(text, line, false);
    }

    /**
     * Translates a trigger WHEN condition, where row references carry no colon.
     */
    public String translateWhenClause(String text, int line) {
        return translate(text, line, true);
    }

    private String translate(String text, int line, boolean bareRowReferences) {
        if (text == null || text.trim().isEmpty()) {
            return text;
        }
        List<TextToken> tokens = TextTokens.tokenize(text);
        tokens = rowReferences.rewrite(tokens, bareRowReferences);
        tokens = operationPredicates.rewrite(tokens);
        tokens = functionCalls.rewrite(tokens, line);
        tokens = sequenceReferences.rewrite(tokens);
        tokens = rewriteOperatorsAndLiterals(tokens);

        String result = TextTokens.render(tokens);
        if (log.isTraceEnabled() && !result.equals(text)) {
            log.trace("Line {}: '{}' → '{}'", line, text, result);
        }
        return result;
    }

    private List<TextToken> rewriteOperatorsAndLiterals(List<TextToken> tokens) {
        List<TextToken> out = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            TextToken token = tokens.get(i);
            if (token.isSymbol("!=") || token.isSymbol("^=") || token.isSymbol("~=")) {
                out.add(token.withText("<>"));
            } else if (token.isWord("FROM") && TextTokens.isWordAt(tokens, i + 1, "DUAL")
                    && !TextTokens.isSymbolAt(tokens, i + 2, ".")) {
                i++;
            } else if (token.isNumber()) {
                out.add(token.withText(context.getLiterals().normalizeNumber(token.getText())));
            } else {
                out.add(token);
            }
        }
        return out;
    }
}
