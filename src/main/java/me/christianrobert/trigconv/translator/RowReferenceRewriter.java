package me.christianrobert.trigconv.translator;

import me.christianrobert.trigconv.ir.TriggerMetadata;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Rewrites row pseudo-variables to the target record names.
 *
 * <pre>
 * :NEW.salary       → NEW.salary
 * :old.status       → OLD.status
 * :n.id             → NEW.id      (REFERENCING NEW AS n)
 * </pre>
 *
 * <p>In a trigger WHEN condition Oracle writes the references without a colon; there a bare
 * {@code new.col} (or alias) followed by a dot is rewritten too.</p>
 */
class RowReferenceRewriter {

    private final String newRecordName;
    private final String oldRecordName;
    private final Set<String> newNames = new HashSet<>();
    private final Set<String> oldNames = new HashSet<>();

    RowReferenceRewriter(ConversionOptions options, TriggerMetadata metadata) {
        this.newRecordName = options.getNewRecordName();
        this.oldRecordName = options.getOldRecordName();
        newNames.add("NEW");
        oldNames.add("OLD");
        if (metadata != null && metadata.getNewAlias() != null) {
            newNames.add(metadata.getNewAlias().toUpperCase(Locale.ROOT));
        }
        if (metadata != null && metadata.getOldAlias() != null) {
            oldNames.add(metadata.getOldAlias().toUpperCase(Locale.ROOT));
        }
    }

    List<TextToken> rewrite(List<TextToken> tokens, boolean bareReferences) {
        List<TextToken> out = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            TextToken token = tokens.get(i);
            if (token.isSymbol(":") && i + 1 < tokens.size() && tokens.get(i + 1).isWord()
                    && tokens.get(i + 1).getLeading().isEmpty()) {
                String record = recordNameFor(tokens.get(i + 1));
                if (record != null) {
                    out.add(TextToken.word(record, token.getLeading()));
                    i++;
                    continue;
                }
            }
            if (bareReferences && token.isWord() && !TextTokens.isSymbolAt(tokens, i - 1, ".")
                    && TextTokens.isSymbolAt(tokens, i + 1, ".")) {
                String record = recordNameFor(token);
                if (record != null) {
                    out.add(TextToken.word(record, token.getLeading()));
                    continue;
                }
            }
            out.add(token);
        }
        return out;
    }

    private String recordNameFor(TextToken word) {
        if (newNames.contains(word.getUpper())) {
            return newRecordName;
        }
        if (oldNames.contains(word.getUpper())) {
            return oldRecordName;
        }
        return null;
    }
}
