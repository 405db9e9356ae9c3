package me.christianrobert.trigconv.translator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@code seq.NEXTVAL} → {@code nextval('seq')}, {@code app.seq.CURRVAL} → {@code currval('app.seq')}.
 */
class SequenceReferenceRewriter {

    List<TextToken> rewrite(List<TextToken> tokens) {
        List<TextToken> out = new ArrayList<>(tokens.size());
        int i = 0;
        while (i < tokens.size()) {
            TextToken token = tokens.get(i);
            if (token.isWord() && !TextTokens.isSymbolAt(tokens, i - 1, ".")) {
                int end = i;
                while (TextTokens.isSymbolAt(tokens, end + 1, ".") && end + 2 < tokens.size()
                        && tokens.get(end + 2).isWord()) {
                    end += 2;
                }
                TextToken last = tokens.get(end);
                if (end > i && (last.isWord("NEXTVAL") || last.isWord("CURRVAL"))
                        && !TextTokens.isSymbolAt(tokens, end + 1, "(")) {
                    StringBuilder sequence = new StringBuilder();
                    for (int j = i; j < end - 1; j++) {
                        sequence.append(tokens.get(j).getText());
                    }
                    out.addAll(TextTokens.fragment(last.getUpper().toLowerCase(Locale.ROOT)
                            + "('" + sequence + "')", token.getLeading()));
                    i = end + 1;
                    continue;
                }
                out.addAll(tokens.subList(i, end + 1));
                i = end + 1;
                continue;
            }
            out.add(token);
            i++;
        }
        return out;
    }
}
