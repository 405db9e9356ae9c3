package me.christianrobert.trigconv.parser;

import me.christianrobert.trigconv.core.exception.SectionBoundaryException;
import me.christianrobert.trigconv.core.exception.StructuralParseException;
import me.christianrobert.trigconv.report.WarningCollector;
import me.christianrobert.trigconv.report.WarningKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates DECLARE, the first top-level BEGIN and the END closing the main block.
 *
 * <p>The closing END is found by counting openers and closers from BEGIN onward, at
 * statement starts only, so a CASE expression's bare END inside a statement never closes
 * the block and words inside string literals are never seen (the lexer already made
 * them STRING tokens; comments are gone after preprocessing).</p>
 */
public class SectionSplitter {

    private static final Logger log = LoggerFactory.getLogger(SectionSplitter.class);

    public static TriggerSections split(TokenSequence tokens, WarningCollector warnings) {
        int declareIndex = -1;
        int beginIndex = -1;
        int parenDepth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            SqlToken token = tokens.get(i);
            if (token.isSymbol("(")) {
                parenDepth++;
            } else if (token.isSymbol(")")) {
                parenDepth--;
            } else if (parenDepth == 0 && (token.isWord("DECLARE") || token.isWord("BEGIN"))) {
                if (token.isWord("DECLARE")) {
                    declareIndex = i;
                } else {
                    beginIndex = i;
                }
                break;
            }
        }

        if (declareIndex >= 0) {
            beginIndex = findBeginAfterDeclarations(tokens, declareIndex);
            if (beginIndex < 0) {
                throw new SectionBoundaryException("DECLARE at line " + tokens.lineOf(declareIndex)
                        + " is not followed by BEGIN", tokens.lineOf(declareIndex), tokens.lineText(declareIndex));
            }
        }
        if (beginIndex < 0) {
            throw new SectionBoundaryException("No BEGIN found in trigger body",
                    tokens.size() == 0 ? -1 : tokens.lineOf(0), tokens.size() == 0 ? null : tokens.lineText(0));
        }

        BlockBoundaryScanner.NestingProfile profile =
                new BlockBoundaryScanner(tokens).measure(beginIndex, tokens.size());
        if (!profile.isClosed()) {
            throw new SectionBoundaryException("BEGIN at line " + tokens.lineOf(beginIndex)
                    + " has no matching END", tokens.lineOf(beginIndex), tokens.lineText(beginIndex));
        }

        checkTrailingContent(tokens, profile.getTerminatorIndex() + 1, warnings);

        int headerEnd = declareIndex >= 0 ? declareIndex : beginIndex;
        log.debug("Sections: header={} tokens, DECLARE@{}, BEGIN@{}, EXCEPTION@{}, END@{}",
                headerEnd, declareIndex, beginIndex, profile.getExceptionIndex(), profile.getCloserIndex());

        return new TriggerSections(headerEnd, declareIndex, beginIndex, profile.getExceptionIndex(),
                profile.getCloserIndex(), profile.getTerminatorIndex(), profile.getMaxDepth());
    }

    // BEGIN is the first statement start after DECLARE that is the word BEGIN
    private static int findBeginAfterDeclarations(TokenSequence tokens, int declareIndex) {
        int i = declareIndex + 1;
        while (i < tokens.size()) {
            if (tokens.isWord(i, "BEGIN")) {
                return i;
            }
            int semicolon = tokens.findSemicolon(i, tokens.size());
            int end = semicolon < 0 ? tokens.size() : semicolon;
            // unterminated declaration: BEGIN opening a line still ends the section
            for (int j = i + 1; j < end; j++) {
                if (tokens.isWord(j, "BEGIN") && tokens.get(j).isFirstOnLine()) {
                    return j;
                }
            }
            if (semicolon < 0) {
                return -1;
            }
            i = semicolon + 1;
        }
        return -1;
    }

    /**
     * After the final END only SQL*Plus lines may follow: a "/" is accepted silently,
     * a SHOW command is dropped with a warning. Anything else is code that would be lost.
     */
    private static void checkTrailingContent(TokenSequence tokens, int from, WarningCollector warnings) {
        int i = from;
        while (i < tokens.size()) {
            SqlToken token = tokens.get(i);
            if (token.isSymbol("/")) {
                i++;
                continue;
            }
            if (token.isFirstOnLine() && token.isWord("SHOW")) {
                int lineEnd = i;
                while (lineEnd + 1 < tokens.size() && !tokens.get(lineEnd + 1).isFirstOnLine()) {
                    lineEnd++;
                }
                warnings.add(WarningKind.TRAILING_CONTENT, "SQL*Plus command after the final END is ignored",
                        token.getLineNumber(), 0, null, tokens.flatText(i, lineEnd));
                i = lineEnd + 1;
                continue;
            }
            String what = token.isWord("END") ? "Unmatched END after the final END of the trigger body"
                    : "Statement after the final END of the trigger body";
            throw new StructuralParseException(what, token.getLineNumber(), 0, tokens.lineText(i));
        }
    }
}
