package me.christianrobert.trigconv.parser;

import me.christianrobert.trigconv.core.tools.CleanedCode;
import me.christianrobert.trigconv.core.tools.CodeCleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw trigger text into an ordered sequence of {@link SourceLine} records.
 *
 * <p>Comments are stripped first (keeping line breaks), then every non-blank
 * physical line becomes one record carrying its original 1-based line number
 * and its indentation width. Blank lines are dropped but never renumber the
 * lines that follow them.</p>
 *
 * <p>A string literal that spans physical lines stays verbatim: the lines it
 * continues on are appended, untrimmed and blank ones included, to the record
 * the literal opened in.</p>
 */
public class Preprocessor {

    private static final Logger log = LoggerFactory.getLogger(Preprocessor.class);

    static final int TAB_WIDTH = 4;

    public static PreprocessedSource preprocess(String triggerText) {
        if (triggerText == null) {
            throw new IllegalArgumentException("Trigger text cannot be null");
        }

        CleanedCode cleaned = CodeCleaner.removeComments(triggerText);
        String[] physicalLines = cleaned.getCode().split("\r?\n", -1);

        List<SourceLine> lines = new ArrayList<>();
        boolean insideString = false;
        for (int i = 0; i < physicalLines.length; i++) {
            String raw = physicalLines[i];
            if (insideString) {
                SourceLine open = lines.remove(lines.size() - 1);
                lines.add(new SourceLine(open.getLineNumber(), open.getIndent(), open.getText() + "\n" + raw));
                insideString = SqlLexer.endsInsideString(raw, true);
                continue;
            }
            String text = raw.trim();
            if (text.isEmpty()) {
                continue;
            }
            insideString = SqlLexer.endsInsideString(text, false);
            if (insideString) {
                // trailing blanks belong to the literal
                text = raw.stripLeading();
            }
            lines.add(new SourceLine(i + 1, measureIndent(raw), text));
        }

        log.trace("Preprocessed {} physical lines into {} line records ({} comments)",
                physicalLines.length, lines.size(), cleaned.getComments().size());
        return new PreprocessedSource(lines, cleaned.getComments(), physicalLines.length);
    }

    static int measureIndent(String raw) {
        int width = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width += TAB_WIDTH;
            } else if (!Character.isWhitespace(c)) {
                break;
            }
        }
        return width;
    }
}
