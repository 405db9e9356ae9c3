package me.christianrobert.trigconv.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PreprocessorTest {

    @Test
    void blankLinesAreDroppedWithoutRenumbering() {
        PreprocessedSource source = Preprocessor.preprocess("BEGIN\n\n  NULL;\n\n\nEND;");

        List<SourceLine> lines = source.getLines();
        assertEquals(3, lines.size());
        assertEquals(1, lines.get(0).getLineNumber());
        assertEquals(3, lines.get(1).getLineNumber());
        assertEquals(6, lines.get(2).getLineNumber());
        assertEquals(6, source.getPhysicalLineCount());
    }

    @Test
    void commentOnlyLinesDisappearButKeepTheirNumber() {
        PreprocessedSource source = Preprocessor.preprocess("-- audit trigger\nBEGIN\n  /* nothing\n yet */\n  NULL;\nEND;");

        assertEquals(List.of(2, 5, 6), source.getLines().stream().map(SourceLine::getLineNumber).toList());
        assertEquals(List.of("audit trigger", "nothing\n yet"), source.getComments());
    }

    @Test
    void textIsTrimmedAndIndentMeasured() {
        PreprocessedSource source = Preprocessor.preprocess("BEGIN\n    x := 1;   \n\tNULL;\nEND;");

        SourceLine assignment = source.getLines().get(1);
        assertEquals("x := 1;", assignment.getText());
        assertEquals(4, assignment.getIndent());
        assertEquals(Preprocessor.TAB_WIDTH, source.getLines().get(2).getIndent());
    }

    @Test
    void multiLineLiteralIsKeptVerbatim() {
        PreprocessedSource source = Preprocessor.preprocess(
                "BEGIN\n  v_msg := 'first  \n\n        indented second';\n  NULL;\nEND;");

        List<SourceLine> lines = source.getLines();
        assertEquals(4, lines.size());
        assertEquals("v_msg := 'first  \n\n        indented second';", lines.get(1).getText());
        assertEquals(2, lines.get(1).getLineNumber());
        assertEquals(5, lines.get(2).getLineNumber());
    }

    @Test
    void doubledQuoteDoesNotOpenLiteral() {
        PreprocessedSource source = Preprocessor.preprocess("BEGIN\n  x := 'it''s';\n\n  NULL;\nEND;");

        assertEquals(4, source.getLines().size());
        assertEquals("x := 'it''s';", source.getLines().get(1).getText());
    }

    @Test
    void nullInputIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Preprocessor.preprocess(null));
    }
}
