package me.christianrobert.trigconv.core.tools;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for CodeCleaner.removeComments()
 *
 * Purpose: comments must vanish without shifting line numbers, and comment syntax
 * inside literals must survive.
 */
class CodeCleanerTest {

    // ========== Basic Comment Removal ==========

    @Test
    void removeComments_singleLineComment() {
        CleanedCode cleaned = CodeCleaner.removeComments("x := 1; -- set x\ny := 2;");
        assertEquals("x := 1; \ny := 2;", cleaned.getCode());
        assertEquals(List.of("set x"), cleaned.getComments());
    }

    @Test
    void removeComments_multiLineComment() {
        CleanedCode cleaned = CodeCleaner.removeComments("SELECT /* comment */ * FROM emp;");
        assertEquals("SELECT  * FROM emp;", cleaned.getCode());
        assertEquals(List.of("comment"), cleaned.getComments());
    }

    @Test
    void removeComments_multiLineCommentKeepsLineBreaks() {
        String input = "SELECT /*\n  This comment\n  spans lines\n*/ * FROM emp;";
        String actual = CodeCleaner.removeComments(input).getCode();
        assertEquals("SELECT \n\n\n * FROM emp;", actual, "Line breaks inside the comment must be kept");
        assertEquals(input.split("\n").length, actual.split("\n").length);
    }

    @Test
    void removeComments_commentsCollectedInOrder() {
        CleanedCode cleaned = CodeCleaner.removeComments("-- first\nBEGIN /* second */ NULL; END; -- third");
        assertEquals(List.of("first", "second", "third"), cleaned.getComments());
    }

    @Test
    void removeComments_emptyCommentNotCollected() {
        CleanedCode cleaned = CodeCleaner.removeComments("NULL; --\nNULL;");
        assertTrue(cleaned.getComments().isEmpty());
    }

    // ========== String Literal Preservation ==========

    @Test
    void removeComments_stringWithCommentSyntax() {
        String input = "v := 'Value with -- fake /* comment */';";
        assertEquals(input, CodeCleaner.removeComments(input).getCode());
    }

    @Test
    void removeComments_stringWithEscapedQuote() {
        String input = "v := 'O''Reilly -- still text'; -- comment";
        assertEquals("v := 'O''Reilly -- still text'; ", CodeCleaner.removeComments(input).getCode());
    }

    @Test
    void removeComments_quotedIdentifierWithCommentSyntax() {
        String input = "SELECT \"a--b\" FROM t;";
        assertEquals(input, CodeCleaner.removeComments(input).getCode());
    }

    // ========== Edge Cases ==========

    @Test
    void removeComments_unterminatedMultiLineComment() {
        CleanedCode cleaned = CodeCleaner.removeComments("NULL; /* never closed");
        assertEquals("NULL; ", cleaned.getCode());
        assertEquals(List.of("never closed"), cleaned.getComments());
    }

    @Test
    void removeComments_windowsLineEndings() {
        CleanedCode cleaned = CodeCleaner.removeComments("a; -- c\r\nb;");
        assertEquals("a; \nb;", cleaned.getCode());
        assertEquals(List.of("c"), cleaned.getComments());
    }
}
