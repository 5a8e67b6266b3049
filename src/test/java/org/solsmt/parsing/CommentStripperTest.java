package org.solsmt.parsing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CommentStripperTest {

    @Test
    @DisplayName("A whole-line comment disappears together with its newline")
    void testLeadingComment() {
        assertEquals("(exit)", CommentStripper.strip("; a comment\n(exit)"));
    }

    @Test
    @DisplayName("A comment at the end of the input without newline is removed")
    void testTrailingCommentWithoutNewline() {
        assertEquals("(check-sat) ", CommentStripper.strip("(check-sat) ; done"));
    }

    @Test
    @DisplayName("A comment inside a list is cut up to the newline")
    void testCommentInsideList() {
        assertEquals("(a  b)", CommentStripper.strip("(a ; note\n b)"));
    }

    @Test
    @DisplayName("Text without comments is copied unchanged")
    void testNoComment() {
        String text = "(declare-fun x () Real)\n\t(assert (> x 0.0))\r\n";
        assertEquals(text, CommentStripper.strip(text));
    }

    @Test
    void testOnlyComments() {
        assertEquals("", CommentStripper.strip(";one\n;two\n;three"));
        assertEquals("", CommentStripper.strip(""));
    }
}
