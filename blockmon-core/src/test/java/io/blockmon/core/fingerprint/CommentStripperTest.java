package io.blockmon.core.fingerprint;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CommentStripperTest {

    @Test
    void dropsLineComments() {
        assertEquals("int a = 1;\nint b = 2;\n",
                CommentStripper.strip("int a = 1;\n// note\nint b = 2;\n"));
    }

    @Test
    void dropsIndentedLineComments() {
        assertEquals("    return x;\n",
                CommentStripper.strip("    // explain\n    return x;\n"));
    }

    @Test
    void keepsCodeWithTrailingComment() {
        String line = "int a = 1; // trailing\n";
        assertEquals(line, CommentStripper.strip(line));
    }

    @Test
    void dropsMultiLineBlockComment() {
        String source = "/**\n * Docs.\n */\nvoid f() {}\n";
        assertEquals("void f() {}\n", CommentStripper.strip(source));
    }

    @Test
    void keepsLineWhereBlockCommentEndsBeforeCode() {
        String source = "/* a\n b */ int x;\n";
        assertEquals(" b */ int x;\n", CommentStripper.strip(source));
    }

    @Test
    void commentMarkersInsideStringsAreCode() {
        String source = "String s = \"/*\";\nint y = 2;\n";
        assertEquals(source, CommentStripper.strip(source));
    }

    @Test
    void commentMarkersInsideTextBlocksAreCode() {
        String source = "String s = \"\"\"\n    // not a comment\n    \"\"\";\n";
        assertEquals(source, CommentStripper.strip(source));
    }

    @Test
    void keepsBlankLines() {
        String source = "a();\n\nb();\n";
        assertEquals(source, CommentStripper.strip(source));
    }

    @Test
    void lastLineWithoutNewline() {
        assertEquals("x();\n", CommentStripper.strip("x();\n// end"));
        assertEquals("", CommentStripper.strip(""));
    }
}
