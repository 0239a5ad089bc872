package org.parsercraft.peg.tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LineIndexTest {

    @Test
    void locate_firstLine_countsColumnsFromOne() {
        var index = LineIndex.of("abc");

        assertEquals(SourceLocation.at(1, 1, 0), index.locate(0));
        assertEquals(SourceLocation.at(1, 4, 3), index.locate(3));
    }

    @Test
    void locate_afterNewline_startsNextLine() {
        var index = LineIndex.of("ab\ncd\n");

        assertEquals(SourceLocation.at(1, 3, 2), index.locate(2));
        assertEquals(SourceLocation.at(2, 1, 3), index.locate(3));
        assertEquals(SourceLocation.at(3, 1, 6), index.locate(6));
        assertEquals(3, index.lineCount());
    }

    @Test
    void locate_manyLines_growsIndex() {
        var index = LineIndex.of("x\n".repeat(100));

        assertEquals(101, index.lineCount());
        assertEquals(51, index.locate(100).line());
    }

    @Test
    void locate_outsideSource_throws() {
        var index = LineIndex.of("ab");

        assertThrows(IndexOutOfBoundsException.class, () -> index.locate(3));
        assertThrows(IndexOutOfBoundsException.class, () -> index.locate(-1));
    }

    @Test
    void span_coversBothEnds() {
        var span = LineIndex.of("ab\ncd").span(1, 4);

        assertEquals(3, span.length());
        assertEquals("b\nc", span.extract("ab\ncd"));
        assertTrue(span.contains(1));
        assertFalse(span.contains(4));
        assertEquals("1:2-2:2", span.toString());
    }
}
