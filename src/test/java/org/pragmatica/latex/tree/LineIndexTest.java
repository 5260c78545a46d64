package org.pragmatica.latex.tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LineIndexTest {

    @Test
    void locate_firstLine_usesOneBasedColumns() {
        var index = LineIndex.of("x^2");

        assertEquals(SourceLocation.at(1, 1, 0), index.locate(0));
        assertEquals(SourceLocation.at(1, 3, 2), index.locate(2));
    }

    @Test
    void locate_afterNewline_startsNextLine() {
        var index = LineIndex.of("a\nbc\n\nd");

        assertEquals(4, index.lineCount());
        assertEquals(SourceLocation.at(2, 1, 2), index.locate(2));
        assertEquals(SourceLocation.at(2, 3, 4), index.locate(4));
        assertEquals(SourceLocation.at(3, 1, 5), index.locate(5));
        assertEquals(SourceLocation.at(4, 1, 6), index.locate(6));
    }

    @Test
    void locate_endOfInput_isValidPosition() {
        var index = LineIndex.of("ab");

        assertEquals(SourceLocation.at(1, 3, 2), index.locate(2));
    }

    @Test
    void locate_outOfRange_isClamped() {
        var index = LineIndex.of("ab");

        assertEquals(0, index.locate(-5).offset());
        assertEquals(2, index.locate(99).offset());
    }

    @Test
    void locate_manyLines_growsTable() {
        var source = "x\n".repeat(100);
        var index = LineIndex.of(source);

        assertEquals(101, index.lineCount());
        assertEquals(SourceLocation.at(51, 1, 100), index.locate(100));
    }

    @Test
    void startAndEnd_resolveSpanBoundaries() {
        var index = LineIndex.of("a\nbcd");
        var span = SourceSpan.of(1, 4);

        assertEquals("1:2", index.start(span).toString());
        assertEquals("2:3", index.end(span).toString());
    }
}
