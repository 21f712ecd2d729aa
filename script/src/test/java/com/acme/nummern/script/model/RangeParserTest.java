package com.acme.nummern.script.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RangeParserTest {

    @Test
    void shouldDefaultBareReferenceToBody() throws Exception {
        RangeAddress address = RangeParser.parse("B3");
        assertEquals(GridRegion.BODY, address.region());
        assertEquals(new CellAddress(3, 1), address.start());
        assertTrue(address.isSingleCell());
        assertEquals("body[B3]", address.toWire());
    }

    @Test
    void shouldNormalizeReversedRange() throws Exception {
        RangeAddress address = RangeParser.parse("top_labels[C4:A1]");
        assertEquals(GridRegion.TOP_LABELS, address.region());
        assertEquals(new CellAddress(1, 0), address.start());
        assertEquals(new CellAddress(4, 2), address.end());
        assertEquals("top_labels[A1:C4]", address.toWire());
        assertEquals(4, address.rowCount());
        assertEquals(3, address.colCount());
    }

    @Test
    void shouldIgnoreAbsoluteMarkers() throws Exception {
        assertEquals(new CellAddress(2, 27), RangeParser.parseCell("$AB$2"));
    }

    @Test
    void shouldRoundTripColumnLabels() throws Exception {
        assertEquals("A", RangeParser.columnLabel(0));
        assertEquals("Z", RangeParser.columnLabel(25));
        assertEquals("AA", RangeParser.columnLabel(26));
        assertEquals(701, RangeParser.columnIndex("ZZ"));
        assertEquals("ZZ", RangeParser.columnLabel(701));
    }

    @Test
    void shouldRejectMalformedAddresses() {
        RangeParseException region = assertThrows(RangeParseException.class, () -> RangeParser.parse("middle[A0]"));
        assertEquals(RangeParseException.Reason.INVALID_REGION, region.reason());
        RangeParseException format = assertThrows(RangeParseException.class, () -> RangeParser.parse("body[A0:B1:C2]"));
        assertEquals(RangeParseException.Reason.INVALID_FORMAT, format.reason());
        RangeParseException cell = assertThrows(RangeParseException.class, () -> RangeParser.parse("body[0A]"));
        assertEquals(RangeParseException.Reason.INVALID_CELL_REFERENCE, cell.reason());
    }

    @Test
    void shouldDetectOverlapOnlyWithinOneRegion() throws Exception {
        RangeAddress block = RangeParser.parse("body[A0:B1]");
        assertTrue(block.overlaps(RangeParser.parse("body[B1:C5]")));
        assertFalse(block.overlaps(RangeParser.parse("body[C0]")));
        assertFalse(block.overlaps(RangeParser.parse("left_labels[A0]")));
    }
}
