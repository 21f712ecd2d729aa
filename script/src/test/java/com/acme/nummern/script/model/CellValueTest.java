package com.acme.nummern.script.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CellValueTest {

    @Test
    void shouldParseUntypedInput() {
        assertTrue(CellValue.fromUserInput("   ").isEmpty());
        assertEquals(CellValue.bool(true), CellValue.fromUserInput("TRUE"));
        assertEquals(CellValue.number(2.5), CellValue.fromUserInput(" 2.5 "));
        assertEquals(CellValue.text("abc"), CellValue.fromUserInput("abc"));
    }

    @Test
    void shouldParseTypedColumns() {
        assertEquals(CellValue.date(LocalDate.of(2024, 1, 15)),
            CellValue.fromUserInput("2024-01-15", ColumnDataType.DATE, Locale.US));
        assertEquals(CellValue.time(3600.0 * 13 + 60 * 45 + 30),
            CellValue.fromUserInput("13:45:30", ColumnDataType.TIME, Locale.US));
        assertEquals(CellValue.number(0.25), CellValue.fromUserInput("25%", ColumnDataType.PERCENTAGE, Locale.US));
        assertInstanceOf(CellValue.TextValue.class, CellValue.fromUserInput("soon", ColumnDataType.DATE, Locale.US));
    }

    @Test
    void shouldRenderDisplayStrings() {
        assertEquals("3", CellValue.number(3.0).displayString());
        assertEquals("3.5", CellValue.number(3.5).displayString());
        assertEquals("FALSE", CellValue.bool(false).displayString());
        assertEquals("01:00:05", CellValue.time(3605).displayString());
        assertEquals("", CellValue.empty().displayString());
    }

    @Test
    void shouldAllocateSequentialIds() {
        assertEquals("table_3", ModelIds.nextTableId(List.of("table_1", "table_2", "table_x", "summary_9")));
        assertEquals("sheet_1", ModelIds.nextSheetId(List.of()));
        assertEquals("summary_10", ModelIds.nextSummaryId(List.of("summary_9")));
    }
}
