package com.acme.nummern.script.runtime;

import com.acme.nummern.script.model.CellValue;
import com.acme.nummern.script.model.ColumnDataType;
import com.acme.nummern.script.model.ProjectModel;
import com.acme.nummern.script.model.Rect;
import com.acme.nummern.script.model.TableModel;
import com.acme.nummern.script.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProjectSnapshotDecoderTest {
    private static final String SNAPSHOT = "{\"sheets\":[{\"id\":\"sheet_1\",\"name\":\"Budget\",\"tables\":[{"
        + "\"id\":\"table_1\",\"name\":\"Costs\","
        + "\"rect\":{\"x\":10,\"y\":20,\"width\":300,\"height\":120},"
        + "\"gridSpec\":{\"bodyRows\":4,\"bodyCols\":3,\"labelBands\":{\"topRows\":1,\"bottomRows\":0,\"leftCols\":0,\"rightCols\":0}},"
        + "\"cellValues\":{"
        + "\"body[A0]\":{\"type\":\"number\",\"value\":1.5},"
        + "\"body[B0]\":{\"type\":\"string\",\"value\":\"x\"},"
        + "\"body[C0]\":{\"type\":\"date\",\"value\":\"2024-01-15\"},"
        + "\"body[A1]\":{\"type\":\"time\",\"value\":\"13:45:30\"},"
        + "\"body[B1]\":{\"type\":\"number\",\"value\":\"nan\"},"
        + "\"body[C1]\":{\"type\":\"empty\"},"
        + "\"top_labels[A0]\":\"Amount\"},"
        + "\"rangeValues\":{\"body[A2:B3]\":{\"values\":[[1,2],[3,null]],\"dtype\":\"float64\"}},"
        + "\"formulas\":{\"body[C2]\":{\"formula\":\"=A2+B2\",\"mode\":\"cell\"},\"body[C3]\":\"=A3\"},"
        + "\"columnTypes\":{\"0\":\"currency\",\"1\":\"bogus\"}"
        + "}]}]}";

    private static ProjectModel decode(String json) throws JsonProcessingException {
        return ProjectSnapshotDecoder.decode(JsonCodec.readTree(json));
    }

    @Test
    void shouldDecodeFullTable() throws Exception {
        ProjectModel project = decode(SNAPSHOT);
        assertEquals("Budget", project.sheets().get(0).name());
        TableModel table = project.table("table_1").orElseThrow();

        assertEquals("Costs", table.name());
        assertEquals(new Rect(10, 20, 300, 120), table.rect());
        assertEquals(4, table.gridSpec().bodyRows());
        assertEquals(1, table.gridSpec().labelBands().topRows());

        assertEquals(CellValue.number(1.5), table.cellValues().get("body[A0]"));
        assertEquals(CellValue.text("x"), table.cellValues().get("body[B0]"));
        assertEquals(CellValue.date(LocalDate.of(2024, 1, 15)), table.cellValues().get("body[C0]"));
        assertEquals(CellValue.time(13 * 3600 + 45 * 60 + 30), table.cellValues().get("body[A1]"));
        CellValue.NumberValue nan = assertInstanceOf(CellValue.NumberValue.class, table.cellValues().get("body[B1]"));
        assertTrue(Double.isNaN(nan.value()));
        assertFalse(table.cellValues().containsKey("body[C1]"));
        assertEquals(CellValue.text("Amount"), table.cellValues().get("top_labels[A0]"));

        assertEquals(List.of(CellValue.number(3), CellValue.empty()), table.rangeValues().get("body[A2:B3]").values().get(1));
        assertEquals("float64", table.rangeValues().get("body[A2:B3]").dtype());
        assertEquals("=A2+B2", table.formulas().get("body[C2]").formula());
        assertEquals("=A3", table.formulas().get("body[C3]").formula());

        assertEquals(ColumnDataType.CURRENCY, table.columnTypes().get(0));
        assertFalse(table.columnTypes().containsKey(1));
        assertTrue(table.explicitColumnTypes().contains(0));
        assertNull(table.summarySpec());
    }

    @Test
    void shouldDecodeEmptyProject() throws Exception {
        assertTrue(decode("{\"sheets\":[]}").sheets().isEmpty());
    }

    @Test
    void shouldRejectMissingStructure() {
        assertThrows(IllegalArgumentException.class, () -> decode("{}"));
        assertThrows(IllegalArgumentException.class, () -> decode("{\"sheets\":[{\"name\":\"no id\"}]}"));
        assertThrows(IllegalArgumentException.class,
            () -> decode("{\"sheets\":[{\"id\":\"s\",\"tables\":[{\"id\":\"t\",\"cellValues\":{\"A0\":{\"type\":\"blob\"}}}]}]}"));
        assertThrows(IllegalArgumentException.class,
            () -> decode("{\"sheets\":[{\"id\":\"s\",\"tables\":[{\"id\":\"t\",\"cellValues\":{\"A0\":{\"type\":\"date\",\"value\":\"soon\"}}}]}]}"));
    }

    @Test
    void shouldAcceptBareScalars() throws Exception {
        assertEquals(CellValue.bool(true), ProjectSnapshotDecoder.decodeValue(JsonCodec.readTree("true")));
        assertEquals(CellValue.number(2), ProjectSnapshotDecoder.decodeValue(JsonCodec.readTree("2")));
        assertEquals(CellValue.empty(), ProjectSnapshotDecoder.decodeValue(JsonCodec.readTree("null")));
        assertEquals(CellValue.number(Double.NEGATIVE_INFINITY),
            ProjectSnapshotDecoder.decodeValue(JsonCodec.readTree("{\"type\":\"number\",\"value\":\"-inf\"}")));
    }
}
