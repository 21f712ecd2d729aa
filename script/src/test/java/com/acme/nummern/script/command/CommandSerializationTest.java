package com.acme.nummern.script.command;

import com.acme.nummern.script.model.CellValue;
import com.acme.nummern.script.model.ColumnDataType;
import com.acme.nummern.script.model.LabelBands;
import com.acme.nummern.script.model.ProjectModel;
import com.acme.nummern.script.model.Rect;
import com.acme.nummern.script.model.SummaryAggregation;
import com.acme.nummern.script.model.SummarySpec;
import com.acme.nummern.script.model.SummaryValueSpec;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandSerializationTest {

    @Test
    void shouldRenderCreationCalls() {
        assertEquals("proj.add_sheet('Sheet 1', sheet_id='sheet_1')", new AddSheetCommand("sheet_1", "Sheet 1").toScript());
        assertEquals("proj.add_table('sheet_1', table_id='table_1', name='table_1', rect=Rect(0, 0, 120, 80), rows=3, cols=2, "
                + "labels=dict(top=0, left=0, bottom=0, right=0))",
            new AddTableCommand("sheet_1", "table_1", new Rect(0, 0, 120, 80), 3, 2, LabelBands.ZERO).toScript());
        assertEquals("proj.rename_sheet('sheet_1', name='Budget')", new RenameSheetCommand("sheet_1", "Budget").toScript());
    }

    @Test
    void shouldKeepMoveAndResizeApart() {
        assertEquals("proj.table('table_1').set_position(x=50, y=60)", new MoveTableCommand("table_1", 50, 60).toScript());
        assertEquals("proj.table('table_1').resize(rows=5)", new ResizeTableCommand("table_1", 5, null).toScript());
        assertEquals("proj.table('table_1').resize(rows=5, cols=4)", new ResizeTableCommand("table_1", 5, 4).toScript());
        assertTrue(new ResizeTableCommand("table_1", null, null).isNoOp());
    }

    @Test
    void shouldRenderTableCalls() {
        assertEquals("proj.table('table_1').set_labels(top=1, left=0, bottom=0, right=0)",
            new SetLabelBandsCommand("table_1", new LabelBands(1, 0, 0, 0)).toScript());
        assertEquals("proj.table('t').insert_rows(at=2, count=1)", new InsertRowsCommand("t", 2, 1).toScript());
        assertEquals("proj.table('t').insert_cols(at=0, count=3)", new InsertColsCommand("t", 0, 3).toScript());
        assertEquals("proj.table('t').set_column_type(1, 'currency')",
            new SetColumnTypeCommand("t", 1, ColumnDataType.CURRENCY).toScript());
    }

    @Test
    void shouldRenderCellMapsSortedByKey() {
        Map<String, CellValue> cells = new LinkedHashMap<>();
        cells.put("top_labels[A0]", CellValue.text("Name"));
        cells.put("B0", CellValue.number(2));
        cells.put("body[A0]", CellValue.date(LocalDate.of(2024, 1, 15)));
        String expected = String.join("\n",
            "t = proj.table('table_1')",
            "with table_context(t):",
            "    a0 = date.fromisoformat('2024-01-15')",
            "    b0 = 2",
            "with label_context(t, 'top_labels'):",
            "    a0 = 'Name'");
        assertEquals(expected, new SetCellsCommand("table_1", cells).toScript());

        Map<String, CellValue> reversed = new HashMap<>(cells);
        assertEquals(expected, new SetCellsCommand("table_1", reversed).toScript());
    }

    @Test
    void shouldRejectRangeKeysInCellWrites() {
        assertThrows(IllegalArgumentException.class,
            () -> new SetCellsCommand("table_1", Map.of("body[A0:B1]", CellValue.number(1))));
        assertThrows(IllegalArgumentException.class,
            () -> new SetCellsCommand("table_1", Map.of("nowhere[A0]", CellValue.number(1))));
    }

    @Test
    void shouldRenderRangesAsCellsOrTypedCall() {
        List<List<CellValue>> values = List.of(
            List.of(CellValue.number(1), CellValue.number(2)),
            List.of(CellValue.number(3)));
        assertEquals(String.join("\n",
                "t = proj.table('t')",
                "with table_context(t):",
                "    a0 = 1",
                "    a1 = 3",
                "    b0 = 2",
                "    b1 = None"),
            new SetRangeCommand("t", "body[A0]", values, null).toScript());
        assertEquals("proj.table('t').set_range('body[A0:B1]', [[1, 2], [3, None]], dtype='float64')",
            new SetRangeCommand("t", "A0", values, "float64").toScript());
    }

    @Test
    void shouldRenderFormulaCommands() {
        assertEquals(String.join("\n",
                "t = proj.table('table_1')",
                "with table_context(t):",
                "    c0 = c_sum('a0:b1')"),
            new SetFormulaCommand("table_1", "C0", "=SUM(A0:B1)").toScript());
        assertEquals("proj.table('t').set_formula('body[C0:C3]', '=A0+B0')",
            new SetFormulaCommand("t", "body[C0:C3]", "=A0+B0").toScript());
        assertEquals("proj.table('t').clear_formula('body[C0]')", new SetFormulaCommand("t", "body[C0]", " ").toScript());
    }

    @Test
    void shouldRenderSummaryTable() {
        SummarySpec spec = new SummarySpec("table_1", List.of(0), List.of(new SummaryValueSpec(1, SummaryAggregation.SUM)));
        assertEquals("proj.add_summary_table('sheet_1', table_id='summary_1', name='summary_1', source_table_id='table_1', "
                + "group_by=['A'], values=[dict(col='B', agg='sum')], x=80, y=80)",
            new CreateSummaryTableCommand("sheet_1", "summary_1", spec, 80, 80).toScript());
    }

    @Test
    void shouldSuppressMinimizeOfBlankTable() {
        ProjectModel project = new AddTableCommand("sheet_1", "table_1", Rect.ZERO, 3, 2, LabelBands.ZERO)
            .apply(new AddSheetCommand("sheet_1", "Sheet 1").apply(ProjectModel.empty()));
        assertTrue(MinimizeTableCommand.of(project, "table_1").isNoOp());
        assertTrue(MinimizeTableCommand.of(project, "missing").isNoOp());
    }

    @Test
    void shouldJoinBatchChildrenInOrder() {
        CommandBatch batch = new CommandBatch(List.of(
            new MoveTableCommand("t", 1, 2),
            new ResizeTableCommand("t", null, null),
            new InsertRowsCommand("t", 0, 1)));
        assertEquals("proj.table('t').set_position(x=1, y=2)\nproj.table('t').insert_rows(at=0, count=1)", batch.toScript());
    }
}
