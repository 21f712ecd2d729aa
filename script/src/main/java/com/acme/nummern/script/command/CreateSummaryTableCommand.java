package com.acme.nummern.script.command;

import com.acme.nummern.script.literal.LiteralEncoder;
import com.acme.nummern.script.model.LabelBands;
import com.acme.nummern.script.model.ModelIds;
import com.acme.nummern.script.model.ProjectModel;
import com.acme.nummern.script.model.Rect;
import com.acme.nummern.script.model.RangeParser;
import com.acme.nummern.script.model.SummarySpec;
import com.acme.nummern.script.model.SummaryValueSpec;
import com.acme.nummern.script.model.TableModel;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Derived table grouping {@code sourceTableId} by columns. The runtime fills
 * the body; locally the table starts with one header row and one body row.
 */
public record CreateSummaryTableCommand(
    String commandId,
    Instant timestamp,
    String sheetId,
    String tableId,
    String name,
    SummarySpec summary,
    double x,
    double y
) implements Command {

    public CreateSummaryTableCommand {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(sheetId, "sheetId");
        Objects.requireNonNull(tableId, "tableId");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(summary, "summary");
    }

    public CreateSummaryTableCommand(String sheetId, String tableId, SummarySpec summary, double x, double y) {
        this(ModelIds.make(), Instant.now(), sheetId, tableId, tableId, summary, x, y);
    }

    @Override
    public ProjectModel apply(ProjectModel project) {
        if (project.table(tableId).isPresent()) {
            return project;
        }
        int cols = Math.max(1, summary.groupBy().size() + summary.values().size());
        TableModel table = TableModel.create(tableId, name, new Rect(x, y, 0, 0), 1, cols, new LabelBands(1, 0, 0, 0))
            .withSummarySpec(summary);
        return project.updateSheet(sheetId, s -> s.withTable(table));
    }

    @Override
    public String toScript() {
        List<String> values = new ArrayList<>(summary.values().size());
        for (SummaryValueSpec value : summary.values()) {
            values.add("dict(col=" + LiteralEncoder.encodeString(RangeParser.columnLabel(value.column()))
                + ", agg=" + LiteralEncoder.encodeString(value.aggregation().wireName()) + ")");
        }
        return "proj.add_summary_table(" + LiteralEncoder.encodeString(sheetId)
            + ", table_id=" + LiteralEncoder.encodeString(tableId)
            + ", name=" + LiteralEncoder.encodeString(name)
            + ", source_table_id=" + LiteralEncoder.encodeString(summary.sourceTableId())
            + ", group_by=" + ScriptCalls.columnLetters(summary.groupBy())
            + ", values=[" + String.join(", ", values) + "]"
            + ", x=" + LiteralEncoder.encodeNumber(x)
            + ", y=" + LiteralEncoder.encodeNumber(y) + ")";
    }
}
