package com.acme.nummern.script.command;

import com.acme.nummern.script.literal.LiteralEncoder;
import com.acme.nummern.script.model.LabelBands;
import com.acme.nummern.script.model.ModelIds;
import com.acme.nummern.script.model.ProjectModel;
import com.acme.nummern.script.model.Rect;
import com.acme.nummern.script.model.TableModel;

import java.time.Instant;
import java.util.Objects;

public record AddTableCommand(
    String commandId,
    Instant timestamp,
    String sheetId,
    String tableId,
    String name,
    Rect rect,
    int rows,
    int cols,
    LabelBands labels
) implements Command {
    public AddTableCommand {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(sheetId, "sheetId");
        Objects.requireNonNull(tableId, "tableId");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(rect, "rect");
        Objects.requireNonNull(labels, "labels");
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("rows and cols must be non-negative");
        }
    }

    public AddTableCommand(String sheetId, String tableId, Rect rect, int rows, int cols, LabelBands labels) {
        this(ModelIds.make(), Instant.now(), sheetId, tableId, tableId, rect, rows, cols, labels);
    }

    @Override
    public ProjectModel apply(ProjectModel project) {
        if (project.table(tableId).isPresent()) {
            return project;
        }
        return project.updateSheet(sheetId, s -> s.withTable(TableModel.create(tableId, name, rect, rows, cols, labels)));
    }

    @Override
    public String toScript() {
        return "proj.add_table(" + LiteralEncoder.encodeString(sheetId)
            + ", table_id=" + LiteralEncoder.encodeString(tableId)
            + ", name=" + LiteralEncoder.encodeString(name)
            + ", rect=" + LiteralEncoder.encodeRect(rect)
            + ", rows=" + rows
            + ", cols=" + cols
            + ", labels=" + LiteralEncoder.encodeLabels(labels) + ")";
    }
}
