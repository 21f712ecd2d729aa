package com.acme.nummern.script.command;

import com.acme.nummern.script.literal.LiteralEncoder;
import com.acme.nummern.script.model.CellAddress;
import com.acme.nummern.script.model.CellValue;
import com.acme.nummern.script.model.ModelIds;
import com.acme.nummern.script.model.ProjectModel;
import com.acme.nummern.script.model.RangeAddress;
import com.acme.nummern.script.model.RangeValue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Rectangular write anchored at {@code start}. Ragged rows are padded with
 * empties. Without a dtype it renders like a cell write; with one it renders
 * a single {@code set_range} call.
 */
public record SetRangeCommand(
    String commandId,
    Instant timestamp,
    String tableId,
    String start,
    List<List<CellValue>> values,
    String dtype
) implements Command {

    public SetRangeCommand {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(tableId, "tableId");
        Objects.requireNonNull(values, "values");
        RangeAddress anchor = ScriptCalls.address(Objects.requireNonNull(start, "start"));
        start = RangeAddress.single(anchor.region(), anchor.start().row(), anchor.start().col()).toWire();
        values = pad(values);
    }

    public SetRangeCommand(String tableId, String start, List<List<CellValue>> values, String dtype) {
        this(ModelIds.make(), Instant.now(), tableId, start, values, dtype);
    }

    /** Covered range; empty when there are no values. */
    public Optional<RangeAddress> range() {
        if (values.isEmpty() || values.get(0).isEmpty()) {
            return Optional.empty();
        }
        RangeAddress anchor = ScriptCalls.address(start);
        CellAddress topLeft = anchor.start();
        CellAddress bottomRight = new CellAddress(topLeft.row() + values.size() - 1, topLeft.col() + values.get(0).size() - 1);
        return Optional.of(new RangeAddress(anchor.region(), topLeft, bottomRight));
    }

    /** Row-major cell map of the padded block. */
    public TreeMap<String, CellValue> toCells() {
        TreeMap<String, CellValue> cells = new TreeMap<>();
        Optional<RangeAddress> range = range();
        if (range.isEmpty()) {
            return cells;
        }
        RangeAddress r = range.get();
        for (int i = 0; i < values.size(); i++) {
            List<CellValue> row = values.get(i);
            for (int j = 0; j < row.size(); j++) {
                cells.put(RangeAddress.single(r.region(), r.start().row() + i, r.start().col() + j).toWire(), row.get(j));
            }
        }
        return cells;
    }

    @Override
    public ProjectModel apply(ProjectModel project) {
        Optional<RangeAddress> range = range();
        if (range.isEmpty()) {
            return project;
        }
        return project.updateTable(tableId, t -> {
            Map<String, RangeValue> ranges = new HashMap<>(t.rangeValues());
            ranges.put(range.get().toWire(), new RangeValue(values, dtype));
            return CellWrites.write(t, toCells()).withRangeValues(ranges);
        });
    }

    @Override
    public String toScript() {
        Optional<RangeAddress> range = range();
        if (range.isEmpty()) {
            return "";
        }
        if (dtype == null || dtype.isBlank()) {
            return SetCellsCommand.render(tableId, toCells());
        }
        return ScriptCalls.tableCall(tableId, "set_range",
            LiteralEncoder.encodeString(range.get().toWire()) + ", " + LiteralEncoder.encode2D(values)
                + ", dtype=" + LiteralEncoder.encodeString(dtype));
    }

    @Override
    public Optional<Command> invert(ProjectModel previous) {
        if (range().isEmpty()) {
            return Optional.empty();
        }
        return CellWrites.restore(previous, tableId, toCells().keySet());
    }

    private static List<List<CellValue>> pad(List<List<CellValue>> rows) {
        int width = 0;
        for (List<CellValue> row : rows) {
            width = Math.max(width, row.size());
        }
        List<List<CellValue>> out = new ArrayList<>(rows.size());
        for (List<CellValue> row : rows) {
            List<CellValue> padded = new ArrayList<>(width);
            for (CellValue v : row) {
                padded.add(v == null ? CellValue.empty() : v);
            }
            while (padded.size() < width) {
                padded.add(CellValue.empty());
            }
            out.add(List.copyOf(padded));
        }
        return List.copyOf(out);
    }
}
