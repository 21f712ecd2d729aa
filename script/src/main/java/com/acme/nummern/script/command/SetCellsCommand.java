package com.acme.nummern.script.command;

import com.acme.nummern.script.literal.Identifiers;
import com.acme.nummern.script.literal.LiteralEncoder;
import com.acme.nummern.script.model.CellValue;
import com.acme.nummern.script.model.GridRegion;
import com.acme.nummern.script.model.ModelIds;
import com.acme.nummern.script.model.ProjectModel;
import com.acme.nummern.script.model.RangeAddress;
import com.acme.nummern.script.model.RangeParser;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Multi-cell write. Keys are canonical single-cell addresses
 * ({@code body[A0]}, {@code top_labels[B0]}) held in sorted order, so
 * rendering does not depend on the caller's map.
 */
public record SetCellsCommand(String commandId, Instant timestamp, String tableId, SortedMap<String, CellValue> cells)
    implements Command {

    public SetCellsCommand {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(tableId, "tableId");
        Objects.requireNonNull(cells, "cells");
        cells = canonical(cells);
    }

    public SetCellsCommand(String tableId, Map<String, CellValue> cells) {
        this(ModelIds.make(), Instant.now(), tableId, new TreeMap<>(cells));
    }

    /** Folds {@code later} into this command; later values win per key. */
    public SetCellsCommand mergedWith(SetCellsCommand later) {
        if (!tableId.equals(later.tableId)) {
            throw new IllegalArgumentException("Cannot merge cell writes for " + tableId + " and " + later.tableId);
        }
        TreeMap<String, CellValue> merged = new TreeMap<>(cells);
        merged.putAll(later.cells);
        return new SetCellsCommand(commandId, later.timestamp, tableId, merged);
    }

    @Override
    public ProjectModel apply(ProjectModel project) {
        return project.updateTable(tableId, t -> CellWrites.inferColumnTypes(CellWrites.write(t, cells), cells));
    }

    @Override
    public String toScript() {
        return render(tableId, cells);
    }

    @Override
    public Optional<Command> invert(ProjectModel previous) {
        return CellWrites.restore(previous, tableId, cells.keySet());
    }

    /**
     * Alias line plus one context block per region, regions and keys in key
     * order. Empty when {@code cells} is empty.
     */
    static String render(String tableId, SortedMap<String, CellValue> cells) {
        if (cells.isEmpty()) {
            return "";
        }
        Map<GridRegion, List<String>> byRegion = new LinkedHashMap<>();
        for (Map.Entry<String, CellValue> e : cells.entrySet()) {
            RangeAddress address = ScriptCalls.address(e.getKey());
            String lhs = Identifiers.cellIdentifier(RangeParser.cellLabel(address.start().row(), address.start().col()));
            byRegion.computeIfAbsent(address.region(), r -> new ArrayList<>())
                .add("    " + lhs + " = " + LiteralEncoder.encode(e.getValue()));
        }
        List<String> lines = new ArrayList<>();
        lines.add("t = " + ScriptCalls.table(tableId));
        for (Map.Entry<GridRegion, List<String>> block : byRegion.entrySet()) {
            if (block.getKey() == GridRegion.BODY) {
                lines.add("with table_context(t):");
            } else {
                lines.add("with label_context(t, " + LiteralEncoder.encodeString(block.getKey().wireName()) + "):");
            }
            lines.addAll(block.getValue());
        }
        return ScriptCalls.lines(lines);
    }

    private static SortedMap<String, CellValue> canonical(Map<String, CellValue> raw) {
        TreeMap<String, CellValue> out = new TreeMap<>();
        for (Map.Entry<String, CellValue> e : raw.entrySet()) {
            RangeAddress address = ScriptCalls.address(e.getKey());
            if (!address.isSingleCell()) {
                throw new IllegalArgumentException("Cell write key must be a single cell: " + e.getKey());
            }
            out.put(address.toWire(), e.getValue() == null ? CellValue.empty() : e.getValue());
        }
        return Collections.unmodifiableSortedMap(out);
    }
}
