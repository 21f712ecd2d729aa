package com.acme.nummern.script.command;

import com.acme.nummern.script.model.CellAddress;
import com.acme.nummern.script.model.CellValue;
import com.acme.nummern.script.model.ColumnDataType;
import com.acme.nummern.script.model.FormulaSpec;
import com.acme.nummern.script.model.GridRegion;
import com.acme.nummern.script.model.ProjectModel;
import com.acme.nummern.script.model.RangeAddress;
import com.acme.nummern.script.model.TableModel;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/** Value-write rules shared by cell and range commands. */
final class CellWrites {
    private CellWrites() {
    }

    /**
     * Stores {@code cells} (single-cell wire keys) and drops every formula whose
     * target overlaps a written cell. Empty values remove the entry.
     */
    static TableModel write(TableModel table, Map<String, CellValue> cells) {
        Map<String, CellValue> values = new HashMap<>(table.cellValues());
        Map<String, FormulaSpec> formulas = new HashMap<>(table.formulas());
        for (Map.Entry<String, CellValue> e : cells.entrySet()) {
            RangeAddress written = ScriptCalls.address(e.getKey());
            formulas.keySet().removeIf(target -> ScriptCalls.address(target).overlaps(written));
            if (e.getValue().isEmpty()) {
                values.remove(e.getKey());
            } else {
                values.put(e.getKey(), e.getValue());
            }
        }
        return table.withCellValues(values).withFormulas(formulas);
    }

    /**
     * Infers body column types from written values. Explicitly typed columns
     * keep their type; a STRING column stays STRING when a number arrives.
     */
    static TableModel inferColumnTypes(TableModel table, Map<String, CellValue> cells) {
        Map<Integer, ColumnDataType> types = new HashMap<>(table.columnTypes());
        for (Map.Entry<String, CellValue> e : cells.entrySet()) {
            RangeAddress address = ScriptCalls.address(e.getKey());
            int col = address.start().col();
            if (address.region() != GridRegion.BODY || table.explicitColumnTypes().contains(col)) {
                continue;
            }
            CellValue value = e.getValue();
            if (value instanceof CellValue.NumberValue) {
                if (types.get(col) != ColumnDataType.STRING) {
                    types.put(col, ColumnDataType.NUMBER);
                }
            } else if (value instanceof CellValue.TextValue) {
                types.put(col, ColumnDataType.STRING);
            }
        }
        return table.withColumnTypes(types, table.explicitColumnTypes());
    }

    /**
     * Inverse of a value write: prior values for {@code keys}, then any formula
     * the write removed.
     */
    static Optional<Command> restore(ProjectModel previous, String tableId, Iterable<String> keys) {
        Optional<TableModel> before = previous.table(tableId);
        if (before.isEmpty()) {
            return Optional.empty();
        }
        TableModel table = before.get();
        Map<String, CellValue> prior = new TreeMap<>();
        List<RangeAddress> written = new ArrayList<>();
        for (String key : keys) {
            prior.put(key, table.cellValue(key));
            written.add(ScriptCalls.address(key));
        }
        List<Command> steps = new ArrayList<>();
        steps.add(new SetCellsCommand(tableId, prior));
        for (Map.Entry<String, FormulaSpec> f : table.formulas().entrySet()) {
            RangeAddress target = ScriptCalls.address(f.getKey());
            if (written.stream().anyMatch(target::overlaps)) {
                steps.add(new SetFormulaCommand(tableId, f.getKey(), f.getValue().formula()));
            }
        }
        return Optional.of(steps.size() == 1 ? steps.get(0) : new CommandBatch(steps));
    }

    static Map<String, CellValue> priorValues(TableModel table, RangeAddress range) {
        Map<String, CellValue> prior = new TreeMap<>();
        for (CellAddress cell : range.cells()) {
            String key = RangeAddress.single(range.region(), cell.row(), cell.col()).toWire();
            CellValue value = table.cellValue(key);
            if (!value.isEmpty()) {
                prior.put(key, value);
            }
        }
        return prior;
    }
}
