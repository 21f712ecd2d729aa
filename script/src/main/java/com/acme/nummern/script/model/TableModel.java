package com.acme.nummern.script.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable table snapshot. Cell, range and formula maps are keyed by wire
 * addresses ({@code body[A0]}, {@code body[A0:B1]}) and kept in key order.
 */
public record TableModel(
    String id,
    String name,
    Rect rect,
    GridSpec gridSpec,
    Map<String, CellValue> cellValues,
    Map<String, RangeValue> rangeValues,
    Map<String, FormulaSpec> formulas,
    Map<Integer, ColumnDataType> columnTypes,
    Set<Integer> explicitColumnTypes,
    SummarySpec summarySpec
) {
    public TableModel {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(rect, "rect");
        Objects.requireNonNull(gridSpec, "gridSpec");
        cellValues = Collections.unmodifiableMap(new TreeMap<>(cellValues));
        rangeValues = Collections.unmodifiableMap(new TreeMap<>(rangeValues));
        formulas = Collections.unmodifiableMap(new TreeMap<>(formulas));
        columnTypes = Collections.unmodifiableMap(new TreeMap<>(columnTypes));
        explicitColumnTypes = Collections.unmodifiableSet(new TreeSet<>(explicitColumnTypes));
    }

    public static TableModel create(String id, String name, Rect rect, int rows, int cols, LabelBands labels) {
        return new TableModel(id, name, rect, new GridSpec(rows, cols, labels),
            Map.of(), Map.of(), Map.of(), Map.of(), Set.of(), null);
    }

    public TableModel withName(String newName) {
        return new TableModel(id, newName, rect, gridSpec, cellValues, rangeValues, formulas,
            columnTypes, explicitColumnTypes, summarySpec);
    }

    public TableModel withRect(Rect newRect) {
        return new TableModel(id, name, newRect, gridSpec, cellValues, rangeValues, formulas,
            columnTypes, explicitColumnTypes, summarySpec);
    }

    public TableModel withGridSpec(GridSpec newGridSpec) {
        return new TableModel(id, name, rect, newGridSpec, cellValues, rangeValues, formulas,
            columnTypes, explicitColumnTypes, summarySpec);
    }

    public TableModel withCellValues(Map<String, CellValue> newCellValues) {
        return new TableModel(id, name, rect, gridSpec, newCellValues, rangeValues, formulas,
            columnTypes, explicitColumnTypes, summarySpec);
    }

    public TableModel withRangeValues(Map<String, RangeValue> newRangeValues) {
        return new TableModel(id, name, rect, gridSpec, cellValues, newRangeValues, formulas,
            columnTypes, explicitColumnTypes, summarySpec);
    }

    public TableModel withFormulas(Map<String, FormulaSpec> newFormulas) {
        return new TableModel(id, name, rect, gridSpec, cellValues, rangeValues, newFormulas,
            columnTypes, explicitColumnTypes, summarySpec);
    }

    public TableModel withColumnTypes(Map<Integer, ColumnDataType> newTypes, Set<Integer> newExplicit) {
        return new TableModel(id, name, rect, gridSpec, cellValues, rangeValues, formulas,
            newTypes, newExplicit, summarySpec);
    }

    public TableModel withSummarySpec(SummarySpec newSummarySpec) {
        return new TableModel(id, name, rect, gridSpec, cellValues, rangeValues, formulas,
            columnTypes, explicitColumnTypes, newSummarySpec);
    }

    public CellValue cellValue(String address) {
        CellValue value = cellValues.get(address);
        return value == null ? CellValue.empty() : value;
    }

    /** True when no cell holds a value and no formula is set. */
    public boolean isBlank() {
        return formulas.isEmpty() && cellValues.values().stream().allMatch(CellValue::isEmpty);
    }

    /**
     * Smallest body footprint (rows, cols) that still covers every non-empty
     * body value and every body formula target; at least 1x1.
     */
    public int[] usedBodyExtent() {
        int rows = 1;
        int cols = 1;
        for (Map.Entry<String, CellValue> e : cellValues.entrySet()) {
            if (e.getValue().isEmpty()) {
                continue;
            }
            RangeAddress range = parseOrNull(e.getKey());
            if (range != null && range.region() == GridRegion.BODY) {
                rows = Math.max(rows, range.end().row() + 1);
                cols = Math.max(cols, range.end().col() + 1);
            }
        }
        for (String target : formulas.keySet()) {
            RangeAddress range = parseOrNull(target);
            if (range != null && range.region() == GridRegion.BODY) {
                rows = Math.max(rows, range.end().row() + 1);
                cols = Math.max(cols, range.end().col() + 1);
            }
        }
        return new int[]{rows, cols};
    }

    private static RangeAddress parseOrNull(String address) {
        try {
            return RangeParser.parse(address);
        } catch (RangeParseException e) {
            return null;
        }
    }
}
