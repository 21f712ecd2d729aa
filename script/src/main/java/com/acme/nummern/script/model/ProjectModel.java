package com.acme.nummern.script.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Immutable project snapshot. Mutations return a new snapshot; the owner
 * replaces its reference wholesale after each apply.
 */
public record ProjectModel(List<SheetModel> sheets) {
    private static final ProjectModel EMPTY = new ProjectModel(List.of());

    public ProjectModel {
        sheets = List.copyOf(sheets);
    }

    public static ProjectModel empty() {
        return EMPTY;
    }

    public ProjectModel withSheet(SheetModel sheet) {
        List<SheetModel> next = new ArrayList<>(sheets);
        next.add(sheet);
        return new ProjectModel(next);
    }

    /** Applies {@code mutate} to the sheet with {@code sheetId}; unknown ids leave the snapshot unchanged. */
    public ProjectModel updateSheet(String sheetId, UnaryOperator<SheetModel> mutate) {
        List<SheetModel> next = new ArrayList<>(sheets.size());
        for (SheetModel sheet : sheets) {
            next.add(sheet.id().equals(sheetId) ? mutate.apply(sheet) : sheet);
        }
        return new ProjectModel(next);
    }

    /** Applies {@code mutate} to the table with {@code tableId}; unknown ids leave the snapshot unchanged. */
    public ProjectModel updateTable(String tableId, UnaryOperator<TableModel> mutate) {
        List<SheetModel> next = new ArrayList<>(sheets.size());
        for (SheetModel sheet : sheets) {
            next.add(sheet.hasTable(tableId) ? sheet.updateTable(tableId, mutate) : sheet);
        }
        return new ProjectModel(next);
    }

    public Optional<SheetModel> sheet(String sheetId) {
        return sheets.stream().filter(s -> s.id().equals(sheetId)).findFirst();
    }

    public Optional<TableModel> table(String tableId) {
        for (SheetModel sheet : sheets) {
            for (TableModel table : sheet.tables()) {
                if (table.id().equals(tableId)) {
                    return Optional.of(table);
                }
            }
        }
        return Optional.empty();
    }

    public List<String> tableIds() {
        List<String> out = new ArrayList<>();
        for (SheetModel sheet : sheets) {
            for (TableModel table : sheet.tables()) {
                out.add(table.id());
            }
        }
        return out;
    }

    public String nextSheetId() {
        return ModelIds.nextSheetId(sheets.stream().map(SheetModel::id).toList());
    }

    public String nextTableId() {
        return ModelIds.nextTableId(tableIds());
    }

    public String nextSummaryId() {
        return ModelIds.nextSummaryId(tableIds());
    }
}
