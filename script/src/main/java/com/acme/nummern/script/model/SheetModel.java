package com.acme.nummern.script.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

public record SheetModel(String id, String name, List<TableModel> tables) {
    public SheetModel {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        tables = List.copyOf(tables);
    }

    public SheetModel(String id, String name) {
        this(id, name, List.of());
    }

    public SheetModel withName(String newName) {
        return new SheetModel(id, newName, tables);
    }

    public SheetModel withTable(TableModel table) {
        List<TableModel> next = new ArrayList<>(tables);
        next.add(table);
        return new SheetModel(id, name, next);
    }

    public boolean hasTable(String tableId) {
        return tables.stream().anyMatch(t -> t.id().equals(tableId));
    }

    SheetModel updateTable(String tableId, UnaryOperator<TableModel> mutate) {
        List<TableModel> next = new ArrayList<>(tables.size());
        for (TableModel table : tables) {
            next.add(table.id().equals(tableId) ? mutate.apply(table) : table);
        }
        return new SheetModel(id, name, next);
    }
}
