package com.acme.nummern.script.command;

import com.acme.nummern.script.literal.LiteralEncoder;
import com.acme.nummern.script.model.ColumnDataType;
import com.acme.nummern.script.model.ModelIds;
import com.acme.nummern.script.model.ProjectModel;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/** Pins a body column's type; inference no longer touches that column. */
public record SetColumnTypeCommand(String commandId, Instant timestamp, String tableId, int column, ColumnDataType type)
    implements Command {

    public SetColumnTypeCommand {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(tableId, "tableId");
        Objects.requireNonNull(type, "type");
        if (column < 0) {
            throw new IllegalArgumentException("column must be non-negative");
        }
    }

    public SetColumnTypeCommand(String tableId, int column, ColumnDataType type) {
        this(ModelIds.make(), Instant.now(), tableId, column, type);
    }

    @Override
    public ProjectModel apply(ProjectModel project) {
        return project.updateTable(tableId, t -> {
            Map<Integer, ColumnDataType> types = new HashMap<>(t.columnTypes());
            Set<Integer> explicit = new HashSet<>(t.explicitColumnTypes());
            types.put(column, type);
            explicit.add(column);
            return t.withColumnTypes(types, explicit);
        });
    }

    @Override
    public String toScript() {
        return ScriptCalls.tableCall(tableId, "set_column_type", column + ", " + LiteralEncoder.encodeString(type.wireName()));
    }

    /** Only an explicit prior type can be restored. */
    @Override
    public Optional<Command> invert(ProjectModel previous) {
        return previous.table(tableId)
            .filter(t -> t.explicitColumnTypes().contains(column))
            .map(t -> new SetColumnTypeCommand(tableId, column, t.columnTypes().get(column)));
    }
}
