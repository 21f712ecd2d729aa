package com.acme.nummern.script.command;

import com.acme.nummern.script.model.ModelIds;
import com.acme.nummern.script.model.ProjectModel;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

public record InsertColsCommand(String commandId, Instant timestamp, String tableId, int at, int count)
    implements Command {

    public InsertColsCommand {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(tableId, "tableId");
        if (at < 0 || count < 0) {
            throw new IllegalArgumentException("at and count must be non-negative");
        }
    }

    public InsertColsCommand(String tableId, int at, int count) {
        this(ModelIds.make(), Instant.now(), tableId, at, count);
    }

    @Override
    public ProjectModel apply(ProjectModel project) {
        if (count == 0) {
            return project;
        }
        return project.updateTable(tableId, t -> t.withGridSpec(t.gridSpec().withBodyCols(t.gridSpec().bodyCols() + count)));
    }

    @Override
    public String toScript() {
        return count == 0 ? "" : ScriptCalls.tableCall(tableId, "insert_cols", "at=" + at + ", count=" + count);
    }

    @Override
    public Optional<Command> invert(ProjectModel previous) {
        if (count == 0) {
            return Optional.empty();
        }
        return previous.table(tableId).map(t -> new ResizeTableCommand(tableId, null, t.gridSpec().bodyCols()));
    }
}
