package com.acme.nummern.script.command;

import com.acme.nummern.script.literal.LiteralEncoder;
import com.acme.nummern.script.model.ModelIds;
import com.acme.nummern.script.model.ProjectModel;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/** Position-only change. Size changes go through {@link ResizeTableCommand}. */
public record MoveTableCommand(String commandId, Instant timestamp, String tableId, double x, double y) implements Command {
    public MoveTableCommand {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(tableId, "tableId");
    }

    public MoveTableCommand(String tableId, double x, double y) {
        this(ModelIds.make(), Instant.now(), tableId, x, y);
    }

    @Override
    public ProjectModel apply(ProjectModel project) {
        return project.updateTable(tableId, t -> t.withRect(t.rect().withPosition(x, y)));
    }

    @Override
    public String toScript() {
        return ScriptCalls.tableCall(tableId, "set_position",
            "x=" + LiteralEncoder.encodeNumber(x) + ", y=" + LiteralEncoder.encodeNumber(y));
    }

    @Override
    public Optional<Command> invert(ProjectModel previous) {
        return previous.table(tableId).map(t -> new MoveTableCommand(tableId, t.rect().x(), t.rect().y()));
    }
}
