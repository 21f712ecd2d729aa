package com.acme.nummern.script.command;

import com.acme.nummern.script.model.ModelIds;
import com.acme.nummern.script.model.ProjectModel;
import com.acme.nummern.script.model.TableModel;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Shrinks the body to its used extent. The target footprint is fixed when the
 * command is built; a {@code null} footprint marks a no-op.
 */
public record MinimizeTableCommand(String commandId, Instant timestamp, String tableId, Integer rows, Integer cols)
    implements Command {

    public MinimizeTableCommand {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(tableId, "tableId");
        if ((rows == null) != (cols == null)) {
            throw new IllegalArgumentException("rows and cols must both be set or both be null");
        }
    }

    /**
     * Builds the command against the current snapshot. Missing, blank and
     * already-minimal tables yield a no-op.
     */
    public static MinimizeTableCommand of(ProjectModel project, String tableId) {
        Optional<TableModel> table = project.table(tableId);
        if (table.isEmpty() || table.get().isBlank()) {
            return new MinimizeTableCommand(ModelIds.make(), Instant.now(), tableId, null, null);
        }
        TableModel t = table.get();
        int[] extent = t.usedBodyExtent();
        if (extent[0] >= t.gridSpec().bodyRows() && extent[1] >= t.gridSpec().bodyCols()) {
            return new MinimizeTableCommand(ModelIds.make(), Instant.now(), tableId, null, null);
        }
        return new MinimizeTableCommand(ModelIds.make(), Instant.now(), tableId,
            Math.min(extent[0], t.gridSpec().bodyRows()), Math.min(extent[1], t.gridSpec().bodyCols()));
    }

    @Override
    public ProjectModel apply(ProjectModel project) {
        if (rows == null) {
            return project;
        }
        return project.updateTable(tableId, t -> t.withGridSpec(t.gridSpec().withBodyRows(rows).withBodyCols(cols)));
    }

    @Override
    public String toScript() {
        return rows == null ? "" : ScriptCalls.tableCall(tableId, "minimize", "");
    }

    @Override
    public Optional<Command> invert(ProjectModel previous) {
        if (rows == null) {
            return Optional.empty();
        }
        return previous.table(tableId)
            .map(t -> new ResizeTableCommand(tableId, t.gridSpec().bodyRows(), t.gridSpec().bodyCols()));
    }
}
