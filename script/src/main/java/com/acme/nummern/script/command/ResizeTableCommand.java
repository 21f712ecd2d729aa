package com.acme.nummern.script.command;

import com.acme.nummern.script.model.GridSpec;
import com.acme.nummern.script.model.ModelIds;
import com.acme.nummern.script.model.ProjectModel;
import com.acme.nummern.script.model.TableModel;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Body resize. A {@code null} dimension is unchanged and is left out of the
 * rendered call.
 */
public record ResizeTableCommand(String commandId, Instant timestamp, String tableId, Integer rows, Integer cols)
    implements Command {

    public ResizeTableCommand {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(tableId, "tableId");
        if ((rows != null && rows < 0) || (cols != null && cols < 0)) {
            throw new IllegalArgumentException("rows and cols must be non-negative");
        }
    }

    public ResizeTableCommand(String tableId, Integer rows, Integer cols) {
        this(ModelIds.make(), Instant.now(), tableId, rows, cols);
    }

    /** Keeps only the dimensions that differ from {@code current}. */
    public static ResizeTableCommand between(TableModel current, int rows, int cols) {
        GridSpec spec = current.gridSpec();
        return new ResizeTableCommand(current.id(),
            spec.bodyRows() == rows ? null : rows,
            spec.bodyCols() == cols ? null : cols);
    }

    @Override
    public ProjectModel apply(ProjectModel project) {
        return project.updateTable(tableId, t -> {
            GridSpec spec = t.gridSpec();
            if (rows != null) {
                spec = spec.withBodyRows(rows);
            }
            if (cols != null) {
                spec = spec.withBodyCols(cols);
            }
            return t.withGridSpec(spec);
        });
    }

    @Override
    public String toScript() {
        List<String> args = new ArrayList<>(2);
        if (rows != null) {
            args.add("rows=" + rows);
        }
        if (cols != null) {
            args.add("cols=" + cols);
        }
        if (args.isEmpty()) {
            return "";
        }
        return ScriptCalls.tableCall(tableId, "resize", String.join(", ", args));
    }

    @Override
    public Optional<Command> invert(ProjectModel previous) {
        return previous.table(tableId).map(t -> new ResizeTableCommand(tableId,
            rows == null ? null : t.gridSpec().bodyRows(),
            cols == null ? null : t.gridSpec().bodyCols()));
    }
}
