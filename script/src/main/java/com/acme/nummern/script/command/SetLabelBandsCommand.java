package com.acme.nummern.script.command;

import com.acme.nummern.script.literal.LiteralEncoder;
import com.acme.nummern.script.model.LabelBands;
import com.acme.nummern.script.model.ModelIds;
import com.acme.nummern.script.model.ProjectModel;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

public record SetLabelBandsCommand(String commandId, Instant timestamp, String tableId, LabelBands bands)
    implements Command {

    public SetLabelBandsCommand {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(tableId, "tableId");
        Objects.requireNonNull(bands, "bands");
    }

    public SetLabelBandsCommand(String tableId, LabelBands bands) {
        this(ModelIds.make(), Instant.now(), tableId, bands);
    }

    @Override
    public ProjectModel apply(ProjectModel project) {
        return project.updateTable(tableId, t -> t.withGridSpec(t.gridSpec().withLabelBands(bands)));
    }

    @Override
    public String toScript() {
        return ScriptCalls.tableCall(tableId, "set_labels", LiteralEncoder.encodeLabelArgs(bands));
    }

    @Override
    public Optional<Command> invert(ProjectModel previous) {
        return previous.table(tableId).map(t -> new SetLabelBandsCommand(tableId, t.gridSpec().labelBands()));
    }
}
