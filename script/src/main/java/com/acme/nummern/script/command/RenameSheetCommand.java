package com.acme.nummern.script.command;

import com.acme.nummern.script.literal.LiteralEncoder;
import com.acme.nummern.script.model.ModelIds;
import com.acme.nummern.script.model.ProjectModel;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

public record RenameSheetCommand(String commandId, Instant timestamp, String sheetId, String name) implements Command {
    public RenameSheetCommand {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(sheetId, "sheetId");
        Objects.requireNonNull(name, "name");
    }

    public RenameSheetCommand(String sheetId, String name) {
        this(ModelIds.make(), Instant.now(), sheetId, name);
    }

    @Override
    public ProjectModel apply(ProjectModel project) {
        return project.updateSheet(sheetId, s -> s.withName(name));
    }

    @Override
    public String toScript() {
        return "proj.rename_sheet(" + LiteralEncoder.encodeString(sheetId) + ", name=" + LiteralEncoder.encodeString(name) + ")";
    }

    @Override
    public Optional<Command> invert(ProjectModel previous) {
        return previous.sheet(sheetId).map(s -> new RenameSheetCommand(sheetId, s.name()));
    }
}
