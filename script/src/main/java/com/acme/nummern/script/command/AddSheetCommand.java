package com.acme.nummern.script.command;

import com.acme.nummern.script.literal.LiteralEncoder;
import com.acme.nummern.script.model.ModelIds;
import com.acme.nummern.script.model.ProjectModel;
import com.acme.nummern.script.model.SheetModel;

import java.time.Instant;
import java.util.Objects;

public record AddSheetCommand(String commandId, Instant timestamp, String sheetId, String name) implements Command {
    public AddSheetCommand {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(sheetId, "sheetId");
        Objects.requireNonNull(name, "name");
    }

    public AddSheetCommand(String sheetId, String name) {
        this(ModelIds.make(), Instant.now(), sheetId, name);
    }

    @Override
    public ProjectModel apply(ProjectModel project) {
        if (project.sheet(sheetId).isPresent()) {
            return project;
        }
        return project.withSheet(new SheetModel(sheetId, name));
    }

    @Override
    public String toScript() {
        return "proj.add_sheet(" + LiteralEncoder.encodeString(name) + ", sheet_id=" + LiteralEncoder.encodeString(sheetId) + ")";
    }
}
