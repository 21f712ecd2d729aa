package com.acme.nummern.script.command;

import com.acme.nummern.script.model.ModelIds;
import com.acme.nummern.script.model.ProjectModel;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Ordered group of commands applied and rendered as one unit. */
public record CommandBatch(String commandId, Instant timestamp, List<Command> commands) implements Command {
    public CommandBatch {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(timestamp, "timestamp");
        commands = List.copyOf(commands);
    }

    public CommandBatch(List<Command> commands) {
        this(ModelIds.make(), Instant.now(), commands);
    }

    @Override
    public ProjectModel apply(ProjectModel project) {
        ProjectModel current = project;
        for (Command command : commands) {
            current = command.apply(current);
        }
        return current;
    }

    @Override
    public String toScript() {
        List<String> parts = new ArrayList<>(commands.size());
        for (Command command : commands) {
            String script = command.toScript();
            if (!script.isEmpty()) {
                parts.add(script);
            }
        }
        return String.join("\n", parts);
    }

    /** Children's inverses in reverse order; empty if any child has none. */
    @Override
    public Optional<Command> invert(ProjectModel previous) {
        List<Command> inverses = new ArrayList<>(commands.size());
        ProjectModel current = previous;
        for (Command command : commands) {
            Optional<Command> inverse = command.invert(current);
            if (inverse.isEmpty()) {
                return Optional.empty();
            }
            inverses.add(inverse.get());
            current = command.apply(current);
        }
        Collections.reverse(inverses);
        return Optional.of(new CommandBatch(inverses));
    }
}
