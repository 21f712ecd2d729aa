package com.acme.nummern.script.command;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record CommandTransaction(String id, Instant timestamp, TransactionKind kind, List<Command> commands) {
    public CommandTransaction {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        commands = List.copyOf(commands);
    }

    public boolean isEmpty() {
        return commands.isEmpty();
    }
}
