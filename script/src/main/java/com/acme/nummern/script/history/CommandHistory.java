package com.acme.nummern.script.history;

import java.util.List;

/** Ordered canonical command lines; the source of truth for rebuilding a script. */
public record CommandHistory(List<String> commands) {
    public static final CommandHistory EMPTY = new CommandHistory(List.of());

    public CommandHistory {
        commands = List.copyOf(commands);
    }

    /** Splits generated-region text into history lines. */
    public static CommandHistory fromScript(String generated) {
        if (generated == null || generated.isEmpty()) {
            return EMPTY;
        }
        return new CommandHistory(List.of(generated.split("\n", -1)));
    }

    public boolean isEmpty() {
        return commands.isEmpty();
    }
}
