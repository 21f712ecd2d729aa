package com.acme.nummern.script.history;

import com.acme.nummern.script.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Reads and writes the history artifact {@code {"commands": [...]}}. */
public final class HistoryCodec {
    private static final String COMMANDS = "commands";

    private HistoryCodec() {
    }

    public static String encode(CommandHistory history) {
        Objects.requireNonNull(history, "history");
        ObjectNode root = JsonCodec.newObject();
        ArrayNode commands = root.putArray(COMMANDS);
        history.commands().forEach(commands::add);
        try {
            return JsonCodec.writePretty(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode history", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the text is not JSON, or {@code commands}
     *                                  is missing, not an array, or holds non-strings
     */
    public static CommandHistory decode(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("History JSON is empty");
        }
        JsonNode root;
        try {
            root = JsonCodec.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("History is not valid JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode commands = root == null ? null : root.get(COMMANDS);
        if (commands == null || !commands.isArray()) {
            throw new IllegalArgumentException("History field 'commands' must be an array");
        }
        List<String> out = new ArrayList<>(commands.size());
        for (JsonNode entry : commands) {
            if (!entry.isTextual()) {
                throw new IllegalArgumentException("History entries must be strings");
            }
            out.add(entry.asText());
        }
        return new CommandHistory(out);
    }
}
