package com.acme.nummern.script.history;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HistoryCodecTest {

    @Test
    void shouldDecodeEncodedHistory() {
        CommandHistory history = new CommandHistory(List.of(
            "proj.add_sheet('Sheet \\'1\\'', sheet_id='sheet_1')",
            "with table_context(table_1):",
            "    a0 = 'café'",
            ""));
        assertEquals(history, HistoryCodec.decode(HistoryCodec.encode(history)));
    }

    @Test
    void shouldEncodeCommandsArray() {
        String json = HistoryCodec.encode(new CommandHistory(List.of("a()")));
        assertTrue(json.contains("\"commands\""));
        assertTrue(json.contains("\"a()\""));
    }

    @Test
    void shouldRejectMalformedHistory() {
        assertThrows(IllegalArgumentException.class, () -> HistoryCodec.decode(""));
        assertThrows(IllegalArgumentException.class, () -> HistoryCodec.decode("{not json"));
        assertThrows(IllegalArgumentException.class, () -> HistoryCodec.decode("{\"commands\": \"a()\"}"));
        assertThrows(IllegalArgumentException.class, () -> HistoryCodec.decode("{\"commands\": [1, 2]}"));
        assertThrows(IllegalArgumentException.class, () -> HistoryCodec.decode("[]"));
    }

    @Test
    void shouldSplitScriptIntoCommands() {
        assertEquals(List.of("a()", "b()", ""), CommandHistory.fromScript("a()\nb()\n").commands());
        assertTrue(CommandHistory.fromScript("").isEmpty());
        assertTrue(CommandHistory.fromScript(null).isEmpty());
    }
}
