package com.acme.nummern.script.tools;

import com.acme.nummern.script.compose.ScriptComposer;
import com.acme.nummern.script.history.CommandHistory;
import com.acme.nummern.script.history.HistoryCodec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScriptRepairMainTest {
    @TempDir
    Path dir;

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private int run(String... args) throws Exception {
        try (PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
             PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8)) {
            return ScriptRepairMain.run(args, out, err);
        }
    }

    @Test
    void shouldRejectBadUsage() throws Exception {
        assertEquals(ScriptRepairMain.EXIT_INVALID, run("only-one"));
        assertEquals(ScriptRepairMain.EXIT_INVALID, run("a.py", "b.json", "--bogus"));
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains("usage:"));
    }

    @Test
    void shouldRebuildGeneratedRegionAndKeepUserCode() throws Exception {
        Path script = dir.resolve("doc.py");
        Path history = dir.resolve("doc.json");
        Files.writeString(script, "import math\n" + ScriptComposer.MARKER + "\nstale()\n");
        Files.writeString(history, HistoryCodec.encode(new CommandHistory(List.of(
            "t = proj.table('table_1')",
            "with table_context(t):",
            "    c0 = a0*2"))));

        assertEquals(ScriptRepairMain.EXIT_OK, run(script.toString(), history.toString()));
        assertEquals("import math\n" + ScriptComposer.MARKER + "\n"
                + "table_1 = proj.table('table_1')\nwith table_context(table_1):\n    c0 = a0*2\n",
            Files.readString(script));
        assertTrue(outBytes.toString(StandardCharsets.UTF_8).contains("commands=3"));
    }

    @Test
    void shouldStartFromDefaultScriptWhenMissing() throws Exception {
        Path script = dir.resolve("new.py");
        Path history = dir.resolve("new.json");
        Files.writeString(history, "{\"commands\": [\"proj.add_sheet('S', sheet_id='sheet_1')\"]}");

        assertEquals(ScriptRepairMain.EXIT_OK, run(script.toString(), history.toString()));
        assertEquals(ScriptComposer.defaultScript() + "proj.add_sheet('S', sheet_id='sheet_1')\n", Files.readString(script));
    }

    @Test
    void shouldFailOnMissingOrBrokenHistory() throws Exception {
        Path script = dir.resolve("doc.py");
        assertEquals(ScriptRepairMain.EXIT_INVALID, run(script.toString(), dir.resolve("absent.json").toString()));
        Path broken = dir.resolve("broken.json");
        Files.writeString(broken, "{\"commands\": 1}");
        assertEquals(ScriptRepairMain.EXIT_INVALID, run(script.toString(), broken.toString()));
        assertFalse(Files.exists(script));
    }

    @Test
    void shouldExtractHistoryFromScript() throws Exception {
        Path script = dir.resolve("doc.py");
        Path history = dir.resolve("doc.json");
        Files.writeString(script, ScriptComposer.compose(ScriptComposer.defaultScript(),
            "table_1 = proj.table('table_1')\nproj.table('table_1').minimize()"));

        assertEquals(ScriptRepairMain.EXIT_OK, run(script.toString(), history.toString(), "--extract"));
        assertEquals(List.of("proj.table('table_1').minimize()"),
            HistoryCodec.decode(Files.readString(history)).commands());
        assertEquals(ScriptRepairMain.EXIT_INVALID,
            run(dir.resolve("missing.py").toString(), history.toString(), "--extract"));
    }
}
