package com.acme.nummern.script.tools;

import com.acme.nummern.script.compose.ScriptComposer;
import com.acme.nummern.script.history.CommandHistory;
import com.acme.nummern.script.history.HistoryCodec;
import com.acme.nummern.script.normalize.LogNormalizer;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Rebuilds a script from its history artifact, or the other way round.
 *
 * <pre>
 * ScriptRepairMain &lt;script.py&gt; &lt;history.json&gt; [--extract]
 * </pre>
 *
 * Without {@code --extract} the generated region of the script is replaced by
 * the normalized history and the user region is kept. With it the history
 * file is rewritten from the script's generated region.
 */
public final class ScriptRepairMain {
    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 2;

    private ScriptRepairMain() {
    }

    public static void main(String[] args) throws IOException {
        int code = run(args, System.out, System.err);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) throws IOException {
        if (args.length < 2 || args.length > 3 || (args.length == 3 && !"--extract".equals(args[2]))) {
            err.println("usage: ScriptRepairMain <script.py> <history.json> [--extract]");
            return EXIT_INVALID;
        }
        Path script = Path.of(args[0]);
        Path history = Path.of(args[1]);
        try {
            if (args.length == 3) {
                extract(script, history, out);
            } else {
                repair(script, history, out);
            }
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            return EXIT_INVALID;
        }
        return EXIT_OK;
    }

    private static void repair(Path script, Path history, PrintStream out) throws IOException {
        if (!Files.exists(history)) {
            throw new IllegalArgumentException("history file not found: " + history);
        }
        CommandHistory decoded = HistoryCodec.decode(Files.readString(history, StandardCharsets.UTF_8));
        String existing = Files.exists(script)
            ? Files.readString(script, StandardCharsets.UTF_8)
            : ScriptComposer.defaultScript();
        String generated = String.join("\n", LogNormalizer.normalize(decoded.commands()));
        Files.writeString(script, ScriptComposer.compose(existing, generated), StandardCharsets.UTF_8);
        out.println("repaired=" + script + " commands=" + decoded.commands().size());
    }

    private static void extract(Path script, Path history, PrintStream out) throws IOException {
        if (!Files.exists(script)) {
            throw new IllegalArgumentException("script file not found: " + script);
        }
        String text = Files.readString(script, StandardCharsets.UTF_8);
        CommandHistory extracted = CommandHistory.fromScript(ScriptComposer.extractGeneratedRegion(text));
        Files.writeString(history, HistoryCodec.encode(extracted), StandardCharsets.UTF_8);
        out.println("extracted=" + history + " commands=" + extracted.commands().size());
    }
}
