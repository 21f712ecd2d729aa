package com.acme.nummern.script.compose;

import com.acme.nummern.script.normalize.LineClassifier;
import com.acme.nummern.script.normalize.ScriptTokenizer;
import com.acme.nummern.script.normalize.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits a script into the user region and the generated region at a single
 * marker line, and puts them back together.
 *
 * <p>The user region is never rewritten. When the marker is missing the whole
 * existing text is treated as user code and kept.</p>
 */
public final class ScriptComposer {
    public static final String MARKER = "# ---- Auto-generated log (append-only) --------------------------------";
    public static final String USER_HEADER = "# ---- User code (editable) ---------------------------------------------";
    public static final String PROJECT_INIT = "proj = Project()";

    private static final String DEFAULT_SCRIPT = String.join("\n",
        USER_HEADER,
        "import numpy as np",
        "from datetime import date, time",
        "from canvassheets_api import Project, Rect, formula, table_context, label_context, "
            + "c_sum, c_avg, c_min, c_max, c_count, c_counta",
        "",
        PROJECT_INIT,
        MARKER,
        "");

    private ScriptComposer() {
    }

    /** Preamble of a new document, ending with the marker line. */
    public static String defaultScript() {
        return DEFAULT_SCRIPT;
    }

    /**
     * User region of {@code existing}, then the marker, then {@code generated}.
     */
    public static String compose(String existing, String generated) {
        String current = existing == null ? "" : existing;
        String fresh = generated == null ? "" : generated;
        if (current.isEmpty() && fresh.isEmpty()) {
            return "";
        }
        int markerStart = markerOffset(current);
        StringBuilder sb = new StringBuilder(current.length() + fresh.length() + MARKER.length() + 2);
        if (markerStart >= 0) {
            sb.append(current, 0, markerStart);
        } else {
            sb.append(current);
            if (!current.isEmpty() && !current.endsWith("\n")) {
                sb.append('\n');
            }
        }
        sb.append(MARKER).append('\n');
        if (!fresh.isEmpty()) {
            sb.append(fresh);
            if (!fresh.endsWith("\n")) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * Text after the marker with lookup-alias lines removed. Empty when there
     * is no marker.
     */
    public static String extractGeneratedRegion(String fullText) {
        if (fullText == null || fullText.isEmpty()) {
            return "";
        }
        int markerStart = markerOffset(fullText);
        if (markerStart < 0) {
            return "";
        }
        int newline = fullText.indexOf('\n', markerStart);
        if (newline < 0) {
            return "";
        }
        List<String> kept = new ArrayList<>();
        for (String line : splitLines(fullText.substring(newline + 1))) {
            if (!LineClassifier.isLookupAlias(line)) {
                kept.add(line);
            }
        }
        return String.join("\n", kept);
    }

    /**
     * Independently runnable script for {@code selected}: the import lines of
     * the user region, a project initialization when the selection has none,
     * then the selection.
     */
    public static Optional<String> selectionScript(String fullText, String selected) {
        if (selected == null || selected.isBlank()) {
            return Optional.empty();
        }
        String text = fullText == null ? "" : fullText;
        int markerStart = markerOffset(text);
        String headerSource = markerStart >= 0 ? text.substring(0, markerStart) : text;
        List<String> out = new ArrayList<>();
        for (String line : splitLines(headerSource)) {
            if (isImport(line)) {
                out.add(line);
            }
        }
        List<String> selection = splitLines(selected);
        if (selection.stream().noneMatch(ScriptComposer::isProjectInit)) {
            out.add(PROJECT_INIT);
        }
        out.addAll(selection);
        return Optional.of(String.join("\n", out));
    }

    /** Offset of the first marker line, or -1. Trailing whitespace is tolerated, leading is not. */
    static int markerOffset(String text) {
        int start = 0;
        while (start <= text.length()) {
            int end = text.indexOf('\n', start);
            String line = end < 0 ? text.substring(start) : text.substring(start, end);
            if (line.stripTrailing().equals(MARKER)) {
                return start;
            }
            if (end < 0) {
                return -1;
            }
            start = end + 1;
        }
        return -1;
    }

    private static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>(List.of(text.split("\n", -1)));
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    private static boolean isImport(String line) {
        if (ScriptTokenizer.indentation(line) != 0) {
            return false;
        }
        List<Token> tokens = ScriptTokenizer.tokenize(line);
        if (tokens.isEmpty()) {
            return false;
        }
        if (tokens.get(0).isIdentifier("import")) {
            return true;
        }
        return tokens.get(0).isIdentifier("from") && tokens.stream().anyMatch(t -> t.isIdentifier("import"));
    }

    private static boolean isProjectInit(String line) {
        List<Token> tokens = ScriptTokenizer.tokenize(line);
        return tokens.size() == 5
            && tokens.get(0).isIdentifier("proj") && tokens.get(1).isOperator("=")
            && tokens.get(2).isIdentifier("Project") && tokens.get(3).isOperator("(") && tokens.get(4).isOperator(")");
    }
}
