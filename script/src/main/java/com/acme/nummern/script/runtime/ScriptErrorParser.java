package com.acme.nummern.script.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a displayable error from interpreter stderr. Handles a full
 * traceback and the runner's one-line {@code Error: ...} form.
 */
public final class ScriptErrorParser {
    private static final Pattern FRAME = Pattern.compile("^\\s*File \"([^\"]*)\", line (\\d+)");
    private static final Pattern TRAILING_LINE = Pattern.compile("\\(([^()]*), line (\\d+)\\)\\s*$");
    private static final String RUNNER_PREFIX = "Error: ";

    private ScriptErrorParser() {
    }

    public static ScriptErrorDetail parse(String stderr) {
        return parse(stderr, null);
    }

    /**
     * @param scriptPath path of the executed file; frames from it win over
     *                   frames inside library code. May be null.
     */
    public static ScriptErrorDetail parse(String stderr, String scriptPath) {
        List<String> lines = new ArrayList<>();
        for (String line : (stderr == null ? "" : stderr).split("\n")) {
            if (!line.isBlank()) {
                lines.add(line.stripTrailing());
            }
        }
        if (lines.isEmpty()) {
            return new ScriptErrorDetail(null, "Script failed without error output");
        }
        String last = lines.get(lines.size() - 1).strip();
        if (last.startsWith(RUNNER_PREFIX)) {
            String message = last.substring(RUNNER_PREFIX.length());
            Matcher trailing = TRAILING_LINE.matcher(message);
            Integer line = trailing.find() ? Integer.valueOf(trailing.group(2)) : null;
            return new ScriptErrorDetail(line, message);
        }
        Integer anyFrame = null;
        Integer scriptFrame = null;
        for (String line : lines) {
            Matcher m = FRAME.matcher(line);
            if (m.find()) {
                Integer number = Integer.valueOf(m.group(2));
                anyFrame = number;
                if (scriptPath != null && scriptPath.equals(m.group(1))) {
                    scriptFrame = number;
                }
            }
        }
        return new ScriptErrorDetail(scriptFrame != null ? scriptFrame : anyFrame, last);
    }
}
