package com.acme.nummern.script.runtime;

/**
 * Failed script execution. {@link #kind()} tells the cases apart; none of them
 * is retried.
 */
public class ScriptRunException extends Exception {
    public enum Kind {
        /** Interpreter or helper module not found; raised before any process starts. */
        MODULE_NOT_FOUND,
        LAUNCH_FAILED,
        /** Non-zero exit status. */
        PROCESS_FAILED,
        /** Exit status zero, but no usable project snapshot on stdout. */
        INVALID_OUTPUT,
        TIMED_OUT
    }

    private final Kind kind;
    private final Integer exitCode;
    private final String stdout;
    private final String stderr;

    public ScriptRunException(Kind kind, String message) {
        this(kind, message, null, "", "", null);
    }

    public ScriptRunException(Kind kind, String message, Throwable cause) {
        this(kind, message, null, "", "", cause);
    }

    public ScriptRunException(Kind kind, String message, Integer exitCode, String stdout, String stderr, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.exitCode = exitCode;
        this.stdout = stdout == null ? "" : stdout;
        this.stderr = stderr == null ? "" : stderr;
    }

    public Kind kind() { return kind; }
    public Integer exitCode() { return exitCode; }
    public String stdout() { return stdout; }
    public String stderr() { return stderr; }
}
