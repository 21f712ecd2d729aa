package com.acme.nummern.script.util;

/**
 * Default limits and names for the script runtime.
 * <p>
 * These values are used when the corresponding environment variable is not set.
 */
public final class NummernDefaults {

    // ---- Runner ----
    public static final long DEFAULT_RUN_TIMEOUT_MS = 10_000L;
    public static final long MIN_RUN_TIMEOUT_MS = 100L;
    public static final long MAX_RUN_TIMEOUT_MS = 600_000L;

    // ---- Captured output, per stream ----
    public static final int DEFAULT_MAX_OUTPUT_BYTES = 4 * 1024 * 1024;
    public static final int MIN_MAX_OUTPUT_BYTES = 1024;
    public static final int MAX_MAX_OUTPUT_BYTES = 256 * 1024 * 1024;

    // ---- Interpreter ----
    public static final String DEFAULT_PYTHON_EXECUTABLE = "/usr/bin/python3";
    public static final String HELPER_MODULE = "canvassheets_api";
    public static final String RUNNER_MODULE = HELPER_MODULE + ".runner";

    // ---- Reader threads ----
    public static final long READER_JOIN_MS = 2_000L;

    private NummernDefaults() {
    }
}
