package com.acme.nummern.script.util;

/**
 * Canonical environment variable names read by the script runtime.
 */
public final class NummernEnvKeys {
    public static final String NUMMERN_PYTHONPATH = "NUMMERN_PYTHONPATH";
    public static final String NUMMERN_PYTHON_EXECUTABLE = "NUMMERN_PYTHON_EXECUTABLE";
    public static final String NUMMERN_RUN_TIMEOUT_MS = "NUMMERN_RUN_TIMEOUT_MS";
    public static final String NUMMERN_MAX_OUTPUT_BYTES = "NUMMERN_MAX_OUTPUT_BYTES";

    public static final String PYTHONPATH = "PYTHONPATH";
    public static final String PATH = "PATH";

    private NummernEnvKeys() {
    }
}
