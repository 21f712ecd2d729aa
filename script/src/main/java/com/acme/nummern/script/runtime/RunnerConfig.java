package com.acme.nummern.script.runtime;

import com.acme.nummern.script.util.EnvVars;
import com.acme.nummern.script.util.NummernDefaults;
import com.acme.nummern.script.util.NummernEnvKeys;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Interpreter settings. {@code moduleDir} is the directory that contains the
 * {@code canvassheets_api} package; it may be null when unconfigured.
 */
public record RunnerConfig(Path moduleDir, String pythonExecutable, long timeoutMs, int maxOutputBytes) {
    public RunnerConfig {
        Objects.requireNonNull(pythonExecutable, "pythonExecutable");
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        if (maxOutputBytes <= 0) {
            throw new IllegalArgumentException("maxOutputBytes must be positive");
        }
    }

    public static RunnerConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static RunnerConfig fromEnvironment(Map<String, String> env) {
        String modulePath = EnvVars.firstPathEntry(env, NummernEnvKeys.NUMMERN_PYTHONPATH);
        return new RunnerConfig(
            modulePath == null ? null : Path.of(modulePath),
            EnvVars.getOrDefault(env, NummernEnvKeys.NUMMERN_PYTHON_EXECUTABLE, NummernDefaults.DEFAULT_PYTHON_EXECUTABLE),
            EnvVars.getLongClamped(env, NummernEnvKeys.NUMMERN_RUN_TIMEOUT_MS,
                NummernDefaults.DEFAULT_RUN_TIMEOUT_MS, NummernDefaults.MIN_RUN_TIMEOUT_MS, NummernDefaults.MAX_RUN_TIMEOUT_MS),
            EnvVars.getIntClamped(env, NummernEnvKeys.NUMMERN_MAX_OUTPUT_BYTES,
                NummernDefaults.DEFAULT_MAX_OUTPUT_BYTES, NummernDefaults.MIN_MAX_OUTPUT_BYTES, NummernDefaults.MAX_MAX_OUTPUT_BYTES)
        );
    }

    public RunnerConfig withModuleDir(Path dir) {
        return new RunnerConfig(dir, pythonExecutable, timeoutMs, maxOutputBytes);
    }

    public RunnerConfig withPythonExecutable(String executable) {
        return new RunnerConfig(moduleDir, executable, timeoutMs, maxOutputBytes);
    }

    public RunnerConfig withTimeoutMs(long ms) {
        return new RunnerConfig(moduleDir, pythonExecutable, ms, maxOutputBytes);
    }

    public RunnerConfig withMaxOutputBytes(int bytes) {
        return new RunnerConfig(moduleDir, pythonExecutable, timeoutMs, bytes);
    }
}
