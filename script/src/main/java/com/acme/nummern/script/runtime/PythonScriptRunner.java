package com.acme.nummern.script.runtime;

import com.acme.nummern.script.model.ProjectModel;
import com.acme.nummern.script.util.JsonCodec;
import com.acme.nummern.script.util.NummernDefaults;
import com.acme.nummern.script.util.NummernEnvKeys;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a script with {@code python -m canvassheets_api.runner <file>} and
 * decodes the project snapshot the runner prints as its last stdout line.
 */
public final class PythonScriptRunner implements ScriptRunner {
    private static final Logger LOG = Logger.getLogger(PythonScriptRunner.class.getName());

    private final RunnerConfig config;
    private final Map<String, String> baseEnvironment;

    public PythonScriptRunner(RunnerConfig config) {
        this(config, System.getenv());
    }

    public PythonScriptRunner(RunnerConfig config, Map<String, String> baseEnvironment) {
        this.config = Objects.requireNonNull(config, "config");
        this.baseEnvironment = Map.copyOf(Objects.requireNonNull(baseEnvironment, "baseEnvironment"));
    }

    public RunnerConfig config() {
        return config;
    }

    @Override
    public RunResult run(String script) throws ScriptRunException, InterruptedException {
        Objects.requireNonNull(script, "script");
        Path moduleDir = requireModuleDir();
        String executable = requireExecutable();

        Path scriptFile;
        try {
            scriptFile = Files.createTempFile("nummern-run-", ".py");
            Files.writeString(scriptFile, script, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ScriptRunException(ScriptRunException.Kind.LAUNCH_FAILED,
                "Cannot write script file: " + e.getMessage(), e);
        }

        Process process = null;
        try {
            ProcessBuilder pb = new ProcessBuilder(List.of(
                executable, "-m", NummernDefaults.RUNNER_MODULE, scriptFile.toString()));
            pb.environment().put(NummernEnvKeys.PYTHONPATH, pythonPath(moduleDir));
            try {
                process = pb.start();
            } catch (IOException e) {
                throw new ScriptRunException(ScriptRunException.Kind.LAUNCH_FAILED,
                    "Cannot start " + executable + ": " + e.getMessage(), e);
            }
            long pid = process.pid();
            LOG.fine(() -> "Started script run pid=" + pid + " file=" + scriptFile.getFileName());
            closeStdin(process);

            BoundedStreamCollector out = new BoundedStreamCollector(
                process.getInputStream(), config.maxOutputBytes(), "nummern-run-stdout");
            BoundedStreamCollector err = new BoundedStreamCollector(
                process.getErrorStream(), config.maxOutputBytes(), "nummern-run-stderr");
            out.start();
            err.start();

            if (!process.waitFor(config.timeoutMs(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                LOG.warning("Script run timed out after " + config.timeoutMs() + " ms; process killed");
                out.join(NummernDefaults.READER_JOIN_MS);
                err.join(NummernDefaults.READER_JOIN_MS);
                throw new ScriptRunException(ScriptRunException.Kind.TIMED_OUT,
                    "Script timed out after " + config.timeoutMs() + " ms", null, out.text(), err.text(), null);
            }

            boolean outDone = out.join(NummernDefaults.READER_JOIN_MS);
            boolean errDone = err.join(NummernDefaults.READER_JOIN_MS);
            if (!outDone || !errDone) {
                LOG.warning("Output readers still running after process exit");
            }
            if (out.droppedBytes() > 0 || err.droppedBytes() > 0) {
                LOG.warning("Script output truncated: stdoutDropped=" + out.droppedBytes()
                    + " stderrDropped=" + err.droppedBytes());
            }

            String stdout = out.text();
            String stderr = err.text();
            int exit = process.exitValue();
            if (exit != 0) {
                ScriptErrorDetail detail = ScriptErrorParser.parse(stderr, scriptFile.toString());
                LOG.info("Script run failed exit=" + exit + " line=" + detail.line());
                throw new ScriptRunException(ScriptRunException.Kind.PROCESS_FAILED,
                    detail.message(), exit, stdout, stderr, null);
            }
            return new RunResult(decodeSnapshot(stdout, stderr), stdout, stderr);
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            try {
                Files.deleteIfExists(scriptFile);
            } catch (IOException e) {
                LOG.log(Level.WARNING, "Cannot delete script file " + scriptFile, e);
            }
        }
    }

    private Path requireModuleDir() throws ScriptRunException {
        Path dir = config.moduleDir();
        if (dir == null) {
            throw new ScriptRunException(ScriptRunException.Kind.MODULE_NOT_FOUND,
                "Helper module directory is not configured (" + NummernEnvKeys.NUMMERN_PYTHONPATH + ")");
        }
        if (!Files.isDirectory(dir.resolve(NummernDefaults.HELPER_MODULE))) {
            throw new ScriptRunException(ScriptRunException.Kind.MODULE_NOT_FOUND,
                "Package " + NummernDefaults.HELPER_MODULE + " not found under " + dir);
        }
        return dir;
    }

    /**
     * Interpreter to launch. A name containing a separator is taken as a path;
     * a bare name is looked up on {@code PATH} of the base environment.
     */
    private String requireExecutable() throws ScriptRunException {
        String configured = config.pythonExecutable();
        if (configured.indexOf('/') >= 0 || configured.indexOf(File.separatorChar) >= 0) {
            Path path = Path.of(configured);
            if (!Files.isRegularFile(path) || !Files.isExecutable(path)) {
                throw new ScriptRunException(ScriptRunException.Kind.MODULE_NOT_FOUND,
                    "Interpreter " + configured + " is missing or not executable ("
                        + NummernEnvKeys.NUMMERN_PYTHON_EXECUTABLE + ")");
            }
            return configured;
        }
        String searchPath = baseEnvironment.get(NummernEnvKeys.PATH);
        if (searchPath != null) {
            for (String dir : searchPath.split(File.pathSeparator)) {
                if (dir.isBlank()) {
                    continue;
                }
                Path candidate = Path.of(dir, configured);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return candidate.toString();
                }
            }
        }
        throw new ScriptRunException(ScriptRunException.Kind.MODULE_NOT_FOUND,
            "Interpreter " + configured + " not found on " + NummernEnvKeys.PATH);
    }

    private String pythonPath(Path moduleDir) {
        String existing = baseEnvironment.get(NummernEnvKeys.PYTHONPATH);
        if (existing == null || existing.isBlank()) {
            return moduleDir.toString();
        }
        return moduleDir + File.pathSeparator + existing;
    }

    static ProjectModel decodeSnapshot(String stdout, String stderr) throws ScriptRunException {
        String[] lines = stdout.split("\n");
        for (int i = lines.length - 1; i >= 0; i--) {
            String line = lines[i].strip();
            if (!line.startsWith("{")) {
                continue;
            }
            JsonNode node;
            try {
                node = JsonCodec.readTree(line);
            } catch (JsonProcessingException e) {
                LOG.fine(() -> "Skipping non-JSON stdout line: " + e.getOriginalMessage());
                continue;
            }
            try {
                return ProjectSnapshotDecoder.decode(node);
            } catch (IllegalArgumentException e) {
                throw new ScriptRunException(ScriptRunException.Kind.INVALID_OUTPUT,
                    "Malformed project snapshot: " + e.getMessage(), 0, stdout, stderr, e);
            }
        }
        throw new ScriptRunException(ScriptRunException.Kind.INVALID_OUTPUT,
            "Runner produced no project snapshot", 0, stdout, stderr, null);
    }

    private static void closeStdin(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            LOG.fine(() -> "Cannot close child stdin: " + e.getMessage());
        }
    }
}
