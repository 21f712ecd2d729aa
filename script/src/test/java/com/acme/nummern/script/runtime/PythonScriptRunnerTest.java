package com.acme.nummern.script.runtime;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class PythonScriptRunnerTest {
    private static final String SNAPSHOT = "{\"sheets\":[{\"id\":\"sheet_1\",\"name\":\"S\",\"tables\":[]}]}";

    @TempDir
    Path dir;

    private Path moduleDir;

    @BeforeEach
    void setUp() throws IOException {
        moduleDir = Files.createDirectories(dir.resolve("lib"));
        Files.createDirectories(moduleDir.resolve("canvassheets_api"));
    }

    /** Writes a shell script standing in for the interpreter; it receives {@code -m module file}. */
    private String fakeInterpreter(String body) throws IOException {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "needs /bin/sh");
        Path exe = dir.resolve("fake-python");
        Files.writeString(exe, "#!/bin/sh\n" + body + "\n");
        Files.setPosixFilePermissions(exe, PosixFilePermissions.fromString("rwxr-xr-x"));
        return exe.toString();
    }

    private PythonScriptRunner runner(String executable, long timeoutMs) {
        return new PythonScriptRunner(new RunnerConfig(moduleDir, executable, timeoutMs, 64 * 1024), Map.of());
    }

    @Test
    void shouldFailBeforeLaunchWithoutModuleDir() {
        PythonScriptRunner runner = new PythonScriptRunner(new RunnerConfig(null, "/nonexistent/python", 1000, 1024), Map.of());
        ScriptRunException e = assertThrows(ScriptRunException.class, () -> runner.run("x = 1"));
        assertEquals(ScriptRunException.Kind.MODULE_NOT_FOUND, e.kind());
    }

    @Test
    void shouldFailBeforeLaunchWhenPackageIsMissing() throws IOException {
        Path empty = Files.createDirectories(dir.resolve("empty"));
        PythonScriptRunner runner = new PythonScriptRunner(new RunnerConfig(empty, "/nonexistent/python", 1000, 1024), Map.of());
        ScriptRunException e = assertThrows(ScriptRunException.class, () -> runner.run("x = 1"));
        assertEquals(ScriptRunException.Kind.MODULE_NOT_FOUND, e.kind());
    }

    @Test
    void shouldFailBeforeLaunchWhenInterpreterIsMissing() throws IOException {
        ScriptRunException missing = assertThrows(ScriptRunException.class,
            () -> runner(dir.resolve("no-such-python").toString(), 1000).run("x = 1"));
        assertEquals(ScriptRunException.Kind.MODULE_NOT_FOUND, missing.kind());

        Path plain = Files.writeString(dir.resolve("not-executable"), "#!/bin/sh\n");
        ScriptRunException notExecutable = assertThrows(ScriptRunException.class,
            () -> runner(plain.toString(), 1000).run("x = 1"));
        assertEquals(ScriptRunException.Kind.MODULE_NOT_FOUND, notExecutable.kind());

        PythonScriptRunner onPath = new PythonScriptRunner(
            new RunnerConfig(moduleDir, "no-such-python", 1000, 1024), Map.of("PATH", dir.toString()));
        ScriptRunException notOnPath = assertThrows(ScriptRunException.class, () -> onPath.run("x = 1"));
        assertEquals(ScriptRunException.Kind.MODULE_NOT_FOUND, notOnPath.kind());
    }

    @Test
    void shouldFindBareInterpreterNameOnPath() throws Exception {
        fakeInterpreter("echo '" + SNAPSHOT + "'");
        PythonScriptRunner runner = new PythonScriptRunner(
            new RunnerConfig(moduleDir, "fake-python", 5000, 64 * 1024), Map.of("PATH", "/nonexistent" + File.pathSeparator + dir));
        assertEquals("sheet_1", runner.run("proj = Project()\n").project().sheets().get(0).id());
    }

    @Test
    void shouldDecodeSnapshotFromLastLine() throws Exception {
        String exe = fakeInterpreter(
            "test \"$1\" = \"-m\" || exit 9\n"
                + "test \"$2\" = \"canvassheets_api.runner\" || exit 9\n"
                + "test -f \"$3\" || exit 9\n"
                + "echo \"PYTHONPATH=$PYTHONPATH\"\n"
                + "echo '" + SNAPSHOT + "'");
        RunResult result = runner(exe, 5000).run("proj = Project()\n");
        assertEquals("sheet_1", result.project().sheets().get(0).id());
        assertTrue(result.stdout().contains("PYTHONPATH=" + moduleDir));
    }

    @Test
    void shouldReportProcessFailureWithParsedMessage() throws Exception {
        String exe = fakeInterpreter("echo 'Error: name '\"'\"'dict'\"'\"' is not defined' >&2\nexit 1");
        ScriptRunException e = assertThrows(ScriptRunException.class, () -> runner(exe, 5000).run("dict()"));
        assertEquals(ScriptRunException.Kind.PROCESS_FAILED, e.kind());
        assertEquals(1, e.exitCode());
        assertEquals("name 'dict' is not defined", e.getMessage());
    }

    @Test
    void shouldKillRunawayScript() throws Exception {
        String exe = fakeInterpreter("exec sleep 30");
        ScriptRunException e = assertThrows(ScriptRunException.class, () -> runner(exe, 300).run("while True: pass"));
        assertEquals(ScriptRunException.Kind.TIMED_OUT, e.kind());
    }

    @Test
    void shouldRejectOutputWithoutSnapshot() {
        ScriptRunException missing = assertThrows(ScriptRunException.class,
            () -> PythonScriptRunner.decodeSnapshot("hello\n{not json\n", ""));
        assertEquals(ScriptRunException.Kind.INVALID_OUTPUT, missing.kind());
        assertEquals(0, missing.exitCode());

        ScriptRunException malformed = assertThrows(ScriptRunException.class,
            () -> PythonScriptRunner.decodeSnapshot("{\"tables\": []}\n", ""));
        assertEquals(ScriptRunException.Kind.INVALID_OUTPUT, malformed.kind());
    }

    @Test
    void shouldSkipTrailingNoiseAfterSnapshot() throws Exception {
        assertEquals(1, PythonScriptRunner.decodeSnapshot(SNAPSHOT + "\n{oops\nbye\n", "").sheets().size());
    }
}
