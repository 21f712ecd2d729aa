package com.acme.nummern.script.runtime;

/** Executes a full script and returns the resulting project state. */
public interface ScriptRunner {
    /**
     * @throws InterruptedException when the calling thread is interrupted; the
     *                              child process is killed first
     */
    RunResult run(String script) throws ScriptRunException, InterruptedException;
}
