package com.acme.nummern.script.runtime;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Serializes full-script runs on one background thread. Starting a new run
 * cancels the previous one; results of superseded runs are never delivered.
 */
public final class ScriptRunCoordinator implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(ScriptRunCoordinator.class.getName());

    private final ScriptRunner runner;
    private final RunGeneration generation = new RunGeneration();
    private final ExecutorService executor;
    private Future<?> inFlight;

    public ScriptRunCoordinator(ScriptRunner runner) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "nummern-script-runner");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Schedules a run of {@code script}. {@code onOutcome} is invoked on the
     * runner thread, and only if no later run was requested meanwhile.
     *
     * @return the generation token of this run
     */
    public synchronized long runAll(String script, Consumer<RunOutcome> onOutcome) {
        Objects.requireNonNull(script, "script");
        Objects.requireNonNull(onOutcome, "onOutcome");
        long token = generation.bump();
        if (inFlight != null && !inFlight.isDone()) {
            inFlight.cancel(true);
        }
        inFlight = executor.submit(() -> execute(token, script, onOutcome));
        return token;
    }

    public long currentGeneration() {
        return generation.token();
    }

    private void execute(long token, String script, Consumer<RunOutcome> onOutcome) {
        if (!generation.matches(token)) {
            return;
        }
        RunOutcome outcome;
        try {
            outcome = new RunOutcome.Completed(token, script, runner.run(script));
        } catch (ScriptRunException e) {
            outcome = new RunOutcome.Failed(token, script, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.fine(() -> "Script run " + token + " interrupted");
            return;
        } catch (RuntimeException e) {
            LOG.warning("Script runner failure: " + e.getClass().getSimpleName());
            outcome = new RunOutcome.Failed(token, script,
                new ScriptRunException(ScriptRunException.Kind.LAUNCH_FAILED, String.valueOf(e.getMessage()), e));
        }
        if (!generation.matches(token)) {
            LOG.fine(() -> "Discarding stale result of run " + token);
            return;
        }
        onOutcome.accept(outcome);
    }

    @Override
    public void close() {
        generation.bump();
        executor.shutdownNow();
    }
}
