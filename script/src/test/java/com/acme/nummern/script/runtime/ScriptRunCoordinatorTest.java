package com.acme.nummern.script.runtime;

import com.acme.nummern.script.model.ProjectModel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScriptRunCoordinatorTest {

    @Test
    void shouldDeliverOnlyLatestResult() throws Exception {
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch delivered = new CountDownLatch(1);
        ScriptRunner runner = script -> {
            if (script.equals("slow")) {
                firstStarted.countDown();
                // ignores interruption so the stale result reaches the generation check
                long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(200);
                while (System.nanoTime() < until) {
                    Thread.onSpinWait();
                }
            }
            return new RunResult(ProjectModel.empty(), script, "");
        };
        List<RunOutcome> outcomes = new CopyOnWriteArrayList<>();
        try (ScriptRunCoordinator coordinator = new ScriptRunCoordinator(runner)) {
            long first = coordinator.runAll("slow", outcomes::add);
            assertTrue(firstStarted.await(5, TimeUnit.SECONDS));
            long second = coordinator.runAll("fast", o -> {
                outcomes.add(o);
                delivered.countDown();
            });
            assertTrue(second > first);
            assertTrue(delivered.await(5, TimeUnit.SECONDS));
            assertEquals(second, coordinator.currentGeneration());
        }
        assertEquals(1, outcomes.size());
        RunOutcome.Completed completed = assertInstanceOf(RunOutcome.Completed.class, outcomes.get(0));
        assertEquals("fast", completed.script());
        assertEquals("fast", completed.result().stdout());
    }

    @Test
    void shouldDeliverFailureWithDetail() throws Exception {
        ScriptRunner runner = script -> {
            throw new ScriptRunException(ScriptRunException.Kind.PROCESS_FAILED, "boom", 1, "",
                "Traceback (most recent call last):\n  File \"run.py\", line 3, in <module>\nNameError: boom\n", null);
        };
        CountDownLatch delivered = new CountDownLatch(1);
        List<RunOutcome> outcomes = new CopyOnWriteArrayList<>();
        try (ScriptRunCoordinator coordinator = new ScriptRunCoordinator(runner)) {
            coordinator.runAll("x", o -> {
                outcomes.add(o);
                delivered.countDown();
            });
            assertTrue(delivered.await(5, TimeUnit.SECONDS));
        }
        RunOutcome.Failed failed = assertInstanceOf(RunOutcome.Failed.class, outcomes.get(0));
        assertEquals(3, failed.detail().line());
        assertEquals("NameError: boom", failed.detail().message());
    }

    @Test
    void shouldWrapUnexpectedRunnerErrors() throws Exception {
        ScriptRunner runner = script -> {
            throw new IllegalStateException("broken");
        };
        CountDownLatch delivered = new CountDownLatch(1);
        List<RunOutcome> outcomes = new CopyOnWriteArrayList<>();
        try (ScriptRunCoordinator coordinator = new ScriptRunCoordinator(runner)) {
            coordinator.runAll("x", o -> {
                outcomes.add(o);
                delivered.countDown();
            });
            assertTrue(delivered.await(5, TimeUnit.SECONDS));
        }
        RunOutcome.Failed failed = assertInstanceOf(RunOutcome.Failed.class, outcomes.get(0));
        assertEquals(ScriptRunException.Kind.LAUNCH_FAILED, failed.error().kind());
        assertNull(failed.detail().line());
        assertEquals("broken", failed.detail().message());
    }

    @Test
    void shouldAdvanceGenerationMonotonically() {
        RunGeneration generation = new RunGeneration();
        long a = generation.bump();
        long b = generation.bump();
        assertTrue(b > a);
        assertTrue(generation.matches(b));
        assertEquals(b, generation.token());
        assertFalse(generation.matches(a));
    }
}
