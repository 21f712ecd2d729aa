package com.acme.nummern.script.util;

import org.junit.jupiter.api.Test;

import java.io.File;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class EnvVarsTest {

    @Test
    void shouldReturnDefaultForMissingOrBlank() {
        Map<String, String> env = Map.of("EMPTY", "   ");
        assertEquals("fallback", EnvVars.getOrDefault(env, "MISSING", "fallback"));
        assertEquals("fallback", EnvVars.getOrDefault(env, "EMPTY", "fallback"));
    }

    @Test
    void shouldClampIntAndFallbackOnMalformed() {
        Map<String, String> env = Map.of(
            "LOW", "-10",
            "HIGH", "9000",
            "OK", " 42 ",
            "BAD", "abc"
        );
        assertEquals(1, EnvVars.getIntClamped(env, "LOW", 10, 1, 100));
        assertEquals(100, EnvVars.getIntClamped(env, "HIGH", 10, 1, 100));
        assertEquals(42, EnvVars.getIntClamped(env, "OK", 10, 1, 100));
        assertEquals(10, EnvVars.getIntClamped(env, "BAD", 10, 1, 100));
        assertEquals(10, EnvVars.getIntClamped(env, "MISSING", 10, 1, 100));
    }

    @Test
    void shouldClampLongTimeouts() {
        Map<String, String> env = Map.of(NummernEnvKeys.NUMMERN_RUN_TIMEOUT_MS, "5");
        assertEquals(NummernDefaults.MIN_RUN_TIMEOUT_MS, EnvVars.getLongClamped(env, NummernEnvKeys.NUMMERN_RUN_TIMEOUT_MS,
            NummernDefaults.DEFAULT_RUN_TIMEOUT_MS, NummernDefaults.MIN_RUN_TIMEOUT_MS, NummernDefaults.MAX_RUN_TIMEOUT_MS));
    }

    @Test
    void shouldPickFirstNonBlankPathEntry() {
        String sep = File.pathSeparator;
        Map<String, String> env = Map.of("P", sep + "/opt/helpers" + sep + "/usr/lib/py", "BLANK", " ");
        assertEquals("/opt/helpers", EnvVars.firstPathEntry(env, "P"));
        assertNull(EnvVars.firstPathEntry(env, "BLANK"));
        assertNull(EnvVars.firstPathEntry(env, "MISSING"));
    }
}
