package com.acme.nummern.script.util;

import java.io.File;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Environment parsing helpers with consistent defaulting and clamping.
 *
 * <p>Every lookup has an overload taking an explicit map so callers can inject
 * a fixed environment.</p>
 */
public final class EnvVars {
    private EnvVars() {
    }

    public static String getOrDefault(String name, String defaultValue) {
        return getOrDefault(System.getenv(), name, defaultValue);
    }

    public static int getIntClamped(String name, int defaultValue, int min, int max) {
        return getIntClamped(System.getenv(), name, defaultValue, min, max);
    }

    public static long getLongClamped(String name, long defaultValue, long min, long max) {
        return getLongClamped(System.getenv(), name, defaultValue, min, max);
    }

    public static String getOrDefault(Map<String, String> env, String name, String defaultValue) {
        String v = env.get(name);
        return (v == null || v.isBlank()) ? defaultValue : v;
    }

    public static int getIntClamped(Map<String, String> env, String name, int defaultValue, int min, int max) {
        long parsed = getLongClamped(env, name, defaultValue, min, max);
        return (int) parsed;
    }

    public static long getLongClamped(Map<String, String> env, String name, long defaultValue, long min, long max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(raw.trim());
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }

    /**
     * First entry of a search path split on {@link File#pathSeparator}, or {@code null} when unset.
     */
    public static String firstPathEntry(Map<String, String> env, String name) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        for (String part : raw.split(Pattern.quote(File.pathSeparator))) {
            if (!part.isBlank()) {
                return part.trim();
            }
        }
        return null;
    }
}
