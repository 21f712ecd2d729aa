package com.acme.nummern.script.runtime;

import java.util.Objects;

/** Script line (1-based, null when unknown) and message of a failed run. */
public record ScriptErrorDetail(Integer line, String message) {
    public ScriptErrorDetail {
        Objects.requireNonNull(message, "message");
    }
}
