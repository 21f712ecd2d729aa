package com.acme.nummern.script.runtime;

import java.util.Objects;

public sealed interface RunOutcome permits RunOutcome.Completed, RunOutcome.Failed {
    long generation();

    record Completed(long generation, String script, RunResult result) implements RunOutcome {
        public Completed {
            Objects.requireNonNull(script, "script");
            Objects.requireNonNull(result, "result");
        }
    }

    record Failed(long generation, String script, ScriptRunException error) implements RunOutcome {
        public Failed {
            Objects.requireNonNull(script, "script");
            Objects.requireNonNull(error, "error");
        }

        public ScriptErrorDetail detail() {
            if (error.kind() == ScriptRunException.Kind.PROCESS_FAILED) {
                return ScriptErrorParser.parse(error.stderr());
            }
            return new ScriptErrorDetail(null, error.getMessage() == null ? error.kind().name() : error.getMessage());
        }
    }
}
