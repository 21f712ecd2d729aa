package com.acme.nummern.script.runtime;

import com.acme.nummern.script.model.ProjectModel;

import java.util.Objects;

/** Successful run: the decoded project plus captured (possibly truncated) output. */
public record RunResult(ProjectModel project, String stdout, String stderr) {
    public RunResult {
        Objects.requireNonNull(project, "project");
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }
}
