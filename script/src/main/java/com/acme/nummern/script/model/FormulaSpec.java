package com.acme.nummern.script.model;

import java.util.Objects;

public record FormulaSpec(String formula) {
    public FormulaSpec {
        Objects.requireNonNull(formula, "formula");
    }
}
