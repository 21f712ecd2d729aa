package com.acme.nummern.script.model;

import java.util.List;
import java.util.Objects;

/** A rectangular block of values written in one operation, with an optional dtype hint. */
public record RangeValue(List<List<CellValue>> values, String dtype) {
    public RangeValue {
        Objects.requireNonNull(values, "values");
        values = values.stream().map(List::copyOf).toList();
    }
}
