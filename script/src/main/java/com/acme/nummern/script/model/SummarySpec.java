package com.acme.nummern.script.model;

import java.util.List;
import java.util.Objects;

/** Grouping definition of a summary table derived from a source table. */
public record SummarySpec(String sourceTableId, List<Integer> groupBy, List<SummaryValueSpec> values) {
    public SummarySpec {
        Objects.requireNonNull(sourceTableId, "sourceTableId");
        groupBy = List.copyOf(groupBy);
        values = List.copyOf(values);
    }
}
