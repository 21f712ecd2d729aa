package com.acme.nummern.script.model;

import java.util.Objects;

public record SummaryValueSpec(int column, SummaryAggregation aggregation) {
    public SummaryValueSpec {
        Objects.requireNonNull(aggregation, "aggregation");
    }
}
