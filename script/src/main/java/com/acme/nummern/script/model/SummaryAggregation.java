package com.acme.nummern.script.model;

import java.util.Locale;

public enum SummaryAggregation {
    SUM,
    AVERAGE,
    MIN,
    MAX,
    COUNT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
