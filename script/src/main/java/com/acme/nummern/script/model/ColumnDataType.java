package com.acme.nummern.script.model;

import java.util.Locale;

public enum ColumnDataType {
    NUMBER,
    STRING,
    DATE,
    TIME,
    CURRENCY,
    PERCENTAGE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean usesNumericStorage() {
        return this != STRING;
    }

    public static ColumnDataType fromWireName(String raw) {
        if (raw == null) {
            return null;
        }
        for (ColumnDataType type : values()) {
            if (type.wireName().equals(raw.trim().toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        return null;
    }
}
