package com.acme.nummern.script.model;

public class RangeParseException extends Exception {
    public enum Reason {
        INVALID_FORMAT,
        INVALID_REGION,
        INVALID_CELL_REFERENCE
    }

    private final Reason reason;

    public RangeParseException(Reason reason, String input) {
        super(reason + ": " + input);
        this.reason = reason;
    }

    public Reason reason() { return reason; }
}
