package com.acme.nummern.script.command;

public enum TransactionKind {
    GENERAL,
    /** Keystroke-level edits; consecutive cell writes to one table fold together. */
    CELL_EDIT
}
