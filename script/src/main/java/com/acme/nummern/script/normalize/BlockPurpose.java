package com.acme.nummern.script.normalize;

public enum BlockPurpose {
    /** Literal assignments; hoisted to the table's anchor. */
    DATA,
    FORMULA,
    LABEL
}
