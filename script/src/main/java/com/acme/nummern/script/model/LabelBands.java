package com.acme.nummern.script.model;

/** Row/column counts of the four label bands around a table body. */
public record LabelBands(int topRows, int bottomRows, int leftCols, int rightCols) {
    public static final LabelBands ZERO = new LabelBands(0, 0, 0, 0);

    public LabelBands {
        if (topRows < 0 || bottomRows < 0 || leftCols < 0 || rightCols < 0) {
            throw new IllegalArgumentException("label band counts must be non-negative");
        }
    }
}
