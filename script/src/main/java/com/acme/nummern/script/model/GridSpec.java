package com.acme.nummern.script.model;

import java.util.Objects;

public record GridSpec(int bodyRows, int bodyCols, LabelBands labelBands) {
    public GridSpec {
        Objects.requireNonNull(labelBands, "labelBands");
        if (bodyRows < 0 || bodyCols < 0) {
            throw new IllegalArgumentException("body dimensions must be non-negative");
        }
    }

    public GridSpec withBodyRows(int rows) {
        return new GridSpec(rows, bodyCols, labelBands);
    }

    public GridSpec withBodyCols(int cols) {
        return new GridSpec(bodyRows, cols, labelBands);
    }

    public GridSpec withLabelBands(LabelBands bands) {
        return new GridSpec(bodyRows, bodyCols, bands);
    }
}
