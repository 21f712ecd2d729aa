package com.acme.nummern.script.model;

/** Zero-based row/column pair inside one region. */
public record CellAddress(int row, int col) {
    public CellAddress {
        if (row < 0 || col < 0) {
            throw new IllegalArgumentException("negative cell address: row=" + row + " col=" + col);
        }
    }
}
