package com.acme.nummern.script.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A rectangular span inside one region. Start and end are normalized so that
 * start is the top-left corner.
 */
public record RangeAddress(GridRegion region, CellAddress start, CellAddress end) {
    public RangeAddress {
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        CellAddress topLeft = new CellAddress(Math.min(start.row(), end.row()), Math.min(start.col(), end.col()));
        CellAddress bottomRight = new CellAddress(Math.max(start.row(), end.row()), Math.max(start.col(), end.col()));
        start = topLeft;
        end = bottomRight;
    }

    public static RangeAddress single(GridRegion region, int row, int col) {
        CellAddress cell = new CellAddress(row, col);
        return new RangeAddress(region, cell, cell);
    }

    public boolean isSingleCell() {
        return start.equals(end);
    }

    public int rowCount() {
        return end.row() - start.row() + 1;
    }

    public int colCount() {
        return end.col() - start.col() + 1;
    }

    public boolean contains(GridRegion otherRegion, CellAddress cell) {
        return region == otherRegion
            && cell.row() >= start.row() && cell.row() <= end.row()
            && cell.col() >= start.col() && cell.col() <= end.col();
    }

    public boolean overlaps(RangeAddress other) {
        return region == other.region
            && start.row() <= other.end.row() && other.start.row() <= end.row()
            && start.col() <= other.end.col() && other.start.col() <= end.col();
    }

    /** Cells in row-major order. */
    public List<CellAddress> cells() {
        List<CellAddress> out = new ArrayList<>(rowCount() * colCount());
        for (int r = start.row(); r <= end.row(); r++) {
            for (int c = start.col(); c <= end.col(); c++) {
                out.add(new CellAddress(r, c));
            }
        }
        return out;
    }

    /** Wire form, e.g. {@code body[A0:B1]} or {@code top_labels[C2]}. */
    public String toWire() {
        String inner = RangeParser.cellLabel(start.row(), start.col());
        if (!isSingleCell()) {
            inner += ":" + RangeParser.cellLabel(end.row(), end.col());
        }
        return region.wireName() + "[" + inner + "]";
    }
}
