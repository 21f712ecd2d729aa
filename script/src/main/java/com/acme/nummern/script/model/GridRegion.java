package com.acme.nummern.script.model;

public enum GridRegion {
    BODY("body"),
    TOP_LABELS("top_labels"),
    BOTTOM_LABELS("bottom_labels"),
    LEFT_LABELS("left_labels"),
    RIGHT_LABELS("right_labels");

    private final String wireName;

    GridRegion(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isLabelBand() {
        return this != BODY;
    }

    /** Returns the region for a wire name, or {@code null} when unknown. */
    public static GridRegion fromWireName(String raw) {
        if (raw == null) {
            return null;
        }
        for (GridRegion region : values()) {
            if (region.wireName.equals(raw)) {
                return region;
            }
        }
        return null;
    }
}
