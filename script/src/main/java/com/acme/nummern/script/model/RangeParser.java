package com.acme.nummern.script.model;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses address tokens: {@code region[A0]}, {@code region[A0:B3]}, or a bare
 * {@code A0}/{@code A0:B3} which defaults to the body region. Rows are zero-based.
 * Absolute markers ({@code $}) are accepted and ignored.
 */
public final class RangeParser {
    private static final Pattern CELL = Pattern.compile("\\$?([A-Za-z]+)\\$?([0-9]+)");

    private RangeParser() {
    }

    public static RangeAddress parse(String input) throws RangeParseException {
        if (input == null) {
            throw new RangeParseException(RangeParseException.Reason.INVALID_FORMAT, "null");
        }
        String trimmed = input.trim();
        GridRegion region = GridRegion.BODY;
        String inner = trimmed;
        int bracket = trimmed.indexOf('[');
        if (bracket >= 0) {
            if (!trimmed.endsWith("]")) {
                throw new RangeParseException(RangeParseException.Reason.INVALID_FORMAT, input);
            }
            region = GridRegion.fromWireName(trimmed.substring(0, bracket).trim());
            if (region == null) {
                throw new RangeParseException(RangeParseException.Reason.INVALID_REGION, input);
            }
            inner = trimmed.substring(bracket + 1, trimmed.length() - 1);
        }
        String[] parts = inner.split(":", -1);
        if (parts.length == 1) {
            CellAddress cell = parseCell(parts[0]);
            return new RangeAddress(region, cell, cell);
        }
        if (parts.length == 2) {
            return new RangeAddress(region, parseCell(parts[0]), parseCell(parts[1]));
        }
        throw new RangeParseException(RangeParseException.Reason.INVALID_FORMAT, input);
    }

    public static CellAddress parseCell(String input) throws RangeParseException {
        Matcher m = CELL.matcher(input == null ? "" : input.trim());
        if (!m.matches()) {
            throw new RangeParseException(RangeParseException.Reason.INVALID_CELL_REFERENCE, String.valueOf(input));
        }
        int row;
        try {
            row = Integer.parseInt(m.group(2));
        } catch (NumberFormatException e) {
            throw new RangeParseException(RangeParseException.Reason.INVALID_CELL_REFERENCE, input);
        }
        return new CellAddress(row, columnIndex(m.group(1)));
    }

    public static int columnIndex(String label) throws RangeParseException {
        String upper = label == null ? "" : label.trim().toUpperCase(Locale.ROOT);
        if (upper.isEmpty()) {
            throw new RangeParseException(RangeParseException.Reason.INVALID_CELL_REFERENCE, String.valueOf(label));
        }
        int value = 0;
        for (int i = 0; i < upper.length(); i++) {
            char ch = upper.charAt(i);
            if (ch < 'A' || ch > 'Z') {
                throw new RangeParseException(RangeParseException.Reason.INVALID_CELL_REFERENCE, label);
            }
            value = value * 26 + (ch - 'A' + 1);
        }
        return value - 1;
    }

    public static String columnLabel(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Column index must be non-negative: " + index);
        }
        int number = index + 1;
        StringBuilder sb = new StringBuilder();
        while (number > 0) {
            int remainder = (number - 1) % 26;
            sb.append((char) ('A' + remainder));
            number = (number - 1) / 26;
        }
        return sb.reverse().toString();
    }

    public static String cellLabel(int row, int col) {
        return columnLabel(col) + row;
    }

    public static String address(GridRegion region, int row, int col) {
        return region.wireName() + "[" + cellLabel(row, col) + "]";
    }
}
