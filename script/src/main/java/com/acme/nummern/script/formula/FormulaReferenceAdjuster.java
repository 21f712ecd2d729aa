package com.acme.nummern.script.formula;

import com.acme.nummern.script.model.RangeParseException;
import com.acme.nummern.script.model.RangeParser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shifts relative cell references when a formula is copied to another cell.
 * Absolute parts ({@code $B}, {@code $3}) stay put, table-qualified references
 * and quoted text are left alone. Shifted indices clamp at zero.
 */
public final class FormulaReferenceAdjuster {
    private static final Pattern REFERENCE = Pattern.compile(
        "(?<![A-Za-z0-9_.$])(\\$?)([A-Za-z]{1,3})(\\$?)([0-9]+)(?![A-Za-z0-9_(])");

    private FormulaReferenceAdjuster() {
    }

    public static String adjust(String formula, int rowDelta, int colDelta) {
        if (formula == null || formula.isEmpty() || (rowDelta == 0 && colDelta == 0)) {
            return formula;
        }
        StringBuilder out = new StringBuilder(formula.length());
        int segmentStart = 0;
        char quote = 0;
        for (int i = 0; i < formula.length(); i++) {
            char ch = formula.charAt(i);
            if (quote == 0 && (ch == '\'' || ch == '"')) {
                out.append(shiftSegment(formula.substring(segmentStart, i), rowDelta, colDelta));
                segmentStart = i;
                quote = ch;
            } else if (quote != 0 && ch == quote) {
                out.append(formula, segmentStart, i + 1);
                segmentStart = i + 1;
                quote = 0;
            }
        }
        String tail = formula.substring(segmentStart);
        out.append(quote == 0 ? shiftSegment(tail, rowDelta, colDelta) : tail);
        return out.toString();
    }

    private static String shiftSegment(String segment, int rowDelta, int colDelta) {
        Matcher m = REFERENCE.matcher(segment);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(shift(m, rowDelta, colDelta)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String shift(Matcher m, int rowDelta, int colDelta) {
        boolean absoluteCol = !m.group(1).isEmpty();
        boolean absoluteRow = !m.group(3).isEmpty();
        String colLabel = m.group(2);
        int row;
        try {
            row = Integer.parseInt(m.group(4));
        } catch (NumberFormatException e) {
            return m.group();
        }
        if (!absoluteCol) {
            try {
                colLabel = RangeParser.columnLabel(Math.max(0, RangeParser.columnIndex(colLabel) + colDelta));
            } catch (RangeParseException e) {
                return m.group();
            }
        }
        if (!absoluteRow) {
            row = Math.max(0, row + rowDelta);
        }
        return m.group(1) + colLabel + m.group(3) + row;
    }
}
