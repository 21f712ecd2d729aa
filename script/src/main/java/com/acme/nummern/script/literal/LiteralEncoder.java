package com.acme.nummern.script.literal;

import com.acme.nummern.script.model.CellValue;
import com.acme.nummern.script.model.LabelBands;
import com.acme.nummern.script.model.Rect;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Renders values as Python source literals.
 *
 * <p>Every input has a defined encoding. Strings are single-quoted with all
 * control characters escaped, so the output can be re-parsed as source.</p>
 */
public final class LiteralEncoder {
    private static final char[] HEX = "0123456789abcdef".toCharArray();
    private static final long NANOS_PER_DAY = 86_400_000_000_000L;

    private LiteralEncoder() {
    }

    public static String encode(CellValue value) {
        if (value == null || value instanceof CellValue.Empty) {
            return "None";
        }
        if (value instanceof CellValue.TextValue t) {
            return encodeString(t.value());
        }
        if (value instanceof CellValue.NumberValue n) {
            return encodeNumber(n.value());
        }
        if (value instanceof CellValue.BoolValue b) {
            return b.value() ? "True" : "False";
        }
        if (value instanceof CellValue.DateValue d) {
            return encodeDate(d.value());
        }
        if (value instanceof CellValue.TimeValue t) {
            return encodeTime(t.seconds());
        }
        throw new IllegalStateException("Unhandled value: " + value);
    }

    public static String encodeString(String raw) {
        String s = raw == null ? "" : raw;
        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append('\'');
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            switch (ch) {
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (ch < 0x20 || ch == 0x7f) {
                        sb.append("\\x").append(HEX[(ch >> 4) & 0xf]).append(HEX[ch & 0xf]);
                    } else {
                        sb.append(ch);
                    }
                }
            }
        }
        return sb.append('\'').toString();
    }

    public static String encodeNumber(double v) {
        if (Double.isNaN(v)) {
            return "float('nan')";
        }
        if (Double.isInfinite(v)) {
            return v > 0 ? "float('inf')" : "-float('inf')";
        }
        if (v == Math.rint(v) && Math.abs(v) < 1e15) {
            return Long.toString((long) v);
        }
        return Double.toString(v);
    }

    public static String encodeDate(LocalDate date) {
        return "date.fromisoformat('" + date + "')";
    }

    /** {@code seconds} since midnight; wraps into one day. */
    public static String encodeTime(double seconds) {
        long nanos = Math.floorMod(Math.round(seconds * 1_000_000.0d) * 1_000L, NANOS_PER_DAY);
        LocalTime t = LocalTime.ofNanoOfDay(nanos);
        StringBuilder sb = new StringBuilder("time.fromisoformat('");
        sb.append(pad2(t.getHour())).append(':').append(pad2(t.getMinute())).append(':').append(pad2(t.getSecond()));
        int micros = t.getNano() / 1_000;
        if (micros != 0) {
            sb.append('.').append(String.format(Locale.ROOT, "%06d", micros));
        }
        return sb.append("')").toString();
    }

    public static String encodeList(List<CellValue> values) {
        return joinList(values, LiteralEncoder::encode);
    }

    public static String encodeStringList(List<String> values) {
        return joinList(values, LiteralEncoder::encodeString);
    }

    public static String encode2D(List<List<CellValue>> rows) {
        return joinList(rows, LiteralEncoder::encodeList);
    }

    /** {@code {'a': 1, 'b': 'x'}} with keys in sorted order. */
    public static String encodeDict(Map<String, CellValue> entries) {
        List<String> parts = new ArrayList<>(entries.size());
        for (Map.Entry<String, CellValue> e : new TreeMap<>(entries).entrySet()) {
            parts.add(encodeString(e.getKey()) + ": " + encode(e.getValue()));
        }
        return "{" + String.join(", ", parts) + "}";
    }

    public static String encodeRect(Rect rect) {
        return "Rect(" + encodeNumber(rect.x()) + ", " + encodeNumber(rect.y()) + ", "
            + encodeNumber(rect.width()) + ", " + encodeNumber(rect.height()) + ")";
    }

    public static String encodeLabels(LabelBands bands) {
        return "dict(" + encodeLabelArgs(bands) + ")";
    }

    /** Keyword form shared by creation and {@code set_labels} calls. */
    public static String encodeLabelArgs(LabelBands bands) {
        return "top=" + bands.topRows() + ", left=" + bands.leftCols()
            + ", bottom=" + bands.bottomRows() + ", right=" + bands.rightCols();
    }

    private static <T> String joinList(List<T> items, Function<T, String> render) {
        List<String> parts = new ArrayList<>(items.size());
        for (T item : items) {
            parts.add(render.apply(item));
        }
        return "[" + String.join(", ", parts) + "]";
    }

    private static String pad2(int v) {
        return v < 10 ? "0" + v : Integer.toString(v);
    }
}
