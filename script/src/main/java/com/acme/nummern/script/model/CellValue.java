package com.acme.nummern.script.model;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.text.ParsePosition;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;

/**
 * Typed cell value. Equality is structural; dates and times carry no zone.
 */
public sealed interface CellValue
    permits CellValue.TextValue, CellValue.NumberValue, CellValue.BoolValue,
            CellValue.DateValue, CellValue.TimeValue, CellValue.Empty {

    record TextValue(String value) implements CellValue {
        public TextValue {
            Objects.requireNonNull(value, "value");
        }
    }

    record NumberValue(double value) implements CellValue {}

    record BoolValue(boolean value) implements CellValue {}

    record DateValue(LocalDate value) implements CellValue {
        public DateValue {
            Objects.requireNonNull(value, "value");
        }
    }

    /** Seconds since midnight. */
    record TimeValue(double seconds) implements CellValue {}

    record Empty() implements CellValue {}

    static CellValue text(String value) {
        return new TextValue(value);
    }

    static CellValue number(double value) {
        return new NumberValue(value);
    }

    static CellValue bool(boolean value) {
        return new BoolValue(value);
    }

    static CellValue date(LocalDate value) {
        return new DateValue(value);
    }

    static CellValue time(double seconds) {
        return new TimeValue(seconds);
    }

    static CellValue empty() {
        return new Empty();
    }

    default boolean isEmpty() {
        return this instanceof Empty;
    }

    static CellValue fromUserInput(String input) {
        if (input == null) {
            return empty();
        }
        String trimmed = input.trim();
        if (trimmed.isEmpty()) {
            return empty();
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.equals("true")) {
            return bool(true);
        }
        if (lower.equals("false")) {
            return bool(false);
        }
        try {
            return number(Double.parseDouble(trimmed));
        } catch (NumberFormatException ignored) {
            return text(trimmed);
        }
    }

    /**
     * Parses editor input for a column of the given type, falling back to
     * untyped parsing when the text does not fit the type.
     */
    static CellValue fromUserInput(String input, ColumnDataType columnType, Locale locale) {
        if (columnType == null || input == null || input.isBlank()) {
            return fromUserInput(input);
        }
        String trimmed = input.trim();
        switch (columnType) {
            case DATE -> {
                try {
                    return date(LocalDate.parse(trimmed));
                } catch (DateTimeParseException ignored) {
                    return fromUserInput(trimmed);
                }
            }
            case TIME -> {
                try {
                    LocalTime parsed = LocalTime.parse(trimmed);
                    return time(parsed.toNanoOfDay() / 1_000_000_000.0d);
                } catch (DateTimeParseException ignored) {
                    return fromUserInput(trimmed);
                }
            }
            case CURRENCY -> {
                Number parsed = parseFully(NumberFormat.getCurrencyInstance(locale), trimmed);
                return parsed == null ? fromUserInput(trimmed) : number(parsed.doubleValue());
            }
            case PERCENTAGE -> {
                Number parsed = parseFully(NumberFormat.getPercentInstance(locale), trimmed);
                if (parsed != null) {
                    return number(parsed.doubleValue());
                }
                if (trimmed.endsWith("%")) {
                    try {
                        BigDecimal raw = new BigDecimal(trimmed.substring(0, trimmed.length() - 1).trim());
                        return number(raw.movePointLeft(2).doubleValue());
                    } catch (NumberFormatException ignored) {
                        return text(trimmed);
                    }
                }
                return fromUserInput(trimmed);
            }
            default -> {
                return fromUserInput(trimmed);
            }
        }
    }

    private static Number parseFully(NumberFormat format, String text) {
        ParsePosition position = new ParsePosition(0);
        Number parsed = format.parse(text, position);
        if (parsed == null || position.getIndex() != text.length()) {
            return null;
        }
        return parsed;
    }

    default String displayString() {
        if (this instanceof TextValue t) {
            return t.value();
        }
        if (this instanceof NumberValue n) {
            double v = n.value();
            if (Double.isFinite(v) && v == Math.rint(v) && Math.abs(v) < 1e15) {
                return Long.toString((long) v);
            }
            return Double.toString(v);
        }
        if (this instanceof BoolValue b) {
            return b.value() ? "TRUE" : "FALSE";
        }
        if (this instanceof DateValue d) {
            return d.value().toString();
        }
        if (this instanceof TimeValue t) {
            return LocalTime.ofNanoOfDay(Math.floorMod(Math.round(t.seconds() * 1_000_000_000.0d), 86_400_000_000_000L)).toString();
        }
        return "";
    }
}
