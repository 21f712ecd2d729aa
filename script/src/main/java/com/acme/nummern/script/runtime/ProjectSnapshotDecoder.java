package com.acme.nummern.script.runtime;

import com.acme.nummern.script.model.CellValue;
import com.acme.nummern.script.model.ColumnDataType;
import com.acme.nummern.script.model.FormulaSpec;
import com.acme.nummern.script.model.GridSpec;
import com.acme.nummern.script.model.LabelBands;
import com.acme.nummern.script.model.ProjectModel;
import com.acme.nummern.script.model.RangeValue;
import com.acme.nummern.script.model.Rect;
import com.acme.nummern.script.model.SheetModel;
import com.acme.nummern.script.model.TableModel;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps the runtime's JSON snapshot onto {@link ProjectModel}.
 *
 * <p>Cell values are {@code {"type": ..., "value": ...}} objects with type one
 * of {@code string}, {@code number}, {@code bool}, {@code empty}, {@code date}
 * or {@code time}.</p>
 */
public final class ProjectSnapshotDecoder {
    private ProjectSnapshotDecoder() {
    }

    /** @throws IllegalArgumentException when the structure does not match */
    public static ProjectModel decode(JsonNode root) {
        JsonNode sheets = requireArray(root, "sheets");
        List<SheetModel> out = new ArrayList<>(sheets.size());
        for (JsonNode sheet : sheets) {
            List<TableModel> tables = new ArrayList<>();
            JsonNode tableNodes = sheet.get("tables");
            if (tableNodes != null && tableNodes.isArray()) {
                for (JsonNode table : tableNodes) {
                    tables.add(decodeTable(table));
                }
            }
            out.add(new SheetModel(requireText(sheet, "id"), textOr(sheet, "name", ""), tables));
        }
        return new ProjectModel(out);
    }

    public static CellValue decodeValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return CellValue.empty();
        }
        if (!node.isObject()) {
            // bare JSON scalars from older runtimes
            if (node.isBoolean()) {
                return CellValue.bool(node.booleanValue());
            }
            if (node.isNumber()) {
                return CellValue.number(node.doubleValue());
            }
            return CellValue.text(node.asText());
        }
        String type = textOr(node, "type", "empty");
        JsonNode value = node.get("value");
        switch (type) {
            case "string":
                return CellValue.text(value == null ? "" : value.asText());
            case "number":
                return CellValue.number(value == null ? 0.0d : numberOf(value));
            case "bool":
                return CellValue.bool(value != null && value.asBoolean());
            case "date":
                try {
                    return CellValue.date(LocalDate.parse(value == null ? "" : value.asText()));
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("Invalid date value: " + value, e);
                }
            case "time":
                return CellValue.time(timeOf(value));
            case "empty":
                return CellValue.empty();
            default:
                throw new IllegalArgumentException("Unknown value type: " + type);
        }
    }

    private static TableModel decodeTable(JsonNode table) {
        String id = requireText(table, "id");
        Rect rect = Rect.ZERO;
        JsonNode r = table.get("rect");
        if (r != null && r.isObject()) {
            rect = new Rect(r.path("x").asDouble(), r.path("y").asDouble(), r.path("width").asDouble(), r.path("height").asDouble());
        }
        JsonNode g = table.path("gridSpec");
        JsonNode b = g.path("labelBands");
        GridSpec grid = new GridSpec(g.path("bodyRows").asInt(), g.path("bodyCols").asInt(),
            new LabelBands(b.path("topRows").asInt(), b.path("bottomRows").asInt(),
                b.path("leftCols").asInt(), b.path("rightCols").asInt()));

        Map<String, CellValue> cells = new HashMap<>();
        fields(table.get("cellValues")).forEachRemaining(e -> {
            CellValue v = decodeValue(e.getValue());
            if (!v.isEmpty()) {
                cells.put(e.getKey(), v);
            }
        });

        Map<String, RangeValue> ranges = new HashMap<>();
        fields(table.get("rangeValues")).forEachRemaining(e -> {
            List<List<CellValue>> rows = new ArrayList<>();
            for (JsonNode row : e.getValue().path("values")) {
                List<CellValue> decoded = new ArrayList<>();
                for (JsonNode cell : row) {
                    decoded.add(decodeValue(cell));
                }
                rows.add(decoded);
            }
            JsonNode dtype = e.getValue().get("dtype");
            ranges.put(e.getKey(), new RangeValue(rows, dtype == null || dtype.isNull() ? null : dtype.asText()));
        });

        Map<String, FormulaSpec> formulas = new HashMap<>();
        fields(table.get("formulas")).forEachRemaining(e -> {
            JsonNode f = e.getValue();
            String text = f.isObject() ? f.path("formula").asText("") : f.asText("");
            if (!text.isEmpty()) {
                formulas.put(e.getKey(), new FormulaSpec(text));
            }
        });

        Map<Integer, ColumnDataType> types = new HashMap<>();
        Set<Integer> explicit = new HashSet<>();
        fields(table.get("columnTypes")).forEachRemaining(e -> {
            ColumnDataType type = ColumnDataType.fromWireName(e.getValue().asText());
            if (type != null) {
                int col = Integer.parseInt(e.getKey());
                types.put(col, type);
                explicit.add(col);
            }
        });

        return new TableModel(id, textOr(table, "name", id), rect, grid, cells, ranges, formulas, types, explicit, null);
    }

    private static double numberOf(JsonNode value) {
        if (value.isNumber()) {
            return value.doubleValue();
        }
        String text = value.asText();
        switch (text) {
            case "nan":
            case "NaN":
                return Double.NaN;
            case "inf":
            case "Infinity":
                return Double.POSITIVE_INFINITY;
            case "-inf":
            case "-Infinity":
                return Double.NEGATIVE_INFINITY;
            default:
                try {
                    return Double.parseDouble(text);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid number value: " + text, e);
                }
        }
    }

    private static double timeOf(JsonNode value) {
        if (value == null) {
            return 0.0d;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        try {
            return LocalTime.parse(value.asText()).toNanoOfDay() / 1_000_000_000.0d;
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid time value: " + value, e);
        }
    }

    private static Iterator<Map.Entry<String, JsonNode>> fields(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Collections.emptyIterator();
        }
        return node.fields();
    }

    private static JsonNode requireArray(JsonNode node, String field) {
        JsonNode v = node == null ? null : node.get(field);
        if (v == null || !v.isArray()) {
            throw new IllegalArgumentException("Snapshot field '" + field + "' must be an array");
        }
        return v;
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual()) {
            throw new IllegalArgumentException("Snapshot field '" + field + "' must be a string");
        }
        return v.asText();
    }

    private static String textOr(JsonNode node, String field, String fallback) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? fallback : v.asText();
    }
}
