package com.acme.nummern.script.export;

import com.acme.nummern.script.formula.ArrayExpressionTranslator;
import com.acme.nummern.script.literal.Identifiers;
import com.acme.nummern.script.literal.LiteralEncoder;
import com.acme.nummern.script.model.CellAddress;
import com.acme.nummern.script.model.CellValue;
import com.acme.nummern.script.model.FormulaSpec;
import com.acme.nummern.script.model.GridRegion;
import com.acme.nummern.script.model.GridSpec;
import com.acme.nummern.script.model.LabelBands;
import com.acme.nummern.script.model.ProjectModel;
import com.acme.nummern.script.model.RangeAddress;
import com.acme.nummern.script.model.RangeParseException;
import com.acme.nummern.script.model.RangeParser;
import com.acme.nummern.script.model.RangeValue;
import com.acme.nummern.script.model.SheetModel;
import com.acme.nummern.script.model.TableModel;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Emits a self-contained NumPy script that rebuilds every table as arrays.
 * The output needs neither the helper module nor the normalizer and is not
 * meant to be fed back into the log.
 *
 * <p>Tables end up in a {@code tables} dict keyed by table id, each entry
 * holding {@code body}, {@code labels} and {@code formulas}. The body is also
 * bound to a variable named after the table so that translated formulas can
 * index it directly.</p>
 */
public final class StandaloneScriptExporter {
    private static final Logger LOG = Logger.getLogger(StandaloneScriptExporter.class.getName());

    static final String HEADER = "import numpy as np\nfrom datetime import date, time\n";

    private StandaloneScriptExporter() {
    }

    public static String export(ProjectModel project, boolean includeFormulas) {
        StringBuilder out = new StringBuilder(HEADER);
        out.append('\n').append("tables = {}\n");
        for (SheetModel sheet : project.sheets()) {
            for (TableModel table : sheet.tables()) {
                out.append('\n');
                appendTable(out, sheet, table);
            }
        }
        if (includeFormulas) {
            appendFormulas(out, project);
        }
        return out.toString();
    }

    private static void appendTable(StringBuilder out, SheetModel sheet, TableModel table) {
        String var = Identifiers.bindingName(table.id());
        String key = LiteralEncoder.encodeString(table.id());
        GridSpec grid = table.gridSpec();
        LabelBands bands = grid.labelBands();
        Map<String, CellValue> values = flatten(table);

        out.append("# ").append(oneLine(sheet.name())).append(" / ").append(oneLine(table.name())).append('\n');
        out.append(var).append(" = ").append(array(values, GridRegion.BODY, grid.bodyRows(), grid.bodyCols())).append('\n');
        out.append("tables[").append(key).append("] = {'body': ").append(var)
            .append(", 'labels': {}, 'formulas': {}}\n");
        appendBand(out, key, "top", values, GridRegion.TOP_LABELS, bands.topRows(), grid.bodyCols());
        appendBand(out, key, "bottom", values, GridRegion.BOTTOM_LABELS, bands.bottomRows(), grid.bodyCols());
        appendBand(out, key, "left", values, GridRegion.LEFT_LABELS, grid.bodyRows(), bands.leftCols());
        appendBand(out, key, "right", values, GridRegion.RIGHT_LABELS, grid.bodyRows(), bands.rightCols());
    }

    private static void appendBand(StringBuilder out, String key, String name, Map<String, CellValue> values,
                                   GridRegion region, int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            return;
        }
        out.append("tables[").append(key).append("]['labels'][").append(LiteralEncoder.encodeString(name))
            .append("] = ").append(array(values, region, rows, cols)).append('\n');
    }

    private static void appendFormulas(StringBuilder out, ProjectModel project) {
        boolean header = false;
        for (SheetModel sheet : project.sheets()) {
            for (TableModel table : sheet.tables()) {
                for (Map.Entry<String, FormulaSpec> e : table.formulas().entrySet()) {
                    if (!header) {
                        out.append("\n# Formulas\n");
                        header = true;
                    }
                    appendFormula(out, table, e.getKey(), e.getValue().formula());
                }
            }
        }
    }

    private static void appendFormula(StringBuilder out, TableModel table, String target, String formula) {
        String key = LiteralEncoder.encodeString(table.id());
        out.append("tables[").append(key).append("]['formulas'][").append(LiteralEncoder.encodeString(target))
            .append("] = ").append(LiteralEncoder.encodeString(formula)).append('\n');
        RangeAddress address;
        try {
            address = RangeParser.parse(target);
        } catch (RangeParseException e) {
            LOG.fine(() -> "Skipping formula with unparsable target " + target);
            out.append(comment(table.id(), target, formula));
            return;
        }
        Optional<String> expr = ArrayExpressionTranslator.translate(formula, table.id());
        if (address.region() != GridRegion.BODY || !address.isSingleCell() || expr.isEmpty()) {
            out.append(comment(table.id(), target, formula));
            return;
        }
        CellAddress cell = address.start();
        out.append(Identifiers.bindingName(table.id())).append('[').append(cell.row()).append(", ")
            .append(cell.col()).append("] = ").append(expr.get()).append('\n');
    }

    private static String comment(String tableId, String target, String formula) {
        return "# not expressible as arrays: " + oneLine(tableId) + " " + oneLine(target) + " " + oneLine(formula) + '\n';
    }

    /** Text safe inside a comment: a line break would end it. */
    static String oneLine(String text) {
        return text.replace('\n', ' ').replace('\r', ' ');
    }

    /** Cell values by wire key, stored ranges first so explicit cells win. */
    private static Map<String, CellValue> flatten(TableModel table) {
        Map<String, CellValue> out = new HashMap<>();
        for (Map.Entry<String, RangeValue> e : table.rangeValues().entrySet()) {
            RangeAddress range;
            try {
                range = RangeParser.parse(e.getKey());
            } catch (RangeParseException ex) {
                LOG.fine(() -> "Skipping range with unparsable key " + e.getKey());
                continue;
            }
            List<List<CellValue>> rows = e.getValue().values();
            for (int i = 0; i < rows.size(); i++) {
                for (int j = 0; j < rows.get(i).size(); j++) {
                    out.put(RangeAddress.single(range.region(), range.start().row() + i, range.start().col() + j).toWire(),
                        rows.get(i).get(j));
                }
            }
        }
        out.putAll(table.cellValues());
        return out;
    }

    static String array(Map<String, CellValue> values, GridRegion region, int rows, int cols) {
        List<List<CellValue>> grid = new ArrayList<>(rows);
        boolean numeric = true;
        for (int r = 0; r < rows; r++) {
            List<CellValue> row = new ArrayList<>(cols);
            for (int c = 0; c < cols; c++) {
                CellValue v = values.getOrDefault(RangeAddress.single(region, r, c).toWire(), CellValue.empty());
                if (!v.isEmpty() && !(v instanceof CellValue.NumberValue)) {
                    numeric = false;
                }
                row.add(v);
            }
            grid.add(row);
        }
        StringBuilder sb = new StringBuilder("np.array([");
        for (int r = 0; r < grid.size(); r++) {
            if (r > 0) {
                sb.append(", ");
            }
            sb.append('[');
            List<CellValue> row = grid.get(r);
            for (int c = 0; c < row.size(); c++) {
                if (c > 0) {
                    sb.append(", ");
                }
                CellValue v = row.get(c);
                sb.append(v.isEmpty() && numeric ? "np.nan" : LiteralEncoder.encode(v));
            }
            sb.append(']');
        }
        return sb.append("], dtype=").append(numeric ? "float" : "object").append(')').toString();
    }
}
