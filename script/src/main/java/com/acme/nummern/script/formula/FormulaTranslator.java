package com.acme.nummern.script.formula;

import com.acme.nummern.script.literal.Identifiers;
import com.acme.nummern.script.literal.LiteralEncoder;
import com.acme.nummern.script.model.GridRegion;
import com.acme.nummern.script.model.RangeAddress;
import com.acme.nummern.script.model.RangeParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates spreadsheet formulas into script text.
 *
 * <p>Forms are tried in order: aggregate helper call, inline arithmetic,
 * generic {@code formula('...')} fallback.</p>
 */
public final class FormulaTranslator {
    static final Map<String, String> AGGREGATE_HELPERS = Map.of(
        "SUM", "c_sum",
        "AVERAGE", "c_avg",
        "MIN", "c_min",
        "MAX", "c_max",
        "COUNT", "c_count",
        "COUNTA", "c_counta"
    );

    private static final Pattern CALL = Pattern.compile("^([A-Za-z]+)\\s*\\((.*)\\)$", Pattern.DOTALL);
    private static final Pattern NUMBER = Pattern.compile("[-+]?[0-9]+(\\.[0-9]+)?");
    private static final Pattern REFERENCE_ARG = Pattern.compile("[A-Za-z0-9_.:]+");
    private static final Pattern INLINE_REFERENCE = Pattern.compile(
        "[A-Za-z]+[0-9]+|[A-Za-z_][A-Za-z0-9_]*\\.[A-Za-z]+[0-9]+");
    private static final Pattern UNSIGNED_NUMBER = Pattern.compile("[0-9]+(\\.[0-9]+)?");
    private static final Pattern NUMPY_AGGREGATE = Pattern.compile(
        "(?<![A-Za-z0-9_.])(SUM|AVERAGE|MIN|MAX)\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Map<String, String> NUMPY_NAMES = Map.of(
        "SUM", "np.sum",
        "AVERAGE", "np.mean",
        "MIN", "np.min",
        "MAX", "np.max"
    );

    private FormulaTranslator() {
    }

    /** Strips the leading {@code =} and surrounding whitespace. */
    public static String body(String formula) {
        String trimmed = formula == null ? "" : formula.trim();
        return trimmed.startsWith("=") ? trimmed.substring(1).trim() : trimmed;
    }

    public static FormulaRendering translate(String formula) {
        String body = body(formula);
        FormulaRendering aggregate = tryAggregate(body);
        if (aggregate != null) {
            return aggregate;
        }
        if (isInline(body)) {
            return new FormulaRendering.InlineExpression(body.toLowerCase(Locale.ROOT));
        }
        String source = containsStringLiteral(body) ? body : rewriteNumpyAggregates(body);
        return new FormulaRendering.GenericFormula(source, "formula(" + LiteralEncoder.encodeString(source) + ")");
    }

    /**
     * Lines for setting {@code formula} on {@code target}. A single cell renders as a
     * context block, a multi-cell range as one {@code set_formula} call, and a blank
     * formula as {@code clear_formula}.
     */
    public static List<String> renderSetFormula(String tableId, RangeAddress target, String formula) {
        String table = "proj.table(" + LiteralEncoder.encodeString(tableId) + ")";
        String address = LiteralEncoder.encodeString(target.toWire());
        if (body(formula).isEmpty()) {
            return List.of(table + ".clear_formula(" + address + ")");
        }
        if (!target.isSingleCell()) {
            return List.of(table + ".set_formula(" + address + ", " + LiteralEncoder.encodeString(formula.trim()) + ")");
        }
        List<String> lines = new ArrayList<>(3);
        lines.add("t = " + table);
        lines.add("with table_context(t):");
        lines.add("    " + targetIdentifier(target) + " = " + translate(formula).expression());
        return lines;
    }

    /** {@code c0} for a body cell, {@code top_labels.a0} for a label-band cell. */
    public static String targetIdentifier(RangeAddress target) {
        String cell = Identifiers.cellIdentifier(RangeParser.cellLabel(target.start().row(), target.start().col()));
        if (target.region() == GridRegion.BODY) {
            return cell;
        }
        return target.region().wireName() + "." + cell;
    }

    private static FormulaRendering tryAggregate(String body) {
        Matcher m = CALL.matcher(body);
        if (!m.matches()) {
            return null;
        }
        String helper = AGGREGATE_HELPERS.get(m.group(1).toUpperCase(Locale.ROOT));
        if (helper == null || m.group(2).isBlank()) {
            return null;
        }
        List<String> args = new ArrayList<>();
        for (String raw : m.group(2).split(",", -1)) {
            String arg = raw.trim();
            if (!NUMBER.matcher(arg).matches() && !REFERENCE_ARG.matcher(arg).matches()) {
                return null;
            }
            args.add(LiteralEncoder.encodeString(arg.toLowerCase(Locale.ROOT)));
        }
        return new FormulaRendering.AggregateCall(helper, args);
    }

    static boolean isInline(String body) {
        if (body.isEmpty()) {
            return false;
        }
        for (int i = 0; i < body.length(); i++) {
            char ch = body.charAt(i);
            boolean allowed = Character.isLetterOrDigit(ch) && ch < 0x80
                || ch == '_' || ch == '.' || ch == '+' || ch == '-' || ch == '*' || ch == '/'
                || ch == ' ' || ch == '\t';
            if (!allowed) {
                return false;
            }
        }
        String[] operands = body.split("[+\\-*/]", -1);
        boolean sawReference = false;
        for (int i = 0; i < operands.length; i++) {
            String operand = operands[i].trim();
            if (operand.isEmpty()) {
                // unary sign; a trailing operator has nothing to apply to
                if (i == operands.length - 1) {
                    return false;
                }
                continue;
            }
            if (INLINE_REFERENCE.matcher(operand).matches()) {
                sawReference = true;
            } else if (!UNSIGNED_NUMBER.matcher(operand).matches()) {
                return false;
            }
        }
        return sawReference;
    }

    private static boolean containsStringLiteral(String body) {
        return body.indexOf('\'') >= 0 || body.indexOf('"') >= 0;
    }

    private static String rewriteNumpyAggregates(String body) {
        Matcher m = NUMPY_AGGREGATE.matcher(body);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(NUMPY_NAMES.get(m.group(1).toUpperCase(Locale.ROOT)) + "("));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
