package com.acme.nummern.script.formula;

import com.acme.nummern.script.literal.Identifiers;
import com.acme.nummern.script.model.CellAddress;
import com.acme.nummern.script.model.RangeParseException;
import com.acme.nummern.script.model.RangeParser;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Rewrites a formula into a NumPy expression over per-table arrays, for
 * scripts that run without the helper module.
 *
 * <p>{@code A0} becomes {@code table_1[0, 0]}, {@code A0:B1} becomes
 * {@code table_1[0:2, 0:2]} and aggregates map onto NumPy functions. Anything
 * else (strings, comparisons, absolute markers, unknown functions) has no
 * array form and yields {@link Optional#empty()}.</p>
 */
public final class ArrayExpressionTranslator {
    private static final Pattern CELL = Pattern.compile("[A-Za-z]+[0-9]+");
    private static final Map<String, String> FUNCTIONS = Map.of(
        "SUM", "np.sum",
        "AVERAGE", "np.mean",
        "MIN", "np.min",
        "MAX", "np.max",
        "COUNT", "np.size",
        "COUNTA", "np.count_nonzero"
    );

    private ArrayExpressionTranslator() {
    }

    public static Optional<String> translate(String formula, String tableId) {
        String body = FormulaTranslator.body(formula);
        if (body.isEmpty()) {
            return Optional.empty();
        }
        return new Scanner(body, Identifiers.bindingName(tableId)).run();
    }

    private static final class Scanner {
        private final String src;
        private final String tableVar;
        private final StringBuilder out = new StringBuilder();
        private int pos;
        private int depth;
        private boolean afterOperand;

        Scanner(String src, String tableVar) {
            this.src = src;
            this.tableVar = tableVar;
        }

        Optional<String> run() {
            try {
                while (true) {
                    skipSpaces();
                    if (pos >= src.length()) {
                        break;
                    }
                    step();
                }
            } catch (RangeParseException | IllegalStateException e) {
                return Optional.empty();
            }
            if (depth != 0 || !afterOperand) {
                return Optional.empty();
            }
            return Optional.of(out.toString());
        }

        private void step() throws RangeParseException {
            char ch = src.charAt(pos);
            if (Character.isDigit(ch)) {
                out.append(readNumber());
                afterOperand = true;
            } else if (isWordStart(ch)) {
                word();
            } else if (ch == '+' || ch == '-' || ch == '*' || ch == '/') {
                pos++;
                if (afterOperand) {
                    out.append(' ').append(ch).append(' ');
                } else {
                    out.append(ch);
                }
                afterOperand = false;
            } else if (ch == '(') {
                pos++;
                depth++;
                out.append('(');
                afterOperand = false;
            } else if (ch == ')') {
                pos++;
                if (--depth < 0) {
                    throw new IllegalStateException("unbalanced");
                }
                out.append(')');
                afterOperand = true;
            } else if (ch == ',' && depth > 0) {
                pos++;
                out.append(", ");
                afterOperand = false;
            } else {
                throw new IllegalStateException("unsupported character " + ch);
            }
        }

        private void word() throws RangeParseException {
            String word = readWord();
            skipSpaces();
            char next = pos < src.length() ? src.charAt(pos) : '\0';
            if (next == '(') {
                String fn = FUNCTIONS.get(word.toUpperCase(Locale.ROOT));
                if (fn == null) {
                    throw new IllegalStateException("unknown function " + word);
                }
                out.append(fn);
                afterOperand = false;
                return;
            }
            String target = tableVar;
            String cell = word;
            if (next == '.') {
                pos++;
                target = Identifiers.bindingName(word);
                cell = readWord();
            }
            if (!CELL.matcher(cell).matches()) {
                throw new IllegalStateException("not a cell reference: " + cell);
            }
            CellAddress start = RangeParser.parseCell(cell);
            if (pos < src.length() && src.charAt(pos) == ':') {
                pos++;
                CellAddress end = RangeParser.parseCell(readWord());
                int r0 = Math.min(start.row(), end.row());
                int r1 = Math.max(start.row(), end.row());
                int c0 = Math.min(start.col(), end.col());
                int c1 = Math.max(start.col(), end.col());
                out.append(target).append('[').append(r0).append(':').append(r1 + 1)
                    .append(", ").append(c0).append(':').append(c1 + 1).append(']');
            } else {
                out.append(target).append('[').append(start.row()).append(", ").append(start.col()).append(']');
            }
            afterOperand = true;
        }

        private String readNumber() {
            int begin = pos;
            while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '.')) {
                pos++;
            }
            return src.substring(begin, pos);
        }

        private String readWord() {
            int begin = pos;
            while (pos < src.length() && (isWordStart(src.charAt(pos)) || Character.isDigit(src.charAt(pos)))) {
                pos++;
            }
            if (begin == pos) {
                throw new IllegalStateException("expected identifier at " + pos);
            }
            return src.substring(begin, pos);
        }

        private void skipSpaces() {
            while (pos < src.length() && Character.isWhitespace(src.charAt(pos))) {
                pos++;
            }
        }

        private static boolean isWordStart(char ch) {
            return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_';
        }
    }
}
