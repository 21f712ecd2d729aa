package com.acme.nummern.script.literal;

import java.util.Locale;
import java.util.Set;

/** Maps canonical ids onto valid Python identifiers. */
public final class Identifiers {
    private static final Set<String> RESERVED = Set.of(
        // names the generated log itself binds or imports
        "proj", "t", "np", "date", "time", "formula", "table_context", "label_context", "Project", "Rect",
        "c_sum", "c_avg", "c_min", "c_max", "c_count", "c_counta",
        "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
        "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
        "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");

    private Identifiers() {
    }

    /**
     * Replaces every character outside {@code [A-Za-z0-9_]} with an underscore
     * and prefixes a leading digit. Ids like {@code table_1} pass through unchanged.
     */
    public static String sanitize(String id) {
        if (id == null || id.isEmpty()) {
            return "_";
        }
        StringBuilder sb = new StringBuilder(id.length() + 1);
        for (int i = 0; i < id.length(); i++) {
            char ch = id.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || (ch >= '0' && ch <= '9') || ch == '_';
            sb.append(ok ? ch : '_');
        }
        if (Character.isDigit(sb.charAt(0))) {
            sb.insert(0, '_');
        }
        return sb.toString();
    }

    /** Name a table is bound to in generated text; reserved names get a trailing underscore. */
    public static String bindingName(String id) {
        String name = sanitize(id);
        return RESERVED.contains(name) ? name + "_" : name;
    }

    public static boolean isIdentifier(String text) {
        if (text == null || text.isEmpty() || Character.isDigit(text.charAt(0))) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (!(Character.isLetterOrDigit(ch) || ch == '_') || ch > 0x7f) {
                return false;
            }
        }
        return true;
    }

    /** Lower-case cell identifier used inside a table context, e.g. {@code c0}. */
    public static String cellIdentifier(String cellLabel) {
        return cellLabel.toLowerCase(Locale.ROOT);
    }
}
