package com.acme.nummern.script.normalize;

import java.util.List;
import java.util.Set;

/**
 * Classifies a single line by scanning its tokens. Indentation is ignored here;
 * callers decide which indentation levels they accept.
 */
public final class LineClassifier {
    private static final Set<String> CREATION_METHODS = Set.of("add_table", "add_summary_table");
    private static final Set<String> LITERAL_CONSTRUCTORS = Set.of("date.fromisoformat", "time.fromisoformat", "float");

    private LineClassifier() {
    }

    public static ClassifiedLine classify(String line) {
        List<Token> tokens = withoutComment(ScriptTokenizer.tokenize(line));
        if (tokens.isEmpty()) {
            return new ClassifiedLine.Other(null);
        }
        if (tokens.get(0).isIdentifier("with")) {
            ClassifiedLine header = header(tokens);
            if (header != null) {
                return header;
            }
        }
        if (tokens.size() > 2 && tokens.get(0).kind() == Token.Kind.IDENTIFIER && tokens.get(1).isOperator("=")) {
            List<Token> rhs = tokens.subList(2, tokens.size());
            String alias = tokens.get(0).text();
            String looked = lookupTarget(rhs);
            if (looked != null) {
                return new ClassifiedLine.LookupAlias(alias, looked);
            }
            String created = createdTable(rhs);
            if (created != null) {
                return new ClassifiedLine.ConstructorAlias(alias, created);
            }
        }
        String created = createdTable(tokens);
        if (created != null) {
            return new ClassifiedLine.CreationLine(created);
        }
        return new ClassifiedLine.Other(firstTableReference(tokens));
    }

    /** True for {@code name = proj.table('id')} with any spacing or indentation. */
    public static boolean isLookupAlias(String line) {
        return classify(line) instanceof ClassifiedLine.LookupAlias;
    }

    /**
     * True when {@code rhs} is a literal: a number, {@code None}, a boolean, one
     * string, or a typed constructor around one string.
     */
    public static boolean isLiteral(String rhs) {
        List<Token> tokens = withoutComment(ScriptTokenizer.tokenize(rhs));
        int i = 0;
        if (!tokens.isEmpty() && (tokens.get(0).isOperator("-") || tokens.get(0).isOperator("+"))) {
            i = 1;
        }
        List<Token> rest = tokens.subList(i, tokens.size());
        if (rest.size() == 1) {
            Token t = rest.get(0);
            if (t.kind() == Token.Kind.NUMBER) {
                return true;
            }
            if (i == 0 && t.kind() == Token.Kind.IDENTIFIER) {
                return t.text().equals("None") || t.text().equals("True") || t.text().equals("False");
            }
            return i == 0 && t.kind() == Token.Kind.STRING && ScriptTokenizer.unquote(t) != null;
        }
        // float('nan'), date.fromisoformat('2024-01-15')
        int open = indexOfOperator(rest, "(");
        if (open < 1 || rest.size() != open + 3) {
            return false;
        }
        String callee = join(rest.subList(0, open));
        return LITERAL_CONSTRUCTORS.contains(callee)
            && rest.get(open + 1).kind() == Token.Kind.STRING
            && rest.get(open + 2).isOperator(")");
    }

    /**
     * Splits {@code lhs = rhs} where lhs is a dotted name. Returns null for
     * anything else, including comparisons and augmented assignments.
     */
    public static String[] splitAssignment(String line) {
        List<Token> tokens = ScriptTokenizer.tokenize(line);
        int i = 0;
        while (true) {
            if (i >= tokens.size() || tokens.get(i).kind() != Token.Kind.IDENTIFIER) {
                return null;
            }
            i++;
            if (i < tokens.size() && tokens.get(i).isOperator(".")) {
                i++;
                continue;
            }
            break;
        }
        if (i >= tokens.size() - 1 || !tokens.get(i).isOperator("=")) {
            return null;
        }
        int eq = line.indexOf('=');
        if (eq < 0) {
            return null;
        }
        return new String[]{line.substring(0, eq).trim(), line.substring(eq + 1).trim()};
    }

    private static ClassifiedLine header(List<Token> tokens) {
        // with table_context ( ref ) :   |   with label_context ( ref , 'region' ) :
        if (tokens.size() < 6 || tokens.get(1).kind() != Token.Kind.IDENTIFIER || !tokens.get(2).isOperator("(")) {
            return null;
        }
        String fn = tokens.get(1).text();
        Token ref = tokens.get(3);
        boolean literal = ref.kind() == Token.Kind.STRING;
        if (!literal && ref.kind() != Token.Kind.IDENTIFIER) {
            return null;
        }
        String refText = literal ? ScriptTokenizer.unquote(ref) : ref.text();
        if (refText == null) {
            return null;
        }
        if (fn.equals("table_context") && tokens.size() == 6
            && tokens.get(4).isOperator(")") && tokens.get(5).isOperator(":")) {
            return new ClassifiedLine.ContextHeader(refText, literal, ContextKind.TABLE, null);
        }
        if (fn.equals("label_context") && tokens.size() == 8
            && tokens.get(4).isOperator(",") && tokens.get(5).kind() == Token.Kind.STRING
            && tokens.get(6).isOperator(")") && tokens.get(7).isOperator(":")) {
            String region = ScriptTokenizer.unquote(tokens.get(5));
            return region == null ? null : new ClassifiedLine.ContextHeader(refText, literal, ContextKind.LABEL, region);
        }
        return null;
    }

    /** {@code proj.table('id')} spanning all of {@code tokens}. */
    private static String lookupTarget(List<Token> tokens) {
        if (tokens.size() != 6) {
            return null;
        }
        if (!tokens.get(0).isIdentifier("proj") || !tokens.get(1).isOperator(".") || !tokens.get(2).isIdentifier("table")
            || !tokens.get(3).isOperator("(") || !tokens.get(5).isOperator(")")) {
            return null;
        }
        return ScriptTokenizer.unquote(tokens.get(4));
    }

    /** Table id of a {@code proj.add_table(...)} call spanning all of {@code tokens}. */
    private static String createdTable(List<Token> tokens) {
        if (tokens.size() < 5 || !tokens.get(0).isIdentifier("proj") || !tokens.get(1).isOperator(".")
            || tokens.get(2).kind() != Token.Kind.IDENTIFIER || !CREATION_METHODS.contains(tokens.get(2).text())
            || !tokens.get(3).isOperator("(")) {
            return null;
        }
        int close = matchingParen(tokens, 3);
        if (close != tokens.size() - 1) {
            return null;
        }
        int depth = 0;
        for (int i = 4; i < close; i++) {
            Token t = tokens.get(i);
            if (t.isOperator("(") || t.isOperator("[") || t.isOperator("{")) {
                depth++;
            } else if (t.isOperator(")") || t.isOperator("]") || t.isOperator("}")) {
                depth--;
            } else if (depth == 0 && t.isIdentifier("table_id") && i + 2 < close
                && tokens.get(i + 1).isOperator("=") && tokens.get(i + 2).kind() == Token.Kind.STRING) {
                return ScriptTokenizer.unquote(tokens.get(i + 2));
            }
        }
        return null;
    }

    private static String firstTableReference(List<Token> tokens) {
        for (int i = 0; i + 5 < tokens.size(); i++) {
            if (tokens.get(i).isIdentifier("proj") && tokens.get(i + 1).isOperator(".")
                && tokens.get(i + 2).isIdentifier("table") && tokens.get(i + 3).isOperator("(")
                && tokens.get(i + 4).kind() == Token.Kind.STRING && tokens.get(i + 5).isOperator(")")) {
                String id = ScriptTokenizer.unquote(tokens.get(i + 4));
                if (id != null) {
                    return id;
                }
            }
        }
        return null;
    }

    private static int matchingParen(List<Token> tokens, int open) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            if (tokens.get(i).isOperator("(")) {
                depth++;
            } else if (tokens.get(i).isOperator(")")) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static int indexOfOperator(List<Token> tokens, String op) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).isOperator(op)) {
                return i;
            }
        }
        return -1;
    }

    private static String join(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token t : tokens) {
            sb.append(t.text());
        }
        return sb.toString();
    }

    private static List<Token> withoutComment(List<Token> tokens) {
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).kind() == Token.Kind.COMMENT) {
            return tokens.subList(0, tokens.size() - 1);
        }
        return tokens;
    }
}
