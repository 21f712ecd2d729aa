package com.acme.nummern.script.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Single-line tokenizer covering the subset of Python the generated log uses.
 * It never fails: characters it does not know become {@link Token.Kind#UNKNOWN}
 * tokens and an unterminated string runs to the end of the line.
 */
public final class ScriptTokenizer {
    private static final Set<String> TWO_CHAR_OPERATORS = Set.of(
        "==", "!=", "<=", ">=", "+=", "-=", "*=", "/=", "**", "//", "->", ":=");
    private static final Set<String> STRING_PREFIXES = Set.of("r", "b", "f", "u", "rb", "br", "fr", "rf");
    private static final String OPERATOR_CHARS = "=()[]{},.:;+-*/%<>!&|^~@";

    private ScriptTokenizer() {
    }

    public static List<Token> tokenize(String line) {
        List<Token> out = new ArrayList<>();
        String s = line == null ? "" : line;
        int i = 0;
        int n = s.length();
        while (i < n) {
            char ch = s.charAt(i);
            if (ch == ' ' || ch == '\t' || ch == '\r') {
                i++;
            } else if (ch == '#') {
                out.add(new Token(Token.Kind.COMMENT, s.substring(i)));
                break;
            } else if (ch == '\'' || ch == '"') {
                int end = stringEnd(s, i);
                out.add(new Token(Token.Kind.STRING, s.substring(i, end)));
                i = end;
            } else if (isIdentifierStart(ch)) {
                int end = i + 1;
                while (end < n && isIdentifierPart(s.charAt(end))) {
                    end++;
                }
                String word = s.substring(i, end);
                if (end < n && (s.charAt(end) == '\'' || s.charAt(end) == '"')
                    && STRING_PREFIXES.contains(word.toLowerCase(Locale.ROOT))) {
                    int stringEnd = stringEnd(s, end);
                    out.add(new Token(Token.Kind.STRING, s.substring(i, stringEnd)));
                    i = stringEnd;
                } else {
                    out.add(new Token(Token.Kind.IDENTIFIER, word));
                    i = end;
                }
            } else if (Character.isDigit(ch) || (ch == '.' && i + 1 < n && Character.isDigit(s.charAt(i + 1)))) {
                int end = numberEnd(s, i);
                out.add(new Token(Token.Kind.NUMBER, s.substring(i, end)));
                i = end;
            } else if (OPERATOR_CHARS.indexOf(ch) >= 0) {
                if (i + 1 < n && TWO_CHAR_OPERATORS.contains(s.substring(i, i + 2))) {
                    out.add(new Token(Token.Kind.OPERATOR, s.substring(i, i + 2)));
                    i += 2;
                } else {
                    out.add(new Token(Token.Kind.OPERATOR, String.valueOf(ch)));
                    i++;
                }
            } else {
                out.add(new Token(Token.Kind.UNKNOWN, String.valueOf(ch)));
                i++;
            }
        }
        return out;
    }

    /** Leading indentation width; a tab counts as four columns. */
    public static int indentation(String line) {
        int width = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == ' ') {
                width++;
            } else if (ch == '\t') {
                width += 4;
            } else {
                break;
            }
        }
        return width;
    }

    /**
     * Decoded content of a plain string token, or {@code null} for prefixed,
     * unterminated or non-string text.
     */
    public static String unquote(Token token) {
        if (token.kind() != Token.Kind.STRING) {
            return null;
        }
        String raw = token.text();
        if (raw.length() < 2) {
            return null;
        }
        char quote = raw.charAt(0);
        if ((quote != '\'' && quote != '"') || raw.charAt(raw.length() - 1) != quote) {
            return null;
        }
        String body = raw.substring(1, raw.length() - 1);
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char ch = body.charAt(i);
            if (ch != '\\' || i + 1 >= body.length()) {
                sb.append(ch);
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'x' -> {
                    if (i + 2 < body.length() && isHex(body.charAt(i + 1)) && isHex(body.charAt(i + 2))) {
                        sb.append((char) Integer.parseInt(body.substring(i + 1, i + 3), 16));
                        i += 2;
                    } else {
                        sb.append('\\').append(next);
                    }
                }
                case '\\', '\'', '"' -> sb.append(next);
                default -> sb.append('\\').append(next);
            }
        }
        return sb.toString();
    }

    private static int stringEnd(String s, int quoteIndex) {
        char quote = s.charAt(quoteIndex);
        int i = quoteIndex + 1;
        while (i < s.length()) {
            char ch = s.charAt(i);
            if (ch == '\\') {
                i += 2;
                continue;
            }
            if (ch == quote) {
                return i + 1;
            }
            i++;
        }
        return s.length();
    }

    private static int numberEnd(String s, int start) {
        int i = start;
        while (i < s.length()) {
            char ch = s.charAt(i);
            if (Character.isDigit(ch) || ch == '.' || ch == '_') {
                i++;
            } else if ((ch == 'e' || ch == 'E') && i + 1 < s.length()
                && (Character.isDigit(s.charAt(i + 1)) || s.charAt(i + 1) == '-' || s.charAt(i + 1) == '+')) {
                i += 2;
            } else if (ch == 'j' || ch == 'J') {
                return i + 1;
            } else {
                break;
            }
        }
        return i;
    }

    private static boolean isIdentifierStart(char ch) {
        return Character.isLetter(ch) || ch == '_';
    }

    private static boolean isIdentifierPart(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_';
    }

    private static boolean isHex(char ch) {
        return Character.digit(ch, 16) >= 0;
    }
}
