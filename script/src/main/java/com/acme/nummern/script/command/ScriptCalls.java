package com.acme.nummern.script.command;

import com.acme.nummern.script.literal.LiteralEncoder;
import com.acme.nummern.script.model.RangeAddress;
import com.acme.nummern.script.model.RangeParseException;
import com.acme.nummern.script.model.RangeParser;

import java.util.List;
import java.util.Locale;

/** Call fragments shared by command renderings. */
final class ScriptCalls {
    private ScriptCalls() {
    }

    /** {@code proj.table('table_1')} */
    static String table(String tableId) {
        return "proj.table(" + LiteralEncoder.encodeString(tableId) + ")";
    }

    static String tableCall(String tableId, String method, String args) {
        return table(tableId) + "." + method + "(" + args + ")";
    }

    static RangeAddress address(String wire) {
        try {
            return RangeParser.parse(wire);
        } catch (RangeParseException e) {
            throw new IllegalArgumentException("Invalid address '" + wire + "': " + e.reason(), e);
        }
    }

    static String columnLetters(List<Integer> columns) {
        return LiteralEncoder.encodeStringList(columns.stream().map(RangeParser::columnLabel).toList());
    }

    static String lower(String text) {
        return text.toLowerCase(Locale.ROOT);
    }

    static String lines(List<String> lines) {
        return String.join("\n", lines);
    }
}
