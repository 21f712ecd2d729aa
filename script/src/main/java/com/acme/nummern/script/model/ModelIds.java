package com.acme.nummern.script.model;

import java.util.Collection;
import java.util.UUID;

/**
 * Identifier generation. Sheets and tables get short sequential ids that
 * double as script identifiers; commands get opaque UUIDs.
 */
public final class ModelIds {
    private ModelIds() {
    }

    public static String make() {
        return UUID.randomUUID().toString();
    }

    public static String nextSheetId(Collection<String> existingIds) {
        return nextSequentialId("sheet", existingIds);
    }

    public static String nextTableId(Collection<String> existingIds) {
        return nextSequentialId("table", existingIds);
    }

    public static String nextSummaryId(Collection<String> existingIds) {
        return nextSequentialId("summary", existingIds);
    }

    static String nextSequentialId(String prefix, Collection<String> existingIds) {
        String normalized = prefix.endsWith("_") ? prefix : prefix + "_";
        int max = 0;
        for (String id : existingIds) {
            if (id == null || !id.startsWith(normalized)) {
                continue;
            }
            max = Math.max(max, sequenceOf(id.substring(normalized.length())));
        }
        return normalized + (max + 1);
    }

    private static int sequenceOf(String suffix) {
        try {
            return Integer.parseInt(suffix);
        } catch (NumberFormatException notSequential) {
            return 0;
        }
    }
}
