package com.acme.nummern.script.normalize;

import java.util.Objects;

/** Role of one script line in the generated log. */
public sealed interface ClassifiedLine
    permits ClassifiedLine.LookupAlias, ClassifiedLine.ConstructorAlias, ClassifiedLine.CreationLine,
            ClassifiedLine.ContextHeader, ClassifiedLine.Other {

    /** {@code t = proj.table('table_1')} */
    record LookupAlias(String alias, String tableId) implements ClassifiedLine {
        public LookupAlias {
            Objects.requireNonNull(alias, "alias");
            Objects.requireNonNull(tableId, "tableId");
        }
    }

    /** {@code t = proj.add_table(..., table_id='table_1', ...)} */
    record ConstructorAlias(String alias, String tableId) implements ClassifiedLine {
        public ConstructorAlias {
            Objects.requireNonNull(alias, "alias");
            Objects.requireNonNull(tableId, "tableId");
        }
    }

    /** Bare {@code proj.add_table(...)} or {@code proj.add_summary_table(...)} statement. */
    record CreationLine(String tableId) implements ClassifiedLine {
        public CreationLine {
            Objects.requireNonNull(tableId, "tableId");
        }
    }

    /**
     * {@code with table_context(ref):} or {@code with label_context(ref, 'region'):}.
     * {@code literal} is true when {@code ref} came from a string argument rather than a name.
     */
    record ContextHeader(String ref, boolean literal, ContextKind kind, String region) implements ClassifiedLine {
        public ContextHeader {
            Objects.requireNonNull(ref, "ref");
            Objects.requireNonNull(kind, "kind");
        }
    }

    /** Anything else. {@code referencedTableId} is the first {@code proj.table('..')} target, or null. */
    record Other(String referencedTableId) implements ClassifiedLine {}
}
