package com.acme.nummern.script.normalize;

import java.util.List;
import java.util.Objects;

/** Unit of normalizer output. */
public sealed interface Block permits Block.Line, Block.ContextBlock {

    record Line(String text) implements Block {
        public Line {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * Context block for one table. {@code region} is the label region name for
     * {@link ContextKind#LABEL} blocks and null otherwise. {@code lines} are the
     * body statements without the block indentation, in insertion order.
     */
    record ContextBlock(String tableId, ContextKind kind, String region, List<String> lines, BlockPurpose purpose)
        implements Block {

        public ContextBlock {
            Objects.requireNonNull(tableId, "tableId");
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(purpose, "purpose");
            lines = List.copyOf(lines);
        }

        /** True when {@code other} renders under the same header with the same purpose. */
        public boolean mergeableWith(ContextBlock other) {
            return tableId.equals(other.tableId) && kind == other.kind
                && Objects.equals(region, other.region) && purpose == other.purpose;
        }
    }
}
