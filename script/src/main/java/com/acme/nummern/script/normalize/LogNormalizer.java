package com.acme.nummern.script.normalize;

import com.acme.nummern.script.literal.Identifiers;
import com.acme.nummern.script.literal.LiteralEncoder;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Canonicalizes the flat command log into merged, hoisted context blocks.
 *
 * <p>Three passes over the input, with no state kept between calls:</p>
 * <ol>
 *   <li>parse lines into {@link Block}s, resolving context-header aliases
 *       through a fresh {@link AliasTable} and consuming lookup aliases;</li>
 *   <li>split table-context blocks into data (literal assignments) and
 *       formula statements;</li>
 *   <li>hoist each table's data to its anchor (creation line, else first
 *       reference) and merge adjacent blocks with the same header and purpose.</li>
 * </ol>
 *
 * <p>Output fed back in comes out unchanged. Lines the parser does not
 * recognize pass through untouched.</p>
 */
public final class LogNormalizer {
    private static final Logger LOG = Logger.getLogger(LogNormalizer.class.getName());
    private static final String INDENT = "    ";

    private LogNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return String.join("\n", normalize(List.of(text)));
    }

    /** Elements may hold several newline-separated lines. */
    public static List<String> normalize(List<String> input) {
        List<String> lines = new ArrayList<>();
        for (String chunk : input) {
            for (String line : chunk.split("\n", -1)) {
                lines.add(line);
            }
        }
        if (lines.isEmpty() || (lines.size() == 1 && lines.get(0).isEmpty())) {
            return List.of();
        }
        Pass pass = new Pass();
        List<Block> parsed = pass.parse(lines);
        List<Block> partitioned = partition(parsed);
        return pass.render(pass.hoistAndMerge(partitioned));
    }

    /** Pass 2. Table blocks leave pass 1 marked FORMULA and are split here. */
    static List<Block> partition(List<Block> blocks) {
        List<Block> out = new ArrayList<>(blocks.size());
        for (Block block : blocks) {
            if (!(block instanceof Block.ContextBlock ctx) || ctx.kind() != ContextKind.TABLE) {
                out.add(block);
                continue;
            }
            List<String> data = new ArrayList<>();
            List<String> formula = new ArrayList<>();
            for (List<String> statement : statements(ctx.lines())) {
                if (statement.size() == 1 && isDataAssignment(statement.get(0))) {
                    data.add(statement.get(0));
                } else {
                    formula.addAll(statement);
                }
            }
            if (!data.isEmpty()) {
                out.add(new Block.ContextBlock(ctx.tableId(), ContextKind.TABLE, null, data, BlockPurpose.DATA));
            }
            if (!formula.isEmpty()) {
                out.add(new Block.ContextBlock(ctx.tableId(), ContextKind.TABLE, null, formula, BlockPurpose.FORMULA));
            }
        }
        return out;
    }

    static boolean isDataAssignment(String line) {
        String[] parts = LineClassifier.splitAssignment(line);
        return parts != null && LineClassifier.isLiteral(parts[1]);
    }

    /** Groups each unindented line with the more deeply indented lines under it. */
    private static List<List<String>> statements(List<String> lines) {
        List<List<String>> out = new ArrayList<>();
        for (String line : lines) {
            if (out.isEmpty() || ScriptTokenizer.indentation(line) == 0) {
                out.add(new ArrayList<>());
            }
            out.get(out.size() - 1).add(line);
        }
        return out;
    }

    private static boolean isBlank(String line) {
        return line.isBlank();
    }

    private static String dedent(String line, int columns) {
        int removed = 0;
        int i = 0;
        while (i < line.length() && removed < columns) {
            char ch = line.charAt(i);
            if (ch == ' ') {
                removed++;
            } else if (ch == '\t') {
                removed += 4;
            } else {
                break;
            }
            i++;
        }
        return line.substring(i);
    }

    /** Per-call state: aliases and table bindings seen while parsing. */
    private static final class Pass {
        private final AliasTable aliases = new AliasTable();
        private final Map<String, String> creationNames = new HashMap<>();
        private final Map<String, Set<String>> nameOwners = new HashMap<>();
        private final Map<String, String> idsByBindingName = new HashMap<>();
        private final Set<String> unresolved = new HashSet<>();
        private final Set<String> lookupEmitted = new HashSet<>();

        /** Pass 1. */
        List<Block> parse(List<String> lines) {
            collectTableIds(lines);
            List<Block> out = new ArrayList<>();
            int i = 0;
            while (i < lines.size()) {
                String line = lines.get(i);
                if (isBlank(line) || ScriptTokenizer.indentation(line) > 0) {
                    out.add(new Block.Line(line));
                    i++;
                    continue;
                }
                ClassifiedLine classified = LineClassifier.classify(line);
                if (classified instanceof ClassifiedLine.LookupAlias lookup) {
                    aliases.bind(lookup.alias(), lookup.tableId());
                    i++;
                } else if (classified instanceof ClassifiedLine.ConstructorAlias ctor) {
                    aliases.bind(ctor.alias(), ctor.tableId());
                    recordCreation(ctor.tableId(), ctor.alias());
                    out.add(new Block.Line(line));
                    i++;
                } else if (classified instanceof ClassifiedLine.CreationLine creation) {
                    String name = Identifiers.bindingName(creation.tableId());
                    aliases.bind(name, creation.tableId());
                    recordCreation(creation.tableId(), name);
                    out.add(new Block.Line(name + " = " + line.strip()));
                    i++;
                } else if (classified instanceof ClassifiedLine.ContextHeader header) {
                    int end = i + 1;
                    while (end < lines.size() && !isBlank(lines.get(end)) && ScriptTokenizer.indentation(lines.get(end)) > 0) {
                        end++;
                    }
                    if (end == i + 1) {
                        out.add(new Block.Line(line));
                        i++;
                        continue;
                    }
                    int base = ScriptTokenizer.indentation(lines.get(i + 1));
                    List<String> body = new ArrayList<>(end - i - 1);
                    for (int j = i + 1; j < end; j++) {
                        body.add(dedent(lines.get(j), base));
                    }
                    String tableId = resolve(header);
                    BlockPurpose purpose = header.kind() == ContextKind.LABEL ? BlockPurpose.LABEL : BlockPurpose.FORMULA;
                    out.add(new Block.ContextBlock(tableId, header.kind(), header.region(), body, purpose));
                    i = end;
                } else {
                    out.add(new Block.Line(line));
                    i++;
                }
            }
            return out;
        }

        /** Pass 3. */
        List<Block> hoistAndMerge(List<Block> blocks) {
            Map<String, List<String>> data = new LinkedHashMap<>();
            Map<String, Integer> creationAnchor = new HashMap<>();
            Map<String, Integer> referenceAnchor = new HashMap<>();
            for (int idx = 0; idx < blocks.size(); idx++) {
                Block block = blocks.get(idx);
                if (block instanceof Block.ContextBlock ctx) {
                    referenceAnchor.putIfAbsent(ctx.tableId(), idx);
                    if (ctx.purpose() == BlockPurpose.DATA) {
                        data.computeIfAbsent(ctx.tableId(), k -> new ArrayList<>()).addAll(ctx.lines());
                    }
                } else if (block instanceof Block.Line line && !isBlank(line.text())
                    && ScriptTokenizer.indentation(line.text()) == 0) {
                    ClassifiedLine classified = LineClassifier.classify(line.text());
                    if (classified instanceof ClassifiedLine.ConstructorAlias ctor) {
                        creationAnchor.putIfAbsent(ctor.tableId(), idx);
                        referenceAnchor.putIfAbsent(ctor.tableId(), idx);
                    } else if (classified instanceof ClassifiedLine.Other other && other.referencedTableId() != null) {
                        referenceAnchor.putIfAbsent(other.referencedTableId(), idx);
                    }
                }
            }
            Map<Integer, List<String>> anchoredAt = new HashMap<>();
            for (String tableId : data.keySet()) {
                Integer at = creationAnchor.getOrDefault(tableId, referenceAnchor.get(tableId));
                anchoredAt.computeIfAbsent(at, k -> new ArrayList<>()).add(tableId);
            }

            List<Block> out = new ArrayList<>();
            for (int idx = 0; idx < blocks.size(); idx++) {
                Block block = blocks.get(idx);
                List<String> anchored = anchoredAt.getOrDefault(idx, List.of());
                if (block instanceof Block.Line) {
                    append(out, block);
                    for (String tableId : anchored) {
                        emitData(out, tableId, data.get(tableId));
                    }
                    continue;
                }
                Block.ContextBlock ctx = (Block.ContextBlock) block;
                for (String tableId : anchored) {
                    emitData(out, tableId, data.get(tableId));
                }
                if (ctx.purpose() != BlockPurpose.DATA) {
                    ensureBound(out, ctx.tableId());
                    append(out, ctx);
                }
            }
            return out;
        }

        List<String> render(List<Block> blocks) {
            List<String> out = new ArrayList<>();
            for (Block block : blocks) {
                if (block instanceof Block.Line line) {
                    out.add(line.text());
                    continue;
                }
                Block.ContextBlock ctx = (Block.ContextBlock) block;
                String name = boundName(ctx.tableId());
                if (ctx.kind() == ContextKind.TABLE) {
                    out.add("with table_context(" + name + "):");
                } else {
                    out.add("with label_context(" + name + ", " + LiteralEncoder.encodeString(ctx.region()) + "):");
                }
                for (String line : ctx.lines()) {
                    out.add(INDENT + line);
                }
            }
            return out;
        }

        private void emitData(List<Block> out, String tableId, List<String> lines) {
            ensureBound(out, tableId);
            append(out, new Block.ContextBlock(tableId, ContextKind.TABLE, null, lines, BlockPurpose.DATA));
        }

        /** Emits {@code name = proj.table('id')} before the first block of a table with no usable creation name. */
        private void ensureBound(List<Block> out, String tableId) {
            if (creationName(tableId) != null || unresolved.contains(tableId) || !lookupEmitted.add(tableId)) {
                return;
            }
            out.add(new Block.Line(Identifiers.bindingName(tableId) + " = proj.table(" + LiteralEncoder.encodeString(tableId) + ")"));
        }

        private static void append(List<Block> out, Block block) {
            if (block instanceof Block.ContextBlock ctx && !out.isEmpty()
                && out.get(out.size() - 1) instanceof Block.ContextBlock last && last.mergeableWith(ctx)) {
                List<String> lines = new ArrayList<>(last.lines());
                lines.addAll(ctx.lines());
                out.set(out.size() - 1, new Block.ContextBlock(last.tableId(), last.kind(), last.region(), lines, last.purpose()));
                return;
            }
            out.add(block);
        }

        /** Binding name of every table id the stream mentions, for headers whose lookup line was stripped. */
        private void collectTableIds(List<String> lines) {
            for (String line : lines) {
                if (isBlank(line) || ScriptTokenizer.indentation(line) > 0) {
                    continue;
                }
                ClassifiedLine classified = LineClassifier.classify(line);
                String tableId = null;
                if (classified instanceof ClassifiedLine.LookupAlias lookup) {
                    tableId = lookup.tableId();
                } else if (classified instanceof ClassifiedLine.ConstructorAlias ctor) {
                    tableId = ctor.tableId();
                } else if (classified instanceof ClassifiedLine.CreationLine creation) {
                    tableId = creation.tableId();
                } else if (classified instanceof ClassifiedLine.Other other) {
                    tableId = other.referencedTableId();
                }
                if (tableId != null) {
                    idsByBindingName.putIfAbsent(Identifiers.bindingName(tableId), tableId);
                }
            }
        }

        /**
         * Table id behind a header. A name no alias binds is taken as a binding
         * name: first of a table mentioned elsewhere, else of the table with that
         * very id. Reserved names cannot be binding names and stay verbatim.
         */
        private String resolve(ClassifiedLine.ContextHeader header) {
            String ref = header.ref();
            if (header.literal()) {
                return ref;
            }
            return aliases.resolve(ref).orElseGet(() -> {
                String known = idsByBindingName.get(ref);
                if (known != null) {
                    return known;
                }
                if (Identifiers.bindingName(ref).equals(ref)) {
                    LOG.fine(() -> "Unbound context name '" + ref + "', treating it as the table id");
                    return ref;
                }
                LOG.fine(() -> "Unresolved context alias '" + ref + "', keeping it verbatim");
                unresolved.add(ref);
                return ref;
            });
        }

        private void recordCreation(String tableId, String name) {
            creationNames.putIfAbsent(tableId, name);
            nameOwners.computeIfAbsent(name, k -> new HashSet<>()).add(tableId);
        }

        /** Creation-line name, unless several tables were created under it. */
        private String creationName(String tableId) {
            String name = creationNames.get(tableId);
            if (name == null || nameOwners.get(name).size() > 1) {
                return null;
            }
            return name;
        }

        private String boundName(String tableId) {
            String name = creationName(tableId);
            if (name != null) {
                return name;
            }
            return unresolved.contains(tableId) ? tableId : Identifiers.bindingName(tableId);
        }
    }
}
