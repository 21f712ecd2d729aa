package com.acme.nummern.script.normalize;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LineClassifierTest {

    @Test
    void shouldRecognizeLookupAliases() {
        ClassifiedLine.LookupAlias alias = assertInstanceOf(ClassifiedLine.LookupAlias.class,
            LineClassifier.classify("t = proj.table('table_1')"));
        assertEquals("t", alias.alias());
        assertEquals("table_1", alias.tableId());
        assertTrue(LineClassifier.isLookupAlias("    t=proj.table(\"table_1\")  # cached"));
        assertFalse(LineClassifier.isLookupAlias("t = proj.table('table_1').resize(rows=2)"));
    }

    @Test
    void shouldRecognizeCreationForms() {
        ClassifiedLine.CreationLine bare = assertInstanceOf(ClassifiedLine.CreationLine.class,
            LineClassifier.classify("proj.add_table('sheet_1', table_id='table_9', rect=Rect(0, 0, 1, 1), rows=1, cols=1)"));
        assertEquals("table_9", bare.tableId());
        ClassifiedLine.ConstructorAlias bound = assertInstanceOf(ClassifiedLine.ConstructorAlias.class,
            LineClassifier.classify("s = proj.add_summary_table('sheet_1', table_id='summary_1', values=[dict(col='B')])"));
        assertEquals("s", bound.alias());
        assertEquals("summary_1", bound.tableId());
    }

    @Test
    void shouldParseContextHeaders() {
        ClassifiedLine.ContextHeader table = assertInstanceOf(ClassifiedLine.ContextHeader.class,
            LineClassifier.classify("with table_context(t):"));
        assertEquals(ContextKind.TABLE, table.kind());
        assertFalse(table.literal());
        ClassifiedLine.ContextHeader label = assertInstanceOf(ClassifiedLine.ContextHeader.class,
            LineClassifier.classify("with label_context('table_1', 'top_labels'):"));
        assertEquals(ContextKind.LABEL, label.kind());
        assertEquals("top_labels", label.region());
        assertTrue(label.literal());
        assertInstanceOf(ClassifiedLine.Other.class, LineClassifier.classify("with open('f') as fh:"));
    }

    @Test
    void shouldReportReferencedTable() {
        ClassifiedLine.Other other = assertInstanceOf(ClassifiedLine.Other.class,
            LineClassifier.classify("proj.table('table_4').minimize()"));
        assertEquals("table_4", other.referencedTableId());
    }

    @Test
    void shouldClassifyLiterals() {
        assertTrue(LineClassifier.isLiteral("42"));
        assertTrue(LineClassifier.isLiteral("-1.5e3"));
        assertTrue(LineClassifier.isLiteral("None"));
        assertTrue(LineClassifier.isLiteral("'hello'"));
        assertTrue(LineClassifier.isLiteral("time.fromisoformat('13:45:30')"));
        assertTrue(LineClassifier.isLiteral("float('nan')"));
        assertFalse(LineClassifier.isLiteral("a0 + 1"));
        assertFalse(LineClassifier.isLiteral("c_sum('a0:b1')"));
        assertFalse(LineClassifier.isLiteral("-None"));
        assertFalse(LineClassifier.isLiteral("'a' 'b'"));
    }

    @Test
    void shouldSplitDottedAssignments() {
        assertArrayEquals(new String[]{"top_labels.a0", "c_sum('a1:a3')"},
            LineClassifier.splitAssignment("top_labels.a0 = c_sum('a1:a3')"));
        assertNull(LineClassifier.splitAssignment("a0 == 1"));
        assertNull(LineClassifier.splitAssignment("a0 += 1"));
        assertNull(LineClassifier.splitAssignment("print(a0)"));
    }
}
