package com.acme.nummern.script.formula;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FormulaReferenceAdjusterTest {

    @Test
    void shouldAdjustRelativeReferences() {
        assertEquals("=c_sin(A2)", FormulaReferenceAdjuster.adjust("=c_sin(A1)", 1, 0));
    }

    @Test
    void shouldPreserveAbsoluteMarkers() {
        assertEquals("=C2+$B3+$C$3", FormulaReferenceAdjuster.adjust("=A1+$B2+$C$3", 1, 2));
    }

    @Test
    void shouldSkipTableQualifiedReferences() {
        assertEquals("=table_1.A1+B2", FormulaReferenceAdjuster.adjust("=table_1.A1+B1", 1, 0));
    }

    @Test
    void shouldAdjustBothEndsOfRange() {
        assertEquals("=SUM(B1:C2)", FormulaReferenceAdjuster.adjust("=SUM(A0:B1)", 1, 1));
    }

    @Test
    void shouldClampAtZeroAndLeaveQuotedText() {
        assertEquals("=A0+\"B5\"", FormulaReferenceAdjuster.adjust("=B2+\"B5\"", -4, -3));
    }
}
