package br.ufscar.dc.vippdfa;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class DfaWriterTest {

    @Test
    void formatsNumbersWithoutTrailingZeros() {
        assertEquals("12.5", DfaWriter.number(12.5));
        assertEquals("3", DfaWriter.number(3.0));
        assertEquals("0.353", DfaWriter.number(0.352778));
        assertEquals("0", DfaWriter.number(-0.0001));
        assertEquals("-4", DfaWriter.number(-4));
        assertEquals("100", DfaWriter.number(100));
    }

    @Test
    void rejectsNaN() {
        assertThrows(GenerationInvariantException.class, () -> DfaWriter.number(Double.NaN));
    }

    @Test
    void quotesLiterals() {
        assertEquals("'it''s'", DfaWriter.quote("it's"));
    }

    @Test
    void indentsNestedLines() {
        DfaWriter w = new DfaWriter();
        w.line("A;").indent().line("B;").dedent().line("C;");

        assertEquals("A;\n    B;\nC;\n", w.getOutput());
    }

    @Test
    void dedentBelowZeroIsAnInvariantViolation() {
        assertThrows(GenerationInvariantException.class, () -> new DfaWriter().dedent());
    }
}
