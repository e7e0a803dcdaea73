package br.ufscar.dc.vippdfa;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class BoxStyleTest {

    @Test
    void shadeCodes() {
        assertEquals(100, BoxStyle.parse("S1").getShade());
        assertEquals(75, BoxStyle.parse("S2").getShade());
        assertEquals(50, BoxStyle.parse("S3").getShade());
        assertEquals(25, BoxStyle.parse("S4").getShade());
    }

    @Test
    void colorPrefixWithShade() {
        BoxStyle style = BoxStyle.parse("R_S2");

        assertEquals("RED", style.getColor());
        assertEquals(75, style.getShade());
        assertEquals("BLUE", BoxStyle.parse("BS1").getColor());
    }

    @Test
    void thicknessAndLineType() {
        BoxStyle style = BoxStyle.parse("LTHKD");

        assertFalse(style.isFilled());
        assertEquals(0.5, style.getThicknessMm());
        assertEquals(BoxStyle.LineType.DASHED, style.getLineType());
        assertEquals(BoxStyle.LineType.DOTTED, BoxStyle.parse("LTHN_P").getLineType());
    }

    @Test
    void fillPrefixIsSolidBlack() {
        BoxStyle style = BoxStyle.parse("F");

        assertEquals("BLACK", style.getColor());
        assertEquals(100, style.getShade());
    }

    @Test
    void unknownStyleIsMediumOutline() {
        BoxStyle style = BoxStyle.parse("XLT");

        assertNull(style.getColor());
        assertFalse(style.isFilled());
        assertEquals(0.2, style.getThicknessMm());
    }
}
