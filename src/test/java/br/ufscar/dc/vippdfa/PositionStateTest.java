package br.ufscar.dc.vippdfa;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PositionStateTest {

    private TranslatorConfig config;
    private PositionState state;

    @BeforeEach
    void setUp() {
        config = TranslatorConfig.defaults();
        state = new PositionState(config, "ARIAL08");
    }

    @Test
    void negativeNewLineIsSignedOffset() {
        state.setLineSpacing(7.0);
        state.moveTo(20, 100);

        state.newLine(-12.0);

        assertEquals(88.0, state.getY(), 1e-9);
        assertEquals(PositionState.Mode.FLOW, state.getMode());
    }

    @Test
    void negativeOffsetIgnoresLineSpacing() {
        for (double spacing : new double[] {2.0, 4.233, 10.0}) {
            state.setLineSpacing(spacing);
            state.moveTo(0, 100);
            state.newLine(-5.0);
            assertEquals(95.0, state.getY(), 1e-9);
        }
    }

    @Test
    void plainNewLineAddsLineSpacing() {
        state.setLineSpacing(5.0);
        state.moveTo(10, 40);

        state.newLine(null);
        state.newLine(null);

        assertEquals(50.0, state.getY(), 1e-9);
        assertEquals(10.0, state.getFlowY(), 1e-9);
        assertFalse(state.isYExplicit());
    }

    @Test
    void moveToSetsAbsoluteMode() {
        state.newLine(null);
        state.moveTo(15, 30);

        assertEquals(PositionState.Mode.ABSOLUTE, state.getMode());
        assertEquals(15.0, state.getX(), 1e-9);
        assertEquals(30.0, state.getY(), 1e-9);
        assertEquals(0.0, state.getFlowY(), 1e-9);
        assertTrue(state.isXExplicit());
    }

    @Test
    void segmentInvertsNegativeOffsets() {
        state.enterSegment();

        for (double d : new double[] {0.5, 3, 12.25, 40}) {
            assertEquals(d, state.mapY(-d), 1e-9);
        }
        assertEquals(PositionState.Mode.RESET, state.getMode());
    }

    @Test
    void restoreBringsBackCallerState() {
        state.setFont("F1");
        state.setColor("R");
        state.moveTo(20, 50);
        PositionState saved = state.copy();

        state.enterSegment();
        state.setFont("F2");
        state.moveTo(1, -3);
        state.newLine(4.0);
        state.restore(saved);

        assertEquals(20.0, state.getX(), 1e-9);
        assertEquals(50.0, state.getY(), 1e-9);
        assertEquals("F1", state.getFont());
        assertEquals("R", state.getColor());
        assertFalse(state.inSegment());
        assertTrue(state.samePlacement(saved));
    }

    @Test
    void bottomUpDocumentAxisUsesPageHeight() {
        state.setAxis(PositionState.Axis.BOTTOM_UP);

        state.moveTo(10, 20);

        assertEquals(config.getPageHeightMm() - 20, state.getY(), 1e-9);
    }

    @Test
    void unitsConvertToMillimetres() {
        state.setUnits(PositionState.Unit.parse("CM"));
        state.moveTo(2, 3);

        assertEquals(20.0, state.getX(), 1e-9);
        assertEquals(30.0, state.getY(), 1e-9);
        assertEquals(PositionState.Unit.POINT, PositionState.Unit.parse("pt"));
    }

    @Test
    void layoutOriginShiftsAbsolutePositions() {
        state.setOrigin(5, 7);
        state.moveTo(10, 10);

        assertEquals(15.0, state.getX(), 1e-9);
        assertEquals(17.0, state.getY(), 1e-9);
    }
}
