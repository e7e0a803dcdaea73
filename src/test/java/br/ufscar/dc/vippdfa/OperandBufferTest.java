package br.ufscar.dc.vippdfa;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class OperandBufferTest {

    @Test
    void popReturnsSourceOrder() throws Exception {
        OperandBuffer buffer = new OperandBuffer();
        buffer.push(Operand.number("10", 1), 0);
        buffer.push(Operand.number("20", 1), 1);
        buffer.push(Operand.number("30", 1), 2);

        List<Operand> popped = buffer.pop(2, "MOVETO", 1);

        assertEquals("20", popped.get(0).getText());
        assertEquals("30", popped.get(1).getText());
        assertEquals(1, buffer.size());
    }

    @Test
    void popBeyondAvailableFails() {
        OperandBuffer buffer = new OperandBuffer();
        buffer.push(Operand.number("10", 4), 0);

        ParseException e = assertThrows(ParseException.class, () -> buffer.pop(2, "MOVETO", 4));
        assertEquals("Linha 4: MOVETO espera 2 operando(s), encontrado(s) 1", e.getMessage());
        assertEquals(1, buffer.size());
    }

    @Test
    void tracksTokenOfTopOperand() {
        OperandBuffer buffer = new OperandBuffer();
        buffer.push(Operand.number("3", 1), 7);

        assertTrue(buffer.topPushedAt(7));
        assertFalse(buffer.topPushedAt(6));
    }

    @Test
    void drainEmptiesInSourceOrder() {
        OperandBuffer buffer = new OperandBuffer();
        buffer.push(Operand.string("a", 1), 0);
        buffer.push(Operand.string("b", 1), 1);

        List<Operand> residue = buffer.drain();

        assertEquals("a", residue.get(0).getText());
        assertEquals("b", residue.get(1).getText());
        assertTrue(buffer.isEmpty());
    }
}
