package br.ufscar.dc.vippdfa;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class DfaExpressionsTest {

    private static Operand id(String name) {
        return Operand.identifier(name, 1);
    }

    private static Operand num(String n) {
        return Operand.number(n, 1);
    }

    private static Operand expr(String op, Operand... args) {
        return Operand.expression(op, List.of(args), 1);
    }

    @Test
    void variablesAreNeverQuoted() {
        assertEquals("CLIENTE_NOME", DfaExpressions.value(id("CLIENTE.NOME")));
        assertEquals("'CLIENTE'", DfaExpressions.value(Operand.string("CLIENTE", 1)));
    }

    @Test
    void comparisonsAndLogic() {
        Operand cond = expr("and", expr("eq", id("PREFIX"), Operand.string("A", 1)), expr("not", expr("gt", id("N"), num("3"))));

        assertEquals("ISTRUE((PREFIX=='A') AND (NOT(N>3)))", DfaExpressions.condition(cond));
        assertEquals("X<>1", DfaExpressions.value(expr("ne", id("X"), num("1"))));
    }

    @Test
    void frameLeftBecomesRemainingSpaceTest() {
        assertEquals("$SL_MAXY>$LP_HEIGHT-MM(60)", DfaExpressions.value(expr("lt", id("FRLEFT"), num("60"))));
    }

    @Test
    void indexesShiftToOneBased() {
        assertEquals("SUBSTR(LINHA, 6, 3, '')", DfaExpressions.value(expr("GETINTV", id("LINHA"), num("5"), num("3"))));
        assertEquals("TAB[I+1]", DfaExpressions.value(expr("GETITEM", id("TAB"), id("I"))));
    }

    @Test
    void substitutionSplitsLiteralsAndVariables() {
        assertTrue(DfaExpressions.hasSubstitution("Total: $$VALOR. reais"));
        assertFalse(DfaExpressions.hasSubstitution("R$ 10,00"));
        assertEquals("'Total: ' ! VALOR ! ' reais'", DfaExpressions.substitute("Total: $$VALOR. reais"));
        assertEquals("A ! B", DfaExpressions.substitute("$$A.$$B."));
    }
}
