package br.ufscar.dc.vippdfa;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VippParserTest {

    private Diagnostics diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics();
    }

    private ParsedDocument document(String source) throws TranslationException {
        return new VippParser("T", diagnostics).parse(VippTokenReader.tokenize(source, "T"), ParsedDocument.Role.MAIN);
    }

    private List<Command> parse(String source) throws TranslationException {
        return document(source).getCommands();
    }

    private static List<Command> thenOf(Command ifCmd) {
        return ifCmd.child(CommandKind.THEN_BRANCH).getChildren();
    }

    private static List<Command> elseOf(Command ifCmd) {
        return ifCmd.child(CommandKind.ELSE_BRANCH).getChildren();
    }

    @Test
    void popsExactArity() throws Exception {
        List<Command> commands = parse("10 20 MOVETO (Nome) SH");

        assertEquals(2, commands.size());
        Command move = commands.get(0);
        assertEquals(CommandKind.MOVE_TO, move.getKind());
        assertEquals("10", move.getParameter(0).getText());
        assertEquals("20", move.getParameter(1).getText());
        assertEquals("Nome", commands.get(1).getParameter(0).getText());
    }

    @Test
    void missingOperandsFail() {
        ParseException e = assertThrows(ParseException.class, () -> parse("(a) SH\n10 MOVETO"));

        assertEquals("Linha 2: MOVETO espera 2 operando(s), encontrado(s) 1", e.getMessage());
    }

    @Test
    void neverPopsAcrossKeywordBoundary() {
        ParseException e = assertThrows(ParseException.class, () -> parse("10 20 MOVETO MOVEH"));

        assertEquals("Linha 1: MOVEH espera 1 operando(s), encontrado(s) 0", e.getMessage());
    }

    @Test
    void residueIsReportedAndDiscarded() throws Exception {
        List<Command> commands = parse("5 (a) (b) SH 10 MOVEH");

        assertEquals("b", commands.get(0).getParameter(0).getText());
        assertEquals("10", commands.get(1).getParameter(0).getText());
        assertEquals(1, diagnostics.count(Diagnostics.Kind.UNUSED_OPERANDS));
    }

    @Test
    void newLineTakesSignedSpacing() throws Exception {
        List<Command> commands = parse("(a) SH - 4 NL NL");

        assertEquals("-4", commands.get(1).getOption("spacing").getText());
        assertNull(commands.get(2).getOption("spacing"));
    }

    @Test
    void postfixIf() throws Exception {
        List<Command> commands = parse("PREFIX (A) eq { (sim) SH } IF");

        Command ifCmd = commands.get(0);
        assertEquals(CommandKind.IF, ifCmd.getKind());
        Operand cond = ifCmd.getParameter(0);
        assertTrue(cond.isExpression("eq"));
        assertEquals(Operand.Kind.IDENTIFIER, cond.getElements().get(0).getKind());
        assertEquals("A", cond.getElements().get(1).getText());
        assertEquals(1, thenOf(ifCmd).size());
        assertNull(ifCmd.child(CommandKind.ELSE_BRANCH));
    }

    @Test
    void postfixIfElseForms() throws Exception {
        List<Command> ifelse = parse("X 1 eq { (a) SH } { (b) SH (c) SH } IFELSE");
        List<Command> ifThenElse = parse("X 1 eq { (a) SH } IF ELSE { (b) SH (c) SH }");

        for (List<Command> commands : List.of(ifelse, ifThenElse)) {
            assertEquals(1, commands.size());
            assertEquals(1, thenOf(commands.get(0)).size());
            assertEquals(2, elseOf(commands.get(0)).size());
        }
    }

    @Test
    void prefixBraceIf() throws Exception {
        List<Command> commands = parse("IF X 1 eq { (a) SH } ELSE { (b) SH } ENDIF (c) SH");

        assertEquals(2, commands.size());
        assertEquals(1, elseOf(commands.get(0)).size());
        assertEquals(CommandKind.SHOW, commands.get(1).getKind());
    }

    @Test
    void flatIfWithThen() throws Exception {
        List<Command> commands = parse("IF X (A) eq THEN (a) SH NL ELSE (b) SH ENDIF (c) SH");

        assertEquals(2, commands.size());
        Command ifCmd = commands.get(0);
        assertEquals(2, thenOf(ifCmd).size());
        assertEquals(1, elseOf(ifCmd).size());
    }

    @Test
    void flatIfWithoutThenUsesShortestCondition() throws Exception {
        List<Command> commands = parse("IF X (A) eq (a) SH ENDIF");

        Command ifCmd = commands.get(0);
        assertTrue(ifCmd.getParameter(0).isExpression("eq"));
        assertEquals("a", thenOf(ifCmd).get(0).getParameter(0).getText());
    }

    @Test
    void closedBraceIfLeavesEndifToPendingFlatIf() throws Exception {
        List<Command> commands = parse(
                "IF X 1 eq THEN\n"
                + "  IF Y 2 eq { (a) SH }\n"
                + "ENDIF\n"
                + "(b) SH");

        assertEquals(2, commands.size());
        Command outer = commands.get(0);
        assertEquals(1, thenOf(outer).size());
        assertEquals(CommandKind.IF, thenOf(outer).get(0).getKind());
        assertEquals(CommandKind.SHOW, commands.get(1).getKind());
    }

    @Test
    void braceIfInsideFlatIfKeepsItsOwnEndif() throws Exception {
        List<Command> commands = parse(
                "IF A 1 eq THEN\n"
                + "  IF B 2 eq { (x) SH } ENDIF\n"
                + "  (y) SH\n"
                + "ENDIF\n"
                + "(z) SH");

        assertEquals(2, commands.size());
        Command outer = commands.get(0);
        assertEquals(2, thenOf(outer).size());
        assertEquals(CommandKind.IF, thenOf(outer).get(0).getKind());
        assertEquals(CommandKind.SHOW, thenOf(outer).get(1).getKind());
        assertEquals(CommandKind.SHOW, commands.get(1).getKind());
    }

    @Test
    void nestedFlatIfs() throws Exception {
        List<Command> commands = parse("IF A 1 eq THEN IF B 2 eq THEN (x) SH ENDIF (y) SH ENDIF");

        Command outer = commands.get(0);
        assertEquals(1, commands.size());
        assertEquals(2, thenOf(outer).size());
        assertEquals(1, thenOf(thenOf(outer).get(0)).size());
    }

    @Test
    void unmatchedEndifFails() {
        ParseException e = assertThrows(ParseException.class, () -> parse("(a) SH ENDIF"));

        assertEquals("Linha 1: ENDIF sem IF correspondente", e.getMessage());
    }

    @Test
    void unclosedFlatIfReportsOpeningLine() {
        ParseException e = assertThrows(ParseException.class, () -> parse("(a) SH\nIF X 1 eq THEN\n(b) SH\n"));

        assertEquals(2, e.getLine());
        assertEquals("Linha 2: IF sem ENDIF correspondente", e.getMessage());
    }

    @Test
    void unclosedBlockReportsOpeningLine() {
        ParseException e = assertThrows(ParseException.class, () -> parse("(a) SH\n{ (b) SH\n(c) SH"));

        assertEquals("Linha 2: bloco '{' sem fechamento", e.getMessage());
    }

    @Test
    void strayCloseFails() {
        ParseException e = assertThrows(ParseException.class, () -> parse("(a) SH }"));

        assertEquals("Linha 1: '}' sem abertura correspondente", e.getMessage());
    }

    @Test
    void caseDispatchKeepsEntriesInOrder() throws Exception {
        List<Command> commands = parse(
                "CASE PREFIX\n"
                + "(A) { (a) SH }\n"
                + "(B) { /TOTAL 0 SETVAR }\n"
                + "{ (d) SH }\n"
                + "ENDCASE\n"
                + "(fim) SH");

        assertEquals(2, commands.size());
        Command dispatch = commands.get(0);
        assertEquals("PREFIX", dispatch.getParameter(0).getText());
        List<Command> entries = dispatch.getChildren();
        assertEquals(3, entries.size());
        assertEquals("A", entries.get(0).getParameter(0).getText());
        assertEquals("B", entries.get(1).getParameter(0).getText());
        assertEquals(CommandKind.SET_VARIABLE, entries.get(1).getChildren().get(0).getKind());
        assertEquals(CommandKind.CASE_DEFAULT, entries.get(2).getKind());
    }

    @Test
    void caseWithTwoDefaultsFails() {
        ParseException e = assertThrows(ParseException.class, () -> parse("CASE P { (a) SH } { (b) SH } ENDCASE"));

        assertEquals("Linha 1: CASE com mais de um bloco padrao", e.getMessage());
    }

    @Test
    void caseWithoutEndcaseFails() {
        assertThrows(ParseException.class, () -> parse("CASE P (A) { (a) SH }"));
    }

    @Test
    void subroutineDefinition() throws Exception {
        List<Command> commands = parse("/TXNB { 0 0 188 09 LMED DRAWB } XGFRESDEF");

        Command sub = commands.get(0);
        assertEquals(CommandKind.SUBROUTINE, sub.getKind());
        assertEquals("TXNB", sub.getParameter(0).getText());
        Command box = sub.getChildren().get(0);
        assertEquals(CommandKind.DRAW_BOX, box.getKind());
        assertEquals(5, box.getParameters().size());
        assertEquals("LMED", box.getParameter(4).getText());
    }

    @Test
    void declaredAliasesBecomeSwitches() throws Exception {
        List<Command> commands = parse("/F1 /ARIAL 8 INDEXFONT /R /RED INDEXCOLOR F1 R (x) SH");

        assertEquals(CommandKind.DEFINE_FONT, commands.get(0).getKind());
        assertEquals(CommandKind.DEFINE_COLOR, commands.get(1).getKind());
        assertEquals(CommandKind.SET_FONT, commands.get(2).getKind());
        assertEquals(CommandKind.SET_COLOR, commands.get(3).getKind());
        assertEquals(CommandKind.SHOW, commands.get(4).getKind());
    }

    @Test
    void knownAliasesSwitchWithoutLocalDeclaration() throws Exception {
        List<Command> commands = new VippParser("FORM1", diagnostics, Set.of("F2"), Set.of("R"))
                .parse(VippTokenReader.tokenize("F2 R (x) SH", "FORM1"), ParsedDocument.Role.OVERLAY)
                .getCommands();

        assertEquals(3, commands.size());
        assertEquals(CommandKind.SET_FONT, commands.get(0).getKind());
        assertEquals(CommandKind.SET_COLOR, commands.get(1).getKind());
        assertEquals(0, diagnostics.count(Diagnostics.Kind.UNUSED_OPERANDS));
    }

    @Test
    void tableKeepsDeclaredWidths() throws Exception {
        List<Command> commands = parse("[20 30] BEGINTABLE [(a) (b)] SHROW ENDTABLE");

        Command table = commands.get(0);
        assertEquals(CommandKind.TABLE, table.getKind());
        assertEquals(2, table.getOption("widths").getElements().size());
        assertEquals(CommandKind.TABLE_ROW, table.getChildren().get(0).getKind());
    }

    @Test
    void iniFlagOnSetvar() throws Exception {
        List<Command> commands = parse("/CONT 0 /INI SETVAR /CONT ++");

        assertNotNull(commands.get(0).getOption("ini"));
        assertEquals(CommandKind.INCREMENT, commands.get(1).getKind());
    }

    @Test
    void operatorsReduceWithoutBoundary() throws Exception {
        List<Command> commands = parse("(Total: $$VALOR.) VSUB SH LINHA 0 5 GETINTV SH");

        assertTrue(commands.get(0).getParameter(0).isExpression("VSUB"));
        Operand sub = commands.get(1).getParameter(0);
        assertTrue(sub.isExpression("GETINTV"));
        assertEquals(3, sub.getElements().size());
    }

    @Test
    void repeatAndMetadata() throws Exception {
        ParsedDocument doc = document("%%Title: Extrato mensal\n3 { (a) SH NL } REPEAT");

        assertEquals("Extrato mensal", doc.getMetadata().get("Title"));
        Command repeat = doc.getCommands().get(0);
        assertEquals(CommandKind.REPEAT, repeat.getKind());
        assertEquals(2, repeat.getChildren().size());
    }

    @Test
    void unsupportedCommandConsumesArity() throws Exception {
        List<Command> commands = parse("0 0 100 100 CLIP (a) SH");

        assertEquals(CommandKind.UNSUPPORTED, commands.get(0).getKind());
        assertEquals(4, commands.get(0).getParameters().size());
        assertEquals(0, diagnostics.count(Diagnostics.Kind.UNUSED_OPERANDS));
    }
}
