package br.ufscar.dc.vippdfa;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConflictResolverTest {

    private Diagnostics diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics();
    }

    private VippSemantico analyze(String name, String source, ParsedDocument.Role role) throws TranslationException {
        ParsedDocument doc = new VippParser(name, diagnostics).parse(VippTokenReader.tokenize(source, name), role);
        return new VippSemantico(doc).analyze();
    }

    @Test
    void overlayAliasWithOtherAttributesIsRenamed() throws Exception {
        VippSemantico main = analyze("MAIN", "/A /ARIAL 8 INDEXFONT A (x) SH", ParsedDocument.Role.MAIN);
        VippSemantico form = analyze("FORM1", "/A /TIMES 10 INDEXFONT A (y) SH (~~Aabc) SH", ParsedDocument.Role.OVERLAY);

        ConflictResolver.Resolution r = new ConflictResolver(diagnostics).resolve(main, List.of(form));

        SymbolTable global = r.getGlobal();
        assertEquals(2, global.getFonts().size());
        assertEquals("ARIAL", global.getFont("A").getFamily());
        assertEquals("TIMES", global.getFont("A_1").getFamily());
        assertEquals(10.0, global.getFont("A_1").getSize());

        List<Command> commands = form.getDocument().getCommands();
        assertEquals("A_1", commands.get(0).getParameter(0).getText());
        assertEquals("A_1", commands.get(1).getParameter(0).getText());
        assertEquals("~~A_1abc", commands.get(3).getParameter(0).getText());

        assertEquals("A", main.getDocument().getCommands().get(1).getParameter(0).getText());
        assertEquals("A_1", r.getFontRenames("FORM1").get("A"));
        assertEquals(1, r.getReport().getEntries().size());
        assertEquals(1, diagnostics.count(Diagnostics.Kind.CONFLICT));
    }

    @Test
    void identicalRedefinitionIsShared() throws Exception {
        VippSemantico main = analyze("MAIN", "/A /ARIAL 8 INDEXFONT", ParsedDocument.Role.MAIN);
        VippSemantico form = analyze("FORM1", "/A /ARIAL 8 INDEXFONT A (y) SH", ParsedDocument.Role.OVERLAY);

        ConflictResolver.Resolution r = new ConflictResolver(diagnostics).resolve(main, List.of(form));

        assertEquals(1, r.getGlobal().getFonts().size());
        assertTrue(r.getReport().isEmpty());
        assertEquals("A", form.getDocument().getCommands().get(1).getParameter(0).getText());
    }

    @Test
    void suffixesFollowFileOrder() throws Exception {
        VippSemantico main = analyze("MAIN", "/A /ARIAL 8 INDEXFONT /C /RED INDEXCOLOR", ParsedDocument.Role.MAIN);
        VippSemantico f1 = analyze("F1", "/A /TIMES 10 INDEXFONT /C /BLUE INDEXCOLOR C", ParsedDocument.Role.OVERLAY);
        VippSemantico f2 = analyze("F2", "/A /COURIER 9 INDEXFONT", ParsedDocument.Role.OVERLAY);

        ConflictResolver.Resolution r = new ConflictResolver(diagnostics).resolve(main, List.of(f1, f2));

        assertEquals("A_1", r.getFontRenames("F1").get("A"));
        assertEquals("A_2", r.getFontRenames("F2").get("A"));
        assertEquals("C_1", r.getColorRenames("F1").get("C"));
        assertEquals("BLUE", r.getGlobal().getColor("C_1").getValue());
        assertEquals("C_1", f1.getDocument().getCommands().get(2).getParameter(0).getText());
    }

    @Test
    void reportSerializesToJson() throws Exception {
        VippSemantico main = analyze("MAIN", "/A /ARIAL 8 INDEXFONT", ParsedDocument.Role.MAIN);
        VippSemantico form = analyze("FORM1", "/A /TIMES 10 INDEXFONT", ParsedDocument.Role.OVERLAY);

        String json = new ConflictResolver(diagnostics).resolve(main, List.of(form)).getReport().toJson();

        assertTrue(json.contains("\"renamedTo\" : \"A_1\""));
        assertTrue(json.contains("\"document\" : \"FORM1\""));
    }
}
