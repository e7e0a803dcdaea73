package br.ufscar.dc.vippdfa;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;

import org.junit.jupiter.api.Test;

class TextEmitterTest {

    @Test
    void shortPlainTextIsSimple() {
        assertEquals(TextEmitter.Mode.SIMPLE, TextEmitter.choose(50, TextEmitter.Align.RIGHT, false, false, 50));
    }

    @Test
    void longTextIsWrapped() {
        assertEquals(TextEmitter.Mode.WRAPPED, TextEmitter.choose(51, TextEmitter.Align.LEFT, false, false, 50));
    }

    @Test
    void justificationOrSwitchesForceWrapping() {
        assertEquals(TextEmitter.Mode.WRAPPED, TextEmitter.choose(3, TextEmitter.Align.JUSTIFY, false, false, 50));
        assertEquals(TextEmitter.Mode.WRAPPED, TextEmitter.choose(3, TextEmitter.Align.LEFT, true, false, 50));
        assertEquals(TextEmitter.Mode.WRAPPED, TextEmitter.choose(3, TextEmitter.Align.LEFT, false, true, 50));
    }

    @Test
    void simpleOutputCarriesColorAndAlignment() {
        DfaWriter out = new DfaWriter();
        TextEmitter emitter = new TextEmitter(out, TranslatorConfig.defaults(), Set.of("F1"));

        emitter.emit(TextEmitter.Content.literal("https://example.com", false), TextEmitter.Align.RIGHT,
                "F1", "R", "POSITION (SAME) (SAME)", null, 190);

        assertEquals("OUTPUT 'https://example.com'\n"
                + "    FONT F1 NORMAL\n"
                + "    POSITION (SAME) (SAME)\n"
                + "    COLOR R\n"
                + "    ALIGN RIGHT NOPAD;\n", out.getOutput());
    }

    @Test
    void fontSwitchesBecomeTextSegments() {
        DfaWriter out = new DfaWriter();
        TextEmitter emitter = new TextEmitter(out, TranslatorConfig.defaults(), Set.of("F1", "F2"));

        TextEmitter.Mode mode = emitter.emit(TextEmitter.Content.literal("Nome: ~~F2Joao", false),
                TextEmitter.Align.LEFT, "F1", null, "POSITION (10 MM-$MR_LEFT) (SAME)", null, 150);

        assertEquals(TextEmitter.Mode.WRAPPED, mode);
        String text = out.getOutput();
        assertTrue(text.startsWith("TEXT\n"));
        assertTrue(text.contains("WIDTH 150 MM"));
        assertTrue(text.contains("FONT F1 NORMAL\n    'Nome: '\n    FONT F2 NORMAL\n    'Joao'"));
        assertTrue(text.endsWith("    ;\n"));
    }

    @Test
    void substitutedTextKeepsVariablesUnquoted() {
        DfaWriter out = new DfaWriter();
        new TextEmitter(out, TranslatorConfig.defaults(), Set.of()).emit(
                TextEmitter.Content.literal("Total: $$VALOR.", true), TextEmitter.Align.LEFT,
                "F1", null, "POSITION (SAME) (SAME)", null, 150);

        assertTrue(out.getOutput().startsWith("OUTPUT ('Total: ' ! VALOR)\n"));
    }

    @Test
    void narrowWidthIsRaisedToMinimum() {
        DfaWriter out = new DfaWriter();
        new TextEmitter(out, TranslatorConfig.defaults(), Set.of()).emit(
                TextEmitter.Content.literal("x", false), TextEmitter.Align.LEFT, "F1", null,
                "POSITION (SAME) (SAME)", 5.0, 150);

        assertTrue(out.getOutput().contains("WIDTH 20 MM"));
    }
}
