package br.ufscar.dc.vippdfa;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TranslatorConfigTest {

    @Test
    void defaultsComeFromClasspath() {
        TranslatorConfig config = TranslatorConfig.defaults();

        assertEquals(210.0, config.getPageWidthMm());
        assertEquals(50, config.getWrapThreshold());
        assertEquals(5, config.getInlineMaxCommands());
        assertEquals("Arial Bold", config.fontFamily("ARIALB"));
        assertEquals(List.of(100, 0, 0), config.color("RED"));
        assertEquals(0.0, config.layoutOffset("QUALQUER").getX());
    }

    @Test
    void jsonOverridesOnlyGivenKeys() throws Exception {
        TranslatorConfig config = TranslatorConfig.fromJson("{\"wrapThreshold\": 80,"
                + " \"fontFamilies\": {\"MINHA\": \"Minha Fonte\"},"
                + " \"layoutOffsets\": {\"CAPA\": {\"x\": 2.5, \"y\": -1}},"
                + " \"desconhecida\": true}");

        assertEquals(80, config.getWrapThreshold());
        assertEquals(297.0, config.getPageHeightMm());
        assertEquals("Minha Fonte", config.fontFamily("MINHA"));
        assertEquals("Arial Bold", config.fontFamily("ARIALB"));
        assertEquals(2.5, config.layoutOffset("CAPA").getX());
        assertNull(config.color("SEM_COR"));
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("config.json");
        Files.write(file, "{\"ruleThresholdMm\": 0.5}".getBytes("UTF-8"));

        TranslatorConfig config = TranslatorConfig.load(file);

        assertEquals(0.5, config.getRuleThresholdMm());
        assertTrue(config.getFontFamilies().size() > 1);
    }

    @Test
    void layoutOffsetShiftsMainContent() throws Exception {
        TranslatorConfig config = TranslatorConfig.fromJson("{\"layoutOffsets\": {\"CAPA\": {\"x\": 5, \"y\": 7}}}");

        String dfa = new Translator(config).translate(
                new SourceDocument("m.dbm", "(CAPA.frm) SETFORM 10 10 MOVETO (x) SH"), List.of()).getMain();

        assertTrue(dfa.contains("/* Page layout offset for CAPA: 5 MM, 7 MM */"));
        assertTrue(dfa.contains("POSITION (15 MM-$MR_LEFT) (17 MM-$MR_TOP+&CORFONT8)"));
    }
}
