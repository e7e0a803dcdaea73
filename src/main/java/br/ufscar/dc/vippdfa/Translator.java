package br.ufscar.dc.vippdfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Traduz um documento principal e suas sobreposições. Cada documento passa
 * por leitura, análise e geração próprias; a resolução de conflitos entre as
 * tabelas acontece antes de qualquer geração.
 */
public class Translator {

    private static final Logger log = LoggerFactory.getLogger(Translator.class);

    private final TranslatorConfig config;

    public Translator(TranslatorConfig config) {
        this.config = config;
    }

    public Translator() {
        this(TranslatorConfig.defaults());
    }

    /**
     * @throws TranslationException se o documento principal não puder ser lido
     *         ou analisado; falhas em sobreposições só geram diagnóstico
     */
    public TranslationResult translate(SourceDocument main, List<SourceDocument> overlays)
            throws TranslationException {
        Diagnostics diagnostics = new Diagnostics();
        log.info("Traduzindo {} com {} sobreposicao(oes)", main.getName(), overlays.size());

        Set<String> predefinedColors = config.getColors().keySet();
        VippSemantico mainAnalysis = analyze(main, ParsedDocument.Role.MAIN, diagnostics,
                Collections.emptySet(), predefinedColors);

        // as sobreposições podem trocar para fontes e cores declaradas só no principal
        SymbolTable mainTable = mainAnalysis.getSymbolTable();
        Set<String> mainColors = new HashSet<>(predefinedColors);
        mainColors.addAll(mainTable.getColors().keySet());

        List<VippSemantico> overlayAnalyses = new ArrayList<>();
        for (SourceDocument overlay : overlays) {
            try {
                overlayAnalyses.add(analyze(overlay, ParsedDocument.Role.OVERLAY, diagnostics,
                        mainTable.getFonts().keySet(), mainColors));
            } catch (TranslationException e) {
                diagnostics.add(Diagnostics.Kind.DOCUMENT_FAILED, overlay.getName(), e.getLine(), e.getMessage());
            }
        }

        ConflictResolver.Resolution resolution = new ConflictResolver(diagnostics).resolve(mainAnalysis, overlayAnalyses);

        Set<String> overlayNames = new LinkedHashSet<>();
        for (VippSemantico o : overlayAnalyses) {
            overlayNames.add(o.getDocument().getName());
        }
        Set<String> resources = new TreeSet<>();

        VippGeradorDfa mainGenerator = new VippGeradorDfa(config, resolution.getGlobal(), mainAnalysis,
                diagnostics, overlayNames);
        String mainText = mainGenerator.generate();
        resources.addAll(mainGenerator.getResources());

        Map<String, String> overlayTexts = new LinkedHashMap<>();
        for (VippSemantico o : overlayAnalyses) {
            VippGeradorDfa gerador = new VippGeradorDfa(config, resolution.getGlobal(), o, diagnostics, overlayNames);
            overlayTexts.put(o.getDocument().getName(), gerador.generate());
            resources.addAll(gerador.getResources());
        }

        log.info("{}: {} diagnostico(s), {} conflito(s), {} recurso(s)", main.getName(),
                diagnostics.getEntries().size(), resolution.getReport().getEntries().size(), resources.size());
        return new TranslationResult(main.getName(), mainText, overlayTexts, diagnostics,
                resolution.getReport(), resources);
    }

    private static VippSemantico analyze(SourceDocument source, ParsedDocument.Role role, Diagnostics diagnostics,
            Set<String> knownFonts, Set<String> knownColors) throws TranslationException {
        log.debug("Lendo {}", source.getName());
        List<VippToken> tokens = VippTokenReader.tokenize(source.getText(), source.getName());
        ParsedDocument document = new VippParser(source.getName(), diagnostics, knownFonts, knownColors)
                .parse(tokens, role);
        return new VippSemantico(document).analyze();
    }
}
