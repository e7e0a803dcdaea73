package br.ufscar.dc.vippdfa;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Junta as tabelas por arquivo numa tabela global. O documento principal
 * mantém seus aliases; um alias de sobreposição já usado com atributos
 * diferentes recebe o sufixo _n, e todas as referências na árvore daquele
 * arquivo são reescritas antes da geração.
 */
public class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    public static class Resolution {
        private final SymbolTable global;
        private final ConflictReport report;
        private final Map<String, Map<String, String>> fontRenames;
        private final Map<String, Map<String, String>> colorRenames;

        Resolution(SymbolTable global, ConflictReport report,
                Map<String, Map<String, String>> fontRenames, Map<String, Map<String, String>> colorRenames) {
            this.global = global;
            this.report = report;
            this.fontRenames = fontRenames;
            this.colorRenames = colorRenames;
        }

        public SymbolTable getGlobal() {
            return global;
        }

        public ConflictReport getReport() {
            return report;
        }

        /** Renomeações de fonte do documento indicado (alias antigo -> novo) */
        public Map<String, String> getFontRenames(String document) {
            return fontRenames.getOrDefault(document, Map.of());
        }

        public Map<String, String> getColorRenames(String document) {
            return colorRenames.getOrDefault(document, Map.of());
        }
    }

    private final Diagnostics diagnostics;

    public ConflictResolver(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public Resolution resolve(VippSemantico main, List<VippSemantico> overlays) {
        SymbolTable global = new SymbolTable();
        ConflictReport report = new ConflictReport();
        Map<String, Map<String, String>> fontRenames = new LinkedHashMap<>();
        Map<String, Map<String, String>> colorRenames = new LinkedHashMap<>();
        Map<String, Integer> fontCounters = new HashMap<>();
        Map<String, Integer> colorCounters = new HashMap<>();

        if (main != null) {
            main.getSymbolTable().getFonts().values().forEach(global::addFont);
            main.getSymbolTable().getColors().values().forEach(global::addColor);
        }

        for (VippSemantico overlay : overlays) {
            String doc = overlay.getDocument().getName();
            SymbolTable local = overlay.getSymbolTable();
            Map<String, String> fonts = new LinkedHashMap<>();
            Map<String, String> colors = new LinkedHashMap<>();

            for (SymbolTable.FontEntry entry : local.getFonts().values()) {
                SymbolTable.FontEntry existing = global.getFont(entry.getAlias());
                if (existing == null) {
                    global.addFont(entry);
                } else if (!existing.sameAttributes(entry)) {
                    String renamed = unusedName(entry.getAlias(), fontCounters,
                            n -> global.containsFont(n) || local.containsFont(n));
                    global.addFont(entry.renamed(renamed));
                    fonts.put(entry.getAlias(), renamed);
                    record(report, "FONT", doc, entry.getAlias(), renamed, existing.toString(), entry.toString());
                }
            }
            for (SymbolTable.ColorEntry entry : local.getColors().values()) {
                SymbolTable.ColorEntry existing = global.getColor(entry.getAlias());
                if (existing == null) {
                    global.addColor(entry);
                } else if (!existing.sameAttributes(entry)) {
                    String renamed = unusedName(entry.getAlias(), colorCounters,
                            n -> global.containsColor(n) || local.containsColor(n));
                    global.addColor(entry.renamed(renamed));
                    colors.put(entry.getAlias(), renamed);
                    record(report, "COLOR", doc, entry.getAlias(), renamed, existing.toString(), entry.toString());
                }
            }

            if (!fonts.isEmpty() || !colors.isEmpty()) {
                Set<String> aliases = new TreeSet<>(local.getFonts().keySet());
                rewrite(overlay.getDocument().getCommands(), fonts, colors, aliases);
            }
            fontRenames.put(doc, fonts);
            colorRenames.put(doc, colors);
        }
        return new Resolution(global, report, fontRenames, colorRenames);
    }

    private interface NameCheck {
        boolean taken(String name);
    }

    /** Sufixo estável: contador por alias, na ordem de processamento dos arquivos */
    private static String unusedName(String alias, Map<String, Integer> counters, NameCheck check) {
        int n = counters.getOrDefault(alias, 0);
        String candidate;
        do {
            n++;
            candidate = alias + "_" + n;
        } while (check.taken(candidate));
        counters.put(alias, n);
        return candidate;
    }

    private void record(ConflictReport report, String kind, String doc, String alias, String renamed,
            String kept, String other) {
        report.add(new ConflictReport.Entry(kind, doc, alias, renamed, kept, other));
        diagnostics.add(Diagnostics.Kind.CONFLICT, doc, 0,
                String.format("%s %s redefinido (%s x %s), renomeado para %s", kind, alias, kept, other, renamed));
        log.debug("{}: {} -> {}", doc, alias, renamed);
    }

    /** Reescreve definições, trocas e marcadores ~~ de toda a árvore */
    static void rewrite(List<Command> commands, Map<String, String> fonts, Map<String, String> colors,
            Set<String> fontAliases) {
        for (Command c : commands) {
            switch (c.getKind()) {
                case DEFINE_FONT:
                case SET_FONT:
                    renameParameter(c, 0, fonts);
                    break;
                case DEFINE_COLOR:
                case SET_COLOR:
                    renameParameter(c, 0, colors);
                    break;
                default:
                    break;
            }
            if (!fonts.isEmpty()) {
                List<Operand> params = new ArrayList<>(c.getParameters());
                for (int i = 0; i < params.size(); i++) {
                    c.setParameter(i, params.get(i).rewriteStrings(s -> FontSwitches.rewrite(s, fontAliases, fonts)));
                }
                for (Map.Entry<String, Operand> e : c.getOptions().entrySet()) {
                    e.setValue(e.getValue().rewriteStrings(s -> FontSwitches.rewrite(s, fontAliases, fonts)));
                }
            }
            rewrite(c.getChildren(), fonts, colors, fontAliases);
        }
    }

    private static void renameParameter(Command c, int index, Map<String, String> renames) {
        Operand op = c.getParameter(index);
        String renamed = renames.get(op.getText());
        if (renamed != null) {
            c.setParameter(index, op.withText(renamed));
        }
    }
}
