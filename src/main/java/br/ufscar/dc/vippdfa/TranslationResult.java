package br.ufscar.dc.vippdfa;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/** Saída de uma tradução: fluxo principal, fluxos de sobreposição e relatórios */
public class TranslationResult {

    private final String mainName;
    private final String main;
    private final Map<String, String> overlays;
    private final Diagnostics diagnostics;
    private final ConflictReport conflicts;
    private final Set<String> resources;

    public TranslationResult(String mainName, String main, Map<String, String> overlays, Diagnostics diagnostics,
            ConflictReport conflicts, Set<String> resources) {
        this.mainName = mainName;
        this.main = main;
        this.overlays = Collections.unmodifiableMap(overlays);
        this.diagnostics = diagnostics;
        this.conflicts = conflicts;
        this.resources = Collections.unmodifiableSet(resources);
    }

    public String getMainName() {
        return mainName;
    }

    public String getMain() {
        return main;
    }

    /** Texto DFA de cada sobreposição traduzida, por nome */
    public Map<String, String> getOverlays() {
        return overlays;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    public ConflictReport getConflicts() {
        return conflicts;
    }

    public Set<String> getResources() {
        return resources;
    }
}
