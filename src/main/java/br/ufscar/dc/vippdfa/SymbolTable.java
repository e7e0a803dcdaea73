package br.ufscar.dc.vippdfa;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/** Tabela de símbolos de um arquivo: fontes, cores, variáveis e sub-rotinas */
public class SymbolTable {

    public enum VariableKind {
        SCALAR,
        STRING,
        ARRAY
    }

    public static class FontEntry {
        private final String alias;
        private final String family;
        private final double size;

        public FontEntry(String alias, String family, double size) {
            this.alias = alias;
            this.family = family;
            this.size = size;
        }

        public String getAlias() {
            return alias;
        }

        public String getFamily() {
            return family;
        }

        public double getSize() {
            return size;
        }

        public boolean sameAttributes(FontEntry other) {
            return family.equalsIgnoreCase(other.family) && Double.compare(size, other.size) == 0;
        }

        public FontEntry renamed(String newAlias) {
            return new FontEntry(newAlias, family, size);
        }

        @Override
        public String toString() {
            return family + " " + DfaWriter.number(size);
        }
    }

    public static class ColorEntry {
        private final String alias;
        private final String value; // nome de cor (RED) ou RGB(r,g,b) em percentuais

        public ColorEntry(String alias, String value) {
            this.alias = alias;
            this.value = value;
        }

        public String getAlias() {
            return alias;
        }

        public String getValue() {
            return value;
        }

        public boolean sameAttributes(ColorEntry other) {
            return value.equalsIgnoreCase(other.value);
        }

        public ColorEntry renamed(String newAlias) {
            return new ColorEntry(newAlias, value);
        }

        @Override
        public String toString() {
            return value;
        }
    }

    public static class VariableEntry {
        private final String name;
        private final VariableKind kind;
        private final boolean initOnly; // primeira atribuição marcada com /INI

        public VariableEntry(String name, VariableKind kind, boolean initOnly) {
            this.name = name;
            this.kind = kind;
            this.initOnly = initOnly;
        }

        public String getName() {
            return name;
        }

        public VariableKind getKind() {
            return kind;
        }

        public boolean isInitOnly() {
            return initOnly;
        }
    }

    private final Map<String, FontEntry> fonts = new LinkedHashMap<>();
    private final Map<String, ColorEntry> colors = new LinkedHashMap<>();
    private final Map<String, VariableEntry> variables = new LinkedHashMap<>();
    private final Map<String, Command> subroutines = new LinkedHashMap<>();

    /** Insere fonte; a primeira definição de um alias prevalece */
    public void addFont(FontEntry entry) {
        fonts.putIfAbsent(entry.getAlias(), entry);
    }

    public boolean containsFont(String alias) {
        return fonts.containsKey(alias);
    }

    public FontEntry getFont(String alias) {
        return fonts.get(alias);
    }

    /** Fontes na ordem de definição */
    public Map<String, FontEntry> getFonts() {
        return Collections.unmodifiableMap(fonts);
    }

    /** Fontes ordenadas por alias, para emissão determinística */
    public Map<String, FontEntry> getSortedFonts() {
        return Collections.unmodifiableMap(new TreeMap<>(fonts));
    }

    public void addColor(ColorEntry entry) {
        colors.putIfAbsent(entry.getAlias(), entry);
    }

    public boolean containsColor(String alias) {
        return colors.containsKey(alias);
    }

    public ColorEntry getColor(String alias) {
        return colors.get(alias);
    }

    public Map<String, ColorEntry> getColors() {
        return Collections.unmodifiableMap(colors);
    }

    public Map<String, ColorEntry> getSortedColors() {
        return Collections.unmodifiableMap(new TreeMap<>(colors));
    }

    /** Insere variável; reatribuições não mudam o tipo registrado */
    public void addVariable(VariableEntry entry) {
        variables.putIfAbsent(entry.getName(), entry);
    }

    public Map<String, VariableEntry> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    public void addSubroutine(String name, Command definition) {
        subroutines.put(Objects.requireNonNull(name), definition);
    }

    public Command getSubroutine(String name) {
        return subroutines.get(name);
    }

    public Map<String, Command> getSubroutines() {
        return Collections.unmodifiableMap(subroutines);
    }
}
