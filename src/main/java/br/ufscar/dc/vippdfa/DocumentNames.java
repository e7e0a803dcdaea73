package br.ufscar.dc.vippdfa;

import java.util.Locale;

/** Normalização de nomes de arquivos e de valores para identificadores DFA */
public final class DocumentNames {

    private DocumentNames() {
    }

    /** "dir/Form1.frm" -> "FORM1" */
    public static String baseName(String fileName) {
        String name = fileName.replace('\\', '/');
        int slash = name.lastIndexOf('/');
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        return identifier(name);
    }

    /** Extensão em minúsculas, ou vazio */
    public static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        return dot > slash && dot < fileName.length() - 1
                ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    /** Identificador DFA: maiúsculas, dígitos e sublinhado */
    public static String identifier(String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        for (char c : raw.toUpperCase(Locale.ROOT).toCharArray()) {
            sb.append((c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_' ? c : '_');
        }
        if (sb.length() == 0) {
            return "_";
        }
        return sb.toString();
    }

    /** Nome de variável DFA: o ponto dos nomes compostos vira sublinhado */
    public static String variable(String raw) {
        return raw.replace('.', '_');
    }
}
