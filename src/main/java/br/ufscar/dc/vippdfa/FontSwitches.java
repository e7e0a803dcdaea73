package br.ufscar.dc.vippdfa;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Marcadores de troca de fonte embutidos em cadeias ("~~FAtexto"). O alias
 * após o marcador é o mais longo alias conhecido; sem correspondência, vale
 * a forma VIPP de um ou dois caracteres alfanuméricos.
 */
public final class FontSwitches {

    public static final String MARKER = "~~";

    public static class Segment {
        private final String font; // null antes do primeiro marcador
        private final String text;

        Segment(String font, String text) {
            this.font = font;
            this.text = text;
        }

        public String getFont() {
            return font;
        }

        public String getText() {
            return text;
        }
    }

    private FontSwitches() {
    }

    public static boolean hasSwitch(String text) {
        return text.contains(MARKER);
    }

    public static List<Segment> split(String text, Collection<String> aliases) {
        List<Segment> segments = new ArrayList<>();
        String font = null;
        int pos = 0;
        while (true) {
            int marker = text.indexOf(MARKER, pos);
            String chunk = marker < 0 ? text.substring(pos) : text.substring(pos, marker);
            if (!chunk.isEmpty() || (font != null && marker < 0)) {
                segments.add(new Segment(font, chunk));
            }
            if (marker < 0) {
                return segments;
            }
            int start = marker + MARKER.length();
            int end = aliasEnd(text, start, aliases);
            font = text.substring(start, end);
            pos = end;
        }
    }

    /** Troca os aliases renomeados nos marcadores da cadeia */
    public static String rewrite(String text, Collection<String> aliases, Map<String, String> renames) {
        if (!hasSwitch(text) || renames.isEmpty()) {
            return text;
        }
        StringBuilder sb = new StringBuilder();
        int pos = 0;
        int marker;
        while ((marker = text.indexOf(MARKER, pos)) >= 0) {
            int start = marker + MARKER.length();
            int end = aliasEnd(text, start, aliases);
            String alias = text.substring(start, end);
            sb.append(text, pos, start).append(renames.getOrDefault(alias, alias));
            pos = end;
        }
        return sb.append(text.substring(pos)).toString();
    }

    private static int aliasEnd(String text, int start, Collection<String> aliases) {
        int best = -1;
        for (String a : aliases) {
            if (text.startsWith(a, start) && a.length() > best) {
                best = a.length();
            }
        }
        if (best > 0) {
            return start + best;
        }
        int end = start;
        while (end < text.length() && end < start + 2 && Character.isLetterOrDigit(text.charAt(end))) {
            end++;
        }
        return end;
    }
}
