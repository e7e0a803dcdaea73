package br.ufscar.dc.vippdfa;

import java.util.Collection;
import java.util.List;

/**
 * Emissão de texto. Todo comando de saída (SH*, SHP, linhas de tabela) passa
 * por {@link #choose} para decidir entre OUTPUT simples e TEXT com quebra.
 */
public class TextEmitter {

    public enum Mode {
        SIMPLE,
        WRAPPED
    }

    public enum Align {
        LEFT,
        RIGHT,
        CENTER,
        JUSTIFY
    }

    /** Conteúdo a imprimir: cadeia literal (com ou sem substituições) ou expressão DFA */
    public static class Content {
        private final String literal;
        private final boolean substitute;
        private final String expression;
        private final int visibleLength;

        private Content(String literal, boolean substitute, String expression, int visibleLength) {
            this.literal = literal;
            this.substitute = substitute;
            this.expression = expression;
            this.visibleLength = visibleLength;
        }

        public static Content literal(String text, boolean substitute) {
            String visible = substitute ? DfaExpressions.withoutSubstitutions(text) : text;
            return new Content(text, substitute, null, visible.length());
        }

        public static Content expression(String expression, int visibleLength) {
            return new Content(null, false, expression, visibleLength);
        }

        public boolean isLiteral() {
            return literal != null;
        }

        public String getLiteral() {
            return literal;
        }

        public String getExpression() {
            return expression;
        }

        public boolean hasFontSwitch() {
            return literal != null && FontSwitches.hasSwitch(literal);
        }

        public int getVisibleLength() {
            return visibleLength;
        }
    }

    private final DfaWriter out;
    private final TranslatorConfig config;
    private final Collection<String> fontAliases;

    public TextEmitter(DfaWriter out, TranslatorConfig config, Collection<String> fontAliases) {
        this.out = out;
        this.config = config;
        this.fontAliases = fontAliases;
    }

    public static Mode choose(int visibleLength, Align align, boolean fontSwitch, boolean explicitWidth,
            int wrapThreshold) {
        if (visibleLength > wrapThreshold || align == Align.JUSTIFY || fontSwitch || explicitWidth) {
            return Mode.WRAPPED;
        }
        return Mode.SIMPLE;
    }

    /**
     * @param position cláusula POSITION já montada
     * @param widthMm largura explícita, ou null para a largura disponível
     * @param availableMm largura até a margem direita a partir da posição
     */
    public Mode emit(Content content, Align align, String font, String color, String position,
            Double widthMm, double availableMm) {
        Mode mode = choose(content.getVisibleLength(), align, content.hasFontSwitch(), widthMm != null,
                config.getWrapThreshold());
        if (mode == Mode.SIMPLE) {
            simple(content, align, font, color, position);
        } else {
            double width = widthMm != null ? widthMm : availableMm;
            wrapped(content, align, font, color, position, Math.max(width, config.getMinTextWidthMm()));
        }
        return mode;
    }

    private void simple(Content content, Align align, String font, String color, String position) {
        out.line("OUTPUT " + render(content));
        out.indent();
        out.line("FONT " + font + " NORMAL");
        String tail = "";
        if (align == Align.RIGHT || align == Align.CENTER) {
            tail = "ALIGN " + align.name() + " NOPAD";
        }
        if (color == null && tail.isEmpty()) {
            out.line(position + ";");
        } else {
            out.line(position);
            if (color != null) {
                out.line("COLOR " + color + (tail.isEmpty() ? ";" : ""));
            }
            if (!tail.isEmpty()) {
                out.line(tail + ";");
            }
        }
        out.dedent();
    }

    private void wrapped(Content content, Align align, String font, String color, String position, double width) {
        out.line("TEXT");
        out.indent();
        out.line(position);
        out.line("WIDTH " + DfaWriter.number(width) + " MM");
        out.line("ALIGN " + align.name());
        if (color != null) {
            out.line("COLOR " + color);
        }
        if (content.hasFontSwitch()) {
            List<FontSwitches.Segment> segments = FontSwitches.split(content.getLiteral(), fontAliases);
            for (FontSwitches.Segment s : segments) {
                out.line("FONT " + (s.getFont() != null ? s.getFont() : font) + " NORMAL");
                out.line(renderLiteral(s.getText(), content.substitute));
            }
        } else {
            out.line("FONT " + font + " NORMAL");
            out.line(render(content));
        }
        out.line(";");
        out.dedent();
    }

    private static String render(Content content) {
        if (content.isLiteral()) {
            return renderLiteral(content.getLiteral(), content.substitute);
        }
        return "(" + content.getExpression() + ")";
    }

    private static String renderLiteral(String text, boolean substitute) {
        if (substitute && DfaExpressions.hasSubstitution(text)) {
            return "(" + DfaExpressions.substitute(text) + ")";
        }
        return DfaWriter.quote(text);
    }
}
