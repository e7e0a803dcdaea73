package br.ufscar.dc.vippdfa;

import java.util.Locale;

/**
 * Estilo do DRAWB: prefixo de cor (R, G, B; F é preenchimento preto),
 * sombra S1-S4, espessura LTHN/LMED/LTHK e tipo de linha (D tracejada,
 * P pontilhada). Partes separadas por "_" ou coladas: R_S1, RS2, LMEDD.
 */
public final class BoxStyle {

    public enum LineType {
        SOLID,
        DASHED,
        DOTTED
    }

    private String color;   // nome de cor DFA, ou null
    private Integer shade;  // percentual de preenchimento, ou null para contorno
    private double thicknessMm = 0.2;
    private LineType lineType = LineType.SOLID;

    private BoxStyle() {
    }

    public static BoxStyle parse(String text) {
        BoxStyle style = new BoxStyle();
        if (text == null) {
            return style;
        }
        for (String part : text.toUpperCase(Locale.ROOT).split("_")) {
            style.apply(part);
        }
        return style;
    }

    private void apply(String part) {
        if (part.isEmpty()) {
            return;
        }
        if (thickness(part) || shade(part)) {
            return;
        }
        switch (part) {
            case "D":
                lineType = LineType.DASHED;
                return;
            case "P":
                lineType = LineType.DOTTED;
                return;
            default:
                break;
        }
        if (part.length() > 4 && thickness(part.substring(0, 4))) {
            apply(part.substring(4));
            return;
        }
        char first = part.charAt(0);
        switch (first) {
            case 'R':
                color = "RED";
                break;
            case 'G':
                color = "GREEN";
                break;
            case 'B':
                color = "BLUE";
                break;
            case 'F':
                color = "BLACK";
                if (shade == null) {
                    shade = 100;
                }
                break;
            default:
                return;
        }
        apply(part.substring(1));
    }

    private boolean thickness(String part) {
        switch (part) {
            case "LTHN":
                thicknessMm = 0.1;
                return true;
            case "LMED":
                thicknessMm = 0.2;
                return true;
            case "LTHK":
                thicknessMm = 0.5;
                return true;
            default:
                return false;
        }
    }

    private boolean shade(String part) {
        switch (part) {
            case "S1":
                shade = 100;
                return true;
            case "S2":
                shade = 75;
                return true;
            case "S3":
                shade = 50;
                return true;
            case "S4":
                shade = 25;
                return true;
            default:
                return false;
        }
    }

    public String getColor() {
        return color;
    }

    public Integer getShade() {
        return shade;
    }

    public boolean isFilled() {
        return shade != null;
    }

    public double getThicknessMm() {
        return thicknessMm;
    }

    public LineType getLineType() {
        return lineType;
    }
}
