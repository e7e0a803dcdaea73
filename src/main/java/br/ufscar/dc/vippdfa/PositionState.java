package br.ufscar.dc.vippdfa;

import java.util.Locale;

/**
 * Posição corrente durante a geração, sempre em milímetros no eixo DFA
 * (origem no canto superior esquerdo, y crescendo para baixo). Dentro de
 * segmentos as coordenadas são relativas à âncora da chamada.
 */
public class PositionState {

    public enum Mode {
        ABSOLUTE,
        FLOW,
        RESET
    }

    public enum Axis {
        TOP_DOWN,
        BOTTOM_UP;

        public static Axis parse(String text) {
            return Axis.valueOf(text.toUpperCase(Locale.ROOT));
        }
    }

    public enum Unit {
        MM(1.0),
        CM(10.0),
        INCH(25.4),
        POINT(0.352778);

        private final double mm;

        Unit(double mm) {
            this.mm = mm;
        }

        public double toMm(double value) {
            return value * mm;
        }

        /** Aceita MM, CM, INCH/IN e POINT/PT/DOT */
        public static Unit parse(String text) {
            switch (text.toUpperCase(Locale.ROOT)) {
                case "MM":
                    return MM;
                case "CM":
                    return CM;
                case "IN":
                case "INCH":
                    return INCH;
                case "PT":
                case "POINT":
                case "DOT":
                    return POINT;
                default:
                    throw new IllegalArgumentException("unidade desconhecida: " + text);
            }
        }
    }

    private double x;
    private double y;
    // coordenadas simbólicas (variáveis VIPP), quando não numéricas
    private String xExpression;
    private String yExpression;
    private boolean xExplicit;
    private boolean yExplicit;
    private double flowY;
    private Mode mode = Mode.ABSOLUTE;
    private Unit units;
    private Axis axis;
    private Axis segmentAxis;
    private String font;
    private String color;
    private Double lineSpacing; // null: espaçamento automático
    private int segmentDepth;
    private double originX;
    private double originY;
    private final double pageHeight;
    private final double defaultLineSpacing;

    public PositionState(TranslatorConfig config, String defaultFont) {
        this.units = Unit.parse(config.getDefaultUnit());
        this.axis = Axis.parse(config.getDocumentAxis());
        this.segmentAxis = Axis.parse(config.getSegmentAxis());
        this.pageHeight = config.getPageHeightMm();
        this.defaultLineSpacing = config.getDefaultLineSpacingMm();
        this.font = defaultFont;
    }

    private PositionState(PositionState o) {
        this.pageHeight = o.pageHeight;
        this.defaultLineSpacing = o.defaultLineSpacing;
        copyFrom(o);
    }

    public PositionState copy() {
        return new PositionState(this);
    }

    /** Volta ao estado salvo antes de uma chamada ou ramo */
    public void restore(PositionState saved) {
        copyFrom(saved);
    }

    private void copyFrom(PositionState o) {
        x = o.x;
        y = o.y;
        xExpression = o.xExpression;
        yExpression = o.yExpression;
        xExplicit = o.xExplicit;
        yExplicit = o.yExplicit;
        flowY = o.flowY;
        mode = o.mode;
        units = o.units;
        axis = o.axis;
        segmentAxis = o.segmentAxis;
        font = o.font;
        color = o.color;
        lineSpacing = o.lineSpacing;
        segmentDepth = o.segmentDepth;
        originX = o.originX;
        originY = o.originY;
    }

    public double toMm(double value) {
        return units.toMm(value);
    }

    public double mapX(double value) {
        return inSegment() ? toMm(value) : toMm(value) + originX;
    }

    public double mapY(double value) {
        double mm = toMm(value);
        if (inSegment()) {
            return segmentAxis == Axis.BOTTOM_UP ? -mm : mm;
        }
        return (axis == Axis.BOTTOM_UP ? pageHeight - mm : mm) + originY;
    }

    public void moveTo(double vx, double vy) {
        x = mapX(vx);
        y = mapY(vy);
        xExpression = null;
        yExpression = null;
        xExplicit = true;
        yExplicit = true;
        flowY = 0;
        mode = Mode.ABSOLUTE;
    }

    /** MOVETO com coordenadas em variáveis; o valor só é conhecido na execução */
    public void moveToExpression(String ex, String ey) {
        xExpression = ex;
        yExpression = ey;
        xExplicit = true;
        yExplicit = true;
        flowY = 0;
        mode = Mode.ABSOLUTE;
    }

    public void moveHorizontal(double vx) {
        x = mapX(vx);
        xExpression = null;
        xExplicit = true;
        yExplicit = false;
    }

    public void moveHorizontalExpression(String ex) {
        xExpression = ex;
        xExplicit = true;
        yExplicit = false;
    }

    /**
     * Avança uma linha. Sem valor usa o espaçamento corrente; com valor, o
     * deslocamento é relativo e com sinal (negativo sobe).
     */
    public void newLine(Double override) {
        double delta = override == null ? getEffectiveLineSpacing() : toMm(override);
        y += delta;
        flowY += delta;
        mode = Mode.FLOW;
        xExplicit = false;
        yExplicit = false;
    }

    /** Depois de uma saída a próxima continua no fluxo do DFA */
    public void afterOutput() {
        xExplicit = false;
        yExplicit = false;
    }

    /** Após ramos ou laços com posições divergentes */
    public void forgetPosition() {
        xExplicit = false;
        yExplicit = false;
        mode = Mode.FLOW;
    }

    public void enterSegment() {
        segmentDepth++;
        x = 0;
        y = 0;
        xExpression = null;
        yExpression = null;
        xExplicit = true;
        yExplicit = true;
        flowY = 0;
        mode = Mode.RESET;
    }

    public boolean inSegment() {
        return segmentDepth > 0;
    }

    public int getSegmentDepth() {
        return segmentDepth;
    }

    /** Mesma posição, fonte e cor */
    public boolean samePlacement(PositionState o) {
        return Double.compare(x, o.x) == 0 && Double.compare(y, o.y) == 0
                && xExplicit == o.xExplicit && yExplicit == o.yExplicit
                && equal(xExpression, o.xExpression) && equal(yExpression, o.yExpression)
                && equal(font, o.font) && equal(color, o.color);
    }

    private static boolean equal(Object a, Object b) {
        return a == null ? b == null : a.equals(b);
    }

    public void setOrigin(double ox, double oy) {
        originX = ox;
        originY = oy;
    }

    public double getX() {
        return x;
    }

    public void setX(double x) {
        this.x = x;
    }

    public double getY() {
        return y;
    }

    public void setY(double y) {
        this.y = y;
    }

    public String getXExpression() {
        return xExpression;
    }

    public String getYExpression() {
        return yExpression;
    }

    public boolean isXExplicit() {
        return xExplicit;
    }

    public boolean isYExplicit() {
        return yExplicit;
    }

    public double getFlowY() {
        return flowY;
    }

    public Mode getMode() {
        return mode;
    }

    public Unit getUnits() {
        return units;
    }

    public void setUnits(Unit units) {
        this.units = units;
    }

    public Axis getAxis() {
        return axis;
    }

    public void setAxis(Axis axis) {
        this.axis = axis;
    }

    public String getFont() {
        return font;
    }

    public void setFont(String font) {
        this.font = font;
    }

    public String getColor() {
        return color;
    }

    public void setColor(String color) {
        this.color = color;
    }

    public Double getLineSpacing() {
        return lineSpacing;
    }

    public void setLineSpacing(Double lineSpacing) {
        this.lineSpacing = lineSpacing;
    }

    public double getEffectiveLineSpacing() {
        return lineSpacing != null ? lineSpacing : defaultLineSpacing;
    }
}
