package br.ufscar.dc.vippdfa;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Parâmetros da tradução. Os padrões vêm de translator-defaults.json no
 * classpath; um arquivo JSON opcional sobrepõe apenas as chaves presentes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TranslatorConfig {

    private static final String DEFAULTS = "/translator-defaults.json";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Deslocamento de origem de um layout de página, em milímetros */
    public static class Offset {
        private double x;
        private double y;

        public Offset() {
        }

        public Offset(double x, double y) {
            this.x = x;
            this.y = y;
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
    }

    private double pageWidthMm;
    private double pageHeightMm;
    private double marginLeftMm;
    private double marginTopMm;
    private double marginRightMm;
    private double marginBottomMm;
    private String defaultUnit;
    private String documentAxis;
    private String segmentAxis;
    private double defaultLineSpacingMm;
    private String defaultFontFamily;
    private double defaultFontSize;
    private int wrapThreshold;
    private double ruleThresholdMm;
    private double minStrokeMm;
    private double minBoxMm;
    private double minTextWidthMm;
    private int inlineMaxCommands;
    private double averageCharWidthRatio;
    private String fieldDelimiter;
    private int recordLength;

    @JsonMerge
    private Map<String, Offset> layoutOffsets = new LinkedHashMap<>();
    @JsonMerge
    private Map<String, String> fontFamilies = new LinkedHashMap<>();
    @JsonMerge
    private Map<String, List<Integer>> colors = new LinkedHashMap<>();

    public static TranslatorConfig defaults() {
        try (InputStream in = TranslatorConfig.class.getResourceAsStream(DEFAULTS)) {
            if (in == null) {
                throw new IllegalStateException("recurso " + DEFAULTS + " ausente do classpath");
            }
            return MAPPER.readValue(in, TranslatorConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("falha ao ler " + DEFAULTS, e);
        }
    }

    /** Padrões sobrepostos pelo arquivo indicado */
    public static TranslatorConfig load(Path file) throws IOException {
        TranslatorConfig config = defaults();
        try (InputStream in = Files.newInputStream(file)) {
            return MAPPER.readerForUpdating(config).readValue(in);
        }
    }

    /** Padrões sobrepostos por um trecho JSON */
    public static TranslatorConfig fromJson(String json) throws IOException {
        return MAPPER.readerForUpdating(defaults()).readValue(json);
    }

    public Offset layoutOffset(String layout) {
        Offset o = layoutOffsets.get(layout);
        return o != null ? o : new Offset(0, 0);
    }

    public String fontFamily(String vippName) {
        return fontFamilies.getOrDefault(vippName, vippName);
    }

    /** RGB em percentuais para o nome de cor, ou null se desconhecido */
    public List<Integer> color(String name) {
        return colors.get(name);
    }

    public double getPageWidthMm() {
        return pageWidthMm;
    }

    public void setPageWidthMm(double pageWidthMm) {
        this.pageWidthMm = pageWidthMm;
    }

    public double getPageHeightMm() {
        return pageHeightMm;
    }

    public void setPageHeightMm(double pageHeightMm) {
        this.pageHeightMm = pageHeightMm;
    }

    public double getMarginLeftMm() {
        return marginLeftMm;
    }

    public void setMarginLeftMm(double marginLeftMm) {
        this.marginLeftMm = marginLeftMm;
    }

    public double getMarginTopMm() {
        return marginTopMm;
    }

    public void setMarginTopMm(double marginTopMm) {
        this.marginTopMm = marginTopMm;
    }

    public double getMarginRightMm() {
        return marginRightMm;
    }

    public void setMarginRightMm(double marginRightMm) {
        this.marginRightMm = marginRightMm;
    }

    public double getMarginBottomMm() {
        return marginBottomMm;
    }

    public void setMarginBottomMm(double marginBottomMm) {
        this.marginBottomMm = marginBottomMm;
    }

    public String getDefaultUnit() {
        return defaultUnit;
    }

    public void setDefaultUnit(String defaultUnit) {
        this.defaultUnit = defaultUnit;
    }

    public String getDocumentAxis() {
        return documentAxis;
    }

    public void setDocumentAxis(String documentAxis) {
        this.documentAxis = documentAxis;
    }

    public String getSegmentAxis() {
        return segmentAxis;
    }

    public void setSegmentAxis(String segmentAxis) {
        this.segmentAxis = segmentAxis;
    }

    public double getDefaultLineSpacingMm() {
        return defaultLineSpacingMm;
    }

    public void setDefaultLineSpacingMm(double defaultLineSpacingMm) {
        this.defaultLineSpacingMm = defaultLineSpacingMm;
    }

    public String getDefaultFontFamily() {
        return defaultFontFamily;
    }

    public void setDefaultFontFamily(String defaultFontFamily) {
        this.defaultFontFamily = defaultFontFamily;
    }

    public double getDefaultFontSize() {
        return defaultFontSize;
    }

    public void setDefaultFontSize(double defaultFontSize) {
        this.defaultFontSize = defaultFontSize;
    }

    public int getWrapThreshold() {
        return wrapThreshold;
    }

    public void setWrapThreshold(int wrapThreshold) {
        this.wrapThreshold = wrapThreshold;
    }

    public double getRuleThresholdMm() {
        return ruleThresholdMm;
    }

    public void setRuleThresholdMm(double ruleThresholdMm) {
        this.ruleThresholdMm = ruleThresholdMm;
    }

    public double getMinStrokeMm() {
        return minStrokeMm;
    }

    public void setMinStrokeMm(double minStrokeMm) {
        this.minStrokeMm = minStrokeMm;
    }

    public double getMinBoxMm() {
        return minBoxMm;
    }

    public void setMinBoxMm(double minBoxMm) {
        this.minBoxMm = minBoxMm;
    }

    public double getMinTextWidthMm() {
        return minTextWidthMm;
    }

    public void setMinTextWidthMm(double minTextWidthMm) {
        this.minTextWidthMm = minTextWidthMm;
    }

    public int getInlineMaxCommands() {
        return inlineMaxCommands;
    }

    public void setInlineMaxCommands(int inlineMaxCommands) {
        this.inlineMaxCommands = inlineMaxCommands;
    }

    public double getAverageCharWidthRatio() {
        return averageCharWidthRatio;
    }

    public void setAverageCharWidthRatio(double averageCharWidthRatio) {
        this.averageCharWidthRatio = averageCharWidthRatio;
    }

    public String getFieldDelimiter() {
        return fieldDelimiter;
    }

    public void setFieldDelimiter(String fieldDelimiter) {
        this.fieldDelimiter = fieldDelimiter;
    }

    public int getRecordLength() {
        return recordLength;
    }

    public void setRecordLength(int recordLength) {
        this.recordLength = recordLength;
    }

    public Map<String, Offset> getLayoutOffsets() {
        return layoutOffsets;
    }

    public void setLayoutOffsets(Map<String, Offset> layoutOffsets) {
        this.layoutOffsets = layoutOffsets;
    }

    public Map<String, String> getFontFamilies() {
        return fontFamilies;
    }

    public void setFontFamilies(Map<String, String> fontFamilies) {
        this.fontFamilies = fontFamilies;
    }

    public Map<String, List<Integer>> getColors() {
        return colors;
    }

    public void setColors(Map<String, List<Integer>> colors) {
        this.colors = colors;
    }
}
