package br.ufscar.dc.vippdfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gera o texto DFA de um documento já analisado. Uma instância por
 * documento: o estado de posição não é compartilhado entre documentos.
 */
public class VippGeradorDfa {

    private static final Logger log = LoggerFactory.getLogger(VippGeradorDfa.class);

    private static final Set<String> RASTER = Set.of("jpg", "jpeg", "tif", "tiff", "png", "gif", "bmp");

    private static final class PendingFormat {
        private final String name;
        private final List<Command> commands;

        PendingFormat(String name, List<Command> commands) {
            this.name = name;
            this.commands = commands;
        }
    }

    private final TranslatorConfig config;
    private final SymbolTable global;
    private final VippSemantico semantico;
    private final Diagnostics diagnostics;
    private final Set<String> availableOverlays;
    private final String document;
    private final String defaultFont;

    private final DfaWriter out = new DfaWriter();
    private final TextEmitter text;
    private PositionState state;
    private PositionState initialState;

    private final List<Command> initCommands = new ArrayList<>();
    private final List<PendingFormat> pendingFormats = new ArrayList<>();
    private final Set<String> formatNames = new HashSet<>();
    private final Map<String, String> placeholders = new LinkedHashMap<>();
    private final Set<String> calledSubroutines = new LinkedHashSet<>();
    private final Set<String> inlining = new HashSet<>();
    private final Set<String> extraColors = new TreeSet<>();
    private final Set<String> resources = new TreeSet<>();
    private List<Operand> tableWidths = Collections.emptyList();
    private boolean inInit;
    private int loopCounter;
    private String output;

    /**
     * @param overlays nomes dos documentos de sobreposição fornecidos junto ao principal
     */
    public VippGeradorDfa(TranslatorConfig config, SymbolTable global, VippSemantico semantico,
            Diagnostics diagnostics, Set<String> overlays) {
        this.config = config;
        this.global = global;
        this.semantico = semantico;
        this.diagnostics = diagnostics;
        this.availableOverlays = overlays;
        this.document = semantico.getDocument().getName();
        this.defaultFont = DocumentNames.identifier(config.getDefaultFontFamily())
                + String.format(Locale.ROOT, "%02d", Math.round(config.getDefaultFontSize()));
        this.text = new TextEmitter(out, config, global.getFonts().keySet());
        this.state = new PositionState(config, defaultFont);
    }

    public String generate() {
        if (output == null) {
            log.debug("{}: gerando {}", document, semantico.getDocument().getRole());
            output = semantico.getDocument().getRole() == ParsedDocument.Role.MAIN ? generateMain() : generateOverlay();
        }
        return output;
    }

    public String getOutput() {
        return generate();
    }

    /** Imagens e segmentos referenciados, para cópia junto da saída */
    public Set<String> getResources() {
        return Collections.unmodifiableSet(resources);
    }

    // ------------------------------------------------------------------
    // documento principal

    private String generateMain() {
        List<Command> body = new ArrayList<>();
        Command dispatch = null;
        for (Command c : semantico.getDocument().getCommands()) {
            switch (c.getKind()) {
                case DEFINE_FONT:
                case DEFINE_COLOR:
                case SUBROUTINE:
                case PAGE_HOOK:
                case LOAD_FORM:
                case PAGE_DEFINITION:
                case LINK_FRAME:
                case DATA_SEPARATOR:
                case DIRECTIVE:
                    break;
                case SET_FONT:
                case SET_COLOR:
                case SET_UNIT:
                case SET_LINE_SPACING:
                case SET_ORIENTATION:
                    if (body.isEmpty()) {
                        applyStyle(c);
                    } else {
                        body.add(c);
                    }
                    break;
                case CASE:
                    if (dispatch == null) {
                        dispatch = c;
                    } else {
                        body.add(c);
                    }
                    break;
                case IF:
                    if (Command.hasMeaningfulContent(c.getChildren())) {
                        body.add(c);
                    } else {
                        initCommands.add(c);
                    }
                    break;
                default:
                    if (c.getKind().isAssignment()) {
                        initCommands.add(c);
                    } else {
                        body.add(c);
                    }
            }
        }
        applyLayoutOffset();
        initialState = state.copy();

        generateFormatGroup();
        generateTheMain(body, dispatch);

        for (int i = 0; i < pendingFormats.size(); i++) {
            PendingFormat f = pendingFormats.get(i);
            out.blank();
            out.line("DOCFORMAT " + f.name + ";");
            out.indent();
            state = initialState.copy();
            outline("POSITION LEFT NEXT", f.commands);
            out.dedent();
        }

        List<String> subroutines = new ArrayList<>(calledSubroutines);
        for (int i = 0; i < subroutines.size(); i++) {
            generateSubroutineFormat(subroutines.get(i));
            for (String s : calledSubroutines) {
                if (!subroutines.contains(s)) {
                    subroutines.add(s);
                }
            }
        }

        if (!placeholders.isEmpty()) {
            out.blank();
            out.line("/* Stub DOCFORMATs for undefined dispatch values */");
            for (Map.Entry<String, String> p : placeholders.entrySet()) {
                out.line("DOCFORMAT " + p.getKey() + ";");
                out.indent();
                out.line("/* " + p.getValue() + " prefix not found or commented out */");
                out.dedent();
            }
        }

        generateInit();

        DfaWriter head = new DfaWriter();
        header(head);
        definitions(head);
        return head.getOutput() + out.getOutput();
    }

    private void applyLayoutOffset() {
        for (String form : semantico.getLoadedForms()) {
            TranslatorConfig.Offset o = config.layoutOffset(form);
            if (o.getX() != 0 || o.getY() != 0) {
                state.setOrigin(o.getX(), o.getY());
                log.debug("{}: deslocamento de layout {} ({}, {})", document, form, o.getX(), o.getY());
                return;
            }
        }
    }

    private void header(DfaWriter w) {
        w.line("/* Generated from " + document + " (VIPP) */");
        for (Map.Entry<String, String> m : semantico.getDocument().getMetadata().entrySet()) {
            w.line("/* " + m.getKey() + ": " + m.getValue().replace("*/", "* /") + " */");
        }
        w.line("DOCDEF " + document + ";");
        w.blank();
        w.line("APPLICATION-INPUT-FORMAT");
        w.indent();
        w.line("CODE 1252");
        w.line("RECORD-FORMAT VARPC");
        w.line("RECORD-DELIMITER X'0D0A'");
        w.line("RECORD-LENGTH " + config.getRecordLength());
        w.line("CHANNEL-CODE NO");
        w.line("TRC NO;");
        w.dedent();
        w.blank();
        w.line("APPLICATION-OUTPUT-FORMAT");
        w.indent();
        w.line("CODE 1200");
        w.line("OPTIMIZE YES");
        w.line("PDEVICE 'PDF';");
        w.dedent();
    }

    private void definitions(DfaWriter w) {
        w.blank();
        w.line("/* Fonts */");
        for (SymbolTable.FontEntry f : global.getSortedFonts().values()) {
            w.line(fontDefinition(f.getAlias(), config.fontFamily(f.getFamily()), f.getSize()));
        }
        if (!global.containsFont(defaultFont)) {
            w.line(fontDefinition(defaultFont, config.fontFamily(config.getDefaultFontFamily()),
                    config.getDefaultFontSize()));
        }

        Map<String, List<Integer>> colors = new LinkedHashMap<>();
        for (SymbolTable.ColorEntry c : global.getSortedColors().values()) {
            colors.put(c.getAlias(), rgb(c.getValue()));
        }
        for (String name : extraColors) {
            if (!colors.containsKey(name)) {
                colors.put(name, rgb(name));
            }
        }
        if (!colors.isEmpty()) {
            w.blank();
            w.line("/* Colors */");
            for (Map.Entry<String, List<Integer>> c : colors.entrySet()) {
                List<Integer> v = c.getValue();
                w.line("DEFINE " + c.getKey() + " COLOR RGB RVAL " + v.get(0) + " GVAL " + v.get(1)
                        + " BVAL " + v.get(2) + ";");
            }
        }
    }

    private static String fontDefinition(String alias, String family, double size) {
        return "FONT " + alias + " NOTDEF AS " + DfaWriter.quote(family) + " DBCS ROTATION 0 HEIGHT "
                + DfaWriter.number(size) + ";";
    }

    /** "RGB(r,g,b)" ou nome do mapa de cores; desconhecido vira preto */
    private List<Integer> rgb(String value) {
        if (value.startsWith("RGB(") && value.endsWith(")")) {
            String[] parts = value.substring(4, value.length() - 1).split(",");
            List<Integer> v = new ArrayList<>();
            for (String p : parts) {
                v.add(Integer.parseInt(p.trim()));
            }
            return v;
        }
        List<Integer> known = config.color(value);
        if (known == null) {
            diagnostics.add(Diagnostics.Kind.UNSUPPORTED_CONSTRUCT, document, 0,
                    "cor desconhecida " + value + ", definida como preto");
            return List.of(0, 0, 0);
        }
        return known;
    }

    private void generateFormatGroup() {
        out.blank();
        out.line("FORMATGROUP MAIN;");
        out.indent();
        out.line("SHEET");
        out.indent();
        out.line("WIDTH " + DfaWriter.number(config.getPageWidthMm()) + " MM");
        out.line("HEIGHT " + DfaWriter.number(config.getPageHeightMm()) + " MM;");
        out.dedent();
        out.line("LAYER 1;");
        out.line("LOGICALPAGE 1");
        out.indent();
        out.line("SIDE FRONT");
        out.line("POSITION 0 0");
        out.line("WIDTH " + DfaWriter.number(config.getPageWidthMm()) + " MM");
        out.line("HEIGHT " + DfaWriter.number(config.getPageHeightMm()) + " MM");
        out.line("DIRECTION ACROSS");
        out.line("FOOTER");
        out.indent();
        out.line("PP = PP + 1;");
        out.dedent();
        out.line("FOOTEREND");
        out.line("PRINTFOOTER");
        out.indent();
        overlays();
        for (Command hook : semantico.getPageHooks()) {
            out.line("/* BEGINPAGE */");
            state = initialState.copy();
            outline("POSITION (0 MM) (0 MM)", hook.getChildren());
        }
        out.line("P = P + 1;");
        out.dedent();
        out.line("PRINTEND;");
        out.dedent();
        out.dedent();
    }

    /** Formulários desenhados antes dos dados, na ordem de carga */
    private void overlays() {
        List<VippSemantico.PageLayout> layouts = new ArrayList<>();
        for (VippSemantico.PageLayout l : semantico.getPageLayouts()) {
            if (!l.getForms().isEmpty()) {
                layouts.add(l);
            }
        }
        if (layouts.size() >= 2) {
            out.line("/* Overlays: first page and next pages */");
            out.line("IF P<1;");
            out.line("THEN;");
            out.indent();
            useForms(layouts.get(0).getForms());
            out.dedent();
            out.line("ELSE;");
            out.indent();
            useForms(layouts.get(1).getForms());
            out.dedent();
            out.line("ENDIF;");
        } else if (!semantico.getLoadedForms().isEmpty()) {
            out.line("/* Overlays */");
            useForms(semantico.getLoadedForms());
        }
    }

    private void useForms(List<String> forms) {
        for (String form : forms) {
            if (!availableOverlays.contains(form)) {
                log.warn("{}: formulario {} referenciado mas nao fornecido", document, form);
            }
            out.line("USE FORMAT " + form + " EXTERNAL;");
        }
    }

    private void generateTheMain(List<Command> body, Command dispatch) {
        out.blank();
        out.line("DOCFORMAT THEMAIN;");
        out.indent();
        margins();
        Double spacing = initialState.getLineSpacing();
        out.line("SETUNITS LINESP " + (spacing == null ? "AUTO" : DfaWriter.number(spacing) + " MM") + ";");
        for (String form : semantico.getLoadedForms()) {
            TranslatorConfig.Offset o = config.layoutOffset(form);
            if (o.getX() != 0 || o.getY() != 0) {
                out.line("/* Page layout offset for " + form + ": " + DfaWriter.number(o.getX()) + " MM, "
                        + DfaWriter.number(o.getY()) + " MM */");
            }
        }
        for (VippSemantico.PageLayout l : semantico.getPageLayouts()) {
            if (!l.getFrames().isEmpty()) {
                out.line("/* SETLKF frames: " + l.getFrames() + " */");
            }
        }

        if (!body.isEmpty()) {
            state = initialState.copy();
            outline("POSITION LEFT NEXT", body);
        }

        if (dispatch != null) {
            String disc = DocumentNames.variable(dispatch.getParameter(0).getText());
            out.line("FOR N");
            out.indent();
            out.line("REPEAT 1;");
            out.line("RECORD INPUTREC");
            out.indent();
            out.line("REPEAT 1;");
            out.line("VARIABLE LINE1 SCALAR NOSPACE START 1;");
            out.dedent();
            out.line("ENDIO;");
            out.line("N_FLD = EXTRACTALL(FLD, LINE1, &SEP, '');");
            out.line(disc + " = FLD[1];");
            state = initialState.copy();
            emitDispatch(dispatch);
            out.dedent();
            out.line("ENDFOR;");
        }
        out.dedent();
    }

    private void margins() {
        out.line("MARGIN TOP " + DfaWriter.number(config.getMarginTopMm()) + " MM"
                + " BOTTOM " + DfaWriter.number(config.getMarginBottomMm()) + " MM"
                + " LEFT " + DfaWriter.number(config.getMarginLeftMm()) + " MM"
                + " RIGHT " + DfaWriter.number(config.getMarginRightMm()) + " MM;");
    }

    private void outline(String position, List<Command> commands) {
        out.line("OUTLINE");
        out.indent();
        out.line(position);
        out.line("DIRECTION ACROSS;");
        generateCommands(commands);
        out.dedent();
        out.line("ENDIO;");
    }

    private void generateSubroutineFormat(String name) {
        Command sub = semantico.getSymbolTable().getSubroutine(name);
        out.blank();
        out.line("DOCFORMAT " + subroutineFormat(name) + ";");
        out.indent();
        state = initialState.copy();
        state.enterSegment();
        outline("POSITION (POSX) (POSY)", sub.getChildren());
        out.dedent();
    }

    private static String subroutineFormat(String name) {
        return "SUB_" + DocumentNames.identifier(name);
    }

    private void generateInit() {
        out.blank();
        out.line("/* Initialize variables */");
        out.line("DOCFORMAT $_BEFOREFIRSTDOC;");
        out.indent();
        out.line("P = 0;");
        out.line("PP = 0;");
        out.line("/* Correction for Xerox baseline position */");
        out.line("&CORFONT6 = -33;");
        out.line("&CORFONT7 = -37.5;");
        out.line("&CORFONT8 = -43.5;");
        out.line("&CORFONT10 = -55.5;");
        out.line("&CORFONT12 = -66;");
        out.line("&CORSEGMENT = 33;");
        String sep = semantico.getDataSeparator() != null ? semantico.getDataSeparator() : config.getFieldDelimiter();
        out.line("&SEP = " + DfaWriter.quote(sep) + ";");
        declareVariables();
        inInit = true;
        state = initialState.copy();
        generateCommands(initCommands);
        inInit = false;
        out.dedent();
        out.blank();
        out.line("DOCFORMAT $_BEFOREDOC;");
        out.indent();
        out.line("P = 0;");
        out.dedent();
    }

    /** Valor neutro para as variáveis sem atribuição direta na inicialização */
    private void declareVariables() {
        Set<String> assigned = new HashSet<>();
        for (Command c : initCommands) {
            if (c.getKind() == CommandKind.SET_VARIABLE) {
                assigned.add(c.getParameter(0).getText());
            }
        }
        boolean first = true;
        for (SymbolTable.VariableEntry v : semantico.getSymbolTable().getVariables().values()) {
            if (v.isInitOnly() || v.getKind() == SymbolTable.VariableKind.ARRAY || assigned.contains(v.getName())) {
                continue;
            }
            if (first) {
                out.line("/* Variables assigned per record */");
                first = false;
            }
            String neutral = v.getKind() == SymbolTable.VariableKind.STRING ? "''" : "0";
            out.line(DocumentNames.variable(v.getName()) + " = " + neutral + ";");
        }
    }

    // ------------------------------------------------------------------
    // sobreposição

    private String generateOverlay() {
        initialState = state.copy();
        out.line("/* Generated from " + document + " (VIPP form) */");
        out.line("DOCFORMAT " + document + ";");
        out.indent();
        out.line("MARGIN TOP 0 MM BOTTOM 0 MM LEFT 0 MM RIGHT 0 MM;");
        out.line("SETUNITS LINESP AUTO;");
        outline("POSITION (0 MM) (0 MM)", semantico.getDocument().getCommands());
        out.dedent();
        return out.getOutput();
    }

    private boolean isOverlay() {
        return semantico.getDocument().getRole() == ParsedDocument.Role.OVERLAY;
    }

    // ------------------------------------------------------------------
    // comandos

    private void generateCommands(List<Command> commands) {
        for (Command c : commands) {
            generateCommand(c);
        }
    }

    private void generateCommand(Command c) {
        switch (c.getKind()) {
            case SHOW:
                emitShow(c);
                break;
            case SHOW_PARAGRAPH:
                emitParagraph(c);
                break;
            case TABLE_ROW:
                emitRow(c);
                break;
            case MOVE_TO:
                moveTo(c);
                break;
            case MOVE_H: {
                Operand x = c.getParameter(0);
                if (x.is(Operand.Kind.NUMBER)) {
                    state.moveHorizontal(x.asNumber());
                } else {
                    state.moveHorizontalExpression(DfaExpressions.value(x));
                }
                break;
            }
            case NEW_LINE:
                emitNewLine(c.getOption("spacing"), c.getLine());
                break;
            case SET_LINE_SPACING:
            case SET_UNIT:
            case SET_ORIENTATION:
            case SET_FONT:
            case SET_COLOR:
                applyStyle(c);
                break;
            case SET_VARIABLE:
                if (c.getOption("ini") != null && !inInit && !isOverlay()) {
                    initCommands.add(c);
                } else {
                    emitAssignment(c);
                }
                break;
            case INCREMENT:
            case DECREMENT:
                emitAssignment(c);
                break;
            case DRAW_BOX:
                emitBox(c);
                break;
            case CALL_SEGMENT:
                emitSegmentCall(c);
                break;
            case CALL_IMAGE:
                emitImage(c);
                break;
            case LOAD_FORM:
                out.line("/* SETFORM " + VippSemantico.formName(c.getParameter(0)) + ": drawn by PRINTFOOTER */");
                break;
            case PAGE_DEFINITION:
                out.line("/* SETPAGEDEF with " + c.getChildren().size() + " page layout(s) */");
                break;
            case LINK_FRAME:
                out.line("/* SETLKF frames: " + c.getParameter(0) + " */");
                break;
            case PAGE_BREAK:
                out.line("USE LOGICALPAGE NEXT; /* " + c.getName() + " */");
                state.forgetPosition();
                break;
            case BOOKMARK:
                out.line("BOOKMARK " + DfaExpressions.value(c.getParameter(0)) + " LEVEL 1;");
                break;
            case IF:
                emitIf(c);
                break;
            case CASE:
                if (isOverlay()) {
                    emitInlineSelect(c);
                } else {
                    emitDispatch(c);
                }
                break;
            case FORM:
                generateCommands(c.getChildren());
                break;
            case REPEAT:
                emitRepeat(c);
                break;
            case TABLE:
                emitTable(c);
                break;
            case UNSUPPORTED:
                out.line("/* VIPP command not directly supported: " + c.getName() + " */");
                diagnostics.add(Diagnostics.Kind.UNSUPPORTED_CONSTRUCT, document, c.getLine(),
                        c.getName() + " sem traducao direta");
                break;
            default:
                // definições, sub-rotinas e diretivas já tratadas pela análise
                break;
        }
    }

    private void applyStyle(Command c) {
        Operand p = c.getParameters().isEmpty() ? null : c.getParameter(0);
        switch (c.getKind()) {
            case SET_FONT:
                state.setFont(p.getText());
                break;
            case SET_COLOR: {
                String color = p.getText();
                if (!global.containsColor(color)) {
                    color = color.toUpperCase(Locale.ROOT);
                    extraColors.add(color);
                }
                state.setColor(color);
                break;
            }
            case SET_UNIT:
                try {
                    state.setUnits(PositionState.Unit.parse(p.getText()));
                } catch (IllegalArgumentException e) {
                    diagnostics.add(Diagnostics.Kind.UNSUPPORTED_CONSTRUCT, document, c.getLine(), e.getMessage());
                }
                break;
            case SET_LINE_SPACING:
                if (p.is(Operand.Kind.NUMBER)) {
                    double mm = state.toMm(p.asNumber());
                    state.setLineSpacing(mm);
                    if (initialState != null) {
                        out.line("SETUNITS LINESP " + DfaWriter.number(mm) + " MM;");
                    }
                }
                break;
            case SET_ORIENTATION:
                if ("ORITL".equals(c.getName())) {
                    state.setAxis(PositionState.Axis.TOP_DOWN);
                } else if (initialState != null) {
                    out.line("/* Orientation " + c.getName() + " */");
                }
                break;
            default:
                break;
        }
    }

    private void moveTo(Command c) {
        Operand x = c.getParameter(0);
        Operand y = c.getParameter(1);
        if (x.is(Operand.Kind.NUMBER) && y.is(Operand.Kind.NUMBER)) {
            state.moveTo(x.asNumber(), y.asNumber());
        } else {
            state.moveToExpression(DfaExpressions.value(x), DfaExpressions.value(y));
        }
    }

    // ------------------------------------------------------------------
    // posições

    private String position(boolean text, int line) {
        String x = state.isXExplicit() ? xCoordinate(line) : "SAME";
        String y = state.isYExplicit() ? yCoordinate(text, line) : "SAME";
        return "POSITION (" + x + ") (" + y + ")";
    }

    private String xCoordinate(int line) {
        if (state.getXExpression() != null) {
            String mm = symbolicMm(state.getXExpression(), false);
            return state.inSegment() ? anchor("POSX") + "+" + mm : mm + "-$MR_LEFT";
        }
        return xCoordinate(state.getX(), line);
    }

    private String xCoordinate(double mm, int line) {
        if (state.inSegment()) {
            return anchor("POSX") + signed(mm) + " MM";
        }
        return DfaWriter.number(checked(mm, line, "x")) + " MM-$MR_LEFT";
    }

    private String yCoordinate(boolean text, int line) {
        if (state.getYExpression() != null) {
            String mm = symbolicMm(state.getYExpression(), true);
            return state.inSegment() ? anchor("POSY") + "+" + mm : mm + "-$MR_TOP";
        }
        String y = yCoordinate(state.getY(), line);
        if (text && !state.inSegment()) {
            y += "+&CORFONT" + corfont(fontSize());
        }
        return y;
    }

    private String yCoordinate(double mm, int line) {
        if (state.inSegment()) {
            return anchor("POSY") + signed(mm) + " MM";
        }
        return DfaWriter.number(checked(mm, line, "y")) + " MM-$MR_TOP";
    }

    /** Coordenada em variável: convertida em tempo de execução por MM() */
    private String symbolicMm(String expression, boolean vertical) {
        double factor = state.toMm(1);
        String value = factor == 1 ? expression : expression + "*" + DfaWriter.number(factor);
        if (vertical && !state.inSegment() && state.getAxis() == PositionState.Axis.BOTTOM_UP) {
            value = DfaWriter.number(config.getPageHeightMm()) + "-(" + value + ")";
        }
        return "MM(" + value + ")";
    }

    private String anchor(String base) {
        int depth = state.getSegmentDepth();
        return depth > 1 ? base + depth : base;
    }

    private static String signed(double mm) {
        return mm < 0 ? "-" + DfaWriter.number(-mm) : "+" + DfaWriter.number(mm);
    }

    /** Coordenadas absolutas negativas são trazidas para 0 e registradas */
    private double checked(double mm, int line, String axis) {
        if (Double.isNaN(mm)) {
            throw new GenerationInvariantException("coordenada " + axis + " indefinida na linha " + line);
        }
        if (mm < 0) {
            diagnostics.add(Diagnostics.Kind.CLAMPED_COORDINATE, document, line,
                    String.format(Locale.ROOT, "coordenada %s negativa (%s MM) ajustada para 0", axis,
                            DfaWriter.number(mm)));
            return 0;
        }
        return mm;
    }

    private double fontSize() {
        SymbolTable.FontEntry f = global.getFont(state.getFont());
        return f != null ? f.getSize() : config.getDefaultFontSize();
    }

    static int corfont(double size) {
        if (size <= 6.5) {
            return 6;
        } else if (size <= 7.5) {
            return 7;
        } else if (size <= 9) {
            return 8;
        } else if (size <= 11) {
            return 10;
        }
        return 12;
    }

    private double availableWidth() {
        double start = state.isXExplicit() && state.getXExpression() == null ? state.getX() : config.getMarginLeftMm();
        return config.getPageWidthMm() - config.getMarginRightMm() - Math.max(start, 0);
    }

    // ------------------------------------------------------------------
    // texto

    private void emitShow(Command c) {
        TextEmitter.Align align;
        switch (c.getName()) {
            case "SHR":
            case "SHr":
                align = TextEmitter.Align.RIGHT;
                break;
            case "SHC":
                align = TextEmitter.Align.CENTER;
                break;
            case "SHJ":
                align = TextEmitter.Align.JUSTIFY;
                break;
            default:
                align = TextEmitter.Align.LEFT;
        }
        emitText(content(c.getParameter(0)), align, null, c.getLine());
    }

    private void emitParagraph(Command c) {
        Operand width = c.getParameter(1);
        Operand code = c.getParameter(2);
        TextEmitter.Align align = TextEmitter.Align.LEFT;
        if (code.is(Operand.Kind.NUMBER)) {
            switch ((int) code.asNumber()) {
                case 1:
                    align = TextEmitter.Align.RIGHT;
                    break;
                case 2:
                    align = TextEmitter.Align.CENTER;
                    break;
                case 3:
                    align = TextEmitter.Align.JUSTIFY;
                    break;
                default:
                    break;
            }
        }
        Double widthMm = width.is(Operand.Kind.NUMBER) ? state.toMm(width.asNumber()) : null;
        emitText(content(c.getParameter(0)), align, widthMm, c.getLine());
    }

    private void emitText(TextEmitter.Content content, TextEmitter.Align align, Double widthMm, int line) {
        String font = state.getFont() != null ? state.getFont() : defaultFont;
        text.emit(content, align, font, state.getColor(), position(true, line), widthMm, availableWidth());
        state.afterOutput();
    }

    private static TextEmitter.Content content(Operand op) {
        switch (op.getKind()) {
            case STRING:
            case NUMBER:
                return TextEmitter.Content.literal(op.getText(), false);
            case EXPRESSION:
                if (op.isExpression("VSUB") && op.getElements().get(0).is(Operand.Kind.STRING)) {
                    return TextEmitter.Content.literal(op.getElements().get(0).getText(), true);
                }
                return TextEmitter.Content.expression(DfaExpressions.value(op), 0);
            default:
                return TextEmitter.Content.expression(DfaExpressions.value(op), 0);
        }
    }

    private void emitNewLine(Operand spacing, int line) {
        String y;
        if (spacing == null) {
            y = "NEXT";
            state.newLine(null);
        } else {
            double mm = state.toMm(spacing.asNumber());
            y = "SAME" + signed(mm) + " MM";
            state.newLine(spacing.asNumber());
        }
        if (!state.inSegment() && state.getY() < 0) {
            checked(state.getY(), line, "y");
            state.setY(0);
        }
        String font = state.getFont() != null ? state.getFont() : defaultFont;
        out.line("OUTPUT ''");
        out.indent();
        out.line("FONT " + font + " NORMAL");
        out.line("POSITION (SAME) (" + y + ");");
        out.dedent();
    }

    private void emitTable(Command c) {
        List<Operand> previous = tableWidths;
        Operand widths = c.getOption("widths");
        tableWidths = widths != null ? widths.getElements() : Collections.emptyList();
        generateCommands(c.getChildren());
        tableWidths = previous;
    }

    /** Cada célula ocupa a largura declarada, em caracteres médios da fonte ativa */
    private void emitRow(Command c) {
        Operand row = c.getParameter(0);
        List<Operand> cells = row.is(Operand.Kind.ARRAY) ? row.getElements() : List.of(row);
        if (cells.size() == 1 && cells.get(0).is(Operand.Kind.ARRAY)) {
            cells = cells.get(0).getElements();
        }
        double charMm = fontSize() * config.getAverageCharWidthRatio() * 0.352778;
        List<String> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        boolean allLiteral = true;
        int visible = 0;
        for (int i = 0; i < cells.size(); i++) {
            Operand cell = cells.get(i);
            Integer chars = null;
            if (i < tableWidths.size() && tableWidths.get(i).is(Operand.Kind.NUMBER)) {
                chars = (int) Math.max(1, Math.round(state.toMm(tableWidths.get(i).asNumber()) / charMm));
            }
            if (cell.is(Operand.Kind.STRING) || cell.is(Operand.Kind.NUMBER)) {
                String s = chars != null ? pad(cell.getText(), chars) : cell.getText() + " ";
                literal.append(s);
                visible += s.length();
            } else {
                allLiteral = false;
                if (literal.length() > 0) {
                    parts.add(DfaWriter.quote(literal.toString()));
                    literal.setLength(0);
                }
                String v = DfaExpressions.value(cell);
                if (chars != null) {
                    parts.add("LEFT(" + v + ", " + chars + ", ' ')");
                    visible += chars;
                } else {
                    parts.add(v);
                }
            }
        }
        TextEmitter.Content content;
        if (allLiteral) {
            content = TextEmitter.Content.literal(literal.toString(), false);
        } else {
            if (literal.length() > 0) {
                parts.add(DfaWriter.quote(literal.toString()));
            }
            content = TextEmitter.Content.expression(String.join(" ! ", parts), visible);
        }
        emitText(content, TextEmitter.Align.LEFT, null, c.getLine());
        emitNewLine(null, c.getLine());
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) {
            return s.substring(0, width);
        }
        StringBuilder sb = new StringBuilder(s);
        while (sb.length() < width) {
            sb.append(' ');
        }
        return sb.toString();
    }

    // ------------------------------------------------------------------
    // atribuições

    private void emitAssignment(Command c) {
        String name = DocumentNames.variable(c.getParameter(0).getText());
        switch (c.getKind()) {
            case INCREMENT:
                out.line(name + " = " + name + "+1;");
                break;
            case DECREMENT:
                out.line(name + " = " + name + "-1;");
                break;
            default: {
                Operand value = c.getParameter(1);
                if (value.is(Operand.Kind.ARRAY)) {
                    List<Operand> e = value.getElements();
                    for (int i = 0; i < e.size(); i++) {
                        out.line(name + "[" + (i + 1) + "] = " + DfaExpressions.value(e.get(i)) + ";");
                    }
                } else {
                    out.line(name + " = " + DfaExpressions.value(value) + ";");
                }
            }
        }
    }

    // ------------------------------------------------------------------
    // desenho

    private void emitBox(Command c) {
        Operand px = c.getParameter(0);
        Operand py = c.getParameter(1);
        Operand pw = c.getParameter(2);
        Operand ph = c.getParameter(3);
        Operand ps = c.getParameter(4);
        BoxStyle style = BoxStyle.parse(ps.isSymbol() || ps.is(Operand.Kind.STRING) ? ps.getText() : null);
        String color = style.getColor();
        if (color != null && !global.containsColor(color)) {
            extraColors.add(color);
        }
        if (!(px.is(Operand.Kind.NUMBER) && py.is(Operand.Kind.NUMBER)
                && pw.is(Operand.Kind.NUMBER) && ph.is(Operand.Kind.NUMBER))) {
            symbolicBox(px, py, pw, ph, style);
            return;
        }
        double w = state.toMm(pw.asNumber());
        double h = state.toMm(Math.abs(ph.asNumber()));
        double x = state.mapX(px.asNumber());
        double y = state.mapY(py.asNumber());
        if (w < 0) {
            x += w;
            w = -w;
        }
        String position = "POSITION (" + xCoordinate(x, c.getLine()) + ") (" + yCoordinate(y, c.getLine()) + ")";

        if (Math.min(w, h) <= config.getRuleThresholdMm()) {
            boolean across = w >= h;
            out.line("RULE");
            out.indent();
            out.line(position);
            out.line("DIRECTION " + (across ? "ACROSS" : "DOWN"));
            out.line("LENGTH " + DfaWriter.number(Math.max(Math.max(w, h), config.getMinStrokeMm())) + " MM");
            out.line("THICKNESS " + DfaWriter.number(Math.max(Math.min(w, h), config.getMinStrokeMm())) + " MM");
            out.line("TYPE " + style.getLineType() + (color == null ? ";" : ""));
            if (color != null) {
                out.line("COLOR " + color + ";");
            }
            out.dedent();
            return;
        }
        out.line("BOX");
        out.indent();
        out.line(position);
        out.line("WIDTH " + DfaWriter.number(Math.max(w, config.getMinBoxMm())) + " MM");
        out.line("HEIGHT " + DfaWriter.number(Math.max(h, config.getMinBoxMm())) + " MM");
        boxStroke(style, color);
        out.dedent();
    }

    private void boxStroke(BoxStyle style, String color) {
        if (color != null) {
            out.line("COLOR " + color);
        }
        if (style.isFilled()) {
            out.line("THICKNESS 0 TYPE SOLID");
            out.line("SHADE " + style.getShade() + ";");
        } else {
            out.line("THICKNESS " + DfaWriter.number(Math.max(style.getThicknessMm(), config.getMinStrokeMm()))
                    + " MM TYPE " + style.getLineType() + ";");
        }
    }

    /** Caixa com dimensões em variáveis: sem decisão régua/caixa possível */
    private void symbolicBox(Operand px, Operand py, Operand pw, Operand ph, BoxStyle style) {
        PositionState saved = state.copy();
        state.moveToExpression(DfaExpressions.value(px), DfaExpressions.value(py));
        String position = "POSITION (" + xCoordinate(px.getLine()) + ") (" + yCoordinate(false, py.getLine()) + ")";
        state.restore(saved);
        out.line("BOX");
        out.indent();
        out.line(position);
        out.line("WIDTH " + symbolicMm(DfaExpressions.value(pw), false));
        out.line("HEIGHT " + symbolicMm(DfaExpressions.value(ph), false));
        boxStroke(style, style.getColor());
        out.dedent();
    }

    // ------------------------------------------------------------------
    // segmentos, sub-rotinas e imagens

    private void emitSegmentCall(Command c) {
        String raw = c.getParameter(0).getText();
        Command sub = semantico.getSymbolTable().getSubroutine(raw);
        if (sub == null) {
            emitResource(c, raw, false);
            return;
        }
        int size = sub.getChildren().size();
        boolean inline = isOverlay() || size <= config.getInlineMaxCommands();
        if (inlining.contains(raw)) {
            if (isOverlay()) {
                out.line("/* Recursive subroutine call not expanded: " + raw + " */");
                diagnostics.add(Diagnostics.Kind.UNSUPPORTED_CONSTRUCT, document, c.getLine(),
                        "chamada recursiva de " + raw + " nao expandida");
                return;
            }
            inline = false;
        }
        PositionState saved = state.copy();
        if (inline) {
            out.line("/* Inlined subroutine: " + raw + " (" + size + " commands) */");
            anchors(state.getSegmentDepth() + 1, c.getLine());
            state.enterSegment();
            inlining.add(raw);
            generateCommands(sub.getChildren());
            inlining.remove(raw);
        } else {
            anchors(1, c.getLine());
            out.line("USE FORMAT " + subroutineFormat(raw) + ";");
            calledSubroutines.add(raw);
        }
        state.restore(saved);
    }

    /** POSX/POSY guardam a origem do segmento chamado */
    private void anchors(int depth, int line) {
        String suffix = depth > 1 ? String.valueOf(depth) : "";
        String y;
        String x;
        if (state.isYExplicit()) {
            y = state.getYExpression() != null ? symbolicMm(state.getYExpression(), true) + "-$MR_TOP"
                    : "MM(" + DfaWriter.number(state.inSegment() ? state.getY() : checked(state.getY(), line, "y"))
                            + ")" + (state.inSegment() ? "+" + anchor("POSY") : "-$MR_TOP");
        } else {
            y = "$SL_CURRY";
        }
        if (state.isXExplicit()) {
            x = state.getXExpression() != null ? symbolicMm(state.getXExpression(), false) + "-$MR_LEFT"
                    : "MM(" + DfaWriter.number(state.inSegment() ? state.getX() : checked(state.getX(), line, "x"))
                            + ")" + (state.inSegment() ? "+" + anchor("POSX") : "-$MR_LEFT");
        } else {
            x = "$SL_CURRX";
        }
        out.line("POSY" + suffix + " = " + y + ";");
        out.line("POSX" + suffix + " = " + x + ";");
    }

    private void emitImage(Command c) {
        emitResource(c, c.getParameter(0).getText(), true);
    }

    private void emitResource(Command c, String raw, boolean image) {
        resources.add(raw);
        String name = DocumentNames.baseName(raw);
        String position = position(false, c.getLine());
        Operand scale = c.getOption("scale");
        if (image) {
            out.line("IMAGE " + name);
            out.indent();
            out.line(position + (scale == null ? ";" : ""));
            if (scale != null) {
                out.line("SCALE " + DfaWriter.number(scale.asNumber()) + ";");
            }
            out.dedent();
        } else if (RASTER.contains(DocumentNames.extension(raw))) {
            out.line("CREATEOBJECT IOBDLL(IOBDEFS)");
            out.indent();
            out.line(position);
            out.line("PARAMETERS");
            out.indent();
            out.line("('FILENAME'=" + DfaWriter.quote(name) + ")");
            out.line("('OBJECTTYPE'='1')");
            out.line("('OTHERTYPES'=" + DfaWriter.quote(DocumentNames.extension(raw).toUpperCase(Locale.ROOT)) + ")");
            out.line("('XOBJECTAREASIZE'='0')");
            out.line("('YOBJECTAREASIZE'='0');");
            out.dedent();
            out.dedent();
        } else {
            out.line("SEGMENT " + name);
            out.indent();
            out.line(position + ";");
            out.dedent();
        }
    }

    // ------------------------------------------------------------------
    // controle de fluxo

    private void emitIf(Command c) {
        Command thenBranch = c.child(CommandKind.THEN_BRANCH);
        Command elseBranch = c.child(CommandKind.ELSE_BRANCH);
        out.line("IF " + DfaExpressions.condition(c.getParameter(0)) + ";");
        out.line("THEN;");
        PositionState saved = state.copy();
        out.indent();
        generateCommands(thenBranch.getChildren());
        out.dedent();
        PositionState afterThen = state.copy();
        state.restore(saved);
        if (elseBranch != null) {
            out.line("ELSE;");
            out.indent();
            generateCommands(elseBranch.getChildren());
            out.dedent();
        }
        out.line("ENDIF;");
        if (!state.samePlacement(afterThen)) {
            state.forgetPosition();
        }
    }

    private void emitRepeat(Command c) {
        String counter = "I" + (++loopCounter);
        out.line("FOR " + counter);
        out.indent();
        out.line("REPEAT " + DfaExpressions.value(c.getParameter(0)) + ";");
        PositionState saved = state.copy();
        generateCommands(c.getChildren());
        if (!state.samePlacement(saved)) {
            state.forgetPosition();
        }
        out.dedent();
        out.line("ENDFOR;");
    }

    /**
     * Despacho por valor do discriminante. Entradas com conteúdo viram
     * DOCFORMAT próprios; entradas só com atribuições vão para a
     * inicialização; valores comparados sem entrada recebem um DOCFORMAT vazio.
     */
    private void emitDispatch(Command c) {
        String discRaw = c.getParameter(0).getText();
        String disc = DocumentNames.variable(discRaw);
        Map<String, String> arms = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();
        String otherwise = null;

        for (Command entry : c.getChildren()) {
            if (entry.getKind() == CommandKind.CASE_DEFAULT) {
                if (Command.hasMeaningfulContent(entry.getChildren())) {
                    otherwise = queueFormat("DF_DEFAULT", entry.getChildren());
                } else {
                    hoist(entry, "bloco padrao");
                }
                continue;
            }
            String value = entry.getParameter(0).getText();
            seen.add(value);
            if (Command.hasMeaningfulContent(entry.getChildren())) {
                arms.put(value, queueFormat(formatName(value), entry.getChildren()));
            } else if (entry.getChildren().isEmpty()) {
                arms.put(value, placeholder(value, entry.getLine()));
            } else {
                hoist(entry, "entrada " + value);
            }
        }
        for (String value : semantico.getDispatchReferences(discRaw)) {
            if (!seen.contains(value)) {
                arms.put(value, placeholder(value, c.getLine()));
            }
        }

        out.line("SELECT " + disc + ";");
        out.indent();
        for (Map.Entry<String, String> arm : arms.entrySet()) {
            out.line("CASE " + DfaWriter.quote(arm.getKey()) + ";");
            out.indent();
            out.line("USE FORMAT " + arm.getValue() + ";");
            out.dedent();
        }
        if (otherwise != null) {
            out.line("OTHERWISE;");
            out.indent();
            out.line("USE FORMAT " + otherwise + ";");
            out.dedent();
        }
        out.dedent();
        out.line("ENDSELECT;");
    }

    private void hoist(Command entry, String what) {
        initCommands.addAll(entry.getChildren());
        diagnostics.add(Diagnostics.Kind.HOISTED_BLOCK, document, entry.getLine(),
                what + " so com atribuicoes movida para $_BEFOREFIRSTDOC");
    }

    private String formatName(String value) {
        return "DF_" + (value.isEmpty() ? "EMPTY" : DocumentNames.identifier(value));
    }

    private String unique(String base) {
        String name = base;
        int n = 1;
        while (formatNames.contains(name)) {
            name = base + "_" + (++n);
        }
        formatNames.add(name);
        return name;
    }

    private String queueFormat(String base, List<Command> commands) {
        String name = unique(base);
        pendingFormats.add(new PendingFormat(name, commands));
        return name;
    }

    private String placeholder(String value, int line) {
        String name = unique(formatName(value));
        placeholders.put(name, value);
        diagnostics.add(Diagnostics.Kind.PLACEHOLDER, document, line,
                "valor de despacho '" + value + "' sem bloco, gerado " + name + " vazio");
        return name;
    }

    /** Em sobreposições o despacho fica no próprio DOCFORMAT */
    private void emitInlineSelect(Command c) {
        out.line("SELECT " + DocumentNames.variable(c.getParameter(0).getText()) + ";");
        out.indent();
        Command otherwise = null;
        for (Command entry : c.getChildren()) {
            if (entry.getKind() == CommandKind.CASE_DEFAULT) {
                otherwise = entry;
                continue;
            }
            out.line("CASE " + DfaWriter.quote(entry.getParameter(0).getText()) + ";");
            selectArm(entry);
        }
        if (otherwise != null) {
            out.line("OTHERWISE;");
            selectArm(otherwise);
        }
        out.dedent();
        out.line("ENDSELECT;");
    }

    private void selectArm(Command entry) {
        PositionState saved = state.copy();
        out.indent();
        generateCommands(entry.getChildren());
        out.dedent();
        if (!state.samePlacement(saved)) {
            state.restore(saved);
            state.forgetPosition();
        }
    }
}
