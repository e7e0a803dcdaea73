package br.ufscar.dc.vippdfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Percorre a árvore de um documento e monta a tabela de símbolos, os pontos
 * de carga de formulários, os ganchos de página e os valores de despacho
 * referenciados em comparações.
 */
public class VippSemantico {

    private static final Logger log = LoggerFactory.getLogger(VippSemantico.class);

    /** Layout de página declarado por SETPAGEDEF ou por SETFORM solto */
    public static class PageLayout {
        private final List<String> forms = new ArrayList<>();
        private final List<Operand> frames = new ArrayList<>();

        public List<String> getForms() {
            return forms;
        }

        public List<Operand> getFrames() {
            return frames;
        }
    }

    private final ParsedDocument document;
    private final SymbolTable symbolTable = new SymbolTable();
    private final List<PageLayout> pageLayouts = new ArrayList<>();
    private final List<String> loadedForms = new ArrayList<>();
    private final List<Command> pageHooks = new ArrayList<>();
    private final Map<String, Set<String>> dispatchReferences = new LinkedHashMap<>();
    private String dataSeparator;

    public VippSemantico(ParsedDocument document) {
        this.document = document;
    }

    public VippSemantico analyze() throws ParseException {
        visit(document.getCommands(), null);
        log.debug("{}: {} fontes, {} cores, {} variaveis, {} sub-rotinas", document.getName(),
                symbolTable.getFonts().size(), symbolTable.getColors().size(),
                symbolTable.getVariables().size(), symbolTable.getSubroutines().size());
        return this;
    }

    private void visit(List<Command> commands, PageLayout layout) throws ParseException {
        for (Command c : commands) {
            switch (c.getKind()) {
                case DEFINE_FONT:
                    symbolTable.addFont(fontEntry(c));
                    break;
                case DEFINE_COLOR:
                    symbolTable.addColor(new SymbolTable.ColorEntry(c.getParameter(0).getText(),
                            colorValue(c.getParameter(1))));
                    break;
                case SET_VARIABLE:
                    symbolTable.addVariable(new SymbolTable.VariableEntry(c.getParameter(0).getText(),
                            kindOf(c.getParameter(1)), c.getOption("ini") != null));
                    collectReferences(c.getParameter(1));
                    break;
                case INCREMENT:
                case DECREMENT:
                    symbolTable.addVariable(new SymbolTable.VariableEntry(c.getParameter(0).getText(),
                            SymbolTable.VariableKind.SCALAR, false));
                    break;
                case SUBROUTINE:
                    symbolTable.addSubroutine(c.getParameter(0).getText(), c);
                    break;
                case PAGE_HOOK:
                    pageHooks.add(c);
                    break;
                case LOAD_FORM: {
                    String form = formName(c.getParameter(0));
                    if (!loadedForms.contains(form)) {
                        loadedForms.add(form);
                    }
                    if (layout != null) {
                        layout.getForms().add(form);
                    }
                    break;
                }
                case LINK_FRAME:
                    if (layout != null) {
                        layout.getFrames().add(c.getParameter(0));
                    }
                    break;
                case PAGE_LAYOUT: {
                    PageLayout nested = new PageLayout();
                    pageLayouts.add(nested);
                    visit(c.getChildren(), nested);
                    continue;
                }
                case DATA_SEPARATOR:
                    dataSeparator = c.getParameter(0).getText();
                    break;
                case IF:
                    collectReferences(c.getParameter(0));
                    break;
                default:
                    break;
            }
            visit(c.getChildren(), layout);
        }
    }

    private SymbolTable.FontEntry fontEntry(Command c) throws ParseException {
        Operand size = c.getParameter(2);
        if (!size.is(Operand.Kind.NUMBER)) {
            throw new ParseException(c.getLine(), "INDEXFONT espera tamanho numerico, encontrado " + size);
        }
        return new SymbolTable.FontEntry(c.getParameter(0).getText(),
                c.getParameter(1).getText().toUpperCase(Locale.ROOT), size.asNumber());
    }

    /** Nome da cor ou RGB(r,g,b) em percentuais a partir de [r g b] entre 0 e 1 */
    static String colorValue(Operand op) throws ParseException {
        if (op.is(Operand.Kind.ARRAY)) {
            List<Operand> e = op.getElements();
            if (e.size() != 3) {
                throw new ParseException(op.getLine(), "cor RGB espera 3 componentes, encontrado " + op);
            }
            StringBuilder sb = new StringBuilder("RGB(");
            for (int i = 0; i < 3; i++) {
                if (!e.get(i).is(Operand.Kind.NUMBER)) {
                    throw new ParseException(op.getLine(), "componente de cor nao numerico: " + e.get(i));
                }
                sb.append(i > 0 ? "," : "").append(Math.round(e.get(i).asNumber() * 100));
            }
            return sb.append(')').toString();
        }
        return op.getText().toUpperCase(Locale.ROOT);
    }

    static SymbolTable.VariableKind kindOf(Operand value) {
        switch (value.getKind()) {
            case STRING:
                return SymbolTable.VariableKind.STRING;
            case ARRAY:
                return SymbolTable.VariableKind.ARRAY;
            case EXPRESSION:
                return value.isExpression("GETINTV") || value.isExpression("VSUB")
                        ? SymbolTable.VariableKind.STRING : SymbolTable.VariableKind.SCALAR;
            default:
                return SymbolTable.VariableKind.SCALAR;
        }
    }

    /** Nome do formulário sem extensão, em maiúsculas */
    public static String formName(Operand op) {
        return DocumentNames.baseName(op.getText());
    }

    /** Registra "DISCRIMINANTE (valor) eq" e "ne" para o despacho */
    private void collectReferences(Operand op) {
        if (!op.is(Operand.Kind.EXPRESSION)) {
            return;
        }
        if ((op.isExpression("eq") || op.isExpression("ne")) && op.getElements().size() == 2) {
            Operand a = op.getElements().get(0);
            Operand b = op.getElements().get(1);
            if (a.is(Operand.Kind.IDENTIFIER) && b.is(Operand.Kind.STRING)) {
                reference(a.getText(), b.getText());
            } else if (b.is(Operand.Kind.IDENTIFIER) && a.is(Operand.Kind.STRING)) {
                reference(b.getText(), a.getText());
            }
        }
        for (Operand e : op.getElements()) {
            collectReferences(e);
        }
    }

    private void reference(String discriminant, String value) {
        dispatchReferences.computeIfAbsent(discriminant, k -> new LinkedHashSet<>()).add(value);
    }

    public ParsedDocument getDocument() {
        return document;
    }

    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    public List<PageLayout> getPageLayouts() {
        return Collections.unmodifiableList(pageLayouts);
    }

    /** Formulários na ordem da primeira carga */
    public List<String> getLoadedForms() {
        return Collections.unmodifiableList(loadedForms);
    }

    public List<Command> getPageHooks() {
        return Collections.unmodifiableList(pageHooks);
    }

    public Set<String> getDispatchReferences(String discriminant) {
        return dispatchReferences.getOrDefault(discriminant, Collections.emptySet());
    }

    public String getDataSeparator() {
        return dataSeparator;
    }
}
