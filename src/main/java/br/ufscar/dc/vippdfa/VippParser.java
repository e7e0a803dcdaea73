package br.ufscar.dc.vippdfa;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.ufscar.dc.vippdfa.CommandRegistry.CommandSpec;

/**
 * Parser estrutural: empilha operandos até encontrar uma palavra-chave e
 * então desempilha exatamente a aridade dela. Blocos entre chaves são
 * analisados por escopo; construções planas (IF/ELSE/ENDIF sem chaves,
 * BEGINTABLE/ENDTABLE) usam uma pilha explícita de quadros por escopo.
 */
public class VippParser {

    private static final Logger log = LoggerFactory.getLogger(VippParser.class);

    private final String documentName;
    private final Diagnostics diagnostics;
    private final Set<String> fontAliases = new HashSet<>();
    private final Set<String> colorAliases = new HashSet<>();
    private final Map<String, String> metadata = new LinkedHashMap<>();

    /** Construção plana aberta no escopo corrente */
    private static final class FlatFrame {
        final Command command;
        final int line;
        List<Command> target;
        boolean inElse;

        FlatFrame(Command command, List<Command> target) {
            this.command = command;
            this.line = command.getLine();
            this.target = target;
        }

        boolean isIf() {
            return command.getKind() == CommandKind.IF;
        }
    }

    /** Estado de um escopo (documento ou corpo entre chaves) */
    private final class Scope {
        final List<VippToken> toks;
        final List<Command> result = new ArrayList<>();
        final OperandBuffer buffer = new OperandBuffer();
        final Deque<FlatFrame> frames = new ArrayDeque<>();

        Scope(List<VippToken> toks) {
            this.toks = toks;
        }

        List<Command> target() {
            return frames.isEmpty() ? result : frames.peek().target;
        }

        void append(Command c) {
            target().add(c);
        }

        int pendingIfDepth() {
            int depth = 0;
            for (FlatFrame f : frames) {
                if (f.isIf()) {
                    depth++;
                }
            }
            return depth;
        }

        void drainResidue(int line) {
            List<Operand> residue = buffer.drain();
            if (!residue.isEmpty()) {
                diagnostics.add(Diagnostics.Kind.UNUSED_OPERANDS, documentName, line,
                        "operandos sem uso: " + residue);
            }
        }
    }

    public VippParser(String documentName, Diagnostics diagnostics) {
        this(documentName, diagnostics, Collections.emptySet(), Collections.emptySet());
    }

    /**
     * @param knownFonts aliases de fonte válidos sem INDEXFONT no próprio arquivo
     *                   (as do documento principal, para as sobreposições)
     * @param knownColors cores predefinidas e as do documento principal
     */
    public VippParser(String documentName, Diagnostics diagnostics, Set<String> knownFonts, Set<String> knownColors) {
        this.documentName = documentName;
        this.diagnostics = diagnostics;
        this.fontAliases.addAll(knownFonts);
        this.colorAliases.addAll(knownColors);
    }

    public ParsedDocument parse(List<VippToken> tokens, ParsedDocument.Role role) throws ParseException {
        List<VippToken> significant = new ArrayList<>(tokens.size());
        for (VippToken t : tokens) {
            if (t.getKind() == TokenKind.COMMENT) {
                readMetadata(t.getText());
            } else {
                significant.add(t);
            }
        }
        List<Command> commands = parseSequence(significant);
        log.debug("{}: {} comandos de nivel superior", documentName, commands.size());
        return new ParsedDocument(documentName, role, commands, metadata);
    }

    private void readMetadata(String comment) {
        if (!comment.startsWith("%%")) {
            return;
        }
        int colon = comment.indexOf(':');
        if (colon > 2) {
            String key = comment.substring(2, colon).trim();
            if (!key.isEmpty() && !metadata.containsKey(key)) {
                metadata.put(key, comment.substring(colon + 1).trim());
            }
        }
    }

    List<Command> parseSequence(List<VippToken> toks) throws ParseException {
        Scope scope = new Scope(toks);
        int i = 0;
        while (i < toks.size()) {
            VippToken t = toks.get(i);
            switch (t.getKind()) {
                case BLOCK_CLOSE:
                    throw new ParseException(t.getLine(), "'" + t.getText() + "' sem abertura correspondente");
                case IDENTIFIER:
                    if (!t.isPrefixed()) {
                        i = identifier(scope, i);
                        continue;
                    }
                    i = pushOperand(toks, i, scope.buffer);
                    continue;
                case OPERATOR:
                    CommandSpec opSpec = CommandRegistry.lookup(t.getText());
                    if (opSpec != null) {
                        statement(scope, opSpec, i);
                        i++;
                        continue;
                    }
                    i = pushOperand(toks, i, scope.buffer);
                    continue;
                default:
                    i = pushOperand(toks, i, scope.buffer);
            }
        }
        if (!scope.frames.isEmpty()) {
            FlatFrame open = scope.frames.peek();
            throw new ParseException(open.line, open.isIf()
                    ? "IF sem ENDIF correspondente" : "BEGINTABLE sem ENDTABLE correspondente");
        }
        if (!toks.isEmpty()) {
            scope.drainResidue(toks.get(toks.size() - 1).getLine());
        }
        return scope.result;
    }

    private int identifier(Scope scope, int i) throws ParseException {
        VippToken t = scope.toks.get(i);
        String word = t.getText();
        if (CommandRegistry.isStructural(word)) {
            return structural(scope, i);
        }
        if (CommandRegistry.isOperator(word)) {
            reduce(scope.buffer, word, t.getLine(), i);
            return i + 1;
        }
        CommandSpec spec = CommandRegistry.lookup(word);
        if (spec != null) {
            statement(scope, spec, i);
            return i + 1;
        }
        if (fontAliases.contains(word)) {
            scope.append(new Command(CommandKind.SET_FONT, word,
                    List.of(Operand.identifier(word, t.getLine())), t.getLine()));
            scope.drainResidue(t.getLine());
            return i + 1;
        }
        if (colorAliases.contains(word)) {
            scope.append(new Command(CommandKind.SET_COLOR, word,
                    List.of(Operand.identifier(word, t.getLine())), t.getLine()));
            scope.drainResidue(t.getLine());
            return i + 1;
        }
        scope.buffer.push(Operand.identifier(word, t.getLine()), i);
        return i + 1;
    }

    private static void reduce(OperandBuffer buffer, String operator, int line, int tokenIndex) throws ParseException {
        List<Operand> args = buffer.pop(CommandRegistry.operatorArity(operator), operator, line);
        buffer.push(Operand.expression(operator, args, line), tokenIndex);
    }

    /** Empilha o operando que começa em i e devolve o índice seguinte */
    private int pushOperand(List<VippToken> toks, int i, OperandBuffer buffer) throws ParseException {
        VippToken t = toks.get(i);
        int line = t.getLine();
        switch (t.getKind()) {
            case STRING:
                buffer.push(Operand.string(VippTokenReader.unescape(t.getText()), line), i);
                return i + 1;
            case NUMBER:
                buffer.push(Operand.number(t.getText(), line), i);
                return i + 1;
            case IDENTIFIER:
                buffer.push(t.isPrefixed() ? Operand.name(t.getName(), line) : Operand.identifier(t.getText(), line), i);
                return i + 1;
            case BLOCK_OPEN: {
                int close = matching(toks, i);
                List<VippToken> inner = toks.subList(i + 1, close);
                if ("{".equals(t.getText())) {
                    buffer.push(Operand.procedure(inner, line), close);
                } else {
                    buffer.push(Operand.array(arrayElements(inner), line), close);
                }
                return close + 1;
            }
            case OPERATOR:
                // sinal separado do número: "- 04"
                if (("-".equals(t.getText()) || "+".equals(t.getText())) && i + 1 < toks.size()
                        && toks.get(i + 1).getKind() == TokenKind.NUMBER
                        && !toks.get(i + 1).getText().startsWith("-")
                        && !toks.get(i + 1).getText().startsWith("+")) {
                    buffer.push(Operand.number(t.getText() + toks.get(i + 1).getText(), line), i + 1);
                    return i + 2;
                }
                buffer.push(Operand.identifier(t.getText(), line), i);
                return i + 1;
            default:
                throw new ParseException(line, "token inesperado " + t.getText());
        }
    }

    private List<Operand> arrayElements(List<VippToken> inner) throws ParseException {
        OperandBuffer elements = new OperandBuffer();
        int j = 0;
        while (j < inner.size()) {
            j = pushOperand(inner, j, elements);
        }
        return elements.drain();
    }

    /** Índice do fechamento correspondente ao token de abertura em open */
    static int matching(List<VippToken> toks, int open) throws ParseException {
        Deque<VippToken> opened = new ArrayDeque<>();
        for (int j = open; j < toks.size(); j++) {
            VippToken t = toks.get(j);
            if (t.getKind() == TokenKind.BLOCK_OPEN) {
                opened.push(t);
            } else if (t.getKind() == TokenKind.BLOCK_CLOSE) {
                VippToken o = opened.pop();
                boolean brace = "{".equals(o.getText());
                if (brace != "}".equals(t.getText())) {
                    throw new ParseException(o.getLine(), "bloco '" + o.getText() + "' fechado com '" + t.getText() + "'");
                }
                if (opened.isEmpty()) {
                    return j;
                }
            }
        }
        throw new ParseException(toks.get(open).getLine(), "bloco '" + toks.get(open).getText() + "' sem fechamento");
    }

    private void statement(Scope scope, CommandSpec spec, int i) throws ParseException {
        VippToken t = scope.toks.get(i);
        String word = t.getText();
        int line = t.getLine();
        OperandBuffer buffer = scope.buffer;
        Map<String, Operand> options = new LinkedHashMap<>();

        switch (spec.getTrailing()) {
            case SPACING:
                if (buffer.topPushedAt(i - 1) && buffer.peek().is(Operand.Kind.NUMBER)) {
                    options.put("spacing", buffer.pop(word, line));
                }
                break;
            case SCALE:
                if (buffer.size() > spec.getArity() && buffer.topPushedAt(i - 1)
                        && buffer.peek().is(Operand.Kind.NUMBER)) {
                    options.put("scale", buffer.pop(word, line));
                }
                break;
            case INI_FLAG:
                if (buffer.peek() != null && buffer.peek().is(Operand.Kind.NAME) && "INI".equals(buffer.peek().getText())) {
                    options.put("ini", buffer.pop(word, line));
                }
                break;
            default:
                break;
        }

        List<Operand> params = buffer.pop(spec.getArity(), word, line);
        Command cmd;
        switch (spec.getKind()) {
            case SUBROUTINE:
                requireSymbol(params.get(0), word, line);
                cmd = new Command(CommandKind.SUBROUTINE, word, params.subList(0, 1), line);
                cmd.getChildren().addAll(parseSequence(requireProcedure(params.get(1), word, line).getBody()));
                break;
            case PAGE_HOOK:
            case FORM:
                cmd = new Command(spec.getKind(), word, line);
                cmd.getChildren().addAll(parseSequence(requireProcedure(params.get(0), word, line).getBody()));
                break;
            case REPEAT:
                cmd = new Command(CommandKind.REPEAT, word, params.subList(0, 1), line);
                cmd.getChildren().addAll(parseSequence(requireProcedure(params.get(1), word, line).getBody()));
                break;
            case PAGE_DEFINITION:
                cmd = new Command(CommandKind.PAGE_DEFINITION, word, line);
                Operand layouts = params.get(0);
                List<Operand> procs = layouts.is(Operand.Kind.ARRAY) ? layouts.getElements() : List.of(layouts);
                for (Operand p : procs) {
                    Command layout = new Command(CommandKind.PAGE_LAYOUT, "LAYOUT", p.getLine());
                    layout.getChildren().addAll(parseSequence(requireProcedure(p, word, line).getBody()));
                    cmd.addChild(layout);
                }
                break;
            case DEFINE_FONT:
                requireSymbol(params.get(0), word, line);
                fontAliases.add(params.get(0).getText());
                cmd = new Command(spec.getKind(), word, params, line);
                break;
            case DEFINE_COLOR:
                requireSymbol(params.get(0), word, line);
                colorAliases.add(params.get(0).getText());
                cmd = new Command(spec.getKind(), word, params, line);
                break;
            case SET_VARIABLE:
            case INCREMENT:
            case DECREMENT:
                requireSymbol(params.get(0), word, line);
                cmd = new Command(spec.getKind(), word, params, line);
                break;
            default:
                cmd = new Command(spec.getKind(), word, params, line);
        }
        for (Map.Entry<String, Operand> e : options.entrySet()) {
            cmd.setOption(e.getKey(), e.getValue());
        }
        scope.append(cmd);
        scope.drainResidue(line);
    }

    private static Operand requireProcedure(Operand op, String word, int line) throws ParseException {
        if (!op.is(Operand.Kind.PROCEDURE)) {
            throw new ParseException(line, word + " espera um bloco { }, encontrado " + op);
        }
        return op;
    }

    private static void requireSymbol(Operand op, String word, int line) throws ParseException {
        if (!op.isSymbol() && !op.is(Operand.Kind.STRING)) {
            throw new ParseException(line, word + " espera um nome, encontrado " + op);
        }
    }

    // ------------------------------------------------------------------
    // construções estruturais

    private int structural(Scope scope, int i) throws ParseException {
        VippToken t = scope.toks.get(i);
        switch (t.getText()) {
            case "IF":
            case "IFELSE":
                return conditional(scope, i);
            case "ELSE":
                return flatElse(scope, i);
            case "ENDIF": {
                FlatFrame top = scope.frames.peek();
                if (top == null || !top.isIf()) {
                    throw new ParseException(t.getLine(), "ENDIF sem IF correspondente");
                }
                scope.drainResidue(t.getLine());
                scope.frames.pop();
                scope.append(top.command);
                return i + 1;
            }
            case "THEN":
                throw new ParseException(t.getLine(), "THEN sem IF correspondente");
            case "CASE":
                return caseDispatch(scope, i);
            case "ENDCASE":
                throw new ParseException(t.getLine(), "ENDCASE sem CASE correspondente");
            case "BEGINTABLE": {
                Command table = new Command(CommandKind.TABLE, "BEGINTABLE", t.getLine());
                if (scope.buffer.topPushedAt(i - 1) && scope.buffer.peek().is(Operand.Kind.ARRAY)) {
                    table.setOption("widths", scope.buffer.pop("BEGINTABLE", t.getLine()));
                }
                scope.drainResidue(t.getLine());
                scope.frames.push(new FlatFrame(table, table.getChildren()));
                return i + 1;
            }
            case "ENDTABLE": {
                FlatFrame top = scope.frames.peek();
                if (top == null || top.isIf()) {
                    throw new ParseException(t.getLine(), "ENDTABLE sem BEGINTABLE correspondente");
                }
                scope.drainResidue(t.getLine());
                scope.frames.pop();
                scope.append(top.command);
                return i + 1;
            }
            default:
                throw new ParseException(t.getLine(), "palavra estrutural inesperada " + t.getText());
        }
    }

    private static boolean isWord(List<VippToken> toks, int i, String word) {
        return i < toks.size() && toks.get(i).getKind() == TokenKind.IDENTIFIER
                && !toks.get(i).isPrefixed() && toks.get(i).getText().equals(word);
    }

    private static boolean isOpenBrace(List<VippToken> toks, int i) {
        return i < toks.size() && toks.get(i).is(TokenKind.BLOCK_OPEN, "{");
    }

    private Command newIf(Operand condition, int line) {
        Command cmd = new Command(CommandKind.IF, "IF", List.of(condition), line);
        cmd.addChild(new Command(CommandKind.THEN_BRANCH, "THEN", line));
        return cmd;
    }

    private Command addElse(Command ifCmd, int line) {
        Command elseBranch = new Command(CommandKind.ELSE_BRANCH, "ELSE", line);
        ifCmd.addChild(elseBranch);
        return elseBranch;
    }

    private int conditional(Scope scope, int i) throws ParseException {
        List<VippToken> toks = scope.toks;
        VippToken t = toks.get(i);
        int line = t.getLine();
        OperandBuffer buffer = scope.buffer;

        // forma pós-fixa: cond { then } IF  |  cond { then } { else } IFELSE
        if (buffer.topPushedAt(i - 1) && buffer.peek().is(Operand.Kind.PROCEDURE)) {
            Operand elseBody = null;
            if ("IFELSE".equals(t.getText())) {
                elseBody = buffer.pop(t.getText(), line);
                if (buffer.peek() == null || !buffer.peek().is(Operand.Kind.PROCEDURE)) {
                    throw new ParseException(line, "IFELSE espera dois blocos { }");
                }
            }
            Operand thenBody = buffer.pop(t.getText(), line);
            if (buffer.isEmpty()) {
                throw new ParseException(line, t.getText() + " sem condicao");
            }
            Operand condition = buffer.pop(t.getText(), line);
            scope.drainResidue(line);
            Command cmd = newIf(condition, line);
            cmd.getChildren().get(0).getChildren().addAll(parseSequence(thenBody.getBody()));
            int next = i + 1;
            if (elseBody != null) {
                addElse(cmd, line).getChildren().addAll(parseSequence(elseBody.getBody()));
            } else if (isWord(toks, next, "ELSE") && isOpenBrace(toks, next + 1)) {
                int close = matching(toks, next + 1);
                addElse(cmd, toks.get(next).getLine()).getChildren().addAll(parseSequence(toks.subList(next + 2, close)));
                next = close + 1;
            }
            scope.append(cmd);
            return next;
        }
        if ("IFELSE".equals(t.getText())) {
            throw new ParseException(line, "IFELSE espera dois blocos { }");
        }

        scope.drainResidue(line);
        int j = i + 1;
        while (j < toks.size() && isConditionToken(toks.get(j))) {
            j = toks.get(j).getKind() == TokenKind.BLOCK_OPEN ? matching(toks, j) + 1 : j + 1;
        }
        if (j == i + 1 && !isOpenBrace(toks, j) && !isWord(toks, j, "THEN")) {
            throw new ParseException(line, "IF sem condicao");
        }

        // forma prefixa com chaves: IF cond { then } [ELSE { else }] [ENDIF]
        if (isOpenBrace(toks, j)) {
            if (j == i + 1) {
                throw new ParseException(line, "IF sem condicao");
            }
            Command cmd = newIf(condition(toks, i + 1, j, line), line);
            int close = matching(toks, j);
            cmd.getChildren().get(0).getChildren().addAll(parseSequence(toks.subList(j + 1, close)));
            int k = close + 1;
            if (isWord(toks, k, "ELSE") && isOpenBrace(toks, k + 1)) {
                int elseClose = matching(toks, k + 1);
                addElse(cmd, toks.get(k).getLine()).getChildren().addAll(parseSequence(toks.subList(k + 2, elseClose)));
                k = elseClose + 1;
            }
            // o ENDIF só pertence ao bloco fechado se sobrar algum além dos aguardados pelos IFs planos
            if (isWord(toks, k, "ENDIF") && remainingEndifs(toks, k) > scope.pendingIfDepth()) {
                k++;
            }
            scope.append(cmd);
            return k;
        }

        // forma plana: IF cond [THEN] ... [ELSE ...] ENDIF
        int condEnd;
        int next;
        if (isWord(toks, j, "THEN")) {
            if (j == i + 1) {
                throw new ParseException(line, "IF sem condicao");
            }
            condEnd = j;
            next = j + 1;
        } else {
            condEnd = shortestCondition(toks, i + 1, j, line);
            next = condEnd;
        }
        Command cmd = newIf(condition(toks, i + 1, condEnd, line), line);
        scope.frames.push(new FlatFrame(cmd, cmd.getChildren().get(0).getChildren()));
        log.debug("{}: IF plano aberto na linha {} (profundidade {})", documentName, line, scope.pendingIfDepth());
        return next;
    }

    /** ENDIFs a partir de from no nível deste escopo, sem contar os de blocos aninhados */
    private static int remainingEndifs(List<VippToken> toks, int from) throws ParseException {
        int count = 0;
        int k = from;
        while (k < toks.size()) {
            if (toks.get(k).getKind() == TokenKind.BLOCK_OPEN) {
                k = matching(toks, k) + 1;
                continue;
            }
            if (isWord(toks, k, "ENDIF")) {
                count++;
            }
            k++;
        }
        return count;
    }

    private int flatElse(Scope scope, int i) throws ParseException {
        VippToken t = scope.toks.get(i);
        FlatFrame top = scope.frames.peek();
        if (top == null || !top.isIf()) {
            throw new ParseException(t.getLine(), "ELSE sem IF correspondente");
        }
        if (top.inElse) {
            throw new ParseException(t.getLine(), "ELSE duplicado para o IF da linha " + top.line);
        }
        scope.drainResidue(t.getLine());
        top.inElse = true;
        top.target = addElse(top.command, t.getLine()).getChildren();
        return i + 1;
    }

    private boolean isConditionToken(VippToken t) {
        switch (t.getKind()) {
            case STRING:
            case NUMBER:
                return true;
            case BLOCK_OPEN:
                return "[".equals(t.getText());
            case OPERATOR:
                return CommandRegistry.lookup(t.getText()) == null;
            case IDENTIFIER:
                if (t.isPrefixed() || CommandRegistry.isOperator(t.getText())) {
                    return true;
                }
                return !CommandRegistry.isStructural(t.getText())
                        && CommandRegistry.lookup(t.getText()) == null
                        && !fontAliases.contains(t.getText())
                        && !colorAliases.contains(t.getText());
            default:
                return false;
        }
    }

    /** Reduz os tokens [from, to) e devolve a pilha resultante */
    private List<Operand> reduceRange(List<VippToken> toks, int from, int to) throws ParseException {
        OperandBuffer local = new OperandBuffer();
        int k = from;
        while (k < to) {
            VippToken t = toks.get(k);
            if (t.getKind() == TokenKind.IDENTIFIER && !t.isPrefixed() && CommandRegistry.isOperator(t.getText())) {
                reduce(local, t.getText(), t.getLine(), k);
                k++;
            } else {
                k = pushOperand(toks, k, local);
            }
        }
        return local.drain();
    }

    private Operand condition(List<VippToken> toks, int from, int to, int line) throws ParseException {
        List<Operand> stack = reduceRange(toks, from, to);
        if (stack.size() != 1) {
            throw new ParseException(line, "condicao mal formada: " + stack);
        }
        return stack.get(0);
    }

    /**
     * Sem THEN, a condição termina no menor prefixo que acaba em operador e
     * reduz a um único valor; sem operador, é o primeiro operando.
     */
    private int shortestCondition(List<VippToken> toks, int from, int to, int line) throws ParseException {
        for (int e = from; e < to; e++) {
            VippToken t = toks.get(e);
            if (t.getKind() == TokenKind.IDENTIFIER && !t.isPrefixed() && CommandRegistry.isOperator(t.getText())) {
                if (reduceRange(toks, from, e + 1).size() == 1) {
                    return e + 1;
                }
            }
        }
        if (toks.get(from).getKind() == TokenKind.BLOCK_OPEN) {
            return matching(toks, from) + 1;
        }
        return from + 1;
    }

    private int caseDispatch(Scope scope, int i) throws ParseException {
        List<VippToken> toks = scope.toks;
        VippToken caseTok = toks.get(i);
        int line = caseTok.getLine();
        scope.drainResidue(line);
        int k = i + 1;
        if (k >= toks.size() || toks.get(k).getKind() != TokenKind.IDENTIFIER) {
            throw new ParseException(line, "CASE sem discriminante");
        }
        String discriminant = toks.get(k).getName();
        Command cmd = new Command(CommandKind.CASE, "CASE", List.of(Operand.identifier(discriminant, line)), line);
        k++;
        boolean hasDefault = false;
        while (true) {
            if (k >= toks.size()) {
                throw new ParseException(line, "CASE sem ENDCASE correspondente");
            }
            VippToken t = toks.get(k);
            if (isWord(toks, k, "ENDCASE")) {
                k++;
                break;
            }
            boolean literal = t.getKind() == TokenKind.STRING || t.getKind() == TokenKind.NUMBER
                    || (t.getKind() == TokenKind.IDENTIFIER && t.isPrefixed());
            if (literal && isOpenBrace(toks, k + 1)) {
                String value = t.getKind() == TokenKind.STRING ? VippTokenReader.unescape(t.getText()) : t.getName();
                int close = matching(toks, k + 1);
                Command entry = new Command(CommandKind.CASE_ENTRY, "CASE_ENTRY",
                        List.of(Operand.string(value, t.getLine())), t.getLine());
                entry.getChildren().addAll(parseSequence(toks.subList(k + 2, close)));
                cmd.addChild(entry);
                k = close + 1;
            } else if (isOpenBrace(toks, k)) {
                if (hasDefault) {
                    throw new ParseException(t.getLine(), "CASE com mais de um bloco padrao");
                }
                hasDefault = true;
                int close = matching(toks, k);
                Command def = new Command(CommandKind.CASE_DEFAULT, "DEFAULT", t.getLine());
                def.getChildren().addAll(parseSequence(toks.subList(k + 1, close)));
                cmd.addChild(def);
                k = close + 1;
            } else {
                throw new ParseException(t.getLine(), "entrada de CASE mal formada: " + t.getText());
            }
        }
        scope.append(cmd);
        return k;
    }
}
