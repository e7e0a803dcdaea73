package br.ufscar.dc.vippdfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Nó da árvore de comandos. Blocos (IF, CASE, sub-rotinas, ...) guardam o
 * conteúdo em {@code children}; parâmetros opcionais ficam em {@code options}.
 */
public class Command {

    private final CommandKind kind;
    private final String name;
    private final List<Operand> parameters;
    private final List<Command> children = new ArrayList<>();
    private final Map<String, Operand> options = new LinkedHashMap<>();
    private final int line;

    public Command(CommandKind kind, String name, List<Operand> parameters, int line) {
        this.kind = kind;
        this.name = name;
        this.parameters = new ArrayList<>(parameters);
        this.line = line;
    }

    public Command(CommandKind kind, String name, int line) {
        this(kind, name, Collections.emptyList(), line);
    }

    public CommandKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public List<Operand> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public Operand getParameter(int i) {
        return parameters.get(i);
    }

    public void setParameter(int i, Operand operand) {
        parameters.set(i, operand);
    }

    public List<Command> getChildren() {
        return children;
    }

    public void addChild(Command child) {
        children.add(child);
    }

    public Map<String, Operand> getOptions() {
        return options;
    }

    public Operand getOption(String key) {
        return options.get(key);
    }

    public void setOption(String key, Operand value) {
        options.put(key, value);
    }

    public int getLine() {
        return line;
    }

    /** Primeiro filho do tipo pedido, ou null */
    public Command child(CommandKind k) {
        for (Command c : children) {
            if (c.kind == k) {
                return c;
            }
        }
        return null;
    }

    /** Verdadeiro se há saída, desenho ou controle de página em qualquer nível */
    public static boolean hasMeaningfulContent(List<Command> commands) {
        for (Command c : commands) {
            if (c.kind.isMeaningful()) {
                return true;
            }
            if (c.kind == CommandKind.SUBROUTINE || c.kind == CommandKind.PAGE_HOOK) {
                continue;
            }
            if (hasMeaningfulContent(c.children)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return name + parameters + (children.isEmpty() ? "" : children.toString());
    }
}
