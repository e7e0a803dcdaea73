package br.ufscar.dc.vippdfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/** Operando pendente na pilha do parser ou parâmetro de um comando */
public final class Operand {

    public enum Kind {
        NUMBER,
        STRING,
        NAME,       // /NOME
        IDENTIFIER, // referência a variável
        ARRAY,
        PROCEDURE,  // { ... } ainda não analisado
        EXPRESSION  // operador aplicado a operandos (eq, VSUB, GETINTV, ...)
    }

    private final Kind kind;
    private final String text;
    private final List<Operand> elements;
    private final List<VippToken> body;
    private final int line;

    private Operand(Kind kind, String text, List<Operand> elements, List<VippToken> body, int line) {
        this.kind = kind;
        this.text = text;
        this.elements = elements;
        this.body = body;
        this.line = line;
    }

    public static Operand number(String text, int line) {
        return new Operand(Kind.NUMBER, text, Collections.emptyList(), Collections.emptyList(), line);
    }

    public static Operand string(String value, int line) {
        return new Operand(Kind.STRING, value, Collections.emptyList(), Collections.emptyList(), line);
    }

    public static Operand name(String name, int line) {
        return new Operand(Kind.NAME, name, Collections.emptyList(), Collections.emptyList(), line);
    }

    public static Operand identifier(String name, int line) {
        return new Operand(Kind.IDENTIFIER, name, Collections.emptyList(), Collections.emptyList(), line);
    }

    public static Operand array(List<Operand> elements, int line) {
        return new Operand(Kind.ARRAY, "[]", Collections.unmodifiableList(new ArrayList<>(elements)),
                Collections.emptyList(), line);
    }

    public static Operand procedure(List<VippToken> body, int line) {
        return new Operand(Kind.PROCEDURE, "{}", Collections.emptyList(),
                Collections.unmodifiableList(new ArrayList<>(body)), line);
    }

    public static Operand expression(String operator, List<Operand> args, int line) {
        return new Operand(Kind.EXPRESSION, operator, Collections.unmodifiableList(new ArrayList<>(args)),
                Collections.emptyList(), line);
    }

    public Kind getKind() {
        return kind;
    }

    /** Valor textual: número bruto, conteúdo da cadeia, nome sem barra ou operador */
    public String getText() {
        return text;
    }

    public List<Operand> getElements() {
        return elements;
    }

    public List<VippToken> getBody() {
        return body;
    }

    public int getLine() {
        return line;
    }

    public boolean is(Kind k) {
        return kind == k;
    }

    public boolean isExpression(String operator) {
        return kind == Kind.EXPRESSION && text.equals(operator);
    }

    /** Nome ou identificador, com ou sem barra */
    public boolean isSymbol() {
        return kind == Kind.NAME || kind == Kind.IDENTIFIER;
    }

    public double asNumber() {
        if (kind != Kind.NUMBER) {
            throw new NumberFormatException("operando nao numerico: " + text);
        }
        return Double.parseDouble(text);
    }

    public Operand withText(String newText) {
        return new Operand(kind, newText, elements, body, line);
    }

    /** Copia o operando aplicando a função a todas as cadeias, inclusive aninhadas */
    public Operand rewriteStrings(UnaryOperator<String> fn) {
        switch (kind) {
            case STRING:
                return withText(fn.apply(text));
            case ARRAY:
            case EXPRESSION:
                List<Operand> copy = new ArrayList<>();
                for (Operand e : elements) {
                    copy.add(e.rewriteStrings(fn));
                }
                return kind == Kind.ARRAY ? array(copy, line) : expression(text, copy, line);
            default:
                return this;
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case STRING: return "(" + text + ")";
            case NAME: return "/" + text;
            case ARRAY: return elements.toString();
            case PROCEDURE: return "{...}";
            case EXPRESSION: return text + elements;
            default: return text;
        }
    }
}
