package br.ufscar.dc.vippdfa;

/** Token imutável produzido pelo leitor a partir do léxico gerado */
public final class VippToken {

    private final TokenKind kind;
    private final String text;
    private final int line;
    private final int column;
    private final boolean prefixed; // identificador marcado com '/'

    public VippToken(TokenKind kind, String text, int line, int column) {
        this(kind, text, line, column, false);
    }

    public VippToken(TokenKind kind, String text, int line, int column, boolean prefixed) {
        this.kind = kind;
        this.text = text;
        this.line = line;
        this.column = column;
        this.prefixed = prefixed;
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean isPrefixed() {
        return prefixed;
    }

    /** Nome sem a barra inicial, para identificadores marcados */
    public String getName() {
        return prefixed ? text.substring(1) : text;
    }

    public boolean is(TokenKind k, String t) {
        return kind == k && text.equals(t);
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + line + ":" + column;
    }
}
