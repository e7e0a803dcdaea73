package br.ufscar.dc.vippdfa;

/** Erro fatal para o documento corrente, sempre com a linha de origem */
public class TranslationException extends Exception {

    private final int line;

    public TranslationException(int line, String message) {
        super(String.format("Linha %d: %s", line, message));
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
