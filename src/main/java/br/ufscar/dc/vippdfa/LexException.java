package br.ufscar.dc.vippdfa;

public class LexException extends TranslationException {

    public LexException(int line, String message) {
        super(line, message);
    }
}
