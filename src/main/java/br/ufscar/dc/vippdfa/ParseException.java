package br.ufscar.dc.vippdfa;

public class ParseException extends TranslationException {

    public ParseException(int line, String message) {
        super(line, message);
    }
}
