package br.ufscar.dc.vippdfa;

/** Invariante interna do gerador violada: defeito do gerador, nunca da entrada */
public class GenerationInvariantException extends IllegalStateException {

    public GenerationInvariantException(String message) {
        super(message);
    }
}
