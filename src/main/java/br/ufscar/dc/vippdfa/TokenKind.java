package br.ufscar.dc.vippdfa;

public enum TokenKind {
    IDENTIFIER,
    STRING,
    NUMBER,
    OPERATOR,
    BLOCK_OPEN,
    BLOCK_CLOSE,
    COMMENT
}
