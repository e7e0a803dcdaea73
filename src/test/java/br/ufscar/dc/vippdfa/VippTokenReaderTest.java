package br.ufscar.dc.vippdfa;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class VippTokenReaderTest {

    @Test
    void classifiesTokenKinds() throws Exception {
        List<VippToken> tokens = VippTokenReader.tokenize("/F1 /ARIAL 8 INDEXFONT\n{ (a) SH } [1 2] -3.5 ++", "t");

        assertEquals(TokenKind.IDENTIFIER, tokens.get(0).getKind());
        assertTrue(tokens.get(0).isPrefixed());
        assertEquals("F1", tokens.get(0).getName());
        assertEquals(TokenKind.NUMBER, tokens.get(2).getKind());
        assertEquals("INDEXFONT", tokens.get(3).getText());
        assertEquals(TokenKind.BLOCK_OPEN, tokens.get(4).getKind());
        assertEquals(2, tokens.get(4).getLine());
        assertEquals(TokenKind.STRING, tokens.get(5).getKind());
        assertEquals(TokenKind.BLOCK_CLOSE, tokens.get(7).getKind());
        assertEquals(TokenKind.BLOCK_OPEN, tokens.get(8).getKind());
        assertEquals("-3.5", tokens.get(12).getText());
        assertEquals(TokenKind.OPERATOR, tokens.get(13).getKind());
        assertEquals(14, tokens.size());
    }

    @Test
    void dottedNamesStayWhole() throws Exception {
        List<VippToken> tokens = VippTokenReader.tokenize("DATA.NAME /DATA.NAME", "t");

        assertEquals(2, tokens.size());
        assertEquals(TokenKind.IDENTIFIER, tokens.get(0).getKind());
        assertEquals("DATA.NAME", tokens.get(0).getText());
        assertEquals(TokenKind.IDENTIFIER, tokens.get(1).getKind());
        assertTrue(tokens.get(1).isPrefixed());
        assertEquals("DATA.NAME", tokens.get(1).getName());
        assertEquals("DATA_NAME", DocumentNames.variable(tokens.get(0).getText()));
    }

    @Test
    void keepsCommentsAsTokens() throws Exception {
        List<VippToken> tokens = VippTokenReader.tokenize("%%Title: Extrato\n/* bloco */ (x) SH", "t");

        assertEquals(TokenKind.COMMENT, tokens.get(0).getKind());
        assertEquals(TokenKind.COMMENT, tokens.get(1).getKind());
        assertEquals(TokenKind.STRING, tokens.get(2).getKind());
    }

    @Test
    void nestedParenthesesStayInOneString() throws Exception {
        List<VippToken> tokens = VippTokenReader.tokenize("(a (b) c) SH", "t");

        assertEquals(2, tokens.size());
        assertEquals("a (b) c", VippTokenReader.unescape(tokens.get(0).getText()));
    }

    @Test
    void unescapesStringBodies() {
        assertEquals("a\nb", VippTokenReader.unescape("(a\\nb)"));
        assertEquals("(x)", VippTokenReader.unescape("(\\(x\\))"));
        assertEquals("A", VippTokenReader.unescape("(\\101)"));
        assertEquals("ab", VippTokenReader.unescape("(a\\\nb)"));
    }

    @Test
    void unterminatedStringFailsWithLine() {
        LexException e = assertThrows(LexException.class,
                () -> VippTokenReader.tokenize("(ok) SH\n(sem fim SH", "t"));

        assertEquals(2, e.getLine());
        assertEquals("Linha 2: cadeia literal nao fechada", e.getMessage());
    }

    @Test
    void unterminatedCommentFails() {
        LexException e = assertThrows(LexException.class, () -> VippTokenReader.tokenize("(a) SH /* aberto", "t"));

        assertEquals("Linha 1: comentario nao fechado", e.getMessage());
    }

    @Test
    void invalidCharacterFails() {
        LexException e = assertThrows(LexException.class, () -> VippTokenReader.tokenize("\n\n10 ? 20", "t"));

        assertEquals("Linha 3: ? - simbolo nao identificado", e.getMessage());
    }
}
