package br.ufscar.dc.vippdfa;

import java.util.ArrayList;
import java.util.List;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;

/**
 * Converte os tokens do léxico gerado em {@link VippToken}. Tokens de erro do
 * léxico viram {@link LexException} na primeira ocorrência.
 */
public class VippTokenReader {

    private final VippLexer lexer;
    private boolean finished = false;
    private int lastStop = -1;

    public VippTokenReader(String source, String sourceName) {
        this.lexer = new VippLexer(CharStreams.fromString(source, sourceName));
        this.lexer.removeErrorListeners();
    }

    /** Próximo token, ou null ao fim da entrada */
    public VippToken next() throws LexException {
        if (finished) {
            return null;
        }
        Token t = lexer.nextToken();
        if (t.getType() == Token.EOF) {
            finished = true;
            return null;
        }
        if (t.getStopIndex() <= lastStop) {
            throw new LexException(t.getLine(), "leitura sem progresso proximo a " + t.getText());
        }
        lastStop = t.getStopIndex();

        int line = t.getLine();
        int column = t.getCharPositionInLine() + 1;
        String nomeToken = VippLexer.VOCABULARY.getSymbolicName(t.getType());

        switch (nomeToken) {
            case "ERRO":
                throw new LexException(line, t.getText() + " - simbolo nao identificado");
            case "CADEIA_NAO_FECHADA":
                throw new LexException(line, "cadeia literal nao fechada");
            case "COMENTARIO_NAO_FECHADO":
                throw new LexException(line, "comentario nao fechado");
            case "COMENTARIO_LINHA":
            case "COMENTARIO_BLOCO":
                return new VippToken(TokenKind.COMMENT, t.getText(), line, column);
            case "CADEIA":
                return new VippToken(TokenKind.STRING, t.getText(), line, column);
            case "NUMERO":
                return new VippToken(TokenKind.NUMBER, t.getText(), line, column);
            case "NOME":
                return new VippToken(TokenKind.IDENTIFIER, t.getText(), line, column, true);
            case "IDENT":
                return new VippToken(TokenKind.IDENTIFIER, t.getText(), line, column);
            case "ABRE_CHAVE":
            case "ABRE_COLCHETE":
                return new VippToken(TokenKind.BLOCK_OPEN, t.getText(), line, column);
            case "FECHA_CHAVE":
            case "FECHA_COLCHETE":
                return new VippToken(TokenKind.BLOCK_CLOSE, t.getText(), line, column);
            default:
                return new VippToken(TokenKind.OPERATOR, t.getText(), line, column);
        }
    }

    public List<VippToken> readAll() throws LexException {
        List<VippToken> tokens = new ArrayList<>();
        VippToken t;
        while ((t = next()) != null) {
            tokens.add(t);
        }
        return tokens;
    }

    public static List<VippToken> tokenize(String source, String sourceName) throws LexException {
        return new VippTokenReader(source, sourceName).readAll();
    }

    /** Remove os parênteses externos e resolve os escapes de uma cadeia VIPP */
    public static String unescape(String raw) {
        String body = raw;
        if (body.startsWith("(") && body.endsWith(")") && body.length() >= 2) {
            body = body.substring(1, body.length() - 1);
        }
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                sb.append(c);
                continue;
            }
            char n = body.charAt(++i);
            switch (n) {
                case 'n': sb.append('\n'); break;
                case 'r': sb.append('\r'); break;
                case 't': sb.append('\t'); break;
                case 'b': sb.append('\b'); break;
                case 'f': sb.append('\f'); break;
                case '\n': break; // continuação de linha
                case '\r':
                    if (i + 1 < body.length() && body.charAt(i + 1) == '\n') {
                        i++;
                    }
                    break;
                default:
                    if (n >= '0' && n <= '7') {
                        int end = i;
                        while (end < body.length() && end < i + 3 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
                            end++;
                        }
                        sb.append((char) Integer.parseInt(body.substring(i, end), 8));
                        i = end - 1;
                    } else {
                        sb.append(n);
                    }
            }
        }
        return sb.toString();
    }
}
