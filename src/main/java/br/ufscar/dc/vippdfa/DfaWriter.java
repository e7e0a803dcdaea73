package br.ufscar.dc.vippdfa;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Acumula o texto DFA gerado, com indentação de quatro espaços por nível */
public class DfaWriter {

    private static final String INDENT = "    ";

    private final StringBuilder output = new StringBuilder();
    private int level;

    public DfaWriter line(String text) {
        for (int i = 0; i < level; i++) {
            output.append(INDENT);
        }
        output.append(text).append('\n');
        return this;
    }

    public DfaWriter blank() {
        output.append('\n');
        return this;
    }

    public DfaWriter indent() {
        level++;
        return this;
    }

    public DfaWriter dedent() {
        if (level == 0) {
            throw new GenerationInvariantException("indentacao negativa no texto gerado");
        }
        level--;
        return this;
    }

    public String getOutput() {
        return output.toString();
    }

    /** Três casas no máximo, sem zeros à direita: 12.5, 3, 0.353 */
    public static String number(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new GenerationInvariantException("valor numerico invalido: " + value);
        }
        BigDecimal d = BigDecimal.valueOf(value).setScale(3, RoundingMode.HALF_UP).stripTrailingZeros();
        if (d.signum() == 0) {
            return "0";
        }
        return d.toPlainString();
    }

    /** Literal DFA entre aspas simples, com aspas internas duplicadas */
    public static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }
}
