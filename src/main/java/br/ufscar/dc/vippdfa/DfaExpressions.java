package br.ufscar.dc.vippdfa;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Conversão de operandos VIPP em expressões e condições DFA */
public final class DfaExpressions {

    private static final Pattern SUBSTITUTION = Pattern.compile("\\$\\$([A-Za-z_][A-Za-z0-9_]*)\\.");

    private DfaExpressions() {
    }

    public static String value(Operand op) {
        switch (op.getKind()) {
            case NUMBER:
                return DfaWriter.number(op.asNumber());
            case STRING:
                return DfaWriter.quote(op.getText());
            case NAME:
            case IDENTIFIER:
                return symbol(op.getText());
            case ARRAY: {
                List<String> items = new ArrayList<>();
                for (Operand e : op.getElements()) {
                    items.add(value(e));
                }
                return String.join(" ! ", items);
            }
            case EXPRESSION:
                return expression(op);
            default:
                return "''";
        }
    }

    private static String symbol(String name) {
        switch (name) {
            case "true":
                return "1";
            case "false":
                return "0";
            default:
                return DocumentNames.variable(name);
        }
    }

    private static String expression(Operand op) {
        List<Operand> args = op.getElements();
        switch (op.getText()) {
            case "eq":
                return comparison(args, "==");
            case "ne":
                return comparison(args, "<>");
            case "lt":
                return comparison(args, "<");
            case "gt":
                return comparison(args, ">");
            case "le":
                return comparison(args, "<=");
            case "ge":
                return comparison(args, ">=");
            case "and":
                return "(" + value(args.get(0)) + ") AND (" + value(args.get(1)) + ")";
            case "or":
                return "(" + value(args.get(0)) + ") OR (" + value(args.get(1)) + ")";
            case "not":
                return "NOT(" + value(args.get(0)) + ")";
            case "add":
                return "(" + value(args.get(0)) + "+" + value(args.get(1)) + ")";
            case "sub":
                return "(" + value(args.get(0)) + "-" + value(args.get(1)) + ")";
            case "mul":
                return "(" + value(args.get(0)) + "*" + value(args.get(1)) + ")";
            case "div":
                return "(" + value(args.get(0)) + "/" + value(args.get(1)) + ")";
            case "VSUB":
                return args.get(0).is(Operand.Kind.STRING) ? substitute(args.get(0).getText()) : value(args.get(0));
            case "GETINTV":
                return "SUBSTR(" + value(args.get(0)) + ", " + offset(args.get(1)) + ", "
                        + value(args.get(2)) + ", '')";
            case "GETITEM":
                return value(args.get(0)) + "[" + offset(args.get(1)) + "]";
            case "CACHE":
                return value(args.get(0));
            default:
                throw new GenerationInvariantException("operador sem conversao: " + op.getText());
        }
    }

    /** Índices VIPP começam em 0, os do DFA em 1 */
    private static String offset(Operand index) {
        if (index.is(Operand.Kind.NUMBER)) {
            return DfaWriter.number(index.asNumber() + 1);
        }
        return value(index) + "+1";
    }

    private static String comparison(List<Operand> args, String op) {
        Operand a = args.get(0);
        Operand b = args.get(1);
        if (a.isSymbol() && "FRLEFT".equals(a.getText()) && b.is(Operand.Kind.NUMBER)) {
            return frameLeft(op, b);
        }
        return value(a) + op + value(b);
    }

    /** Espaço restante no quadro: FRLEFT n lt vira $SL_MAXY>$LP_HEIGHT-MM(n) */
    private static String frameLeft(String op, Operand limit) {
        String inverted;
        switch (op) {
            case "<":
                inverted = ">";
                break;
            case ">":
                inverted = "<";
                break;
            case "<=":
                inverted = ">=";
                break;
            case ">=":
                inverted = "<=";
                break;
            default:
                inverted = op;
        }
        return "$SL_MAXY" + inverted + "$LP_HEIGHT-MM(" + DfaWriter.number(limit.asNumber()) + ")";
    }

    public static String condition(Operand op) {
        return "ISTRUE(" + value(op) + ")";
    }

    public static boolean hasSubstitution(String text) {
        return SUBSTITUTION.matcher(text).find();
    }

    /** "Total: $$VALOR." vira 'Total: ' ! VALOR */
    public static String substitute(String text) {
        List<String> parts = new ArrayList<>();
        Matcher m = SUBSTITUTION.matcher(text);
        int pos = 0;
        while (m.find()) {
            if (m.start() > pos) {
                parts.add(DfaWriter.quote(text.substring(pos, m.start())));
            }
            parts.add(DocumentNames.variable(m.group(1)));
            pos = m.end();
        }
        if (pos < text.length()) {
            parts.add(DfaWriter.quote(text.substring(pos)));
        }
        if (parts.isEmpty()) {
            return "''";
        }
        return String.join(" ! ", parts);
    }

    /** Texto visível aproximado de uma cadeia com substituições, sem as variáveis */
    public static String withoutSubstitutions(String text) {
        return SUBSTITUTION.matcher(text).replaceAll("");
    }
}
