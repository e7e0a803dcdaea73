package br.ufscar.dc.vippdfa;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Pilha de operandos pendentes. Só contém operandos empilhados desde a última
 * palavra-chave de comando: o parser esvazia a pilha a cada fronteira.
 */
public class OperandBuffer {

    private static final class Entry {
        final Operand operand;
        final int tokenIndex;

        Entry(Operand operand, int tokenIndex) {
            this.operand = operand;
            this.tokenIndex = tokenIndex;
        }
    }

    private final Deque<Entry> stack = new ArrayDeque<>();

    public void push(Operand operand, int tokenIndex) {
        stack.push(new Entry(operand, tokenIndex));
    }

    public int size() {
        return stack.size();
    }

    public boolean isEmpty() {
        return stack.isEmpty();
    }

    public Operand peek() {
        return stack.isEmpty() ? null : stack.peek().operand;
    }

    /** Verdadeiro se o topo foi empilhado exatamente pelo token indicado */
    public boolean topPushedAt(int tokenIndex) {
        return !stack.isEmpty() && stack.peek().tokenIndex == tokenIndex;
    }

    /** Desempilha n operandos e devolve na ordem do fonte */
    public List<Operand> pop(int n, String keyword, int line) throws ParseException {
        if (stack.size() < n) {
            throw new ParseException(line, String.format(
                    "%s espera %d operando(s), encontrado(s) %d", keyword, n, stack.size()));
        }
        List<Operand> result = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            result.add(stack.pop().operand);
        }
        Collections.reverse(result);
        return result;
    }

    public Operand pop(String keyword, int line) throws ParseException {
        return pop(1, keyword, line).get(0);
    }

    /** Esvazia a pilha devolvendo o resíduo na ordem do fonte */
    public List<Operand> drain() {
        List<Operand> residue = new ArrayList<>(stack.size());
        Iterator<Entry> it = stack.descendingIterator();
        while (it.hasNext()) {
            residue.add(it.next().operand);
        }
        stack.clear();
        return residue;
    }
}
