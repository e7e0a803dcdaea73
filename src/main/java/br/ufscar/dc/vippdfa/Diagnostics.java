package br.ufscar.dc.vippdfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Avisos recuperáveis acumulados durante a tradução, um relatório por execução */
public class Diagnostics {

    private static final Logger log = LoggerFactory.getLogger(Diagnostics.class);

    public enum Kind {
        CONFLICT,
        UNSUPPORTED_CONSTRUCT,
        PLACEHOLDER,
        CLAMPED_COORDINATE,
        UNUSED_OPERANDS,
        HOISTED_BLOCK,
        DOCUMENT_FAILED
    }

    public static class Diagnostic {
        private final Kind kind;
        private final String document;
        private final int line;
        private final String message;

        Diagnostic(Kind kind, String document, int line, String message) {
            this.kind = kind;
            this.document = document;
            this.line = line;
            this.message = message;
        }

        public Kind getKind() {
            return kind;
        }

        public String getDocument() {
            return document;
        }

        public int getLine() {
            return line;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return String.format("[%s] %s, linha %d: %s", kind, document, line, message);
        }
    }

    private final List<Diagnostic> entries = new ArrayList<>();

    public void add(Kind kind, String document, int line, String message) {
        Diagnostic d = new Diagnostic(kind, document, line, message);
        entries.add(d);
        if (kind == Kind.HOISTED_BLOCK) {
            log.info("{}", d);
        } else {
            log.warn("{}", d);
        }
    }

    public List<Diagnostic> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public long count(Kind kind) {
        return entries.stream().filter(d -> d.kind == kind).count();
    }

    /** Relatório de fim de execução */
    public String report() {
        StringBuilder sb = new StringBuilder();
        for (Kind k : Kind.values()) {
            long n = count(k);
            if (n > 0) {
                sb.append(k).append(": ").append(n).append('\n');
            }
        }
        for (Diagnostic d : entries) {
            sb.append(d).append('\n');
        }
        return sb.toString();
    }
}
