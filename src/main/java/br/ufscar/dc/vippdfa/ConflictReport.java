package br.ufscar.dc.vippdfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Registro estruturado das renomeações, entregue ao relatório externo */
public class ConflictReport {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static class Entry {
        private final String symbolKind;
        private final String document;
        private final String alias;
        private final String renamedTo;
        private final String keptDefinition;
        private final String renamedDefinition;

        public Entry(String symbolKind, String document, String alias, String renamedTo,
                String keptDefinition, String renamedDefinition) {
            this.symbolKind = symbolKind;
            this.document = document;
            this.alias = alias;
            this.renamedTo = renamedTo;
            this.keptDefinition = keptDefinition;
            this.renamedDefinition = renamedDefinition;
        }

        public String getSymbolKind() {
            return symbolKind;
        }

        public String getDocument() {
            return document;
        }

        public String getAlias() {
            return alias;
        }

        public String getRenamedTo() {
            return renamedTo;
        }

        public String getKeptDefinition() {
            return keptDefinition;
        }

        public String getRenamedDefinition() {
            return renamedDefinition;
        }
    }

    private final List<Entry> entries = new ArrayList<>();

    public void add(Entry entry) {
        entries.add(entry);
    }

    public List<Entry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public String toJson() throws JsonProcessingException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(this);
    }
}
