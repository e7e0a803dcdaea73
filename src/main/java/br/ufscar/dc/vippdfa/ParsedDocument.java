package br.ufscar.dc.vippdfa;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Documento analisado: árvore de comandos de nível superior e metadados %% */
public class ParsedDocument {

    public enum Role {
        MAIN,
        OVERLAY
    }

    private final String name;
    private final Role role;
    private final List<Command> commands;
    private final Map<String, String> metadata;

    public ParsedDocument(String name, Role role, List<Command> commands, Map<String, String> metadata) {
        this.name = name;
        this.role = role;
        this.commands = commands;
        this.metadata = Collections.unmodifiableMap(metadata);
    }

    public String getName() {
        return name;
    }

    public Role getRole() {
        return role;
    }

    public List<Command> getCommands() {
        return commands;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }
}
