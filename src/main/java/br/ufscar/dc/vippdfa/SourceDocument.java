package br.ufscar.dc.vippdfa;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

/** Texto VIPP de entrada com o nome usado nas referências (SETFORM, USE FORMAT) */
public class SourceDocument {

    private final String name;
    private final String text;

    public SourceDocument(String name, String text) {
        this.name = DocumentNames.baseName(name);
        this.text = text;
    }

    /** Arquivos VIPP costumam vir em Latin-1 */
    public static SourceDocument read(Path file) throws IOException {
        return new SourceDocument(file.getFileName().toString(),
                new String(Files.readAllBytes(file), Charset.forName("ISO-8859-1")));
    }

    public String getName() {
        return name;
    }

    public String getText() {
        return text;
    }
}
