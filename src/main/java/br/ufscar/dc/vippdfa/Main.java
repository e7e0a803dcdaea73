package br.ufscar.dc.vippdfa;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Uso: [--config arquivo.json] principal.dbm diretorio_saida [formulario.frm ...]
 */
public class Main {
    public static void main(String[] args) {
        try {
            List<String> params = new ArrayList<>(Arrays.asList(args));
            TranslatorConfig config = TranslatorConfig.defaults();
            if (params.size() >= 2 && params.get(0).equals("--config")) {
                config = TranslatorConfig.load(Paths.get(params.get(1)));
                params = params.subList(2, params.size());
            }
            if (params.size() < 2) {
                System.err.println("Uso: [--config arquivo.json] principal.dbm diretorio_saida [formulario.frm ...]");
                System.exit(2);
            }

            SourceDocument main = SourceDocument.read(Paths.get(params.get(0)));
            Path saida = Paths.get(params.get(1));
            List<SourceDocument> overlays = new ArrayList<>();
            for (String f : params.subList(2, params.size())) {
                overlays.add(SourceDocument.read(Paths.get(f)));
            }

            TranslationResult result = new Translator(config).translate(main, overlays);

            Files.createDirectories(saida);
            write(saida.resolve(result.getMainName() + ".dfa"), result.getMain());
            for (Map.Entry<String, String> o : result.getOverlays().entrySet()) {
                write(saida.resolve(o.getKey() + ".dfa"), o.getValue());
            }
            write(saida.resolve(result.getMainName() + "_conflicts.json"), result.getConflicts().toJson());

            StringBuilder relatorio = new StringBuilder(result.getDiagnostics().report());
            if (!result.getResources().isEmpty()) {
                relatorio.append("Recursos referenciados:\n");
                for (String r : result.getResources()) {
                    relatorio.append("  ").append(r).append('\n');
                }
            }
            write(saida.resolve(result.getMainName() + "_report.txt"), relatorio.toString());

        } catch (TranslationException e) {
            System.err.println(e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            System.err.println("Ocorreu um erro inesperado: " + e.getMessage());
            System.exit(1);
        }
    }

    private static void write(Path file, String content) throws IOException {
        try (PrintWriter pw = new PrintWriter(file.toFile(), "UTF-8")) {
            pw.print(content);
        }
    }
}
