package no.cantara.aictx;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import no.cantara.aictx.hooks.LifecycleEvent;
import no.cantara.aictx.model.ContextDocument;
import no.cantara.aictx.model.ContextManifest;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Command-line interface for a context-document convention root.
 *
 * <pre>
 * Usage: aictx [--root DIR] validate
 *        aictx [--root DIR] build-manifest
 *        aictx [--root DIR] list [--status S] [--kind K] [--json]
 *        aictx [--root DIR] diff [--json]
 * </pre>
 */
public class AictxCli {

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private static final String USAGE_TEXT =
            "Usage: aictx [--root DIR] <validate | build-manifest | list [--status S] [--kind K] [--json] | diff [--json]>";

    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Path cwd;
    private final PrintStream out;
    private final PrintStream err;

    public AictxCli(Path cwd, PrintStream out, PrintStream err) {
        this.cwd = cwd;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new AictxCli(Path.of(""), System.out, System.err).run(args));
    }

    public int run(String[] args) {
        Path explicitRoot = null;
        String command = null;
        String status = null;
        String kind = null;
        boolean json = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--root" -> {
                    if (++i >= args.length) return usage("--root requires a directory");
                    explicitRoot = Path.of(args[i]);
                }
                case "--status" -> {
                    if (++i >= args.length) return usage("--status requires a value");
                    status = args[i];
                }
                case "--kind" -> {
                    if (++i >= args.length) return usage("--kind requires a value");
                    kind = args[i];
                }
                case "--json" -> json = true;
                default -> {
                    if (args[i].startsWith("-") || command != null) return usage("Unexpected argument: " + args[i]);
                    command = args[i];
                }
            }
        }
        if (command == null) {
            return usage(null);
        }

        try {
            AictxWorkspace ws = AictxWorkspace.resolve(cwd, explicitRoot);
            return switch (command) {
                case "validate" -> validate(ws);
                case "build-manifest" -> buildManifest(ws);
                case "list" -> list(ws, status, kind, json);
                case "diff" -> diff(ws, json);
                default -> usage("Unknown command: " + command);
            };
        } catch (IOException | RuntimeException e) {
            err.println("Error: " + e.getMessage());
            return FAILED;
        }
    }

    int validate(AictxWorkspace ws) {
        ws.hooks().emit(LifecycleEvent.BEFORE_VALIDATE, Map.of("root", ws.root(), "config", ws.config()));
        ConventionValidator.ValidationResult result = ConventionValidator.validate(ws.root());
        ws.hooks().emit(LifecycleEvent.AFTER_VALIDATE, Map.of(
                "root", ws.root(), "config", ws.config(), "index", result.index(), "ok", result.isValid()));
        if (!result.isValid()) {
            return reportErrors(result.errors());
        }
        out.printf("Validated %d document(s).%n", result.index().size());
        return OK;
    }

    int buildManifest(AictxWorkspace ws) throws IOException {
        ConventionValidator.ValidationResult result = ConventionValidator.validate(ws.root());
        if (!result.isValid()) {
            return reportErrors(result.errors());
        }
        ws.hooks().emit(LifecycleEvent.BEFORE_BUILD_MANIFEST, Map.of(
                "root", ws.root(), "config", ws.config(), "index", result.index()));
        ContextManifest manifest = new ManifestBuilder()
                .build(ws.root(), result.index(), ws.config().conventionVersion());
        ManifestStore.writeManifest(ws.root(), manifest);
        ManifestStore.saveState(ws.aictxDir(), manifest);
        ws.hooks().emit(LifecycleEvent.AFTER_BUILD_MANIFEST, Map.of(
                "root", ws.root(), "config", ws.config(), "manifest", manifest));
        out.printf("Built manifest: %d documents, active_set=%d.%n",
                manifest.documents().size(), manifest.activeSet().size());
        return OK;
    }

    int list(AictxWorkspace ws, String status, String kind, boolean json) throws JsonProcessingException {
        ContextIndexer.IndexResult indexed = ContextIndexer.buildIndex(ws.root());
        if (indexed.hasErrors()) {
            return reportErrors(indexed.errors());
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (DocumentIndex.Entry entry : indexed.index().sortedEntries()) {
            ContextDocument doc = entry.document();
            if (status != null && !status.equals(doc.status())) continue;
            if (kind != null && !kind.equals(doc.kind())) continue;
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", entry.key());
            row.put("kind", doc.kind());
            row.put("status", doc.status());
            row.put("path", ManifestBuilder.relativePath(ws.root(), doc.path()));
            row.put("complexity", doc.complexity());
            rows.add(row);
        }

        if (json) {
            out.println(JSON.writeValueAsString(rows));
            return OK;
        }
        if (rows.isEmpty()) {
            out.println("No documents match.");
            return OK;
        }
        int wId = width(rows, "id", 2);
        int wKind = width(rows, "kind", 4);
        int wStatus = width(rows, "status", 6);
        String format = "%-" + wId + "s  %-" + wKind + "s  %-" + wStatus + "s  %s%n";
        out.printf(format, "id", "kind", "status", "path");
        for (Map<String, Object> row : rows) {
            out.printf(format, cell(row, "id"), cell(row, "kind"), cell(row, "status"), cell(row, "path"));
        }
        return OK;
    }

    int diff(AictxWorkspace ws, boolean json) throws IOException {
        ContextIndexer.IndexResult indexed = ContextIndexer.buildIndex(ws.root());
        if (indexed.hasErrors()) {
            return reportErrors(indexed.errors());
        }
        Optional<ContextManifest> last = ManifestStore.loadState(ws.aictxDir());
        if (last.isEmpty()) {
            out.println("No previous manifest in state. Run build-manifest first.");
            return OK;
        }
        ManifestDiff.DiffReport report = ManifestDiff.compare(indexed.index(), last.get());
        if (json) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("added", report.added());
            payload.put("removed", report.removed());
            payload.put("changed", report.changed());
            out.println(JSON.writeValueAsString(payload));
            return OK;
        }
        if (!report.added().isEmpty()) out.println("Added: " + String.join(", ", report.added()));
        if (!report.removed().isEmpty()) out.println("Removed: " + String.join(", ", report.removed()));
        if (!report.changed().isEmpty()) out.println("Changed: " + String.join(", ", report.changed()));
        if (report.isEmpty()) out.println("No changes.");
        return OK;
    }

    private int reportErrors(List<String> errors) {
        errors.forEach(err::println);
        return FAILED;
    }

    private int usage(String problem) {
        if (problem != null) {
            err.println(problem);
        }
        err.println(USAGE_TEXT);
        return USAGE;
    }

    private static int width(List<Map<String, Object>> rows, String key, int min) {
        int w = min;
        for (Map<String, Object> row : rows) {
            w = Math.max(w, cell(row, key).length());
        }
        return w;
    }

    private static String cell(Map<String, Object> row, String key) {
        Object v = row.get(key);
        return v == null ? "" : v.toString();
    }
}
