package no.cantara.aictx.bridge;

import no.cantara.aictx.AictxWorkspace;
import no.cantara.aictx.ConventionValidator;
import no.cantara.aictx.hooks.LifecycleEvent;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Map;

/**
 * CLI entry point for aictx-export.
 *
 * <pre>
 * Usage: aictx-export [--root DIR] &lt;adapter&gt;
 * </pre>
 *
 * The adapter must be enabled in {@code .aictx/config.yaml} and the convention root must validate
 * cleanly before anything is exported.
 */
public class AictxExportCli {

    private final Path cwd;
    private final PrintStream out;
    private final PrintStream err;
    private final AdapterExporter exporter;

    public AictxExportCli(Path cwd, PrintStream out, PrintStream err, AdapterExporter exporter) {
        this.cwd = cwd;
        this.out = out;
        this.err = err;
        this.exporter = exporter;
    }

    public static void main(String[] args) {
        System.exit(new AictxExportCli(Path.of(""), System.out, System.err, new AdapterExporter()).run(args));
    }

    public int run(String[] args) {
        Path explicitRoot = null;
        String adapter = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--root" -> {
                    if (++i >= args.length) return usage();
                    explicitRoot = Path.of(args[i]);
                }
                default -> {
                    if (args[i].startsWith("-") || adapter != null) return usage();
                    adapter = args[i];
                }
            }
        }
        if (adapter == null) {
            return usage();
        }

        try {
            AictxWorkspace ws = AictxWorkspace.resolve(cwd, explicitRoot);
            if (!ws.config().adapters().contains(adapter)) {
                err.println("Adapter '" + adapter + "' not in config.adapters.");
                return 1;
            }
            ConventionValidator.ValidationResult result = ConventionValidator.validate(ws.root());
            if (!result.isValid()) {
                result.errors().forEach(err::println);
                return 1;
            }
            ws.hooks().emit(LifecycleEvent.BEFORE_EXPORT, Map.of(
                    "root", ws.root(), "config", ws.config(), "index", result.index(), "adapter", adapter));
            ExportPayload payload = exporter.export(ws.root(), result.index(), adapter);
            ws.hooks().emit(LifecycleEvent.AFTER_EXPORT, Map.of(
                    "root", ws.root(), "config", ws.config(), "adapter", adapter));
            out.printf("Exported %d document(s) to %s.%n", payload.documents().size(), adapter);
            return 0;
        } catch (IOException | RuntimeException e) {
            err.println(e.getMessage());
            return 1;
        }
    }

    private int usage() {
        err.println("Usage: aictx-export [--root DIR] <adapter>");
        return 2;
    }
}
