package no.cantara.aictx.bridge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import no.cantara.aictx.Checksums;
import no.cantara.aictx.DocumentIndex;
import no.cantara.aictx.model.ContextDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Exports the documents declared in {@code adapters/<name>/context.json} to the adapter's output
 * directory and writes the enriched payload next to them as {@code context.json}.
 *
 * <p>All declared sources and targets are checked before anything is written, so a bad
 * declaration leaves the output directory untouched.
 */
public final class AdapterExporter {

    private static final Logger log = LoggerFactory.getLogger(AdapterExporter.class);

    public static final String ADAPTERS_DIR = "adapters";
    public static final String CONTEXT_FILE = "context.json";

    /** A declared source file does not exist. */
    public static class SourceNotFoundException extends IOException {
        public SourceNotFoundException(String msg) { super(msg); }
    }

    /** A declared source or target resolves outside the directory it must stay in. */
    public static class PathTraversalException extends IllegalArgumentException {
        public PathTraversalException(String msg) { super(msg); }
    }

    private final ObjectMapper objectMapper;

    public AdapterExporter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public AdapterExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IllegalArgumentException if the declaration is missing or has no {@code output_dir}
     */
    public AdapterDeclaration loadDeclaration(Path root, String adapterName) throws IOException {
        Path specPath = root.resolve(ADAPTERS_DIR).resolve(adapterName).resolve(CONTEXT_FILE);
        if (!Files.isRegularFile(specPath)) {
            throw new IllegalArgumentException("Adapter spec not found: " + specPath);
        }
        AdapterDeclaration declaration;
        try (var in = Files.newBufferedReader(specPath, StandardCharsets.UTF_8)) {
            declaration = objectMapper.readValue(in, AdapterDeclaration.class);
        }
        if (declaration == null || declaration.outputDir() == null || declaration.outputDir().isBlank()) {
            throw new IllegalArgumentException("Adapter spec must contain output_dir: " + specPath);
        }
        return declaration;
    }

    /**
     * Builds the payload for a declaration, checking every source on the way.
     *
     * @throws SourceNotFoundException if any declared source is missing
     */
    public ExportPayload buildPayload(AdapterDeclaration declaration, Path root, DocumentIndex index,
                                      String adapterName) throws IOException {
        Path outputDir = outputDirectory(root, declaration.outputDir());
        Map<Path, ContextDocument> byPath = indexByPath(index);
        List<ExportEntry> entries = new ArrayList<>();

        for (AdapterDeclaration.DeclaredDocument declared : declaration.documents()) {
            String source = declared.source();
            if (source == null || source.isBlank()) {
                throw new IllegalArgumentException("Adapter " + adapterName + ": document entry missing 'source': " + declared);
            }
            Path sourcePath = contained(root, source, "source");
            if (!Files.isRegularFile(sourcePath)) {
                throw new SourceNotFoundException("Adapter " + adapterName + ": source not found: " + source);
            }
            String target = declared.targetOrSource();
            contained(outputDir, target, "target");

            Optional<ContextDocument> indexed = declared.id() != null ? index.get(declared.id()) : Optional.empty();
            if (indexed.isEmpty()) {
                indexed = Optional.ofNullable(byPath.get(sourcePath));
            }
            entries.add(indexed.isPresent()
                    ? enriched(declared, target, indexed.get())
                    : notIndexed(declared, target));
        }
        return new ExportPayload(declaration.outputDir(), entries);
    }

    /**
     * Runs a complete export for one adapter.
     *
     * @return the payload that was written to {@code <output_dir>/context.json}
     */
    public ExportPayload export(Path root, DocumentIndex index, String adapterName) throws IOException {
        AdapterDeclaration declaration = loadDeclaration(root, adapterName);
        ExportPayload payload = buildPayload(declaration, root, index, adapterName);

        Path outputDir = outputDirectory(root, payload.outputDir());
        Files.createDirectories(outputDir);
        for (ExportEntry entry : payload.documents()) {
            Path destination = outputDir.resolve(entry.target());
            if (destination.getParent() != null) {
                Files.createDirectories(destination.getParent());
            }
            Files.copy(root.resolve(entry.source()), destination,
                    StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        }
        try (Writer out = Files.newBufferedWriter(outputDir.resolve(CONTEXT_FILE), StandardCharsets.UTF_8)) {
            objectMapper.writeValue(out, payload);
        }
        log.info("Exported {} document(s) for adapter '{}' to {}", payload.documents().size(), adapterName, outputDir);
        return payload;
    }

    static Path outputDirectory(Path root, String outputDir) {
        Path p = Path.of(outputDir);
        return p.isAbsolute() ? p.normalize() : root.resolve(p).normalize();
    }

    private static ExportEntry enriched(AdapterDeclaration.DeclaredDocument declared, String target,
                                        ContextDocument doc) throws IOException {
        String checksum = Checksums.fileChecksum(doc.path());
        return new ExportEntry(
                nullToEmpty(declared.id()),
                nullToEmpty(declared.kind()),
                declared.source(),
                target,
                doc.version(),
                doc.status(),
                doc.complexity(),
                checksum,
                doc.tags());
    }

    private static ExportEntry notIndexed(AdapterDeclaration.DeclaredDocument declared, String target) {
        return new ExportEntry(
                nullToEmpty(declared.id()),
                nullToEmpty(declared.kind()),
                declared.source(),
                target,
                declared.version() != null ? declared.version() : 1,
                null,
                null,
                null,
                declared.tags());
    }

    private static Map<Path, ContextDocument> indexByPath(DocumentIndex index) {
        Map<Path, ContextDocument> byPath = new HashMap<>();
        for (DocumentIndex.Entry entry : index.entries()) {
            byPath.putIfAbsent(entry.document().path().toAbsolutePath().normalize(), entry.document());
        }
        return byPath;
    }

    private static Path contained(Path base, String relative, String what) {
        Path normalizedBase = base.toAbsolutePath().normalize();
        Path resolved = normalizedBase.resolve(relative).normalize();
        if (!resolved.startsWith(normalizedBase)) {
            throw new PathTraversalException("Path traversal attempt: " + what + " '" + relative
                    + "' escapes " + normalizedBase);
        }
        return resolved;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
