package no.cantara.aictx;

import no.cantara.aictx.model.ContextManifest;
import no.cantara.aictx.model.ManifestEntry;
import no.cantara.aictx.model.Relation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes manifests as YAML: the published {@code manifests.yaml} at the convention root
 * and the last-build copy under {@code .aictx/state/} used for diffing.
 *
 * <p>Both files are whole-file overwrites; concurrent builds against the same root are not guarded.
 */
public final class ManifestStore {

    private static final Logger log = LoggerFactory.getLogger(ManifestStore.class);

    public static final String MANIFEST_FILE = "manifests.yaml";
    public static final String STATE_DIR = "state";
    public static final String STATE_FILE = "last_manifest.yaml";

    private static final Yaml LOADER = new Yaml(new SafeConstructor(new LoaderOptions()));
    private static final Yaml DUMPER = new Yaml(dumperOptions());

    private ManifestStore() {}

    public static Path manifestPath(Path root) {
        return root.resolve(MANIFEST_FILE);
    }

    public static Path statePath(Path aictxDir) {
        return aictxDir.resolve(STATE_DIR).resolve(STATE_FILE);
    }

    public static void writeManifest(Path root, ContextManifest manifest) throws IOException {
        write(manifestPath(root), manifest);
    }

    public static void saveState(Path aictxDir, ContextManifest manifest) throws IOException {
        Path path = statePath(aictxDir);
        Files.createDirectories(path.getParent());
        write(path, manifest);
    }

    /** @return the last built manifest, or empty if no build has been recorded */
    public static Optional<ContextManifest> loadState(Path aictxDir) throws IOException {
        return read(statePath(aictxDir));
    }

    public static void write(Path path, ContextManifest manifest) throws IOException {
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            DUMPER.dump(toMap(manifest), out);
        }
        log.debug("Wrote manifest to {}", path);
    }

    public static Optional<ContextManifest> read(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            log.debug("No manifest at {}", path);
            return Optional.empty();
        }
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Map<String, Object> data = LOADER.load(in);
            return data == null ? Optional.empty() : Optional.of(fromMap(data));
        }
    }

    static Map<String, Object> toMap(ContextManifest manifest) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("convention_version", manifest.conventionVersion());
        out.put("generated_at", manifest.generatedAt());
        out.put("generator", manifest.generator());
        out.put("root_checksum", manifest.rootChecksum());
        out.put("documents", manifest.documents().stream().map(ManifestStore::entryToMap).toList());
        out.put("active_set", manifest.activeSet());
        out.put("relations", manifest.relations().stream().map(ManifestStore::relationToMap).toList());
        return out;
    }

    @SuppressWarnings("unchecked")
    static ContextManifest fromMap(Map<String, Object> data) {
        List<Map<String, Object>> docMaps = (List<Map<String, Object>>) data.getOrDefault("documents", List.of());
        List<Map<String, Object>> relMaps = (List<Map<String, Object>>) data.getOrDefault("relations", List.of());
        List<Object> active = (List<Object>) data.getOrDefault("active_set", List.of());
        return new ContextManifest(
                string(data.get("convention_version")),
                timestamp(data.get("generated_at")),
                string(data.get("generator")),
                string(data.get("root_checksum")),
                docMaps == null ? List.of() : docMaps.stream().map(ManifestStore::entryFromMap).toList(),
                active == null ? List.of() : active.stream().map(o -> String.valueOf(o)).toList(),
                relMaps == null ? List.of() : relMaps.stream().map(ManifestStore::relationFromMap).toList());
    }

    private static Map<String, Object> entryToMap(ManifestEntry e) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", e.id());
        m.put("kind", e.kind());
        m.put("path", e.path());
        m.put("version", e.version());
        m.put("status", e.status());
        m.put("complexity", e.complexity());
        m.put("checksum", e.checksum());
        m.put("tags", e.tags());
        return m;
    }

    private static ManifestEntry entryFromMap(Map<String, Object> m) {
        return new ManifestEntry(
                string(m.get("id")),
                string(m.get("kind")),
                string(m.get("path")),
                FrontmatterParser.normalizeVersion(m.get("version")),
                string(m.get("status")),
                string(m.get("complexity")),
                string(m.get("checksum")),
                FrontmatterParser.normalizeList(m.get("tags")));
    }

    private static Map<String, Object> relationToMap(Relation r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("from", r.fromId());
        m.put("to", r.toId());
        m.put("type", r.type());
        return m;
    }

    private static Relation relationFromMap(Map<String, Object> m) {
        return new Relation(string(m.get("from")), string(m.get("to")), string(m.get("type")));
    }

    private static String string(Object value) {
        return value == null ? null : value.toString();
    }

    // A hand-edited, unquoted timestamp comes back from SnakeYAML as a Date.
    private static String timestamp(Object value) {
        if (value instanceof Date d) return ManifestBuilder.TIMESTAMP.format(d.toInstant());
        return string(value);
    }

    private static DumperOptions dumperOptions() {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setAllowUnicode(true);
        options.setIndent(2);
        return options;
    }
}
