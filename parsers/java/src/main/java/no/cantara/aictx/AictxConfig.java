package no.cantara.aictx;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Settings from {@code .aictx/config.yaml}.
 *
 * @param conventionVersion written into every manifest
 * @param adapters          export adapters that may be run
 * @param plugins           ids of lifecycle plugins to activate
 */
public record AictxConfig(
        String conventionVersion,
        List<String> adapters,
        List<String> plugins
) {
    public static final String AICTX_DIR = ".aictx";
    public static final String CONFIG_FILE = "config.yaml";
    public static final List<String> DEFAULT_ADAPTERS = List.of("cursor", "copilot");

    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    public AictxConfig {
        conventionVersion = conventionVersion != null ? conventionVersion : ManifestBuilder.DEFAULT_CONVENTION_VERSION;
        adapters = adapters != null && !adapters.isEmpty() ? List.copyOf(adapters) : DEFAULT_ADAPTERS;
        plugins = plugins != null ? List.copyOf(plugins) : List.of();
    }

    public static AictxConfig defaults() {
        return new AictxConfig(null, null, null);
    }

    public static AictxConfig load(Path aictxDir) throws IOException {
        Path file = aictxDir.resolve(CONFIG_FILE);
        if (!Files.isRegularFile(file)) {
            return defaults();
        }
        Object data;
        try (InputStream is = Files.newInputStream(file)) {
            data = YAML.load(is);
        }
        if (data != null && !(data instanceof Map)) {
            throw new IllegalArgumentException(file + ": config must be a YAML mapping");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) data;
        return fromMap(map);
    }

    static AictxConfig fromMap(Map<String, Object> data) {
        if (data == null) {
            return defaults();
        }
        Object version = data.get("convention_version");
        return new AictxConfig(
                version != null ? version.toString() : null,
                FrontmatterParser.normalizeList(data.get("adapters")),
                FrontmatterParser.normalizeList(data.get("plugins")));
    }

    /** Walks upward from {@code start} to the first directory holding {@code .aictx/}. */
    public static Optional<Path> findAictxDir(Path start) {
        for (Path current = start.toAbsolutePath().normalize(); current != null; current = current.getParent()) {
            Path candidate = current.resolve(AICTX_DIR);
            if (Files.isDirectory(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves the convention root: {@code explicitRoot} if given, else the nearest directory at or
     * above {@code start} holding {@code manifests.yaml}, {@code rules/} or {@code tasks/}, else {@code start}.
     */
    public static Path findConventionRoot(Path start, Path explicitRoot) {
        if (explicitRoot != null) {
            return explicitRoot.toAbsolutePath().normalize();
        }
        Path origin = start.toAbsolutePath().normalize();
        for (Path current = origin; current != null; current = current.getParent()) {
            if (Files.exists(current.resolve(ManifestStore.MANIFEST_FILE))
                    || Files.isDirectory(current.resolve(ContextIndexer.RULES_DIR))
                    || Files.isDirectory(current.resolve(ContextIndexer.TASKS_DIR))) {
                return current;
            }
        }
        return origin;
    }
}
