package no.cantara.aictx;

import no.cantara.aictx.model.ContextDocument;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses a Markdown file with a {@code ---} delimited YAML frontmatter block into a {@link ContextDocument}.
 *
 * <p>Parsing applies defaults (version 1, empty tags and references) but does not check the
 * per-kind schema; see {@link DocumentSchema}.
 */
public final class FrontmatterParser {

    static final String DELIMITER = "---";

    // SafeConstructor keeps YAML tags from instantiating arbitrary Java types.
    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    private FrontmatterParser() {}

    /** Split result: the frontmatter mapping and the text after the closing delimiter. */
    record Split(Map<String, Object> frontmatter, String body) {}

    public static ContextDocument parse(Path path) throws IOException {
        return parse(path, Files.readString(path, StandardCharsets.UTF_8));
    }

    public static ContextDocument parse(Path path, String content) {
        Split split = split(content);
        Map<String, Object> fm = split.frontmatter();

        String id = trimmed(fm.get("id"));
        String kind = trimmed(fm.get("kind"));
        if (id == null || id.isEmpty() || kind == null || kind.isEmpty()) {
            throw new FormatException("Frontmatter must contain id and kind");
        }

        return new ContextDocument(
                path,
                id,
                kind,
                normalizeVersion(fm.get("version")),
                trimmed(fm.get("status")),
                trimmed(fm.get("complexity")),
                normalizeList(fm.get("tags")),
                normalizeList(fm.get("references")),
                trimmed(fm.get("owner")),
                split.body(),
                fm
        );
    }

    @SuppressWarnings("unchecked")
    static Split split(String content) {
        String text = content.strip();
        if (!text.startsWith(DELIMITER)) {
            throw new FormatException("Missing opening frontmatter delimiter " + DELIMITER);
        }
        String rest = stripLeadingLineBreaks(text.substring(DELIMITER.length()));
        int close = rest.indexOf("\n" + DELIMITER);
        if (close < 0) {
            throw new FormatException("Missing closing frontmatter delimiter " + DELIMITER);
        }
        String yaml = rest.substring(0, close).strip();
        String afterClose = rest.substring(close + 1 + DELIMITER.length());
        String body = stripLeadingLineBreaks(afterClose);

        Object loaded;
        try {
            loaded = YAML.load(yaml);
        } catch (YAMLException e) {
            throw new FormatException("Invalid YAML in frontmatter: " + e.getMessage(), e);
        }
        if (loaded == null) {
            return new Split(Map.of(), body);
        }
        if (!(loaded instanceof Map)) {
            throw new FormatException("Frontmatter must be a YAML mapping");
        }
        return new Split((Map<String, Object>) loaded, body);
    }

    /**
     * Coerces a frontmatter version to a positive integer. Missing, non-numeric, boolean
     * and non-positive values become 1.
     */
    static int normalizeVersion(Object value) {
        if (value == null || value instanceof Boolean) return 1;
        long parsed;
        if (value instanceof Number n) {
            parsed = n.longValue();
        } else {
            try {
                parsed = Long.parseLong(value.toString().strip());
            } catch (NumberFormatException e) {
                return 1;
            }
        }
        return parsed >= 1 && parsed <= Integer.MAX_VALUE ? (int) parsed : 1;
    }

    /** A list is stringified element-wise; a scalar becomes a one-element list. */
    static List<String> normalizeList(Object value) {
        if (value == null) return List.of();
        if (value instanceof List<?> list) {
            List<String> out = new ArrayList<>(list.size());
            for (Object o : list) {
                out.add(String.valueOf(o));
            }
            return out;
        }
        return List.of(value.toString());
    }

    private static String trimmed(Object value) {
        return value == null ? null : value.toString().strip();
    }

    private static String stripLeadingLineBreaks(String s) {
        int i = 0;
        while (i < s.length() && (s.charAt(i) == '\r' || s.charAt(i) == '\n')) i++;
        return s.substring(i);
    }
}
