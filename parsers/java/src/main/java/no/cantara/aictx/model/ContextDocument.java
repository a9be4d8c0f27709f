package no.cantara.aictx.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A single rule, task spec or task artifact parsed from a Markdown file with YAML frontmatter.
 *
 * <p>Known fields are typed; the full frontmatter mapping is kept in {@code rawFrontmatter}
 * so that fields this version does not understand are passed through untouched.
 */
public record ContextDocument(
        Path path,
        String id,
        String kind,
        int version,
        String status,
        String complexity,
        List<String> tags,
        List<String> references,
        String owner,
        String body,
        Map<String, Object> rawFrontmatter
) {
    public static final String KIND_RULE = "rule";
    public static final String KIND_SPEC = "spec";

    /** Kinds of the per-task artifact files that sit next to a task's spec.md. */
    public static final Set<String> TASK_ARTIFACT_KINDS =
            Set.of("context", "plan", "implementation", "review", "tests-review");

    public static final String STATUS_ACTIVE = "active";

    public ContextDocument {
        tags = tags != null ? List.copyOf(tags) : List.of();
        references = references != null ? List.copyOf(references) : List.of();
        body = body != null ? body : "";
        // SnakeYAML maps may hold null values, which Map.copyOf rejects
        rawFrontmatter = rawFrontmatter != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(rawFrontmatter))
                : Map.of();
    }

    public boolean isRule() { return KIND_RULE.equals(kind); }
    public boolean isSpec() { return KIND_SPEC.equals(kind); }
    public boolean isTaskArtifact() { return TASK_ARTIFACT_KINDS.contains(kind); }
    public boolean isActive() { return STATUS_ACTIVE.equals(status); }
}
