package no.cantara.aictx;

import no.cantara.aictx.model.ContextDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Walks a convention root and builds a {@link DocumentIndex}.
 *
 * <pre>
 * root/
 *   rules/*.md                 rule documents, keyed by their own id
 *   tasks/&lt;task&gt;/spec.md        a task; keyed &lt;task&gt;-spec
 *   tasks/&lt;task&gt;/plan.md ...    artifacts; keyed &lt;task&gt;-&lt;artifact&gt;
 * </pre>
 *
 * <p>A bad file never aborts the walk: each failure becomes one entry in
 * {@link IndexResult#errors()} and indexing continues.
 */
public final class ContextIndexer {

    private static final Logger log = LoggerFactory.getLogger(ContextIndexer.class);

    public static final String RULES_DIR = "rules";
    public static final String TASKS_DIR = "tasks";
    public static final String SPEC_FILE = "spec.md";

    /** Artifact files looked up next to spec.md, in indexing order. */
    public static final List<String> ARTIFACT_FILES =
            List.of("context.md", "plan.md", "implementation.md", "review.md", "tests-review.md");

    private ContextIndexer() {}

    /**
     * @param index  documents indexed so far; first occurrence of each key wins
     * @param errors parse and duplicate-key errors in discovery order
     */
    public record IndexResult(DocumentIndex index, List<String> errors) {
        public IndexResult {
            errors = List.copyOf(errors);
        }

        public boolean hasErrors() { return !errors.isEmpty(); }
    }

    public static IndexResult buildIndex(Path root) {
        DocumentIndex index = new DocumentIndex();
        List<String> errors = new ArrayList<>();

        for (Path rulePath : ruleFiles(root, errors)) {
            ContextDocument doc = parseInto(rulePath, errors);
            if (doc != null) {
                addOrReport(index, errors, rulePath, doc.id(), doc, null);
            }
        }

        for (Path taskDir : taskDirectories(root, errors)) {
            String taskId = taskDir.getFileName().toString();
            Path specPath = taskDir.resolve(SPEC_FILE);
            ContextDocument spec = parseInto(specPath, errors);
            if (spec != null) {
                addOrReport(index, errors, specPath, taskId + "-spec", spec, taskId);
            }

            for (String artifact : ARTIFACT_FILES) {
                Path artifactPath = taskDir.resolve(artifact);
                if (!Files.exists(artifactPath)) {
                    continue;
                }
                ContextDocument doc = parseInto(artifactPath, errors);
                if (doc != null) {
                    addOrReport(index, errors, artifactPath, taskId + "-" + stripExtension(artifact), doc, taskId);
                }
            }
        }

        log.debug("Indexed {} document(s) under {} with {} error(s)", index.size(), root, errors.size());
        return new IndexResult(index, errors);
    }

    /** All {@code *.md} files directly under {@code rules/}, sorted by name. */
    public static List<Path> ruleFiles(Path root) {
        return ruleFiles(root, new ArrayList<>());
    }

    static List<Path> ruleFiles(Path root, List<String> errors) {
        Path rulesDir = root.resolve(RULES_DIR);
        if (!Files.isDirectory(rulesDir)) {
            return List.of();
        }
        return list(rulesDir, errors).stream()
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(".md"))
                .toList();
    }

    /** Immediate subdirectories of {@code tasks/} that contain a spec.md, sorted by name. */
    public static List<Path> taskDirectories(Path root) {
        return taskDirectories(root, new ArrayList<>());
    }

    static List<Path> taskDirectories(Path root, List<String> errors) {
        Path tasksDir = root.resolve(TASKS_DIR);
        if (!Files.isDirectory(tasksDir)) {
            return List.of();
        }
        return list(tasksDir, errors).stream()
                .filter(Files::isDirectory)
                .filter(dir -> Files.exists(dir.resolve(SPEC_FILE)))
                .toList();
    }

    private static ContextDocument parseInto(Path path, List<String> errors) {
        try {
            ContextDocument doc = FrontmatterParser.parse(path);
            log.debug("Parsed {} (id={}, kind={})", path, doc.id(), doc.kind());
            return doc;
        } catch (IOException | UncheckedIOException | IllegalArgumentException e) {
            errors.add(path + ": " + e.getMessage());
            return null;
        }
    }

    private static void addOrReport(DocumentIndex index, List<String> errors, Path path,
                                    String key, ContextDocument doc, String taskId) {
        if (!index.add(key, doc, taskId)) {
            errors.add(path + ": duplicate key " + key);
        }
    }

    /** Sorted children of {@code dir}; a directory that cannot be read is reported and treated as empty. */
    static List<Path> list(Path dir, List<String> errors) {
        try (Stream<Path> children = Files.list(dir)) {
            return children.sorted().toList();
        } catch (IOException | UncheckedIOException e) {
            log.warn("Cannot list {}", dir, e);
            errors.add(dir + ": cannot list directory: " + e.getMessage());
            return List.of();
        }
    }

    private static String stripExtension(String fileName) {
        return fileName.endsWith(".md") ? fileName.substring(0, fileName.length() - 3) : fileName;
    }
}
