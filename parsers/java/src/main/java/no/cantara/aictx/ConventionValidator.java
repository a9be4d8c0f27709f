package no.cantara.aictx;

import no.cantara.aictx.model.Complexity;
import no.cantara.aictx.model.ContextDocument;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Validates a convention root: frontmatter schema, required task files and reference integrity.
 *
 * <p>Parse errors from indexing short-circuit everything else. Otherwise the three checks run
 * independently and their errors are concatenated in a fixed order: schema, required files,
 * references.
 */
public final class ConventionValidator {

    static final String TASK_SPEC_SUFFIX = "-spec";

    private ConventionValidator() {}

    /**
     * @param errors every problem found, in report order
     * @param index  the index the checks ran against, returned even when invalid
     */
    public record ValidationResult(List<String> errors, DocumentIndex index) {
        public ValidationResult {
            errors = List.copyOf(errors);
        }

        public boolean isValid() { return errors.isEmpty(); }
    }

    public static ValidationResult validate(Path root) {
        ContextIndexer.IndexResult indexed = ContextIndexer.buildIndex(root);
        if (indexed.hasErrors()) {
            return new ValidationResult(indexed.errors(), indexed.index());
        }
        DocumentIndex index = indexed.index();

        List<String> errors = new ArrayList<>();
        errors.addAll(validateSchemas(index));
        errors.addAll(validateRequiredFiles(root, index));
        errors.addAll(validateReferences(index));
        return new ValidationResult(errors, index);
    }

    static List<String> validateSchemas(DocumentIndex index) {
        List<String> errors = new ArrayList<>();
        for (DocumentIndex.Entry entry : index.entries()) {
            try {
                DocumentSchema.validate(entry.document());
            } catch (SchemaException e) {
                errors.add(e.getMessage());
            }
        }
        return errors;
    }

    /**
     * Every task with an indexed spec must carry the files its complexity tier demands.
     * A spec without a complexity is held to the {@code normal} tier.
     */
    static List<String> validateRequiredFiles(Path root, DocumentIndex index) {
        List<String> errors = new ArrayList<>();
        for (Path taskDir : ContextIndexer.taskDirectories(root)) {
            Optional<ContextDocument> spec = index.get(taskDir.getFileName() + TASK_SPEC_SUFFIX);
            if (spec.isEmpty()) {
                continue;
            }
            String declared = spec.get().complexity() != null
                    ? spec.get().complexity()
                    : Complexity.NORMAL.value();
            List<String> required = Complexity.fromValue(declared).requiredFiles().stream().sorted().toList();
            for (String file : required) {
                Path expected = taskDir.resolve(file);
                if (!Files.exists(expected)) {
                    errors.add(expected + ": required file missing (complexity=" + declared + ")");
                }
            }
        }
        return errors;
    }

    static List<String> validateReferences(DocumentIndex index) {
        List<String> errors = new ArrayList<>();
        for (DocumentIndex.Entry entry : index.entries()) {
            for (String ref : entry.document().references()) {
                if (!referenceExists(ref, index)) {
                    errors.add(entry.document().path() + ": reference to unknown id " + ref);
                }
            }
        }
        return errors;
    }

    /**
     * A reference resolves when it is an index key, or when it names a task whose spec is indexed
     * ({@code ref + "-spec"}). The fallback is one-directional.
     */
    public static boolean referenceExists(String ref, DocumentIndex index) {
        return index.containsKey(ref) || index.containsKey(ref + TASK_SPEC_SUFFIX);
    }
}
