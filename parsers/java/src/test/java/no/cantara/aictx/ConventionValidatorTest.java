package no.cantara.aictx;

import no.cantara.aictx.model.ContextDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static no.cantara.aictx.Fixtures.artifact;
import static no.cantara.aictx.Fixtures.rule;
import static no.cantara.aictx.Fixtures.spec;
import static no.cantara.aictx.Fixtures.task;
import static no.cantara.aictx.Fixtures.write;
import static org.junit.jupiter.api.Assertions.*;

class ConventionValidatorTest {

    @TempDir Path root;

    @Test
    void validTreePasses() {
        write(root, "rules/r1.md", rule("R1", "x"));
        task(root, "TASK-1", "active", "normal");
        task(root, "TASK-2", "historical", "critical");

        ConventionValidator.ValidationResult result = ConventionValidator.validate(root);
        assertTrue(result.isValid(), () -> String.join("\n", result.errors()));
        assertEquals(1 + 4 + 6, result.index().size());
    }

    // -----------------------------------------------------------------------
    // Schema
    // -----------------------------------------------------------------------

    @Test
    void specWithoutStatusFailsNamingTheDocument() {
        write(root, "tasks/T1/spec.md", "---\nid: T1\nkind: spec\ncomplexity: trivial\n---\n");
        write(root, "tasks/T1/implementation.md", artifact("i", "implementation"));

        ConventionValidator.ValidationResult result = ConventionValidator.validate(root);
        assertFalse(result.isValid());
        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).contains("T1"));
        assertTrue(result.errors().get(0).contains("status"));
    }

    @Test
    void specWithUnknownStatusFails() {
        write(root, "tasks/T1/spec.md", spec("T1", "draft", "trivial"));
        write(root, "tasks/T1/implementation.md", artifact("i", "implementation"));

        ConventionValidator.ValidationResult result = ConventionValidator.validate(root);
        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).contains("status must be one of [active, historical, obsolete]"));
        assertTrue(result.errors().get(0).contains("'draft'"));
    }

    @Test
    void specWithUnknownComplexityFailsSchemaAndIsHeldToNormalFiles() {
        write(root, "tasks/T1/spec.md", spec("T1", "active", "huge"));
        write(root, "tasks/T1/implementation.md", artifact("i", "implementation"));

        ConventionValidator.ValidationResult result = ConventionValidator.validate(root);
        List<String> errors = result.errors();
        assertTrue(errors.get(0).contains("complexity must be one of"));
        assertEquals(3, errors.size());
        assertTrue(errors.get(1).contains("plan.md") && errors.get(1).contains("complexity=huge"));
        assertTrue(errors.get(2).contains("tests-review.md"));
    }

    @Test
    void ruleWithoutStatusIsFine() {
        write(root, "rules/r1.md", rule("R1", "x"));
        assertTrue(ConventionValidator.validate(root).isValid());
    }

    @Test
    void schemaRulesByKind() {
        Path p = Path.of("x.md");
        assertThrows(SchemaException.class, () -> DocumentSchema.validate(
                new ContextDocument(p, "S", "spec", 1, "active", null, null, null, null, "", null)));
        assertDoesNotThrow(() -> DocumentSchema.validate(
                new ContextDocument(p, "N", "note", 1, null, null, null, null, null, "", null)));
        SchemaException e = assertThrows(SchemaException.class, () -> DocumentSchema.validate(
                new ContextDocument(p, "", "rule", 1, null, null, null, null, null, "", null)));
        assertEquals(p, e.path());
        assertTrue(e.getMessage().contains("rule requires field: id"));
    }

    // -----------------------------------------------------------------------
    // Required files
    // -----------------------------------------------------------------------

    @Test
    void criticalTaskMissingReviewFails() throws IOException {
        task(root, "T1", "active", "critical");
        Files.delete(root.resolve("tasks/T1/review.md"));

        ConventionValidator.ValidationResult result = ConventionValidator.validate(root);
        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).endsWith("review.md: required file missing (complexity=critical)"));
    }

    @Test
    void trivialTaskWithSpecAndImplementationPasses() {
        write(root, "tasks/T1/spec.md", spec("T1", "active", "trivial"));
        write(root, "tasks/T1/implementation.md", artifact("i", "implementation"));
        assertTrue(ConventionValidator.validate(root).isValid());
    }

    @Test
    void sameTaskFailsOnceUpgradedToCritical() {
        write(root, "tasks/T1/spec.md", spec("T1", "active", "critical"));
        write(root, "tasks/T1/implementation.md", artifact("i", "implementation"));

        List<String> errors = ConventionValidator.validate(root).errors();
        assertEquals(4, errors.size());
        assertTrue(errors.stream().allMatch(e -> e.contains("complexity=critical")));
    }

    @Test
    void requiredFileErrorsFollowTaskDirectoryOrder() {
        write(root, "tasks/B/spec.md", spec("B", "active", "trivial"));
        write(root, "tasks/A/spec.md", spec("A", "active", "trivial"));

        List<String> errors = ConventionValidator.validate(root).errors();
        assertEquals(2, errors.size());
        assertTrue(errors.get(0).contains(Path.of("tasks", "A").toString()));
        assertTrue(errors.get(1).contains(Path.of("tasks", "B").toString()));
    }

    // -----------------------------------------------------------------------
    // References
    // -----------------------------------------------------------------------

    @Test
    void referenceResolvesByKeyOrTaskSpecFallback() {
        write(root, "rules/r1.md", "---\nid: R1\nkind: rule\nreferences: [R2, TASK-7]\n---\n");
        write(root, "rules/r2.md", rule("R2", "x"));
        write(root, "tasks/TASK-7/spec.md", spec("TASK-7", "active", "trivial"));
        write(root, "tasks/TASK-7/implementation.md", artifact("i", "implementation"));

        assertTrue(ConventionValidator.validate(root).isValid());
    }

    @Test
    void referenceByFullTaskKeyResolves() {
        DocumentIndex index = new DocumentIndex();
        index.add("TASK-7-spec", FrontmatterParser.parse(Path.of("s.md"), spec("TASK-7", "active", "trivial")), "TASK-7");
        assertTrue(ConventionValidator.referenceExists("TASK-7", index));
        assertTrue(ConventionValidator.referenceExists("TASK-7-spec", index));
        assertFalse(ConventionValidator.referenceExists("TASK", index));
    }

    @Test
    void unknownReferenceFailsExactlyOnce() {
        write(root, "rules/r1.md", "---\nid: R1\nkind: rule\nreferences: GHOST\n---\n");

        ConventionValidator.ValidationResult result = ConventionValidator.validate(root);
        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).endsWith("reference to unknown id GHOST"));
    }

    // -----------------------------------------------------------------------
    // Aggregation
    // -----------------------------------------------------------------------

    @Test
    void parseErrorsShortCircuitOtherChecks() {
        write(root, "rules/broken.md", "no frontmatter");
        write(root, "rules/r1.md", "---\nid: R1\nkind: rule\nreferences: [GHOST]\n---\n");

        ConventionValidator.ValidationResult result = ConventionValidator.validate(root);
        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).contains("broken.md"));
        assertTrue(result.index().containsKey("R1"));
    }

    @Test
    void domainErrorsAreAggregatedInFixedOrder() {
        write(root, "rules/r1.md", "---\nid: R1\nkind: rule\nreferences: [GHOST]\n---\n");
        write(root, "tasks/T1/spec.md", "---\nid: T1\nkind: spec\nstatus: active\n---\n");

        List<String> errors = ConventionValidator.validate(root).errors();
        assertEquals(1 + 3 + 1, errors.size());
        assertTrue(errors.get(0).contains("requires field: complexity"));
        assertTrue(errors.get(1).contains("required file missing (complexity=normal)"));
        assertTrue(errors.get(4).contains("GHOST"));
    }
}
