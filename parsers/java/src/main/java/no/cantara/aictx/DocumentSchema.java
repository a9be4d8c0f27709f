package no.cantara.aictx;

import no.cantara.aictx.model.Complexity;
import no.cantara.aictx.model.ContextDocument;

import java.util.List;
import java.util.Set;

/**
 * Per-kind schema rules. Kept separate from parsing so that every file can be parsed
 * before any domain rule is evaluated.
 *
 * <ul>
 *   <li>spec: id, status and complexity required; status and complexity enum-constrained</li>
 *   <li>rule: id required</li>
 *   <li>anything else: id and kind required</li>
 * </ul>
 */
public final class DocumentSchema {

    public static final Set<String> VALID_STATUSES = Set.of("active", "historical", "obsolete");

    private DocumentSchema() {}

    /**
     * @throws SchemaException on the first violated rule for this document
     */
    public static void validate(ContextDocument doc) {
        if (doc.isSpec()) {
            requireId(doc, "spec");
            if (doc.status() == null) {
                throw new SchemaException(doc.path(), "spec requires field: status");
            }
            if (doc.complexity() == null) {
                throw new SchemaException(doc.path(), "spec requires field: complexity");
            }
            if (!VALID_STATUSES.contains(doc.status())) {
                throw new SchemaException(doc.path(), "status must be one of " + sorted(VALID_STATUSES)
                        + ", got '" + doc.status() + "'");
            }
            if (!Complexity.isValid(doc.complexity())) {
                throw new SchemaException(doc.path(), "complexity must be one of [critical, normal, trivial], got '"
                        + doc.complexity() + "'");
            }
        } else if (doc.isRule()) {
            requireId(doc, "rule");
        } else if (isBlank(doc.id()) || isBlank(doc.kind())) {
            throw new SchemaException(doc.path(), "document must have id and kind");
        }
    }

    private static void requireId(ContextDocument doc, String kind) {
        if (isBlank(doc.id())) {
            throw new SchemaException(doc.path(), kind + " requires field: id");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static List<String> sorted(Set<String> set) {
        return set.stream().sorted().toList();
    }
}
