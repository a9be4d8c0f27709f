package no.cantara.aictx.model;

import java.util.Set;

/**
 * Complexity tier declared by a task spec. Each tier demands a fixed set of files in the task directory.
 */
public enum Complexity {
    TRIVIAL("trivial", Set.of("spec.md", "implementation.md")),
    NORMAL("normal", Set.of("spec.md", "plan.md", "implementation.md", "tests-review.md")),
    CRITICAL("critical", Set.of("spec.md", "context.md", "plan.md", "implementation.md", "review.md", "tests-review.md"));

    private final String value;
    private final Set<String> requiredFiles;

    Complexity(String value, Set<String> requiredFiles) {
        this.value = value;
        this.requiredFiles = requiredFiles;
    }

    public String value() {
        return value;
    }

    public Set<String> requiredFiles() {
        return requiredFiles;
    }

    public static boolean isValid(String value) {
        for (Complexity c : values()) {
            if (c.value.equals(value)) return true;
        }
        return false;
    }

    /**
     * Resolves a declared complexity. Anything that is not {@code trivial} or {@code critical},
     * including a missing value, is treated as {@link #NORMAL}.
     */
    public static Complexity fromValue(String value) {
        if (TRIVIAL.value.equals(value)) return TRIVIAL;
        if (CRITICAL.value.equals(value)) return CRITICAL;
        return NORMAL;
    }
}
