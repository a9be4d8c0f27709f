package no.cantara.aictx.model;

/**
 * A directed edge between two documents. {@code toId} is the reference exactly as written.
 */
public record Relation(
        String fromId,
        String toId,
        String type
) {
    public static final String TYPE_USES = "uses";
}
