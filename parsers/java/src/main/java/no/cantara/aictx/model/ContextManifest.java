package no.cantara.aictx.model;

import java.util.List;

/**
 * Snapshot of a convention root, persisted as manifests.yaml and as the last-build state.
 */
public record ContextManifest(
        String conventionVersion,
        String generatedAt,
        String generator,
        String rootChecksum,
        List<ManifestEntry> documents,
        List<String> activeSet,
        List<Relation> relations
) {
    public ContextManifest {
        documents = documents != null ? List.copyOf(documents) : List.of();
        activeSet = activeSet != null ? List.copyOf(activeSet) : List.of();
        relations = relations != null ? List.copyOf(relations) : List.of();
    }
}
