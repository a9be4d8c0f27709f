package no.cantara.aictx.model;

import java.util.List;

/**
 * One document line in a manifest. {@code id} is the index key, not necessarily the frontmatter id.
 */
public record ManifestEntry(
        String id,
        String kind,
        String path,
        int version,
        String status,
        String complexity,
        String checksum,
        List<String> tags
) {
    public ManifestEntry {
        tags = tags != null ? List.copyOf(tags) : List.of();
    }
}
