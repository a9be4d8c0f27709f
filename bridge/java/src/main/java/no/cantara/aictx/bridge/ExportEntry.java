package no.cantara.aictx.bridge;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** A declared document enriched with index metadata, as written to the adapter's context.json. */
@JsonPropertyOrder({"id", "kind", "source", "target", "version", "status", "complexity", "checksum", "tags"})
public record ExportEntry(
        String id,
        String kind,
        String source,
        String target,
        int version,
        String status,
        String complexity,
        String checksum,
        List<String> tags
) {
    public ExportEntry {
        tags = tags != null ? List.copyOf(tags) : List.of();
    }
}
