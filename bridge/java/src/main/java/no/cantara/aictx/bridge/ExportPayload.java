package no.cantara.aictx.bridge;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"output_dir", "documents"})
public record ExportPayload(
        @JsonProperty("output_dir") String outputDir,
        @JsonProperty("documents") List<ExportEntry> documents
) {
    public ExportPayload {
        documents = documents != null ? List.copyOf(documents) : List.of();
    }
}
