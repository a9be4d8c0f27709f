package no.cantara.aictx.bridge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Contents of {@code adapters/<name>/context.json}: where the export goes and exactly which
 * documents it contains. Only declared documents are ever exported.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AdapterDeclaration(
        @JsonProperty("output_dir") String outputDir,
        @JsonProperty("documents") List<DeclaredDocument> documents
) {
    public AdapterDeclaration {
        documents = documents != null ? List.copyOf(documents) : List.of();
    }

    /**
     * One declared document. {@code target} defaults to {@code source}; {@code version} and
     * {@code tags} are only used when the document is not in the index.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DeclaredDocument(
            @JsonProperty("id") String id,
            @JsonProperty("kind") String kind,
            @JsonProperty("source") String source,
            @JsonProperty("target") String target,
            @JsonProperty("version") Integer version,
            @JsonProperty("tags") List<String> tags
    ) {
        public String targetOrSource() {
            return target != null && !target.isBlank() ? target : source;
        }
    }
}
