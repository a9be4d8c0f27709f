package no.cantara.aictx;

import no.cantara.aictx.model.ContextManifest;
import no.cantara.aictx.model.ManifestEntry;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Compares the live index against a previously built manifest. Read-only: neither side is modified.
 */
public final class ManifestDiff {

    private ManifestDiff() {}

    /** Keys only in the live index, only in the manifest, and in both with a different checksum; each sorted. */
    public record DiffReport(List<String> added, List<String> removed, List<String> changed) {
        public DiffReport {
            added = List.copyOf(added);
            removed = List.copyOf(removed);
            changed = List.copyOf(changed);
        }

        public boolean isEmpty() {
            return added.isEmpty() && removed.isEmpty() && changed.isEmpty();
        }
    }

    public static DiffReport compare(DocumentIndex index, ContextManifest last) throws IOException {
        Map<String, String> lastChecksums = new HashMap<>();
        for (ManifestEntry e : last.documents()) {
            if (e.id() != null) {
                lastChecksums.put(e.id(), e.checksum());
            }
        }
        Set<String> current = new TreeSet<>(index.keys());
        Set<String> previous = new TreeSet<>(lastChecksums.keySet());

        List<String> added = new ArrayList<>();
        List<String> changed = new ArrayList<>();
        for (String key : current) {
            if (!previous.contains(key)) {
                added.add(key);
                continue;
            }
            Optional<DocumentIndex.Entry> entry = index.entry(key);
            if (entry.isPresent()) {
                String now = Checksums.fileChecksum(entry.get().document().path());
                if (!Objects.equals(lastChecksums.get(key), now)) {
                    changed.add(key);
                }
            }
        }
        List<String> removed = previous.stream().filter(k -> !current.contains(k)).toList();
        return new DiffReport(added, removed, changed);
    }
}
