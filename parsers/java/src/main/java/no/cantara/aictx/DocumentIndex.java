package no.cantara.aictx;

import no.cantara.aictx.model.ContextDocument;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Key to document mapping built by {@link ContextIndexer}. Iteration follows discovery order;
 * use {@link #sortedEntries()} wherever output order matters.
 */
public final class DocumentIndex {

    /**
     * @param key      unique index key: a rule's own id, or {@code <task>-<artifact>} for task files
     * @param document the parsed document
     * @param taskId   name of the owning task directory, or {@code null} for rules
     */
    public record Entry(String key, ContextDocument document, String taskId) {}

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    /** @return false, leaving the index untouched, if the key is already taken */
    boolean add(String key, ContextDocument document, String taskId) {
        if (entries.containsKey(key)) {
            return false;
        }
        entries.put(key, new Entry(key, document, taskId));
        return true;
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public Optional<ContextDocument> get(String key) {
        Entry e = entries.get(key);
        return e == null ? Optional.empty() : Optional.of(e.document());
    }

    public Optional<Entry> entry(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public Collection<Entry> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    public List<Entry> sortedEntries() {
        return entries.values().stream()
                .sorted(Comparator.comparing(Entry::key))
                .toList();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
