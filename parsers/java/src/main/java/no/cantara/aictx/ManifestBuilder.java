package no.cantara.aictx;

import no.cantara.aictx.model.ContextDocument;
import no.cantara.aictx.model.ContextManifest;
import no.cantara.aictx.model.ManifestEntry;
import no.cantara.aictx.model.Relation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds a {@link ContextManifest} from a validated index.
 *
 * <p>Every indexed document gets an entry with its own checksum. Only the root checksum is
 * restricted to the active read set:
 * <ul>
 *   <li>rules always</li>
 *   <li>specs with {@code status: active}</li>
 *   <li>task artifacts whose task directory has an active spec</li>
 * </ul>
 */
public final class ManifestBuilder {

    private static final Logger log = LoggerFactory.getLogger(ManifestBuilder.class);

    public static final String GENERATOR = "aictx 1.0";
    public static final String DEFAULT_CONVENTION_VERSION = "0.0.1";

    static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private final Clock clock;

    public ManifestBuilder() {
        this(Clock.systemUTC());
    }

    public ManifestBuilder(Clock clock) {
        this.clock = clock;
    }

    public ContextManifest build(Path root, DocumentIndex index, String conventionVersion) throws IOException {
        List<ManifestEntry> documents = new ArrayList<>();
        List<String> activeSet = new ArrayList<>();
        for (DocumentIndex.Entry entry : index.sortedEntries()) {
            ContextDocument doc = entry.document();
            documents.add(new ManifestEntry(
                    entry.key(),
                    doc.kind(),
                    relativePath(root, doc.path()),
                    doc.version(),
                    doc.status(),
                    doc.complexity(),
                    Checksums.fileChecksum(doc.path()),
                    doc.tags()));
            if (doc.isActive()) {
                activeSet.add(entry.key());
            }
        }

        ContextManifest manifest = new ContextManifest(
                conventionVersion != null ? conventionVersion : DEFAULT_CONVENTION_VERSION,
                TIMESTAMP.format(clock.instant().truncatedTo(ChronoUnit.SECONDS)),
                GENERATOR,
                rootChecksum(index),
                documents,
                activeSet,
                collectRelations(index));
        log.info("Built manifest for {}: {} document(s), {} active, root {}",
                root, documents.size(), activeSet.size(), manifest.rootChecksum());
        return manifest;
    }

    /**
     * Aggregate checksum over the active read set, fed in key order.
     */
    public static String rootChecksum(DocumentIndex index) throws IOException {
        Set<String> activeTasks = activeTaskIds(index);
        List<Path> eligible = new ArrayList<>();
        for (DocumentIndex.Entry entry : index.sortedEntries()) {
            if (isEligible(entry, activeTasks)) {
                eligible.add(entry.document().path());
            }
        }
        return Checksums.aggregate(eligible);
    }

    static boolean isEligible(DocumentIndex.Entry entry, Set<String> activeTasks) {
        ContextDocument doc = entry.document();
        if (doc.isRule()) return true;
        if (doc.isSpec()) return doc.isActive();
        if (doc.isTaskArtifact()) return entry.taskId() != null && activeTasks.contains(entry.taskId());
        return false;
    }

    /** Task names whose spec is active, derived from the {@code <task>-spec} key. */
    static Set<String> activeTaskIds(DocumentIndex index) {
        Set<String> ids = new HashSet<>();
        for (DocumentIndex.Entry entry : index.entries()) {
            ContextDocument doc = entry.document();
            if (doc.isSpec() && doc.isActive()) {
                String key = entry.key();
                ids.add(key.endsWith(ConventionValidator.TASK_SPEC_SUFFIX)
                        ? key.substring(0, key.length() - ConventionValidator.TASK_SPEC_SUFFIX.length())
                        : key);
            }
        }
        return ids;
    }

    /** One {@code uses} edge per reference, pointing at the reference as written. */
    public static List<Relation> collectRelations(DocumentIndex index) {
        List<Relation> relations = new ArrayList<>();
        for (DocumentIndex.Entry entry : index.sortedEntries()) {
            for (String ref : entry.document().references()) {
                relations.add(new Relation(entry.key(), ref, Relation.TYPE_USES));
            }
        }
        return relations;
    }

    /** Path relative to the root with forward slashes; paths outside the root are kept as given. */
    public static String relativePath(Path root, Path path) {
        Path rel = path.startsWith(root) ? root.relativize(path) : path;
        return rel.toString().replace('\\', '/');
    }
}
