package io.cortexr.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cortexr.config.CortexProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Append-only similarity index over past (question, final answer) pairs.
 *
 * <p>Completed session logs under {@code cortex.memory.sessions-dir} are scanned for a
 * {@code run_metadata} item carrying the user query and a successful {@code final_answer}.
 * Each pair is embedded as {@code "User Question: q\nFinal Answer: a"} and appended.
 * Search is brute force over squared L2 distance.</p>
 *
 * <p>On disk the index is two files in {@code cortex.memory.index-dir}:</p>
 * <pre>
 *   vectors.bin    int dimension, int count, count x dimension float32 (big-endian)
 *   metadata.json  [{user_query, final_answer, source_file, timestamp}, ...]
 * </pre>
 * <p>The vector file is written before the metadata, each through a temp file and an atomic
 * move. A crash between the two leaves more vectors than metadata entries, which is repaired
 * on load by truncating the vectors. All reads and writes hold one lock.</p>
 */
@Component
public class MemoryIndex {

    private static final Logger log = LoggerFactory.getLogger(MemoryIndex.class);

    static final String VECTORS_FILE = "vectors.bin";
    static final String METADATA_FILE = "metadata.json";

    private static final TypeReference<List<IndexEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private final Path sessionsDir;
    private final Path indexDir;
    private final int defaultMaxResults;
    private final double defaultThreshold;
    private final EmbeddingModel embeddingModel;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();

    private final List<float[]> vectors = new ArrayList<>();
    private final List<IndexEntry> entries = new ArrayList<>();
    private final Set<String> indexedFiles = new HashSet<>();
    // Files that cannot yield a pair, keyed to the modification time at which they were read
    private final Map<String, FileTime> skippedFiles = new HashMap<>();
    private int dimension;

    public MemoryIndex(CortexProperties properties, EmbeddingModel embeddingModel, ObjectMapper objectMapper) {
        CortexProperties.Memory memory = properties.memory();
        this.sessionsDir = Path.of(memory.sessionsDir());
        this.indexDir = Path.of(memory.indexDir());
        this.defaultMaxResults = memory.injectionMaxResults();
        this.defaultThreshold = memory.injectionDistanceThreshold();
        this.embeddingModel = embeddingModel;
        this.objectMapper = objectMapper;
    }

    /**
     * Loads the persisted index, repairing or rebuilding it when the two files disagree.
     */
    @PostConstruct
    public void load() {
        lock.lock();
        try {
            clear();
            Path vectorsPath = indexDir.resolve(VECTORS_FILE);
            Path metadataPath = indexDir.resolve(METADATA_FILE);
            if (!Files.exists(vectorsPath) || !Files.exists(metadataPath)) {
                log.info("No existing memory index in {}, will build on first refresh", indexDir.toAbsolutePath());
                return;
            }

            List<IndexEntry> storedEntries;
            StoredVectors stored;
            try {
                storedEntries = objectMapper.readValue(metadataPath.toFile(), ENTRY_LIST);
                stored = readVectors(vectorsPath);
            } catch (IOException | RuntimeException e) {
                log.warn("Memory index in {} is unreadable ({}), rebuilding", indexDir, e.getMessage());
                rebuild();
                return;
            }

            if (stored.rows().size() < storedEntries.size()) {
                log.warn("Memory index has {} vectors for {} entries, rebuilding",
                        stored.rows().size(), storedEntries.size());
                rebuild();
                return;
            }
            List<float[]> rows = stored.rows();
            if (rows.size() > storedEntries.size()) {
                log.warn("Memory index has {} vectors for {} entries, truncating vectors",
                        rows.size(), storedEntries.size());
                rows = new ArrayList<>(rows.subList(0, storedEntries.size()));
            }

            dimension = stored.dimension();
            vectors.addAll(rows);
            entries.addAll(storedEntries);
            for (IndexEntry entry : storedEntries) {
                indexedFiles.add(entry.sourceFile());
            }
            if (rows.size() != stored.rows().size()) {
                persist();
            }
            log.info("Loaded memory index with {} entries", entries.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Indexes session logs that are not indexed yet.
     *
     * @return the number of pairs added
     * @throws IndexUnavailableException if the embedding model fails
     */
    public int ensureFresh() {
        lock.lock();
        try {
            if (!Files.isDirectory(sessionsDir)) {
                return 0;
            }
            List<Path> candidates;
            try (Stream<Path> files = Files.walk(sessionsDir)) {
                candidates = files
                        .filter(Files::isRegularFile)
                        .filter(p -> p.getFileName().toString().endsWith(".json"))
                        .filter(p -> !indexedFiles.contains(sourceKey(p)))
                        .sorted()
                        .toList();
            } catch (IOException e) {
                log.warn("Failed to scan session logs in {}: {}", sessionsDir, e.getMessage());
                return 0;
            }

            int added = 0;
            for (Path file : candidates) {
                IndexEntry entry = extractPair(file);
                if (entry == null) {
                    continue;
                }
                float[] vector = embed(entry.embeddingText());
                if (dimension == 0) {
                    dimension = vector.length;
                } else if (vector.length != dimension) {
                    log.warn("Embedding dimension {} does not match index dimension {}, skipping {}",
                            vector.length, dimension, entry.sourceFile());
                    skippedFiles.put(entry.sourceFile(), FileTime.from(entry.timestamp()));
                    continue;
                }
                vectors.add(vector);
                entries.add(entry);
                indexedFiles.add(entry.sourceFile());
                added++;
            }
            if (added > 0) {
                persist();
                log.info("Indexed {} new session(s), {} entries total", added, entries.size());
            }
            return added;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the {@code k} nearest pairs by squared L2 distance, nearest first.
     *
     * @throws IndexUnavailableException if the embedding model fails
     */
    public List<IndexHit> search(String query, int k) {
        if (k <= 0) {
            return List.of();
        }
        ensureFresh();
        lock.lock();
        try {
            if (entries.isEmpty()) {
                return List.of();
            }
            float[] target = embed(query);
            if (target.length != dimension) {
                throw new IndexUnavailableException("Query embedding dimension " + target.length
                        + " does not match index dimension " + dimension, null);
            }
            List<IndexHit> hits = new ArrayList<>(entries.size());
            for (int i = 0; i < entries.size(); i++) {
                hits.add(new IndexHit(entries.get(i), squaredL2(target, vectors.get(i))));
            }
            hits.sort(Comparator.comparingDouble(IndexHit::distance));
            return List.copyOf(hits.subList(0, Math.min(k, hits.size())));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Prepends relevant past conversations to the query. Only hits with a distance strictly
     * below {@code threshold} count; when none qualify, or the index is unavailable, the
     * query is returned unchanged.
     */
    public String selectForInjection(String query, int k, double threshold) {
        List<IndexHit> hits;
        try {
            hits = search(query, k);
        } catch (IndexUnavailableException e) {
            log.warn("Memory index unavailable, skipping context injection: {}", e.getMessage());
            return query;
        }

        List<IndexHit> relevant = hits.stream()
                .filter(hit -> hit.distance() < threshold)
                .toList();
        if (relevant.isEmpty()) {
            return query;
        }

        StringBuilder context = new StringBuilder("Relevant past conversations for context:\n");
        for (IndexHit hit : relevant) {
            context.append("- User asked: '").append(hit.entry().userQuery()).append("'\n");
            context.append("  Agent answered: '").append(hit.entry().finalAnswer()).append("'\n");
        }
        log.info("Injecting {} relevant historical Q&A pair(s)", relevant.size());
        return context + "\nUser task: " + query;
    }

    /**
     * {@link #selectForInjection(String, int, double)} with the configured defaults.
     */
    public String selectForInjection(String query) {
        return selectForInjection(query, defaultMaxResults, defaultThreshold);
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    // --- Internal ---

    private void clear() {
        vectors.clear();
        entries.clear();
        indexedFiles.clear();
        skippedFiles.clear();
        dimension = 0;
    }

    private void rebuild() {
        clear();
        try {
            Files.deleteIfExists(indexDir.resolve(VECTORS_FILE));
            Files.deleteIfExists(indexDir.resolve(METADATA_FILE));
        } catch (IOException e) {
            log.warn("Failed to remove stale memory index files: {}", e.getMessage());
        }
        try {
            ensureFresh();
        } catch (IndexUnavailableException e) {
            log.warn("Memory index rebuild deferred: {}", e.getMessage());
        }
    }

    /**
     * Reads the question/answer pair of a session log: a start record with the user query,
     * followed by a successful final answer for the same query. Files that are malformed, or
     * finished without such a pair, are not read again until they change.
     */
    private IndexEntry extractPair(Path file) {
        String key = sourceKey(file);
        FileTime modified;
        List<MemoryItem> items;
        try {
            modified = Files.getLastModifiedTime(file);
            if (modified.equals(skippedFiles.get(key))) {
                return null;
            }
            items = SessionMemoryLog.read(file, objectMapper);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Skipping malformed session log {}: {}", file, e.getMessage());
            try {
                skippedFiles.put(key, Files.getLastModifiedTime(file));
            } catch (IOException unreadable) {
                log.debug("Cannot stat {}, will retry on next refresh: {}", file, unreadable.getMessage());
                skippedFiles.remove(key);
            }
            return null;
        }

        String startQuery = null;
        String userQuery = null;
        String finalAnswer = null;
        boolean finished = false;
        for (MemoryItem item : items) {
            if (item == null) {
                continue;
            }
            if (item.isType(MemoryItem.RUN_METADATA) && item.userQuery() != null && !item.userQuery().isBlank()) {
                startQuery = item.userQuery();
            } else if (item.isType(MemoryItem.FINAL_ANSWER)) {
                finished = true;
                if (item.isSuccessful() && startQuery != null && startQuery.equals(item.userQuery())
                        && !item.text().isBlank()) {
                    userQuery = startQuery;
                    finalAnswer = item.text();
                }
            }
        }
        if (finalAnswer == null) {
            if (finished) {
                log.debug("Session log {} finished without a successful answer, skipping", file);
                skippedFiles.put(key, modified);
            } else {
                log.debug("Session log {} has no complete question/answer pair yet", file);
            }
            return null;
        }
        return new IndexEntry(userQuery, finalAnswer, key, modified.toInstant());
    }

    private String sourceKey(Path file) {
        return sessionsDir.relativize(file).toString().replace('\\', '/');
    }

    private float[] embed(String text) {
        try {
            float[] vector = embeddingModel.embed(text);
            if (vector == null || vector.length == 0) {
                throw new IndexUnavailableException("Embedding model returned an empty vector", null);
            }
            return vector;
        } catch (IndexUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IndexUnavailableException("Embedding failed: " + e.getMessage(), e);
        }
    }

    static double squaredL2(float[] a, float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = (double) a[i] - (double) b[i];
            sum += d * d;
        }
        return sum;
    }

    private void persist() {
        try {
            Files.createDirectories(indexDir);
            Path vectorsTmp = indexDir.resolve(VECTORS_FILE + ".tmp");
            try (OutputStream os = Files.newOutputStream(vectorsTmp);
                 DataOutputStream out = new DataOutputStream(new BufferedOutputStream(os))) {
                out.writeInt(dimension);
                out.writeInt(vectors.size());
                for (float[] row : vectors) {
                    for (float value : row) {
                        out.writeFloat(value);
                    }
                }
            }
            Files.move(vectorsTmp, indexDir.resolve(VECTORS_FILE),
                    StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

            Path metadataTmp = indexDir.resolve(METADATA_FILE + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(metadataTmp.toFile(), entries);
            Files.move(metadataTmp, indexDir.resolve(METADATA_FILE),
                    StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Failed to save memory index to {}", indexDir, e);
        }
    }

    private static StoredVectors readVectors(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path);
             DataInputStream in = new DataInputStream(new BufferedInputStream(is))) {
            int dimension = in.readInt();
            int count = in.readInt();
            if (dimension < 0 || count < 0) {
                throw new IOException("corrupt vector header");
            }
            List<float[]> rows = new ArrayList<>(Math.min(count, 10_000));
            try {
                for (int i = 0; i < count; i++) {
                    float[] row = new float[dimension];
                    for (int j = 0; j < dimension; j++) {
                        row[j] = in.readFloat();
                    }
                    rows.add(row);
                }
            } catch (EOFException e) {
                log.warn("Vector file {} ends after {} of {} rows", path, rows.size(), count);
            }
            return new StoredVectors(dimension, rows);
        }
    }

    private record StoredVectors(int dimension, List<float[]> rows) {
    }
}
