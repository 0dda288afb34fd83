package io.cortexr.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.cortexr.config.CortexProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.ai.embedding.EmbeddingModel;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class MemoryIndexTest {

    @TempDir
    Path tempDir;

    private Path sessionsDir;
    private Path indexDir;
    private ObjectMapper objectMapper;
    private EmbeddingModel embeddingModel;
    private final Map<String, float[]> embeddings = new LinkedHashMap<>();

    @BeforeEach
    void setUp() {
        sessionsDir = tempDir.resolve("memory");
        indexDir = tempDir.resolve("memory_index");
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        embeddingModel = mock(EmbeddingModel.class);
        when(embeddingModel.embed(anyString())).thenAnswer(invocation -> vectorFor(invocation.getArgument(0)));

        embeddings.put("factorial", new float[]{1f, 0f});
        embeddings.put("capital", new float[]{0f, 1f});
        embeddings.put("edge", new float[]{4f, 4f});
    }

    private float[] vectorFor(String text) {
        for (Map.Entry<String, float[]> entry : embeddings.entrySet()) {
            if (text.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return new float[]{10f, 10f};
    }

    private MemoryIndex newIndex() {
        var memory = new CortexProperties.Memory(sessionsDir.toString(), indexDir.toString(), 2, 300.0, 5, true);
        var index = new MemoryIndex(new CortexProperties(List.of(), null, null, memory), embeddingModel, objectMapper);
        index.load();
        return index;
    }

    private void completedSession(String sessionId, String query, String answer) {
        var log = new SessionMemoryLog(sessionsDir, sessionId, objectMapper);
        log.add(MemoryItem.runStart(sessionId, query));
        log.add(MemoryItem.finalAnswer(sessionId, query, answer, true));
    }

    @Test
    void shouldIndexOnlyCompletedSessions() {
        completedSession("2025/05/04/session-1", "What is 5 factorial?", "120");
        completedSession("2025/05/05/session-2", "What is the capital of France?", "Paris");

        var unfinished = new SessionMemoryLog(sessionsDir, "2025/05/05/session-3", objectMapper);
        unfinished.add(MemoryItem.runStart("2025/05/05/session-3", "Still running"));
        var failed = new SessionMemoryLog(sessionsDir, "2025/05/05/session-4", objectMapper);
        failed.add(MemoryItem.runStart("2025/05/05/session-4", "Gave up"));
        failed.add(MemoryItem.finalAnswer("2025/05/05/session-4", "Gave up", "partial", false));

        MemoryIndex index = newIndex();

        assertEquals(2, index.ensureFresh());
        assertEquals(2, index.size());
        assertEquals(0, index.ensureFresh());
    }

    @Test
    void shouldPickUpSessionsCompletedLater() {
        var log = new SessionMemoryLog(sessionsDir, "2025/05/04/session-1", objectMapper);
        log.add(MemoryItem.runStart("2025/05/04/session-1", "What is 5 factorial?"));
        MemoryIndex index = newIndex();
        assertEquals(0, index.ensureFresh());

        log.add(MemoryItem.finalAnswer("2025/05/04/session-1", "What is 5 factorial?", "120", true));
        assertEquals(1, index.ensureFresh());
    }

    @Test
    void shouldReturnNearestPairsFirst() {
        completedSession("2025/05/04/session-1", "What is 5 factorial?", "120");
        completedSession("2025/05/05/session-2", "What is the capital of France?", "Paris");
        MemoryIndex index = newIndex();

        List<IndexHit> hits = index.search("capital of Italy", 2);

        assertEquals(2, hits.size());
        assertEquals("Paris", hits.get(0).entry().finalAnswer());
        assertEquals(0.0, hits.get(0).distance());
        assertEquals(2.0, hits.get(1).distance());
        assertEquals("2025/05/05/session-2.json", hits.get(0).entry().sourceFile());
    }

    @Test
    void shouldInjectRelevantPairsAheadOfQuery() {
        completedSession("2025/05/04/session-1", "What is 5 factorial?", "120");
        completedSession("2025/05/05/session-2", "What is the capital of France?", "Paris");
        MemoryIndex index = newIndex();

        String injected = index.selectForInjection("And the factorial of 6?", 2, 1.5);

        assertEquals("""
                Relevant past conversations for context:
                - User asked: 'What is 5 factorial?'
                  Agent answered: '120'

                User task: And the factorial of 6?""", injected);
    }

    @Test
    void shouldExcludePairAtExactlyTheThreshold() {
        completedSession("2025/05/04/session-1", "What is 5 factorial?", "120");
        MemoryIndex index = newIndex();

        assertEquals(25.0, index.search("edge case", 1).get(0).distance());
        assertEquals("edge case", index.selectForInjection("edge case", 2, 25.0));
        assertTrue(index.selectForInjection("edge case", 2, 25.5).startsWith("Relevant past conversations"));
    }

    @Test
    void shouldReturnQueryUnchangedWhenEmbeddingFails() {
        completedSession("2025/05/04/session-1", "What is 5 factorial?", "120");
        when(embeddingModel.embed(anyString())).thenThrow(new RuntimeException("rate limited"));
        MemoryIndex index = newIndex();

        assertEquals("factorial again", index.selectForInjection("factorial again"));
        assertThrows(IndexUnavailableException.class, () -> index.search("factorial again", 1));
    }

    @Test
    void shouldReturnQueryUnchangedWhenIndexIsEmpty() {
        MemoryIndex index = newIndex();
        assertEquals("hello", index.selectForInjection("hello"));
        verify(embeddingModel, never()).embed(anyString());
    }

    @Test
    void shouldReloadPersistedIndexWithoutReembedding() {
        completedSession("2025/05/04/session-1", "What is 5 factorial?", "120");
        completedSession("2025/05/05/session-2", "What is the capital of France?", "Paris");
        newIndex().ensureFresh();
        clearInvocations(embeddingModel);

        MemoryIndex reloaded = newIndex();

        assertEquals(2, reloaded.size());
        assertEquals(0, reloaded.ensureFresh());
        verify(embeddingModel, never()).embed(anyString());
    }

    @Test
    void shouldTruncateVectorsWrittenAheadOfMetadata() throws IOException {
        completedSession("2025/05/04/session-1", "What is 5 factorial?", "120");
        completedSession("2025/05/05/session-2", "What is the capital of France?", "Paris");
        newIndex().ensureFresh();

        // Drop the last metadata entry as if the process died after writing vectors
        Path metadata = indexDir.resolve(MemoryIndex.METADATA_FILE);
        List<IndexEntry> entries = objectMapper.readValue(metadata.toFile(),
                objectMapper.getTypeFactory().constructCollectionType(List.class, IndexEntry.class));
        objectMapper.writeValue(metadata.toFile(), entries.subList(0, 1));

        MemoryIndex repaired = newIndex();

        assertEquals(1, repaired.size());
        assertEquals(1, vectorCount());
        assertEquals(1, repaired.ensureFresh());
        assertEquals(2, vectorCount());
    }

    @Test
    void shouldRebuildWhenMetadataIsAheadOfVectors() throws IOException {
        completedSession("2025/05/04/session-1", "What is 5 factorial?", "120");
        completedSession("2025/05/05/session-2", "What is the capital of France?", "Paris");
        newIndex().ensureFresh();

        try (var out = new DataOutputStream(Files.newOutputStream(indexDir.resolve(MemoryIndex.VECTORS_FILE)))) {
            out.writeInt(2);
            out.writeInt(0);
        }

        MemoryIndex rebuilt = newIndex();

        assertEquals(2, rebuilt.size());
        assertEquals(2, vectorCount());
    }

    @Test
    void shouldRebuildWhenMetadataIsUnreadable() throws IOException {
        completedSession("2025/05/04/session-1", "What is 5 factorial?", "120");
        newIndex().ensureFresh();
        Files.writeString(indexDir.resolve(MemoryIndex.METADATA_FILE), "{not json");

        assertEquals(1, newIndex().size());
    }

    @Test
    void shouldIgnoreAnswerRecordedBeforeSessionStart() {
        var log = new SessionMemoryLog(sessionsDir, "2025/05/04/session-1", objectMapper);
        log.add(MemoryItem.finalAnswer("2025/05/04/session-1", "What is 5 factorial?", "120", true));
        log.add(MemoryItem.runStart("2025/05/04/session-1", "What is 5 factorial?"));

        assertEquals(0, newIndex().ensureFresh());
    }

    @Test
    void shouldIgnoreAnswerToAnotherQuery() {
        var log = new SessionMemoryLog(sessionsDir, "2025/05/04/session-1", objectMapper);
        log.add(MemoryItem.runStart("2025/05/04/session-1", "What is 5 factorial?"));
        log.add(MemoryItem.finalAnswer("2025/05/04/session-1", "Other question", "42", true));
        MemoryIndex index = newIndex();

        assertEquals(0, index.ensureFresh());
        assertEquals(0, index.size());
    }

    @Test
    void shouldPairAnswerWithMatchingStartRecord() {
        var log = new SessionMemoryLog(sessionsDir, "2025/05/04/session-1", objectMapper);
        log.add(MemoryItem.finalAnswer("2025/05/04/session-1", "Other question", "42", true));
        log.add(MemoryItem.runStart("2025/05/04/session-1", "What is 5 factorial?"));
        log.add(MemoryItem.finalAnswer("2025/05/04/session-1", "What is 5 factorial?", "120", true));
        MemoryIndex index = newIndex();

        List<IndexHit> hits = index.search("factorial", 1);

        assertEquals(1, hits.size());
        assertEquals("What is 5 factorial?", hits.get(0).entry().userQuery());
        assertEquals("120", hits.get(0).entry().finalAnswer());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldNotRereadFinishedSessionsWithoutAnswer() throws IOException {
        for (int i = 1; i <= 3; i++) {
            String sessionId = "2025/05/05/session-" + i;
            var log = new SessionMemoryLog(sessionsDir, sessionId, objectMapper);
            log.add(MemoryItem.runStart(sessionId, "Gave up " + i));
            log.add(MemoryItem.finalAnswer(sessionId, "Gave up " + i, "partial", false));
        }
        objectMapper = spy(objectMapper);
        MemoryIndex index = newIndex();

        for (int i = 0; i < 10; i++) {
            assertEquals("hello", index.selectForInjection("hello"));
        }

        verify(objectMapper, times(3)).readValue(any(File.class), any(TypeReference.class));
    }

    @Test
    void shouldRereadSkippedSessionWhenItChanges() throws IOException {
        String sessionId = "2025/05/05/session-1";
        var log = new SessionMemoryLog(sessionsDir, sessionId, objectMapper);
        log.add(MemoryItem.runStart(sessionId, "What is 5 factorial?"));
        log.add(MemoryItem.finalAnswer(sessionId, "What is 5 factorial?", "[sandbox error: boom]", false));
        MemoryIndex index = newIndex();
        assertEquals(0, index.ensureFresh());

        completedSession("2025/05/05/session-1", "What is 5 factorial?", "120");
        Path file = sessionsDir.resolve(sessionId + ".json");
        Files.setLastModifiedTime(file, FileTime.fromMillis(
                Files.getLastModifiedTime(file).toMillis() + 5_000));

        assertEquals(1, index.ensureFresh());
    }

    @Test
    void shouldSkipMalformedSessionLogsOnce() throws IOException {
        completedSession("2025/05/04/session-1", "What is 5 factorial?", "120");
        Path broken = sessionsDir.resolve("2025/05/04/session-broken.json");
        Files.writeString(broken, "[{\"type\": ");
        MemoryIndex index = newIndex();

        assertEquals(1, index.ensureFresh());
        assertEquals(0, index.ensureFresh());
        verify(embeddingModel, times(1)).embed(anyString());
    }

    @Test
    void shouldSkipPairsWithMismatchedEmbeddingDimension() {
        completedSession("2025/05/04/session-1", "What is 5 factorial?", "120");
        completedSession("2025/05/05/session-2", "Odd one out", "wide");
        embeddings.put("Odd one out", new float[]{1f, 2f, 3f});
        MemoryIndex index = newIndex();

        assertEquals(1, index.ensureFresh());
        assertEquals(1, index.size());
    }

    @Test
    void shouldComputeSquaredEuclideanDistance() {
        assertEquals(25.0, MemoryIndex.squaredL2(new float[]{0f, 0f}, new float[]{3f, 4f}));
        assertEquals(0.0, MemoryIndex.squaredL2(new float[]{1f, 2f}, new float[]{1f, 2f}));
    }

    private int vectorCount() throws IOException {
        try (var in = new DataInputStream(Files.newInputStream(indexDir.resolve(MemoryIndex.VECTORS_FILE)))) {
            in.readInt();
            return in.readInt();
        }
    }
}
