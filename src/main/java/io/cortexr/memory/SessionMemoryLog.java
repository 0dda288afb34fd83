package io.cortexr.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cortexr.tool.ToolCallRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only log of one session, stored as a JSON array at
 * {@code <sessions-dir>/<sessionId>.json}. Session ids are date-partitioned
 * ({@code yyyy/MM/dd/session-...}), so files land in one directory per day.
 *
 * <p>The whole file is rewritten after every addition through a temp file and an atomic move.</p>
 */
public class SessionMemoryLog {

    private static final Logger log = LoggerFactory.getLogger(SessionMemoryLog.class);
    private static final TypeReference<List<MemoryItem>> ITEM_LIST = new TypeReference<>() {
    };

    private final String sessionId;
    private final Path file;
    private final ObjectMapper objectMapper;
    private final List<MemoryItem> items = new ArrayList<>();

    public SessionMemoryLog(Path sessionsDir, String sessionId, ObjectMapper objectMapper) {
        this.sessionId = sessionId;
        this.file = sessionsDir.resolve(sessionId + ".json");
        this.objectMapper = objectMapper;
        load();
    }

    /**
     * Reads the items of a session file.
     *
     * @throws IOException if the file cannot be read or is not a valid item array
     */
    public static List<MemoryItem> read(Path file, ObjectMapper objectMapper) throws IOException {
        List<MemoryItem> items = objectMapper.readValue(file.toFile(), ITEM_LIST);
        return items != null ? items : List.of();
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        try {
            items.addAll(read(file, objectMapper));
            log.debug("Loaded {} memory items for session {}", items.size(), sessionId);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Session log {} is unreadable, starting empty: {}", file, e.getMessage());
        }
    }

    /**
     * Appends an item and persists the log.
     */
    public synchronized void add(MemoryItem item) {
        items.add(item);
        save();
    }

    /**
     * Appends a {@code tool_output} item for a tool call.
     */
    public void addToolOutput(ToolCallRecord call) {
        add(MemoryItem.toolOutput(sessionId, call));
    }

    public synchronized List<MemoryItem> getItems() {
        return Collections.unmodifiableList(new ArrayList<>(items));
    }

    /**
     * Returns the names of tools that succeeded in this session, most recent first,
     * without duplicates.
     */
    public synchronized List<String> recentSuccessfulTools(int limit) {
        List<String> names = new ArrayList<>();
        for (int i = items.size() - 1; i >= 0 && names.size() < limit; i--) {
            MemoryItem item = items.get(i);
            if (item.isType(MemoryItem.TOOL_OUTPUT) && item.isSuccessful()
                    && item.toolName() != null && !names.contains(item.toolName())) {
                names.add(item.toolName());
            }
        }
        return names;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Path getFile() {
        return file;
    }

    private void save() {
        try {
            Files.createDirectories(file.getParent());
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), items);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Failed to write session log: {}", file, e);
        }
    }
}
