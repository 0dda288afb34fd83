package io.cortexr.core;

import io.cortexr.memory.MemoryItem;
import io.cortexr.memory.SessionMemoryLog;
import io.cortexr.tool.ToolDispatcher;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * State of one agent session: the input, the step counter, task progress, the session log
 * and, once reached, the final answer.
 *
 * <p>Session ids look like {@code 2025/05/04/session-1746352331-a1b2c3}; the date prefix
 * partitions session logs into one directory per day.</p>
 */
public class SessionContext {

    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAILURE = "failure";

    private static final DateTimeFormatter DATE_PATH = DateTimeFormatter.ofPattern("yyyy/MM/dd");

    private final String sessionId;
    private final String userInput;
    private final String userQuery;
    private final ToolDispatcher dispatcher;
    private final SessionMemoryLog memory;
    private final List<TaskProgress> taskProgress = new ArrayList<>();
    private int step;
    private String finalAnswer;

    /**
     * @param sessionId  the session id, see {@link #newSessionId()}
     * @param userInput  the text given to the planner, possibly prefixed with past conversations
     * @param userQuery  the user's own query, recorded in the session log
     * @param dispatcher the dispatcher plans call tools through
     * @param memory     the session log
     */
    public SessionContext(String sessionId, String userInput, String userQuery,
                          ToolDispatcher dispatcher, SessionMemoryLog memory) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Session id must not be blank");
        }
        this.sessionId = sessionId;
        this.userInput = userInput;
        this.userQuery = userQuery != null ? userQuery : userInput;
        this.dispatcher = dispatcher;
        this.memory = memory;
        if (memory.getItems().isEmpty()) {
            memory.add(MemoryItem.runStart(sessionId, this.userQuery));
        }
    }

    public static String newSessionId() {
        String date = LocalDate.now().format(DATE_PATH);
        long epochSeconds = System.currentTimeMillis() / 1000;
        byte[] random = new byte[3];
        ThreadLocalRandom.current().nextBytes(random);
        return date + "/session-" + epochSeconds + "-" + HexFormat.of().formatHex(random);
    }

    /**
     * Advances the step counter by one and returns the new value.
     */
    public int advanceStep() {
        return ++step;
    }

    public int getStep() {
        return step;
    }

    /**
     * Records a tool call of the current step as pending and returns its index.
     */
    public int addTaskProgress(String tool) {
        taskProgress.add(new TaskProgress(step, tool, STATUS_PENDING));
        return taskProgress.size() - 1;
    }

    public void updateTaskProgress(int index, String status) {
        TaskProgress current = taskProgress.get(index);
        taskProgress.set(index, new TaskProgress(current.step(), current.tool(), status));
    }

    public List<TaskProgress> getTaskProgress() {
        return Collections.unmodifiableList(taskProgress);
    }

    /**
     * Sets the final answer. May be called once.
     *
     * @throws IllegalStateException if the answer is already set
     */
    public void setFinalAnswer(String answer) {
        if (finalAnswer != null) {
            throw new IllegalStateException("Final answer already set for session " + sessionId);
        }
        this.finalAnswer = answer;
    }

    public String getFinalAnswer() {
        return finalAnswer;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getUserInput() {
        return userInput;
    }

    public String getUserQuery() {
        return userQuery;
    }

    public ToolDispatcher getDispatcher() {
        return dispatcher;
    }

    public SessionMemoryLog getMemory() {
        return memory;
    }

    /** One tool call made during a step. */
    public record TaskProgress(int step, String tool, String status) {
    }
}
