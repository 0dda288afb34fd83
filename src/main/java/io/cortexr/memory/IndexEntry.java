package io.cortexr.memory;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Metadata of one indexed (query, answer) pair. Its embedding is stored in the vector file
 * at the same position as this entry in the metadata sidecar.
 */
public record IndexEntry(
        @JsonProperty("user_query") String userQuery,
        @JsonProperty("final_answer") String finalAnswer,
        @JsonProperty("source_file") String sourceFile,
        @JsonProperty("timestamp") Instant timestamp
) {

    /** The text that gets embedded for this pair. */
    public String embeddingText() {
        return "User Question: " + userQuery + "\nFinal Answer: " + finalAnswer;
    }
}
