package io.cortexr.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cortexr.config.CortexProperties;
import io.cortexr.memory.MemoryItem;
import io.cortexr.tool.ServerDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * {@link Planner} backed by a chat model. Prompts are classpath templates under {@code prompts/}.
 */
@Component
public class LlmPlanner implements Planner {

    private static final Logger log = LoggerFactory.getLogger(LlmPlanner.class);

    static final String PERCEPTION_PROMPT = "prompts/perception_prompt.txt";
    static final String CONSERVATIVE_PROMPT = "prompts/decision_prompt_conservative.txt";
    static final String EXPLORATORY_PROMPT = "prompts/decision_prompt_exploratory_sequential.txt";

    static final String INVALID_PLAN = "FINAL_ANSWER: [Could not generate valid solve()]";
    static final String PLANNING_FAILED = "FINAL_ANSWER: [unknown]";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{|}}|\\{(\\w+)}");
    private static final Pattern SOLVE_DEF = Pattern.compile("^\\s*(async\\s+)?def\\s+solve\\s*\\(", Pattern.MULTILINE);

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final CortexProperties.Strategy strategy;
    private final Map<String, String> templates = new LinkedHashMap<>();

    public LlmPlanner(ChatModel chatModel, ObjectMapper objectMapper, CortexProperties properties) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.strategy = properties.strategy();
    }

    @Override
    public PerceptionResult perceive(String input, List<ServerDescriptor> servers) {
        String serverLines = servers.stream()
                .map(s -> "- %s: %s".formatted(s.id(), s.description()))
                .collect(Collectors.joining("\n"));
        Map<String, String> values = new HashMap<>();
        values.put("user_input", input == null ? "" : input);
        values.put("server_descriptions", serverLines);
        String prompt = fill(template(PERCEPTION_PROMPT), values);

        String raw;
        try {
            raw = generate(prompt);
        } catch (RuntimeException e) {
            throw new PerceptionParseException("Perception request failed: " + e.getMessage(), e);
        }

        try {
            JsonNode node = objectMapper.readTree(stripFence(raw, "json"));
            if (node == null || !node.isObject()) {
                throw new PerceptionParseException("Perception answer is not a JSON object", null);
            }
            return new PerceptionResult(
                    input,
                    node.path("intent").asText(""),
                    textList(node.path("entities")),
                    node.path("tool_hint").asText(""),
                    textList(node.path("selected_servers")));
        } catch (JsonProcessingException e) {
            throw new PerceptionParseException("Failed to parse perception JSON from model response", e);
        }
    }

    @Override
    public String plan(PlanRequest request) {
        String memoryTexts = request.memoryItems().stream()
                .map(MemoryItem::text)
                .map(text -> "- " + text)
                .collect(Collectors.joining("\n"));
        String toolDescriptions = request.toolDescriptions();

        Map<String, String> values = new HashMap<>();
        values.put("tool_descriptions", toolDescriptions == null || toolDescriptions.isBlank() ? "None" : toolDescriptions);
        values.put("user_input", request.userInput() == null ? "" : request.userInput());
        values.put("memory_texts", memoryTexts.isEmpty() ? "None" : memoryTexts);
        values.put("step_num", String.valueOf(request.step()));
        values.put("max_steps", String.valueOf(request.maxSteps()));
        String prompt = fill(template(strategy.isExploratory() ? EXPLORATORY_PROMPT : CONSERVATIVE_PROMPT), values);
        if (request.forcedReplan()) {
            prompt += "\n\nThe previous plan for this step failed. Write a different plan using the tools listed above.";
        }

        try {
            String raw = stripFence(generate(prompt), "python");
            log.debug("Plan for step {}:\n{}", request.step(), raw);
            if (SOLVE_DEF.matcher(raw).find()) {
                return raw;
            }
            log.warn("Model did not return a valid solve(), answering with a placeholder");
            return INVALID_PLAN;
        } catch (RuntimeException e) {
            log.error("Planning failed: {}", e.getMessage(), e);
            return PLANNING_FAILED;
        }
    }

    private String generate(String prompt) {
        ChatResponse response = ChatClient.builder(chatModel)
                .build()
                .prompt()
                .user(prompt)
                .call()
                .chatResponse();
        if (response == null || response.getResult() == null) {
            throw new IllegalStateException("Model returned no result");
        }
        String text = response.getResult().getOutput().getText();
        return text == null ? "" : text.strip();
    }

    /**
     * Fills {@code {name}} placeholders and turns doubled braces into single ones, in one pass
     * over the template. Inserted values are copied as they are. Unknown
     * placeholders are left in place.
     */
    static String fill(String template, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder(template.length());
        while (matcher.find()) {
            String token = matcher.group();
            String replacement;
            if ("{{".equals(token)) {
                replacement = "{";
            } else if ("}}".equals(token)) {
                replacement = "}";
            } else {
                replacement = values.getOrDefault(matcher.group(1), token);
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Removes a surrounding markdown code fence, with or without a language tag.
     */
    static String stripFence(String raw, String language) {
        String text = raw.strip();
        if (!text.startsWith("```")) {
            return text;
        }
        text = text.substring(3);
        if (text.regionMatches(true, 0, language, 0, language.length())) {
            text = text.substring(language.length());
        }
        int end = text.lastIndexOf("```");
        if (end >= 0) {
            text = text.substring(0, end);
        }
        return text.strip();
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> values.add(item.asText()));
        } else if (node.isTextual() && !node.asText().isBlank()) {
            values.add(node.asText());
        }
        return values;
    }

    private synchronized String template(String path) {
        return templates.computeIfAbsent(path, p -> {
            try (InputStream in = new ClassPathResource(p).getInputStream()) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Prompt template not found: " + p, e);
            }
        });
    }
}
