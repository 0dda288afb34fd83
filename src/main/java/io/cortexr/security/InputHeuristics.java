package io.cortexr.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lightweight guardrails applied to user input before it reaches the agent.
 * Blocks disallowed topics, expands common slang and masks profanity.
 */
@Component
public class InputHeuristics {

    private static final Logger log = LoggerFactory.getLogger(InputHeuristics.class);

    static final int MAX_INPUT_LENGTH = 10_000;
    static final String BLOCKED_MESSAGE = "I’m sorry, but I can’t assist with that topic.";
    static final String EMPTY_MESSAGE = "Could you please rephrase that?";

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<Pattern, String> SLANG = new LinkedHashMap<>();

    static {
        slang("u", "you");
        slang("ur", "your");
        slang("wanna", "want to");
        slang("gonna", "going to");
        slang("gotta", "have to");
        slang("pls?", "please");
        slang("plz", "please");
        slang("tho", "though");
        slang("imo", "in my opinion");
        slang("idk", "I do not know");
        slang("wtf", "what");
    }

    private static final Set<String> OFFENSIVE_WORDS = Set.of("damn", "shit", "fuck", "bitch", "bastard");

    private static final List<String> BLOCKED_SUBJECTS = List.of(
            "violence", "kill", "terrorism", "extremism", "weapon", "firearm", "gun", "bomb",
            "harm someone", "self harm", "drug manufacturing");

    private static final String HIGH_RISK_VERBS =
            "(?:make|build|assemble|manufacture|fabricate|construct|3d[- ]?print|cook(?: up)?|design)";
    private static final String HIGH_RISK_OBJECTS =
            "(?:gun|firearm|weapon|bomb|grenade|explosive|pipe bomb|chemical weapon|improvised explosive|ied|poison|molotov|silencer)";

    private static final List<Pattern> DANGEROUS_PATTERNS = List.of(
            Pattern.compile("\\b" + HIGH_RISK_VERBS + "\\b[^\\n]*\\b" + HIGH_RISK_OBJECTS + "\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b" + HIGH_RISK_OBJECTS + "\\b[^\\n]*\\b" + HIGH_RISK_VERBS + "\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bhow to\\b[^\\n]*\\b(gun|firearm|bomb|explosive|weapon)\\b", Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> BLOCKED_SUBJECT_PATTERNS = BLOCKED_SUBJECTS.stream()
            .map(subject -> Pattern.compile("\\b" + Pattern.quote(subject), Pattern.CASE_INSENSITIVE))
            .toList();

    private static final List<Pattern> OFFENSIVE_PATTERNS = OFFENSIVE_WORDS.stream()
            .map(word -> Pattern.compile("\\b" + Pattern.quote(word) + "\\b", Pattern.CASE_INSENSITIVE))
            .toList();

    private static void slang(String regex, String replacement) {
        SLANG.put(Pattern.compile("\\b" + regex + "\\b", Pattern.CASE_INSENSITIVE), replacement);
    }

    /**
     * Checks and cleans a raw user input.
     *
     * @param raw the input as received, may be null
     * @return the sanitized input, or a rejection with the message to show the user
     */
    public HeuristicResult apply(String raw) {
        String text = raw == null ? "" : CONTROL_CHARS.matcher(raw).replaceAll("");
        if (text.length() > MAX_INPUT_LENGTH) {
            log.debug("Input truncated from {} to {} characters", text.length(), MAX_INPUT_LENGTH);
            text = text.substring(0, MAX_INPUT_LENGTH);
        }

        for (Pattern subject : BLOCKED_SUBJECT_PATTERNS) {
            if (subject.matcher(text).find()) {
                log.info("Input rejected: blocked subject '{}'", subject.pattern());
                return HeuristicResult.reject(BLOCKED_MESSAGE);
            }
        }
        for (Pattern pattern : DANGEROUS_PATTERNS) {
            if (pattern.matcher(text).find()) {
                log.info("Input rejected: dangerous request pattern");
                return HeuristicResult.reject(BLOCKED_MESSAGE);
            }
        }

        String sanitized = text;
        for (Map.Entry<Pattern, String> entry : SLANG.entrySet()) {
            sanitized = entry.getKey().matcher(sanitized).replaceAll(Matcher.quoteReplacement(entry.getValue()));
        }
        for (Pattern word : OFFENSIVE_PATTERNS) {
            sanitized = word.matcher(sanitized).replaceAll(match -> Matcher.quoteReplacement(mask(match.group())));
        }

        sanitized = WHITESPACE.matcher(sanitized).replaceAll(" ").strip();
        if (sanitized.isEmpty()) {
            return HeuristicResult.reject(EMPTY_MESSAGE);
        }
        return HeuristicResult.allow(sanitized);
    }

    static String mask(String word) {
        if (word.length() <= 2) {
            return "*".repeat(word.length());
        }
        return word.charAt(0) + "*".repeat(word.length() - 2) + word.charAt(word.length() - 1);
    }
}
