package io.cortexr.sandbox;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * The {@code re} module on top of {@link java.util.regex}. Python named groups
 * ({@code (?P<name>...)}) and {@code \1} backreferences in replacements are translated.
 */
final class RegexModule implements PlanModule {

    static final long IGNORECASE = 2L;
    static final long MULTILINE = 8L;
    static final long DOTALL = 16L;

    @Override
    public String name() {
        return "re";
    }

    @Override
    public Object attribute(String attribute) {
        return switch (attribute) {
            case "search" -> (PlanCallable) (args, kwargs) -> find(args, kwargs, Mode.SEARCH);
            case "match" -> (PlanCallable) (args, kwargs) -> find(args, kwargs, Mode.MATCH);
            case "fullmatch" -> (PlanCallable) (args, kwargs) -> find(args, kwargs, Mode.FULL);
            case "findall" -> (PlanCallable) this::findall;
            case "sub" -> (PlanCallable) this::sub;
            case "split" -> (PlanCallable) this::split;
            case "I", "IGNORECASE" -> IGNORECASE;
            case "M", "MULTILINE" -> MULTILINE;
            case "S", "DOTALL" -> DOTALL;
            default -> throw new PlanExecutionException("module 're' has no attribute '" + attribute + "'");
        };
    }

    private enum Mode { SEARCH, MATCH, FULL }

    private Object find(List<Object> args, Map<String, Object> kwargs, Mode mode) {
        requireArgs(args, 2, "pattern and string");
        Matcher matcher = compile(args.get(0), flags(args, 2, kwargs)).matcher(text(args.get(1)));
        boolean found = switch (mode) {
            case SEARCH -> matcher.find();
            case MATCH -> matcher.lookingAt();
            case FULL -> matcher.matches();
        };
        return found ? new RegexMatch(matcher.toMatchResult()) : null;
    }

    private Object findall(List<Object> args, Map<String, Object> kwargs) {
        requireArgs(args, 2, "pattern and string");
        Matcher matcher = compile(args.get(0), flags(args, 2, kwargs)).matcher(text(args.get(1)));
        List<Object> matches = new ArrayList<>();
        while (matcher.find()) {
            int groups = matcher.groupCount();
            if (groups == 0) {
                matches.add(matcher.group());
            } else if (groups == 1) {
                matches.add(nullToEmpty(matcher.group(1)));
            } else {
                List<Object> tuple = new ArrayList<>();
                for (int i = 1; i <= groups; i++) {
                    tuple.add(nullToEmpty(matcher.group(i)));
                }
                matches.add(tuple);
            }
        }
        return matches;
    }

    private Object sub(List<Object> args, Map<String, Object> kwargs) {
        requireArgs(args, 3, "pattern, replacement and string");
        Pattern pattern = compile(args.get(0), flags(args, 4, kwargs));
        String replacement = text(args.get(1))
                .replace("$", "\\$")
                .replaceAll("\\\\(\\d)", "\\$$1")
                .replaceAll("\\\\g<(\\w+)>", "\\${$1}");
        return pattern.matcher(text(args.get(2))).replaceAll(replacement);
    }

    private Object split(List<Object> args, Map<String, Object> kwargs) {
        requireArgs(args, 2, "pattern and string");
        List<Object> parts = new ArrayList<>();
        for (String part : compile(args.get(0), flags(args, 3, kwargs)).split(text(args.get(1)), -1)) {
            parts.add(part);
        }
        return parts;
    }

    static Pattern compile(Object pattern, long flags) {
        String regex = text(pattern).replace("(?P<", "(?<").replaceAll("\\(\\?P=(\\w+)\\)", "\\\\k<$1>");
        int javaFlags = 0;
        if ((flags & IGNORECASE) != 0) {
            javaFlags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        }
        if ((flags & MULTILINE) != 0) {
            javaFlags |= Pattern.MULTILINE;
        }
        if ((flags & DOTALL) != 0) {
            javaFlags |= Pattern.DOTALL;
        }
        try {
            return Pattern.compile(regex, javaFlags);
        } catch (PatternSyntaxException e) {
            throw new PlanExecutionException("invalid regular expression: " + e.getDescription());
        }
    }

    private static long flags(List<Object> args, int position, Map<String, Object> kwargs) {
        if (kwargs.containsKey("flags")) {
            return PlanValues.toLong(kwargs.get("flags"));
        }
        return args.size() > position ? PlanValues.toLong(args.get(position)) : 0L;
    }

    private static void requireArgs(List<Object> args, int count, String description) {
        if (args.size() < count) {
            throw new PlanExecutionException("expected " + description);
        }
    }

    private static String text(Object value) {
        if (!(value instanceof String s)) {
            throw new PlanExecutionException("expected string but got '" + PlanValues.typeName(value) + "'");
        }
        return s;
    }

    private static Object nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
