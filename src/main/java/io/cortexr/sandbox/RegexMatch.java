package io.cortexr.sandbox;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.MatchResult;

/**
 * Result of {@code re.search} or {@code re.match}. Exposes {@code group}, {@code groups},
 * {@code start} and {@code end}.
 */
final class RegexMatch {

    private final MatchResult result;

    RegexMatch(MatchResult result) {
        this.result = result;
    }

    Object method(String name, List<Object> args) {
        return switch (name) {
            case "group" -> args.isEmpty() ? result.group() : group(args.get(0));
            case "groups" -> {
                List<Object> groups = new ArrayList<>();
                for (int i = 1; i <= result.groupCount(); i++) {
                    groups.add(result.group(i));
                }
                yield groups;
            }
            case "start" -> (long) result.start(args.isEmpty() ? 0 : (int) PlanValues.toLong(args.get(0)));
            case "end" -> (long) result.end(args.isEmpty() ? 0 : (int) PlanValues.toLong(args.get(0)));
            default -> throw new PlanExecutionException("'Match' object has no attribute '" + name + "'");
        };
    }

    private Object group(Object index) {
        int group = (int) PlanValues.toLong(index);
        if (group < 0 || group > result.groupCount()) {
            throw new PlanExecutionException("no such group");
        }
        return result.group(group);
    }

    @Override
    public String toString() {
        return "<re.Match span=(" + result.start() + ", " + result.end() + "), match='" + result.group() + "'>";
    }
}
