package io.cortexr.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in functions and the methods of str, list and dict values.
 */
final class PlanBuiltins {

    private static final Logger log = LoggerFactory.getLogger(PlanBuiltins.class);

    private static final int MAX_RANGE = 100_000;

    private PlanBuiltins() {
    }

    static Map<String, Object> functions() {
        Map<String, Object> builtins = new LinkedHashMap<>();
        builtins.put("str", (PlanCallable) (args, kw) -> args.isEmpty() ? "" : PlanValues.str(args.get(0)));
        builtins.put("repr", (PlanCallable) (args, kw) -> PlanValues.repr(single(args, "repr")));
        builtins.put("int", (PlanCallable) (args, kw) -> toInt(args.isEmpty() ? 0L : args.get(0)));
        builtins.put("float", (PlanCallable) (args, kw) -> toFloat(args.isEmpty() ? 0.0 : args.get(0)));
        builtins.put("bool", (PlanCallable) (args, kw) -> !args.isEmpty() && PlanValues.truthy(args.get(0)));
        builtins.put("len", (PlanCallable) (args, kw) -> len(single(args, "len")));
        builtins.put("list", (PlanCallable) (args, kw) ->
                args.isEmpty() ? new ArrayList<>() : PlanValues.iterate(args.get(0)));
        builtins.put("dict", (PlanCallable) (args, kw) -> {
            Map<Object, Object> map = new LinkedHashMap<>();
            if (!args.isEmpty() && args.get(0) instanceof Map<?, ?> source) {
                map.putAll(source);
            }
            map.putAll(kw);
            return map;
        });
        builtins.put("print", (PlanCallable) (args, kw) -> {
            List<String> parts = new ArrayList<>();
            for (Object arg : args) {
                parts.add(PlanValues.str(arg));
            }
            log.debug("[plan] {}", String.join(" ", parts));
            return null;
        });
        builtins.put("range", (PlanCallable) (args, kw) -> range(args));
        builtins.put("abs", (PlanCallable) (args, kw) -> {
            Object value = single(args, "abs");
            return value instanceof Long l ? (Object) Math.abs(l) : (Object) Math.abs(PlanValues.toDouble(value));
        });
        builtins.put("min", (PlanCallable) (args, kw) -> extreme(args, -1));
        builtins.put("max", (PlanCallable) (args, kw) -> extreme(args, 1));
        builtins.put("sum", (PlanCallable) (args, kw) -> {
            Object total = 0L;
            for (Object item : PlanValues.iterate(single(args, "sum"))) {
                total = PlanInterpreter.arithmetic("+", total, item);
            }
            return total;
        });
        builtins.put("round", (PlanCallable) (args, kw) -> round(args));
        builtins.put("sorted", (PlanCallable) (args, kw) -> {
            List<Object> items = PlanValues.iterate(single(args, "sorted"));
            items.sort(PlanValues::compare);
            if (PlanValues.truthy(kw.get("reverse"))) {
                Collections.reverse(items);
            }
            return items;
        });
        builtins.put("any", (PlanCallable) (args, kw) ->
                PlanValues.iterate(single(args, "any")).stream().anyMatch(PlanValues::truthy));
        builtins.put("all", (PlanCallable) (args, kw) ->
                PlanValues.iterate(single(args, "all")).stream().allMatch(PlanValues::truthy));
        return builtins;
    }

    // --- Methods on values ---

    static Object callMethod(Object target, String name, List<Object> args, Map<String, Object> kwargs) {
        if (target instanceof String s) {
            return stringMethod(s, name, args);
        }
        if (target instanceof List<?> list) {
            @SuppressWarnings("unchecked")
            List<Object> mutable = (List<Object>) list;
            return listMethod(mutable, name, args);
        }
        if (target instanceof Map<?, ?> map) {
            @SuppressWarnings("unchecked")
            Map<Object, Object> mutable = (Map<Object, Object>) map;
            return dictMethod(mutable, name, args);
        }
        if (target instanceof RegexMatch match) {
            return match.method(name, args);
        }
        throw new PlanExecutionException("'" + PlanValues.typeName(target) + "' object has no attribute '" + name + "'");
    }

    static boolean isDictMethod(String name) {
        return switch (name) {
            case "get", "keys", "values", "items", "update", "pop", "setdefault" -> true;
            default -> false;
        };
    }

    private static Object stringMethod(String s, String name, List<Object> args) {
        return switch (name) {
            case "strip" -> args.isEmpty() ? s.strip() : stripChars(s, str(args, 0), true, true);
            case "lstrip" -> args.isEmpty() ? s.stripLeading() : stripChars(s, str(args, 0), true, false);
            case "rstrip" -> args.isEmpty() ? s.stripTrailing() : stripChars(s, str(args, 0), false, true);
            case "lower" -> s.toLowerCase();
            case "upper" -> s.toUpperCase();
            case "title" -> title(s);
            case "split" -> split(s, args);
            case "replace" -> s.replace(str(args, 0), str(args, 1));
            case "startswith" -> s.startsWith(str(args, 0));
            case "endswith" -> s.endsWith(str(args, 0));
            case "find" -> (long) s.indexOf(str(args, 0));
            case "count" -> (long) countOccurrences(s, str(args, 0));
            case "isdigit" -> !s.isEmpty() && s.chars().allMatch(Character::isDigit);
            case "join" -> {
                List<String> parts = new ArrayList<>();
                for (Object item : PlanValues.iterate(args.isEmpty() ? null : args.get(0))) {
                    if (!(item instanceof String part)) {
                        throw new PlanExecutionException("sequence item: expected str instance, "
                                + PlanValues.typeName(item) + " found");
                    }
                    parts.add(part);
                }
                yield String.join(s, parts);
            }
            default -> throw new PlanExecutionException("'str' object has no attribute '" + name + "'");
        };
    }

    private static Object listMethod(List<Object> list, String name, List<Object> args) {
        switch (name) {
            case "append":
                list.add(args.isEmpty() ? null : args.get(0));
                return null;
            case "extend":
                list.addAll(PlanValues.iterate(args.isEmpty() ? null : args.get(0)));
                return null;
            case "insert":
                int at = PlanValues.clampSliceBound(args.get(0), list.size(), 0);
                list.add(at, args.size() > 1 ? args.get(1) : null);
                return null;
            case "pop":
                if (list.isEmpty()) {
                    throw new PlanExecutionException("pop from empty list");
                }
                int index = args.isEmpty() ? list.size() - 1
                        : PlanValues.normalizeIndex(PlanValues.toLong(args.get(0)), list.size());
                return list.remove(index);
            case "index":
                for (int i = 0; i < list.size(); i++) {
                    if (PlanValues.equal(list.get(i), args.get(0))) {
                        return (long) i;
                    }
                }
                throw new PlanExecutionException(PlanValues.repr(args.get(0)) + " is not in list");
            case "count":
                return list.stream().filter(item -> PlanValues.equal(item, args.get(0))).count();
            default:
                throw new PlanExecutionException("'list' object has no attribute '" + name + "'");
        }
    }

    private static Object dictMethod(Map<Object, Object> map, String name, List<Object> args) {
        switch (name) {
            case "get":
                Object key = args.isEmpty() ? null : args.get(0);
                return map.containsKey(key) ? map.get(key) : (args.size() > 1 ? args.get(1) : null);
            case "keys":
                return new ArrayList<>(map.keySet());
            case "values":
                return new ArrayList<>(map.values());
            case "items": {
                List<Object> items = new ArrayList<>();
                for (Map.Entry<Object, Object> entry : map.entrySet()) {
                    List<Object> pair = new ArrayList<>();
                    pair.add(entry.getKey());
                    pair.add(entry.getValue());
                    items.add(pair);
                }
                return items;
            }
            case "update":
                if (!args.isEmpty() && args.get(0) instanceof Map<?, ?> other) {
                    map.putAll(other);
                }
                return null;
            case "pop":
                if (map.containsKey(args.get(0))) {
                    return map.remove(args.get(0));
                }
                if (args.size() > 1) {
                    return args.get(1);
                }
                throw new PlanExecutionException("KeyError: " + PlanValues.repr(args.get(0)));
            case "setdefault":
                return map.computeIfAbsent(args.get(0), k -> args.size() > 1 ? args.get(1) : null);
            default:
                throw new PlanExecutionException("'dict' object has no attribute '" + name + "'");
        }
    }

    // --- Helpers ---

    private static Object single(List<Object> args, String function) {
        if (args.size() != 1) {
            throw new PlanExecutionException(function + "() takes exactly one argument (" + args.size() + " given)");
        }
        return args.get(0);
    }

    private static String str(List<Object> args, int index) {
        if (args.size() <= index || !(args.get(index) instanceof String s)) {
            throw new PlanExecutionException("expected a string argument");
        }
        return s;
    }

    private static long len(Object value) {
        if (value instanceof String s) {
            return s.codePointCount(0, s.length());
        }
        if (value instanceof List<?> list) {
            return list.size();
        }
        if (value instanceof Map<?, ?> map) {
            return map.size();
        }
        throw new PlanExecutionException("object of type '" + PlanValues.typeName(value) + "' has no len()");
    }

    static Object toInt(Object value) {
        if (value instanceof Long || value == null) {
            return value == null ? 0L : value;
        }
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        if (value instanceof Double d) {
            return (long) d.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Long.parseLong(s.strip().replace("_", ""));
            } catch (NumberFormatException e) {
                throw new PlanExecutionException("invalid literal for int() with base 10: " + PlanValues.repr(s));
            }
        }
        throw new PlanExecutionException("int() argument must be a string or a number, not '"
                + PlanValues.typeName(value) + "'");
    }

    static Object toFloat(Object value) {
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.strip());
            } catch (NumberFormatException e) {
                throw new PlanExecutionException("could not convert string to float: " + PlanValues.repr(s));
            }
        }
        if (PlanValues.isNumber(value)) {
            return PlanValues.toDouble(value);
        }
        throw new PlanExecutionException("float() argument must be a string or a number, not '"
                + PlanValues.typeName(value) + "'");
    }

    private static List<Object> range(List<Object> args) {
        long start = 0;
        long stop;
        long step = 1;
        if (args.size() == 1) {
            stop = PlanValues.toLong(args.get(0));
        } else if (args.size() >= 2) {
            start = PlanValues.toLong(args.get(0));
            stop = PlanValues.toLong(args.get(1));
            if (args.size() > 2) {
                step = PlanValues.toLong(args.get(2));
            }
        } else {
            throw new PlanExecutionException("range expected at least 1 argument");
        }
        if (step == 0) {
            throw new PlanExecutionException("range() arg 3 must not be zero");
        }
        List<Object> values = new ArrayList<>();
        for (long i = start; step > 0 ? i < stop : i > stop; i += step) {
            if (values.size() >= MAX_RANGE) {
                throw new PlanExecutionException("range() is limited to " + MAX_RANGE + " elements in plans");
            }
            values.add(i);
        }
        return values;
    }

    private static Object extreme(List<Object> args, int direction) {
        List<Object> items = args.size() == 1 ? PlanValues.iterate(args.get(0)) : args;
        if (items.isEmpty()) {
            throw new PlanExecutionException("arg is an empty sequence");
        }
        Object best = items.get(0);
        for (Object item : items) {
            if (PlanValues.compare(item, best) * direction > 0) {
                best = item;
            }
        }
        return best;
    }

    private static Object round(List<Object> args) {
        if (args.isEmpty()) {
            throw new PlanExecutionException("round() missing required argument 'number'");
        }
        double value = PlanValues.toDouble(args.get(0));
        if (args.size() == 1 || args.get(1) == null) {
            return (long) Math.rint(value);
        }
        int digits = (int) PlanValues.toLong(args.get(1));
        return BigDecimal.valueOf(value).setScale(digits, RoundingMode.HALF_EVEN).doubleValue();
    }

    private static List<Object> split(String s, List<Object> args) {
        List<Object> parts = new ArrayList<>();
        if (args.isEmpty() || args.get(0) == null) {
            for (String part : s.strip().split("\\s+")) {
                if (!part.isEmpty()) {
                    parts.add(part);
                }
            }
            return parts;
        }
        String separator = str(args, 0);
        if (separator.isEmpty()) {
            throw new PlanExecutionException("empty separator");
        }
        int from = 0;
        int index;
        while ((index = s.indexOf(separator, from)) >= 0) {
            parts.add(s.substring(from, index));
            from = index + separator.length();
        }
        parts.add(s.substring(from));
        return parts;
    }

    private static String stripChars(String s, String chars, boolean leading, boolean trailing) {
        int start = 0;
        int end = s.length();
        while (leading && start < end && chars.indexOf(s.charAt(start)) >= 0) {
            start++;
        }
        while (trailing && end > start && chars.indexOf(s.charAt(end - 1)) >= 0) {
            end--;
        }
        return s.substring(start, end);
    }

    private static String title(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        boolean upperNext = true;
        for (char c : s.toCharArray()) {
            sb.append(upperNext ? Character.toUpperCase(c) : Character.toLowerCase(c));
            upperNext = !Character.isLetter(c);
        }
        return sb.toString();
    }

    private static int countOccurrences(String s, String sub) {
        if (sub.isEmpty()) {
            return s.length() + 1;
        }
        int count = 0;
        int from = 0;
        int index;
        while ((index = s.indexOf(sub, from)) >= 0) {
            count++;
            from = index + sub.length();
        }
        return count;
    }
}
