package io.cortexr.sandbox;

import io.cortexr.sandbox.PlanAst.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Tree-walking evaluator for parsed plans.
 *
 * <p>Plan code sees only the names placed in the global scope by the caller (the tool proxy
 * and the {@code json}/{@code re} modules) plus {@link PlanBuiltins}. There is no access to
 * host classes, files, sockets or processes.</p>
 *
 * <p>Not thread-safe; one interpreter runs one plan.</p>
 */
final class PlanInterpreter {

    static final int MAX_CALL_DEPTH = 64;
    static final long MAX_OPERATIONS = 1_000_000L;
    static final long MAX_SEQUENCE_LENGTH = 10_000_000L;

    private final Scope globals;
    private long operations;
    private int callDepth;

    PlanInterpreter(Map<String, Object> names) {
        Scope builtins = new Scope(null);
        builtins.vars.putAll(PlanBuiltins.functions());
        this.globals = new Scope(builtins);
        this.globals.vars.putAll(names);
    }

    /**
     * Defines the plan's functions and runs its top-level statements.
     */
    void load(Program program) {
        for (FunctionDef def : program.functions()) {
            globals.vars.put(def.name(), new UserFunction(def, globals));
        }
        try {
            execBlock(program.topLevel(), globals);
        } catch (ReturnSignal | LoopSignal e) {
            throw new PlanExecutionException("'return', 'break' or 'continue' outside function");
        }
    }

    /**
     * Returns a global name, or null if it is not defined.
     */
    Object global(String name) {
        return globals.vars.get(name);
    }

    /**
     * Calls a function value with no arguments.
     */
    Object invoke(Object function) {
        if (!(function instanceof PlanCallable callable)) {
            throw new PlanExecutionException("'" + PlanValues.typeName(function) + "' object is not callable");
        }
        return callable.call(List.of(), Map.of());
    }

    /**
     * Awaits a value: futures are joined, anything else is returned as is.
     */
    static Object await(Object value) {
        if (value instanceof CompletionStage<?> stage) {
            try {
                return PlanValues.fromHost(stage.toCompletableFuture().join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException cause) {
                    throw cause;
                }
                throw e;
            }
        }
        return value;
    }

    // --- Statements ---

    private void execBlock(List<Stmt> body, Scope scope) {
        for (Stmt stmt : body) {
            exec(stmt, scope);
        }
    }

    private void exec(Stmt stmt, Scope scope) {
        tick();
        if (stmt instanceof ExprStmt s) {
            eval(s.expr(), scope);
        } else if (stmt instanceof Assign s) {
            assign(s.target(), eval(s.value(), scope), scope);
        } else if (stmt instanceof AugAssign s) {
            Object current = eval(s.target(), scope);
            assign(s.target(), arithmetic(s.op(), current, eval(s.value(), scope)), scope);
        } else if (stmt instanceof Return s) {
            throw new ReturnSignal(s.value() == null ? null : eval(s.value(), scope));
        } else if (stmt instanceof If s) {
            execBlock(PlanValues.truthy(eval(s.condition(), scope)) ? s.then() : s.otherwise(), scope);
        } else if (stmt instanceof For s) {
            execFor(s, scope);
        } else if (stmt instanceof Try s) {
            execTry(s, scope);
        } else if (stmt instanceof FunctionDef s) {
            scope.vars.put(s.name(), new UserFunction(s, scope));
        } else if (stmt instanceof Break) {
            throw LoopSignal.BREAK;
        } else if (stmt instanceof Continue) {
            throw LoopSignal.CONTINUE;
        } else if (!(stmt instanceof Pass)) {
            throw new PlanExecutionException("unsupported statement " + stmt.getClass().getSimpleName());
        }
    }

    private void execFor(For loop, Scope scope) {
        for (Object item : PlanValues.iterate(eval(loop.iterable(), scope))) {
            scope.set(loop.variable(), item);
            try {
                execBlock(loop.body(), scope);
            } catch (LoopSignal signal) {
                if (signal == LoopSignal.BREAK) {
                    break;
                }
            }
        }
    }

    private void execTry(Try stmt, Scope scope) {
        try {
            execBlock(stmt.body(), scope);
        } catch (ReturnSignal | LoopSignal | PlanResourceExhaustedException | OperationLimitException e) {
            throw e;
        } catch (RuntimeException e) {
            if (stmt.errorName() != null) {
                scope.set(stmt.errorName(), e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
            execBlock(stmt.handler(), scope);
        }
    }

    private void assign(Expr target, Object value, Scope scope) {
        if (target instanceof Name name) {
            scope.set(name.id(), value);
            return;
        }
        Index index = (Index) target;
        Object container = eval(index.target(), scope);
        Object key = eval(index.index(), scope);
        if (container instanceof List<?> list) {
            @SuppressWarnings("unchecked")
            List<Object> mutable = (List<Object>) list;
            mutable.set(PlanValues.normalizeIndex(PlanValues.toLong(key), list.size()), value);
        } else if (container instanceof Map<?, ?> map) {
            @SuppressWarnings("unchecked")
            Map<Object, Object> mutable = (Map<Object, Object>) map;
            mutable.put(key, value);
        } else {
            throw new PlanExecutionException("'" + PlanValues.typeName(container)
                    + "' object does not support item assignment");
        }
    }

    // --- Expressions ---

    private Object eval(Expr expr, Scope scope) {
        tick();
        if (expr instanceof Literal e) {
            return e.value();
        }
        if (expr instanceof Name e) {
            return scope.lookup(e.id());
        }
        if (expr instanceof Attribute e) {
            return attribute(eval(e.target(), scope), e.name());
        }
        if (expr instanceof Call e) {
            return call(e, scope);
        }
        if (expr instanceof Await e) {
            return await(eval(e.operand(), scope));
        }
        if (expr instanceof Index e) {
            return index(eval(e.target(), scope), eval(e.index(), scope));
        }
        if (expr instanceof Slice e) {
            return slice(eval(e.target(), scope),
                    e.start() == null ? null : eval(e.start(), scope),
                    e.stop() == null ? null : eval(e.stop(), scope));
        }
        if (expr instanceof Binary e) {
            return arithmetic(e.op(), eval(e.left(), scope), eval(e.right(), scope));
        }
        if (expr instanceof Logical e) {
            Object left = eval(e.left(), scope);
            boolean shortCircuit = "and".equals(e.op()) ? !PlanValues.truthy(left) : PlanValues.truthy(left);
            return shortCircuit ? left : eval(e.right(), scope);
        }
        if (expr instanceof Unary e) {
            return unary(e.op(), eval(e.operand(), scope));
        }
        if (expr instanceof Compare e) {
            return compare(e, scope);
        }
        if (expr instanceof Conditional e) {
            return PlanValues.truthy(eval(e.condition(), scope)) ? eval(e.then(), scope) : eval(e.otherwise(), scope);
        }
        if (expr instanceof FString e) {
            return fstring(e, scope);
        }
        if (expr instanceof ListExpr e) {
            List<Object> items = new ArrayList<>();
            for (Expr item : e.items()) {
                items.add(eval(item, scope));
            }
            return items;
        }
        if (expr instanceof DictExpr e) {
            Map<Object, Object> map = new LinkedHashMap<>();
            for (int i = 0; i < e.keys().size(); i++) {
                map.put(eval(e.keys().get(i), scope), eval(e.values().get(i), scope));
            }
            return map;
        }
        if (expr instanceof Comprehension e) {
            return comprehension(e, scope);
        }
        throw new PlanExecutionException("unsupported expression " + expr.getClass().getSimpleName());
    }

    private Object call(Call call, Scope scope) {
        Object callee = eval(call.callee(), scope);
        List<Object> args = new ArrayList<>();
        for (Expr arg : call.args()) {
            args.add(eval(arg, scope));
        }
        Map<String, Object> kwargs = new LinkedHashMap<>();
        for (int i = 0; i < call.keywordNames().size(); i++) {
            kwargs.put(call.keywordNames().get(i), eval(call.keywordValues().get(i), scope));
        }
        if (!(callee instanceof PlanCallable callable)) {
            throw new PlanExecutionException("'" + PlanValues.typeName(callee) + "' object is not callable");
        }
        return callable.call(args, kwargs);
    }

    private static Object attribute(Object target, String name) {
        if (target instanceof PlanModule module) {
            return module.attribute(name);
        }
        if (target instanceof Map<?, ?> map) {
            if (map.containsKey(name)) {
                return map.get(name);
            }
            if (!PlanBuiltins.isDictMethod(name)) {
                throw new PlanExecutionException("'dict' object has no attribute '" + name + "'");
            }
        } else if (target == null) {
            throw new PlanExecutionException("'NoneType' object has no attribute '" + name + "'");
        }
        return (PlanCallable) (args, kwargs) -> PlanBuiltins.callMethod(target, name, args, kwargs);
    }

    private static Object index(Object target, Object key) {
        if (target instanceof List<?> list) {
            return list.get(PlanValues.normalizeIndex(PlanValues.toLong(key), list.size()));
        }
        if (target instanceof String s) {
            int i = PlanValues.normalizeIndex(PlanValues.toLong(key), s.length());
            return String.valueOf(s.charAt(i));
        }
        if (target instanceof Map<?, ?> map) {
            if (!map.containsKey(key)) {
                throw new PlanExecutionException("KeyError: " + PlanValues.repr(key));
            }
            return map.get(key);
        }
        if (target instanceof RegexMatch match) {
            return match.method("group", List.of(key));
        }
        throw new PlanExecutionException("'" + PlanValues.typeName(target) + "' object is not subscriptable");
    }

    private static Object slice(Object target, Object start, Object stop) {
        if (target instanceof List<?> list) {
            int from = PlanValues.clampSliceBound(start, list.size(), 0);
            int to = PlanValues.clampSliceBound(stop, list.size(), list.size());
            return from >= to ? new ArrayList<>() : new ArrayList<Object>(list.subList(from, to));
        }
        if (target instanceof String s) {
            int from = PlanValues.clampSliceBound(start, s.length(), 0);
            int to = PlanValues.clampSliceBound(stop, s.length(), s.length());
            return from >= to ? "" : s.substring(from, to);
        }
        throw new PlanExecutionException("'" + PlanValues.typeName(target) + "' object is not subscriptable");
    }

    private static Object unary(String op, Object value) {
        switch (op) {
            case "not":
                return !PlanValues.truthy(value);
            case "-":
                if (value instanceof Long l) {
                    return Math.negateExact(l);
                }
                if (PlanValues.isNumber(value)) {
                    return -PlanValues.toDouble(value);
                }
                break;
            case "+":
                if (PlanValues.isNumber(value)) {
                    return value instanceof Boolean ? PlanValues.toLong(value) : value;
                }
                break;
            default:
                break;
        }
        throw new PlanExecutionException("bad operand type for unary " + op + ": '" + PlanValues.typeName(value) + "'");
    }

    private Object compare(Compare compare, Scope scope) {
        Object left = eval(compare.operands().get(0), scope);
        for (int i = 0; i < compare.ops().size(); i++) {
            Object right = eval(compare.operands().get(i + 1), scope);
            if (!compareOnce(compare.ops().get(i), left, right)) {
                return false;
            }
            left = right;
        }
        return true;
    }

    private static boolean compareOnce(String op, Object left, Object right) {
        return switch (op) {
            case "==" -> PlanValues.equal(left, right);
            case "!=" -> !PlanValues.equal(left, right);
            case "<" -> PlanValues.compare(left, right) < 0;
            case ">" -> PlanValues.compare(left, right) > 0;
            case "<=" -> PlanValues.compare(left, right) <= 0;
            case ">=" -> PlanValues.compare(left, right) >= 0;
            case "in" -> PlanValues.contains(right, left);
            case "not in" -> !PlanValues.contains(right, left);
            case "is" -> identical(left, right);
            case "is not" -> !identical(left, right);
            default -> throw new PlanExecutionException("unsupported comparison " + op);
        };
    }

    private static boolean identical(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (left instanceof Boolean) {
            return left.equals(right);
        }
        return left == right;
    }

    static Object arithmetic(String op, Object left, Object right) {
        try {
            if (left instanceof Long a && right instanceof Long b) {
                return longArithmetic(op, a, b);
            }
            if (PlanValues.isNumber(left) && PlanValues.isNumber(right)) {
                if (left instanceof Boolean || right instanceof Boolean) {
                    if (!(left instanceof Double) && !(right instanceof Double)) {
                        return longArithmetic(op, PlanValues.toLong(left), PlanValues.toLong(right));
                    }
                }
                return doubleArithmetic(op, PlanValues.toDouble(left), PlanValues.toDouble(right));
            }
        } catch (ArithmeticException e) {
            throw new PlanExecutionException(e.getMessage() != null && e.getMessage().contains("overflow")
                    ? "integer overflow" : "division by zero");
        }
        if ("+".equals(op)) {
            if (left instanceof String a && right instanceof String b) {
                return a + b;
            }
            if (left instanceof List<?> a && right instanceof List<?> b) {
                List<Object> joined = new ArrayList<>(a);
                joined.addAll(b);
                return joined;
            }
        }
        if ("*".equals(op)) {
            if (left instanceof String s && right instanceof Long n) {
                return s.repeat(repeatCount(n, s.length()));
            }
            if (left instanceof Long n && right instanceof String s) {
                return s.repeat(repeatCount(n, s.length()));
            }
            if (left instanceof List<?> list && right instanceof Long n) {
                int count = repeatCount(n, list.size());
                List<Object> repeated = new ArrayList<>(count * list.size());
                for (int i = 0; i < count; i++) {
                    repeated.addAll(list);
                }
                return repeated;
            }
        }
        throw new PlanExecutionException("unsupported operand type(s) for " + op + ": '"
                + PlanValues.typeName(left) + "' and '" + PlanValues.typeName(right) + "'");
    }

    /**
     * Number of copies for sequence repetition. Negative counts give zero copies; results
     * longer than {@link #MAX_SEQUENCE_LENGTH} are rejected.
     */
    static int repeatCount(long n, int length) {
        if (n <= 0 || length == 0) {
            return 0;
        }
        if (n > Integer.MAX_VALUE || n * length > MAX_SEQUENCE_LENGTH) {
            throw new PlanExecutionException("repeated sequence too long");
        }
        return (int) n;
    }

    private static Object longArithmetic(String op, long a, long b) {
        return switch (op) {
            case "+" -> Math.addExact(a, b);
            case "-" -> Math.subtractExact(a, b);
            case "*" -> Math.multiplyExact(a, b);
            case "/" -> {
                if (b == 0) {
                    throw new ArithmeticException("/ by zero");
                }
                yield (double) a / b;
            }
            case "//" -> Math.floorDiv(a, b);
            case "%" -> Math.floorMod(a, b);
            case "**" -> b < 0 ? (Object) Math.pow(a, b) : (Object) power(a, b);
            default -> throw new PlanExecutionException("unsupported operator " + op);
        };
    }

    private static long power(long base, long exponent) {
        if (base == 0 || base == 1) {
            return exponent == 0 ? 1 : base;
        }
        if (base == -1) {
            return exponent % 2 == 0 ? 1 : -1;
        }
        long result = 1;
        for (long i = 0; i < exponent; i++) {
            result = Math.multiplyExact(result, base);
        }
        return result;
    }

    private static Object doubleArithmetic(String op, double a, double b) {
        if ((op.equals("/") || op.equals("//") || op.equals("%")) && b == 0.0) {
            throw new ArithmeticException("float division by zero");
        }
        return switch (op) {
            case "+" -> a + b;
            case "-" -> a - b;
            case "*" -> a * b;
            case "/" -> a / b;
            case "//" -> Math.floor(a / b);
            case "%" -> a - b * Math.floor(a / b);
            case "**" -> Math.pow(a, b);
            default -> throw new PlanExecutionException("unsupported operator " + op);
        };
    }

    private Object fstring(FString fstring, Scope scope) {
        StringBuilder sb = new StringBuilder();
        for (Object part : fstring.parts()) {
            if (part instanceof String literal) {
                sb.append(literal);
            } else {
                FormatField field = (FormatField) part;
                sb.append(format(eval(field.expr(), scope), field.spec()));
            }
        }
        return sb.toString();
    }

    static String format(Object value, String spec) {
        if (spec == null || spec.isEmpty()) {
            return PlanValues.str(value);
        }
        boolean grouping = spec.contains(",");
        String plain = spec.replace(",", "");
        if (plain.matches("\\.\\d+f") && PlanValues.isNumber(value)) {
            return String.format(Locale.ROOT, "%" + (grouping ? "," : "") + plain, PlanValues.toDouble(value));
        }
        if (plain.matches("\\.\\d+%") && PlanValues.isNumber(value)) {
            String digits = plain.substring(1, plain.length() - 1);
            return String.format(Locale.ROOT, "%." + digits + "f%%", PlanValues.toDouble(value) * 100);
        }
        if ((plain.isEmpty() || plain.equals("d")) && value instanceof Long l) {
            return grouping ? String.format(Locale.ROOT, "%,d", l) : Long.toString(l);
        }
        return PlanValues.str(value);
    }

    private Object comprehension(Comprehension comprehension, Scope scope) {
        Scope inner = new Scope(scope);
        List<Object> results = new ArrayList<>();
        for (Object item : PlanValues.iterate(eval(comprehension.iterable(), scope))) {
            inner.vars.put(comprehension.variable(), item);
            if (comprehension.condition() == null || PlanValues.truthy(eval(comprehension.condition(), inner))) {
                results.add(eval(comprehension.element(), inner));
            }
        }
        return results;
    }

    private void tick() {
        if (++operations > MAX_OPERATIONS) {
            throw new OperationLimitException();
        }
    }

    // --- Runtime structures ---

    private static final class Scope {
        private final Map<String, Object> vars = new HashMap<>();
        private final Scope parent;

        Scope(Scope parent) {
            this.parent = parent;
        }

        Object lookup(String name) {
            for (Scope s = this; s != null; s = s.parent) {
                if (s.vars.containsKey(name)) {
                    return s.vars.get(name);
                }
            }
            throw new PlanExecutionException("name '" + name + "' is not defined");
        }

        void set(String name, Object value) {
            vars.put(name, value);
        }
    }

    private final class UserFunction implements PlanCallable {
        private final FunctionDef def;
        private final Scope closure;

        UserFunction(FunctionDef def, Scope closure) {
            this.def = def;
            this.closure = closure;
        }

        @Override
        public Object call(List<Object> args, Map<String, Object> kwargs) {
            List<String> params = def.params();
            if (args.size() > params.size()) {
                throw new PlanExecutionException(def.name() + "() takes " + params.size()
                        + " positional arguments but " + args.size() + " were given");
            }
            Scope local = new Scope(closure);
            for (int i = 0; i < params.size(); i++) {
                String param = params.get(i);
                if (i < args.size()) {
                    local.set(param, args.get(i));
                } else if (kwargs.containsKey(param)) {
                    local.set(param, kwargs.get(param));
                } else {
                    throw new PlanExecutionException(def.name() + "() missing required argument '" + param + "'");
                }
            }
            if (++callDepth > MAX_CALL_DEPTH) {
                callDepth--;
                throw new PlanExecutionException("maximum recursion depth exceeded");
            }
            try {
                execBlock(def.body(), local);
                return null;
            } catch (ReturnSignal signal) {
                return signal.value;
            } catch (LoopSignal signal) {
                throw new PlanExecutionException("'break' or 'continue' outside loop");
            } finally {
                callDepth--;
            }
        }

        @Override
        public String toString() {
            return "<function " + def.name() + ">";
        }
    }

    private static final class ReturnSignal extends RuntimeException {
        private final transient Object value;

        ReturnSignal(Object value) {
            super(null, null, false, false);
            this.value = value;
        }
    }

    private static final class LoopSignal extends RuntimeException {
        static final LoopSignal BREAK = new LoopSignal();
        static final LoopSignal CONTINUE = new LoopSignal();

        private LoopSignal() {
            super(null, null, false, false);
        }
    }

    private static final class OperationLimitException extends PlanExecutionException {
        OperationLimitException() {
            super("plan exceeded " + MAX_OPERATIONS + " evaluation steps");
        }
    }
}
