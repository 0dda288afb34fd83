package io.cortexr.sandbox;

import io.cortexr.sandbox.PlanAst.*;
import io.cortexr.sandbox.PlanLexer.Token;
import io.cortexr.sandbox.PlanLexer.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for plan code.
 *
 * <p>Accepts a small Python-like subset: function definitions, assignments, {@code if/elif/else},
 * {@code for ... in}, {@code try/except}, {@code return} and expressions including f-strings,
 * list comprehensions and {@code await}. Only the {@code json} and {@code re} modules may be
 * imported; any other import is rejected at parse time.</p>
 */
final class PlanParser {

    static final Set<String> ALLOWED_IMPORTS = Set.of("json", "re");

    private static final Set<String> COMPARE_OPS = Set.of("==", "!=", "<", ">", "<=", ">=");

    private final List<Token> tokens;
    private int pos;

    private PlanParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a complete plan.
     *
     * @throws PlanSyntaxException on malformed input or a forbidden import
     */
    static Program parse(String code) {
        return new PlanParser(PlanLexer.tokenize(code)).program();
    }

    /**
     * Parses a single expression, as found inside an f-string field.
     */
    static Expr parseExpression(String source, int line) {
        PlanParser parser = new PlanParser(PlanLexer.tokenize(source));
        Expr expr = parser.expression();
        parser.skipNewlines();
        if (parser.peek().type() != Type.EOF) {
            throw new PlanSyntaxException("invalid f-string expression '" + source.trim() + "'", line);
        }
        return expr;
    }

    private Program program() {
        List<FunctionDef> functions = new ArrayList<>();
        List<Stmt> topLevel = new ArrayList<>();
        skipNewlines();
        while (peek().type() != Type.EOF) {
            Token t = peek();
            if (t.isKeyword("import") || t.isKeyword("from")) {
                importStatement();
            } else if (t.isKeyword("def") || (t.isKeyword("async") && peekAt(1).isKeyword("def"))) {
                functions.add(functionDef());
            } else {
                topLevel.add(statement());
            }
            skipNewlines();
        }
        return new Program(functions, topLevel);
    }

    private void importStatement() {
        Token t = next();
        if (t.isKeyword("from")) {
            String module = expect(Type.NAME).text();
            checkImport(module, t.line());
            expectKeyword("import");
            do {
                expect(Type.NAME);
            } while (match(","));
        } else {
            do {
                checkImport(expect(Type.NAME).text(), t.line());
                if (peek().isKeyword("as")) {
                    throw new PlanSyntaxException("import aliases are not supported", t.line());
                }
            } while (match(","));
        }
        endOfStatement();
    }

    private static void checkImport(String module, int line) {
        if (!ALLOWED_IMPORTS.contains(module)) {
            throw new PlanSyntaxException("import of module '" + module + "' is not allowed", line);
        }
    }

    private FunctionDef functionDef() {
        boolean async = false;
        if (peek().isKeyword("async")) {
            next();
            async = true;
        }
        int line = expectKeyword("def").line();
        String name = expect(Type.NAME).text();
        expectOp("(");
        List<String> params = new ArrayList<>();
        if (!peek().isOp(")")) {
            do {
                params.add(expect(Type.NAME).text());
                if (match(":")) {
                    expression();
                }
            } while (match(",") && !peek().isOp(")"));
        }
        expectOp(")");
        if (match("->")) {
            expression();
        }
        expectOp(":");
        return new FunctionDef(name, params, block(), async, line);
    }

    private List<Stmt> block() {
        List<Stmt> body = new ArrayList<>();
        if (peek().type() != Type.NEWLINE) {
            body.add(simpleStatement());
            return body;
        }
        next();
        skipNewlines();
        expect(Type.INDENT);
        while (peek().type() != Type.DEDENT && peek().type() != Type.EOF) {
            body.add(statement());
            skipNewlines();
        }
        if (peek().type() == Type.DEDENT) {
            next();
        }
        return body;
    }

    private Stmt statement() {
        Token t = peek();
        if (t.isKeyword("if")) {
            next();
            return ifStatement(t.line());
        }
        if (t.isKeyword("for")) {
            return forStatement();
        }
        if (t.isKeyword("try")) {
            return tryStatement();
        }
        if (t.isKeyword("def") || t.isKeyword("async") && peekAt(1).isKeyword("def")) {
            return functionDef();
        }
        if (t.isKeyword("import") || t.isKeyword("from")) {
            importStatement();
            return new Pass(t.line());
        }
        if (t.isKeyword("while") || t.isKeyword("class") || t.isKeyword("lambda")
                || t.isKeyword("with") || t.isKeyword("global")) {
            throw new PlanSyntaxException("'" + t.text() + "' is not supported in plans", t.line());
        }
        return simpleStatement();
    }

    private Stmt simpleStatement() {
        Token t = peek();
        Stmt stmt;
        if (t.isKeyword("return")) {
            next();
            Expr value = atStatementEnd() ? null : expressionList();
            stmt = new Return(value, t.line());
        } else if (t.isKeyword("pass")) {
            next();
            stmt = new Pass(t.line());
        } else if (t.isKeyword("break")) {
            next();
            stmt = new Break(t.line());
        } else if (t.isKeyword("continue")) {
            next();
            stmt = new Continue(t.line());
        } else {
            Expr expr = expressionList();
            if (match("=")) {
                checkAssignable(expr, t.line());
                stmt = new Assign(expr, expressionList(), t.line());
            } else if (peek().isOp("+=") || peek().isOp("-=") || peek().isOp("*=")) {
                checkAssignable(expr, t.line());
                String op = next().text().substring(0, 1);
                stmt = new AugAssign(expr, op, expression(), t.line());
            } else {
                stmt = new ExprStmt(expr, t.line());
            }
        }
        endOfStatement();
        return stmt;
    }

    private static void checkAssignable(Expr target, int line) {
        if (!(target instanceof Name) && !(target instanceof Index)) {
            throw new PlanSyntaxException("cannot assign to expression", line);
        }
    }

    private Stmt ifStatement(int line) {
        Expr condition = expression();
        expectOp(":");
        List<Stmt> then = block();
        skipNewlines();
        List<Stmt> otherwise = List.of();
        Token t = peek();
        if (t.isKeyword("elif")) {
            next();
            otherwise = List.of(ifStatement(t.line()));
        } else if (t.isKeyword("else")) {
            next();
            expectOp(":");
            otherwise = block();
        }
        return new If(condition, then, otherwise, line);
    }

    private Stmt forStatement() {
        int line = expectKeyword("for").line();
        String variable = expect(Type.NAME).text();
        expectKeyword("in");
        Expr iterable = expression();
        expectOp(":");
        return new For(variable, iterable, block(), line);
    }

    private Stmt tryStatement() {
        int line = expectKeyword("try").line();
        expectOp(":");
        List<Stmt> body = block();
        skipNewlines();
        String errorName = null;
        List<Stmt> handler = List.of();
        boolean sawHandler = false;
        while (peek().isKeyword("except")) {
            next();
            if (!peek().isOp(":")) {
                expression();
                if (peek().isKeyword("as")) {
                    next();
                    errorName = expect(Type.NAME).text();
                }
            }
            expectOp(":");
            List<Stmt> clause = block();
            if (!sawHandler) {
                handler = clause;
                sawHandler = true;
            }
            skipNewlines();
        }
        if (peek().isKeyword("finally")) {
            throw new PlanSyntaxException("'finally' is not supported in plans", peek().line());
        }
        if (!sawHandler) {
            throw new PlanSyntaxException("'try' without 'except'", line);
        }
        return new Try(body, errorName, handler, line);
    }

    // --- Expressions ---

    /** A bare tuple such as {@code return a, b} evaluates to a list. */
    private Expr expressionList() {
        Expr first = expression();
        if (!peek().isOp(",")) {
            return first;
        }
        List<Expr> items = new ArrayList<>();
        items.add(first);
        while (match(",")) {
            if (atStatementEnd() || peek().isOp("=")) {
                break;
            }
            items.add(expression());
        }
        return new ListExpr(items);
    }

    private Expr expression() {
        Expr value = orExpr();
        if (peek().isKeyword("if")) {
            next();
            Expr condition = orExpr();
            expectKeyword("else");
            Expr otherwise = expression();
            return new Conditional(condition, value, otherwise);
        }
        return value;
    }

    private Expr orExpr() {
        Expr left = andExpr();
        while (peek().isKeyword("or")) {
            next();
            left = new Logical("or", left, andExpr());
        }
        return left;
    }

    private Expr andExpr() {
        Expr left = notExpr();
        while (peek().isKeyword("and")) {
            next();
            left = new Logical("and", left, notExpr());
        }
        return left;
    }

    private Expr notExpr() {
        if (peek().isKeyword("not")) {
            next();
            return new Unary("not", notExpr());
        }
        return comparison();
    }

    private Expr comparison() {
        Expr first = arith();
        List<String> ops = new ArrayList<>();
        List<Expr> operands = new ArrayList<>();
        operands.add(first);
        while (true) {
            Token t = peek();
            String op;
            if (t.type() == Type.OP && COMPARE_OPS.contains(t.text())) {
                next();
                op = t.text();
            } else if (t.isKeyword("in")) {
                next();
                op = "in";
            } else if (t.isKeyword("not") && peekAt(1).isKeyword("in")) {
                next();
                next();
                op = "not in";
            } else if (t.isKeyword("is")) {
                next();
                op = match("not") ? "is not" : "is";
            } else {
                break;
            }
            ops.add(op);
            operands.add(arith());
        }
        return ops.isEmpty() ? first : new Compare(ops, operands);
    }

    private Expr arith() {
        Expr left = term();
        while (peek().isOp("+") || peek().isOp("-")) {
            String op = next().text();
            left = new Binary(op, left, term());
        }
        return left;
    }

    private Expr term() {
        Expr left = factor();
        while (peek().isOp("*") || peek().isOp("/") || peek().isOp("//") || peek().isOp("%")) {
            String op = next().text();
            left = new Binary(op, left, factor());
        }
        return left;
    }

    private Expr factor() {
        if (peek().isOp("-") || peek().isOp("+")) {
            String op = next().text();
            return new Unary(op, factor());
        }
        return power();
    }

    private Expr power() {
        Expr base = awaitExpr();
        if (match("**")) {
            return new Binary("**", base, factor());
        }
        return base;
    }

    private Expr awaitExpr() {
        if (peek().isKeyword("await")) {
            next();
            return new Await(primary());
        }
        return primary();
    }

    private Expr primary() {
        Expr expr = atom();
        while (true) {
            if (match("(")) {
                expr = callArguments(expr);
            } else if (match("[")) {
                expr = subscript(expr);
            } else if (match(".")) {
                expr = new Attribute(expr, expect(Type.NAME).text());
            } else {
                return expr;
            }
        }
    }

    private Expr callArguments(Expr callee) {
        List<Expr> args = new ArrayList<>();
        List<String> keywordNames = new ArrayList<>();
        List<Expr> keywordValues = new ArrayList<>();
        while (!peek().isOp(")")) {
            if (peek().type() == Type.NAME && peekAt(1).isOp("=")) {
                keywordNames.add(next().text());
                next();
                keywordValues.add(expression());
            } else {
                if (!keywordNames.isEmpty()) {
                    throw new PlanSyntaxException("positional argument follows keyword argument", peek().line());
                }
                args.add(expression());
            }
            if (!match(",")) {
                break;
            }
        }
        expectOp(")");
        return new Call(callee, args, keywordNames, keywordValues);
    }

    private Expr subscript(Expr target) {
        Expr start = null;
        if (!peek().isOp(":")) {
            start = expression();
            if (match("]")) {
                return new Index(target, start);
            }
        }
        expectOp(":");
        Expr stop = peek().isOp("]") ? null : expression();
        expectOp("]");
        return new Slice(target, start, stop);
    }

    private Expr atom() {
        Token t = next();
        switch (t.type()) {
            case NUMBER:
                return new Literal(parseNumber(t));
            case STRING: {
                StringBuilder sb = new StringBuilder(t.text());
                while (peek().type() == Type.STRING) {
                    sb.append(next().text());
                }
                return new Literal(sb.toString());
            }
            case FSTRING:
                return fstring(t);
            case NAME:
                return switch (t.text()) {
                    case "True" -> new Literal(Boolean.TRUE);
                    case "False" -> new Literal(Boolean.FALSE);
                    case "None" -> new Literal(null);
                    default -> new Name(t.text());
                };
            case OP:
                if (t.isOp("(")) {
                    if (match(")")) {
                        return new ListExpr(List.of());
                    }
                    Expr inner = expression();
                    if (peek().isOp(",")) {
                        List<Expr> items = new ArrayList<>();
                        items.add(inner);
                        while (match(",") && !peek().isOp(")")) {
                            items.add(expression());
                        }
                        inner = new ListExpr(items);
                    }
                    expectOp(")");
                    return inner;
                }
                if (t.isOp("[")) {
                    return listDisplay();
                }
                if (t.isOp("{")) {
                    return dictDisplay();
                }
                break;
            default:
                break;
        }
        throw new PlanSyntaxException("unexpected token '" + describe(t) + "'", t.line());
    }

    private Expr listDisplay() {
        List<Expr> items = new ArrayList<>();
        if (match("]")) {
            return new ListExpr(items);
        }
        Expr first = expression();
        if (peek().isKeyword("for")) {
            next();
            String variable = expect(Type.NAME).text();
            expectKeyword("in");
            Expr iterable = orExpr();
            Expr condition = null;
            if (peek().isKeyword("if")) {
                next();
                condition = orExpr();
            }
            expectOp("]");
            return new Comprehension(first, variable, iterable, condition);
        }
        items.add(first);
        while (match(",") && !peek().isOp("]")) {
            items.add(expression());
        }
        expectOp("]");
        return new ListExpr(items);
    }

    private Expr dictDisplay() {
        List<Expr> keys = new ArrayList<>();
        List<Expr> values = new ArrayList<>();
        while (!peek().isOp("}")) {
            keys.add(expression());
            expectOp(":");
            values.add(expression());
            if (!match(",")) {
                break;
            }
        }
        expectOp("}");
        return new DictExpr(keys, values);
    }

    private Expr fstring(Token t) {
        String text = t.text();
        List<Object> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '{' && i + 1 < text.length() && text.charAt(i + 1) == '{') {
                literal.append('{');
                i += 2;
            } else if (c == '}' && i + 1 < text.length() && text.charAt(i + 1) == '}') {
                literal.append('}');
                i += 2;
            } else if (c == '{') {
                int end = findFieldEnd(text, i + 1, t.line());
                if (literal.length() > 0) {
                    parts.add(literal.toString());
                    literal.setLength(0);
                }
                parts.add(formatField(text.substring(i + 1, end), t.line()));
                i = end + 1;
            } else {
                literal.append(c);
                i++;
            }
        }
        if (literal.length() > 0) {
            parts.add(literal.toString());
        }
        return new FString(parts);
    }

    private static int findFieldEnd(String text, int from, int line) {
        int nesting = 0;
        char quote = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '{' || c == '[' || c == '(') {
                nesting++;
            } else if (c == ']' || c == ')') {
                nesting--;
            } else if (c == '}') {
                if (nesting == 0) {
                    return i;
                }
                nesting--;
            }
        }
        throw new PlanSyntaxException("unterminated f-string field", line);
    }

    private static FormatField formatField(String field, int line) {
        String source = field;
        String spec = null;
        int nesting = 0;
        char quote = 0;
        for (int i = 0; i < field.length(); i++) {
            char c = field.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '[' || c == '(' || c == '{') {
                nesting++;
            } else if (c == ']' || c == ')' || c == '}') {
                nesting--;
            } else if (c == ':' && nesting == 0) {
                source = field.substring(0, i);
                spec = field.substring(i + 1);
                break;
            } else if (c == '!' && nesting == 0 && i + 1 < field.length() && field.charAt(i + 1) != '=') {
                source = field.substring(0, i);
                break;
            }
        }
        if (source.endsWith("=")) {
            source = source.substring(0, source.length() - 1);
        }
        return new FormatField(parseExpression(source, line), spec);
    }

    private static Object parseNumber(Token t) {
        String text = t.text();
        try {
            if (text.contains(".") || text.contains("e") || text.contains("E")) {
                return Double.parseDouble(text);
            }
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new PlanSyntaxException("invalid number literal '" + text + "'", t.line());
        }
    }

    // --- Token helpers ---

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        int i = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(i);
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.type() != Type.EOF) {
            pos++;
        }
        return t;
    }

    private boolean match(String op) {
        Token t = peek();
        if (t.isOp(op) || (t.type() == Type.NAME && t.text().equals(op))) {
            pos++;
            return true;
        }
        return false;
    }

    private Token expect(Type type) {
        Token t = peek();
        if (t.type() != type) {
            throw new PlanSyntaxException("expected " + type.name().toLowerCase()
                    + " but found '" + describe(t) + "'", t.line());
        }
        return next();
    }

    private Token expectOp(String op) {
        Token t = peek();
        if (!t.isOp(op)) {
            throw new PlanSyntaxException("expected '" + op + "' but found '" + describe(t) + "'", t.line());
        }
        return next();
    }

    private Token expectKeyword(String keyword) {
        Token t = peek();
        if (!t.isKeyword(keyword)) {
            throw new PlanSyntaxException("expected '" + keyword + "' but found '" + describe(t) + "'", t.line());
        }
        return next();
    }

    private boolean atStatementEnd() {
        Type type = peek().type();
        return type == Type.NEWLINE || type == Type.EOF || type == Type.DEDENT;
    }

    private void endOfStatement() {
        Token t = peek();
        if (t.type() == Type.NEWLINE) {
            next();
        } else if (t.type() != Type.EOF && t.type() != Type.DEDENT) {
            throw new PlanSyntaxException("unexpected token '" + describe(t) + "'", t.line());
        }
    }

    private void skipNewlines() {
        while (peek().type() == Type.NEWLINE) {
            next();
        }
    }

    private static String describe(Token t) {
        return switch (t.type()) {
            case NEWLINE -> "newline";
            case INDENT -> "indent";
            case DEDENT -> "dedent";
            case EOF -> "end of input";
            default -> t.text();
        };
    }
}
