package io.cortexr.sandbox;

import java.util.List;

/**
 * Syntax tree of plan code.
 */
final class PlanAst {

    private PlanAst() {
    }

    interface Stmt {
        int line();
    }

    interface Expr {
    }

    record Program(List<FunctionDef> functions, List<Stmt> topLevel) {
    }

    // --- Statements ---

    record FunctionDef(String name, List<String> params, List<Stmt> body, boolean async, int line) implements Stmt {
    }

    record Assign(Expr target, Expr value, int line) implements Stmt {
    }

    record AugAssign(Expr target, String op, Expr value, int line) implements Stmt {
    }

    record ExprStmt(Expr expr, int line) implements Stmt {
    }

    record Return(Expr value, int line) implements Stmt {
    }

    record If(Expr condition, List<Stmt> then, List<Stmt> otherwise, int line) implements Stmt {
    }

    record For(String variable, Expr iterable, List<Stmt> body, int line) implements Stmt {
    }

    record Try(List<Stmt> body, String errorName, List<Stmt> handler, int line) implements Stmt {
    }

    record Pass(int line) implements Stmt {
    }

    record Break(int line) implements Stmt {
    }

    record Continue(int line) implements Stmt {
    }

    // --- Expressions ---

    record Literal(Object value) implements Expr {
    }

    record Name(String id) implements Expr {
    }

    record FString(List<Object> parts) implements Expr {
    }

    /** One {@code {expr:spec}} field of an f-string. */
    record FormatField(Expr expr, String spec) {
    }

    record ListExpr(List<Expr> items) implements Expr {
    }

    record DictExpr(List<Expr> keys, List<Expr> values) implements Expr {
    }

    record Comprehension(Expr element, String variable, Expr iterable, Expr condition) implements Expr {
    }

    record Unary(String op, Expr operand) implements Expr {
    }

    record Binary(String op, Expr left, Expr right) implements Expr {
    }

    record Logical(String op, Expr left, Expr right) implements Expr {
    }

    record Compare(List<String> ops, List<Expr> operands) implements Expr {
    }

    record Conditional(Expr condition, Expr then, Expr otherwise) implements Expr {
    }

    record Attribute(Expr target, String name) implements Expr {
    }

    record Index(Expr target, Expr index) implements Expr {
    }

    record Slice(Expr target, Expr start, Expr stop) implements Expr {
    }

    record Call(Expr callee, List<Expr> args, List<String> keywordNames, List<Expr> keywordValues) implements Expr {
    }

    record Await(Expr operand) implements Expr {
    }
}
