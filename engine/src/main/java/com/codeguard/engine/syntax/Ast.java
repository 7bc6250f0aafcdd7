package com.codeguard.engine.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Syntax tree model for parsed Python snippets.
 *
 * Every node carries the {@link Span} of source text it was parsed from.
 * Nodes are immutable; editors never change a tree, they compute text edits
 * from spans and splice the original source.
 */
public final class Ast {

    private Ast() {}

    /**
     * Source range of a node.
     *
     * @param start  inclusive char offset
     * @param end    exclusive char offset
     * @param line   1-based line of {@code start}
     * @param column 0-based column of {@code start}
     */
    public record Span(int start, int end, int line, int column) {
        public Span to(Span other) {
            return new Span(start, other.end, line, column);
        }

        public String text(String source) {
            return source.substring(start, end);
        }
    }

    public interface Node {
        Span span();

        List<Node> children();
    }

    public interface Stmt extends Node {}

    public interface Expr extends Node {}

    /** Walk {@code root} and every descendant, parents before children. */
    public static void walk(Node root, Consumer<Node> visitor) {
        visitor.accept(root);
        for (Node child : root.children()) {
            walk(child, visitor);
        }
    }

    static List<Node> nodes(Object... parts) {
        List<Node> result = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Node n) {
                result.add(n);
            } else if (part instanceof Block b) {
                result.addAll(b.statements());
            } else if (part instanceof List<?> list) {
                for (Object o : list) {
                    if (o instanceof Node n) {
                        result.add(n);
                    }
                }
            }
        }
        return result;
    }

    // ------------------------------------------------------------------
    // Module and blocks
    // ------------------------------------------------------------------

    /** @param indentUnit one level of the snippet's block indentation: a tab, or N spaces (four by default) */
    public record Module(List<Stmt> body, String indentUnit, Span span) implements Node {
        public List<Node> children() { return nodes(body); }
    }

    /**
     * Statements of a compound statement's suite.
     *
     * @param inline true when the suite sits on the header's line
     *               ({@code def f(): pass})
     */
    public record Block(List<Stmt> statements, boolean inline, Span span) {}

    // ------------------------------------------------------------------
    // Definitions
    // ------------------------------------------------------------------

    public enum ParamKind { POSITIONAL_ONLY, POSITIONAL, VAR_POSITIONAL, KEYWORD_ONLY, VAR_KEYWORD }

    public record Param(String name, ParamKind kind, Expr annotation, Expr defaultValue, Span span) implements Node {
        public boolean hasDefault() { return defaultValue != null; }

        public List<Node> children() { return nodes(annotation, defaultValue); }
    }

    /**
     * @param keywordStart offset of the {@code def}/{@code async} keyword (after decorators)
     * @param colonEnd     offset just past the header's closing colon
     */
    public record FunctionDef(
            String     name,
            boolean    async,
            List<Expr> decorators,
            List<Param> params,
            Expr       returns,
            Block      body,
            int        keywordStart,
            int        colonEnd,
            Span       span) implements Stmt {

        public List<Node> children() { return nodes(decorators, params, returns, body); }
    }

    public record ClassDef(
            String        name,
            List<Expr>    decorators,
            List<Expr>    bases,
            List<Keyword> keywords,
            Block         body,
            Span          span) implements Stmt {

        public List<Node> children() { return nodes(decorators, bases, keywords, body); }
    }

    // ------------------------------------------------------------------
    // Simple statements
    // ------------------------------------------------------------------

    public record Return(Expr value, Span span) implements Stmt {
        public List<Node> children() { return nodes(value); }
    }

    public record Delete(List<Expr> targets, Span span) implements Stmt {
        public List<Node> children() { return nodes(targets); }
    }

    /** {@code a = b = value}: one entry in {@code targets} per {@code =}. */
    public record Assign(List<Expr> targets, Expr value, Span span) implements Stmt {
        public List<Node> children() { return nodes(targets, value); }
    }

    public record AugAssign(Expr target, String op, Expr value, Span span) implements Stmt {
        public List<Node> children() { return nodes(target, value); }
    }

    public record AnnAssign(Expr target, Expr annotation, Expr value, Span span) implements Stmt {
        public List<Node> children() { return nodes(target, annotation, value); }
    }

    public record Raise(Expr exception, Expr cause, Span span) implements Stmt {
        public List<Node> children() { return nodes(exception, cause); }
    }

    public record Assert(Expr test, Expr message, Span span) implements Stmt {
        public List<Node> children() { return nodes(test, message); }
    }

    public record Alias(String name, String asName) {}

    public record Import(List<Alias> names, Span span) implements Stmt {
        public List<Node> children() { return List.of(); }
    }

    /** @param module null for {@code from . import x} */
    public record ImportFrom(String module, int level, List<Alias> names, Span span) implements Stmt {
        public List<Node> children() { return List.of(); }
    }

    public record Global(List<String> names, Span span) implements Stmt {
        public List<Node> children() { return List.of(); }
    }

    public record Nonlocal(List<String> names, Span span) implements Stmt {
        public List<Node> children() { return List.of(); }
    }

    public record ExprStmt(Expr value, Span span) implements Stmt {
        public List<Node> children() { return nodes(value); }
    }

    public record Pass(Span span) implements Stmt {
        public List<Node> children() { return List.of(); }
    }

    public record Break(Span span) implements Stmt {
        public List<Node> children() { return List.of(); }
    }

    public record Continue(Span span) implements Stmt {
        public List<Node> children() { return List.of(); }
    }

    // ------------------------------------------------------------------
    // Compound statements
    // ------------------------------------------------------------------

    /** {@code elif} is an {@code orElse} block holding a single nested If. */
    public record If(Expr test, Block body, Block orElse, Span span) implements Stmt {
        public List<Node> children() { return nodes(test, body, orElse); }
    }

    public record While(Expr test, Block body, Block orElse, Span span) implements Stmt {
        public List<Node> children() { return nodes(test, body, orElse); }
    }

    public record For(boolean async, Expr target, Expr iter, Block body, Block orElse, Span span) implements Stmt {
        public List<Node> children() { return nodes(target, iter, body, orElse); }
    }

    public record WithItem(Expr context, Expr target, Span span) implements Node {
        public List<Node> children() { return nodes(context, target); }
    }

    public record With(boolean async, List<WithItem> items, Block body, Span span) implements Stmt {
        public List<Node> children() { return nodes(items, body); }
    }

    public record ExceptHandler(Expr type, String name, Block body, Span span) implements Node {
        public List<Node> children() { return nodes(type, body); }
    }

    public record Try(Block body, List<ExceptHandler> handlers, Block orElse, Block finalBody, Span span)
            implements Stmt {
        public List<Node> children() { return nodes(body, handlers, orElse, finalBody); }
    }

    /** {@code match subject:}; several comma-separated subjects form a {@link TupleExpr}. */
    public record Match(Expr subject, List<MatchCase> cases, Span span) implements Stmt {
        public List<Node> children() { return nodes(subject, cases); }
    }

    /** @param patterns capture names appear as {@link Name}, other pattern forms as {@link Other} */
    public record MatchCase(List<Expr> patterns, Expr guard, Block body, Span span) implements Node {
        public List<Node> children() { return nodes(patterns, guard, body); }
    }

    /** {@code type Alias = value}. */
    public record TypeAlias(Expr name, Expr value, Span span) implements Stmt {
        public List<Node> children() { return nodes(name, value); }
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    /**
     * Syntax with no dedicated record (generic and union annotations, match
     * patterns, ...).
     *
     * @param type the grammar's node type
     */
    public record Other(String type, List<Expr> parts, Span span) implements Expr {
        public List<Node> children() { return nodes(parts); }
    }

    public enum ConstKind { INT, FLOAT, IMAGINARY, STRING, BYTES, TRUE, FALSE, NONE, ELLIPSIS }

    /** @param text source text of the literal (all parts, for implicitly concatenated strings) */
    public record Constant(ConstKind kind, String text, Span span) implements Expr {
        public List<Node> children() { return List.of(); }
    }

    public record Name(String id, Span span) implements Expr {
        public List<Node> children() { return List.of(); }
    }

    public record Attribute(Expr value, String attr, Span span) implements Expr {
        public List<Node> children() { return nodes(value); }
    }

    public record Subscript(Expr value, Expr slice, Span span) implements Expr {
        public List<Node> children() { return nodes(value, slice); }
    }

    public record Slice(Expr lower, Expr upper, Expr step, Span span) implements Expr {
        public List<Node> children() { return nodes(lower, upper, step); }
    }

    /** @param arg null for {@code **mapping} */
    public record Keyword(String arg, Expr value, Span span) implements Node {
        public List<Node> children() { return nodes(value); }
    }

    /** @param args positional arguments, including {@link Starred} unpacking */
    public record Call(Expr func, List<Expr> args, List<Keyword> keywords, Span span) implements Expr {
        public List<Node> children() { return nodes(func, args, keywords); }
    }

    public record Starred(Expr value, Span span) implements Expr {
        public List<Node> children() { return nodes(value); }
    }

    public record BinOp(Expr left, String op, Expr right, Span span) implements Expr {
        public List<Node> children() { return nodes(left, right); }
    }

    public record UnaryOp(String op, Expr operand, Span span) implements Expr {
        public List<Node> children() { return nodes(operand); }
    }

    public record BoolOp(String op, List<Expr> values, Span span) implements Expr {
        public List<Node> children() { return nodes(values); }
    }

    public record Compare(Expr left, List<String> ops, List<Expr> comparators, Span span) implements Expr {
        public List<Node> children() { return nodes(left, comparators); }
    }

    public record IfExp(Expr test, Expr body, Expr orElse, Span span) implements Expr {
        public List<Node> children() { return nodes(test, body, orElse); }
    }

    public record Lambda(List<Param> params, Expr body, Span span) implements Expr {
        public List<Node> children() { return nodes(params, body); }
    }

    public record NamedExpr(Name target, Expr value, Span span) implements Expr {
        public List<Node> children() { return nodes(target, value); }
    }

    public record Await(Expr value, Span span) implements Expr {
        public List<Node> children() { return nodes(value); }
    }

    public record Yield(Expr value, boolean from, Span span) implements Expr {
        public List<Node> children() { return nodes(value); }
    }

    public record TupleExpr(List<Expr> elements, Span span) implements Expr {
        public List<Node> children() { return nodes(elements); }
    }

    public record ListExpr(List<Expr> elements, Span span) implements Expr {
        public List<Node> children() { return nodes(elements); }
    }

    public record SetExpr(List<Expr> elements, Span span) implements Expr {
        public List<Node> children() { return nodes(elements); }
    }

    /** A null key marks a {@code **mapping} entry. */
    public record DictExpr(List<Expr> keys, List<Expr> values, Span span) implements Expr {
        public List<Node> children() { return nodes(keys, values); }
    }

    public enum ComprehensionKind { LIST, SET, DICT, GENERATOR }

    public record ComprehensionFor(boolean async, Expr target, Expr iter, List<Expr> conditions, Span span)
            implements Node {
        public List<Node> children() { return nodes(target, iter, conditions); }
    }

    /** @param value dict comprehension value, null otherwise */
    public record Comprehension(
            ComprehensionKind      kind,
            Expr                   element,
            Expr                   value,
            List<ComprehensionFor> generators,
            Span                   span) implements Expr {

        public List<Node> children() { return nodes(element, value, generators); }
    }
}
