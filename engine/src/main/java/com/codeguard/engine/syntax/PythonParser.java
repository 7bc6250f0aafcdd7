package com.codeguard.engine.syntax;

import com.codeguard.engine.syntax.Ast.*;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds an {@link Ast.Module} from the tree-sitter-python syntax tree of a
 * snippet.
 *
 * <p>The grammar is more permissive than CPython in a few places, so after
 * rejecting any ERROR or MISSING node the conversion also enforces what
 * CPython's parser would: consistent block indentation, no required parameter
 * after a defaulted one, no positional argument after a keyword argument and
 * no Python 2 {@code print}/{@code exec} statements.
 */
public final class PythonParser {

    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await",
            "break", "class", "continue", "def", "del", "elif", "else", "except",
            "finally", "for", "from", "global", "if", "import", "in", "is",
            "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try",
            "while", "with", "yield");

    private static final Set<String> TRIVIA = Set.of("comment", "line_continuation");

    private static final Set<String> LITERALS = Set.of(
            "integer", "float", "string", "concatenated_string", "true", "false", "none");

    private static final String DEFAULT_INDENT = "    ";

    private final SourceTree tree;
    private final String     source;

    private int     smallestStep = Integer.MAX_VALUE;
    private boolean tabs;

    private PythonParser(SourceTree tree) {
        this.tree   = tree;
        this.source = tree.source();
    }

    /**
     * Parse {@code source} into a module tree.
     *
     * @throws SyntaxFailure with the line and column of the first error
     */
    public static Ast.Module parse(String source) {
        SourceTree tree = SourceTree.parse(source);
        TSNode error = firstError(tree.root());
        if (error != null) {
            String detail = !error.isMissing() ? "invalid syntax"
                    : error.isNamed() ? "expected " + error.getType()
                    : "expected '" + error.getType() + "'";
            // a missing token is reported where the previous token ends
            int at = error.isMissing()
                    ? tree.offset(lastTokenEnd(tree.root(), error.getStartByte(), 0))
                    : tree.start(error);
            throw new SyntaxFailure(tree.line(at), tree.column(at), detail);
        }
        return new PythonParser(tree).module(tree.root());
    }

    /** True for Python's reserved words (soft keywords excluded). */
    public static boolean isKeyword(String word) {
        return KEYWORDS.contains(word);
    }

    /** First ERROR or MISSING node in document order, or null. */
    private static TSNode firstError(TSNode node) {
        if (node.isMissing() || node.getType().equals("ERROR")) {
            return node;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode found = firstError(node.getChild(i));
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /** Largest end byte of a non-empty leaf ending at or before {@code bound}. */
    private static int lastTokenEnd(TSNode node, int bound, int best) {
        if (node.getStartByte() >= bound && node.getEndByte() > node.getStartByte()) {
            return best;
        }
        if (node.getChildCount() == 0) {
            return node.getEndByte() > node.getStartByte() && node.getEndByte() <= bound
                    ? Math.max(best, node.getEndByte()) : best;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            best = lastTokenEnd(node.getChild(i), bound, best);
        }
        return best;
    }

    private Ast.Module module(TSNode root) {
        List<Stmt> body = new ArrayList<>();
        for (TSNode child : named(root)) {
            Stmt stmt = statement(child);
            if (startsLine(stmt.span().start()) && stmt.span().column() != 0) {
                throw fail(stmt.span(), "unexpected indent");
            }
            body.add(stmt);
        }
        String unit = tabs ? "\t" : smallestStep == Integer.MAX_VALUE ? DEFAULT_INDENT : " ".repeat(smallestStep);
        return new Ast.Module(body, unit, tree.span(0, source.length()));
    }

    // ------------------------------------------------------------------
    // Blocks
    // ------------------------------------------------------------------

    /** The suite {@code node} of the compound statement or clause {@code owner}. */
    private Block block(TSNode owner, TSNode node) {
        List<TSNode> children = node == null ? List.of() : named(node);
        if (children.isEmpty()) {
            throw fail(tree.span(node != null ? node : owner), "expected an indented block");
        }
        List<Stmt> stmts = new ArrayList<>();
        for (TSNode child : children) {
            stmts.add(statement(child));
        }
        TSNode colon = colonBefore(owner, node);
        int headerLine = tree.line(tree.start(colon != null ? colon : owner));
        boolean inline = stmts.get(0).span().line() == headerLine;
        if (!inline) {
            checkIndentation(tree.column(tree.start(owner)), stmts);
        }
        return new Block(stmts, inline, stmts.get(0).span().to(stmts.get(stmts.size() - 1).span()));
    }

    private void checkIndentation(int headerColumn, List<Stmt> stmts) {
        Span first = stmts.get(0).span();
        int column = first.column();
        if (column <= headerColumn) {
            throw fail(first, "expected an indented block");
        }
        String indent = source.substring(first.start() - column, first.start());
        if (indent.indexOf('\t') >= 0) {
            tabs = true;
        } else {
            smallestStep = Math.min(smallestStep, column - headerColumn);
        }
        for (Stmt stmt : stmts) {
            Span s = stmt.span();
            if (!startsLine(s.start())) {
                continue;
            }
            if (s.column() > column) {
                throw fail(s, "unexpected indent");
            }
            if (s.column() < column) {
                throw fail(s, "unindent does not match any outer indentation level");
            }
        }
    }

    /** The {@code :} token that introduces {@code block} inside {@code owner}. */
    private static TSNode colonBefore(TSNode owner, TSNode block) {
        if (block == null) {
            return null;
        }
        TSNode colon = null;
        for (int i = 0; i < owner.getChildCount(); i++) {
            TSNode child = owner.getChild(i);
            if (child.getStartByte() >= block.getStartByte() && !child.getType().equals(":")) {
                break;
            }
            if (child.getType().equals(":")) {
                colon = child;
            }
        }
        return colon;
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    private Stmt statement(TSNode n) {
        Span span = tree.span(n);
        switch (n.getType()) {
            case "expression_statement":   return expressionStatement(n);
            case "return_statement": {
                TSNode value = firstNamed(n);
                return new Return(value == null ? null : expr(value), span);
            }
            case "pass_statement":         return new Pass(span);
            case "break_statement":        return new Break(span);
            case "continue_statement":     return new Continue(span);
            case "delete_statement":       return new Delete(elements(firstNamed(n)), span);
            case "raise_statement":        return raise(n);
            case "assert_statement": {
                List<TSNode> parts = named(n);
                return new Assert(expr(parts.get(0)), parts.size() > 1 ? expr(parts.get(1)) : null, span);
            }
            case "import_statement":       return new Import(aliases(n, null), span);
            case "import_from_statement":  return importFrom(n);
            case "future_import_statement": return new ImportFrom("__future__", 0, aliases(n, null), span);
            case "global_statement":       return new Global(identifiers(n), span);
            case "nonlocal_statement":     return new Nonlocal(identifiers(n), span);
            case "type_alias_statement": {
                List<TSNode> parts = named(n);
                TSNode left  = field(n, "left");
                TSNode right = field(n, "right");
                return new TypeAlias(expr(left != null ? left : parts.get(parts.size() - 2)),
                        expr(right != null ? right : parts.get(parts.size() - 1)), span);
            }
            case "print_statement":
            case "exec_statement":
                throw fail(span, "Missing parentheses in call to '" + n.getChild(0).getType() + "'");
            case "if_statement":           return ifStatement(n);
            case "for_statement":          return forStatement(n);
            case "while_statement":        return whileStatement(n);
            case "try_statement":          return tryStatement(n);
            case "with_statement":         return withStatement(n);
            case "function_definition":    return functionDef(n, List.of(), n);
            case "class_definition":       return classDef(n, List.of(), n);
            case "decorated_definition":   return decorated(n);
            case "match_statement":        return match(n);
            default:                       return new ExprStmt(other(n), span);
        }
    }

    private Stmt expressionStatement(TSNode n) {
        List<TSNode> parts = named(n);
        Span span = tree.span(n);
        if (parts.size() > 1) {
            return new ExprStmt(new TupleExpr(exprs(parts), span), span);
        }
        TSNode only = parts.get(0);
        switch (only.getType()) {
            case "assignment":
                return assignment(only, span);
            case "augmented_assignment":
                return new AugAssign(expr(field(only, "left")), tree.text(field(only, "operator")),
                        expr(field(only, "right")), span);
            default:
                return new ExprStmt(expr(only), span);
        }
    }

    /** {@code a = b = v} nests as assignments on the right; flatten into one target per {@code =}. */
    private Stmt assignment(TSNode node, Span span) {
        List<Expr> targets = new ArrayList<>();
        TSNode current = node;
        while (true) {
            TSNode left  = field(current, "left");
            TSNode type  = field(current, "type");
            TSNode right = field(current, "right");
            if (type != null) {
                if (!targets.isEmpty()) {
                    throw fail(tree.span(type), "invalid syntax");
                }
                return new AnnAssign(expr(left), expr(type), right == null ? null : expr(right), span);
            }
            targets.add(expr(left));
            if (right != null && right.getType().equals("assignment")) {
                current = right;
                continue;
            }
            if (right == null || right.getType().equals("augmented_assignment")) {
                throw fail(tree.span(right != null ? right : current), "invalid syntax");
            }
            return new Assign(targets, expr(right), span);
        }
    }

    private Raise raise(TSNode n) {
        TSNode cause = field(n, "cause");
        TSNode exception = null;
        for (TSNode child : named(n)) {
            if (cause == null || !same(child, cause)) {
                exception = child;
                break;
            }
        }
        return new Raise(exception == null ? null : expr(exception), cause == null ? null : expr(cause),
                tree.span(n));
    }

    private ImportFrom importFrom(TSNode n) {
        TSNode moduleNode = field(n, "module_name");
        String module = null;
        int level = 0;
        if (moduleNode.getType().equals("relative_import")) {
            for (TSNode part : named(moduleNode)) {
                if (part.getType().equals("import_prefix")) {
                    level = tree.text(part).replaceAll("[^.]", "").length();
                } else {
                    module = dotted(part);
                }
            }
        } else {
            module = dotted(moduleNode);
        }
        return new ImportFrom(module, level, aliases(n, moduleNode), tree.span(n));
    }

    /** Imported names of an import statement, skipping {@code except} (the module of a from-import). */
    private List<Alias> aliases(TSNode n, TSNode except) {
        List<Alias> names = new ArrayList<>();
        for (TSNode child : named(n)) {
            if (except != null && same(child, except)) {
                continue;
            }
            switch (child.getType()) {
                case "wildcard_import":
                    names.add(new Alias("*", null));
                    break;
                case "aliased_import":
                    names.add(new Alias(dotted(field(child, "name")), tree.text(field(child, "alias"))));
                    break;
                case "dotted_name":
                    names.add(new Alias(dotted(child), null));
                    break;
                default:
                    break;
            }
        }
        return names;
    }

    private List<String> identifiers(TSNode n) {
        List<String> names = new ArrayList<>();
        for (TSNode child : named(n)) {
            names.add(tree.text(child));
        }
        return names;
    }

    private If ifStatement(TSNode n) {
        Expr test  = expr(field(n, "condition"));
        Block body = block(n, field(n, "consequence"));
        List<TSNode> alternatives = new ArrayList<>();
        for (TSNode child : named(n)) {
            if (child.getType().equals("elif_clause") || child.getType().equals("else_clause")) {
                alternatives.add(child);
            }
        }
        Block orElse = elseChain(alternatives, 0);
        return new If(test, body, orElse, tree.span(tree.start(n), (orElse != null ? orElse : body).span().end()));
    }

    /** {@code elif} becomes an else-block holding one nested {@link If}. */
    private Block elseChain(List<TSNode> alternatives, int index) {
        if (index >= alternatives.size()) {
            return null;
        }
        TSNode clause = alternatives.get(index);
        if (clause.getType().equals("else_clause")) {
            return block(clause, field(clause, "body"));
        }
        Expr test  = expr(field(clause, "condition"));
        Block body = block(clause, field(clause, "consequence"));
        Block rest = elseChain(alternatives, index + 1);
        If nested = new If(test, body, rest,
                tree.span(tree.start(clause), (rest != null ? rest : body).span().end()));
        return new Block(List.of(nested), false, nested.span());
    }

    private For forStatement(TSNode n) {
        Expr target = expr(field(n, "left"));
        Expr iter   = expr(field(n, "right"));
        Block body  = block(n, field(n, "body"));
        Block orElse = elseBlock(n);
        return new For(startsWithAsync(n), target, iter, body, orElse,
                tree.span(tree.start(n), (orElse != null ? orElse : body).span().end()));
    }

    private While whileStatement(TSNode n) {
        Expr test  = expr(field(n, "condition"));
        Block body = block(n, field(n, "body"));
        Block orElse = elseBlock(n);
        return new While(test, body, orElse,
                tree.span(tree.start(n), (orElse != null ? orElse : body).span().end()));
    }

    private Block elseBlock(TSNode n) {
        TSNode clause = childOfType(n, "else_clause");
        return clause == null ? null : block(clause, field(clause, "body"));
    }

    private Try tryStatement(TSNode n) {
        Block body = block(n, field(n, "body"));
        List<ExceptHandler> handlers = new ArrayList<>();
        Block orElse    = null;
        Block finalBody = null;
        for (TSNode child : named(n)) {
            switch (child.getType()) {
                case "except_clause":
                case "except_group_clause":
                    handlers.add(handler(child));
                    break;
                case "else_clause":
                    orElse = block(child, field(child, "body"));
                    break;
                case "finally_clause":
                    finalBody = block(child, childOfType(child, "block"));
                    break;
                default:
                    break;
            }
        }
        Block last = finalBody != null ? finalBody
                : orElse != null ? orElse
                : !handlers.isEmpty() ? handlers.get(handlers.size() - 1).body()
                : body;
        return new Try(body, handlers, orElse, finalBody, tree.span(tree.start(n), last.span().end()));
    }

    private ExceptHandler handler(TSNode clause) {
        TSNode blockNode = childOfType(clause, "block");
        List<TSNode> parts = new ArrayList<>();
        for (TSNode child : named(clause)) {
            if (blockNode == null || !same(child, blockNode)) {
                parts.add(child);
            }
        }
        Expr type = null;
        String name = null;
        if (!parts.isEmpty()) {
            TSNode first = parts.get(0);
            if (first.getType().equals("as_pattern")) {
                type = expr(firstNamed(first));
                TSNode alias = field(first, "alias");
                name = alias == null ? null : tree.text(alias).strip();
            } else {
                type = expr(first);
                if (parts.size() > 1) {
                    name = tree.text(parts.get(1)).strip();
                }
            }
        }
        Block body = block(clause, blockNode);
        return new ExceptHandler(type, name, body, tree.span(tree.start(clause), body.span().end()));
    }

    private With withStatement(TSNode n) {
        List<WithItem> items = new ArrayList<>();
        TSNode clause = childOfType(n, "with_clause");
        for (TSNode item : clause == null ? List.<TSNode>of() : named(clause)) {
            if (!item.getType().equals("with_item")) {
                continue;
            }
            TSNode value = field(item, "value");
            if (value == null) {
                value = firstNamed(item);
            }
            Expr context = expr(value);
            Expr target  = null;
            if (value.getType().equals("as_pattern")) {
                context = expr(firstNamed(value));
                TSNode alias = field(value, "alias");
                if (alias != null) {
                    target = expr(alias.getType().equals("as_pattern_target") ? firstNamed(alias) : alias);
                }
            }
            items.add(new WithItem(context, target, tree.span(item)));
        }
        Block body = block(n, field(n, "body"));
        return new With(startsWithAsync(n), items, body, tree.span(tree.start(n), body.span().end()));
    }

    private Stmt decorated(TSNode n) {
        List<Expr> decorators = new ArrayList<>();
        for (TSNode child : named(n)) {
            if (child.getType().equals("decorator")) {
                decorators.add(expr(firstNamed(child)));
            }
        }
        TSNode definition = field(n, "definition");
        if (definition.getType().equals("class_definition")) {
            return classDef(definition, decorators, n);
        }
        return functionDef(definition, decorators, n);
    }

    /** @param outer the node the definition's span starts at (its first decorator, if any) */
    private FunctionDef functionDef(TSNode n, List<Expr> decorators, TSNode outer) {
        String name = tree.text(field(n, "name"));
        List<Param> params = parameters(field(n, "parameters"));
        TSNode returns  = field(n, "return_type");
        TSNode bodyNode = field(n, "body");
        TSNode colon    = colonBefore(n, bodyNode);
        Block body = block(n, bodyNode);
        return new FunctionDef(name, startsWithAsync(n), decorators, params,
                returns == null ? null : expr(returns), body,
                tree.start(n), colon != null ? tree.end(colon) : body.span().start(),
                tree.span(tree.start(outer), body.span().end()));
    }

    private List<Param> parameters(TSNode node) {
        List<Param> params = new ArrayList<>();
        if (node == null) {
            return params;
        }
        boolean keywordOnly = false;
        boolean sawDefault  = false;
        for (TSNode p : named(node)) {
            Span span = tree.span(p);
            switch (p.getType()) {
                case "positional_separator": {
                    List<Param> marked = new ArrayList<>();
                    for (Param param : params) {
                        marked.add(new Param(param.name(), ParamKind.POSITIONAL_ONLY,
                                param.annotation(), param.defaultValue(), param.span()));
                    }
                    params = marked;
                    break;
                }
                case "keyword_separator":
                    keywordOnly = true;
                    break;
                case "list_splat_pattern":
                    keywordOnly = true;
                    params.add(new Param(tree.text(firstNamed(p)), ParamKind.VAR_POSITIONAL, null, null, span));
                    break;
                case "dictionary_splat_pattern":
                    params.add(new Param(tree.text(firstNamed(p)), ParamKind.VAR_KEYWORD, null, null, span));
                    break;
                case "typed_parameter": {
                    TSNode inner = firstNamed(p);
                    Expr annotation = expr(field(p, "type"));
                    if (inner.getType().equals("list_splat_pattern")) {
                        keywordOnly = true;
                        params.add(new Param(tree.text(firstNamed(inner)), ParamKind.VAR_POSITIONAL,
                                annotation, null, span));
                    } else if (inner.getType().equals("dictionary_splat_pattern")) {
                        params.add(new Param(tree.text(firstNamed(inner)), ParamKind.VAR_KEYWORD,
                                annotation, null, span));
                    } else {
                        if (sawDefault && !keywordOnly) {
                            throw fail(span, "non-default argument follows default argument");
                        }
                        params.add(new Param(tree.text(inner), kind(keywordOnly), annotation, null, span));
                    }
                    break;
                }
                case "default_parameter":
                case "typed_default_parameter": {
                    TSNode type = field(p, "type");
                    sawDefault = true;
                    params.add(new Param(tree.text(field(p, "name")), kind(keywordOnly),
                            type == null ? null : expr(type), expr(field(p, "value")), span));
                    break;
                }
                case "identifier":
                    if (sawDefault && !keywordOnly) {
                        throw fail(span, "non-default argument follows default argument");
                    }
                    params.add(new Param(tree.text(p), kind(keywordOnly), null, null, span));
                    break;
                default:
                    throw fail(span, "invalid syntax");
            }
        }
        return params;
    }

    private static ParamKind kind(boolean keywordOnly) {
        return keywordOnly ? ParamKind.KEYWORD_ONLY : ParamKind.POSITIONAL;
    }

    private ClassDef classDef(TSNode n, List<Expr> decorators, TSNode outer) {
        String name = tree.text(field(n, "name"));
        List<Expr>    bases    = new ArrayList<>();
        List<Keyword> keywords = new ArrayList<>();
        TSNode superclasses = field(n, "superclasses");
        if (superclasses != null) {
            arguments(superclasses, bases, keywords);
        }
        Block body = block(n, field(n, "body"));
        return new ClassDef(name, decorators, bases, keywords, body,
                tree.span(tree.start(outer), body.span().end()));
    }

    private Match match(TSNode n) {
        TSNode body = field(n, "body");
        List<TSNode> subjects = new ArrayList<>();
        for (TSNode child : named(n)) {
            if (body == null || !same(child, body)) {
                subjects.add(child);
            }
        }
        Expr subject = subjects.size() == 1 ? expr(subjects.get(0))
                : new TupleExpr(exprs(subjects), tree.span(tree.start(subjects.get(0)),
                        tree.end(subjects.get(subjects.size() - 1))));
        List<MatchCase> cases = new ArrayList<>();
        for (TSNode clause : body == null ? List.<TSNode>of() : named(body)) {
            if (clause.getType().equals("case_clause")) {
                cases.add(matchCase(clause));
            }
        }
        if (cases.isEmpty()) {
            throw fail(tree.span(n), "expected an indented block");
        }
        return new Match(subject, cases,
                tree.span(tree.start(n), cases.get(cases.size() - 1).span().end()));
    }

    private MatchCase matchCase(TSNode clause) {
        List<Expr> patterns = new ArrayList<>();
        for (TSNode child : named(clause)) {
            if (child.getType().equals("case_pattern")) {
                patterns.add(pattern(child));
            }
        }
        TSNode guard = field(clause, "guard");
        Block body = block(clause, field(clause, "consequence"));
        return new MatchCase(patterns, guard == null ? null : expr(firstNamed(guard)), body,
                tree.span(tree.start(clause), body.span().end()));
    }

    /** Capture names become {@link Name}s, dotted value patterns attribute chains, the rest {@link Other}. */
    private Expr pattern(TSNode n) {
        String type = n.getType();
        if (type.equals("identifier")) {
            return new Name(tree.text(n), tree.span(n));
        }
        if (type.equals("dotted_name")) {
            return dottedExpr(n);
        }
        if (LITERALS.contains(type)) {
            return expr(n);
        }
        List<TSNode> parts = named(n);
        if (type.equals("case_pattern") && parts.size() == 1) {
            return pattern(parts.get(0));
        }
        List<Expr> converted = new ArrayList<>();
        for (TSNode part : parts) {
            converted.add(pattern(part));
        }
        return new Other(type, converted, tree.span(n));
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    private Expr expr(TSNode n) {
        Span span = tree.span(n);
        switch (n.getType()) {
            case "identifier":
            case "keyword_identifier":
                return new Name(tree.text(n), span);
            case "integer":
            case "float":
                return new Constant(numberKind(tree.text(n)), tree.text(n), span);
            case "string":
            case "concatenated_string":
                return string(n);
            case "true":     return new Constant(ConstKind.TRUE, tree.text(n), span);
            case "false":    return new Constant(ConstKind.FALSE, tree.text(n), span);
            case "none":     return new Constant(ConstKind.NONE, tree.text(n), span);
            case "ellipsis": return new Constant(ConstKind.ELLIPSIS, tree.text(n), span);
            case "attribute":
                return new Attribute(expr(field(n, "object")), tree.text(field(n, "attribute")), span);
            case "subscript":
                return subscript(n);
            case "slice":
                return slice(n);
            case "call":
                return call(n);
            case "binary_operator":
                return new BinOp(expr(field(n, "left")), tree.text(field(n, "operator")),
                        expr(field(n, "right")), span);
            case "unary_operator":
                return new UnaryOp(tree.text(field(n, "operator")), expr(field(n, "argument")), span);
            case "not_operator":
                return new UnaryOp("not", expr(field(n, "argument")), span);
            case "boolean_operator": {
                String op = tree.text(field(n, "operator"));
                List<Expr> values = new ArrayList<>();
                flattenBoolean(n, op, values);
                return new BoolOp(op, values, span);
            }
            case "comparison_operator":
                return compare(n);
            case "conditional_expression": {
                List<TSNode> parts = named(n);
                return new IfExp(expr(parts.get(1)), expr(parts.get(0)), expr(parts.get(2)), span);
            }
            case "lambda":
                return new Lambda(parameters(field(n, "parameters")), expr(field(n, "body")), span);
            case "named_expression": {
                TSNode name = field(n, "name");
                return new NamedExpr(new Name(tree.text(name), tree.span(name)), expr(field(n, "value")), span);
            }
            case "await":
                return new Await(expr(firstNamed(n)), span);
            case "yield": {
                TSNode value = firstNamed(n);
                return new Yield(value == null ? null : expr(value), childOfType(n, "from") != null, span);
            }
            case "parenthesized_expression":
                return expr(firstNamed(n));
            case "tuple":
            case "expression_list":
            case "pattern_list":
            case "tuple_pattern":
                return new TupleExpr(exprs(named(n)), span);
            case "list":
            case "list_pattern":
                return new ListExpr(exprs(named(n)), span);
            case "set":
                return new SetExpr(exprs(named(n)), span);
            case "dictionary":
                return dictionary(n);
            case "list_comprehension":       return comprehension(n, ComprehensionKind.LIST);
            case "set_comprehension":        return comprehension(n, ComprehensionKind.SET);
            case "dictionary_comprehension": return comprehension(n, ComprehensionKind.DICT);
            case "generator_expression":     return comprehension(n, ComprehensionKind.GENERATOR);
            case "list_splat":
            case "list_splat_pattern":
                return new Starred(expr(firstNamed(n)), span);
            case "type": {
                List<TSNode> parts = named(n);
                return parts.size() == 1 ? expr(parts.get(0)) : other(n);
            }
            default:
                return other(n);
        }
    }

    /** Syntax the model has no record for; its named parts stay reachable as children. */
    private Other other(TSNode n) {
        return new Other(n.getType(), exprs(named(n)), tree.span(n));
    }

    private List<Expr> exprs(List<TSNode> nodes) {
        List<Expr> out = new ArrayList<>();
        for (TSNode node : nodes) {
            out.add(expr(node));
        }
        return out;
    }

    /** Targets of {@code del}: the items of a bare tuple, otherwise the single expression. */
    private List<Expr> elements(TSNode n) {
        if (n.getType().equals("expression_list")) {
            return exprs(named(n));
        }
        return List.of(expr(n));
    }

    private Expr string(TSNode n) {
        String text = tree.text(n);
        TSNode first = n.getType().equals("concatenated_string") ? firstNamed(n) : n;
        String firstText = tree.text(first);
        int quote = 0;
        while (quote < firstText.length() && firstText.charAt(quote) != '"' && firstText.charAt(quote) != '\'') {
            quote++;
        }
        boolean bytes = firstText.substring(0, quote).toLowerCase(Locale.ROOT).contains("b");
        return new Constant(bytes ? ConstKind.BYTES : ConstKind.STRING, text, tree.span(n));
    }

    private Expr subscript(TSNode n) {
        TSNode value = field(n, "value");
        List<TSNode> slices = new ArrayList<>();
        for (TSNode child : named(n)) {
            if (!same(child, value)) {
                slices.add(child);
            }
        }
        Expr slice = slices.size() == 1 ? expr(slices.get(0))
                : new TupleExpr(exprs(slices),
                        tree.span(tree.start(slices.get(0)), tree.end(slices.get(slices.size() - 1))));
        return new Subscript(expr(value), slice, tree.span(n));
    }

    private Expr slice(TSNode n) {
        Expr[] parts = new Expr[3];
        int index = 0;
        for (int i = 0; i < n.getChildCount(); i++) {
            TSNode child = n.getChild(i);
            if (child.getType().equals(":")) {
                index++;
            } else if (child.isNamed() && !TRIVIA.contains(child.getType())) {
                parts[Math.min(index, 2)] = expr(child);
            }
        }
        return new Slice(parts[0], parts[1], parts[2], tree.span(n));
    }

    private Expr call(TSNode n) {
        Expr func = expr(field(n, "function"));
        TSNode arguments = field(n, "arguments");
        List<Expr>    args     = new ArrayList<>();
        List<Keyword> keywords = new ArrayList<>();
        if (arguments.getType().equals("generator_expression")) {
            args.add(expr(arguments));
        } else {
            arguments(arguments, args, keywords);
        }
        return new Call(func, args, keywords, tree.span(n));
    }

    private void arguments(TSNode list, List<Expr> args, List<Keyword> keywords) {
        for (TSNode a : named(list)) {
            Span span = tree.span(a);
            switch (a.getType()) {
                case "keyword_argument":
                    keywords.add(new Keyword(tree.text(field(a, "name")), expr(field(a, "value")), span));
                    break;
                case "dictionary_splat":
                    keywords.add(new Keyword(null, expr(firstNamed(a)), span));
                    break;
                case "list_splat":
                    args.add(new Starred(expr(firstNamed(a)), span));
                    break;
                default:
                    if (keywords.stream().anyMatch(k -> k.arg() != null)) {
                        throw fail(span, "positional argument follows keyword argument");
                    }
                    args.add(expr(a));
                    break;
            }
        }
    }

    private void flattenBoolean(TSNode n, String op, List<Expr> out) {
        if (n.getType().equals("boolean_operator") && tree.text(field(n, "operator")).equals(op)) {
            flattenBoolean(field(n, "left"), op, out);
            flattenBoolean(field(n, "right"), op, out);
        } else {
            out.add(expr(n));
        }
    }

    /** Operators are the unnamed tokens between operands; {@code not in} and {@code is not} span two. */
    private Expr compare(TSNode n) {
        Expr left = null;
        List<String> ops  = new ArrayList<>();
        List<Expr>   rest = new ArrayList<>();
        StringBuilder pending = new StringBuilder();
        for (int i = 0; i < n.getChildCount(); i++) {
            TSNode child = n.getChild(i);
            if (TRIVIA.contains(child.getType())) {
                continue;
            }
            if (!child.isNamed()) {
                if (pending.length() > 0) {
                    pending.append(' ');
                }
                pending.append(tree.text(child).trim().replaceAll("\\s+", " "));
            } else if (left == null) {
                left = expr(child);
            } else {
                ops.add(pending.toString());
                pending.setLength(0);
                rest.add(expr(child));
            }
        }
        return new Compare(left, ops, rest, tree.span(n));
    }

    private Expr dictionary(TSNode n) {
        List<Expr> keys   = new ArrayList<>();
        List<Expr> values = new ArrayList<>();
        for (TSNode entry : named(n)) {
            if (entry.getType().equals("pair")) {
                keys.add(expr(field(entry, "key")));
                values.add(expr(field(entry, "value")));
            } else {
                keys.add(null);
                values.add(expr(firstNamed(entry)));
            }
        }
        return new DictExpr(keys, values, tree.span(n));
    }

    private Expr comprehension(TSNode n, ComprehensionKind kind) {
        TSNode body = field(n, "body");
        Expr element;
        Expr value = null;
        if (kind == ComprehensionKind.DICT) {
            element = expr(field(body, "key"));
            value   = expr(field(body, "value"));
        } else {
            element = expr(body);
        }

        List<ComprehensionFor> generators = new ArrayList<>();
        TSNode clause = null;
        List<Expr> conditions = new ArrayList<>();
        int end = 0;
        for (TSNode child : named(n)) {
            if (child.getType().equals("for_in_clause")) {
                if (clause != null) {
                    generators.add(generator(clause, conditions, end));
                }
                clause = child;
                conditions = new ArrayList<>();
                end = tree.end(child);
            } else if (child.getType().equals("if_clause") && clause != null) {
                conditions.add(expr(firstNamed(child)));
                end = tree.end(child);
            }
        }
        if (clause != null) {
            generators.add(generator(clause, conditions, end));
        }
        return new Comprehension(kind, element, value, generators, tree.span(n));
    }

    private ComprehensionFor generator(TSNode clause, List<Expr> conditions, int end) {
        return new ComprehensionFor(startsWithAsync(clause), expr(field(clause, "left")),
                expr(field(clause, "right")), conditions, tree.span(tree.start(clause), end));
    }

    private String dotted(TSNode n) {
        if (!n.getType().equals("dotted_name")) {
            return tree.text(n);
        }
        List<String> parts = new ArrayList<>();
        for (TSNode part : named(n)) {
            parts.add(tree.text(part));
        }
        return String.join(".", parts);
    }

    private Expr dottedExpr(TSNode n) {
        List<TSNode> parts = named(n);
        Expr e = new Name(tree.text(parts.get(0)), tree.span(parts.get(0)));
        for (int i = 1; i < parts.size(); i++) {
            e = new Attribute(e, tree.text(parts.get(i)), tree.span(tree.start(n), tree.end(parts.get(i))));
        }
        return e;
    }

    // ------------------------------------------------------------------
    // Tree helpers
    // ------------------------------------------------------------------

    private static List<TSNode> named(TSNode n) {
        List<TSNode> out = new ArrayList<>();
        for (int i = 0; i < n.getNamedChildCount(); i++) {
            TSNode child = n.getNamedChild(i);
            if (!TRIVIA.contains(child.getType())) {
                out.add(child);
            }
        }
        return out;
    }

    private static TSNode firstNamed(TSNode n) {
        List<TSNode> children = named(n);
        return children.isEmpty() ? null : children.get(0);
    }

    private static TSNode field(TSNode n, String name) {
        TSNode child = n.getChildByFieldName(name);
        return child == null || child.isNull() ? null : child;
    }

    private static TSNode childOfType(TSNode n, String type) {
        for (int i = 0; i < n.getChildCount(); i++) {
            TSNode child = n.getChild(i);
            if (child.getType().equals(type)) {
                return child;
            }
        }
        return null;
    }

    private static boolean startsWithAsync(TSNode n) {
        return n.getChildCount() > 0 && n.getChild(0).getType().equals("async");
    }

    private static boolean same(TSNode a, TSNode b) {
        return a.getStartByte() == b.getStartByte() && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }

    /** True when only indentation precedes {@code offset} on its line. */
    private boolean startsLine(int offset) {
        int column = tree.column(offset);
        return source.substring(offset - column, offset).isBlank();
    }

    private static ConstKind numberKind(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.endsWith("j")) {
            return ConstKind.IMAGINARY;
        }
        if (lower.startsWith("0x") || lower.startsWith("0o") || lower.startsWith("0b")) {
            return ConstKind.INT;
        }
        return lower.contains(".") || lower.contains("e") ? ConstKind.FLOAT : ConstKind.INT;
    }

    private static SyntaxFailure fail(Span at, String message) {
        return new SyntaxFailure(at.line(), at.column(), message);
    }
}
