package com.codeguard.engine.validate;

import com.codeguard.engine.syntax.Ast;
import com.codeguard.engine.syntax.PythonParser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Project rules an edited snippet has to satisfy before it is released:
 *
 * <ul>
 *   <li><b>sentinel-none</b>: a name containing "sentinel" must not be bound
 *       to {@code None}; sentinels have to be unique objects.</li>
 *   <li><b>arity</b>: a call by simple name to a local function must supply at
 *       least as many arguments as the function requires.</li>
 *   <li><b>undefined-return</b>: {@code return name} inside a function must
 *       return something bound in that function, an enclosing function, the
 *       module, or the builtins.</li>
 * </ul>
 */
public final class StaticValidator {

    public static final String RULE_SENTINEL        = "sentinel-none";
    public static final String RULE_ARITY           = "arity";
    public static final String RULE_UNDEFINED_RETURN = "undefined-return";

    private static final Set<String> BUILTINS = Set.of(
            "abs", "aiter", "all", "anext", "any", "ascii", "bin", "bool", "breakpoint", "bytearray",
            "bytes", "callable", "chr", "classmethod", "compile", "complex", "copyright", "credits",
            "delattr", "dict", "dir", "divmod", "enumerate", "eval", "exec", "exit", "filter", "float",
            "format", "frozenset", "getattr", "globals", "hasattr", "hash", "help", "hex", "id", "input",
            "int", "isinstance", "issubclass", "iter", "len", "license", "list", "locals", "map", "max",
            "memoryview", "min", "next", "object", "oct", "open", "ord", "pow", "print", "property",
            "quit", "range", "repr", "reversed", "round", "set", "setattr", "slice", "sorted",
            "staticmethod", "str", "sum", "super", "tuple", "type", "vars", "zip", "__import__",
            "__name__", "__file__", "__doc__", "__builtins__", "__debug__", "NotImplemented", "Ellipsis",
            "ArithmeticError", "AssertionError", "AttributeError", "BaseException", "EOFError",
            "Exception", "FileNotFoundError", "ImportError", "IndexError", "KeyError",
            "KeyboardInterrupt", "LookupError", "NameError", "NotImplementedError", "OSError",
            "OverflowError", "RecursionError", "RuntimeError", "StopIteration", "SyntaxError",
            "SystemExit", "TypeError", "ValueError", "ZeroDivisionError");

    private StaticValidator() {}

    /**
     * @throws ValidationFailure listing every finding, when there is at least one
     * @throws com.codeguard.engine.syntax.SyntaxFailure when the snippet does not parse
     */
    public static void validate(String snippet) {
        List<Finding> findings = findings(snippet);
        if (!findings.isEmpty()) {
            throw new ValidationFailure(findings);
        }
    }

    /** All findings of all rules, sorted by line. */
    public static List<Finding> findings(String snippet) {
        Ast.Module tree = PythonParser.parse(snippet);
        List<Finding> out = new ArrayList<>();
        sentinels(tree, out);
        arity(tree, out);
        undefinedReturns(tree, out);
        out.sort(Comparator.comparingInt(Finding::line).thenComparingInt(Finding::column));
        return out;
    }

    // ------------------------------------------------------------------
    // sentinel-none
    // ------------------------------------------------------------------

    private static void sentinels(Ast.Module tree, List<Finding> out) {
        Ast.walk(tree, node -> {
            if (node instanceof Ast.Assign a && isNone(a.value())) {
                for (Ast.Expr target : a.targets()) {
                    checkSentinel(target, out);
                }
            } else if (node instanceof Ast.AnnAssign a && a.value() != null && isNone(a.value())) {
                checkSentinel(a.target(), out);
            }
        });
    }

    private static void checkSentinel(Ast.Expr target, List<Finding> out) {
        if (target instanceof Ast.Name n && n.id().toLowerCase(Locale.ROOT).contains("sentinel")) {
            out.add(new Finding(RULE_SENTINEL,
                    "'" + n.id() + "' is initialised to None; sentinels must be unique objects such as object()",
                    n.span().line(), n.span().column()));
        }
    }

    private static boolean isNone(Ast.Expr e) {
        return e instanceof Ast.Constant c && c.kind() == Ast.ConstKind.NONE;
    }

    // ------------------------------------------------------------------
    // arity
    // ------------------------------------------------------------------

    private record Signature(int required, boolean variadic) {}

    private static void arity(Ast.Module tree, List<Finding> out) {
        Map<String, Signature> signatures = new HashMap<>();
        collectFunctions(tree.body(), signatures);

        Ast.walk(tree, node -> {
            if (!(node instanceof Ast.Call call) || !(call.func() instanceof Ast.Name name)) {
                return;
            }
            Signature sig = signatures.get(name.id());
            if (sig == null || sig.variadic()) {
                return;
            }
            boolean unpacks = call.args().stream().anyMatch(a -> a instanceof Ast.Starred)
                    || call.keywords().stream().anyMatch(k -> k.arg() == null);
            if (unpacks) {
                return;
            }
            int supplied = call.args().size() + call.keywords().size();
            if (supplied < sig.required()) {
                out.add(new Finding(RULE_ARITY,
                        "call to '" + name.id() + "' passes " + supplied + " argument(s) but "
                                + sig.required() + " are required",
                        call.span().line(), call.span().column()));
            }
        });
    }

    /** Functions callable by simple name: module level and nested in functions, not methods. */
    private static void collectFunctions(List<Ast.Stmt> body, Map<String, Signature> out) {
        for (Ast.Stmt stmt : body) {
            forEachNested(stmt, false, node -> {
                if (node instanceof Ast.FunctionDef f) {
                    out.put(f.name(), signatureOf(f));
                    collectFunctions(f.body().statements(), out);
                }
            });
        }
    }

    private static Signature signatureOf(Ast.FunctionDef f) {
        int required = 0;
        boolean variadic = false;
        for (Ast.Param p : f.params()) {
            switch (p.kind()) {
                case VAR_POSITIONAL, VAR_KEYWORD -> variadic = true;
                default -> {
                    if (!p.hasDefault()) {
                        required++;
                    }
                }
            }
        }
        return new Signature(required, variadic);
    }

    // ------------------------------------------------------------------
    // undefined-return
    // ------------------------------------------------------------------

    private static void undefinedReturns(Ast.Module tree, List<Finding> out) {
        Set<String> moduleNames = new HashSet<>();
        for (Ast.Stmt stmt : tree.body()) {
            collectBindings(stmt, moduleNames);
        }
        Deque<Set<String>> enclosing = new ArrayDeque<>();
        for (Ast.Stmt stmt : tree.body()) {
            forEachNested(stmt, true, node -> {
                if (node instanceof Ast.FunctionDef f) {
                    checkFunction(f, moduleNames, enclosing, out);
                }
            });
        }
    }

    private static void checkFunction(Ast.FunctionDef f, Set<String> moduleNames,
                                      Deque<Set<String>> enclosing, List<Finding> out) {
        Set<String> local = new HashSet<>();
        for (Ast.Param p : f.params()) {
            local.add(p.name());
        }
        for (Ast.Stmt stmt : f.body().statements()) {
            collectBindings(stmt, local);
        }

        for (Ast.Stmt stmt : f.body().statements()) {
            inScope(stmt, node -> {
                if (node instanceof Ast.Return r && r.value() instanceof Ast.Name n) {
                    String id = n.id();
                    boolean bound = local.contains(id) || moduleNames.contains(id) || BUILTINS.contains(id)
                            || enclosing.stream().anyMatch(s -> s.contains(id));
                    if (!bound) {
                        out.add(new Finding(RULE_UNDEFINED_RETURN,
                                "function '" + f.name() + "' returns '" + id + "', which is never assigned",
                                r.span().line(), r.span().column()));
                    }
                }
            });
        }

        enclosing.push(local);
        for (Ast.Stmt stmt : f.body().statements()) {
            forEachNested(stmt, true, node -> {
                if (node instanceof Ast.FunctionDef nested) {
                    checkFunction(nested, moduleNames, enclosing, out);
                }
            });
        }
        enclosing.pop();
    }

    /** Names bound in the scope that contains {@code stmt}. */
    private static void collectBindings(Ast.Stmt stmt, Set<String> out) {
        inScope(stmt, node -> {
            if (node instanceof Ast.Assign a) {
                a.targets().forEach(t -> bindTarget(t, out));
            } else if (node instanceof Ast.AugAssign a) {
                bindTarget(a.target(), out);
            } else if (node instanceof Ast.AnnAssign a) {
                bindTarget(a.target(), out);
            } else if (node instanceof Ast.For f) {
                bindTarget(f.target(), out);
            } else if (node instanceof Ast.WithItem w && w.target() != null) {
                bindTarget(w.target(), out);
            } else if (node instanceof Ast.NamedExpr n) {
                out.add(n.target().id());
            } else if (node instanceof Ast.ExceptHandler h && h.name() != null) {
                out.add(h.name());
            } else if (node instanceof Ast.Import i) {
                for (Ast.Alias alias : i.names()) {
                    out.add(alias.asName() != null ? alias.asName() : alias.name().split("\\.")[0]);
                }
            } else if (node instanceof Ast.ImportFrom i) {
                for (Ast.Alias alias : i.names()) {
                    out.add(alias.asName() != null ? alias.asName() : alias.name());
                }
            } else if (node instanceof Ast.FunctionDef f) {
                out.add(f.name());
            } else if (node instanceof Ast.ClassDef c) {
                out.add(c.name());
            } else if (node instanceof Ast.MatchCase c) {
                c.patterns().forEach(p -> bindPattern(p, out));
            } else if (node instanceof Ast.TypeAlias t) {
                bindTarget(t.name(), out);
            } else if (node instanceof Ast.Global g) {
                out.addAll(g.names());
            } else if (node instanceof Ast.Nonlocal n) {
                out.addAll(n.names());
            }
        });
    }

    private static void bindTarget(Ast.Expr target, Set<String> out) {
        if (target instanceof Ast.Name n) {
            out.add(n.id());
        } else if (target instanceof Ast.TupleExpr t) {
            t.elements().forEach(e -> bindTarget(e, out));
        } else if (target instanceof Ast.ListExpr l) {
            l.elements().forEach(e -> bindTarget(e, out));
        } else if (target instanceof Ast.Starred s) {
            bindTarget(s.value(), out);
        }
    }

    /** Capture names in a case pattern; class names and keyword names are not captures. */
    private static void bindPattern(Ast.Expr pattern, Set<String> out) {
        if (pattern instanceof Ast.Name n) {
            out.add(n.id());
        } else if (pattern instanceof Ast.Other o) {
            List<Ast.Expr> parts = o.parts();
            int from = o.type().equals("class_pattern") || o.type().equals("keyword_pattern") ? 1 : 0;
            for (int i = from; i < parts.size(); i++) {
                bindPattern(parts.get(i), out);
            }
        }
    }

    /**
     * Visit {@code node} and its descendants in the same scope. Nested
     * functions and classes are visited themselves (their names bind here)
     * but not entered; lambdas and comprehensions are skipped.
     */
    private static void inScope(Ast.Node node, Consumer<Ast.Node> visitor) {
        if (node instanceof Ast.Lambda || node instanceof Ast.Comprehension) {
            return;
        }
        visitor.accept(node);
        if (node instanceof Ast.FunctionDef || node instanceof Ast.ClassDef) {
            return;
        }
        for (Ast.Node child : node.children()) {
            inScope(child, visitor);
        }
    }

    /**
     * Visit the outermost function definitions under {@code node}. Methods are
     * included only when {@code intoClasses} is set.
     */
    private static void forEachNested(Ast.Node node, boolean intoClasses, Consumer<Ast.Node> visitor) {
        if (node instanceof Ast.FunctionDef) {
            visitor.accept(node);
            return;
        }
        if ((node instanceof Ast.ClassDef && !intoClasses) || node instanceof Ast.Expr) {
            return;
        }
        for (Ast.Node child : node.children()) {
            forEachNested(child, intoClasses, visitor);
        }
    }
}
