package com.codeguard.engine.protect;

import com.codeguard.engine.syntax.Ast;
import com.codeguard.engine.syntax.PythonParser;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Builds a {@link ProtectedIdentifiers} snapshot from a snippet's syntax tree.
 */
public final class IdentifierCollector {

    private static final Pattern MAIN_LITERAL = Pattern.compile("^[rRuU]?(['\"])__main__\\1$");

    private IdentifierCollector() {}

    /**
     * @throws com.codeguard.engine.syntax.SyntaxFailure when the snippet does not parse
     */
    public static ProtectedIdentifiers collect(String snippet) {
        return collect(PythonParser.parse(snippet));
    }

    public static ProtectedIdentifiers collect(Ast.Module module) {
        SortedSet<String> functions   = new TreeSet<>();
        SortedSet<String> classes     = new TreeSet<>();
        SortedSet<String> calls       = new TreeSet<>();
        SortedSet<String> entryPoints = new TreeSet<>();

        Ast.walk(module, node -> {
            if (node instanceof Ast.FunctionDef f) {
                functions.add(f.name());
            } else if (node instanceof Ast.ClassDef c) {
                classes.add(c.name());
            } else if (node instanceof Ast.Call call) {
                String callee = dottedName(call.func());
                if (callee != null) {
                    calls.add(callee);
                }
            }
        });

        for (Ast.Stmt stmt : module.body()) {
            if (stmt instanceof Ast.If guard && isMainGuard(guard.test())) {
                for (Ast.Stmt inner : guard.body().statements()) {
                    collectDirectCalls(inner, entryPoints);
                }
            }
        }
        return new ProtectedIdentifiers(functions, classes, calls, entryPoints);
    }

    /**
     * {@code a.b.c} for a Name/Attribute chain, null for anything else
     * ({@code f()()}, {@code xs[0].g}, ...).
     */
    public static String dottedName(Ast.Expr expr) {
        if (expr instanceof Ast.Name n) {
            return n.id();
        }
        if (expr instanceof Ast.Attribute a) {
            String base = dottedName(a.value());
            return base == null ? null : base + "." + a.attr();
        }
        return null;
    }

    static boolean isMainGuard(Ast.Expr test) {
        if (!(test instanceof Ast.Compare cmp) || cmp.ops().size() != 1 || !cmp.ops().get(0).equals("==")) {
            return false;
        }
        Ast.Expr left  = cmp.left();
        Ast.Expr right = cmp.comparators().get(0);
        return (isDunderName(left) && isMainLiteral(right)) || (isMainLiteral(left) && isDunderName(right));
    }

    private static boolean isDunderName(Ast.Expr e) {
        return e instanceof Ast.Name n && n.id().equals("__name__");
    }

    private static boolean isMainLiteral(Ast.Expr e) {
        return e instanceof Ast.Constant c
                && c.kind() == Ast.ConstKind.STRING
                && MAIN_LITERAL.matcher(c.text()).matches();
    }

    /** Calls in {@code node}, not descending into nested function, class or lambda bodies. */
    private static void collectDirectCalls(Ast.Node node, SortedSet<String> out) {
        if (node instanceof Ast.FunctionDef || node instanceof Ast.ClassDef || node instanceof Ast.Lambda) {
            return;
        }
        if (node instanceof Ast.Call call) {
            String callee = dottedName(call.func());
            if (callee != null) {
                out.add(callee);
            }
        }
        List<Ast.Node> children = node.children();
        for (Ast.Node child : children) {
            collectDirectCalls(child, out);
        }
    }
}
