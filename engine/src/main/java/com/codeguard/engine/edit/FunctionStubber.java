package com.codeguard.engine.edit;

import com.codeguard.engine.syntax.Ast;
import com.codeguard.engine.syntax.PythonParser;
import com.codeguard.engine.syntax.SyntaxFailure;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Replaces the {@code pass} body of a placeholder function with a stub.
 *
 * <p>Only the {@code pass} statement is rewritten: decorators, the
 * signature, the return annotation and a leading docstring keep their exact
 * text. For {@code def f(): pass} the new body moves to its own line,
 * indented one level deeper than the header using the snippet's own indent
 * unit.
 */
public final class FunctionStubber {

    private FunctionStubber() {}

    /**
     * @throws OperationFailure when the function is missing or its body is not a bare {@code pass}
     * @throws SyntaxFailure    when the snippet does not parse
     */
    public static String stub(String snippet, String functionName, StubPolicy policy) {
        Ast.Module tree = PythonParser.parse(snippet);
        Ast.FunctionDef def = find(tree, functionName);
        if (def == null) {
            throw new OperationFailure("function '" + functionName + "' not found");
        }

        List<Ast.Stmt> body = def.body().statements();
        Ast.Stmt docstring = !body.isEmpty() && isDocstring(body.get(0)) ? body.get(0) : null;
        List<Ast.Stmt> rest = docstring == null ? body : body.subList(1, body.size());
        if (rest.size() != 1 || !(rest.get(0) instanceof Ast.Pass pass)) {
            throw new OperationFailure("function '" + functionName
                    + "' does not have a bare 'pass' body; refusing to overwrite it");
        }

        SourceLines lines = SourceLines.of(snippet);
        String eol = lines.lineEnding();
        List<String> stubLines = policy.lines();

        SourceEdit edit;
        if (def.body().inline()) {
            String headerIndent = SourceLines.indentation(lines.line(lines.lineAt(def.keywordStart())));
            String indent = headerIndent + tree.indentUnit();
            StringBuilder sb = new StringBuilder();
            if (docstring != null) {
                sb.append(eol).append(indent).append(docstring.span().text(snippet));
            }
            sb.append(eol).append(indent).append(String.join(eol + indent, stubLines));
            edit = new SourceEdit(def.colonEnd(), pass.span().end(), sb.toString());
        } else {
            int passLine = lines.lineAt(pass.span().start());
            String indent = SourceLines.indentation(lines.line(passLine));
            edit = new SourceEdit(pass.span().start(), pass.span().end(),
                    String.join(eol + indent, stubLines));
        }

        String result = SourceEdits.apply(snippet, List.of(edit));
        try {
            PythonParser.parse(result);
        } catch (SyntaxFailure e) {
            throw new OperationFailure("stubbed function does not parse: " + e.getMessage(), e);
        }
        return result;
    }

    private static Ast.FunctionDef find(Ast.Module tree, String name) {
        AtomicReference<Ast.FunctionDef> found = new AtomicReference<>();
        Ast.walk(tree, node -> {
            if (found.get() == null && node instanceof Ast.FunctionDef f && f.name().equals(name)) {
                found.set(f);
            }
        });
        return found.get();
    }

    private static boolean isDocstring(Ast.Stmt stmt) {
        return stmt instanceof Ast.ExprStmt e
                && e.value() instanceof Ast.Constant c
                && c.kind() == Ast.ConstKind.STRING;
    }
}
