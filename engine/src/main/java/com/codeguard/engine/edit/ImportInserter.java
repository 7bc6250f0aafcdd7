package com.codeguard.engine.edit;

import com.codeguard.engine.syntax.Ast;
import com.codeguard.engine.syntax.PythonParser;
import com.codeguard.engine.syntax.PythonTokenizer;
import com.codeguard.engine.syntax.Token;
import com.codeguard.engine.syntax.TokenKind;
import com.codeguard.engine.syntax.TokenStream;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Adds one {@code import} line to a snippet, at the place a human would put it.
 *
 * <p>Insertion point: after a shebang, an encoding declaration, the module
 * docstring and leading blank lines; after the last line of an import block
 * that follows them. Calling it again with the same import is a no-op.
 */
public final class ImportInserter {

    private static final Pattern DOTTED     = Pattern.compile("[A-Za-z_]\\w*(\\.[A-Za-z_]\\w*)*");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_]\\w*");
    private static final Pattern ENCODING   = Pattern.compile("^[ \\t\\f]*#.*?coding[:=][ \\t]*[-\\w.]+");

    private ImportInserter() {}

    /** {@code import module}. */
    public static String addImport(String snippet, String module) {
        return ensureImport(snippet, module, null, null);
    }

    /**
     * Ensure {@code import module [as alias]} or, when {@code symbol} is given,
     * {@code from module import symbol [as alias]} is present at top level.
     *
     * @throws OperationFailure for a malformed module, symbol or alias name
     * @throws com.codeguard.engine.syntax.SyntaxFailure when the snippet does not parse
     */
    public static String ensureImport(String snippet, String module, String symbol, String alias) {
        Objects.requireNonNull(snippet, "snippet");
        if (module == null || !DOTTED.matcher(module).matches()) {
            throw new OperationFailure("invalid module name: '" + module + "'");
        }
        if (symbol != null && !symbol.equals("*") && !IDENTIFIER.matcher(symbol).matches()) {
            throw new OperationFailure("invalid symbol name: '" + symbol + "'");
        }
        if (alias != null && !IDENTIFIER.matcher(alias).matches()) {
            throw new OperationFailure("invalid alias: '" + alias + "'");
        }
        if ("*".equals(symbol) && alias != null) {
            throw new OperationFailure("a star import cannot have an alias");
        }

        Ast.Module tree = PythonParser.parse(snippet);
        if (alreadyImported(tree, module, symbol, alias)) {
            return snippet;
        }

        String statement = symbol == null
                ? "import " + module + (alias != null ? " as " + alias : "")
                : "from " + module + " import " + symbol + (alias != null ? " as " + alias : "");

        SourceLines lines = SourceLines.of(snippet);
        int index = insertionLine(lines, tree);
        index = outsideStrings(PythonTokenizer.tokenize(snippet), lines, index);
        return insertAt(snippet, lines, index, statement);
    }

    private static boolean alreadyImported(Ast.Module tree, String module, String symbol, String alias) {
        for (Ast.Stmt stmt : tree.body()) {
            if (symbol == null && stmt instanceof Ast.Import imp) {
                for (Ast.Alias a : imp.names()) {
                    if (a.name().equals(module) && Objects.equals(a.asName(), alias)) {
                        return true;
                    }
                }
            } else if (symbol != null && stmt instanceof Ast.ImportFrom from
                    && from.level() == 0 && module.equals(from.module())) {
                for (Ast.Alias a : from.names()) {
                    if (a.name().equals(symbol) && Objects.equals(a.asName(), alias)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private static int insertionLine(SourceLines lines, Ast.Module tree) {
        int n = lines.count();
        int index = 0;
        if (index < n && lines.line(index).startsWith("#!")) {
            index++;
        }
        if (index < n && ENCODING.matcher(lines.line(index)).find()) {
            index++;
        }
        if (!tree.body().isEmpty() && isDocstring(tree.body().get(0))) {
            Ast.Span doc = tree.body().get(0).span();
            if (lines.lineAt(doc.start()) >= index) {
                index = lines.lineAt(Math.max(doc.start(), doc.end() - 1)) + 1;
            }
        }
        while (index < n && lines.line(index).isBlank()) {
            index++;
        }

        // contiguous top-level import block starting at the computed line
        boolean advanced = true;
        while (advanced) {
            advanced = false;
            for (Ast.Stmt stmt : tree.body()) {
                boolean isImport = stmt instanceof Ast.Import || stmt instanceof Ast.ImportFrom;
                if (isImport && lines.lineAt(stmt.span().start()) == index
                        && lines.startOffset(index) + SourceLines.indentation(lines.line(index)).length()
                                == stmt.span().start()) {
                    index = lines.lineAt(Math.max(stmt.span().start(), stmt.span().end() - 1)) + 1;
                    advanced = true;
                    break;
                }
            }
        }
        return index;
    }

    private static boolean isDocstring(Ast.Stmt stmt) {
        return stmt instanceof Ast.ExprStmt e
                && e.value() instanceof Ast.Constant c
                && c.kind() == Ast.ConstKind.STRING;
    }

    /** Move past a multi-line string literal that would otherwise contain the insertion point. */
    private static int outsideStrings(TokenStream tokens, SourceLines lines, int index) {
        int offset = lines.startOffset(index);
        for (Token t : tokens.tokens()) {
            if (t.kind() == TokenKind.STRING && t.startOffset() < offset && offset < t.endOffset()) {
                return lines.lineAt(t.endOffset() - 1) + 1;
            }
        }
        return index;
    }

    private static String insertAt(String snippet, SourceLines lines, int index, String statement) {
        String eol = lines.lineEnding();
        if (index < lines.count()) {
            return SourceEdits.apply(snippet, List.of(
                    SourceEdit.insert(lines.startOffset(index), statement + eol)));
        }
        if (snippet.isEmpty()) {
            return statement;
        }
        String addition = lines.endsWithNewline() ? statement + eol : eol + statement;
        return snippet + addition;
    }
}
