package com.codeguard.engine.syntax;

/**
 * One-line syntax report for a snippet, meant to be shown to an agent verbatim.
 */
public final class PythonSyntax {

    private PythonSyntax() {}

    /**
     * @return {@code "ok: ..."} when the snippet parses, otherwise
     *         {@code "syntax_error: line L, column C: message"}
     */
    public static String check(String source) {
        try {
            Ast.Module module = PythonParser.parse(source);
            return "ok: parsed " + module.body().size() + " top-level statement(s)";
        } catch (SyntaxFailure e) {
            return "syntax_error: line " + e.getLine() + ", column " + e.getColumn() + ": " + e.getDetail();
        }
    }

    /** True when {@code source} parses. */
    public static boolean isValid(String source) {
        try {
            PythonParser.parse(source);
            return true;
        } catch (SyntaxFailure e) {
            return false;
        }
    }
}
