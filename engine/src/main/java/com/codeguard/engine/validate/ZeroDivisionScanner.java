package com.codeguard.engine.validate;

import com.codeguard.engine.syntax.Ast;
import com.codeguard.engine.syntax.PythonParser;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Finds {@code /}, {@code //} and {@code %} whose right operand is a constant
 * zero ({@code 0}, {@code 0.0}, {@code False}, {@code 3 - 3}, ...), including
 * the augmented forms. A {@code %} whose left operand is a string literal
 * formats a string and is never reported.
 */
public final class ZeroDivisionScanner {

    public static final String ISSUE_TYPE = "ZeroDivisionError";

    private static final Map<String, String> MESSAGES = Map.of(
            "/",  "Detected division by zero.",
            "//", "Detected floor division by zero.",
            "%",  "Detected modulo by zero.");

    private ZeroDivisionScanner() {}

    /**
     * @return issues sorted by line, then column
     * @throws com.codeguard.engine.syntax.SyntaxFailure when the snippet does not parse
     */
    public static List<RuntimeIssue> detect(String snippet) {
        Ast.Module tree = PythonParser.parse(snippet);
        List<RuntimeIssue> issues = new ArrayList<>();
        Ast.walk(tree, node -> {
            if (node instanceof Ast.BinOp b && MESSAGES.containsKey(b.op()) && !isFormatting(b)
                    && ConstantFolder.isZero(b.right())) {
                issues.add(issue(b.op(), b.span()));
            } else if (node instanceof Ast.AugAssign a) {
                String op = a.op().substring(0, a.op().length() - 1);
                if (MESSAGES.containsKey(op) && ConstantFolder.isZero(a.value())) {
                    issues.add(issue(op, a.span()));
                }
            }
        });
        issues.sort(Comparator.comparingInt(RuntimeIssue::line).thenComparingInt(RuntimeIssue::column));
        return issues;
    }

    /** One formatted line per issue, or {@code [runtime_error] none detected}. */
    public static String report(String snippet) {
        List<RuntimeIssue> issues = detect(snippet);
        if (issues.isEmpty()) {
            return "[runtime_error] none detected";
        }
        return issues.stream().map(RuntimeIssue::format).collect(Collectors.joining("\n"));
    }

    /** {@code "%d items" % 0} is string formatting, not a modulo. */
    private static boolean isFormatting(Ast.BinOp b) {
        return b.op().equals("%") && b.left() instanceof Ast.Constant c
                && (c.kind() == Ast.ConstKind.STRING || c.kind() == Ast.ConstKind.BYTES);
    }

    private static RuntimeIssue issue(String op, Ast.Span span) {
        return new RuntimeIssue(ISSUE_TYPE, MESSAGES.get(op), span.line(), span.column());
    }
}
