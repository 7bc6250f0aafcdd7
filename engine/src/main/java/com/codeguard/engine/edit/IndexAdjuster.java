package com.codeguard.engine.edit;

import com.codeguard.engine.syntax.PythonTokenizer;
import com.codeguard.engine.syntax.Token;
import com.codeguard.engine.syntax.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites one integer literal that is the whole content of a subscript,
 * e.g. the {@code 2} in {@code arr[2]}.
 *
 * <p>A {@code [} opens a subscript when it follows a name, a closing bracket
 * or a string; after an operator, keyword or at the start of an expression it
 * is a list display and is never touched.
 */
public final class IndexAdjuster {

    private static final Logger log = LoggerFactory.getLogger(IndexAdjuster.class);

    private IndexAdjuster() {}

    /**
     * @return the snippet with the selected literal rewritten
     * @throws OperationFailure for an invalid request, no matching subscript, a
     *                          missing occurrence or a negative resulting index
     */
    public static String adjust(String snippet, IndexAdjustment request) {
        if ((request.newValue() == null) == (request.delta() == null)) {
            throw new OperationFailure("exactly one of newValue or delta is required");
        }
        if (request.occurrence() < 1) {
            throw new OperationFailure("occurrence must be 1 or greater, got " + request.occurrence());
        }

        List<Token> candidates = candidates(snippet, request.originalValue());
        if (candidates.isEmpty()) {
            throw new OperationFailure(request.originalValue() == null
                    ? "no subscript with an integer index found"
                    : "no subscript with index " + request.originalValue() + " found");
        }
        if (request.legacyShiftAll()) {
            return shiftAll(snippet, candidates, request);
        }
        if (request.occurrence() > candidates.size()) {
            throw new OperationFailure("occurrence " + request.occurrence() + " requested but only "
                    + candidates.size() + " matching subscript(s) found");
        }
        Token target = candidates.get(request.occurrence() - 1);
        return SourceEdits.apply(snippet, List.of(rewrite(target, request)));
    }

    /** Subscript literals in source order, filtered by {@code originalValue} when given. */
    static List<Token> candidates(String snippet, Integer originalValue) {
        List<Token> sig = PythonTokenizer.tokenize(snippet).significant();
        List<Token> out = new ArrayList<>();
        for (int i = 1; i + 2 < sig.size(); i++) {
            Token open   = sig.get(i);
            Token number = sig.get(i + 1);
            Token close  = sig.get(i + 2);
            if (open.isOp("[") && close.isOp("]") && isDecimal(number) && opensSubscript(sig.get(i - 1))
                    && (originalValue == null || parse(number) == originalValue.longValue())) {
                out.add(number);
            }
        }
        return out;
    }

    private static String shiftAll(String snippet, List<Token> candidates, IndexAdjustment request) {
        if (request.delta() == null) {
            throw new OperationFailure("legacyShiftAll requires delta");
        }
        log.warn("legacyShiftAll rewrites {} subscript(s) at once; prefer a targeted occurrence",
                candidates.size());
        List<SourceEdit> edits = new ArrayList<>();
        for (Token t : candidates) {
            edits.add(rewrite(t, request));
        }
        return SourceEdits.apply(snippet, edits);
    }

    private static SourceEdit rewrite(Token literal, IndexAdjustment request) {
        long current = parse(literal);
        long result  = request.newValue() != null ? request.newValue() : current + request.delta();
        if (result < 0) {
            throw new OperationFailure("resulting index " + result + " at line " + literal.line()
                    + " would be negative");
        }
        return new SourceEdit(literal.startOffset(), literal.endOffset(), Long.toString(result));
    }

    private static boolean opensSubscript(Token before) {
        if (before.kind() == TokenKind.NAME) {
            return true;
        }
        if (before.kind() == TokenKind.KEYWORD) {
            return before.text().equals("True") || before.text().equals("False") || before.text().equals("None");
        }
        return before.kind() == TokenKind.STRING
                || before.isOp(")") || before.isOp("]") || before.isOp("}");
    }

    private static boolean isDecimal(Token t) {
        if (t.kind() != TokenKind.NUMBER || t.text().isEmpty()) {
            return false;
        }
        for (int i = 0; i < t.text().length(); i++) {
            if (!Character.isDigit(t.text().charAt(i))) {
                return false;
            }
        }
        return t.text().length() == 1 || t.text().charAt(0) != '0';
    }

    private static long parse(Token t) {
        try {
            return Long.parseLong(t.text());
        } catch (NumberFormatException e) {
            throw new OperationFailure("subscript literal too large: " + t.text(), e);
        }
    }
}
