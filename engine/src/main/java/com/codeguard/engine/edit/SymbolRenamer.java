package com.codeguard.engine.edit;

import com.codeguard.engine.protect.ProtectedIdentifierViolation;
import com.codeguard.engine.protect.ProtectedIdentifiers;
import com.codeguard.engine.protect.Violation;
import com.codeguard.engine.syntax.PythonParser;
import com.codeguard.engine.syntax.PythonTokenizer;
import com.codeguard.engine.syntax.Token;
import com.codeguard.engine.syntax.TokenKind;
import com.codeguard.engine.syntax.TokenStream;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Token-based identifier rename.
 *
 * A match is a NAME token equal to the old name that does not follow a
 * {@code .} (attribute access is left alone). Reserved words are never
 * renamed, in either direction. Substrings of longer names are
 * never touched; string literal contents only when
 * {@link RenameOptions#includeStrings()} is set.
 */
public final class SymbolRenamer {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_]\\w*");

    private SymbolRenamer() {}

    public static String rename(String snippet, String oldName, String newName, RenameOptions options) {
        return rename(snippet, oldName, newName, options, null);
    }

    /**
     * @param baseline armed session baseline, or null when no guard is active
     * @throws ProtectedIdentifierViolation when {@code oldName} is protected by
     *                                      {@code baseline} and the options do not allow it
     * @throws OperationFailure             for invalid names or an out-of-range occurrence
     */
    public static String rename(String snippet, String oldName, String newName,
                                RenameOptions options, ProtectedIdentifiers baseline) {
        if (oldName == null || !IDENTIFIER.matcher(oldName).matches() || PythonParser.isKeyword(oldName)) {
            throw new OperationFailure("invalid identifier to rename: '" + oldName + "'");
        }
        if (newName == null || !IDENTIFIER.matcher(newName).matches() || PythonParser.isKeyword(newName)) {
            throw new OperationFailure("invalid new name: '" + newName + "'");
        }
        if (baseline != null && !options.allowProtected() && baseline.forbids(oldName)) {
            throw new ProtectedIdentifierViolation(
                    "'" + oldName + "' is a protected identifier; pass allowProtected to rename it anyway",
                    List.of(new Violation(categoryOf(baseline, oldName), oldName)));
        }
        if (oldName.equals(newName)) {
            return snippet;
        }

        TokenStream stream = PythonTokenizer.tokenize(snippet);
        List<SourceEdit> matches = findMatches(stream, oldName, newName, options.includeStrings());
        if (matches.isEmpty()) {
            return snippet;
        }
        return SourceEdits.apply(snippet, select(matches, options));
    }

    private static List<SourceEdit> findMatches(TokenStream stream, String oldName, String newName,
                                                boolean includeStrings) {
        Pattern word = Pattern.compile("(?<![\\w])" + Pattern.quote(oldName) + "(?![\\w])");
        List<SourceEdit> out = new ArrayList<>();
        Token previous = null;
        for (Token t : stream.tokens()) {
            if (t.kind() == TokenKind.NAME && t.text().equals(oldName)
                    && (previous == null || !previous.isOp("."))) {
                out.add(new SourceEdit(t.startOffset(), t.endOffset(), newName));
            } else if (includeStrings && t.kind() == TokenKind.STRING) {
                int bodyStart = firstQuote(t.text());
                Matcher m = word.matcher(t.text());
                m.region(bodyStart, t.text().length());
                while (m.find()) {
                    out.add(new SourceEdit(t.startOffset() + m.start(), t.startOffset() + m.end(), newName));
                }
            }
            if (!t.kind().isTrivia()) {
                previous = t;
            }
        }
        return out;
    }

    private static List<SourceEdit> select(List<SourceEdit> matches, RenameOptions options) {
        if (options.all()) {
            return matches;
        }
        int occurrence = options.occurrence() == null ? 1 : options.occurrence();
        if (occurrence < 1) {
            throw new OperationFailure("occurrence must be 1 or greater, got " + occurrence);
        }
        if (occurrence > matches.size()) {
            throw new OperationFailure("occurrence " + occurrence + " requested but only "
                    + matches.size() + " match(es) found");
        }
        return List.of(matches.get(occurrence - 1));
    }

    private static int firstQuote(String literal) {
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (c == '"' || c == '\'') {
                return i;
            }
        }
        return 0;
    }

    private static Violation.Category categoryOf(ProtectedIdentifiers baseline, String name) {
        if (baseline.functions().contains(name)) {
            return Violation.Category.FUNCTION;
        }
        if (baseline.classes().contains(name)) {
            return Violation.Category.CLASS;
        }
        if (baseline.entryPoints().contains(name)) {
            return Violation.Category.ENTRY_POINT;
        }
        return Violation.Category.CALL;
    }
}
