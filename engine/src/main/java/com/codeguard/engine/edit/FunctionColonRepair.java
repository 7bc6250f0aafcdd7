package com.codeguard.engine.edit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inserts the {@code :} an agent left out after a {@code def} signature.
 *
 * <p>Works on text, not on a syntax tree, because the input is exactly the
 * code that does not parse. Handles signatures spanning several lines, return
 * annotations, trailing comments ({@code def f(a) # c} becomes
 * {@code def f(a): # c}) and inline bodies ({@code def f(a) return a}).
 * A {@code def} inside a string literal or a comment is text, not a
 * signature, and is left alone.
 */
public final class FunctionColonRepair {

    private static final Pattern DEF_START =
            Pattern.compile("(?m)^[ \\t]*(?:async[ \\t]+)?def[ \\t]+[A-Za-z_]\\w*[ \\t]*\\(");

    private FunctionColonRepair() {}

    /** @return the repaired snippet, or empty when every signature already had its colon */
    public static Optional<String> repair(String snippet) {
        List<SourceEdit> edits = new ArrayList<>();
        List<int[]> literals = literalRanges(snippet);
        Matcher m = DEF_START.matcher(snippet);
        while (m.find()) {
            if (inside(literals, skipBlanks(snippet, m.start()))) {
                continue;
            }
            int headerEnd = headerEnd(snippet, m.end());
            if (headerEnd < 0) {
                continue;
            }
            int next = skipBlanks(snippet, headerEnd);
            if (next < snippet.length() && snippet.charAt(next) == ':') {
                continue;
            }
            edits.add(SourceEdit.insert(headerEnd, ":"));
        }
        if (edits.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(SourceEdits.apply(snippet, edits));
    }

    /** Same as {@link #repair} but returns the input when nothing needed fixing. */
    public static String repairOrSame(String snippet) {
        return repair(snippet).orElse(snippet);
    }

    /**
     * Offset just past the signature (closing paren, or the return annotation)
     * given the offset just past the opening paren; -1 when the parameter list
     * never closes.
     */
    private static int headerEnd(String s, int afterOpenParen) {
        int i = skipBalanced(s, afterOpenParen, 1);
        if (i < 0) {
            return -1;
        }
        int j = skipBlanks(s, i);
        if (!s.startsWith("->", j)) {
            return i;
        }
        j = skipBlanks(s, j + 2);
        int end = j;
        int depth = 0;
        while (end < s.length()) {
            char c = s.charAt(end);
            if (c == '\n' || c == '\r' || c == '#') {
                break;
            }
            if (depth == 0 && (c == ':' || c == ' ' || c == '\t')) {
                break;
            }
            if (c == '[' || c == '(' || c == '{') {
                depth++;
            } else if ((c == ']' || c == ')' || c == '}') && depth > 0) {
                depth--;
            }
            end++;
        }
        return end == j ? i : end;
    }

    /** Skip to just past the bracket that closes {@code depth} open brackets, honouring quotes. */
    private static int skipBalanced(String s, int i, int depth) {
        char quote = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i += 2;
                    continue;
                }
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
            i++;
        }
        return -1;
    }

    /**
     * {@code [start, end)} of every string literal and comment. Lenient: an
     * unterminated literal runs to the end of its line, or of the input for a
     * triple-quoted one.
     */
    static List<int[]> literalRanges(String s) {
        List<int[]> ranges = new ArrayList<>();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '#') {
                int end = i;
                while (end < s.length() && s.charAt(end) != '\n' && s.charAt(end) != '\r') {
                    end++;
                }
                ranges.add(new int[] {i, end});
                i = end;
            } else if (c == '"' || c == '\'') {
                int end = literalEnd(s, i, c);
                ranges.add(new int[] {i, end});
                i = end;
            } else {
                i++;
            }
        }
        return ranges;
    }

    private static int literalEnd(String s, int start, char quote) {
        String triple = String.valueOf(quote).repeat(3);
        boolean isTriple = s.startsWith(triple, start);
        int i = start + (isTriple ? 3 : 1);
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (isTriple && s.startsWith(triple, i)) {
                return i + 3;
            }
            if (!isTriple && c == quote) {
                return i + 1;
            }
            if (!isTriple && (c == '\n' || c == '\r')) {
                return i;
            }
            i++;
        }
        return s.length();
    }

    private static boolean inside(List<int[]> ranges, int offset) {
        for (int[] r : ranges) {
            if (r[0] < offset && offset < r[1]) {
                return true;
            }
        }
        return false;
    }

    private static int skipBlanks(String s, int i) {
        while (i < s.length() && (s.charAt(i) == ' ' || s.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }
}
