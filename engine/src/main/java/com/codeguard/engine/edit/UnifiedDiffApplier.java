package com.codeguard.engine.edit;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replays the hunks of a unified diff against a snippet.
 *
 * <p>Hunks are matched by their {@code -start} line and their context and
 * removed lines, which must equal the snippet's lines (trailing whitespace
 * ignored). The header's line counts are informational: agents routinely get
 * them wrong, and the body is what defines the hunk. File headers
 * ({@code ---}/{@code +++}) and {@code \ No newline at end of file} markers are
 * skipped; the result keeps the snippet's own trailing-newline convention.
 */
public final class UnifiedDiffApplier {

    private static final Pattern HUNK_HEADER =
            Pattern.compile("^@@ -(\\d+)(?:,(\\d+))? \\+(\\d+)(?:,(\\d+))? @@.*$");

    private UnifiedDiffApplier() {}

    record Hunk(int oldStart, int oldLength, List<String> body) {}

    /**
     * @throws OperationFailure for a diff without hunks, a context or removed
     *                          line that does not match, or a hunk reaching
     *                          past the end of the snippet
     */
    public static String apply(String snippet, String diff) {
        if (diff == null || diff.isBlank()) {
            throw new OperationFailure("patch is empty");
        }
        List<Hunk> hunks = parse(diff);
        if (hunks.isEmpty()) {
            throw new OperationFailure("patch contains no hunks");
        }

        SourceLines source = SourceLines.of(snippet);
        List<String> original = source.lines();
        List<String> out = new ArrayList<>();
        int cursor = 0;

        for (int h = 0; h < hunks.size(); h++) {
            Hunk hunk = hunks.get(h);
            int start = hunk.oldLength() == 0 ? hunk.oldStart() : hunk.oldStart() - 1;
            if (start < 0) {
                start = 0;
            }
            if (start > original.size()) {
                throw new OperationFailure("hunk " + (h + 1) + " starts at line " + hunk.oldStart()
                        + " but the snippet has only " + original.size() + " line(s)");
            }
            if (start < cursor) {
                throw new OperationFailure("hunk " + (h + 1) + " overlaps the previous hunk");
            }
            out.addAll(original.subList(cursor, start));

            int pos = start;
            for (String line : hunk.body()) {
                char tag = line.isEmpty() ? ' ' : line.charAt(0);
                String text = line.isEmpty() ? "" : line.substring(1);
                switch (tag) {
                    case ' ', '-' -> {
                        if (pos >= original.size()) {
                            throw new OperationFailure("hunk " + (h + 1) + " references line " + (pos + 1)
                                    + " beyond the end of the snippet (" + original.size() + " line(s))");
                        }
                        if (!original.get(pos).stripTrailing().equals(text.stripTrailing())) {
                            throw new OperationFailure("hunk " + (h + 1) + " does not match line " + (pos + 1)
                                    + ": expected '" + text + "' but found '" + original.get(pos) + "'");
                        }
                        if (tag == ' ') {
                            out.add(original.get(pos));
                        }
                        pos++;
                    }
                    case '+' -> out.add(text);
                    default -> throw new OperationFailure("hunk " + (h + 1) + " has an invalid line: '" + line + "'");
                }
            }
            cursor = pos;
        }
        out.addAll(original.subList(cursor, original.size()));
        return SourceLines.join(out, source.lineEnding(), source.endsWithNewline());
    }

    static List<Hunk> parse(String diff) {
        List<String> lines = new ArrayList<>(List.of(diff.split("\r?\n", -1)));
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }

        List<Hunk> hunks = new ArrayList<>();
        List<String> body = null;
        int oldStart  = 0;
        int oldLength = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            Matcher m = HUNK_HEADER.matcher(line);
            if (m.matches()) {
                if (body != null) {
                    hunks.add(new Hunk(oldStart, oldLength, body));
                }
                oldStart  = Integer.parseInt(m.group(1));
                oldLength = m.group(2) == null ? 1 : Integer.parseInt(m.group(2));
                body = new ArrayList<>();
                continue;
            }
            if (isFileHeader(lines, i) || line.startsWith("\\")) {
                continue;
            }
            if (body == null) {
                // preamble before the first hunk: diff/index lines and the like
                continue;
            }
            body.add(line);
        }
        if (body != null) {
            hunks.add(new Hunk(oldStart, oldLength, body));
        }
        return hunks;
    }

    private static boolean isFileHeader(List<String> lines, int i) {
        String line = lines.get(i);
        if (line.startsWith("--- ") || line.equals("---")) {
            return i + 1 < lines.size() && lines.get(i + 1).startsWith("+++");
        }
        if (line.startsWith("+++ ") || line.equals("+++")) {
            return i > 0 && lines.get(i - 1).startsWith("---");
        }
        return false;
    }
}
