package com.codeguard.engine.edit;

import java.util.ArrayList;
import java.util.List;

/**
 * Physical-line view of a snippet.
 *
 * Lines are reported without their terminators. A final line break does not
 * open an extra empty line, so {@code "a\nb\n"} and {@code "a\nb"} both have
 * two lines; {@link #endsWithNewline()} tells them apart.
 */
public final class SourceLines {

    private final String text;
    private final List<Integer> starts  = new ArrayList<>();
    private final List<Integer> bodyEnds = new ArrayList<>();

    private SourceLines(String text) {
        this.text = text;
        int i = 0;
        int n = text.length();
        while (i < n) {
            starts.add(i);
            int j = i;
            while (j < n && text.charAt(j) != '\n' && text.charAt(j) != '\r') {
                j++;
            }
            bodyEnds.add(j);
            if (j < n && text.charAt(j) == '\r' && j + 1 < n && text.charAt(j + 1) == '\n') {
                j += 2;
            } else if (j < n) {
                j++;
            }
            i = j;
        }
    }

    public static SourceLines of(String text) {
        return new SourceLines(text);
    }

    public int count() { return starts.size(); }

    public String line(int index) {
        return text.substring(starts.get(index), bodyEnds.get(index));
    }

    public List<String> lines() {
        List<String> out = new ArrayList<>(count());
        for (int i = 0; i < count(); i++) {
            out.add(line(i));
        }
        return out;
    }

    /** Offset where line {@code index} starts; {@code text.length()} for {@code index == count()}. */
    public int startOffset(int index) {
        return index >= count() ? text.length() : starts.get(index);
    }

    /** 0-based index of the line containing {@code offset}. */
    public int lineAt(int offset) {
        int lo = 0;
        int hi = count() - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (starts.get(mid) <= offset) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return Math.max(lo, 0);
    }

    public boolean endsWithNewline() {
        return !text.isEmpty() && (text.endsWith("\n") || text.endsWith("\r"));
    }

    /** The first line terminator in the text, or {@code "\n"} when there is none. */
    public String lineEnding() {
        for (int i = 0; i < count(); i++) {
            int end = bodyEnds.get(i);
            if (end < text.length()) {
                return text.startsWith("\r\n", end) ? "\r\n" : String.valueOf(text.charAt(end));
            }
        }
        return "\n";
    }

    /** Leading spaces and tabs of {@code line}. */
    public static String indentation(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return line.substring(0, i);
    }

    /** Join lines with {@code eol}, adding a final {@code eol} when {@code trailing} is set. */
    public static String join(List<String> lines, String eol, boolean trailing) {
        String body = String.join(eol, lines);
        return trailing && !lines.isEmpty() ? body + eol : body;
    }
}
