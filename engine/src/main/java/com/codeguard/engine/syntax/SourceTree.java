package com.codeguard.engine.syntax;

import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * A snippet together with its tree-sitter concrete syntax tree.
 *
 * <p>tree-sitter reports UTF-8 byte offsets; everything else in the engine
 * works on Java char offsets, so the conversion happens here and nowhere else.
 * The tree is error tolerant: a snippet that does not parse still gets a tree,
 * with ERROR and MISSING nodes where the parser recovered.
 */
final class SourceTree {

    // TSParser is not thread-safe; one per thread.
    private static final ThreadLocal<TSParser> PARSER = ThreadLocal.withInitial(() -> {
        TSParser parser = new TSParser();
        if (!parser.setLanguage(new TreeSitterPython())) {
            throw new IllegalStateException("tree-sitter rejected the Python grammar");
        }
        return parser;
    });

    private final String source;
    private final TSTree tree;
    private final int[]  byteToChar;
    private final int[]  lineStarts;

    private SourceTree(String source, TSTree tree, int[] byteToChar, int[] lineStarts) {
        this.source     = source;
        this.tree       = tree;
        this.byteToChar = byteToChar;
        this.lineStarts = lineStarts;
    }

    static SourceTree parse(String source) {
        TSTree tree = PARSER.get().parseString(null, source);
        return new SourceTree(source, tree, byteToChar(source), lineStarts(source));
    }

    String source() { return source; }

    TSNode root() { return tree.getRootNode(); }

    int start(TSNode node) { return offset(node.getStartByte()); }

    int end(TSNode node) { return offset(node.getEndByte()); }

    String text(TSNode node) {
        return source.substring(start(node), end(node));
    }

    Ast.Span span(TSNode node) {
        return span(start(node), end(node));
    }

    Ast.Span span(int start, int end) {
        return new Ast.Span(start, Math.max(start, end), line(start), column(start));
    }

    /** 1-based line of a char offset. */
    int line(int offset) {
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo + 1;
    }

    /** 0-based column of a char offset. */
    int column(int offset) {
        return offset - lineStarts[line(offset) - 1];
    }

    /** Char offset of a UTF-8 byte offset. */
    int offset(int byteOffset) {
        if (byteOffset <= 0) {
            return 0;
        }
        if (byteOffset >= byteToChar.length) {
            return source.length();
        }
        return byteToChar[byteOffset];
    }

    /**
     * For every UTF-8 byte offset, the char offset of the code point it belongs
     * to. The extra final slot maps the end of input.
     */
    private static int[] byteToChar(String source) {
        int[] map = new int[source.getBytes(StandardCharsets.UTF_8).length + 1];
        int b = 0;
        int c = 0;
        while (c < source.length()) {
            int cp = source.codePointAt(c);
            // a lone surrogate encodes as a single '?'
            int width = Character.isSurrogate((char) cp) && cp < 0x10000 ? 1
                    : cp < 0x80 ? 1 : cp < 0x800 ? 2 : cp < 0x10000 ? 3 : 4;
            for (int k = 0; k < width; k++) {
                map[b + k] = c;
            }
            b += width;
            c += Character.charCount(cp);
        }
        map[b] = c;
        return map;
    }

    /** Offsets where lines start; {@code \r\n}, {@code \n} and a lone {@code \r} all end a line. */
    private static int[] lineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            char ch = source.charAt(i);
            if (ch == '\r' && i + 1 < source.length() && source.charAt(i + 1) == '\n') {
                i++;
                starts.add(i + 1);
            } else if (ch == '\n' || ch == '\r') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }
}
