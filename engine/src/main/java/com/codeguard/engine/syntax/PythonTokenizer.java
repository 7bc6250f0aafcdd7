package com.codeguard.engine.syntax;

import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lossless token stream read off the leaves of a tree-sitter tree.
 *
 * <p>Never fails: a snippet that does not parse still yields tokens, which is
 * what the repairs need. Text between leaves becomes WHITESPACE, so the stream
 * always joins back into the source. A string literal is one STRING token,
 * except an f-string with replacement fields, whose literal pieces are STRING
 * tokens and whose fields are tokenized like any other expression.
 */
public final class PythonTokenizer {

    private static final Pattern WORD = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*");

    private static final Set<String> NUMBERS = Set.of("integer", "float");

    private PythonTokenizer() {}

    public static TokenStream tokenize(String source) {
        SourceTree tree = SourceTree.parse(source);
        Collector collector = new Collector(tree);
        collector.visit(tree.root());
        collector.flush(source.length());
        return new TokenStream(source, collector.tokens);
    }

    private static final class Collector {
        private final SourceTree  tree;
        private final List<Token> tokens = new ArrayList<>();
        private int cursor = 0;

        Collector(SourceTree tree) {
            this.tree = tree;
        }

        void visit(TSNode node) {
            String type = node.getType();
            if (type.equals("string")) {
                string(node);
                return;
            }
            if (type.equals("comment")) {
                emit(TokenKind.COMMENT, node);
                return;
            }
            if (NUMBERS.contains(type)) {
                emit(TokenKind.NUMBER, node);
                return;
            }
            int count = node.getChildCount();
            if (count == 0) {
                leaf(node);
                return;
            }
            for (int i = 0; i < count; i++) {
                visit(node.getChild(i));
            }
        }

        private void string(TSNode node) {
            if (!hasInterpolation(node)) {
                emit(TokenKind.STRING, node);
                return;
            }
            for (int i = 0; i < node.getChildCount(); i++) {
                TSNode part = node.getChild(i);
                if (part.getType().equals("interpolation")) {
                    interpolation(part);
                } else {
                    emit(TokenKind.STRING, part);
                }
            }
        }

        private void interpolation(TSNode node) {
            for (int i = 0; i < node.getChildCount(); i++) {
                TSNode part = node.getChild(i);
                String type = part.getType();
                if (type.equals("format_specifier") || type.equals("type_conversion")) {
                    emit(TokenKind.STRING, part);
                } else {
                    visit(part);
                }
            }
        }

        private void leaf(TSNode node) {
            int start = tree.start(node);
            int end   = tree.end(node);
            if (start == end) {
                return;
            }
            String text = tree.source().substring(start, end);
            String type = node.getType();
            TokenKind kind;
            if (type.equals("line_continuation") || text.isBlank()) {
                kind = TokenKind.WHITESPACE;
            } else if (type.equals("identifier")) {
                kind = PythonParser.isKeyword(text) ? TokenKind.KEYWORD : TokenKind.NAME;
            } else if (WORD.matcher(text).matches()) {
                kind = PythonParser.isKeyword(text) || !node.isNamed() ? TokenKind.KEYWORD : TokenKind.NAME;
            } else if (type.equals("ERROR")) {
                kind = TokenKind.ERRORTOKEN;
            } else {
                kind = TokenKind.OP;
            }
            add(kind, start, end);
        }

        private void emit(TokenKind kind, TSNode node) {
            add(kind, tree.start(node), tree.end(node));
        }

        private void add(TokenKind kind, int start, int end) {
            if (start < cursor || start == end) {
                return;
            }
            flush(start);
            tokens.add(token(kind, start, end));
            cursor = end;
        }

        /** Emit the text between the last token and {@code upTo}. */
        void flush(int upTo) {
            if (upTo <= cursor) {
                return;
            }
            String gap = tree.source().substring(cursor, upTo);
            tokens.add(token(gap.isBlank() ? TokenKind.WHITESPACE : TokenKind.ERRORTOKEN, cursor, upTo));
            cursor = upTo;
        }

        private Token token(TokenKind kind, int start, int end) {
            return new Token(kind, tree.source().substring(start, end), start, end,
                    tree.line(start), tree.column(start));
        }

        private static boolean hasInterpolation(TSNode string) {
            for (int i = 0; i < string.getChildCount(); i++) {
                if (string.getChild(i).getType().equals("interpolation")) {
                    return true;
                }
            }
            return false;
        }
    }
}
