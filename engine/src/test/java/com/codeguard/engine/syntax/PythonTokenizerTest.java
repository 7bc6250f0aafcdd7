package com.codeguard.engine.syntax;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PythonTokenizerTest {

    // ------------------------------------------------------------------
    // Lossless round trip
    // ------------------------------------------------------------------

    @Test
    void detokenize_reproducesSourceExactly() {
        String source = """
                #!/usr/bin/env python
                # -*- coding: utf-8 -*-
                \"\"\"Module docstring.\"\"\"
                import os, sys


                class Greeter(object):   # trailing comment
                \tdef greet(self, name: str = "x") -> str:
                \t\treturn f"hi {name}" + 'there' \\
                \t\t\t+ r'\\d+'

                data = {
                    "a": [1, 2.5, 3j, 0x1F],   # inside brackets
                }
                """;

        TokenStream stream = PythonTokenizer.tokenize(source);

        assertThat(stream.detokenize()).isEqualTo(source);
    }

    @Test
    void detokenize_withoutTrailingNewline_roundTrips() {
        String source = "x = 1\nif x:\n    y = 2";

        assertThat(PythonTokenizer.tokenize(source).detokenize()).isEqualTo(source);
    }

    @Test
    void detokenize_nonAsciiSource_roundTrips() {
        String source = "naïve = '日本語'  # ünïcode 🐍\nx = naïve\n";

        TokenStream stream = PythonTokenizer.tokenize(source);

        assertThat(stream.detokenize()).isEqualTo(source);
        assertThat(stream.significant()).extracting(Token::text).contains("naïve", "'日本語'", "x");
    }

    @Test
    void detokenize_crlfSource_roundTrips() {
        String source = "def f():\r\n    return 1\r\n";

        assertThat(PythonTokenizer.tokenize(source).detokenize()).isEqualTo(source);
    }

    @Test
    void detokenize_emptySource_roundTrips() {
        assertThat(PythonTokenizer.tokenize("").detokenize()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Token kinds and positions
    // ------------------------------------------------------------------

    @Test
    void tokenize_simpleAssignment_significantKinds() {
        List<Token> sig = PythonTokenizer.tokenize("total = items[0]\n").significant();

        assertThat(sig).extracting(Token::kind).containsExactly(
                TokenKind.NAME, TokenKind.OP, TokenKind.NAME, TokenKind.OP,
                TokenKind.NUMBER, TokenKind.OP);
        assertThat(sig.get(4).text()).isEqualTo("0");
        assertThat(sig.get(4).line()).isEqualTo(1);
        assertThat(sig.get(4).column()).isEqualTo(14);
    }

    @Test
    void tokenize_reservedWordsAreKeywords_softKeywordsUsedAsNamesAreNames() {
        List<Token> sig = PythonTokenizer.tokenize("if x is None:\n    match = type(print)\n").significant();

        assertThat(sig).filteredOn(t -> t.kind() == TokenKind.KEYWORD).extracting(Token::text)
                .containsExactly("if", "is", "None");
        assertThat(sig).filteredOn(t -> t.kind() == TokenKind.NAME).extracting(Token::text)
                .containsExactly("x", "match", "type", "print");
    }

    @Test
    void tokenize_indentationAndNewlinesAreWhitespace() {
        TokenStream stream = PythonTokenizer.tokenize("if x:\n    y = 1\nz = 2\n");

        assertThat(stream.tokens()).filteredOn(t -> t.text().isBlank())
                .extracting(Token::kind).containsOnly(TokenKind.WHITESPACE);
        assertThat(stream.significant()).extracting(Token::text)
                .containsExactly("if", "x", ":", "y", "=", "1", "z", "=", "2");
    }

    @Test
    void tokenize_prefixedAndTripleQuotedStrings_areSingleTokens() {
        String source = "a = rb'\\x00'\nb = \"\"\"line1\nline2\"\"\"\n";

        List<Token> strings = PythonTokenizer.tokenize(source).tokens().stream()
                .filter(t -> t.kind() == TokenKind.STRING)
                .toList();

        assertThat(strings).extracting(Token::text)
                .containsExactly("rb'\\x00'", "\"\"\"line1\nline2\"\"\"");
    }

    @Test
    void tokenize_fStringFields_areTokenizedAsCode() {
        String source = "msg = f\"hi {name!r:>10} and {count + 1}\"\n";

        TokenStream stream = PythonTokenizer.tokenize(source);

        assertThat(stream.detokenize()).isEqualTo(source);
        assertThat(stream.significant()).filteredOn(t -> t.kind() == TokenKind.NAME)
                .extracting(Token::text).containsExactly("msg", "name", "count");
        assertThat(stream.tokens()).filteredOn(t -> t.kind() == TokenKind.STRING)
                .extracting(Token::text).noneMatch(t -> t.contains("name") || t.contains("count"));
    }

    @Test
    void inStringOrComment_coversLiteralInteriors() {
        String source = "x = 'def f'  # def g\ndef h(): pass\n";
        TokenStream stream = PythonTokenizer.tokenize(source);

        assertThat(stream.inStringOrComment(source.indexOf("def f"))).isTrue();
        assertThat(stream.inStringOrComment(source.indexOf("def g"))).isTrue();
        assertThat(stream.inStringOrComment(source.indexOf("def h"))).isFalse();
    }

    // ------------------------------------------------------------------
    // Broken input
    // ------------------------------------------------------------------

    @Test
    void tokenize_brokenSnippets_stillRoundTrip() {
        List<String> broken = List.of(
                "x = 'abc\n",
                "x = (1, 2\n",
                "x = 1)\n",
                "def bad()\n    pass\n",
                "if x:\n        y = 1\n    z = 2\n",
                "$ = @@\n");

        for (String source : broken) {
            assertThat(PythonTokenizer.tokenize(source).detokenize()).as(source).isEqualTo(source);
        }
    }

    @Test
    void tokenize_missingColon_keepsDefKeywordAndName() {
        List<Token> sig = PythonTokenizer.tokenize("def bad()\n    pass\n").significant();

        assertThat(sig.get(0).isKeyword("def")).isTrue();
        assertThat(sig.get(1)).extracting(Token::kind, Token::text).containsExactly(TokenKind.NAME, "bad");
    }
}
