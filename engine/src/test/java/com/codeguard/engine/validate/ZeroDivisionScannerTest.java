package com.codeguard.engine.validate;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ZeroDivisionScannerTest {

    @Test
    void detect_literalDivisionByZero() {
        List<RuntimeIssue> issues = ZeroDivisionScanner.detect("result = 10 / 0\n");

        assertThat(issues).containsExactly(
                new RuntimeIssue("ZeroDivisionError", "Detected division by zero.", 1, 9));
    }

    @Test
    void detect_nonZeroDivisor_nothingReported() {
        assertThat(ZeroDivisionScanner.detect("value = 10 / 2\n")).isEmpty();
        assertThat(ZeroDivisionScanner.detect("value = 10 / n\n")).isEmpty();
    }

    @Test
    void detect_foldedZeroFloorDivisionModuloAndAugmented() {
        String snippet = """
                a = 1 // (3 - 3)
                b = 5 % 0.0
                c = 4
                c /= False
                d = 2 / (0x0)
                """;

        List<RuntimeIssue> issues = ZeroDivisionScanner.detect(snippet);

        assertThat(issues).extracting(RuntimeIssue::line).containsExactly(1, 2, 4, 5);
        assertThat(issues).extracting(RuntimeIssue::message).containsExactly(
                "Detected floor division by zero.",
                "Detected modulo by zero.",
                "Detected division by zero.",
                "Detected division by zero.");
    }

    @Test
    void detect_stringFormattingWithZero_nothingReported() {
        assertThat(ZeroDivisionScanner.detect("msg = \"%d items\" % 0\n")).isEmpty();
        assertThat(ZeroDivisionScanner.detect("raw = b\"%d\" % 0\n")).isEmpty();
    }

    @Test
    void detect_largeIntegersFoldExactly() {
        assertThat(ZeroDivisionScanner.detect("x = 1 / (10**20 + 1 - 10**20)\n")).isEmpty();
        assertThat(ZeroDivisionScanner.detect("x = 1 / (10**20 - 10**20)\n"))
                .extracting(RuntimeIssue::message).containsExactly("Detected division by zero.");
    }

    @Test
    void detect_floatFoldingAndNegativeModulo() {
        assertThat(ZeroDivisionScanner.detect("x = 1 % (0.5 - 0.5)\n")).hasSize(1);
        assertThat(ZeroDivisionScanner.detect("x = 1 // (-7 % 7)\n")).hasSize(1);
        assertThat(ZeroDivisionScanner.detect("x = 1 // (-7 % 3)\n")).isEmpty();
    }

    @Test
    void detect_insideFunctionBodies() {
        String snippet = """
                def ratio(x):
                    if x:
                        return x / 0
                    return 1
                """;

        assertThat(ZeroDivisionScanner.detect(snippet)).extracting(RuntimeIssue::line).containsExactly(3);
    }

    @Test
    void report_formatsOneLinePerIssue() {
        String report = ZeroDivisionScanner.report("x = 1 / 0\ny = 2 % 0\n");

        assertThat(report).isEqualTo("""
                [runtime_error] ZeroDivisionError at line 1, column 4 - Detected division by zero.
                [runtime_error] ZeroDivisionError at line 2, column 4 - Detected modulo by zero.""");
    }

    @Test
    void report_cleanSnippet() {
        assertThat(ZeroDivisionScanner.report("x = 1\n")).isEqualTo("[runtime_error] none detected");
    }
}
