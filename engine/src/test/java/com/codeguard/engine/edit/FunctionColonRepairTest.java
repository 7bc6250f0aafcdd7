package com.codeguard.engine.edit;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FunctionColonRepairTest {

    @Test
    void repair_missingColon_inserted() {
        assertThat(FunctionColonRepair.repair("def bad()\n    pass\n")).contains("def bad():\n    pass\n");
    }

    @Test
    void repair_trailingComment_colonBeforeComment() {
        assertThat(FunctionColonRepair.repair("def f(a) # c\n    return a\n"))
                .contains("def f(a): # c\n    return a\n");
    }

    @Test
    void repair_returnAnnotation_colonAfterAnnotation() {
        assertThat(FunctionColonRepair.repair("async def f(a) -> list[int]\n    return [a]\n"))
                .contains("async def f(a) -> list[int]:\n    return [a]\n");
    }

    @Test
    void repair_multiLineSignature() {
        assertThat(FunctionColonRepair.repair("def f(a,\n      b=\")\")\n    return a\n"))
                .contains("def f(a,\n      b=\")\"):\n    return a\n");
    }

    @Test
    void repair_inlineBody() {
        assertThat(FunctionColonRepair.repair("def f(a) return a\n")).contains("def f(a): return a\n");
    }

    @Test
    void repair_defInsideDocstring_untouched() {
        String snippet = "def f(a):\n    \"\"\"Replaces\n    def old_f(x)\n    \"\"\"\n    return a\n";

        assertThat(FunctionColonRepair.repair(snippet)).isEmpty();
    }

    @Test
    void repair_realDefAfterDocstringMention_stillRepaired() {
        String snippet = "'''\ndef old_f(x)\n'''\ndef f(a)\n    return a\n";

        assertThat(FunctionColonRepair.repair(snippet))
                .contains("'''\ndef old_f(x)\n'''\ndef f(a):\n    return a\n");
    }

    @Test
    void repair_nothingMissing_returnsEmpty() {
        String snippet = "def f(a):\n    return a\n";

        assertThat(FunctionColonRepair.repair(snippet)).isEmpty();
        assertThat(FunctionColonRepair.repairOrSame(snippet)).isSameAs(snippet);
    }
}
