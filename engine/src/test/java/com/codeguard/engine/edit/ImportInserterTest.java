package com.codeguard.engine.edit;

import com.codeguard.engine.syntax.SyntaxFailure;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImportInserterTest {

    @Test
    void addImport_plainModule_insertedAtTop() {
        String result = ImportInserter.addImport("def foo():\n    return 1\n", "math");

        assertThat(result).isEqualTo("import math\ndef foo():\n    return 1\n");
    }

    @Test
    void addImport_repeated_isNoOp() {
        String once  = ImportInserter.addImport("def foo():\n    return 1\n", "math");
        String twice = ImportInserter.addImport(once, "math");

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void addImport_afterDocstringAndExistingImports() {
        String snippet = """
                \"\"\"Doc.\"\"\"
                import os

                def f():
                    return os.sep
                """;

        String result = ImportInserter.addImport(snippet, "sys");

        assertThat(result).isEqualTo("""
                \"\"\"Doc.\"\"\"
                import os
                import sys

                def f():
                    return os.sep
                """);
    }

    @Test
    void addImport_afterShebangAndEncodingLines() {
        String snippet = "#!/usr/bin/env python\n# -*- coding: utf-8 -*-\nx = 1\n";

        String result = ImportInserter.addImport(snippet, "json");

        assertThat(result).isEqualTo("#!/usr/bin/env python\n# -*- coding: utf-8 -*-\nimport json\nx = 1\n");
    }

    @Test
    void addImport_onlyTopLevelImportsCount() {
        String snippet = "def f():\n    import math\n    return math.pi\n";

        String result = ImportInserter.addImport(snippet, "math");

        assertThat(result).isEqualTo("import math\n" + snippet);
    }

    @Test
    void addImport_emptySnippet_returnsStatementOnly() {
        assertThat(ImportInserter.addImport("", "os")).isEqualTo("import os");
    }

    @Test
    void ensureImport_fromImport_addedOnceThenIdempotent() {
        String snippet = "x: List[int] = []\n";

        String once = ImportInserter.ensureImport(snippet, "typing", "List", null);

        assertThat(once).isEqualTo("from typing import List\nx: List[int] = []\n");
        assertThat(ImportInserter.ensureImport(once, "typing", "List", null)).isEqualTo(once);
    }

    @Test
    void ensureImport_aliasMustMatchToCountAsPresent() {
        assertThat(ImportInserter.ensureImport("import numpy as np\n", "numpy", null, "np"))
                .isEqualTo("import numpy as np\n");
        assertThat(ImportInserter.ensureImport("import numpy\n", "numpy", null, "np"))
                .isEqualTo("import numpy\nimport numpy as np\n");
    }

    @Test
    void ensureImport_invalidModuleName_throwsOperationFailure() {
        assertThatThrownBy(() -> ImportInserter.addImport("x = 1\n", "os path"))
                .isInstanceOf(OperationFailure.class)
                .hasMessageContaining("invalid module name");
    }

    @Test
    void addImport_unparsableSnippet_throwsSyntaxFailure() {
        assertThatThrownBy(() -> ImportInserter.addImport("def bad()\n    pass\n", "os"))
                .isInstanceOf(SyntaxFailure.class);
    }
}
