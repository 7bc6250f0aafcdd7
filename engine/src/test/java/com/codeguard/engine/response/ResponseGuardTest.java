package com.codeguard.engine.response;

import com.codeguard.engine.syntax.SyntaxFailure;
import com.codeguard.engine.validate.ValidationFailure;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseGuardTest {

    private final ResponseGuard guard = new ResponseGuard(new ObjectMapper());

    @Test
    void validate_correctedCodeJson_preferred() {
        String response = """
                {"corrected_code": "def add(a, b):\\n    return a + b\\n", "explanation": "fixed"}
                """;

        ValidatedResponse result = guard.validate(response);

        assertThat(result).isEqualTo(new ValidatedResponse(
                "def add(a, b):\n    return a + b\n", CodeSource.CORRECTED_CODE, false));
    }

    @Test
    void validate_jsonArray_firstElementUsed() {
        ValidatedResponse result = guard.validate("[{\"corrected_code\": \"x = 1\\n\"}, {\"corrected_code\": \"(\"}]");

        assertThat(result.code()).isEqualTo("x = 1\n");
    }

    @Test
    void validate_codeBlockInsideResultTag() {
        String response = """
                Some reasoning with ```python
                broken(
                ``` in it.
                <result>
                ```python
                def ok():
                    return 1
                ```
                </result>
                """;

        ValidatedResponse result = guard.validate(response);

        assertThat(result.source()).isEqualTo(CodeSource.CODE_BLOCK);
        assertThat(result.code()).isEqualTo("def ok():\n    return 1\n");
    }

    @Test
    void validate_rawText_usedAsCode() {
        assertThat(guard.validate("x = 1\n").source()).isEqualTo(CodeSource.RAW);
    }

    @Test
    void validate_missingDefColon_repaired() {
        ValidatedResponse result = guard.validate("```python\ndef f(a)\n    return a\n```");

        assertThat(result.colonsRepaired()).isTrue();
        assertThat(result.code()).isEqualTo("def f(a):\n    return a\n");
    }

    @Test
    void validate_validCodeMentioningDefInDocstring_returnedUnchanged() {
        String code = "def f(a):\n    \"\"\"Replaces\n    def old_f(x)\n    \"\"\"\n    return a\n";

        ValidatedResponse result = guard.validate("```python\n" + code + "```");

        assertThat(result.code()).isEqualTo(code);
        assertThat(result.colonsRepaired()).isFalse();
    }

    @Test
    void validate_unparsableCode_throwsSyntaxFailure() {
        assertThatThrownBy(() -> guard.validate("```python\nx = (1,\n```"))
                .isInstanceOf(SyntaxFailure.class);
    }

    @Test
    void validate_staticFindings_throwValidationFailure() {
        assertThatThrownBy(() -> guard.validate("{\"corrected_code\": \"SENTINEL = None\\n\"}"))
                .isInstanceOf(ValidationFailure.class)
                .hasMessageContaining("sentinel-none");
    }

    @Test
    void correctedCode_nullField_emptyCode() {
        assertThat(guard.correctedCode("{\"corrected_code\": null}")).contains("");
    }

    @Test
    void correctedCode_malformedJson_empty() {
        assertThat(guard.correctedCode("{not json")).isEmpty();
        assertThat(guard.correctedCode("{\"other\": 1}")).isEmpty();
    }
}
