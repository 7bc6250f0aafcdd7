package com.codeguard.engine.edit;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceEditsTest {

    @Test
    void apply_editsGivenInAnyOrder_offsetsReferToOriginal() {
        String text = "alpha beta gamma";

        String result = SourceEdits.apply(text, List.of(
                new SourceEdit(11, 16, "G"),
                new SourceEdit(0, 5, "A"),
                SourceEdit.insert(6, ">")));

        assertThat(result).isEqualTo("A >beta G");
    }

    @Test
    void apply_overlappingEdits_throwOperationFailure() {
        assertThatThrownBy(() -> SourceEdits.apply("abcdef", List.of(
                new SourceEdit(0, 3, "x"),
                new SourceEdit(2, 4, "y"))))
                .isInstanceOf(OperationFailure.class)
                .hasMessageContaining("overlapping");
    }

    @Test
    void apply_spanOutsideText_throwsOperationFailure() {
        assertThatThrownBy(() -> SourceEdits.apply("abc", List.of(new SourceEdit(1, 9, "x"))))
                .isInstanceOf(OperationFailure.class)
                .hasMessageContaining("outside the snippet");
    }
}
