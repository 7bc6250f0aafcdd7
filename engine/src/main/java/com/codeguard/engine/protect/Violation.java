package com.codeguard.engine.protect;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Comparator;

/**
 * A baseline identifier that is missing after an edit.
 */
public record Violation(Category category, String name) implements Comparable<Violation> {

    public enum Category {
        FUNCTION("function"),
        CLASS("class"),
        CALL("call"),
        ENTRY_POINT("entry-point");

        private final String label;

        Category(String label) { this.label = label; }

        @JsonValue
        public String label() { return label; }
    }

    private static final Comparator<Violation> ORDER =
            Comparator.comparing(Violation::category).thenComparing(Violation::name);

    @Override
    public int compareTo(Violation other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return category.label() + " '" + name + "'";
    }
}
