package com.codeguard.engine.edit;

/**
 * Request for {@link IndexAdjuster}.
 *
 * <p>Exactly one of {@code newValue} and {@code delta} must be set. When
 * {@code originalValue} is set only subscripts holding that literal are
 * candidates; {@code occurrence} (1-based) picks one of them.
 *
 * @param legacyShiftAll deprecated: apply {@code delta} to every candidate
 *                       instead of one occurrence
 */
public record IndexAdjustment(
        Integer originalValue,
        Integer newValue,
        Integer delta,
        int     occurrence,
        boolean legacyShiftAll) {

    public static IndexAdjustment replace(Integer originalValue, int newValue, int occurrence) {
        return new IndexAdjustment(originalValue, newValue, null, occurrence, false);
    }

    public static IndexAdjustment shift(Integer originalValue, int delta, int occurrence) {
        return new IndexAdjustment(originalValue, null, delta, occurrence, false);
    }
}
