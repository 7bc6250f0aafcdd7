package com.codeguard.engine.edit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies span edits computed against one original buffer.
 *
 * Edits are applied right to left so that earlier offsets stay valid, and
 * everything outside the edited spans (comments, spacing, line endings) is
 * copied through untouched.
 */
public final class SourceEdits {

    private SourceEdits() {}

    /**
     * @throws OperationFailure when two edits overlap or a span lies outside {@code text}
     */
    public static String apply(String text, List<SourceEdit> edits) {
        if (edits.isEmpty()) {
            return text;
        }
        List<SourceEdit> sorted = new ArrayList<>(edits);
        sorted.sort(Comparator.comparingInt(SourceEdit::start).thenComparingInt(SourceEdit::end));

        for (int i = 0; i < sorted.size(); i++) {
            SourceEdit e = sorted.get(i);
            if (e.end() > text.length()) {
                throw new OperationFailure("edit span [" + e.start() + ", " + e.end()
                        + ") lies outside the snippet (length " + text.length() + ")");
            }
            if (i > 0) {
                SourceEdit before = sorted.get(i - 1);
                boolean sameInsertPoint = before.start() == before.end() && e.start() == e.end()
                        && before.start() == e.start();
                if (before.end() > e.start() || sameInsertPoint) {
                    throw new OperationFailure("overlapping edits at offset " + e.start());
                }
            }
        }

        StringBuilder sb = new StringBuilder(text);
        for (int i = sorted.size() - 1; i >= 0; i--) {
            SourceEdit e = sorted.get(i);
            sb.replace(e.start(), e.end(), e.replacement());
        }
        return sb.toString();
    }
}
