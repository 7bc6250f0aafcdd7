package com.codeguard.engine.edit;

/**
 * One step of a structured patch.
 *
 * @param target      exact text the step applies to (unused by append/prepend)
 * @param replacement new text for {@code replace}
 * @param content     text to insert for the insert/append/prepend actions
 * @param occurrence  1-based occurrence of {@code target}; null requires the target to be unique
 */
public record PatchOperation(
        PatchAction action,
        String      target,
        String      replacement,
        String      content,
        Integer     occurrence) {

    public static PatchOperation replace(String target, String replacement) {
        return new PatchOperation(PatchAction.REPLACE, target, replacement, null, null);
    }

    public static PatchOperation delete(String target) {
        return new PatchOperation(PatchAction.DELETE, target, null, null, null);
    }

    public static PatchOperation insertAfter(String target, String content) {
        return new PatchOperation(PatchAction.INSERT_AFTER, target, null, content, null);
    }

    public static PatchOperation insertBefore(String target, String content) {
        return new PatchOperation(PatchAction.INSERT_BEFORE, target, null, content, null);
    }

    public static PatchOperation append(String content) {
        return new PatchOperation(PatchAction.APPEND, null, null, content, null);
    }

    public static PatchOperation prepend(String content) {
        return new PatchOperation(PatchAction.PREPEND, null, null, content, null);
    }
}
