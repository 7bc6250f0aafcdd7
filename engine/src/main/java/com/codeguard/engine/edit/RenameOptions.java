package com.codeguard.engine.edit;

/**
 * How {@link SymbolRenamer} selects matches.
 *
 * @param includeStrings also rewrite whole-word occurrences inside string literals
 * @param occurrence     1-based match to rename; null means the first one
 * @param all            rename every match (overrides {@code occurrence})
 * @param allowProtected rename even when the armed baseline protects the name
 */
public record RenameOptions(boolean includeStrings, Integer occurrence, boolean all, boolean allowProtected) {

    public static RenameOptions defaults() {
        return new RenameOptions(false, null, false, false);
    }

    public static RenameOptions everyMatch() {
        return new RenameOptions(false, null, true, false);
    }

    public RenameOptions withIncludeStrings(boolean value) {
        return new RenameOptions(value, occurrence, all, allowProtected);
    }

    public RenameOptions withOccurrence(Integer value) {
        return new RenameOptions(includeStrings, value, all, allowProtected);
    }

    public RenameOptions withAllowProtected(boolean value) {
        return new RenameOptions(includeStrings, occurrence, all, value);
    }
}
