package com.codeguard.engine.edit;

import java.util.Locale;

public enum PatchAction {
    REPLACE,
    DELETE,
    INSERT_BEFORE,
    INSERT_AFTER,
    APPEND,
    PREPEND;

    /** Wire name, e.g. {@code insert_before}. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws OperationFailure for anything but the six wire names
     */
    public static PatchAction fromWireName(String name) {
        if (name != null) {
            for (PatchAction action : values()) {
                if (action.wireName().equals(name.trim().toLowerCase(Locale.ROOT))) {
                    return action;
                }
            }
        }
        throw new OperationFailure("unsupported action: '" + name + "'");
    }

    boolean needsTarget() {
        return this != APPEND && this != PREPEND;
    }
}
