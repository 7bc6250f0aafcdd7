package com.codeguard.engine.protect;

public enum RegistryState {
    /** No baseline yet; the next snippet seen becomes the baseline. */
    UNINITIALIZED,
    /** Baseline frozen; every edit is compared against it. */
    ARMED
}
