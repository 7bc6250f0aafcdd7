package com.codeguard.engine.response;

/** Where in an agent response the validated code was found. */
public enum CodeSource {
    CORRECTED_CODE,
    CODE_BLOCK,
    RAW
}
