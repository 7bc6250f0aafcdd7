package com.codeguard.engine.api.dto;

import com.codeguard.engine.response.CodeSource;
import com.codeguard.engine.response.ValidatedResponse;

/** Response body for a final answer that passed the gate. */
public record ValidateResponseResult(
        String     status,
        String     code,
        CodeSource source,
        boolean    colonsRepaired
) {
    public static ValidateResponseResult from(ValidatedResponse v) {
        return new ValidateResponseResult("valid", v.code(), v.source(), v.colonsRepaired());
    }
}
