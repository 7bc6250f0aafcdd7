package com.codeguard.engine.api.dto;

import com.codeguard.engine.GuardException;
import com.codeguard.engine.guard.EditResult;
import com.codeguard.engine.protect.Violation;
import com.codeguard.engine.validate.Finding;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Response body of a tool call: {@code applied} with the snippet (and the
 * validator's report), or {@code rejected} with the reason.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolCallResponse(
        String              status,
        String              snippet,
        String              result,
        GuardException.Kind kind,
        String              message,
        List<Violation>     violations,
        List<Finding>       findings
) {
    public static ToolCallResponse from(EditResult result) {
        if (result instanceof EditResult.Applied a) {
            return new ToolCallResponse("applied", a.snippet(), a.result(), null, null, null, null);
        }
        EditResult.Rejected r = (EditResult.Rejected) result;
        return new ToolCallResponse("rejected", null, null, r.kind(), r.message(), r.violations(), r.findings());
    }
}
