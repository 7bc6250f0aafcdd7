package com.codeguard.engine.api;

import com.codeguard.engine.GuardException;
import com.codeguard.engine.api.dto.ToolCallResponse;
import com.codeguard.engine.guard.EditResult;
import com.codeguard.engine.skill.SkillException;
import com.codeguard.engine.skill.SkillNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures that escape the controllers to HTTP responses. Rejections
 * carry the same body as a rejected tool call; everything else is a
 * {@link ProblemDetail}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(GuardException.class)
    public ResponseEntity<ToolCallResponse> handleRejection(GuardException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ToolCallResponse.from(EditResult.rejected(ex)));
    }

    @ExceptionHandler(SkillNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleUnknownTool(SkillNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "Unknown tool", ex.getMessage());
    }

    @ExceptionHandler(SkillException.class)
    public ResponseEntity<ProblemDetail> handleSkillFailure(SkillException ex) {
        switch (ex.getKind()) {
            case PARSE_ERROR:
                return problem(HttpStatus.BAD_REQUEST, "Invalid tool arguments", ex.getMessage());
            case POLICY_VIOLATION:
                return problem(HttpStatus.PAYLOAD_TOO_LARGE, "Tool policy violation", ex.getMessage());
            default:
                log.error("Tool execution failed", ex);
                return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Tool execution failed", ex.getMessage());
        }
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleBadRequest(IllegalArgumentException ex) {
        return problem(HttpStatus.BAD_REQUEST, "Invalid request", ex.getMessage());
    }

    private static ResponseEntity<ProblemDetail> problem(HttpStatus status, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        return ResponseEntity.status(status).body(problem);
    }
}
