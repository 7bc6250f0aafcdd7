package com.codeguard.engine.api;

import com.codeguard.engine.api.dto.ValidateResponseRequest;
import com.codeguard.engine.api.dto.ValidateResponseResult;
import com.codeguard.engine.response.ResponseGuard;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * POST /responses/validate: gate an agent's final answer before release.
 *
 * HTTP 200: the extracted (and possibly colon-repaired) code is valid
 * HTTP 422: it does not parse or breaks a static rule
 */
@RestController
@RequestMapping("/responses")
public class ResponseController {

    private final ResponseGuard responseGuard;

    public ResponseController(ResponseGuard responseGuard) {
        this.responseGuard = responseGuard;
    }

    @PostMapping("/validate")
    public ValidateResponseResult validate(@RequestBody ValidateResponseRequest req) {
        if (req.response() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "response is required");
        }
        return ValidateResponseResult.from(responseGuard.validate(req.response()));
    }
}
