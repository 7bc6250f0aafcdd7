package com.codeguard.engine.response;

import com.codeguard.engine.edit.FunctionColonRepair;
import com.codeguard.engine.syntax.PythonParser;
import com.codeguard.engine.syntax.SyntaxFailure;
import com.codeguard.engine.validate.StaticValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Last check before an agent's final answer is released.
 *
 * <p>The code is taken from, in order: a JSON object's {@code corrected_code}
 * field, the first fenced code block, or the whole text. The search runs inside
 * the {@code <result>} section when there is one. Code that does not parse gets
 * its missing {@code def} colons restored; code that still does not parse or
 * that breaks a static rule is refused with the corresponding {@link com.codeguard.engine.GuardException}.
 */
@Component
public class ResponseGuard {

    private static final Logger log = LoggerFactory.getLogger(ResponseGuard.class);

    static final String CORRECTED_CODE = "corrected_code";

    private final ObjectMapper objectMapper;

    public ResponseGuard(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws com.codeguard.engine.syntax.SyntaxFailure      when the code does not parse
     * @throws com.codeguard.engine.validate.ValidationFailure when it breaks a static rule
     */
    public ValidatedResponse validate(String response) {
        String text = response == null ? "" : response;
        text = ResponseParser.extractResult(text).orElse(text);

        CodeSource source;
        String code;
        Optional<String> corrected = correctedCode(text);
        if (corrected.isPresent()) {
            source = CodeSource.CORRECTED_CODE;
            code   = corrected.get();
        } else {
            Optional<String> block = ResponseParser.extractCodeBlock(text);
            source = block.isPresent() ? CodeSource.CODE_BLOCK : CodeSource.RAW;
            code   = block.orElse(text);
        }

        boolean colonsRepaired = false;
        try {
            PythonParser.parse(code);
        } catch (SyntaxFailure e) {
            Optional<String> repaired = FunctionColonRepair.repair(code);
            if (repaired.isEmpty()) {
                throw e;
            }
            log.info("Response gate restored missing function colons ({}) after: {}", source, e.getMessage());
            code = repaired.get();
            colonsRepaired = true;
            PythonParser.parse(code);
        }
        StaticValidator.validate(code);
        return new ValidatedResponse(code, source, colonsRepaired);
    }

    /** The {@code corrected_code} field when {@code text} is a JSON object (or array of one). */
    Optional<String> correctedCode(String text) {
        String trimmed = text.strip();
        if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            log.debug("Response looks like JSON but does not parse, treating it as code: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (root != null && root.isArray() && root.size() > 0) {
            root = root.get(0);
        }
        if (root == null || !root.isObject() || !root.has(CORRECTED_CODE)) {
            return Optional.empty();
        }
        JsonNode field = root.get(CORRECTED_CODE);
        return Optional.of(field.isNull() ? "" : field.asText());
    }
}
