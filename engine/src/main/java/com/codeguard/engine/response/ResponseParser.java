package com.codeguard.engine.response;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the parts the response gate cares about out of an agent's final text:
 *   1. a {@code <result>...</result>} section, when the agent used one
 *   2. the first fenced code block ({@code ```python}, {@code ```py} or bare {@code ```})
 */
public class ResponseParser {

    // Matches ```python ... ``` or ``` ... ``` (with optional language label)
    private static final Pattern CODE_BLOCK = Pattern.compile(
            "```(?:python3?|py)?[ \\t]*\\r?\\n(.*?)\\r?\\n[ \\t]*```",
            Pattern.DOTALL
    );

    // Matches <result>...</result>
    private static final Pattern RESULT_TAG = Pattern.compile(
            "<result>(.*?)</result>",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    /**
     * Extract the first code block. The block's own trailing newline is
     * restored so the code reads like a file.
     */
    public static Optional<String> extractCodeBlock(String response) {
        Matcher m = CODE_BLOCK.matcher(response);
        return m.find() ? Optional.of(m.group(1) + "\n") : Optional.empty();
    }

    /** Extract the content of the first {@code <result>...</result>} tag. */
    public static Optional<String> extractResult(String response) {
        Matcher m = RESULT_TAG.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }
}
