package com.codeguard.engine.edit;

import java.util.ArrayList;
import java.util.List;

/**
 * What {@link FunctionStubber} puts in place of a bare {@code pass}.
 */
public record StubPolicy(Mode mode, String value) {

    public enum Mode {
        /** {@code raise NotImplementedError()}, or with a message when {@code value} is set. */
        RAISE_NOT_IMPLEMENTED,
        /** {@code return <value>}. */
        RETURN_VALUE,
        /** {@code value} verbatim, re-indented to the body's indentation. */
        CUSTOM_BODY
    }

    public StubPolicy {
        if (mode == null) {
            throw new IllegalArgumentException("mode is required");
        }
        if (mode != Mode.RAISE_NOT_IMPLEMENTED && (value == null || value.isBlank())) {
            throw new OperationFailure("stub policy " + mode + " needs a value");
        }
    }

    public static StubPolicy raiseNotImplemented() {
        return new StubPolicy(Mode.RAISE_NOT_IMPLEMENTED, null);
    }

    public static StubPolicy raiseNotImplemented(String message) {
        return new StubPolicy(Mode.RAISE_NOT_IMPLEMENTED, message);
    }

    public static StubPolicy returning(String literal) {
        return new StubPolicy(Mode.RETURN_VALUE, literal);
    }

    public static StubPolicy body(String code) {
        return new StubPolicy(Mode.CUSTOM_BODY, code);
    }

    /** Body lines without indentation. Blank lines come back empty. */
    List<String> lines() {
        switch (mode) {
            case RAISE_NOT_IMPLEMENTED:
                return List.of(value == null
                        ? "raise NotImplementedError()"
                        : "raise NotImplementedError(" + pythonString(value) + ")");
            case RETURN_VALUE:
                return List.of("return " + value.strip());
            default:
                return dedent(value);
        }
    }

    private static String pythonString(String text) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"'  -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default   -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    private static List<String> dedent(String code) {
        List<String> raw = SourceLines.of(code).lines();
        int common = Integer.MAX_VALUE;
        for (String line : raw) {
            if (!line.isBlank()) {
                common = Math.min(common, SourceLines.indentation(line).length());
            }
        }
        List<String> out = new ArrayList<>();
        for (String line : raw) {
            out.add(line.isBlank() ? "" : line.substring(common).stripTrailing());
        }
        while (!out.isEmpty() && out.get(0).isEmpty()) {
            out.remove(0);
        }
        while (!out.isEmpty() && out.get(out.size() - 1).isEmpty()) {
            out.remove(out.size() - 1);
        }
        if (out.isEmpty()) {
            throw new OperationFailure("custom stub body is empty");
        }
        return out;
    }
}
