package com.codeguard.engine.edit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies a batch of exact-text operations to a snippet.
 *
 * <p>Operations run in order, each against the output of the previous one.
 * The batch is all or nothing: the first failing operation aborts it and the
 * caller keeps the original snippet.
 */
public final class StructuredPatchApplier {

    private StructuredPatchApplier() {}

    /**
     * @throws OperationFailure for an empty batch, a missing/absent/ambiguous
     *                          target or missing content
     */
    public static String apply(String snippet, List<PatchOperation> operations) {
        if (operations == null || operations.isEmpty()) {
            throw new OperationFailure("structured patch has no operations");
        }
        String working = snippet;
        for (int i = 0; i < operations.size(); i++) {
            working = applyOne(working, operations.get(i), i + 1);
        }
        return working;
    }

    /**
     * Read operations from JSON: an array of operation objects, or a single object.
     *
     * @throws OperationFailure when the text is not JSON of that shape
     */
    public static List<PatchOperation> parse(ObjectMapper mapper, String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new OperationFailure("operations are not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new OperationFailure("operations are not valid JSON");
        }
        return parse(root);
    }

    public static List<PatchOperation> parse(JsonNode root) {
        List<PatchOperation> out = new ArrayList<>();
        if (root.isObject()) {
            out.add(toOperation(root, 1));
        } else if (root.isArray()) {
            for (int i = 0; i < root.size(); i++) {
                if (!root.get(i).isObject()) {
                    throw new OperationFailure("operation " + (i + 1) + " must be a JSON object");
                }
                out.add(toOperation(root.get(i), i + 1));
            }
        } else {
            throw new OperationFailure("operations must be a JSON object or array");
        }
        return out;
    }

    private static PatchOperation toOperation(JsonNode node, int index) {
        JsonNode occurrence = node.get("occurrence");
        if (occurrence != null && !occurrence.isNull() && !occurrence.canConvertToInt()) {
            throw new OperationFailure("operation " + index + ": occurrence must be an integer");
        }
        return new PatchOperation(
                PatchAction.fromWireName(text(node, "action")),
                text(node, "target"),
                text(node, "replacement"),
                text(node, "content"),
                occurrence == null || occurrence.isNull() ? null : occurrence.asInt());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    // ------------------------------------------------------------------

    private static String applyOne(String text, PatchOperation op, int index) {
        if (op.action() == null) {
            throw new OperationFailure("operation " + index + ": unsupported action");
        }
        String label = "operation " + index + " (" + op.action().wireName() + ")";
        if (op.action().needsTarget() && (op.target() == null || op.target().isEmpty())) {
            throw new OperationFailure(label + " requires a 'target'");
        }
        switch (op.action()) {
            case REPLACE: {
                require(op.replacement(), "replacement", label);
                int at = locate(text, op.target(), op.occurrence(), label);
                return text.substring(0, at) + op.replacement() + text.substring(at + op.target().length());
            }
            case DELETE: {
                int at = locate(text, op.target(), op.occurrence(), label);
                return text.substring(0, at) + text.substring(at + op.target().length());
            }
            case INSERT_BEFORE: {
                require(op.content(), "content", label);
                int at = locate(text, op.target(), op.occurrence(), label);
                return text.substring(0, at) + op.content() + text.substring(at);
            }
            case INSERT_AFTER: {
                require(op.content(), "content", label);
                int at = locate(text, op.target(), op.occurrence(), label) + op.target().length();
                return text.substring(0, at) + op.content() + text.substring(at);
            }
            case APPEND: {
                require(op.content(), "content", label);
                String base = text.isEmpty() || text.endsWith("\n") ? text : text + "\n";
                return withNewline(base + op.content());
            }
            case PREPEND: {
                require(op.content(), "content", label);
                return withNewline(op.content()) + text;
            }
            default:
                throw new OperationFailure(label + ": unsupported action");
        }
    }

    private static int locate(String text, String target, Integer occurrence, String label) {
        List<Integer> hits = new ArrayList<>();
        int from = 0;
        while (true) {
            int at = text.indexOf(target, from);
            if (at < 0) {
                break;
            }
            hits.add(at);
            from = at + 1;
        }
        if (hits.isEmpty()) {
            throw new OperationFailure(label + ": target not found: '" + target + "'");
        }
        if (occurrence == null) {
            if (hits.size() > 1) {
                throw new OperationFailure(label + ": target is ambiguous (" + hits.size()
                        + " occurrences); pass an occurrence");
            }
            return hits.get(0);
        }
        if (occurrence < 1 || occurrence > hits.size()) {
            throw new OperationFailure(label + ": occurrence " + occurrence + " out of range (1.."
                    + hits.size() + ")");
        }
        return hits.get(occurrence - 1);
    }

    private static void require(String value, String field, String label) {
        if (value == null) {
            throw new OperationFailure(label + " requires a '" + field + "'");
        }
    }

    private static String withNewline(String text) {
        return text.endsWith("\n") ? text : text + "\n";
    }
}
