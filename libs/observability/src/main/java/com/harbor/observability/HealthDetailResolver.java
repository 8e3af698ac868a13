package com.harbor.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Turns check outcomes into {@link HealthDetail}.
 * <p>
 * Failures: a {@link HealthCheckException} whose {@code details} serialize to a non-empty JSON
 * value is reported structured; every other failure (no details, details that cannot be
 * serialized, details that serialize to {@code null}, {@code {}} or {@code []}) is reported
 * as the exception message.
 * <p>
 * Successes: {@code null} means no detail, a {@link String} becomes text, anything else is
 * reported structured when non-empty.
 */
public final class HealthDetailResolver {

    private final ObjectMapper mapper;

    public HealthDetailResolver() {
        this(new ObjectMapper());
    }

    public HealthDetailResolver(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper must not be null");
        }
        this.mapper = mapper;
    }

    /**
     * Resolves the detail for a failed check.
     *
     * @param error the failure thrown by the checker
     * @return structured or text detail, never {@code null}
     */
    public HealthDetail fromError(Throwable error) {
        if (error instanceof HealthCheckException hce && hce.details() != null) {
            JsonNode tree = toTree(hce.details());
            if (isNonTrivial(tree)) {
                return new HealthDetail.Structured(tree);
            }
        }
        return new HealthDetail.Text(messageOf(error));
    }

    /**
     * Resolves the detail returned by a healthy check.
     *
     * @param value what the checker returned
     * @return the detail, or {@code null} when there is nothing worth reporting
     */
    public HealthDetail fromValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String text) {
            return new HealthDetail.Text(text);
        }
        JsonNode tree = toTree(value);
        if (tree == null) {
            return new HealthDetail.Text(String.valueOf(value));
        }
        return isNonTrivial(tree) ? new HealthDetail.Structured(tree) : null;
    }

    private JsonNode toTree(Object value) {
        try {
            return mapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static boolean isNonTrivial(JsonNode tree) {
        if (tree == null || tree.isNull() || tree.isMissingNode()) {
            return false;
        }
        return !tree.isContainerNode() || !tree.isEmpty();
    }

    private static String messageOf(Throwable error) {
        String message = error.getMessage();
        return message != null ? message : error.toString();
    }
}
