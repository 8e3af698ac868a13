package com.harbor.observability;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Detail reported alongside a dependency's health.
 * <p>
 * Either a structured JSON value supplied by the dependency, or a plain text message.
 * {@link HealthDetailResolver} decides which variant a check result becomes.
 */
public sealed interface HealthDetail permits HealthDetail.Structured, HealthDetail.Text {

    /**
     * Returns the JSON form written in verbose health responses.
     */
    @JsonValue
    JsonNode toJson();

    /**
     * Structured detail, written as-is.
     *
     * @param value non-trivial JSON tree
     */
    record Structured(JsonNode value) implements HealthDetail {

        public Structured {
            if (value == null) {
                throw new IllegalArgumentException("value must not be null");
            }
        }

        @Override
        public JsonNode toJson() {
            return value;
        }
    }

    /**
     * Plain text detail, written as a JSON string.
     *
     * @param message the message
     */
    record Text(String message) implements HealthDetail {

        public Text {
            if (message == null) {
                throw new IllegalArgumentException("message must not be null");
            }
        }

        @Override
        public JsonNode toJson() {
            return TextNode.valueOf(message);
        }
    }
}
