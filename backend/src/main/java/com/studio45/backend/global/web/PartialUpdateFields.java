package com.studio45.backend.global.web;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.studio45.backend.global.error.ProblemException;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Reads a JSON object body for partial updates. Distinguishes "absent" from "explicit null"
 * so callers can build typed update variants instead of passing maps around.
 */
public final class PartialUpdateFields {

    private final JsonNode body;

    private PartialUpdateFields(JsonNode body) {
        this.body = body;
    }

    public static PartialUpdateFields of(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw ProblemException.validation("invalid_request_body", "Request body must be a JSON object");
        }
        return new PartialUpdateFields(body);
    }

    public List<String> fieldNames() {
        List<String> names = new ArrayList<>();
        Iterator<String> iterator = body.fieldNames();
        iterator.forEachRemaining(names::add);
        return names;
    }

    public boolean has(String field) {
        return body.has(field);
    }

    /**
     * The untouched node for fields with structured values, e.g. arrays.
     */
    public JsonNode raw(String field) {
        return body.get(field);
    }

    /**
     * Rejects keys outside {@code allowed}; keys in {@code ignored} are dropped silently.
     */
    public void rejectUnknown(Set<String> allowed, Set<String> ignored) {
        for (String name : fieldNames()) {
            if (!allowed.contains(name) && !ignored.contains(name)) {
                throw ProblemException.validation("validation_error", "Unknown field: " + name);
            }
        }
    }

    /**
     * A field that may be changed but never cleared.
     */
    public String requiredText(String field, int minLength, int maxLength) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull() || !node.isTextual()) {
            throw ProblemException.validation("validation_error", field + ": must be a non-null string");
        }
        String value = node.asText().trim();
        if (value.length() < minLength || value.length() > maxLength) {
            throw ProblemException.validation("validation_error",
                    field + ": length must be between " + minLength + " and " + maxLength);
        }
        return value;
    }

    /**
     * A clearable field: {@code null} or an empty string yields {@link Optional#empty()}.
     */
    public Optional<String> clearableText(String field, int maxLength) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (!node.isTextual()) {
            throw ProblemException.validation("validation_error", field + ": must be a string or null");
        }
        String value = node.asText().trim();
        if (value.length() > maxLength) {
            throw ProblemException.validation("validation_error", field + ": length must be at most " + maxLength);
        }
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    public Optional<Boolean> optionalBoolean(String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (!node.isBoolean()) {
            throw ProblemException.validation("validation_error", field + ": must be a boolean");
        }
        return Optional.of(node.asBoolean());
    }
}
