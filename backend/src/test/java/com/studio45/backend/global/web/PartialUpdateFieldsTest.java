package com.studio45.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Set;

import com.studio45.backend.global.error.ProblemException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;

class PartialUpdateFieldsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void absentNullAndEmptyAreDistinguished() throws Exception {
        PartialUpdateFields fields = PartialUpdateFields.of(json("{\"a\": null, \"b\": \"\", \"c\": \"  x  \"}"));

        assertThat(fields.has("a")).isTrue();
        assertThat(fields.has("missing")).isFalse();
        assertThat(fields.clearableText("a", 10)).isEmpty();
        assertThat(fields.clearableText("b", 10)).isEmpty();
        assertThat(fields.clearableText("c", 10)).contains("x");
    }

    @Test
    void requiredTextCannotBeNullOrOutOfRange() throws Exception {
        PartialUpdateFields fields = PartialUpdateFields.of(json("{\"name\": null, \"short\": \"a\", \"number\": 5}"));

        assertThatThrownBy(() -> fields.requiredText("name", 2, 10)).isInstanceOf(ProblemException.class);
        assertThatThrownBy(() -> fields.requiredText("short", 2, 10))
                .hasMessageContaining("length must be between 2 and 10");
        assertThatThrownBy(() -> fields.requiredText("number", 1, 10)).isInstanceOf(ProblemException.class);
    }

    @Test
    void unknownKeysAreRejectedButIgnoredKeysPass() throws Exception {
        PartialUpdateFields fields = PartialUpdateFields.of(json("{\"name\": \"x\", \"id\": \"1\"}"));

        fields.rejectUnknown(Set.of("name"), Set.of("id"));
        assertThatThrownBy(() -> fields.rejectUnknown(Set.of("name"), Set.of()))
                .hasMessageContaining("Unknown field: id");
    }

    @Test
    void booleanFieldsMustBeBooleans() throws Exception {
        PartialUpdateFields fields = PartialUpdateFields.of(json("{\"active\": false, \"flag\": \"yes\"}"));

        assertThat(fields.optionalBoolean("active")).contains(false);
        assertThat(fields.optionalBoolean("missing")).isEmpty();
        assertThatThrownBy(() -> fields.optionalBoolean("flag")).isInstanceOf(ProblemException.class);
    }

    @Test
    void bodyMustBeAnObject() {
        assertThatThrownBy(() -> PartialUpdateFields.of(json("\"text\"")))
                .hasMessageContaining("must be a JSON object");
        assertThatThrownBy(() -> PartialUpdateFields.of(null)).isInstanceOf(ProblemException.class);
    }

    private JsonNode json(String body) throws Exception {
        return objectMapper.readTree(body);
    }
}
