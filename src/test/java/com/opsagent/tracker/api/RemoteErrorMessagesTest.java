package com.opsagent.tracker.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RemoteErrorMessagesTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void combinesOuterAndInnerMessages() {
        ObjectNode body = objectMapper.createObjectNode().put("err_msg", "Invalid param");
        body.putObject("err").put("msg", "field priority is illegal");

        assertThat(RemoteErrorMessages.describe(body)).isEqualTo("Invalid param: field priority is illegal");
    }

    @Test
    void identicalMessagesAppearOnce() {
        ObjectNode body = objectMapper.createObjectNode().put("msg", "denied");
        body.putObject("err").put("err_msg", "denied");

        assertThat(RemoteErrorMessages.describe(body)).isEqualTo("denied");
    }

    @Test
    void emptyEnvelopeIsUnknown() {
        assertThat(RemoteErrorMessages.describe(objectMapper.createObjectNode())).isEqualTo("unknown error");
        assertThat(RemoteErrorMessages.describe(null)).isEqualTo("unknown error");
    }

    @Test
    void updateMessagesDropTheUrlAndFlagLockedFields() {
        assertThat(RemoteErrorMessages.forUpdate("field_value is illegal for url https://tracker/open_api/x"))
                .isEqualTo("field_value is illegal" + RemoteErrorMessages.LOCKED_FIELD_HINT);
        assertThat(RemoteErrorMessages.forUpdate("no permission")).isEqualTo("no permission");
    }

    @Test
    void detectsRateLimiting() {
        assertThat(RemoteErrorMessages.looksRateLimited("HTTP 429 Too Many Requests")).isTrue();
        assertThat(RemoteErrorMessages.looksRateLimited("Rate limit exceeded")).isTrue();
        assertThat(RemoteErrorMessages.looksRateLimited("HTTP 500")).isFalse();
        assertThat(RemoteErrorMessages.looksRateLimited(null)).isFalse();
    }
}
