package com.opsagent.tracker.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.opsagent.tracker.client.RemoteClient;
import com.opsagent.tracker.client.RemoteResponse;
import com.opsagent.tracker.dto.WorkItemFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkItemApiTest {

    @Mock
    private RemoteClient remoteClient;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private WorkItemApi workItemApi;

    @BeforeEach
    void setUp() {
        workItemApi = new WorkItemApi(remoteClient, objectMapper);
    }

    private RemoteResponse ok(JsonNode data) {
        ObjectNode body = objectMapper.createObjectNode().put("err_code", 0);
        body.set("data", data);
        return new RemoteResponse(200, body);
    }

    @Test
    void createPostsNameTypeAndFields() {
        when(remoteClient.post(eq("/open_api/ws_a/work_item/create"), any(JsonNode.class)))
                .thenReturn(ok(objectMapper.getNodeFactory().numberNode(99L)));

        JsonNode data = workItemApi.create("ws_a", "bug", "Boot loop", null);

        assertThat(data.asLong()).isEqualTo(99L);
        ArgumentCaptor<JsonNode> body = ArgumentCaptor.forClass(JsonNode.class);
        verify(remoteClient).post(eq("/open_api/ws_a/work_item/create"), body.capture());
        assertThat(body.getValue().path("work_item_type_key").asText()).isEqualTo("bug");
        assertThat(body.getValue().path("name").asText()).isEqualTo("Boot loop");
        assertThat(body.getValue().path("field_value_pairs").isArray()).isTrue();
    }

    @Test
    void filterKeepsPaginationNextToTheItems() {
        ObjectNode envelope = objectMapper.createObjectNode().put("err_code", 0);
        envelope.putArray("data").addObject().put("id", 1);
        envelope.putObject("pagination").put("total", 40);
        when(remoteClient.post(eq("/open_api/ws_a/work_item/filter"), any(JsonNode.class)))
                .thenReturn(new RemoteResponse(200, envelope));

        JsonNode result = workItemApi.filter("ws_a", WorkItemFilter.builder()
                .workItemTypeKeys(List.of("bug"))
                .workItemName("boot")
                .build());

        assertThat(result.path("work_items").size()).isEqualTo(1);
        assertThat(result.path("pagination").path("total").asInt()).isEqualTo(40);
        ArgumentCaptor<JsonNode> body = ArgumentCaptor.forClass(JsonNode.class);
        verify(remoteClient).post(eq("/open_api/ws_a/work_item/filter"), body.capture());
        assertThat(body.getValue().path("work_item_name").asText()).isEqualTo("boot");
        assertThat(body.getValue().has("work_item_status")).isFalse();
    }

    @Test
    void embeddedErrorCodeBecomesAnApiException() {
        ObjectNode body = objectMapper.createObjectNode().put("err_code", 20006).put("err_msg", "field is illegal");
        when(remoteClient.put(eq("/open_api/ws_a/work_item/bug/5"), any(JsonNode.class)))
                .thenReturn(new RemoteResponse(200, body));

        assertThatThrownBy(() -> workItemApi.update("ws_a", "bug", 5L, objectMapper.createArrayNode()))
                .isInstanceOfSatisfying(TrackerApiException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(20006);
                    assertThat(e.getRemoteMessage()).isEqualTo("field is illegal");
                });
    }

    @Test
    void rateLimitedResponsesAreThrottled() {
        ObjectNode body = objectMapper.createObjectNode().put("err_code", 10429).put("err_msg", "busy");
        when(remoteClient.put(eq("/open_api/ws_a/work_item/bug/5"), any(JsonNode.class)))
                .thenReturn(new RemoteResponse(200, body));

        assertThatThrownBy(() -> workItemApi.update("ws_a", "bug", 5L, objectMapper.createArrayNode()))
                .isInstanceOfSatisfying(ThrottledException.class, e -> assertThat(e.getHttpStatus()).isEqualTo(200));
    }

    @Test
    void queryReturnsTheItemList() {
        JsonNode data = objectMapper.createArrayNode().add(objectMapper.createObjectNode().put("id", 3));
        when(remoteClient.post(eq("/open_api/ws_a/work_item/bug/query"), any(JsonNode.class))).thenReturn(ok(data));

        assertThat(workItemApi.query("ws_a", "bug", List.of(3L))).hasSize(1);
    }
}
