package com.opsagent.tracker.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.opsagent.tracker.dto.TaskPage;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WorkItemPayloadsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void normalizesBareListsAndPaginatedObjects() {
        ArrayNode bare = objectMapper.createArrayNode();
        bare.addObject().put("id", 1);
        TaskPage fromList = WorkItemPayloads.normalize(bare, 1, 50);
        assertThat(fromList.total()).isEqualTo(1);

        ObjectNode paged = objectMapper.createObjectNode();
        paged.set("work_items", bare);
        paged.putObject("pagination").put("total", 120).put("page_num", 3).put("page_size", 20);
        TaskPage fromObject = WorkItemPayloads.normalize(paged, 1, 50);
        assertThat(fromObject.total()).isEqualTo(120);
        assertThat(fromObject.pageNum()).isEqualTo(3);
        assertThat(fromObject.pageSize()).isEqualTo(20);
    }

    @Test
    void fieldValuesPreferLabelsAndNames() {
        ObjectNode item = objectMapper.createObjectNode();
        ArrayNode fields = item.putArray("fields");
        fields.addObject().put("field_key", "priority").putObject("field_value").put("label", "P1").put("value", "opt_p1");
        ObjectNode owners = fields.addObject().put("field_key", "watchers");
        owners.putArray("field_value").addObject().put("name", "张三");
        item.putArray("field_value_pairs").addObject().put("field_key", "owner").put("field_value", "7301");

        assertThat(WorkItemPayloads.extractFieldValue(item, "priority")).contains("P1");
        assertThat(WorkItemPayloads.extractFieldValue(item, "watchers")).contains("张三");
        assertThat(WorkItemPayloads.extractFieldValue(item, "owner")).contains("7301");
        assertThat(WorkItemPayloads.extractFieldValue(item, "status")).isEmpty();
    }

    @Test
    void relationMatchesScalarsAndLists() {
        ObjectNode item = objectMapper.createObjectNode();
        ArrayNode fields = item.putArray("fields");
        fields.addObject().put("field_key", "parent").put("field_value", 777);
        fields.addObject().put("field_key", "links").putArray("field_value").add("888");

        assertThat(WorkItemPayloads.isRelatedTo(item, 777L)).isTrue();
        assertThat(WorkItemPayloads.isRelatedTo(item, 888L)).isTrue();
        assertThat(WorkItemPayloads.isRelatedTo(item, 999L)).isFalse();
    }

    @Test
    void createdIdComesInSeveralShapes() {
        assertThat(WorkItemPayloads.extractCreatedId(objectMapper.getNodeFactory().numberNode(5L))).contains(5L);
        assertThat(WorkItemPayloads.extractCreatedId(objectMapper.createObjectNode().put("id", "6"))).contains(6L);
        ArrayNode list = objectMapper.createArrayNode();
        list.addObject().put("id", 7);
        assertThat(WorkItemPayloads.extractCreatedId(list)).contains(7L);
        assertThat(WorkItemPayloads.extractCreatedId(objectMapper.createObjectNode())).isEmpty();
        assertThat(WorkItemPayloads.extractCreatedId(null)).isEmpty();
    }

    @Test
    void idsPastTheLongRangeAreNotIds() {
        assertThat(WorkItemPayloads.parseId("9223372036854775807")).contains(Long.MAX_VALUE);
        assertThat(WorkItemPayloads.parseId("9223372036854775808")).isEmpty();
        assertThat(WorkItemPayloads.parseId("12a")).isEmpty();
        assertThat(WorkItemPayloads.extractCreatedId(objectMapper.createObjectNode().put("id", "123456789012345678901"))).isEmpty();
        assertThat(WorkItemPayloads.itemId(objectMapper.createObjectNode().put("id", "123456789012345678901"))).isEmpty();
    }
}
