package com.opsagent.tracker.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.opsagent.tracker.api.TrackerApiException;
import com.opsagent.tracker.api.WorkItemApi;
import com.opsagent.tracker.config.ScanSettings;
import com.opsagent.tracker.dto.WorkItemFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrossTypeLookupServiceTest {

    @Mock
    private WorkItemApi workItemApi;

    @Mock
    private MetadataCacheManager metadata;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ManualTicker ticker;
    private CrossTypeLookupService lookup;

    @BeforeEach
    void setUp() {
        ticker = new ManualTicker();
        Map<String, String> types = new LinkedHashMap<>();
        types.put("问题管理", "issue");
        for (int i = 1; i <= 7; i++) {
            types.put("类型" + i, "type_" + i);
        }
        lenient().when(metadata.listTypes("ws_a")).thenReturn(types);
        TaskExecutor sameThread = Runnable::run;
        lookup = new CrossTypeLookupService(workItemApi, metadata, sameThread, ScanSettings.defaults(), ticker);
    }

    private ObjectNode item(long id, String name) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", id);
        node.put("name", name);
        return node;
    }

    @Test
    void returnsTheItemFromThePreferredTypeWithoutFanOut() {
        when(workItemApi.query("ws_a", "issue", List.of(5L))).thenReturn(List.of(item(5L, "Crash")));

        Optional<CrossTypeLookupService.LocatedItem> found = lookup.findItem("ws_a", "issue", 5L);

        assertThat(found).get().extracting(CrossTypeLookupService.LocatedItem::typeKey).isEqualTo("issue");
        verify(workItemApi, times(1)).query(anyString(), anyString(), anyCollection());
    }

    @Test
    void stopsSearchingOnceABatchFindsTheItem() {
        when(workItemApi.query(eq("ws_a"), anyString(), eq(List.of(9L)))).thenReturn(List.of());
        when(workItemApi.query("ws_a", "type_3", List.of(9L))).thenReturn(List.of(item(9L, "Epic work")));

        Optional<CrossTypeLookupService.LocatedItem> found = lookup.findItem("ws_a", "issue", 9L);

        assertThat(found).isPresent();
        assertThat(found.get().typeKey()).isEqualTo("type_3");
        assertThat(found.get().item().path("name").asText()).isEqualTo("Epic work");
        verify(workItemApi).query("ws_a", "type_5", List.of(9L));
        verify(workItemApi, never()).query("ws_a", "type_6", List.of(9L));
        verify(workItemApi, never()).query("ws_a", "type_7", List.of(9L));
    }

    @Test
    void failingTypesDoNotAbortTheSearch() {
        when(workItemApi.query(eq("ws_a"), anyString(), eq(List.of(9L)))).thenReturn(List.of());
        when(workItemApi.query("ws_a", "type_1", List.of(9L)))
                .thenThrow(new TrackerApiException("query work items", 200, 30005, "no permission"));
        when(workItemApi.query("ws_a", "type_7", List.of(9L))).thenReturn(List.of(item(9L, "Late")));

        assertThat(lookup.findItem("ws_a", "issue", 9L)).get()
                .extracting(CrossTypeLookupService.LocatedItem::typeKey).isEqualTo("type_7");
    }

    @Test
    void missingEverywhereIsEmpty() {
        when(workItemApi.query(eq("ws_a"), anyString(), anyCollection())).thenReturn(List.of());

        assertThat(lookup.findItem("ws_a", "issue", 1L)).isEmpty();
        verify(workItemApi, times(8)).query(eq("ws_a"), anyString(), anyCollection());
    }

    @Test
    void remembersNamesAndMisses() {
        when(workItemApi.query(eq("ws_a"), anyString(), anyCollection())).thenReturn(List.of());
        when(workItemApi.query("ws_a", "issue", List.of(10L, 11L))).thenReturn(List.of(item(10L, "Parent")));

        Map<Long, String> first = lookup.resolveItemNames("ws_a", "issue", List.of(10L, 11L));
        Map<Long, String> second = lookup.resolveItemNames("ws_a", "issue", List.of(10L, 11L));

        assertThat(first).containsOnly(Map.entry(10L, "Parent"));
        assertThat(second).isEqualTo(first);
        // one default-type query plus seven other types, all from the first call
        verify(workItemApi, times(8)).query(eq("ws_a"), anyString(), anyCollection());

        ticker.advance(Duration.ofMinutes(6));
        lookup.resolveItemNames("ws_a", "issue", List.of(11L));
        verify(workItemApi, times(16)).query(eq("ws_a"), anyString(), anyCollection());
    }

    @Test
    void relatedToAcceptsIdsDirectly() {
        assertThat(lookup.resolveRelatedTo("ws_a", "6181818812")).isEqualTo(6181818812L);
        assertThat(lookup.resolveRelatedTo("ws_a", 42L)).isEqualTo(42L);
        verify(workItemApi, never()).filter(anyString(), any());
    }

    @Test
    void relatedToPrefersAnExactNameMatch() {
        ObjectNode data = objectMapper.createObjectNode();
        data.putArray("work_items").add(item(1L, "SG06VA rollout")).add(item(2L, "SG06VA"));
        when(workItemApi.filter(eq("ws_a"), any(WorkItemFilter.class))).thenReturn(data);

        assertThat(lookup.resolveRelatedTo("ws_a", "SG06VA")).isEqualTo(2L);

        ArgumentCaptor<WorkItemFilter> filter = ArgumentCaptor.forClass(WorkItemFilter.class);
        verify(workItemApi).filter(eq("ws_a"), filter.capture());
        assertThat(filter.getValue().getWorkItemName()).isEqualTo("SG06VA");
        assertThat(filter.getValue().getWorkItemTypeKeys()).hasSize(8);
    }

    @Test
    void relatedToFallsBackToTheFirstPartialMatch() {
        JsonNode data = objectMapper.createArrayNode().add(item(3L, "SG06VA rollout")).add(item(4L, "SG06VA retro"));
        when(workItemApi.filter(eq("ws_a"), any(WorkItemFilter.class))).thenReturn(data);

        assertThat(lookup.resolveRelatedTo("ws_a", "SG06VA")).isEqualTo(3L);
    }

    @Test
    void relatedToWithoutMatchesIsNotFound() {
        when(workItemApi.filter(eq("ws_a"), any(WorkItemFilter.class))).thenReturn(objectMapper.createArrayNode());

        assertThatThrownBy(() -> lookup.resolveRelatedTo("ws_a", "nothing like it"))
                .isInstanceOfSatisfying(MetadataNotFoundException.class,
                        e -> assertThat(e.getKind()).isEqualTo(MetadataNotFoundException.Kind.WORK_ITEM));
    }

    @Test
    void oversizedNumericRelatedToIsSearchedAsAName() {
        ObjectNode oversized = objectMapper.createObjectNode().put("id", "98765432109876543210").put("name", "legacy");
        when(workItemApi.filter(eq("ws_a"), any(WorkItemFilter.class)))
                .thenReturn(objectMapper.createArrayNode().add(oversized));

        assertThatThrownBy(() -> lookup.resolveRelatedTo("ws_a", "123456789012345678901"))
                .isInstanceOfSatisfying(MetadataNotFoundException.class,
                        e -> assertThat(e.getRequested()).isEqualTo("123456789012345678901"));

        ArgumentCaptor<WorkItemFilter> filter = ArgumentCaptor.forClass(WorkItemFilter.class);
        verify(workItemApi).filter(eq("ws_a"), filter.capture());
        assertThat(filter.getValue().getWorkItemName()).isEqualTo("123456789012345678901");
    }
}
