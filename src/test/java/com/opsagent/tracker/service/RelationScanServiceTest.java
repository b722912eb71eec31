package com.opsagent.tracker.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.opsagent.tracker.api.TrackerApiException;
import com.opsagent.tracker.api.WorkItemApi;
import com.opsagent.tracker.config.ScanSettings;
import com.opsagent.tracker.dto.TaskPage;
import com.opsagent.tracker.dto.WorkItemFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;

import java.util.List;
import java.util.Set;
import java.util.function.IntFunction;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RelationScanServiceTest {

    private static final long RELATED_ID = 777L;

    @Mock
    private WorkItemApi workItemApi;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RelationScanService scanService;

    @BeforeEach
    void setUp() {
        TaskExecutor sameThread = Runnable::run;
        scanService = new RelationScanService(workItemApi, sameThread, ScanSettings.defaults());
    }

    private ArrayNode page(int pageNum, int size, Set<Integer> relatedPositions) {
        ArrayNode items = objectMapper.createArrayNode();
        for (int i = 0; i < size; i++) {
            ObjectNode item = items.addObject();
            item.put("id", pageNum * 1000L + i);
            item.put("name", "item " + pageNum + "-" + i);
            ObjectNode field = item.putArray("fields").addObject();
            field.put("field_key", "field_parent");
            if (relatedPositions.contains(i)) {
                field.put("field_value", RELATED_ID);
            } else {
                field.put("field_value", 1L);
            }
        }
        return items;
    }

    private void answerPages(IntFunction<JsonNode> pages) {
        when(workItemApi.filter(eq("ws_a"), any(WorkItemFilter.class))).thenAnswer(invocation -> {
            WorkItemFilter filter = invocation.getArgument(1);
            return pages.apply(filter.getPageNum());
        });
    }

    private List<Integer> requestedPages() {
        ArgumentCaptor<WorkItemFilter> filters = ArgumentCaptor.forClass(WorkItemFilter.class);
        verify(workItemApi, atLeastOnce()).filter(eq("ws_a"), filters.capture());
        return filters.getAllValues().stream().map(WorkItemFilter::getPageNum).collect(Collectors.toList());
    }

    @Test
    void stopsAfterTheBatchWithAShortPage() {
        answerPages(pageNum -> {
            if (pageNum < 4) {
                return page(pageNum, 50, Set.of(0));
            }
            if (pageNum == 4) {
                return page(pageNum, 10, Set.of(3));
            }
            return objectMapper.createArrayNode();
        });

        TaskPage result = scanService.scan("ws_a", "issue", RELATED_ID);

        assertThat(requestedPages()).containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(result.items()).hasSize(4);
        assertThat(result.total()).isEqualTo(4);
        assertThat(result.hint()).startsWith("Found 4 items related to 777 (scanned 160 items, max 500).");
    }

    @Test
    void firstShortPageEndsTheScanImmediately() {
        answerPages(pageNum -> pageNum == 1 ? page(1, 12, Set.of(1, 5)) : objectMapper.createArrayNode());

        TaskPage result = scanService.scan("ws_a", "issue", RELATED_ID);

        assertThat(requestedPages()).containsExactly(1, 2, 3);
        assertThat(result.items()).extracting(item -> item.path("id").asLong()).containsExactly(1001L, 1005L);
    }

    @Test
    void pageErrorStopsTheScanButKeepsWhatWasFound() {
        answerPages(pageNum -> {
            if (pageNum == 2) {
                throw new TrackerApiException("filter work items", 200, 50006, "internal error");
            }
            return page(pageNum, 50, Set.of(7));
        });

        TaskPage result = scanService.scan("ws_a", "issue", RELATED_ID);

        assertThat(requestedPages()).containsExactly(1, 2, 3);
        assertThat(result.items()).hasSize(2);
    }

    @Test
    void respectsThePageBudget() {
        answerPages(pageNum -> page(pageNum, 50, Set.of()));

        TaskPage result = scanService.scan("ws_a", "issue", RELATED_ID);

        verify(workItemApi, times(10)).filter(eq("ws_a"), any(WorkItemFilter.class));
        assertThat(result.items()).isEmpty();
        assertThat(result.hint()).contains("scanned 500 items");
    }
}
