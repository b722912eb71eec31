package com.opsagent.tracker.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of the work item filter endpoint. Only name and status are filtered server-side.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkItemFilter {
    private List<String> workItemTypeKeys;
    @Builder.Default
    private int pageNum = 1;
    @Builder.Default
    private int pageSize = 50;
    private String workItemName;
    private List<String> workItemStatus;
    private List<String> fields;
}
