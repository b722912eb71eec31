package com.opsagent.tracker.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Work item listing filters. All of them are optional; with none set every item is listed.
 * {@code relatedTo} is a work item id or name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskQuery {
    private String nameKeyword;
    private List<String> status;
    private List<String> priority;
    private String owner;
    private String relatedTo;
    @Builder.Default
    private int pageNum = 1;
    @Builder.Default
    private int pageSize = 50;

    public boolean hasOnlyRelation() {
        return relatedTo != null && !relatedTo.isBlank()
                && (nameKeyword == null || nameKeyword.isBlank())
                && (status == null || status.isEmpty())
                && (priority == null || priority.isEmpty())
                && (owner == null || owner.isBlank());
    }
}
