package com.opsagent.tracker.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field changes for one or more work items. Null means "leave unchanged".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssueUpdateRequest {
    private String name;
    private String priority;
    private String description;
    private String status;
    private String assignee;
    @Builder.Default
    private Map<String, Object> extraFields = new LinkedHashMap<>();

    public List<FieldEdit> toFieldEdits() {
        List<FieldEdit> edits = new ArrayList<>();
        if (name != null) {
            edits.add(FieldEdit.withKey("name", name, "name"));
        }
        if (description != null) {
            edits.add(FieldEdit.of("description", description));
        }
        if (priority != null) {
            edits.add(FieldEdit.of("priority", priority));
        }
        if (status != null) {
            edits.add(FieldEdit.of("status", status));
        }
        if (assignee != null) {
            edits.add(FieldEdit.withKey("assignee", assignee, "owner"));
        }
        if (extraFields != null) {
            extraFields.forEach((field, value) -> edits.add(FieldEdit.custom(field, value)));
        }
        return edits;
    }
}
