package com.opsagent.tracker.dto;

import com.opsagent.tracker.model.FieldValue;

public record ResolvedField(String fieldName, String fieldKey, FieldValue value) {
}
