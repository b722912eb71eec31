package com.opsagent.tracker.service;

/**
 * A value cannot be written to a field: an invalid boolean literal, or a multi-select value that
 * matches no option.
 */
public class FieldValidationException extends RuntimeException {

    private final String fieldName;
    private final Object rejectedValue;

    public FieldValidationException(String fieldName, Object rejectedValue, String message) {
        super(message);
        this.fieldName = fieldName;
        this.rejectedValue = rejectedValue;
    }

    public String getFieldName() {
        return fieldName;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }
}
