package com.opsagent.tracker.service;

/**
 * Derives the short role key used by role-owner fields from an option value of the operator-role field.
 */
public interface RoleKeyExtractor {

    String OPERATOR_ROLE_FIELD_KEY = "current_status_operator_role";

    String extract(String optionValue);
}
