package com.opsagent.tracker.model;

public record Workspace(String name, String key) {
}
