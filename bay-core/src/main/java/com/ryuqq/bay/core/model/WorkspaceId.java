package com.ryuqq.bay.core.model;

import java.util.UUID;

/**
 * Workspace(영속 스토리지 단위) 식별자.
 *
 * @author Bay Team
 * @since 1.0.0
 */
public final class WorkspaceId {

    private static final String PREFIX = "ws-";

    private final String value;

    private WorkspaceId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("WorkspaceId cannot be null or blank");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("WorkspaceId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    public static WorkspaceId of(String value) {
        return new WorkspaceId(value);
    }

    public static WorkspaceId generate() {
        return new WorkspaceId(PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 12));
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkspaceId that = (WorkspaceId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
