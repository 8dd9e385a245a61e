package com.ryuqq.bay.application.sandbox;

import java.util.List;

/**
 * Sandbox 목록 페이지.
 *
 * @param items 현재 페이지
 * @param nextCursor 다음 페이지 커서 (null = 마지막 페이지)
 * @author Bay Team
 * @since 1.0.0
 */
public record SandboxPage(List<SandboxView> items, String nextCursor) {

    public SandboxPage {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean hasMore() {
        return nextCursor != null;
    }
}
