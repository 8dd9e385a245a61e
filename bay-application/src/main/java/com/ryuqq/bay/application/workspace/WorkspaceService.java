package com.ryuqq.bay.application.workspace;

import com.ryuqq.bay.core.model.Workspace;
import com.ryuqq.bay.core.model.WorkspaceId;

import java.util.List;

/**
 * external Workspace 관리.
 *
 * <p>managed Workspace는 Sandbox와 함께 생성/삭제되므로 여기서 직접 삭제할 수 없습니다.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public interface WorkspaceService {

    /**
     * external Workspace 생성 (볼륨 포함).
     *
     * @param owner 소유자
     * @param sizeLimitMb 크기 제한 (null = 기본값)
     * @return 생성된 Workspace
     */
    Workspace create(String owner, Integer sizeLimitMb);

    /**
     * @throws com.ryuqq.bay.core.error.NotFoundException 없거나 다른 소유자의 것인 경우
     */
    Workspace get(String owner, WorkspaceId workspaceId);

    List<Workspace> list(String owner);

    /**
     * external Workspace 삭제 (볼륨 먼저, 기록 나중).
     *
     * @throws com.ryuqq.bay.core.error.ConflictException managed이거나 살아있는 Sandbox가 참조 중인 경우
     */
    void delete(String owner, WorkspaceId workspaceId);
}
