/**
 * Domain model package.
 *
 * <p>Identifiers ({@link com.ryuqq.bay.core.model.SandboxId},
 * {@link com.ryuqq.bay.core.model.SessionId}, {@link com.ryuqq.bay.core.model.WorkspaceId})
 * and immutable records for the four persisted entities: Sandbox, Session, Workspace and
 * IdempotencyRecord.</p>
 *
 * @since 1.0.0
 * @author Bay Team
 */
package com.ryuqq.bay.core.model;
