/**
 * Sandbox lifecycle state machine package.
 *
 * <p>Pure logic, no I/O. The composite sandbox status is derived from the sandbox
 * record and its current session by {@link com.ryuqq.bay.core.statemachine.StatusResolver};
 * {@link com.ryuqq.bay.core.statemachine.StatusTransition} guards every transition the
 * orchestrator performs.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.bay.core.statemachine.SandboxStatus} - derived sandbox status (enum)</li>
 *   <li>{@link com.ryuqq.bay.core.statemachine.SessionState} - stored session state (enum)</li>
 *   <li>{@link com.ryuqq.bay.core.statemachine.StatusTransition} - transition validation</li>
 *   <li>{@link com.ryuqq.bay.core.statemachine.StatusResolver} - status derivation</li>
 * </ul>
 *
 * <h2>Invariant</h2>
 * <pre>
 * EXPIRED → (IDLE | STARTING | READY | FAILED)   forbidden
 * DELETED → *                                    forbidden
 * </pre>
 *
 * @since 1.0.0
 * @author Bay Team
 */
package com.ryuqq.bay.core.statemachine;
