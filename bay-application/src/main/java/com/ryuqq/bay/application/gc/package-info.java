/**
 * Garbage collection task contract.
 *
 * <p>Each task reconciles one resource domain (sandbox records, sessions, workspaces,
 * compute instances, idempotency records) and reports a {@link com.ryuqq.bay.application.gc.GcResult}.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
package com.ryuqq.bay.application.gc;
