/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Unique identifier for each HTTP request (UUID format)</li>
 *   <li>{@code batchId} - One classification call, set by the orchestrator</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-03-02 15:42:32.529 [scoring-pool-1] [requestId] [batchId] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.factopinion.config.logging.MdcFilter
 * @since 1.0
 */
package com.phillippitts.factopinion.config.logging;
