/**
 * Batch-scoped logging context on top of Log4j2's ThreadContext.
 *
 * <p>ThreadContext keys:
 * <ul>
 *   <li>{@code batchId} - correlation id of the report batch (UUID unless supplied)</li>
 *   <li>{@code strategy} - attribute conflict strategy of the batch</li>
 *   <li>{@code pole} - pole number while that pole is being built</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-10-18 09:12:04.211 [main] [batchId] [pole] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.makeready.config.logging.BatchLoggingContext
 */
package com.phillippitts.makeready.config.logging;
