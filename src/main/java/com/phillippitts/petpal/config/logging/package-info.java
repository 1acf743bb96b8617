/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - identifier of the HTTP request, set by
 *       {@link com.phillippitts.petpal.config.logging.MdcFilter}</li>
 *   <li>{@code commandId} - request identifier of the command being executed, set on executor
 *       threads</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2025-10-17 15:42:32.529 [command-1] [requestId] [commandId] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.petpal.config.logging.MdcFilter
 * @since 1.0
 */
package com.phillippitts.petpal.config.logging;
