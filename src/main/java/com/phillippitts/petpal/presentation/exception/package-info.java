/**
 * Global exception handling for HTTP responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.petpal.exception.InvalidCommandException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.petpal.exception.BusyException} → 409 Conflict (retry with backoff)</li>
 *   <li>{@link com.phillippitts.petpal.exception.CommandNotFoundException} → 404 Not Found</li>
 *   <li>{@link com.phillippitts.petpal.exception.CapabilityTimeoutException} → 504 Gateway Timeout</li>
 *   <li>{@link com.phillippitts.petpal.exception.AdapterFailureException} → 502 Bad Gateway</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "BusyException",
 *   "message": "Another command is executing",
 *   "details": "Active request: 3f0c...",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.petpal.presentation.exception;
