/**
 * Presentation layer (REST and SSE controllers and exception handling).
 *
 * <p>Controllers are thin adapters over the service layer: they parse the request, delegate, and let
 * {@link com.phillippitts.petpal.presentation.exception.GlobalExceptionHandler} translate domain
 * exceptions to HTTP responses.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - command, status, push stream, direct action and detection endpoints</li>
 *   <li>{@code presentation.exception} - exception-to-HTTP mapping</li>
 * </ul>
 */
package com.phillippitts.petpal.presentation;
