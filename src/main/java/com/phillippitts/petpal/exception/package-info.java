/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.petpal.exception.PetPalException} - Base exception</li>
 *   <li>{@link com.phillippitts.petpal.exception.BusyException} - another command is executing (409)</li>
 *   <li>{@link com.phillippitts.petpal.exception.InvalidCommandException} - unknown prompt or
 *       out-of-bounds parameter (400)</li>
 *   <li>{@link com.phillippitts.petpal.exception.CommandNotFoundException} - unknown or evicted
 *       request id (404)</li>
 *   <li>{@link com.phillippitts.petpal.exception.AdapterFailureException} - capability call raised</li>
 *   <li>{@link com.phillippitts.petpal.exception.CapabilityTimeoutException} - capability call
 *       exceeded its bound</li>
 * </ul>
 *
 * <p>Only malformed requests and not-found lookups fail synchronously. Failures of an accepted
 * command are recorded on its record and delivered as status transitions, never thrown to the
 * HTTP caller.
 *
 * @see com.phillippitts.petpal.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.petpal.exception;
