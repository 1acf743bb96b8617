/**
 * Simulated capability adapters used when no hardware is attached.
 *
 * <p>Registered as fallbacks: a bean of the same adapter interface supplied elsewhere replaces
 * the simulated one.
 */
package com.phillippitts.petpal.service.capability.mock;
