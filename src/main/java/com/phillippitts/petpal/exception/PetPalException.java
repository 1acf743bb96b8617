package com.phillippitts.petpal.exception;

/**
 * Base exception for all application-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class PetPalException extends RuntimeException {

    public PetPalException(String message) {
        super(message);
    }

    public PetPalException(String message, Throwable cause) {
        super(message, cause);
    }
}
