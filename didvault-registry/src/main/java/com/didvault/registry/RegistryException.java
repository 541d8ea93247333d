package com.didvault.registry;

import java.util.Objects;

/**
 * Thrown when a registry operation is rejected. The operation has no effect.
 */
public class RegistryException extends RuntimeException {

    private final RegistryErrorCode errorCode;

    public RegistryException(RegistryErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "Error code cannot be null");
    }

    public RegistryException(RegistryErrorCode errorCode) {
        this(errorCode, errorCode.description());
    }

    public RegistryErrorCode getErrorCode() {
        return errorCode;
    }
}
