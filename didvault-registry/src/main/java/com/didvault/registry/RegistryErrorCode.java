package com.didvault.registry;

/**
 * Stable failure codes of the identity registry.
 *
 * Numeric codes are fixed and must not be renumbered; clients persist them.
 * {@link #ALREADY_DEACTIVATED} is returned both when deactivating an inactive
 * identity and when reactivating an active one.
 */
public enum RegistryErrorCode {
    UNAUTHORIZED(100, "Caller is not the designated recipient"),
    ALREADY_EXISTS(101, "Identity already exists"),
    NOT_FOUND(102, "Identity not found"),
    MAX_CREDENTIALS(103, "Credential limit reached"),
    ALREADY_DEACTIVATED(104, "Identity already in the requested state"),
    DEACTIVATED(105, "Identity is deactivated"),
    TRANSFER_IN_PROGRESS(106, "A transfer is already pending"),
    NO_PENDING_TRANSFER(107, "No pending transfer"),
    TRANSFER_EXPIRED(108, "Transfer window has expired"),
    SELF_TRANSFER(109, "Cannot transfer an identity to its owner"),
    HISTORY_FULL(110, "Transfer history is full"),
    INVALID_DID_FORMAT(111, "Invalid DID format"),
    INVALID_CREDENTIAL_FORMAT(112, "Invalid credential format");

    private final int numericCode;
    private final String description;

    RegistryErrorCode(int numericCode, String description) {
        this.numericCode = numericCode;
        this.description = description;
    }

    public int numericCode() {
        return numericCode;
    }

    public String description() {
        return description;
    }
}
