package com.didvault.registry;

/**
 * Fixed bounds of the identity registry.
 */
public final class RegistryLimits {

    public static final String DID_PREFIX = "did:stx:";
    public static final int MIN_DID_LENGTH = DID_PREFIX.length() + 1;
    public static final int MAX_DID_LENGTH = 100;

    public static final int MAX_CREDENTIAL_LENGTH = 200;
    public static final int MAX_CREDENTIALS = 10;

    public static final int MAX_REASON_LENGTH = 200;

    public static final int MAX_TRANSFER_HISTORY = 10;

    /** Height units a pending transfer stays acceptable after initiation. */
    public static final long TRANSFER_WINDOW = 144;

    private RegistryLimits() {
    }
}
