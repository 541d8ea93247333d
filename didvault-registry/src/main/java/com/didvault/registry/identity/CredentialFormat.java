package com.didvault.registry.identity;

import com.didvault.registry.RegistryLimits;

/**
 * Credentials are opaque statements; only their length is checked.
 */
public final class CredentialFormat {

    private CredentialFormat() {
    }

    public static boolean isValid(String credential) {
        return credential != null
                && !credential.isEmpty()
                && credential.length() <= RegistryLimits.MAX_CREDENTIAL_LENGTH;
    }
}
