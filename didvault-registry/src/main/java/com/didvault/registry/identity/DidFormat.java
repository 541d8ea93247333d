package com.didvault.registry.identity;

import com.didvault.registry.RegistryLimits;

/**
 * Syntactic rules for DIDs accepted by the registry: the method prefix, a
 * non-empty method-specific part and a maximum length. No resolution or
 * cryptographic check is made.
 */
public final class DidFormat {

    private DidFormat() {
    }

    public static boolean isValid(String did) {
        if (did == null) {
            return false;
        }
        int length = did.length();
        return length >= RegistryLimits.MIN_DID_LENGTH
                && length <= RegistryLimits.MAX_DID_LENGTH
                && did.startsWith(RegistryLimits.DID_PREFIX);
    }
}
