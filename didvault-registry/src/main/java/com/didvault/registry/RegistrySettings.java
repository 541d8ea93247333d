package com.didvault.registry;

import java.util.Objects;

/**
 * Tunable registry behaviour. Capacities and the transfer window are fixed in
 * {@link RegistryLimits} and are not part of the settings.
 */
public record RegistrySettings(OrphanedStatePolicy orphanedStatePolicy) {

    public RegistrySettings {
        Objects.requireNonNull(orphanedStatePolicy, "Orphaned state policy cannot be null");
    }

    public static RegistrySettings defaults() {
        return new RegistrySettings(OrphanedStatePolicy.PRESERVE);
    }
}
