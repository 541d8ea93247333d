package com.didvault.registry;

/**
 * What revoking an identity does to the pending transfer and transfer history
 * stored under the same owner.
 */
public enum OrphanedStatePolicy {
    /** Leave them in place; a later registration by the owner inherits them. */
    PRESERVE,
    /** Delete them together with the identity record. */
    CASCADE
}
