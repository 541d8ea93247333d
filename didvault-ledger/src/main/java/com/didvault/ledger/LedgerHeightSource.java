package com.didvault.ledger;

/**
 * Source of the ledger's logical height.
 *
 * Heights never decrease between calls on the same source.
 */
@FunctionalInterface
public interface LedgerHeightSource {

    long currentHeight();
}
