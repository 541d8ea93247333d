package com.didvault.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.EthBlockNumber;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Height read from an EVM node's latest block number.
 *
 * No retries: a failed call surfaces as {@link LedgerUnavailableException}
 * and the caller decides whether to try again.
 */
public class Web3jLedgerHeightSource implements LedgerHeightSource, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Web3jLedgerHeightSource.class);

    private final Web3j web3j;
    private final AtomicLong lastHeight = new AtomicLong();

    public Web3jLedgerHeightSource(Web3j web3j) {
        this.web3j = Objects.requireNonNull(web3j, "Web3j cannot be null");
    }

    @Override
    public long currentHeight() {
        EthBlockNumber response;
        try {
            response = web3j.ethBlockNumber().send();
        } catch (IOException e) {
            log.warn("Failed to read block number from node", e);
            throw new LedgerUnavailableException("Ledger node unreachable", e);
        }
        if (response == null || response.hasError()) {
            String detail = response == null ? "empty response" : response.getError().getMessage();
            log.warn("Node rejected eth_blockNumber: {}", detail);
            throw new LedgerUnavailableException("Ledger node returned an error: " + detail);
        }

        BigInteger blockNumber = response.getBlockNumber();
        if (blockNumber.signum() < 0 || blockNumber.bitLength() > 63) {
            throw new LedgerUnavailableException("Block number out of range: " + blockNumber);
        }
        return lastHeight.accumulateAndGet(blockNumber.longValue(), Math::max);
    }

    @Override
    public void close() {
        web3j.shutdown();
    }
}
