package com.didvault.ledger;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class LedgerConfigTest {

    @Test
    void defaults_useClockSource() {
        LedgerConfig config = new LedgerConfig();

        assertThat(config.isEnabled()).isFalse();
        assertThat(config.getBlockInterval()).isEqualTo(Duration.ofMinutes(10));
        assertThat(config.getGenesis()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(config.ledgerHeightSource()).isInstanceOf(ClockLedgerHeightSource.class);
    }

    @Test
    void enabled_usesNodeSource() throws Exception {
        LedgerConfig config = new LedgerConfig();
        config.setEnabled(true);
        config.setNodeUrl("http://localhost:18545");

        LedgerHeightSource source = config.ledgerHeightSource();

        assertThat(source).isInstanceOf(Web3jLedgerHeightSource.class);
        ((Web3jLedgerHeightSource) source).close();
    }
}
