package com.didvault.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Configuration for the ledger height source.
 *
 * With {@code enabled} the height is the block number of the node at
 * {@code nodeUrl}; otherwise it is derived from the system clock.
 */
@Configuration
@ConfigurationProperties(prefix = "didvault.ledger")
public class LedgerConfig {

    private static final Logger log = LoggerFactory.getLogger(LedgerConfig.class);

    private boolean enabled = false;
    private String nodeUrl = "http://localhost:8545";
    private Duration blockInterval = Duration.ofMinutes(10);
    private Instant genesis = Instant.parse("2024-01-01T00:00:00Z");

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getNodeUrl() { return nodeUrl; }
    public void setNodeUrl(String nodeUrl) { this.nodeUrl = nodeUrl; }
    public Duration getBlockInterval() { return blockInterval; }
    public void setBlockInterval(Duration blockInterval) { this.blockInterval = blockInterval; }
    public Instant getGenesis() { return genesis; }
    public void setGenesis(Instant genesis) { this.genesis = genesis; }

    @Bean
    public LedgerHeightSource ledgerHeightSource() {
        if (enabled) {
            log.info("Ledger height from node at {}", nodeUrl);
            return new Web3jLedgerHeightSource(Web3j.build(new HttpService(nodeUrl)));
        }
        log.info("Ledger height from system clock (genesis {}, block interval {})", genesis, blockInterval);
        return new ClockLedgerHeightSource(Clock.systemUTC(), genesis, blockInterval);
    }
}
