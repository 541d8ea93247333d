package com.didvault.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Height derived from wall-clock time: the number of whole block intervals
 * elapsed since genesis.
 *
 * A clock stepping backwards never lowers the reported height; the height
 * is held, with one warning, until the clock catches up.
 */
public class ClockLedgerHeightSource implements LedgerHeightSource {

    private static final Logger log = LoggerFactory.getLogger(ClockLedgerHeightSource.class);

    private final Clock clock;
    private final Instant genesis;
    private final long intervalMillis;
    private final AtomicLong lastHeight = new AtomicLong();
    private final AtomicBoolean holding = new AtomicBoolean();

    public ClockLedgerHeightSource(Clock clock, Instant genesis, Duration blockInterval) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.genesis = Objects.requireNonNull(genesis, "Genesis cannot be null");
        Objects.requireNonNull(blockInterval, "Block interval cannot be null");
        if (blockInterval.isNegative() || blockInterval.isZero()) {
            throw new IllegalArgumentException("Block interval must be positive");
        }
        this.intervalMillis = blockInterval.toMillis();
        if (intervalMillis == 0) {
            throw new IllegalArgumentException("Block interval must be at least one millisecond");
        }
    }

    @Override
    public long currentHeight() {
        long elapsed = clock.millis() - genesis.toEpochMilli();
        long computed = elapsed <= 0 ? 0 : elapsed / intervalMillis;
        long height = lastHeight.accumulateAndGet(computed, Math::max);
        if (height > computed) {
            if (holding.compareAndSet(false, true)) {
                log.warn("Clock behind last reported height ({} < {}), holding height", computed, height);
            }
        } else if (holding.compareAndSet(true, false)) {
            log.info("Clock caught up with held height {}", height);
        }
        return height;
    }

    boolean isHolding() {
        return holding.get();
    }
}
