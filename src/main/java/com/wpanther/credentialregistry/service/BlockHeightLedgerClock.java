package com.wpanther.credentialregistry.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Derives the ledger height from elapsed blocks of fixed length since a genesis instant.
 * A wall clock stepping backwards never lowers the height already handed out.
 */
@Component
@Slf4j
public class BlockHeightLedgerClock implements LedgerClock {

    private final Clock clock;
    private final Instant genesis;
    private final Duration blockInterval;
    private final AtomicLong highestHeight = new AtomicLong();

    public BlockHeightLedgerClock(
            Clock clock,
            @Value("${app.ledger.genesis:2024-01-01T00:00:00Z}") String genesis,
            @Value("${app.ledger.block-interval:PT10M}") String blockInterval) {
        this.clock = clock;
        this.genesis = Instant.parse(genesis);
        this.blockInterval = Duration.parse(blockInterval);
        if (this.blockInterval.isZero() || this.blockInterval.isNegative()) {
            throw new IllegalArgumentException("Block interval must be positive: " + blockInterval);
        }
        log.info("Ledger clock started: genesis={}, blockInterval={}", this.genesis, this.blockInterval);
    }

    @Override
    public long currentHeight() {
        Duration elapsed = Duration.between(genesis, clock.instant());
        long observed = elapsed.isNegative() ? 0L : elapsed.toMillis() / blockInterval.toMillis();
        return highestHeight.accumulateAndGet(observed, Math::max);
    }
}
