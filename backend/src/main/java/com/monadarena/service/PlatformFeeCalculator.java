package com.monadarena.service;

import com.monadarena.config.ArenaProperties;
import org.springframework.stereotype.Component;

/**
 * platformFee(x) = floor(x * platformFeeBasisPoints / 10000).
 */
@Component
public class PlatformFeeCalculator {

    private static final long BASIS_POINTS_DENOMINATOR = 10_000L;

    private final ArenaProperties arenaProperties;

    public PlatformFeeCalculator(ArenaProperties arenaProperties) {
        this.arenaProperties = arenaProperties;
    }

    public long feeFor(long pot) {
        if (pot < 0) {
            throw new IllegalArgumentException("pot must be non-negative");
        }
        long basisPoints = arenaProperties.getMatch().getPlatformFeeBasisPoints();
        return Math.multiplyExact(pot, basisPoints) / BASIS_POINTS_DENOMINATOR;
    }

    public long payoutFor(long pot) {
        return pot - feeFor(pot);
    }
}
