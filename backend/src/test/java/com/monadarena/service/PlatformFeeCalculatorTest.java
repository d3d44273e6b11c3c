package com.monadarena.service;

import com.monadarena.config.ArenaProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PlatformFeeCalculatorTest {

    @Test
    void feeFor_floorsBasisPointShare() {
        PlatformFeeCalculator calculator = calculatorWithBasisPoints(250);

        assertEquals(500_000L, calculator.feeFor(20_000_000L));
        assertEquals(0L, calculator.feeFor(39L));
        assertEquals(1L, calculator.feeFor(40L));
        assertEquals(19_500_000L, calculator.payoutFor(20_000_000L));
    }

    @Test
    void feeFor_payoutPlusFeeAlwaysEqualsPot() {
        PlatformFeeCalculator calculator = calculatorWithBasisPoints(333);

        for (long pot : new long[]{1L, 2_000_001L, 123_456_789L, 200_000_000_000L}) {
            assertEquals(pot, calculator.feeFor(pot) + calculator.payoutFor(pot));
        }
    }

    @Test
    void feeFor_zeroBasisPointsKeepsWholePot() {
        PlatformFeeCalculator calculator = calculatorWithBasisPoints(0);

        assertEquals(0L, calculator.feeFor(5_000L));
        assertEquals(5_000L, calculator.payoutFor(5_000L));
    }

    private static PlatformFeeCalculator calculatorWithBasisPoints(int basisPoints) {
        ArenaProperties properties = new ArenaProperties();
        properties.getMatch().setPlatformFeeBasisPoints(basisPoints);
        return new PlatformFeeCalculator(properties);
    }
}
