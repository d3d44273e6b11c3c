package com.monadarena.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Escrow and tournament constants. Bound once at startup; nothing mutates
 * them at runtime. Amounts are in the smallest settlement unit (9 decimals).
 */
@Getter
@Setter
@Validated
@Component
@ConfigurationProperties(prefix = "arena")
public class ArenaProperties {

    /**
     * Wallets allowed to declare match and bracket winners.
     */
    private List<String> resolvers = new ArrayList<>();

    /**
     * Wallet credited with the platform fee on every payout.
     */
    @NotBlank
    @Pattern(regexp = "^0x[0-9a-fA-F]{40}$", message = "arena.treasury-wallet must be a 0x-prefixed 40 hex digit address")
    private String treasuryWallet = "0x0000000000000000000000000000000000000000";

    @Valid
    private Match match = new Match();

    @Valid
    private Tournament tournament = new Tournament();

    @Getter
    @Setter
    public static class Match {
        @Min(1)
        private long minWager = 1_000_000L;

        @Min(1)
        private long maxWager = 100_000_000_000L;

        @Min(1)
        private long commitTimeoutSeconds = 300L;

        @Min(1)
        private long revealTimeoutSeconds = 300L;

        @Min(0)
        @Max(10_000)
        private int platformFeeBasisPoints = 250;

        @AssertTrue(message = "arena.match.min-wager must not exceed arena.match.max-wager")
        public boolean isWagerRangeValid() {
            return minWager <= maxWager;
        }
    }

    @Getter
    @Setter
    public static class Tournament {
        @NotEmpty
        private List<Integer> allowedCapacities = new ArrayList<>(List.of(2, 4, 8, 16));

        @AssertTrue(message = "arena.tournament.allowed-capacities must be powers of two between 2 and 16")
        public boolean isAllowedCapacitiesValid() {
            if (allowedCapacities == null) {
                return true;
            }
            return allowedCapacities.stream()
                    .allMatch(capacity -> capacity != null
                            && capacity >= 2
                            && capacity <= 16
                            && Integer.bitCount(capacity) == 1);
        }
    }
}
