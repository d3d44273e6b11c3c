package com.monadarena.service;

import com.monadarena.model.GameType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MoveOutcomeResolverRegistryTest {

    private final LexicographicMoveOutcomeResolver lexicographic = new LexicographicMoveOutcomeResolver();
    private final AuctionBidMoveOutcomeResolver auction = new AuctionBidMoveOutcomeResolver();

    @Test
    void resolverFor_usesDedicatedResolverAndFallsBackOtherwise() {
        MoveOutcomeResolverRegistry registry = new MoveOutcomeResolverRegistry(List.of(lexicographic, auction));

        assertSame(auction, registry.resolverFor(GameType.AUCTION));
        assertSame(lexicographic, registry.resolverFor(GameType.POKER));
        assertSame(lexicographic, registry.resolverFor(GameType.RPG_BATTLE));
    }

    @Test
    void constructor_rejectsTwoResolversForOneGameType() {
        assertThrows(IllegalStateException.class, () ->
                new MoveOutcomeResolverRegistry(List.of(auction, new AuctionBidMoveOutcomeResolver())));
    }

    @Test
    void lexicographic_comparesUnsignedBytesAndFavorsCreatorOnTie() {
        assertEquals(MoveOutcome.OPPONENT, lexicographic.decide(new byte[]{0x7f}, new byte[]{(byte) 0x80}));
        assertEquals(MoveOutcome.CREATOR, lexicographic.decide(new byte[]{0x02}, new byte[]{0x01, 0x00}));
        assertEquals(MoveOutcome.OPPONENT, lexicographic.decide(new byte[]{0x01}, new byte[]{0x01, 0x00}));
        assertEquals(MoveOutcome.CREATOR, lexicographic.decide(new byte[]{0x05}, new byte[]{0x05}));
    }

    @Test
    void auction_higherBidWinsRegardlessOfLength() {
        assertEquals(MoveOutcome.OPPONENT, auction.decide(new byte[]{(byte) 0xff}, new byte[]{0x01, 0x00}));
        assertEquals(MoveOutcome.CREATOR, auction.decide(new byte[]{0x00, 0x10}, new byte[]{0x10}));
    }
}
