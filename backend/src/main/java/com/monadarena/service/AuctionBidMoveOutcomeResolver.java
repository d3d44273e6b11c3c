package com.monadarena.service;

import com.monadarena.model.GameType;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Set;

/**
 * Sealed-bid auction: each reveal is a big-endian unsigned bid and the higher bid wins.
 */
@Component
public class AuctionBidMoveOutcomeResolver implements MoveOutcomeResolver {

    @Override
    public Set<GameType> gameTypes() {
        return Set.of(GameType.AUCTION);
    }

    @Override
    public MoveOutcome decide(byte[] creatorMove, byte[] opponentMove) {
        BigInteger creatorBid = new BigInteger(1, creatorMove);
        BigInteger opponentBid = new BigInteger(1, opponentMove);
        return opponentBid.compareTo(creatorBid) > 0 ? MoveOutcome.OPPONENT : MoveOutcome.CREATOR;
    }
}
