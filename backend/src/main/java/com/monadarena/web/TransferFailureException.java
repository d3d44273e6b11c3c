package com.monadarena.web;

import lombok.Getter;

/**
 * A payout or refund could not be delivered. Fatal to the enclosing operation:
 * the transaction rolls back and an operator has to intervene. Never retried
 * automatically since the receiving side may have partially applied it.
 */
@Getter
public class TransferFailureException extends RuntimeException {

    private final String walletAddress;
    private final long amount;

    public TransferFailureException(String walletAddress, long amount, String message) {
        super(message);
        this.walletAddress = walletAddress;
        this.amount = amount;
    }
}
