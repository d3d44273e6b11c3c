package com.monadarena.service;

import com.monadarena.web.ArenaOperationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Participant identities are 0x-prefixed 20-byte addresses, stored lower case.
 */
public final class WalletAddresses {

    private static final Pattern WALLET = Pattern.compile("^0x[0-9a-f]{40}$");

    private WalletAddresses() {
    }

    public static String normalize(String wallet) {
        if (wallet == null || wallet.isBlank()) {
            throw ArenaOperationException.invalidWallet("Wallet is required");
        }
        String normalized = wallet.trim().toLowerCase(Locale.ROOT);
        if (!WALLET.matcher(normalized).matches()) {
            throw ArenaOperationException.invalidWallet("Wallet must be 0x followed by 40 hex characters: " + wallet);
        }
        return normalized;
    }
}
