package com.monadarena.service;

import com.monadarena.web.ArenaOperationException;

/**
 * Decides which identities may declare match and bracket winners and freeze payouts.
 */
public interface ResolverAuthorization {

    boolean isResolver(String wallet);

    default void requireResolver(String wallet) {
        if (!isResolver(wallet)) {
            throw ArenaOperationException.notResolver();
        }
    }
}
