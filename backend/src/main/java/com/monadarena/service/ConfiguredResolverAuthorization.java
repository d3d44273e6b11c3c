package com.monadarena.service;

import com.monadarena.config.ArenaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolver set taken from {@code arena.resolvers} at startup.
 */
@Component
public class ConfiguredResolverAuthorization implements ResolverAuthorization {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredResolverAuthorization.class);

    private final Set<String> resolvers;

    public ConfiguredResolverAuthorization(ArenaProperties arenaProperties) {
        this.resolvers = arenaProperties.getResolvers().stream()
                .map(WalletAddresses::normalize)
                .collect(Collectors.toUnmodifiableSet());
        if (resolvers.isEmpty()) {
            log.warn("No resolvers configured; resolver-only operations will be rejected");
        }
    }

    @Override
    public boolean isResolver(String wallet) {
        if (wallet == null || wallet.isBlank()) {
            return false;
        }
        return resolvers.contains(wallet.trim().toLowerCase(Locale.ROOT));
    }
}
