package com.monadarena.service;

import com.monadarena.config.ArenaProperties;
import com.monadarena.web.ArenaOperationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfiguredResolverAuthorizationTest {

    private static final String RESOLVER = "0x" + "e".repeat(40);

    @Test
    void isResolver_matchesConfiguredWalletsCaseInsensitively() {
        ArenaProperties properties = new ArenaProperties();
        properties.setResolvers(List.of("0x" + "E".repeat(40)));
        ConfiguredResolverAuthorization authorization = new ConfiguredResolverAuthorization(properties);

        assertTrue(authorization.isResolver(RESOLVER));
        assertTrue(authorization.isResolver("0x" + "E".repeat(40)));
        assertFalse(authorization.isResolver("0x" + "a".repeat(40)));
        assertFalse(authorization.isResolver(null));
    }

    @Test
    void requireResolver_rejectsEveryoneWhenNoneConfigured() {
        ConfiguredResolverAuthorization authorization = new ConfiguredResolverAuthorization(new ArenaProperties());

        ArenaOperationException ex = assertThrows(ArenaOperationException.class, () ->
                authorization.requireResolver(RESOLVER));

        assertEquals("not_resolver", ex.getCode());
    }
}
