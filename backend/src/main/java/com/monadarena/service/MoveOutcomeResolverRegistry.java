package com.monadarena.service;

import com.monadarena.model.GameType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class MoveOutcomeResolverRegistry {

    private final Map<GameType, MoveOutcomeResolver> resolversByGameType = new EnumMap<>(GameType.class);
    private final MoveOutcomeResolver fallbackResolver;

    public MoveOutcomeResolverRegistry(List<MoveOutcomeResolver> resolvers) {
        MoveOutcomeResolver fallback = null;
        for (MoveOutcomeResolver resolver : resolvers) {
            if (resolver.gameTypes().isEmpty()) {
                if (fallback != null) {
                    throw new IllegalStateException("More than one fallback move outcome resolver registered");
                }
                fallback = resolver;
                continue;
            }
            for (GameType gameType : resolver.gameTypes()) {
                MoveOutcomeResolver previous = resolversByGameType.putIfAbsent(gameType, resolver);
                if (previous != null) {
                    throw new IllegalStateException("Duplicate move outcome resolver for game type " + gameType);
                }
            }
        }
        this.fallbackResolver = fallback != null ? fallback : new LexicographicMoveOutcomeResolver();
    }

    public MoveOutcomeResolver resolverFor(GameType gameType) {
        return resolversByGameType.getOrDefault(gameType, fallbackResolver);
    }
}
