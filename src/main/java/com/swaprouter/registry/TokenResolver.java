package com.swaprouter.registry;

import com.swaprouter.model.Pool;
import com.swaprouter.model.Token;

import java.util.Collection;
import java.util.Optional;

/**
 * Resolves token identifiers against the tokens referenced by a pool collection.
 */
public final class TokenResolver {

    private TokenResolver() {
    }

    /**
     * Scans {@code pools} in iteration order, checking side A then side B of each pool.
     * The first token whose id matches wins.
     *
     * @return the matching token, or empty if no pool references {@code tokenId}
     */
    public static Optional<Token> findToken(Collection<Pool> pools, String tokenId) {
        if (tokenId == null || tokenId.isBlank()) return Optional.empty();
        for (Pool pool : pools) {
            if (pool.tokenA().id().equals(tokenId)) return Optional.of(pool.tokenA());
            if (pool.tokenB().id().equals(tokenId)) return Optional.of(pool.tokenB());
        }
        return Optional.empty();
    }
}
