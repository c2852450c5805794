package com.swaprouter.model;

import java.math.BigInteger;
import java.util.List;

/**
 * Snapshot of a liquidity pool.
 *
 * <p>Pools are never patched field by field: a newer state replaces the whole object,
 * keyed by {@link #id()}.
 *
 * @param id           Pool identifier, unique per chain
 * @param tokenA       First token of the pair
 * @param tokenB       Second token of the pair
 * @param fee          Fee tier in hundredths of a basis point
 * @param active       Whether the pool accepts swaps
 * @param liquidity    Currently active liquidity
 * @param sqrtPriceX64 Square root of the price as a Q64.64 fixed point number
 * @param tickCurrent  Tick of the current price
 * @param ticks        Initialized ticks, ascending by index
 */
public record Pool(String id,
                   Token tokenA,
                   Token tokenB,
                   int fee,
                   boolean active,
                   BigInteger liquidity,
                   BigInteger sqrtPriceX64,
                   int tickCurrent,
                   List<Tick> ticks) {

    public Pool {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Pool id must not be blank");
        if (tokenA == null || tokenB == null) throw new IllegalArgumentException("Pool tokens must not be null");
        if (liquidity == null) liquidity = BigInteger.ZERO;
        if (liquidity.signum() < 0) throw new IllegalArgumentException("Liquidity must be non-negative");
        if (sqrtPriceX64 == null) sqrtPriceX64 = BigInteger.ZERO;
        ticks = ticks == null ? List.of() : List.copyOf(ticks);
    }

    /**
     * The token on the other side of the pair from {@code token}.
     */
    public Token otherToken(Token token) {
        return tokenA.id().equals(token.id()) ? tokenB : tokenA;
    }

    /**
     * Eligible for the bootstrap snapshot: active with positive liquidity.
     */
    public boolean isLive() {
        return active && liquidity.signum() > 0;
    }

    /**
     * A pool without initialized ticks cannot be swapped through.
     */
    public boolean isRoutable() {
        return !ticks.isEmpty();
    }
}
