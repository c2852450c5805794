package com.swaprouter.model;

import java.math.BigInteger;
import java.util.List;

/**
 * Ordered sequence of pools leading from {@code input} to {@code output}.
 */
public record Route(Token input, Token output, List<Pool> pools) {

    public Route {
        if (input == null || output == null) throw new IllegalArgumentException("Route tokens must not be null");
        if (pools == null || pools.isEmpty()) throw new IllegalArgumentException("Route must contain at least one pool");
        pools = List.copyOf(pools);
    }

    public List<String> poolIds() {
        return pools.stream().map(Pool::id).toList();
    }

    public int hops() {
        return pools.size();
    }

    /** Sum of active liquidity over all pools of the route. */
    public BigInteger totalLiquidity() {
        return pools.stream().map(Pool::liquidity).reduce(BigInteger.ZERO, BigInteger::add);
    }

    /**
     * Same path with each pool replaced by {@code freshPools}, which must be in route order.
     */
    public Route withPools(List<Pool> freshPools) {
        return new Route(input, output, freshPools);
    }
}
