package com.swaprouter.cache;

/**
 * Composite key of one cached route set. Record equality makes it safe as a
 * {@link java.util.concurrent.ConcurrentHashMap} key.
 *
 * @param chain         Chain identifier
 * @param inputTokenId  Id of the token being sold
 * @param outputTokenId Id of the token being bought
 * @param maxHops       Hop limit the routes were computed with
 */
public record RouteCacheKey(String chain, String inputTokenId, String outputTokenId, int maxHops) {

    @Override
    public String toString() {
        return chain + "-" + inputTokenId + "-" + outputTokenId + "-" + maxHops;
    }
}
