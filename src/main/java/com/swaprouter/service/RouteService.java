package com.swaprouter.service;

import com.swaprouter.cache.RouteCache;
import com.swaprouter.config.SwapRouterProperties;
import com.swaprouter.model.Pool;
import com.swaprouter.model.Route;
import com.swaprouter.model.Token;
import com.swaprouter.model.TradeType;
import com.swaprouter.registry.PoolRegistry;
import com.swaprouter.registry.TokenResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Query path for candidate routes.
 *
 * <p>Loads the chain's pools, validates the tokens, reads the {@link RouteCache} and swaps
 * the pools of cached routes for their current registry state, since a cached route may be
 * hours older than the pools it passes through.
 */
@Service
public class RouteService {

    private static final Logger log = LoggerFactory.getLogger(RouteService.class);

    private final PoolRegistry poolRegistry;
    private final RouteCache routeCache;
    private final int maxHopsCeiling;

    public RouteService(PoolRegistry poolRegistry, RouteCache routeCache, SwapRouterProperties properties) {
        this.poolRegistry = poolRegistry;
        this.routeCache = routeCache;
        this.maxHopsCeiling = properties.getRoutes().getMaxHopsCeiling();
    }

    /**
     * Candidate routes between two tokens.
     *
     * @param maxHops requested hop limit; null means the configured ceiling, larger values are clamped to it
     * @throws InvalidRouteRequestException if a token is unknown on the chain or {@code maxHops} is below 1
     * @throws com.swaprouter.registry.PoolSourceException if the chain's pools cannot be bootstrapped
     */
    public CandidateRoutes findRoutes(String chain, String inputTokenId, String outputTokenId,
                                      TradeType tradeType, Integer maxHops) {
        long start = System.nanoTime();
        int hops = effectiveMaxHops(maxHops);

        Collection<Pool> allPools = poolRegistry.ensureLoaded(chain);
        List<Pool> routablePools = allPools.stream().filter(Pool::isRoutable).toList();

        Token input = TokenResolver.findToken(allPools, inputTokenId)
                .orElseThrow(() -> new InvalidRouteRequestException("Unknown input token: " + inputTokenId));
        Token output = TokenResolver.findToken(allPools, outputTokenId)
                .orElseThrow(() -> new InvalidRouteRequestException("Unknown output token: " + outputTokenId));

        List<Route> cached = routeCache.get(chain, routablePools, input.id(), output.id(), hops);
        List<Route> routes = withCurrentPools(chain, cached);

        log.info("{} find route {} hop {} ms {} -> {} ({}): {} candidates",
                chain, hops, (System.nanoTime() - start) / 1_000_000,
                input.symbol(), output.symbol(), tradeType, routes.size());
        return new CandidateRoutes(chain, input, output, tradeType, hops, routes);
    }

    private int effectiveMaxHops(Integer requested) {
        if (requested == null) return maxHopsCeiling;
        if (requested < 1) throw new InvalidRouteRequestException("maxHops must be at least 1, got " + requested);
        return Math.min(requested, maxHopsCeiling);
    }

    private List<Route> withCurrentPools(String chain, List<Route> routes) {
        List<Route> refreshed = new ArrayList<>(routes.size());
        for (Route route : routes) {
            List<Pool> current = new ArrayList<>(route.hops());
            for (Pool pool : route.pools()) {
                Optional<Pool> latest = poolRegistry.find(chain, pool.id());
                if (latest.isEmpty()) {
                    log.warn("Pool {} of cached route {} is missing from the {} registry, dropping route",
                            pool.id(), route.poolIds(), chain);
                    break;
                }
                current.add(latest.get());
            }
            if (current.size() == route.hops()) {
                refreshed.add(route.withPools(current));
            }
        }
        return refreshed;
    }
}
