package com.swaprouter.compute;

import com.swaprouter.model.Pool;
import com.swaprouter.model.Route;
import com.swaprouter.model.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Enumerates candidate routes between two tokens over a pool graph.
 *
 * <p>Tokens are vertices and pools are edges. A route is a simple path in terms of pools
 * (no pool used twice) with at most {@code maxHops} pools. Routes are produced in depth-first
 * discovery order, following the iteration order of the pool collection.
 *
 * <p>The search is exponential in {@code maxHops}; it checks the thread's interrupt flag so a
 * cancelled computation stops promptly.
 */
public final class RouteFinder {

    private final Token input;
    private final Token output;
    private final int maxHops;
    private final Map<String, List<Pool>> poolsByToken = new LinkedHashMap<>();

    private final Deque<Pool> path = new ArrayDeque<>();
    private final Set<String> usedPools = new HashSet<>();
    private final List<Route> routes = new ArrayList<>();

    private RouteFinder(Token input, Token output, Collection<Pool> pools, int maxHops) {
        this.input = input;
        this.output = output;
        this.maxHops = maxHops;
        for (Pool pool : pools) {
            poolsByToken.computeIfAbsent(pool.tokenA().id(), k -> new ArrayList<>()).add(pool);
            if (!pool.tokenB().id().equals(pool.tokenA().id())) {
                poolsByToken.computeIfAbsent(pool.tokenB().id(), k -> new ArrayList<>()).add(pool);
            }
        }
    }

    /**
     * Find all routes from {@code input} to {@code output}.
     *
     * @param maxRoutes keep at most this many routes, preferring the highest total liquidity;
     *                  0 or less keeps every route
     * @throws RouteComputationException if the calling thread is interrupted during the search
     */
    public static List<Route> findRoutes(Token input, Token output, Collection<Pool> pools,
                                         int maxHops, int maxRoutes) {
        if (maxHops < 1 || input.id().equals(output.id())) {
            return List.of();
        }

        RouteFinder finder = new RouteFinder(input, output, pools, maxHops);
        finder.search(input);

        List<Route> found = finder.routes;
        if (maxRoutes > 0 && found.size() > maxRoutes) {
            // List.sort is stable, so equally liquid routes keep discovery order
            found.sort(Comparator.comparing(Route::totalLiquidity).reversed());
            return List.copyOf(found.subList(0, maxRoutes));
        }
        return List.copyOf(found);
    }

    private void search(Token current) {
        if (Thread.currentThread().isInterrupted()) {
            throw new RouteComputationException("Route search interrupted");
        }

        for (Pool pool : poolsByToken.getOrDefault(current.id(), List.of())) {
            if (usedPools.contains(pool.id())) continue;

            Token next = pool.otherToken(current);
            path.addLast(pool);
            usedPools.add(pool.id());

            if (next.id().equals(output.id())) {
                routes.add(new Route(input, output, new ArrayList<>(path)));
            } else if (path.size() < maxHops) {
                search(next);
            }

            usedPools.remove(pool.id());
            path.removeLast();
        }
    }
}
