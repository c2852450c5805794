package com.swaprouter.compute;

import com.swaprouter.model.Pool;
import com.swaprouter.model.Route;
import com.swaprouter.model.Token;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Computes candidate routes off the calling thread.
 */
@FunctionalInterface
public interface RouteComputer {

    /**
     * Start a route computation over a snapshot of {@code pools}.
     *
     * @return a future completing with the routes, or exceptionally with a
     *         {@link RouteComputationException}
     */
    CompletableFuture<List<Route>> computeRoutes(Token input, Token output, Collection<Pool> pools, int maxHops);
}
