package com.swaprouter.cache;

import com.swaprouter.compute.RouteComputer;
import com.swaprouter.config.AppConfig;
import com.swaprouter.config.SwapRouterProperties;
import com.swaprouter.model.Pool;
import com.swaprouter.model.Route;
import com.swaprouter.model.Token;
import com.swaprouter.registry.TokenResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Stale-while-revalidate cache of computed routes.
 *
 * <p>Per key:
 * <ul>
 *   <li>first query: blocks until the routes are computed; concurrent first queries share
 *       the same computation</li>
 *   <li>fresh entry: served as is</li>
 *   <li>stale entry: served immediately; one background recomputation is started unless one
 *       is already in flight; the refresh is prepared and run on {@code refreshExecutor}, so
 *       the reader does no work proportional to the pool count</li>
 * </ul>
 *
 * <p>Failed computations never remove or replace an entry and never escape this class: the
 * caller gets the stale routes, or an empty list if there were none. Entries are never evicted.
 */
@Component
public class RouteCache {

    private static final Logger log = LoggerFactory.getLogger(RouteCache.class);

    private final RouteComputer routeComputer;
    private final Executor refreshExecutor;
    private final Clock clock;
    private final Duration ttl;

    /** Null when stale entries may be served forever. */
    private final Duration maxStaleness;

    private final ConcurrentMap<RouteCacheKey, RouteCacheEntry> entries = new ConcurrentHashMap<>();

    /**
     * Key -> computation in flight. At most one per key; removed when the computation
     * completes, whatever the outcome.
     */
    private final ConcurrentMap<RouteCacheKey, CompletableFuture<List<Route>>> inFlight = new ConcurrentHashMap<>();

    public RouteCache(RouteComputer routeComputer,
                      @Qualifier(AppConfig.ROUTE_REFRESH_EXECUTOR) Executor refreshExecutor,
                      Clock clock,
                      SwapRouterProperties properties) {
        this.routeComputer = routeComputer;
        this.refreshExecutor = refreshExecutor;
        this.clock = clock;
        this.ttl = properties.getRoutes().getTtl();
        this.maxStaleness = properties.getRoutes().getMaxStaleness();
    }

    /**
     * Routes from {@code inputTokenId} to {@code outputTokenId} over {@code pools}.
     *
     * <p>Blocks only when the key has no servable entry yet.
     *
     * @param pools the pool snapshot used if a computation has to be started
     * @return cached or freshly computed routes; empty if none exist or the computation failed
     */
    public List<Route> get(String chain, Collection<Pool> pools, String inputTokenId, String outputTokenId, int maxHops) {
        RouteCacheKey key = new RouteCacheKey(chain, inputTokenId, outputTokenId, maxHops);
        Instant now = clock.instant();

        RouteCacheEntry entry = entries.get(key);
        if (entry != null && isServable(entry, now)) {
            if (entry.isStale(now)) {
                refreshInBackground(key, pools);
            } else {
                log.debug("Route cache hit for {}", key);
            }
            return entry.routes();
        }

        if (entry != null) {
            log.info("Routes for {} expired at {} exceed the staleness limit, recomputing", key, entry.expiresAt());
        }
        return populate(key, pools);
    }

    public Optional<RouteCacheEntry> peek(RouteCacheKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean isRefreshing(RouteCacheKey key) {
        return inFlight.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private List<Route> populate(RouteCacheKey key, Collection<Pool> pools) {
        CompletableFuture<List<Route>> mine = new CompletableFuture<>();
        CompletableFuture<List<Route>> running = inFlight.putIfAbsent(key, mine);

        if (running == null) {
            // A computation may have landed between the entry miss and claiming the key
            RouteCacheEntry landed = entries.get(key);
            if (landed != null && isServable(landed, clock.instant())) {
                inFlight.remove(key, mine);
                mine.complete(landed.routes());
                return landed.routes();
            }
            startComputation(key, pools, mine);
            running = mine;
        } else {
            log.debug("Waiting on computation already in flight for {}", key);
        }

        try {
            return running.join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Error computing routes for {}: {}", key, cause.getMessage(), cause);
            return List.of();
        }
    }

    void refreshInBackground(RouteCacheKey key, Collection<Pool> pools) {
        CompletableFuture<List<Route>> mine = new CompletableFuture<>();
        if (inFlight.putIfAbsent(key, mine) != null) {
            log.debug("Refresh already in flight for {}", key);
            return;
        }

        // Another refresh may have landed between the stale read and claiming the key
        RouteCacheEntry current = entries.get(key);
        if (current != null && !current.isStale(clock.instant())) {
            inFlight.remove(key, mine);
            mine.complete(current.routes());
            return;
        }

        log.info("Scheduling background route refresh for {}", key);
        mine.whenComplete((routes, error) -> {
            if (error != null) {
                log.error("Background route refresh failed for {}, keeping stale routes", key, error);
            } else {
                log.info("Routes refreshed in background for {}: {} routes", key, routes.size());
            }
        });
        try {
            refreshExecutor.execute(() -> startComputation(key, pools, mine));
        } catch (RejectedExecutionException e) {
            inFlight.remove(key, mine);
            mine.completeExceptionally(e);
        }
    }

    /**
     * Computes routes for {@code key} and completes {@code promise}. The caller must already
     * hold the in-flight slot for {@code key} with {@code promise}.
     */
    private void startComputation(RouteCacheKey key, Collection<Pool> pools, CompletableFuture<List<Route>> promise) {
        Optional<Token> input = TokenResolver.findToken(pools, key.inputTokenId());
        Optional<Token> output = TokenResolver.findToken(pools, key.outputTokenId());
        if (input.isEmpty() || output.isEmpty()) {
            log.error("Invalid input/output for {}: token not present in routable pools", key);
            inFlight.remove(key, promise);
            promise.complete(List.of());
            return;
        }

        CompletableFuture<List<Route>> computation;
        try {
            computation = routeComputer.computeRoutes(input.get(), output.get(), pools, key.maxHops());
        } catch (RuntimeException e) {
            computation = CompletableFuture.failedFuture(e);
        }

        computation.whenComplete((routes, error) -> {
            if (error == null) {
                entries.put(key, new RouteCacheEntry(routes, clock.instant().plus(ttl)));
            }
            inFlight.remove(key, promise);
            if (error == null) {
                promise.complete(routes);
            } else {
                promise.completeExceptionally(unwrap(error));
            }
        });
    }

    private boolean isServable(RouteCacheEntry entry, Instant now) {
        return maxStaleness == null || !now.isAfter(entry.expiresAt().plus(maxStaleness));
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
