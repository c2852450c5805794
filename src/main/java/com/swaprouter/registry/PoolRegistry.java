package com.swaprouter.registry;

import com.swaprouter.codec.PoolCodec;
import com.swaprouter.model.Pool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory, per-chain view of liquidity pools.
 *
 * <p>A chain's registry is created by a full fetch from the {@link PoolSource} on first access
 * and then kept current by whole-pool upserts from the update channel. Registries are never
 * removed or reset.
 *
 * <p>Bootstrap is single-flight: concurrent first callers for the same chain wait on one
 * fetch instead of racing each other and overwriting the result.
 */
@Repository
public class PoolRegistry {

    private static final Logger log = LoggerFactory.getLogger(PoolRegistry.class);

    private final PoolSource poolSource;
    private final PoolCodec codec;

    private final ConcurrentMap<String, ConcurrentMap<String, Pool>> registries = new ConcurrentHashMap<>();

    /** Chain -> bootstrap in progress. Entries live only while a fetch is running. */
    private final ConcurrentMap<String, CompletableFuture<ConcurrentMap<String, Pool>>> bootstraps =
            new ConcurrentHashMap<>();

    public PoolRegistry(PoolSource poolSource, PoolCodec codec) {
        this.poolSource = poolSource;
        this.codec = codec;
    }

    /**
     * Returns all pools of {@code chain}, fetching them first if the chain has no registry yet.
     *
     * @throws PoolSourceException if the bootstrap fetch fails
     */
    public Collection<Pool> ensureLoaded(String chain) {
        ConcurrentMap<String, Pool> pools = registries.get(chain);
        if (pools == null) {
            pools = bootstrap(chain);
        }
        return List.copyOf(pools.values());
    }

    /**
     * Apply an encoded pool from the update channel.
     *
     * <p>Updates for a chain without a registry cannot be queued: the update is dropped and a
     * bootstrap is run instead, which fetches current state directly.
     *
     * @throws com.swaprouter.codec.PoolDecodeException if the payload is not a usable pool;
     *         the registry is left untouched
     */
    public UpdateOutcome applyUpdate(String chain, byte[] encodedPool) {
        Pool pool = codec.decodePool(encodedPool);

        ConcurrentMap<String, Pool> pools = registries.get(chain);
        if (pools == null) {
            log.info("Update for pool={} arrived before chain={} was loaded; bootstrapping instead", pool.id(), chain);
            ensureLoaded(chain);
            return UpdateOutcome.BOOTSTRAPPED;
        }

        Pool previous = pools.put(pool.id(), pool);
        log.debug("Pool {}: chain={} pool={} liquidity={}",
                previous == null ? "added" : "replaced", chain, pool.id(), pool.liquidity());
        return UpdateOutcome.APPLIED;
    }

    public Optional<Pool> find(String chain, String poolId) {
        ConcurrentMap<String, Pool> pools = registries.get(chain);
        return pools == null ? Optional.empty() : Optional.ofNullable(pools.get(poolId));
    }

    public boolean isLoaded(String chain) {
        return registries.containsKey(chain);
    }

    /**
     * Number of pools held for {@code chain}; 0 if the chain is not loaded.
     */
    public int size(String chain) {
        ConcurrentMap<String, Pool> pools = registries.get(chain);
        return pools == null ? 0 : pools.size();
    }

    public List<String> loadedChains() {
        return registries.keySet().stream().sorted().toList();
    }

    private ConcurrentMap<String, Pool> bootstrap(String chain) {
        CompletableFuture<ConcurrentMap<String, Pool>> mine = new CompletableFuture<>();
        CompletableFuture<ConcurrentMap<String, Pool>> running = bootstraps.putIfAbsent(chain, mine);
        if (running != null) {
            log.debug("Joining bootstrap already in progress for chain={}", chain);
            return await(chain, running);
        }

        try {
            // Another caller may have finished between our registry miss and claiming the slot
            ConcurrentMap<String, Pool> installed = registries.get(chain);
            if (installed == null) {
                installed = fetch(chain);
                registries.put(chain, installed);
                log.info("{} initial {} pools fetched", installed.size(), chain);
            }
            mine.complete(installed);
            return installed;
        } catch (RuntimeException e) {
            PoolSourceException failure = e instanceof PoolSourceException pse
                    ? pse
                    : new PoolSourceException("Bootstrap failed for chain " + chain, e);
            mine.completeExceptionally(failure);
            throw failure;
        } finally {
            bootstraps.remove(chain, mine);
        }
    }

    private ConcurrentMap<String, Pool> fetch(String chain) {
        List<Pool> fetched = poolSource.fetchPools(chain);
        if (fetched == null) {
            throw new PoolSourceException("Pool source returned no data for chain " + chain);
        }

        ConcurrentMap<String, Pool> pools = new ConcurrentHashMap<>();
        for (Pool pool : fetched) {
            if (pool != null && pool.isLive()) {
                pools.put(pool.id(), pool);
            }
        }
        return pools;
    }

    private static ConcurrentMap<String, Pool> await(String chain,
                                                     CompletableFuture<ConcurrentMap<String, Pool>> bootstrap) {
        try {
            return bootstrap.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof PoolSourceException pse) throw pse;
            throw new PoolSourceException("Bootstrap failed for chain " + chain, e.getCause());
        }
    }

    /** Copy of a chain's pools keyed by id; empty if the chain is not loaded. */
    Map<String, Pool> snapshot(String chain) {
        ConcurrentMap<String, Pool> pools = registries.get(chain);
        return pools == null ? Map.of() : Map.copyOf(pools);
    }
}
