package com.swaprouter.registry;

import com.swaprouter.model.Pool;

import java.util.List;

/**
 * Authoritative source of the full pool set of a chain, queried only to bootstrap a registry.
 */
public interface PoolSource {

    /**
     * Fetch all pools currently known for {@code chain}.
     *
     * @throws PoolSourceException if the source is unreachable or answers with malformed data
     */
    List<Pool> fetchPools(String chain);
}
