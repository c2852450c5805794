package com.swaprouter.registry;

import com.swaprouter.config.SwapRouterProperties;
import com.swaprouter.model.Pool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Arrays;
import java.util.List;

/**
 * {@link PoolSource} backed by the pool indexer's REST API.
 *
 * <pre>
 * GET {baseUrl}/{chain}/pools  →  [ {"id": "...", "tokenA": {...}, "tokenB": {...}, ...}, ... ]
 * </pre>
 */
@Component
public class HttpPoolSource implements PoolSource {

    private static final Logger log = LoggerFactory.getLogger(HttpPoolSource.class);

    private final RestClient restClient;

    public HttpPoolSource(RestClient.Builder builder, SwapRouterProperties properties) {
        this.restClient = builder.baseUrl(properties.getPoolSource().getBaseUrl()).build();
    }

    @Override
    public List<Pool> fetchPools(String chain) {
        log.info("Fetching pools for chain={}", chain);
        Pool[] pools;
        try {
            pools = restClient.get()
                    .uri("/{chain}/pools", chain)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(Pool[].class);
        } catch (RestClientException e) {
            throw new PoolSourceException("Pool source request failed for chain " + chain + ": " + e.getMessage(), e);
        }

        if (pools == null) {
            throw new PoolSourceException("Pool source returned an empty body for chain " + chain);
        }
        return Arrays.asList(pools);
    }
}
