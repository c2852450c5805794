package com.swaprouter.controller;

import com.swaprouter.cache.RouteCache;
import com.swaprouter.compute.IsolatedRouteComputer;
import com.swaprouter.model.TradeType;
import com.swaprouter.registry.PoolRegistry;
import com.swaprouter.updates.PoolUpdateListener;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operational endpoints for health monitoring and service introspection.
 */
@RestController
public class StatusController {

    private final PoolRegistry poolRegistry;
    private final RouteCache routeCache;
    private final PoolUpdateListener updateListener;
    private final IsolatedRouteComputer routeComputer;

    public StatusController(PoolRegistry poolRegistry, RouteCache routeCache,
                            PoolUpdateListener updateListener, IsolatedRouteComputer routeComputer) {
        this.poolRegistry = poolRegistry;
        this.routeCache = routeCache;
        this.updateListener = updateListener;
        this.routeComputer = routeComputer;
    }

    /**
     * Simple liveness probe.
     * GET /ping → {"status": "ok"}
     */
    @GetMapping("/ping")
    public ResponseEntity<Map<String, String>> ping() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    /**
     * Detailed service status.
     * GET /status → loaded chains with pool counts, cache and update counters.
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Integer> chains = new LinkedHashMap<>();
        for (String chain : poolRegistry.loadedChains()) {
            chains.put(chain, poolRegistry.size(chain));
        }

        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "timestamp", Instant.now().getEpochSecond(),
                "chains", chains,
                "cachedRouteSets", routeCache.size(),
                "refreshesInFlight", routeCache.inFlightCount(),
                "activeRouteWorkers", routeComputer.activeWorkers(),
                "updatesApplied", updateListener.appliedCount(),
                "updatesRejected", updateListener.rejectedCount(),
                "updateBootstraps", updateListener.bootstrapCount(),
                "supportedTradeTypes", Arrays.asList(TradeType.supportedLabels())
        ));
    }
}
