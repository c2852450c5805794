package com.swaprouter.cache;

import com.swaprouter.model.Route;

import java.time.Instant;
import java.util.List;

/**
 * A computed route set and the moment it stops being fresh. Expired entries are still served.
 */
public record RouteCacheEntry(List<Route> routes, Instant expiresAt) {

    public RouteCacheEntry {
        routes = List.copyOf(routes);
    }

    public boolean isStale(Instant now) {
        return now.isAfter(expiresAt);
    }
}
