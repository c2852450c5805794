package com.swaprouter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Service settings bound from {@code swaprouter.*}. Defaults are documented in application.yml.
 */
@ConfigurationProperties(prefix = "swaprouter")
public class SwapRouterProperties {

    private final Routes routes = new Routes();
    private final Computation computation = new Computation();
    private final PoolSourceSettings poolSource = new PoolSourceSettings();
    private final Updates updates = new Updates();

    public Routes getRoutes() {
        return routes;
    }

    public Computation getComputation() {
        return computation;
    }

    public PoolSourceSettings getPoolSource() {
        return poolSource;
    }

    public Updates getUpdates() {
        return updates;
    }

    public static class Routes {

        /** How long a computed route set is considered fresh. */
        private Duration ttl = Duration.ofHours(2);

        /**
         * How long past expiry a stale route set may still be served while it refreshes.
         * Unset means stale routes are served indefinitely.
         */
        private Duration maxStaleness;

        /** Upper bound applied to the hop count of any query. */
        private int maxHopsCeiling = 3;

        /** Largest route set kept per query, ranked by pool liquidity. 0 disables the cap. */
        private int maxRoutes = 1000;

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public Duration getMaxStaleness() {
            return maxStaleness;
        }

        public void setMaxStaleness(Duration maxStaleness) {
            this.maxStaleness = maxStaleness;
        }

        public int getMaxHopsCeiling() {
            return maxHopsCeiling;
        }

        public void setMaxHopsCeiling(int maxHopsCeiling) {
            this.maxHopsCeiling = maxHopsCeiling;
        }

        public int getMaxRoutes() {
            return maxRoutes;
        }

        public void setMaxRoutes(int maxRoutes) {
            this.maxRoutes = maxRoutes;
        }
    }

    public static class Computation {

        private int corePoolSize = 2;
        private int maxPoolSize = 4;

        /** Requests waiting for a worker; further requests are rejected. */
        private int queueCapacity = 32;

        /** A computation running longer than this is cancelled and reported as failed. */
        private Duration timeout = Duration.ofSeconds(30);

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class PoolSourceSettings {

        /** Base URL of the pool indexer API; pools are read from {@code {baseUrl}/{chain}/pools}. */
        private String baseUrl = "http://localhost:7000/api/v2";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    public static class Updates {

        /** Pub/sub channel carrying {@code {chain, buffer}} pool update messages. */
        private String channel = "swap:pool:instanceUpdated";

        public String getChannel() {
            return channel;
        }

        public void setChannel(String channel) {
            this.channel = channel;
        }
    }
}
