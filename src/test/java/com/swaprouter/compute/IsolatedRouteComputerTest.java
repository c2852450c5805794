package com.swaprouter.compute;

import com.swaprouter.codec.PoolCodec;
import com.swaprouter.config.SwapRouterProperties;
import com.swaprouter.model.Pool;
import com.swaprouter.model.Route;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static com.swaprouter.testutil.PoolFixtures.BRWL;
import static com.swaprouter.testutil.PoolFixtures.TLM;
import static com.swaprouter.testutil.PoolFixtures.USDT;
import static com.swaprouter.testutil.PoolFixtures.WAX;
import static com.swaprouter.testutil.PoolFixtures.pool;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IsolatedRouteComputer")
class IsolatedRouteComputerTest {

    private final List<Pool> pools = List.of(
            pool("1", WAX, TLM),
            pool("2", TLM, USDT),
            pool("3", USDT, BRWL),
            pool("4", WAX, USDT));

    private final CountDownLatch releaseBlocker = new CountDownLatch(1);
    private ThreadPoolTaskExecutor executor;
    private ThreadPoolTaskScheduler scheduler;

    private IsolatedRouteComputer computer(int queueCapacity, Duration timeout) {
        SwapRouterProperties properties = new SwapRouterProperties();
        properties.getComputation().setTimeout(timeout);
        properties.getRoutes().setMaxRoutes(0);

        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(queueCapacity);
        executor.initialize();

        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.initialize();

        return new IsolatedRouteComputer(new PoolCodec(), executor, scheduler, properties);
    }

    private void occupyWorker() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        executor.execute(() -> {
            started.countDown();
            try {
                releaseBlocker.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @AfterEach
    void tearDown() {
        releaseBlocker.countDown();
        if (executor != null) executor.shutdown();
        if (scheduler != null) scheduler.shutdown();
    }

    @Test
    @DisplayName("Routes computed by a worker equal an in-process search")
    void computesRoutes() throws Exception {
        IsolatedRouteComputer computer = computer(4, Duration.ofSeconds(10));

        List<Route> routes = computer.computeRoutes(WAX, BRWL, pools, 3).get(5, TimeUnit.SECONDS);

        assertThat(routes).isEqualTo(RouteFinder.findRoutes(WAX, BRWL, pools, 3, 0));
        assertThat(routes).extracting(Route::poolIds)
                .containsExactly(List.of("1", "2", "3"), List.of("4", "3"));
    }

    @Test
    @DisplayName("Returned routes are decoded copies, not the caller's objects")
    void routesAreDecodedCopies() throws Exception {
        IsolatedRouteComputer computer = computer(4, Duration.ofSeconds(10));

        Route route = computer.computeRoutes(WAX, TLM, pools, 1).get(5, TimeUnit.SECONDS).get(0);

        assertThat(route.pools().get(0)).isEqualTo(pools.get(0)).isNotSameAs(pools.get(0));
    }

    @Test
    @DisplayName("A saturated worker pool rejects the computation")
    void saturatedPoolRejects() throws Exception {
        IsolatedRouteComputer computer = computer(0, Duration.ofSeconds(10));
        occupyWorker();

        CompletableFuture<List<Route>> result = computer.computeRoutes(WAX, BRWL, pools, 3);

        assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(RouteComputationException.class)
                .hasMessageContaining("saturated");
    }

    @Test
    @DisplayName("A computation exceeding the timeout fails")
    void timeoutFailsComputation() throws Exception {
        IsolatedRouteComputer computer = computer(1, Duration.ofMillis(200));
        occupyWorker();

        CompletableFuture<List<Route>> result = computer.computeRoutes(WAX, BRWL, pools, 3);

        assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(RouteComputationException.class)
                .hasMessageContaining("timed out");
    }
}
