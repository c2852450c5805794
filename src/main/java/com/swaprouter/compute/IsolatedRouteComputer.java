package com.swaprouter.compute;

import com.swaprouter.codec.CodecException;
import com.swaprouter.codec.PoolCodec;
import com.swaprouter.config.AppConfig;
import com.swaprouter.config.SwapRouterProperties;
import com.swaprouter.model.Pool;
import com.swaprouter.model.Route;
import com.swaprouter.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs {@link RouteComputationTask}s on the bounded route-worker pool.
 *
 * <p>The request is encoded before it leaves the caller and the answer is decoded after it
 * comes back, so workers never touch the caller's pool objects. Backpressure and liveness:
 * <ul>
 *   <li>a saturated pool rejects the request immediately instead of queueing without bound</li>
 *   <li>a computation exceeding the timeout is reported as failed and its worker interrupted</li>
 * </ul>
 */
@Service
public class IsolatedRouteComputer implements RouteComputer {

    private static final Logger log = LoggerFactory.getLogger(IsolatedRouteComputer.class);

    private final PoolCodec codec;
    private final ThreadPoolTaskExecutor executor;
    private final TaskScheduler taskScheduler;
    private final Duration timeout;
    private final int maxRoutes;

    public IsolatedRouteComputer(PoolCodec codec,
                                 @Qualifier(AppConfig.ROUTE_WORKER_EXECUTOR) ThreadPoolTaskExecutor executor,
                                 TaskScheduler taskScheduler,
                                 SwapRouterProperties properties) {
        this.codec = codec;
        this.executor = executor;
        this.taskScheduler = taskScheduler;
        this.timeout = properties.getComputation().getTimeout();
        this.maxRoutes = properties.getRoutes().getMaxRoutes();
    }

    @Override
    public CompletableFuture<List<Route>> computeRoutes(Token input, Token output, Collection<Pool> pools, int maxHops) {
        CompletableFuture<List<byte[]>> answer = new CompletableFuture<>();

        RouteComputationTask task;
        try {
            task = new RouteComputationTask(encodeRequest(input, output, pools, maxHops), codec);
        } catch (CodecException e) {
            answer.completeExceptionally(new RouteComputationException("Could not encode route computation request", e));
            return answer.thenApply(this::decodeRoutes);
        }

        Future<?> worker;
        try {
            worker = executor.submit(() -> {
                try {
                    answer.complete(task.call());
                } catch (RouteComputationException e) {
                    answer.completeExceptionally(e);
                } catch (Throwable t) {
                    answer.completeExceptionally(new RouteComputationException("Route worker terminated abnormally", t));
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("Route worker pool saturated, rejecting computation {} -> {} maxHops={}",
                    input.symbol(), output.symbol(), maxHops);
            answer.completeExceptionally(new RouteComputationException("Route worker pool saturated", e));
            return answer.thenApply(this::decodeRoutes);
        }

        ScheduledFuture<?> watchdog = taskScheduler.schedule(() -> {
            if (answer.completeExceptionally(new RouteComputationException("Route computation timed out after " + timeout))) {
                log.warn("Route computation {} -> {} maxHops={} exceeded {}, cancelling worker",
                        input.symbol(), output.symbol(), maxHops, timeout);
                worker.cancel(true);
            }
        }, Instant.now().plus(timeout));
        answer.whenComplete((routes, error) -> watchdog.cancel(false));

        return answer.thenApply(this::decodeRoutes);
    }

    /** Route-worker threads currently computing. */
    public int activeWorkers() {
        return executor.getActiveCount();
    }

    private RouteComputationRequest encodeRequest(Token input, Token output, Collection<Pool> pools, int maxHops) {
        List<byte[]> encodedPools = new ArrayList<>(pools.size());
        for (Pool pool : pools) {
            encodedPools.add(codec.encodePool(pool));
        }
        return new RouteComputationRequest(codec.encodeToken(input), codec.encodeToken(output),
                encodedPools, maxHops, maxRoutes);
    }

    private List<Route> decodeRoutes(List<byte[]> encoded) {
        try {
            List<Route> routes = new ArrayList<>(encoded.size());
            for (byte[] payload : encoded) {
                routes.add(codec.decodeRoute(payload));
            }
            return List.copyOf(routes);
        } catch (CodecException e) {
            throw new RouteComputationException("Route worker answered with an undecodable route", e);
        }
    }
}
