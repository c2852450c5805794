package com.swaprouter.compute;

import com.swaprouter.codec.CodecException;
import com.swaprouter.codec.PoolCodec;
import com.swaprouter.model.Pool;
import com.swaprouter.model.Route;
import com.swaprouter.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * One isolated route computation: decodes a {@link RouteComputationRequest}, runs the
 * {@link RouteFinder} and answers with encoded routes. A task is created per request and
 * discarded afterwards.
 */
public class RouteComputationTask implements Callable<List<byte[]>> {

    private static final Logger log = LoggerFactory.getLogger(RouteComputationTask.class);

    private final RouteComputationRequest request;
    private final PoolCodec codec;

    public RouteComputationTask(RouteComputationRequest request, PoolCodec codec) {
        this.request = request;
        this.codec = codec;
    }

    @Override
    public List<byte[]> call() {
        long start = System.nanoTime();
        try {
            Token input = codec.decodeToken(request.input());
            Token output = codec.decodeToken(request.output());
            List<Pool> pools = new ArrayList<>(request.pools().size());
            for (byte[] payload : request.pools()) {
                pools.add(codec.decodePool(payload));
            }

            List<Route> routes = RouteFinder.findRoutes(input, output, pools, request.maxHops(), request.maxRoutes());

            List<byte[]> encoded = new ArrayList<>(routes.size());
            for (Route route : routes) {
                encoded.add(codec.encodeRoute(route));
            }
            log.debug("Computed {} routes {} -> {} over {} pools, maxHops={} in {} ms",
                    routes.size(), input.symbol(), output.symbol(), pools.size(), request.maxHops(),
                    (System.nanoTime() - start) / 1_000_000);
            return encoded;
        } catch (CodecException e) {
            throw new RouteComputationException("Route computation request could not be decoded", e);
        }
    }
}
