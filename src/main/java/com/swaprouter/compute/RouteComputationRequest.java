package com.swaprouter.compute;

import java.util.List;

/**
 * Serialized input of one route computation. Everything a worker needs is carried as
 * encoded bytes so the worker builds its own object graph and shares nothing with the caller.
 *
 * @param input     Encoded input token
 * @param output    Encoded output token
 * @param pools     Encoded pool snapshot, one payload per pool
 * @param maxHops   Maximum number of pools per route
 * @param maxRoutes Result cap, 0 for unlimited
 */
public record RouteComputationRequest(byte[] input, byte[] output, List<byte[]> pools, int maxHops, int maxRoutes) {

    public RouteComputationRequest {
        if (input == null || output == null) throw new IllegalArgumentException("Tokens must not be null");
        pools = pools == null ? List.of() : List.copyOf(pools);
    }
}
