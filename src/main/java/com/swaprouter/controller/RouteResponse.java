package com.swaprouter.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.swaprouter.model.Route;
import com.swaprouter.service.CandidateRoutes;

import java.util.List;

/**
 * REST response DTO for a route query.
 *
 * <pre>
 * {
 *   "status": "ok",
 *   "chain": "wax",
 *   "input": "wax-eosio.token",
 *   "output": "tlm-alien.worlds",
 *   "tradeType": "EXACT_INPUT",
 *   "maxHops": 2,
 *   "routes": [["12"], ["4", "31"]]
 * }
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RouteResponse(
        String status,
        String chain,
        String input,
        String output,
        String tradeType,
        Integer maxHops,
        List<List<String>> routes
) {

    /**
     * Build a response from candidate routes; an empty set yields status {@code no_route}.
     */
    public static RouteResponse of(CandidateRoutes candidates) {
        List<List<String>> poolIds = candidates.routes().stream().map(Route::poolIds).toList();
        return new RouteResponse(candidates.isEmpty() ? "no_route" : "ok",
                candidates.chain(),
                candidates.input().id(),
                candidates.output().id(),
                candidates.tradeType().name(),
                candidates.maxHops(),
                poolIds);
    }

    public static RouteResponse error(String message) {
        return new RouteResponse("error: " + message, null, null, null, null, null, List.of());
    }
}
