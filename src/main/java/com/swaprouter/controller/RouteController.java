package com.swaprouter.controller;

import com.swaprouter.model.TradeType;
import com.swaprouter.registry.PoolSourceException;
import com.swaprouter.service.CandidateRoutes;
import com.swaprouter.service.InvalidRouteRequestException;
import com.swaprouter.service.RouteService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * REST controller exposing candidate swap routes.
 *
 * <pre>
 * GET /routes?chain=wax&amp;input=wax-eosio.token&amp;output=tlm-alien.worlds&amp;tradeType=EXACT_INPUT&amp;maxHops=2
 * </pre>
 */
@RestController
@RequestMapping("/routes")
public class RouteController {

    private static final Logger log = LoggerFactory.getLogger(RouteController.class);

    private final RouteService routeService;

    public RouteController(RouteService routeService) {
        this.routeService = routeService;
    }

    /**
     * @param chain     Chain identifier
     * @param input     Id of the token being sold
     * @param output    Id of the token being bought
     * @param tradeType EXACT_INPUT or EXACT_OUTPUT
     * @param maxHops   Optional hop limit, clamped to the configured ceiling
     */
    @GetMapping
    public ResponseEntity<RouteResponse> getRoutes(
            @RequestParam String chain,
            @RequestParam String input,
            @RequestParam String output,
            @RequestParam String tradeType,
            @RequestParam(required = false) Integer maxHops
    ) {
        if (chain.isBlank() || input.isBlank() || output.isBlank()) {
            return ResponseEntity.badRequest().body(RouteResponse.error("chain, input and output must not be blank"));
        }

        Optional<TradeType> parsedTradeType = TradeType.fromLabel(tradeType);
        if (parsedTradeType.isEmpty()) {
            return ResponseEntity.badRequest()
                    .body(RouteResponse.error("Unsupported trade type: " + tradeType
                            + ". Supported: " + String.join(", ", TradeType.supportedLabels())));
        }

        try {
            CandidateRoutes candidates = routeService.findRoutes(chain, input, output, parsedTradeType.get(), maxHops);
            return ResponseEntity.ok(RouteResponse.of(candidates));
        } catch (InvalidRouteRequestException e) {
            log.warn("Invalid route request on chain={}: {}", chain, e.getMessage());
            return ResponseEntity.badRequest().body(RouteResponse.error(e.getMessage()));
        } catch (PoolSourceException e) {
            log.error("Pools unavailable for chain={}", chain, e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(RouteResponse.error("Pools unavailable for chain " + chain));
        }
    }
}
