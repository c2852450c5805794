package com.swaprouter.service;

import com.swaprouter.model.Route;
import com.swaprouter.model.Token;
import com.swaprouter.model.TradeType;

import java.util.List;

/**
 * Answer to a route query: the resolved tokens, the effective hop limit and the candidate
 * routes, ready for best-trade selection.
 */
public record CandidateRoutes(String chain,
                              Token input,
                              Token output,
                              TradeType tradeType,
                              int maxHops,
                              List<Route> routes) {

    public CandidateRoutes {
        routes = List.copyOf(routes);
    }

    public boolean isEmpty() {
        return routes.isEmpty();
    }
}
