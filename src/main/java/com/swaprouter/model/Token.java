package com.swaprouter.model;

/**
 * Immutable token descriptor as referenced by a liquidity pool.
 *
 * @param id       Token identifier, unique per chain (e.g., "wax-eosio.token")
 * @param symbol   Display symbol (e.g., "WAX")
 * @param decimals Number of decimal places of the on-chain amount
 */
public record Token(String id, String symbol, int decimals) {

    public Token {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Token id must not be blank");
        if (decimals < 0) throw new IllegalArgumentException("Decimals must be non-negative");
    }
}
