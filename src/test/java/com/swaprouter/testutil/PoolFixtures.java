package com.swaprouter.testutil;

import com.swaprouter.model.Pool;
import com.swaprouter.model.Tick;
import com.swaprouter.model.Token;

import java.math.BigInteger;
import java.util.List;

/**
 * Builders for tokens and pools used across tests.
 */
public final class PoolFixtures {

    public static final Token WAX = token("wax-eosio.token");
    public static final Token TLM = token("tlm-alien.worlds");
    public static final Token USDT = token("usdt-tethertether");
    public static final Token BRWL = token("brwl-brwlbrwlbrwl");

    private PoolFixtures() {
    }

    public static Token token(String id) {
        String symbol = id.substring(0, id.indexOf('-') > 0 ? id.indexOf('-') : id.length()).toUpperCase();
        return new Token(id, symbol, 4);
    }

    public static Pool pool(String id, Token a, Token b) {
        return pool(id, a, b, 1_000_000L);
    }

    public static Pool pool(String id, Token a, Token b, long liquidity) {
        return new Pool(id, a, b, 3000, true, BigInteger.valueOf(liquidity), BigInteger.ONE.shiftLeft(64), 0,
                List.of(new Tick(-60, BigInteger.valueOf(liquidity), BigInteger.valueOf(liquidity)),
                        new Tick(60, BigInteger.valueOf(-liquidity), BigInteger.valueOf(liquidity))));
    }

    public static Pool withoutTicks(String id, Token a, Token b) {
        return new Pool(id, a, b, 3000, true, BigInteger.valueOf(1_000_000L), BigInteger.ONE.shiftLeft(64), 0, List.of());
    }

    public static Pool inactive(String id, Token a, Token b) {
        return new Pool(id, a, b, 3000, false, BigInteger.valueOf(1_000_000L), BigInteger.ONE.shiftLeft(64), 0, List.of());
    }

    public static Pool drained(String id, Token a, Token b) {
        return new Pool(id, a, b, 3000, true, BigInteger.ZERO, BigInteger.ONE.shiftLeft(64), 0, List.of());
    }
}
