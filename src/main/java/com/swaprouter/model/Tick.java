package com.swaprouter.model;

import java.math.BigInteger;

/**
 * Initialized tick of a concentrated-liquidity pool.
 *
 * @param index          Tick index
 * @param liquidityNet   Net liquidity change when the tick is crossed left to right
 * @param liquidityGross Total liquidity referencing this tick
 */
public record Tick(int index, BigInteger liquidityNet, BigInteger liquidityGross) {

    public Tick {
        if (liquidityNet == null) liquidityNet = BigInteger.ZERO;
        if (liquidityGross == null) liquidityGross = BigInteger.ZERO;
    }
}
