package com.swaprouter.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static com.swaprouter.testutil.PoolFixtures.TLM;
import static com.swaprouter.testutil.PoolFixtures.USDT;
import static com.swaprouter.testutil.PoolFixtures.WAX;
import static com.swaprouter.testutil.PoolFixtures.drained;
import static com.swaprouter.testutil.PoolFixtures.inactive;
import static com.swaprouter.testutil.PoolFixtures.pool;
import static com.swaprouter.testutil.PoolFixtures.withoutTicks;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Pool")
class PoolTest {

    @Test
    @DisplayName("otherToken returns the opposite side of the pair")
    void otherToken() {
        Pool pool = pool("1", WAX, TLM);
        assertThat(pool.otherToken(WAX)).isEqualTo(TLM);
        assertThat(pool.otherToken(TLM)).isEqualTo(WAX);
    }

    @Test
    @DisplayName("Only active pools with positive liquidity are live")
    void liveness() {
        assertThat(pool("1", WAX, TLM).isLive()).isTrue();
        assertThat(inactive("2", WAX, TLM).isLive()).isFalse();
        assertThat(drained("3", WAX, TLM).isLive()).isFalse();
    }

    @Test
    @DisplayName("Pools without initialized ticks are not routable")
    void routability() {
        assertThat(pool("1", WAX, TLM).isRoutable()).isTrue();
        assertThat(withoutTicks("2", WAX, TLM).isRoutable()).isFalse();
    }

    @Test
    @DisplayName("Throws if id is blank")
    void throwsOnBlankId() {
        assertThatThrownBy(() -> new Pool(" ", WAX, TLM, 3000, true, BigInteger.ONE, BigInteger.ONE, 0, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Throws if liquidity is negative")
    void throwsOnNegativeLiquidity() {
        assertThatThrownBy(() -> new Pool("1", WAX, TLM, 3000, true, BigInteger.valueOf(-1), BigInteger.ONE, 0, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Route exposes its pool ids in order")
    void routePoolIds() {
        Route route = new Route(WAX, USDT, List.of(pool("7", WAX, TLM), pool("3", TLM, USDT)));
        assertThat(route.poolIds()).containsExactly("7", "3");
        assertThat(route.hops()).isEqualTo(2);
    }

    @Test
    @DisplayName("Route without pools is rejected")
    void emptyRouteRejected() {
        assertThatThrownBy(() -> new Route(WAX, TLM, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
