package com.swaprouter.registry;

import com.swaprouter.config.SwapRouterProperties;
import com.swaprouter.model.Pool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("HttpPoolSource")
class HttpPoolSourceTest {

    private static final String POOLS_JSON = """
            [
              {
                "id": "12",
                "tokenA": {"id": "wax-eosio.token", "symbol": "WAX", "decimals": 8},
                "tokenB": {"id": "tlm-alien.worlds", "symbol": "TLM", "decimals": 4},
                "fee": 3000,
                "active": true,
                "liquidity": 250000,
                "sqrtPriceX64": 18446744073709551616,
                "tickCurrent": -12,
                "ticks": [{"index": -60, "liquidityNet": 250000, "liquidityGross": 250000}],
                "creator": "ignored by the client"
              }
            ]
            """;

    private MockRestServiceServer server;
    private HttpPoolSource source;

    @BeforeEach
    void setUp() {
        SwapRouterProperties properties = new SwapRouterProperties();
        properties.getPoolSource().setBaseUrl("http://indexer.test/api/v2");

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        source = new HttpPoolSource(builder, properties);
    }

    @Test
    @DisplayName("Reads the chain's pools from the indexer")
    void readsPools() {
        server.expect(requestTo("http://indexer.test/api/v2/wax/pools"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(POOLS_JSON, MediaType.APPLICATION_JSON));

        List<Pool> pools = source.fetchPools("wax");

        assertThat(pools).hasSize(1);
        Pool pool = pools.get(0);
        assertThat(pool.id()).isEqualTo("12");
        assertThat(pool.tokenA().symbol()).isEqualTo("WAX");
        assertThat(pool.liquidity()).isEqualTo(BigInteger.valueOf(250000));
        assertThat(pool.sqrtPriceX64()).isEqualTo(BigInteger.ONE.shiftLeft(64));
        assertThat(pool.ticks()).hasSize(1);
        server.verify();
    }

    @Test
    @DisplayName("Server errors become PoolSourceException")
    void serverErrorIsPoolSourceFailure() {
        server.expect(requestTo("http://indexer.test/api/v2/wax/pools")).andRespond(withServerError());

        assertThatThrownBy(() -> source.fetchPools("wax")).isInstanceOf(PoolSourceException.class);
    }

    @Test
    @DisplayName("Malformed JSON becomes PoolSourceException")
    void malformedBodyIsPoolSourceFailure() {
        server.expect(requestTo("http://indexer.test/api/v2/wax/pools"))
                .andRespond(withSuccess("[{\"id\": ", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> source.fetchPools("wax")).isInstanceOf(PoolSourceException.class);
    }
}
