package com.swaprouter.registry;

import com.swaprouter.model.Pool;
import com.swaprouter.model.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.swaprouter.testutil.PoolFixtures.pool;
import static com.swaprouter.testutil.PoolFixtures.token;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TokenResolver")
class TokenResolverTest {

    private static final Token A = token("a-contract");
    private static final Token B = token("b-contract");
    private static final Token C = token("c-contract");

    private final List<Pool> pools = List.of(pool("1", A, B), pool("2", B, C));

    @Test
    @DisplayName("Finds tokens on either side of a pool")
    void findsBothSides() {
        assertThat(TokenResolver.findToken(pools, "a-contract")).contains(A);
        assertThat(TokenResolver.findToken(pools, "c-contract")).contains(C);
    }

    @Test
    @DisplayName("Unknown id is not found")
    void unknownIdNotFound() {
        assertThat(TokenResolver.findToken(pools, "d-contract")).isEmpty();
        assertThat(TokenResolver.findToken(pools, "")).isEmpty();
        assertThat(TokenResolver.findToken(List.of(), "a-contract")).isEmpty();
    }

    @Test
    @DisplayName("When pools disagree about a token, the first match in scan order wins")
    void firstMatchWins() {
        Token first = new Token("b-contract", "B", 4);
        Token second = new Token("b-contract", "B2", 8);
        List<Pool> conflicting = List.of(pool("1", C, first), pool("2", second, A));

        assertThat(TokenResolver.findToken(conflicting, "b-contract")).contains(first);
    }
}
