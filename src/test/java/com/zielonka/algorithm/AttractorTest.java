package com.zielonka.algorithm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.zielonka.TestGames;
import com.zielonka.parity.ExplicitParityGame;
import com.zielonka.parity.Player;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AttractorTest {

    /*
     * 0 (even) -> 1, 2
     * 1 (odd)  -> 2, 3
     * 2 (even) -> 2
     * 3 (odd)  -> 3, 4
     * 4 (even) -> 4
     */
    private ExplicitParityGame<Integer> game;
    private Attractor<Integer> attractor;
    private Set<Integer> all;

    @BeforeEach
    void setUp() {
        game = ExplicitParityGame.<Integer>builder()
            .addState(0, Player.EVEN, 0)
            .addState(1, Player.ODD, 1)
            .addState(2, Player.EVEN, 2)
            .addState(3, Player.ODD, 3)
            .addState(4, Player.EVEN, 4)
            .addEdge(0, 1).addEdge(0, 2)
            .addEdge(1, 2).addEdge(1, 3)
            .addEdge(2, 2)
            .addEdge(3, 3).addEdge(3, 4)
            .addEdge(4, 4)
            .build();
        attractor = Attractor.of(game);
        all = game.states();
    }

    @Nested
    @DisplayName("attractor()")
    class Examples {

        @Test
        @DisplayName("should add own states with one edge into the target")
        void shouldAttractOwnStates() {
            assertEquals(Set.of(0, 2), attractor.attractor(all, Set.of(2), Player.EVEN));
        }

        @Test
        @DisplayName("should add opponent states only once all their edges lead into the set")
        void shouldAttractOpponentStatesUniversally() {
            // 0 can still escape to 2
            assertEquals(Set.of(1, 3), attractor.attractor(all, Set.of(3), Player.ODD));
            assertEquals(Set.of(0, 1, 2, 3), attractor.attractor(all, Set.of(2, 3), Player.ODD));
        }

        @Test
        @DisplayName("should ignore edges leaving the universe")
        void shouldRestrictToUniverse() {
            // Without 3, the only remaining successor of 1 is 2
            Set<Integer> universe = Set.of(0, 1, 2);
            assertEquals(Set.of(0, 1, 2), attractor.attractor(universe, Set.of(2), Player.EVEN));
            // Odd stays in 3 forever
            assertEquals(Set.of(4), attractor.attractor(Set.of(3, 4), Set.of(4), Player.EVEN));
        }

        @Test
        @DisplayName("should return the universe if the target is the universe")
        void shouldReturnUniverse() {
            assertEquals(all, attractor.attractor(all, all, Player.EVEN));
            assertEquals(all, attractor.attractor(all, all, Player.ODD));
        }

        @Test
        @DisplayName("should attract opponent states which cannot move inside the universe")
        void shouldAttractStuckOpponent() {
            // Inside {1, 4} the odd state 1 has no successor at all
            assertEquals(Set.of(1), attractor.attractor(Set.of(1, 4), Set.of(), Player.EVEN));
            assertEquals(Set.of(), attractor.attractor(Set.of(1, 4), Set.of(), Player.ODD));
        }

        @Test
        @DisplayName("should reject a target outside the universe")
        void shouldRejectTargetOutsideUniverse() {
            assertThrows(IllegalArgumentException.class,
                () -> attractor.attractor(Set.of(0, 1), Set.of(4), Player.EVEN));
        }

        @Test
        @DisplayName("should not modify its arguments")
        void shouldNotModifyArguments() {
            Set<Integer> universe = new HashSet<>(all);
            Set<Integer> target = new HashSet<>(Set.of(2));
            attractor.attractor(universe, target, Player.EVEN);
            assertEquals(all, universe);
            assertEquals(Set.of(2), target);
        }
    }

    @Nested
    @DisplayName("closure on random subgames")
    class Closure {

        @Test
        @DisplayName("should equal the least fixed point and be idempotent")
        void shouldBeLeastClosedSet() {
            Random random = new Random(7);
            for (int round = 0; round < 200; round++) {
                ExplicitParityGame<Integer> randomGame = TestGames.random(random, 2 + random.nextInt(25), 4, 3);
                Attractor<Integer> randomAttractor = Attractor.of(randomGame);
                Set<Integer> universe = randomGame.states().stream()
                    .filter(s -> random.nextInt(4) != 0)
                    .collect(Collectors.toSet());
                Set<Integer> target = universe.stream()
                    .filter(s -> random.nextInt(5) == 0)
                    .collect(Collectors.toSet());
                Player player = random.nextBoolean() ? Player.EVEN : Player.ODD;

                Set<Integer> result = randomAttractor.attractor(universe, target, player);
                assertTrue(result.containsAll(target));
                assertTrue(universe.containsAll(result));
                assertClosed(randomGame, universe, target, player, result);
                assertEquals(naiveAttractor(randomGame, universe, target, player), result);
                assertEquals(result, randomAttractor.attractor(universe, result, player));
            }
        }
    }

    private static boolean attracted(ExplicitParityGame<Integer> game, Set<Integer> universe, Set<Integer> set,
        Player player, Integer state) {
        Set<Integer> successors = game.successorSet(state).stream()
            .filter(universe::contains)
            .collect(Collectors.toSet());
        return game.owner(state) == player
            ? successors.stream().anyMatch(set::contains)
            : set.containsAll(successors);
    }

    private static void assertClosed(ExplicitParityGame<Integer> game, Set<Integer> universe, Set<Integer> target,
        Player player, Set<Integer> result) {
        for (Integer state : universe) {
            if (!target.contains(state)) {
                assertEquals(result.contains(state), attracted(game, universe, result, player, state),
                    "State " + state);
            }
        }
    }

    private static Set<Integer> naiveAttractor(ExplicitParityGame<Integer> game, Set<Integer> universe,
        Set<Integer> target, Player player) {
        Set<Integer> result = new HashSet<>(target);
        boolean changed = true;
        while (changed) {
            Set<Integer> added = universe.stream()
                .filter(s -> !result.contains(s))
                .filter(s -> attracted(game, universe, result, player, s))
                .collect(Collectors.toSet());
            changed = result.addAll(added);
        }
        return result;
    }
}
