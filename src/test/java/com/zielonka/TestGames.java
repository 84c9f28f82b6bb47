package com.zielonka;

import com.zielonka.parity.ExplicitParityGame;
import com.zielonka.parity.ParityGame;
import com.zielonka.parity.Player;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Game factories shared by the tests.
 */
public final class TestGames {
    private TestGames() {
    }

    /** A game with states {@code 0 .. size - 1}, each with between one and {@code maxDegree} successors. */
    public static ExplicitParityGame<Integer> random(Random random, int size, int maxPriority, int maxDegree) {
        ExplicitParityGame.Builder<Integer> builder = ExplicitParityGame.builder();
        for (int state = 0; state < size; state++) {
            builder.addState(state, random.nextBoolean() ? Player.EVEN : Player.ODD, random.nextInt(maxPriority + 1));
        }
        for (int state = 0; state < size; state++) {
            int degree = 1 + random.nextInt(maxDegree);
            for (int i = 0; i < degree; i++) {
                builder.addEdge(state, random.nextInt(size));
            }
        }
        return builder.build();
    }

    public static ExplicitParityGame<Integer> selfLoop(Player owner, int priority) {
        return ExplicitParityGame.<Integer>builder()
            .addState(0, owner, priority)
            .addEdge(0, 0)
            .build();
    }

    /** Builder for games which are not validated, used to feed malformed games to the solver. */
    public static UncheckedGame unchecked() {
        return new UncheckedGame();
    }

    public static final class UncheckedGame implements ParityGame<Integer> {
        private final Map<Integer, Player> owners = new LinkedHashMap<>();
        private final Map<Integer, Integer> priorities = new LinkedHashMap<>();
        private final Map<Integer, Set<Integer>> successors = new LinkedHashMap<>();

        private UncheckedGame() {
        }

        public UncheckedGame state(int state, Player owner, int priority, Integer... successors) {
            owners.put(state, owner);
            priorities.put(state, priority);
            this.successors.put(state, new HashSet<>(Set.of(successors)));
            return this;
        }

        @Override
        public Set<Integer> states() {
            return owners.keySet();
        }

        @Override
        public Stream<Integer> successors(Integer state) {
            return successors.get(state).stream();
        }

        @Override
        public int priority(Integer state) {
            return priorities.get(state);
        }

        @Override
        public Player owner(Integer state) {
            return owners.get(state);
        }
    }
}
