package com.zielonka.algorithm;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.zielonka.parity.ParityGame;
import com.zielonka.parity.Player;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Queue;
import java.util.Set;

/**
 * Computes attractors inside subgames of a fixed parity game.
 *
 * <p>The attractor of a target for a player is the least superset of the target containing every
 * state of that player with some successor in the set, and every state of the opponent whose
 * successors all lie in the set. Only states and edges inside the given universe are considered.
 * Each call runs in time linear in the size of the subgame: opponent states keep a counter of
 * successors not yet attracted, so their successor sets are never rescanned.
 */
public final class Attractor<S> {
  private final ParityGame<S> game;
  private final PredecessorIndex<S> index;

  public Attractor(ParityGame<S> game, PredecessorIndex<S> index) {
    this.game = requireNonNull(game);
    this.index = requireNonNull(index);
  }

  public static <S> Attractor<S> of(ParityGame<S> game) {
    return new Attractor<>(game, PredecessorIndex.of(game));
  }

  /**
   * Returns the attractor of {@code target} for {@code player} restricted to {@code universe}. The
   * returned set is a fresh, mutable set owned by the caller.
   *
   * @throws IllegalArgumentException if {@code target} is not a subset of {@code universe}
   */
  public Set<S> attractor(Set<S> universe, Set<S> target, Player player) {
    checkArgument(universe.containsAll(target), "Target is not contained in the universe");
    Player opponent = player.flip();

    Set<S> attractor = new HashSet<>(target);
    Queue<S> queue = new ArrayDeque<>(target);

    // Successors inside the universe which are not yet attracted
    Object2IntMap<S> remaining = new Object2IntOpenHashMap<>();
    for (S state : universe) {
      if (game.owner(state) != opponent || attractor.contains(state)) {
        continue;
      }
      int successors = (int) game.successors(state).distinct().filter(universe::contains).count();
      if (successors == 0) {
        // The opponent cannot move inside the universe at all
        attractor.add(state);
        queue.add(state);
      } else {
        remaining.put(state, successors);
      }
    }

    while (!queue.isEmpty()) {
      S state = queue.poll();
      for (S predecessor : index.predecessors(state)) {
        if (!universe.contains(predecessor) || attractor.contains(predecessor)) {
          continue;
        }
        if (game.owner(predecessor) == player) {
          attractor.add(predecessor);
          queue.add(predecessor);
        } else {
          int count = remaining.getInt(predecessor);
          assert count > 0;
          remaining.put(predecessor, count - 1);
          if (count == 1) {
            attractor.add(predecessor);
            queue.add(predecessor);
          }
        }
      }
    }
    assert universe.containsAll(attractor);
    return attractor;
  }
}
