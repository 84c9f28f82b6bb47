package com.zielonka.algorithm;

import com.google.common.collect.ImmutableSetMultimap;
import com.zielonka.parity.InvalidGameException;
import com.zielonka.parity.ParityGame;
import java.util.Iterator;
import java.util.Set;

/**
 * Reverse successor relation of a parity game. Building the index also checks the structural
 * requirements of the game, so an index only exists for well-formed games.
 */
public final class PredecessorIndex<S> {
  private final ImmutableSetMultimap<S, S> predecessors;

  private PredecessorIndex(ImmutableSetMultimap<S, S> predecessors) {
    this.predecessors = predecessors;
  }

  /**
   * Builds the index in a single pass over all edges.
   *
   * @throws InvalidGameException if a state has no successor, a successor is not a state of the
   *     game, or a priority is negative
   */
  public static <S> PredecessorIndex<S> of(ParityGame<S> game) {
    Set<S> states = game.states();
    ImmutableSetMultimap.Builder<S, S> builder = ImmutableSetMultimap.builder();
    for (S state : states) {
      if (game.priority(state) < 0) {
        throw new InvalidGameException("State %s has negative priority %d".formatted(state, game.priority(state)));
      }
      Iterator<S> successors = game.successors(state).iterator();
      if (!successors.hasNext()) {
        throw new InvalidGameException("State %s has no successor".formatted(state));
      }
      while (successors.hasNext()) {
        S successor = successors.next();
        if (!states.contains(successor)) {
          throw new InvalidGameException("Successor %s of state %s is not part of the game".formatted(successor, state));
        }
        builder.put(successor, state);
      }
    }
    return new PredecessorIndex<>(builder.build());
  }

  /** All states with an edge into {@code state}; empty for states without predecessors. */
  public Set<S> predecessors(S state) {
    return predecessors.get(state);
  }

  public int edgeCount() {
    return predecessors.size();
  }
}
