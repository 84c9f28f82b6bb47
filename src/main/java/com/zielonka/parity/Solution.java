package com.zielonka.parity;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.Set;

/**
 * The winning regions of a solved parity game. Both regions are disjoint and together cover every
 * state of the game.
 */
public record Solution<S>(Set<S> evenWinning, Set<S> oddWinning) {
  public Solution {
    evenWinning = ImmutableSet.copyOf(evenWinning);
    oddWinning = ImmutableSet.copyOf(oddWinning);
    checkArgument(Sets.intersection(evenWinning, oddWinning).isEmpty(), "Winning regions overlap");
  }

  public Set<S> region(Player player) {
    return player == Player.EVEN ? evenWinning : oddWinning;
  }

  public Player winner(S state) {
    if (evenWinning.contains(state)) {
      return Player.EVEN;
    }
    checkArgument(oddWinning.contains(state), "State %s is not part of the solution", state);
    return Player.ODD;
  }

  public Set<S> states() {
    return Sets.union(evenWinning, oddWinning);
  }

  public ImmutableMap<S, Player> asMap() {
    ImmutableMap.Builder<S, Player> builder = ImmutableMap.builderWithExpectedSize(
        evenWinning.size() + oddWinning.size());
    evenWinning.forEach(state -> builder.put(state, Player.EVEN));
    oddWinning.forEach(state -> builder.put(state, Player.ODD));
    return builder.build();
  }
}
