package com.zielonka.algorithm;

import static com.google.common.base.Verify.verify;

import com.google.common.base.Stopwatch;
import com.zielonka.parity.ParityGame;
import com.zielonka.parity.Player;
import com.zielonka.parity.Solution;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Solves parity games with Zielonka's recursive algorithm under the max-parity condition: {@link
 * Player#EVEN} wins a play iff the highest priority occurring infinitely often is even.
 *
 * <p>The solver is stateless, every call to {@link #solve(ParityGame)} owns its own predecessor
 * index, attractor counters and working sets.
 */
public final class ZielonkaSolver {
  private static final Logger logger = Logger.getLogger(ZielonkaSolver.class.getName());

  public record Statistics(int recursiveCalls, int attractorComputations, Duration elapsed) {}

  public record Result<S>(Solution<S> solution, Statistics statistics) {}

  public ZielonkaSolver() {}

  /**
   * Computes the winning regions of both players.
   *
   * @throws com.zielonka.parity.InvalidGameException if the game is malformed
   * @throws com.google.common.base.VerifyException if the computed regions do not partition the
   *     states of the game, which indicates a bug in the solver
   */
  public <S> Solution<S> solve(ParityGame<S> game) {
    return solveWithStatistics(game).solution();
  }

  public <S> Result<S> solveWithStatistics(ParityGame<S> game) {
    Stopwatch timer = Stopwatch.createStarted();
    Run<S> run = new Run<>(game);
    Regions<S> regions = run.solve(new HashSet<>(game.states()));

    Set<S> even = regions.region(Player.EVEN);
    Set<S> odd = regions.region(Player.ODD);
    verify(even.size() + odd.size() == game.states().size(),
        "Regions have %s + %s states, game has %s", even.size(), odd.size(), game.states().size());
    for (S state : game.states()) {
      verify(even.contains(state) != odd.contains(state), "State %s is not won by exactly one player", state);
    }

    Statistics statistics = new Statistics(run.recursiveCalls, run.attractorComputations, timer.elapsed());
    logger.log(Level.FINE, () -> "Solved game with %d states in %s (%d recursive calls, %d attractors)"
        .formatted(game.states().size(), timer, statistics.recursiveCalls(), statistics.attractorComputations()));
    return new Result<>(new Solution<>(even, odd), statistics);
  }

  private record Regions<S>(Set<S> even, Set<S> odd) {
    static <S> Regions<S> of(Player player, Set<S> playerRegion, Set<S> opponentRegion) {
      return player == Player.EVEN
          ? new Regions<>(playerRegion, opponentRegion)
          : new Regions<>(opponentRegion, playerRegion);
    }

    Set<S> region(Player player) {
      return player == Player.EVEN ? even : odd;
    }
  }

  private static final class Run<S> {
    private final ParityGame<S> game;
    private final Attractor<S> attractor;
    private int recursiveCalls = 0;
    private int attractorComputations = 0;

    Run(ParityGame<S> game) {
      this.game = game;
      this.attractor = new Attractor<>(game, PredecessorIndex.of(game));
    }

    // Sets passed in and returned are never modified afterwards
    Regions<S> solve(Set<S> area) {
      recursiveCalls += 1;
      if (area.isEmpty()) {
        return new Regions<>(Set.of(), Set.of());
      }

      int maximalPriority = area.stream().mapToInt(game::priority).max().orElseThrow();
      if (maximalPriority == 0) {
        return Regions.of(Player.EVEN, area, Set.of());
      }

      Player player = Player.favoredBy(maximalPriority);
      Player opponent = player.flip();
      Set<S> maximalStates = area.stream()
          .filter(state -> game.priority(state) == maximalPriority)
          .collect(Collectors.toSet());

      Set<S> playerAttractor = attractor(area, maximalStates, player);
      assert !playerAttractor.isEmpty();
      Regions<S> subSolution = solve(difference(area, playerAttractor));
      if (subSolution.region(opponent).isEmpty()) {
        return Regions.of(player, area, Set.of());
      }

      Set<S> opponentAttractor = attractor(area, subSolution.region(opponent), opponent);
      Regions<S> remainder = solve(difference(area, opponentAttractor));
      Set<S> opponentRegion = new HashSet<>(remainder.region(opponent));
      opponentRegion.addAll(opponentAttractor);
      return Regions.of(player, remainder.region(player), opponentRegion);
    }

    private Set<S> attractor(Set<S> universe, Set<S> target, Player player) {
      attractorComputations += 1;
      return attractor.attractor(universe, target, player);
    }

    private static <S> Set<S> difference(Set<S> set, Set<S> remove) {
      Set<S> difference = new HashSet<>(set);
      difference.removeAll(remove);
      return difference;
    }
  }
}
