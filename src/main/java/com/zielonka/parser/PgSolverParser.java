package com.zielonka.parser;

import com.google.common.collect.ImmutableMap;
import com.zielonka.parity.ExplicitParityGame;
import com.zielonka.parity.InvalidGameException;
import com.zielonka.parity.Player;
import java.io.BufferedReader;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import javax.annotation.Nullable;

/**
 * Reads games and solutions in the PGSolver text format, which is also understood by oink.
 *
 * <pre>
 * parity 2;
 * 0 3 1 1,2 "init";
 * 1 2 0 0;
 * 2 1 1 2;
 * </pre>
 *
 * <p>Each state line holds the identifier, priority, owner (0 for even, 1 for odd), the comma
 * separated successors and an optional quoted name. The header gives the largest identifier. A
 * solution consists of a {@code paritysol} header followed by {@code <id> <winner>} lines, any
 * strategy entry is ignored.
 */
public final class PgSolverParser {
  private static final Pattern GAME_HEADER = Pattern.compile("parity\\s+(-?\\d+)");
  private static final Pattern SOLUTION_HEADER = Pattern.compile("paritysol\\s+(-?\\d+)");
  private static final Pattern START = Pattern.compile("start\\s+\\d+");
  private static final Pattern STATE = Pattern.compile(
      "(\\d+)\\s+(\\d+)\\s+(\\d+)\\s+(\\d+(?:\\s*,\\s*\\d+)*)(?:\\s+\"([^\"]*)\")?");
  private static final Pattern SOLUTION_ENTRY = Pattern.compile("(\\d+)\\s+(\\d+)(?:\\s+\\d+)?");
  private static final Pattern COMMA_PATTERN = Pattern.compile("\\s*,\\s*");

  private PgSolverParser() {}

  public static ExplicitParityGame<Integer> parseGame(BufferedReader reader) {
    return parseGame(reader.lines());
  }

  /**
   * Parses a game.
   *
   * @throws InvalidGameException if a line is malformed or the described game is invalid
   */
  public static ExplicitParityGame<Integer> parseGame(Stream<String> lines) {
    ExplicitParityGame.Builder<Integer> builder = ExplicitParityGame.builder();
    @Nullable
    Integer maximalId = null;
    int lineNumber = 0;
    boolean first = true;

    Iterator<String> iterator = lines.iterator();
    while (iterator.hasNext()) {
      lineNumber += 1;
      String line = content(iterator.next());
      if (line.isEmpty()) {
        continue;
      }
      if (first) {
        first = false;
        Matcher header = GAME_HEADER.matcher(line);
        if (header.matches()) {
          maximalId = parseInt(header.group(1), lineNumber);
          continue;
        }
      }
      if (START.matcher(line).matches()) {
        continue;
      }

      Matcher matcher = STATE.matcher(line);
      if (!matcher.matches()) {
        throw new InvalidGameException("Line %d: malformed state definition '%s'".formatted(lineNumber, line));
      }
      int id = parseInt(matcher.group(1), lineNumber);
      if (maximalId != null && id > maximalId) {
        throw new InvalidGameException("Line %d: state %d exceeds declared maximum %d"
            .formatted(lineNumber, id, maximalId));
      }
      int priority = parseInt(matcher.group(2), lineNumber);
      Player owner = parseOwner(matcher.group(3), lineNumber);
      try {
        builder.addState(id, owner, priority, matcher.group(5));
      } catch (InvalidGameException e) {
        throw new InvalidGameException("Line %d: %s".formatted(lineNumber, e.getMessage()), e);
      }
      for (String successor : COMMA_PATTERN.split(matcher.group(4))) {
        builder.addEdge(id, parseInt(successor, lineNumber));
      }
    }
    return builder.build();
  }

  public static Map<Integer, Player> parseSolution(BufferedReader reader) {
    return parseSolution(reader.lines());
  }

  /**
   * Parses the winners of a solution file.
   *
   * @throws InvalidGameException if a line is malformed or a state is listed twice
   */
  public static Map<Integer, Player> parseSolution(Stream<String> lines) {
    Map<Integer, Player> winners = new LinkedHashMap<>();
    int lineNumber = 0;
    boolean first = true;

    Iterator<String> iterator = lines.iterator();
    while (iterator.hasNext()) {
      lineNumber += 1;
      String line = content(iterator.next());
      if (line.isEmpty()) {
        continue;
      }
      if (first) {
        first = false;
        if (SOLUTION_HEADER.matcher(line).matches()) {
          continue;
        }
      }
      Matcher matcher = SOLUTION_ENTRY.matcher(line);
      if (!matcher.matches()) {
        throw new InvalidGameException("Line %d: malformed solution entry '%s'".formatted(lineNumber, line));
      }
      int id = parseInt(matcher.group(1), lineNumber);
      if (winners.put(id, parseOwner(matcher.group(2), lineNumber)) != null) {
        throw new InvalidGameException("Line %d: state %d listed twice".formatted(lineNumber, id));
      }
    }
    return ImmutableMap.copyOf(winners);
  }

  private static String content(String line) {
    String stripped = line.strip();
    if (stripped.startsWith("#")) {
      return "";
    }
    if (stripped.endsWith(";")) {
      stripped = stripped.substring(0, stripped.length() - 1).strip();
    }
    return stripped;
  }

  private static int parseInt(String string, int lineNumber) {
    try {
      return Integer.parseInt(string);
    } catch (NumberFormatException e) {
      throw new InvalidGameException("Line %d: invalid number %s".formatted(lineNumber, string), e);
    }
  }

  private static Player parseOwner(String string, int lineNumber) {
    try {
      return Player.of(parseInt(string, lineNumber));
    } catch (IllegalArgumentException e) {
      if (e instanceof InvalidGameException invalid) {
        throw invalid;
      }
      throw new InvalidGameException("Line %d: invalid player %s".formatted(lineNumber, string), e);
    }
  }
}
