package com.zielonka;

import static picocli.CommandLine.Command;
import static picocli.CommandLine.Option;

import com.google.common.base.Stopwatch;
import com.google.common.collect.MapDifference;
import com.google.common.collect.Maps;
import com.zielonka.algorithm.ZielonkaSolver;
import com.zielonka.output.DotWriter;
import com.zielonka.output.SolutionWriter;
import com.zielonka.parity.ExplicitParityGame;
import com.zielonka.parity.InvalidGameException;
import com.zielonka.parity.Player;
import com.zielonka.parity.Solution;
import com.zielonka.parser.PgSolverParser;
import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.BiConsumer;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import picocli.CommandLine;

@Command(
    name = "zielonka",
    mixinStandardHelpOptions = true,
    version = "Zielonka Parity Game Solver 0.1",
    description = "Computes the winning regions of parity games given in PGSolver format")
public final class Main implements Callable<Integer> {
    private static final Logger log = Logger.getLogger(Main.class.getName());
    private static final Logger projectLogger = Logger.getLogger("com.zielonka");
    private static final ConsoleHandler verboseHandler = new ConsoleHandler();

    static {
        verboseHandler.setLevel(Level.FINE);
    }

    private static PrintStream open(String output) throws IOException {
        return "-".equals(output)
            ? new PrintStream(System.out, false, StandardCharsets.UTF_8) {
                @Override
                public void close() {
                    flush();
                }
            }
            : new PrintStream(new BufferedOutputStream(Files.newOutputStream(Path.of(output))), false,
                StandardCharsets.UTF_8);
    }

    private static BufferedReader read(String input) throws IOException {
        return "-".equals(input)
            ? new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))
            : Files.newBufferedReader(Path.of(input));
    }

    private static <S> void writeIfPresent(@Nullable String output, S object, BiConsumer<S, PrintStream> formatter)
        throws IOException {
        if (output != null) {
            try (var stream = open(output)) {
                formatter.accept(object, stream);
            }
        }
    }

    @Option(
        names = {"--game"},
        description = "Source file in PGSolver format, - for standard input (default: ${DEFAULT-VALUE})")
    private String game = "-";

    @Option(
        names = {"-O", "--output"},
        description = "Write the winning regions (default: ${DEFAULT-VALUE})")
    private String writeOutput = "-";

    @Option(
        names = {"--format"},
        description = "Output format. Valid: ${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE}")
    private SolutionWriter.Format format = SolutionWriter.Format.PGSOLVER;

    @Nullable
    @Option(
        names = {"--write-dot"},
        description = "Write the solved game in dot format")
    private String writeDot;

    @Nullable
    @Option(
        names = {"--expected"},
        description = "Compare the winners with a solution file in PGSolver format")
    private String expected;

    @Option(
        names = {"-v", "--verbose"},
        description = "Log solver statistics")
    private boolean verbose = false;

    private Main() {}

    static CommandLine commandLine() {
        return new CommandLine(new Main()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    @Override
    public Integer call() {
        if (verbose) {
            projectLogger.setLevel(Level.FINE);
            projectLogger.setUseParentHandlers(false);
            // Registered at most once per JVM
            projectLogger.removeHandler(verboseHandler);
            projectLogger.addHandler(verboseHandler);
        }

        ExplicitParityGame<Integer> parityGame;
        try {
            parityGame = parseGame();
        } catch (InvalidGameException e) {
            log.log(Level.FINE, "Rejected input", e);
            System.err.println("Invalid game: " + e.getMessage());
            return 1;
        } catch (IOException | UncheckedIOException e) {
            log.log(Level.FINE, "Failed to read input", e);
            System.err.println("Could not read game: " + e.getMessage());
            return 1;
        }

        var result = new ZielonkaSolver().solveWithStatistics(parityGame);
        Solution<Integer> solution = result.solution();
        log.log(Level.INFO, () -> "Solving took %s, even wins %d states, odd wins %d states".formatted(
            result.statistics().elapsed(), solution.evenWinning().size(), solution.oddWinning().size()));

        try {
            writeIfPresent(writeDot, solution, (s, stream) -> DotWriter.writeGame(parityGame, stream, s));
            try (var stream = open(writeOutput)) {
                SolutionWriter.write(solution, format, stream);
            }
        } catch (IOException | UncheckedIOException e) {
            log.log(Level.FINE, "Failed to write output", e);
            System.err.println("Could not write output: " + e.getMessage());
            return 1;
        }

        if (expected != null) {
            Map<Integer, Player> expectedWinners;
            try (BufferedReader reader = read(expected)) {
                expectedWinners = PgSolverParser.parseSolution(reader);
            } catch (InvalidGameException e) {
                log.log(Level.FINE, "Rejected expected solution", e);
                System.err.println("Invalid solution file: " + e.getMessage());
                return 1;
            } catch (IOException | UncheckedIOException e) {
                log.log(Level.FINE, "Failed to read expected solution", e);
                System.err.println("Could not read solution file: " + e.getMessage());
                return 1;
            }
            return validate(solution, expectedWinners) ? 0 : 1;
        }
        return 0;
    }

    private ExplicitParityGame<Integer> parseGame() throws IOException {
        try (BufferedReader reader = read(game)) {
            Stopwatch timer = Stopwatch.createStarted();
            var parityGame = PgSolverParser.parseGame(reader);
            log.log(Level.INFO, () -> "Read %s in %s".formatted(parityGame, timer));
            return parityGame;
        }
    }

    private static boolean validate(Solution<Integer> solution, Map<Integer, Player> expectedWinners) {
        MapDifference<Integer, Player> difference = Maps.difference(solution.asMap(), expectedWinners);
        if (difference.areEqual()) {
            return true;
        }
        System.err.println("Validation failed!");
        difference.entriesDiffering().forEach((state, winners) -> System.err.printf(
            "State %d: computed %s, expected %s%n", state, winners.leftValue(), winners.rightValue()));
        difference.entriesOnlyOnLeft().keySet().forEach(state -> System.err.printf(
            "State %d: missing in expected solution%n", state));
        difference.entriesOnlyOnRight().keySet().forEach(state -> System.err.printf(
            "State %d: not part of the game%n", state));
        return false;
    }
}
