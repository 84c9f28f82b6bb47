package com.zielonka.output;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.zielonka.parity.Player;
import com.zielonka.parity.Solution;
import java.io.PrintStream;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

public final class SolutionWriter {
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private SolutionWriter() {
    }

    public enum Format {
        PGSOLVER, JSON
    }

    public static void write(Solution<Integer> solution, Format format, PrintStream writer) {
        switch (format) {
            case PGSOLVER -> writePgSolver(solution, writer);
            case JSON -> writeJson(solution, writer);
            default -> throw new AssertionError(format);
        }
    }

    /** Writes {@code paritysol <max-id>;} followed by one {@code <id> <winner>;} line per state. */
    public static void writePgSolver(Solution<Integer> solution, PrintStream writer) {
        List<Integer> states = sorted(solution.states());
        int maximalId = states.isEmpty() ? -1 : states.get(states.size() - 1);
        writer.append("paritysol ").append(String.valueOf(maximalId)).append(";\n");
        for (Integer state : states) {
            writer.append(String.valueOf(state)).append(' ')
                .append(String.valueOf(solution.winner(state).id())).append(";\n");
        }
        writer.flush();
    }

    public static void writeJson(Solution<Integer> solution, PrintStream writer) {
        writer.println(GSON.toJson(toJson(solution)));
        writer.flush();
    }

    public static JsonObject toJson(Solution<Integer> solution) {
        JsonObject object = new JsonObject();
        for (Player player : Player.values()) {
            JsonArray region = new JsonArray();
            sorted(solution.region(player)).forEach(region::add);
            object.add(player.name().toLowerCase(), region);
        }
        return object;
    }

    private static List<Integer> sorted(Collection<Integer> states) {
        return states.stream().sorted(Comparator.naturalOrder()).toList();
    }
}
