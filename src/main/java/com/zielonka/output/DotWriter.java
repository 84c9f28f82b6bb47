package com.zielonka.output;

import com.zielonka.parity.ExplicitParityGame;
import com.zielonka.parity.ParityGame;
import com.zielonka.parity.Player;
import com.zielonka.parity.Solution;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import java.io.PrintStream;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

public final class DotWriter {
    private static final Pattern ESCAPE = Pattern.compile("([\"\\\\])");

    private DotWriter() {
    }

    public static <S> void writeGame(ParityGame<S> game, PrintStream writer) {
        writeGame(game, writer, null);
    }

    /**
     * Writes the game in Graphviz format. Even states are drawn as diamonds, odd states as boxes.
     * If a solution is given, states are filled according to their winner.
     */
    public static <S> void writeGame(ParityGame<S> game, PrintStream writer, @Nullable Solution<S> solution) {
        Object2IntMap<S> ids = new Object2IntOpenHashMap<>();
        game.forEachState(s -> ids.put(s, ids.size()));

        writer.append("digraph {\n");
        for (Object2IntMap.Entry<S> entry : ids.object2IntEntrySet()) {
            S state = entry.getKey();
            String shape = game.owner(state) == Player.EVEN ? "diamond" : "box";
            String style = solution == null ? "" : ",style=filled,fillcolor=%s".formatted(
                solution.winner(state) == Player.EVEN ? "lightblue" : "lightcoral");
            writer.append("S_%d [label=\"%s:%d\",shape=%s%s]\n".formatted(entry.getIntValue(),
                escape(label(game, state)), game.priority(state), shape, style));
        }
        for (Object2IntMap.Entry<S> entry : ids.object2IntEntrySet()) {
            game.successors(entry.getKey()).forEach(successor -> writer.append("S_%d -> S_%d\n"
                .formatted(entry.getIntValue(), ids.getInt(successor))));
        }
        writer.append("}\n");
        writer.flush();
    }

    private static <S> String label(ParityGame<S> game, S state) {
        if (game instanceof ExplicitParityGame<S> explicit) {
            return explicit.name(state).orElse(state.toString());
        }
        return state.toString();
    }

    private static String escape(String string) {
        return ESCAPE.matcher(string).replaceAll("\\\\$1");
    }
}
