package com.zielonka.output;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.zielonka.parity.Solution;
import com.zielonka.parser.PgSolverParser;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SolutionWriterTest {

    private final Solution<Integer> solution = new Solution<>(Set.of(3, 0), Set.of(2, 1));

    private static String write(Solution<Integer> solution, SolutionWriter.Format format) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (PrintStream stream = new PrintStream(bytes, false, StandardCharsets.UTF_8)) {
            SolutionWriter.write(solution, format, stream);
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("PGSolver output lists every state sorted by id")
    void pgSolverFormat() {
        assertEquals("paritysol 3;\n0 0;\n1 1;\n2 1;\n3 0;\n", write(solution, SolutionWriter.Format.PGSOLVER));
        assertEquals("paritysol -1;\n", write(new Solution<>(Set.of(), Set.of()), SolutionWriter.Format.PGSOLVER));
    }

    @Test
    @DisplayName("PGSolver output is read back by the parser")
    void pgSolverReadBack() {
        String output = write(solution, SolutionWriter.Format.PGSOLVER);
        assertEquals(solution.asMap(), PgSolverParser.parseSolution(output.lines()));
    }

    @Test
    @DisplayName("JSON output holds both regions as sorted arrays")
    void jsonFormat() {
        JsonObject json = JsonParser.parseString(write(solution, SolutionWriter.Format.JSON)).getAsJsonObject();
        JsonArray even = new JsonArray();
        even.add(0);
        even.add(3);
        JsonArray odd = new JsonArray();
        odd.add(1);
        odd.add(2);
        assertEquals(even, json.getAsJsonArray("even"));
        assertEquals(odd, json.getAsJsonArray("odd"));
        assertEquals(json, SolutionWriter.toJson(solution));
    }
}
