package org.boxworld.pddl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.boxworld.pddl.planner.PlannerConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoxWorldTest {

    private final StringWriter out = new StringWriter();

    private int execute(String... args) {
        CommandLine commandLine = new CommandLine(new BoxWorld());
        commandLine.setOut(new PrintWriter(out));
        return commandLine.execute(args);
    }

    private static Path copyResource(String name, Path dir) throws IOException {
        Path target = dir.resolve(name);
        try (InputStream in = BoxWorldTest.class.getResourceAsStream("/org/boxworld/pddl/" + name)) {
            assertNotNull(in, name);
            Files.copy(in, target);
        }
        return target;
    }

    @Test
    void translateWritesProblemFile(@TempDir Path dir) throws IOException {
        Path json = copyResource("demo.json", dir);
        Path expected = copyResource("demo.pddl", dir);
        Path pddl = dir.resolve("out.pddl");

        assertEquals(0, execute("translate", json.toString(), "-o", pddl.toString()));
        assertEquals(Files.readString(expected), Files.readString(pddl));
    }

    @Test
    void translatePrintsToStandardOutput(@TempDir Path dir) throws IOException {
        Path json = copyResource("demo.json", dir);

        assertEquals(0, execute("translate", json.toString()));
        assertEquals(Files.readString(copyResource("demo.pddl", dir)), out.toString().replace("\r\n", "\n"));
    }

    @Test
    void translateWithCheckAcceptsValidProblem(@TempDir Path dir) throws IOException {
        Path json = copyResource("demo.json", dir);

        assertEquals(0, execute("translate", "--check", json.toString()));
        assertTrue(out.toString().startsWith("(define (problem demo)"));
    }

    @Test
    void invalidProblemExitsWithOne(@TempDir Path dir) throws IOException {
        Path json = dir.resolve("bad.json");
        Files.writeString(json, "{\"problem_name\": \"p\", \"locations\": [\"l1\"], \"boxes\": [\"b1\"],"
            + " \"initial_state\": {\"robot_at\": \"l1\", \"stacks\": {}}, \"goal\": {}}");

        assertEquals(BoxWorld.EXIT_INVALID, execute("translate", json.toString()));
        assertEquals("", out.toString());
    }

    @Test
    void missingInputExitsWithTwo(@TempDir Path dir) {
        assertEquals(BoxWorld.EXIT_IO, execute("translate", dir.resolve("absent.json").toString()));
    }

    @Test
    void parsePlanPrintsJson(@TempDir Path dir) throws IOException {
        Path plan = copyResource("plan.txt", dir);

        assertEquals(0, execute("parse-plan", plan.toString()));

        ObjectMapper mapper = new ObjectMapper();
        assertEquals(mapper.readTree("{\"plan\": [{\"unstack\": [\"b1\", \"b2\", \"l1\"]},"
            + " {\"put-down\": [\"b1\", \"l1\"]}], \"cost\": 2}"), mapper.readTree(out.toString()));
    }

    @Test
    void strictParsePlanRejectsNoise(@TempDir Path dir) throws IOException {
        Path plan = dir.resolve("plan.txt");
        Files.writeString(plan, "(a x)\nfound a plan\n", StandardCharsets.UTF_8);

        assertEquals(0, execute("parse-plan", plan.toString()));
        assertEquals(BoxWorld.EXIT_INVALID, execute("parse-plan", "--strict", plan.toString()));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void solveRunsPlannerAndWritesPlan(@TempDir Path dir) throws IOException {
        Path json = copyResource("demo.json", dir);
        Path planner = dir.resolve("planner.sh");
        // with a plan flag the plan path is the 4th argument
        Files.writeString(planner, "#!/bin/sh\ngrep -q 'problem demo' \"$2\" || exit 4\n"
            + "printf '(move l1 l2)\\n; cost = 1\\n' > \"$4\"\n");
        assertTrue(planner.toFile().setExecutable(true));
        Path result = dir.resolve("plan.json");

        assertEquals(0, execute("solve", json.toString(), "--planner", planner.toString(),
            "--plan-flag=--plan", "--out", result.toString()));

        ObjectMapper mapper = new ObjectMapper();
        assertEquals(mapper.readTree("{\"plan\": [{\"move\": [\"l1\", \"l2\"]}], \"cost\": 1}"),
            mapper.readTree(result.toFile()));
    }

    @Test
    void solveOptionsBecomePlannerConfig() {
        SolveCommand command = new SolveCommand();
        new CommandLine(command).parseArgs("in.json", "-p", "ff", "--planner-arg=-s", "--planner-arg", "5",
            "--timeout", "30", "--keep-files");

        PlannerConfig config = command.plannerConfig();
        assertEquals("ff", config.getExecutable());
        assertEquals(List.of("-s", "5"), config.getExtraArguments());
        assertEquals(Duration.ofSeconds(30), config.getTimeout().orElseThrow());
        assertTrue(config.isKeepFiles());
        assertFalse(config.getPlanFlag().isPresent());
        assertFalse(config.getDomainFile().isPresent());
    }
}
