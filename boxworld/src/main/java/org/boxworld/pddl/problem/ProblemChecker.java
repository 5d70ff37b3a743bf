package org.boxworld.pddl.problem;

import fr.uga.pddl4j.parser.DefaultParsedProblem;
import fr.uga.pddl4j.parser.ErrorManager;
import fr.uga.pddl4j.parser.Message;
import fr.uga.pddl4j.parser.Parser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Checks an emitted problem by parsing it, together with its domain, with the pddl4j parser.
 *
 * <p>This only catches what the parser catches: syntax errors, undeclared objects or predicates,
 * type mismatches. It says nothing about whether the problem is solvable.</p>
 */
public class ProblemChecker {
    private static final Logger LOGGER = LogManager.getLogger(ProblemChecker.class.getName());

    /**
     * Parses the given domain and problem files.
     *
     * @return the parser errors, empty if both files are accepted
     * @throws IOException if a file cannot be read
     */
    public List<String> check(Path domainFile, Path problemFile) throws IOException {
        Parser parser = new Parser();
        DefaultParsedProblem parsed;
        try {
            parsed = parser.parse(domainFile.toFile(), problemFile.toFile());
        } catch (RuntimeException e) {
            LOGGER.debug("pddl4j parser failed on {}", problemFile, e);
            return Collections.singletonList("parser failure: " + e.getMessage());
        }

        List<String> errors = new ArrayList<>();
        ErrorManager errorManager = parser.getErrorManager();
        for (Message message : errorManager.getMessages()) {
            if (message.getType() == Message.Type.PARSER_WARNING) {
                LOGGER.debug("pddl4j warning: {}", message);
            } else {
                errors.add(message.toString());
            }
        }
        if (parsed == null && errors.isEmpty()) {
            errors.add("parser returned no problem");
        }
        return errors;
    }

    /**
     * Parses the given problem text against the bundled BOX-WORLD domain.
     *
     * @return the parser errors, empty if the problem is accepted
     */
    public List<String> check(String problemText) throws IOException {
        Path dir = Files.createTempDirectory("boxworld-check");
        Path domainFile = dir.resolve("domain.pddl");
        Path problemFile = dir.resolve("problem.pddl");
        try {
            BoxWorldDomain.writeTo(domainFile);
            Files.writeString(problemFile, problemText + "\n", StandardCharsets.UTF_8);
            List<String> errors = check(domainFile, problemFile);
            LOGGER.info("pddl4j check: {} error(s)", errors.size());
            return errors;
        } finally {
            deleteQuietly(problemFile, domainFile, dir);
        }
    }

    /**
     * Removes the check files. A failure here is logged so that it never hides the check result.
     */
    private static void deleteQuietly(Path... paths) {
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                LOGGER.warn("Cannot remove {}: {}", path, e.getMessage());
            }
        }
    }
}
