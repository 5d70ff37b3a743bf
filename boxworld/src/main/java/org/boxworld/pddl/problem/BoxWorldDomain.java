package org.boxworld.pddl.problem;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Access to the BOX-WORLD domain file shipped on the classpath.
 */
public final class BoxWorldDomain {

    /** Classpath location of the bundled domain. */
    public static final String RESOURCE = "/org/boxworld/pddl/boxworld-domain.pddl";

    private BoxWorldDomain() {
    }

    /**
     * @return the PDDL text of the bundled domain
     */
    public static String text() {
        try (InputStream in = BoxWorldDomain.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
    }

    /**
     * Copies the bundled domain to the given file.
     */
    public static Path writeTo(Path target) throws IOException {
        return Files.writeString(target, text(), StandardCharsets.UTF_8);
    }
}
