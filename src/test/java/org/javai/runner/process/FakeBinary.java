package org.javai.runner.process;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.stream.Stream;

/**
 * Writes small shell scripts that stand in for the analysis binary in tests.
 */
public final class FakeBinary {

    private FakeBinary() {
    }

    /**
     * Creates an executable {@code /bin/sh} script named {@code name} in {@code dir}.
     */
    public static Path script(Path dir, String name, String body) throws IOException {
        Path script = dir.resolve(name);
        Files.writeString(script, "#!/bin/sh\n" + body + "\n");
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwx------"));
        return script;
    }

    /**
     * Counts the lines of a file that a script appends to once per invocation.
     */
    public static long invocations(Path counter) throws IOException {
        if (!Files.exists(counter)) {
            return 0;
        }
        try (Stream<String> lines = Files.lines(counter)) {
            return lines.count();
        }
    }
}
