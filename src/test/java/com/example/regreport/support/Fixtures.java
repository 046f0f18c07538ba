package com.example.regreport.support;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.stream.Stream;

/**
 * Copies the CSV fixture set of the third quarter of 2025 into a scratch directory.
 */
public final class Fixtures {

    public static final String Q3_2025 = "/fixtures/q3-2025";

    private Fixtures() {
    }

    public static Path copyTo(Path target) {
        try {
            URL resource = Fixtures.class.getResource(Q3_2025);
            if (resource == null) {
                throw new IllegalStateException("Fixture directory missing from classpath: " + Q3_2025);
            }
            Path source = Path.of(resource.toURI());
            try (Stream<Path> files = Files.list(source)) {
                for (Path file : files.toList()) {
                    Files.copy(file, target.resolve(file.getFileName().toString()),
                            StandardCopyOption.REPLACE_EXISTING);
                }
            }
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Drop every line of the file that contains the given text.
     */
    public static void removeLines(Path file, String containing) {
        try {
            String kept = String.join("\n", Files.readAllLines(file).stream()
                    .filter(line -> !line.contains(containing))
                    .toList()) + "\n";
            Files.writeString(file, kept);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
