package co.elastic.policycheck.support;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Access to the policy dumps under {@code src/test/resources/policies}.
 */
public final class PolicyTestSupport {
    private PolicyTestSupport() {}

    public static Path policiesDirectory() {
        return Path.of("src", "test", "resources", "policies").toAbsolutePath();
    }

    public static String policy(String fileName) {
        try {
            return Files.readString(policiesDirectory().resolve(fileName), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static byte[] policyBytes(String fileName) {
        return policy(fileName).getBytes(StandardCharsets.UTF_8);
    }
}
