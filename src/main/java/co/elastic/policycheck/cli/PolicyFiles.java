package co.elastic.policycheck.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

final class PolicyFiles {
    private PolicyFiles() {}

    static byte[] read(String location) throws IOException {
        if ("-".equals(location)) {
            return System.in.readAllBytes();
        }
        return Files.readAllBytes(Path.of(location));
    }
}
