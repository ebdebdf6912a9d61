package co.elastic.policycheck.fixture;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads policies from a directory of dumps named after the policy id ({@code <id>.yml}, {@code <id>.yaml}
 * or {@code <id>.json}).
 */
public final class DirectoryPolicySource implements PolicySource {
    private static final List<String> EXTENSIONS = List.of(".yml", ".yaml", ".json");

    private final Path directory;

    public DirectoryPolicySource(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
    }

    public Path directory() {
        return directory;
    }

    @Override
    public byte[] downloadPolicy(String policyId) throws IOException {
        if (policyId == null || policyId.isBlank() || policyId.contains("/") || policyId.contains("\\")) {
            throw new IllegalArgumentException("Invalid policy id: " + policyId);
        }
        for (String extension : EXTENSIONS) {
            Path candidate = directory.resolve(policyId + extension);
            if (Files.isRegularFile(candidate)) {
                return Files.readAllBytes(candidate);
            }
        }
        throw new NoSuchFileException(directory.resolve(policyId + EXTENSIONS.get(0)).toString(), null,
            "no dump for policy " + policyId + " in " + directory);
    }
}
