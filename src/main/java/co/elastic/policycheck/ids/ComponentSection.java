package co.elastic.policycheck.ids;

import java.util.List;
import java.util.Optional;

/**
 * Top-level policy sections whose map keys name collector components ({@code <type>/<suffix>}).
 */
public enum ComponentSection {
    EXTENSIONS("extensions", List.of()),
    RECEIVERS("receivers", List.of()),
    PROCESSORS("processors", List.of()),
    CONNECTORS("connectors", List.of()),
    EXPORTERS("exporters", List.of()),
    SERVICE("service", List.of("pipelines"));

    private final String key;
    private final List<String> headerParent;

    ComponentSection(String key, List<String> headerParent) {
        this.key = key;
        this.headerParent = headerParent;
    }

    public String key() {
        return key;
    }

    /**
     * Path, relative to the section, of the map whose keys are component identifiers.
     */
    public List<String> headerParent() {
        return headerParent;
    }

    public static Optional<ComponentSection> forKey(String key) {
        for (var section : values()) {
            if (section.key.equals(key)) {
                return Optional.of(section);
            }
        }
        return Optional.empty();
    }
}
