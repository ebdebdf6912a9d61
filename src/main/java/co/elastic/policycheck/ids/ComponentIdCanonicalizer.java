package co.elastic.policycheck.ids;

import co.elastic.policycheck.tree.NaturalKeyOrder;
import co.elastic.policycheck.tree.PolicyDocument;
import co.elastic.policycheck.tree.PolicyYaml;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renames collector component identifiers ({@code httpcheck/b0f518d6-...}) to stable, order derived ones
 * ({@code httpcheck/componentid-0}) and rewrites every reference to them.
 *
 * <p>Works on block YAML text. Component sections are the blocks opened at column 0 by one of the
 * {@link ComponentSection} keys. Inside a block, headers are numbered from 0 across the whole section:
 * types in {@link NaturalKeyOrder}, components of one type by their serialized body, declaration order
 * only between equal bodies. The canonical output lists components in that same order, so a canonical
 * policy keeps its numbering when it is canonicalized again. Service pipelines are numbered after the
 * other sections.
 *
 * <p>Sample input:
 * <pre>
 * extensions:
 *   health_check/4391d954-1ffe-4014-a256-5eda78a71828: {}
 * receivers:
 *   httpcheck/b0f518d6-4e2d-4c5d-bda7-f9808df537b7:
 *     collection_interval: 1m
 * service:
 *   extensions:
 *     - health_check/4391d954-1ffe-4014-a256-5eda78a71828
 *   pipelines:
 *     logs/6b7f1379-dcb9-4ac7-b253-4df6d088b3ff:
 *       receivers:
 *         - httpcheck/b0f518d6-4e2d-4c5d-bda7-f9808df537b7
 * </pre>
 */
public final class ComponentIdCanonicalizer {
    private static final Logger LOG = LoggerFactory.getLogger(ComponentIdCanonicalizer.class);

    static final String CANONICAL_SUFFIX = "componentid-";

    private static final Pattern SECTION_START = Pattern.compile("^([A-Za-z_]+):(?:\\s+\\{\\})?\\s*(?:#.*)?$");
    private static final Pattern KEY_LINE = Pattern.compile(
        "^( *)(-\\s+)?([^\\s#'\"\\[\\]{}:,\\-][^:]*?):(?:\\s+(.*?))?\\s*$"
    );
    private static final Set<String> NULL_VALUES = Set.of("null", "Null", "NULL", "~");
    private static final Pattern COMPONENT_ID = Pattern.compile("^([A-Za-z0-9_][\\w.\\-]*)/([^\\s:]+)$");

    /**
     * Canonicalizes the identifiers of {@code policy}, ordering same-type components by the content parsed
     * from the text itself.
     *
     * @throws co.elastic.policycheck.tree.DocumentDecodeException if {@code policy} is not a YAML map
     */
    public String canonicalize(String policy) {
        return canonicalize(policy, PolicyYaml.parse(policy));
    }

    /**
     * Canonicalizes the identifiers of {@code policy}.
     *
     * @param bodies the tree {@code policy} was written from; components are looked up there to order
     *     components of the same type by their content
     */
    public String canonicalize(String policy, PolicyDocument bodies) {
        String[] lines = policy.split("\n", -1);
        List<Block> blocks = new ArrayList<>();

        int index = 0;
        while (index < lines.length) {
            var section = sectionAt(lines[index]);
            if (section.isEmpty()) {
                index++;
                continue;
            }
            int end = blockEnd(lines, index + 1);
            blocks.add(new Block(section.get(), headersIn(section.get(), lines, index + 1, end)));
            index = end;
        }
        // pipelines refer to the other sections' components by their canonical names
        blocks.sort(Comparator.comparing((Block block) -> block.section() == ComponentSection.SERVICE));

        boolean[] headerLines = new boolean[lines.length];
        var identities = new IdentityMap();
        for (var block : blocks) {
            number(block, blocks, bodies, lines, headerLines, identities);
        }

        if (!identities.isEmpty()) {
            for (int i = 0; i < lines.length; i++) {
                if (!headerLines[i]) {
                    lines[i] = identities.rewriteReferences(lines[i]);
                }
            }
        }
        LOG.debug("Rewrote {} component identifiers", identities.size());
        return String.join("\n", lines);
    }

    private static Optional<ComponentSection> sectionAt(String line) {
        Matcher matcher = SECTION_START.matcher(stripCarriageReturn(line));
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return ComponentSection.forKey(matcher.group(1));
    }

    private static int blockEnd(String[] lines, int start) {
        int end = start;
        while (end < lines.length) {
            String line = stripCarriageReturn(lines[end]);
            if (!line.isBlank() && !line.startsWith("#") && !Character.isWhitespace(line.charAt(0))) {
                break;
            }
            end++;
        }
        return end;
    }

    private static List<Header> headersIn(ComponentSection section, String[] lines, int start, int end) {
        Deque<KeyFrame> parents = new ArrayDeque<>();
        List<Header> headers = new ArrayList<>();
        for (int i = start; i < end; i++) {
            String content = stripCarriageReturn(lines[i]);
            if (content.isBlank() || content.trim().startsWith("#")) {
                continue;
            }
            Matcher keyLine = KEY_LINE.matcher(content);
            if (!keyLine.matches()) {
                continue;
            }
            boolean listItem = keyLine.group(2) != null;
            int indent = keyLine.group(1).length() + (listItem ? keyLine.group(2).length() : 0);
            while (!parents.isEmpty() && parents.peekLast().indent() >= indent) {
                parents.removeLast();
            }
            String key = keyLine.group(3);
            if (!listItem && isHeaderValue(keyLine.group(4)) && keysOf(parents).equals(section.headerParent())) {
                Matcher id = COMPONENT_ID.matcher(key);
                if (id.matches()) {
                    headers.add(new Header(i, id.group(1), key, keyLine.start(3), keyLine.end(3)));
                }
            }
            parents.addLast(new KeyFrame(indent, key));
        }
        return headers;
    }

    /**
     * Numbers the headers of one block: by type, then by body, then in declaration order. Bodies are
     * compared with every identifier not numbered yet replaced by a placeholder, so the random part of an
     * identifier never decides the order.
     */
    private static void number(
        Block block,
        List<Block> blocks,
        PolicyDocument bodies,
        String[] lines,
        boolean[] headerLines,
        IdentityMap identities
    ) {
        var section = block.section();
        var placeholders = placeholders(blocks, identities);
        List<RankedHeader> ranked = new ArrayList<>(block.headers().size());
        for (var header : block.headers()) {
            String body = PolicyYaml.serializeValue(bodyOf(bodies, section, header.id()));
            ranked.add(new RankedHeader(header, placeholders.rewriteReferences(body)));
        }
        ranked.sort(
            Comparator.comparing((RankedHeader entry) -> entry.header().type() + "/", NaturalKeyOrder.INSTANCE)
                .thenComparing(RankedHeader::body, NaturalKeyOrder.INSTANCE)
        );

        for (int n = 0; n < ranked.size(); n++) {
            var header = ranked.get(n).header();
            String canonical = header.type() + "/" + CANONICAL_SUFFIX + n;
            String line = lines[header.line()];
            lines[header.line()] = line.substring(0, header.keyStart()) + canonical + line.substring(header.keyEnd());
            headerLines[header.line()] = true;
            if (!identities.record(header.id(), canonical)) {
                LOG.warn(
                    "Component {} in {} is also declared in another section, references keep {}",
                    header.id(),
                    section.key(),
                    identities.canonicalFor(header.id()).orElse(canonical)
                );
            }
        }
    }

    private static IdentityMap placeholders(List<Block> blocks, IdentityMap identities) {
        var placeholders = new IdentityMap();
        identities.asMap().forEach(placeholders::record);
        for (var block : blocks) {
            for (var header : block.headers()) {
                placeholders.record(header.id(), header.type() + "/" + CANONICAL_SUFFIX);
            }
        }
        return placeholders;
    }

    private static Object bodyOf(PolicyDocument bodies, ComponentSection section, String id) {
        Object node = bodies.root().get(section.key());
        for (var parent : section.headerParent()) {
            node = node instanceof Map<?, ?> map ? map.get(parent) : null;
        }
        return node instanceof Map<?, ?> map ? map.get(id) : null;
    }

    private static boolean isHeaderValue(String rest) {
        return rest == null
            || rest.isEmpty()
            || rest.equals("{}")
            || NULL_VALUES.contains(rest)
            || rest.startsWith("#");
    }

    private static List<String> keysOf(Deque<KeyFrame> frames) {
        var keys = new ArrayList<String>(frames.size());
        for (var frame : frames) {
            keys.add(frame.key());
        }
        return keys;
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private record KeyFrame(int indent, String key) {}

    private record Header(int line, String type, String id, int keyStart, int keyEnd) {}

    private record RankedHeader(Header header, String body) {}

    private record Block(ComponentSection section, List<Header> headers) {}
}
