package co.elastic.policycheck.tree;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;

/**
 * Reads policy documents into {@link PolicyDocument} trees and writes them back deterministically.
 *
 * <p>Parsing goes through SnakeYAML directly because Jackson's YAML parser reports aliases as plain
 * strings; here anchors are resolved and every alias becomes an independent copy. Writing uses Jackson with
 * map keys sorted by {@link NaturalKeyOrder} and string scalars always quoted, so a serialized tree parses
 * back to the same tree.
 *
 * <p>{@link #layout(PolicyDocument)} writes a tree back in block style with its declaration order kept,
 * which is the shape the component identifier pass reads.
 */
public final class PolicyYaml {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
        YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .disable(YAMLGenerator.Feature.SPLIT_LINES)
            .enable(YAMLGenerator.Feature.INDENT_ARRAYS_WITH_INDICATOR)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build()
    );

    private PolicyYaml() {}

    /**
     * Decodes policy bytes as UTF-8, rejecting malformed sequences instead of replacing them.
     */
    public static String decode(byte[] policy) {
        var decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(policy)).toString();
        } catch (CharacterCodingException ex) {
            throw new DocumentDecodeException("failed to decode policy: input is not valid UTF-8", ex);
        }
    }

    public static PolicyDocument parse(String text) {
        Object loaded;
        try {
            loaded = newYaml().load(text);
        } catch (YAMLException ex) {
            throw new DocumentDecodeException("failed to decode policy: " + ex.getMessage(), ex);
        }
        if (loaded == null) {
            return PolicyDocument.empty();
        }
        if (!(loaded instanceof Map<?, ?> map)) {
            throw new DocumentDecodeException(
                "failed to decode policy: document root must be a map, found " + ValueKind.of(loaded).label()
            );
        }
        var seen = Collections.newSetFromMap(new IdentityHashMap<Object, Boolean>());
        return new PolicyDocument(toTreeMap(map, seen));
    }

    public static String serialize(PolicyDocument document) {
        return serializeValue(document.root());
    }

    /**
     * Serializes any tree value (map, list or scalar) the way {@link #serialize(PolicyDocument)} does.
     */
    public static String serializeValue(Object value) {
        try {
            return YAML_MAPPER.writeValueAsString(sorted(value));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize policy: " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * Writes {@code document} as block YAML, keys in declaration order, one key per line. Flow and JSON
     * input come out in the same layout as block input, without comments.
     */
    public static String layout(PolicyDocument document) {
        var options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        options.setSplitLines(false);
        options.setMaxSimpleKeyLength(1024);
        return new Yaml(new LayoutRepresenter(options), options).dump(document.root());
    }

    private static Yaml newYaml() {
        var options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return new Yaml(new PolicyConstructor(options));
    }

    private static Map<String, Object> toTreeMap(Map<?, ?> map, Set<Object> seen) {
        enter(map, seen);
        var result = new LinkedHashMap<String, Object>();
        for (var entry : map.entrySet()) {
            result.put(String.valueOf(entry.getKey()), toTree(entry.getValue(), seen));
        }
        seen.remove(map);
        return result;
    }

    private static Object toTree(Object value, Set<Object> seen) {
        if (value instanceof Map<?, ?> map) {
            return toTreeMap(map, seen);
        }
        if (value instanceof Collection<?> collection) {
            enter(collection, seen);
            var list = new ArrayList<Object>(collection.size());
            for (var item : collection) {
                list.add(toTree(item, seen));
            }
            seen.remove(collection);
            return list;
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            return Double.isFinite(number) ? BigDecimal.valueOf(number) : value;
        }
        return value;
    }

    private static void enter(Object container, Set<Object> seen) {
        if (!seen.add(container)) {
            throw new DocumentDecodeException("failed to decode policy: recursive alias found");
        }
    }

    private static Object sorted(Object value) {
        if (value instanceof Map<?, ?> map) {
            var keys = new ArrayList<String>();
            map.keySet().forEach(k -> keys.add(String.valueOf(k)));
            keys.sort(NaturalKeyOrder.INSTANCE);
            var result = new LinkedHashMap<String, Object>();
            for (var key : keys) {
                result.put(key, sorted(map.get(key)));
            }
            return result;
        }
        if (value instanceof List<?> list) {
            var result = new ArrayList<Object>(list.size());
            for (var item : list) {
                result.add(sorted(item));
            }
            return result;
        }
        return value;
    }

    /**
     * Double quotes multi-line strings so that their continuation lines never start at column 0.
     */
    private static final class LayoutRepresenter extends Representer {
        LayoutRepresenter(DumperOptions options) {
            super(options);
            this.representers.put(String.class, data -> {
                String text = (String) data;
                if (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
                    return representScalar(Tag.STR, text, DumperOptions.ScalarStyle.DOUBLE_QUOTED);
                }
                return representScalar(Tag.STR, text);
            });
        }
    }

    /**
     * Keeps timestamps as the strings they were written as.
     */
    private static final class PolicyConstructor extends SafeConstructor {
        PolicyConstructor(LoaderOptions options) {
            super(options);
            this.yamlConstructors.put(Tag.TIMESTAMP, new ConstructYamlStr());
        }
    }
}
