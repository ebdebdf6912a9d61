package co.elastic.policycheck.api;

import co.elastic.policycheck.filter.FilterEngine;
import co.elastic.policycheck.ids.ComponentIdCanonicalizer;
import co.elastic.policycheck.tree.PolicyYaml;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Reduces a policy to its canonical form: component identifiers renamed, volatile fields filtered out by
 * the rule table, keys sorted. Two policies that only differ in generated content canonicalize to the
 * same bytes, and canonicalizing a canonical policy returns it unchanged.
 *
 * <p>Instances hold no per-call state and can be shared between threads.
 */
public final class PolicyCanonicalizer {
    private final PolicyCheckConfiguration configuration;
    private final ComponentIdCanonicalizer componentIds = new ComponentIdCanonicalizer();

    public PolicyCanonicalizer() {
        this(PolicyCheckConfiguration.defaults());
    }

    public PolicyCanonicalizer(PolicyCheckConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    public byte[] canonicalize(byte[] policy) {
        return canonicalize(PolicyYaml.decode(policy)).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * The policy is parsed and filtered once to lay it out as block YAML and to order components by their
     * filtered content, then the identifier pass runs over that layout and the result is filtered again.
     */
    public String canonicalize(String policy) {
        var source = PolicyYaml.parse(policy);
        FilterEngine.apply(source, configuration.rules());
        var rewritten = componentIds.canonicalize(PolicyYaml.layout(source), source);
        var document = PolicyYaml.parse(rewritten);
        FilterEngine.apply(document, configuration.rules());
        return PolicyYaml.serialize(document);
    }
}
