package co.elastic.policycheck.filter;

import static co.elastic.policycheck.filter.FilterRule.delete;
import static co.elastic.policycheck.filter.FilterRule.deleteIfEmpty;
import static co.elastic.policycheck.filter.FilterRule.recurseInto;
import static co.elastic.policycheck.filter.FilterRule.recurseIntoMembers;
import static co.elastic.policycheck.filter.FilterRule.renameKeys;
import static co.elastic.policycheck.filter.FilterRule.replaceValues;

import java.util.List;

/**
 * Fields of a downloaded agent policy that are removed or normalized before comparing it with the
 * expected one, because their content is generated by Fleet or depends on the deployment.
 */
public final class PolicyRuleTable {
    public static final String PERMISSIONS_PLACEHOLDER_KEY = "uuid-for-permissions-on-related-indices";
    public static final String ENDPOINT_PLACEHOLDER = "https://elasticsearch:9200";

    public static final List<FilterRule> DEFAULT = List.of(
        // IDs are not relevant.
        delete("id"),
        recurseInto("inputs",
            delete("id"),
            delete("package_policy_id"),
            recurseInto("streams", delete("id"))
        ),
        recurseInto("secret_references", delete("id")),

        // Avoid regenerating fixtures every time the package version changes.
        recurseInto("inputs", delete("meta.package.version")),

        delete("revision"),
        recurseInto("inputs", delete("revision")),

        // Depend on the deployment.
        delete("agent"),
        delete("fleet"),
        delete("outputs"),

        // Signatures change from installation to installation.
        delete("agent.protection.uninstall_token_hash"),
        delete("agent.protection.signing_key"),
        delete("signed"),

        // Permissions for related indices are stored under a random UUID.
        renameKeys("output_permissions.default", "^[a-z0-9]{4,}(-[a-z0-9]{4,})+$", PERMISSIONS_PLACEHOLDER_KEY),

        // Older stacks don't report namespaces.
        deleteIfEmpty("namespaces", "default"),

        // Set by Fleet in input packages starting on 9.1.0.
        recurseInto("inputs",
            recurseInto("streams",
                delete("data_stream.type"),
                delete("data_stream.elasticsearch.dynamic_dataset"),
                delete("data_stream.elasticsearch.dynamic_namespace"),
                deleteIfEmpty("data_stream.elasticsearch")
            )
        ),

        // Exporter endpoints point to the deployment under test.
        recurseIntoMembers("exporters", replaceValues("endpoints", ENDPOINT_PLACEHOLDER))
    );

    private PolicyRuleTable() {}
}
