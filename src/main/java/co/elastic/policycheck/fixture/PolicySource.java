package co.elastic.policycheck.fixture;

import java.io.IOException;

/**
 * Supplies agent policies exactly as served by Fleet, without any processing.
 */
@FunctionalInterface
public interface PolicySource {
    byte[] downloadPolicy(String policyId) throws IOException;
}
