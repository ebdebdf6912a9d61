package co.elastic.policycheck.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class NaturalKeyOrderTest {
    @Test
    void comparesDigitRunsNumerically() {
        assertTrue(NaturalKeyOrder.INSTANCE.compare("componentid-2", "componentid-10") < 0);
        assertTrue(NaturalKeyOrder.INSTANCE.compare("componentid-10", "componentid-9") > 0);
    }

    @Test
    void comparesTextLexicographically() {
        assertTrue(NaturalKeyOrder.INSTANCE.compare("batch/x", "transform/x") < 0);
        assertTrue(NaturalKeyOrder.INSTANCE.compare("_elastic_agent_checks", "uuid") < 0);
    }

    @Test
    void prefixSortsFirst() {
        assertTrue(NaturalKeyOrder.INSTANCE.compare("logs", "logs/componentid-0") < 0);
    }

    @Test
    void leadingZerosFallBackToStringOrder() {
        int forward = NaturalKeyOrder.INSTANCE.compare("a01", "a1");
        int backward = NaturalKeyOrder.INSTANCE.compare("a1", "a01");
        assertTrue(forward != 0);
        assertEquals(-Integer.signum(forward), Integer.signum(backward));
    }

    @Test
    void sortsMixedKeys() {
        var keys = new ArrayList<>(List.of("b10", "a", "b2", "b1", "B"));
        keys.sort(NaturalKeyOrder.INSTANCE);
        assertEquals(List.of("B", "a", "b1", "b2", "b10"), keys);
    }
}
