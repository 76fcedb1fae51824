package io.blockmon.core.recorder;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CoverageStackTest {

    private final CoverageStack stack = new CoverageStack();

    @Test
    void pushStartsAndPopStops() {
        ManualCoverageProvider provider = new ManualCoverageProvider();

        stack.push(provider);
        assertTrue(provider.isStarted());
        assertEquals(1, stack.depth());

        provider.switchContext("t1");
        provider.hit("A.java", 3);
        Map<String, Map<String, Set<Integer>>> data = stack.pop(provider);

        assertFalse(provider.isStarted());
        assertTrue(stack.isEmpty());
        assertEquals(Map.of("t1", Map.of("A.java", Set.of(3))), data);
    }

    @Test
    void nestedScopeSuspendsAndMergesIntoEnclosing() {
        ManualCoverageProvider outer = new ManualCoverageProvider();
        ManualCoverageProvider inner = new ManualCoverageProvider();
        stack.push(outer);
        outer.switchContext("t1");
        outer.hit("A.java", 1);

        stack.push(inner);
        assertFalse(outer.isStarted());
        outer.hit("A.java", 99);
        inner.switchContext("t1");
        inner.hit("B.java", 2);
        stack.pop(inner);

        assertTrue(outer.isStarted());
        assertEquals(Map.of("t1", Map.of("A.java", Set.of(1), "B.java", Set.of(2))), outer.linesByContext());
    }

    @Test
    void poppingAProviderNotOnTopIsCorruption() {
        ManualCoverageProvider outer = new ManualCoverageProvider();
        ManualCoverageProvider inner = new ManualCoverageProvider();
        stack.push(outer);
        stack.push(inner);

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> stack.pop(outer));
        assertTrue(e.getMessage().contains("corrupted"));
        assertThrows(IllegalStateException.class, () -> new CoverageStack().pop(outer));
    }

    @Test
    void hitsWithoutContextOrWhileStoppedAreDropped() {
        ManualCoverageProvider provider = new ManualCoverageProvider();
        provider.switchContext("t1");
        provider.hit("A.java", 1);

        provider.start();
        provider.switchContext(null);
        provider.hit("A.java", 2);

        assertTrue(provider.linesByContext().isEmpty());
    }

    @Test
    void eraseForgetsLines() {
        ManualCoverageProvider provider = new ManualCoverageProvider();
        provider.start();
        provider.switchContext("t1");
        provider.hit("A.java", 1);

        provider.erase();

        assertTrue(provider.linesByContext().isEmpty());
    }
}
