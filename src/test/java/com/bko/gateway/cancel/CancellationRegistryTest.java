package com.bko.gateway.cancel;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CancellationRegistryTest {

    private final CancellationRegistry registry = new CancellationRegistry();

    @Test
    void testStopCancelsActiveToken() {
        CancellationToken token = registry.register("s1");

        assertTrue(registry.stop("s1"));
        assertTrue(token.isCancelled());
        assertFalse(registry.isActive("s1"));
    }

    @Test
    void testStopUnknownSessionHasNoEffect() {
        CancellationToken token = registry.register("s1");

        assertFalse(registry.stop("unknown"));
        assertFalse(token.isCancelled());
    }

    @Test
    void testStopAfterDeregisterReturnsFalse() {
        CancellationToken token = registry.register("s1");
        registry.deregister("s1", token);

        assertFalse(registry.stop("s1"));
        assertFalse(token.isCancelled());
    }

    @Test
    void testDeregisterIgnoresStaleToken() {
        CancellationToken first = registry.register("s1");
        CancellationToken second = registry.register("s1");

        registry.deregister("s1", first);

        assertTrue(registry.isActive("s1"));
        assertTrue(registry.stop("s1"));
        assertTrue(second.isCancelled());
    }
}
