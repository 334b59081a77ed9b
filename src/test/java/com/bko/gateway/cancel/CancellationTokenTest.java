package com.bko.gateway.cancel;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void testCancelRunsListenersOnce() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        assertTrue(token.cancel());
        assertFalse(token.cancel());
        assertTrue(token.isCancelled());
        assertEquals(1, calls.get());
    }

    @Test
    void testListenerRegisteredAfterCancelRunsImmediately() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger calls = new AtomicInteger();

        token.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void testRemovedRegistrationDoesNotRun() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        CancellationToken.Registration registration = token.onCancel(calls::incrementAndGet);

        registration.remove();
        token.cancel();

        assertEquals(0, calls.get());
    }

    @Test
    void testFailingListenerDoesNotStopOthers() {
        CancellationToken token = new CancellationToken();
        List<String> ran = new ArrayList<>();
        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(() -> ran.add("second"));

        token.cancel();

        assertEquals(List.of("second"), ran);
    }

    @Test
    void testThrowIfCancelled() {
        CancellationToken token = new CancellationToken();
        assertDoesNotThrow(token::throwIfCancelled);
        token.cancel();
        assertThrows(CancellationException.class, token::throwIfCancelled);
    }

    @Test
    void testChildFollowsParentButNotTheOtherWay() {
        CancellationToken parent = new CancellationToken();
        CancellationToken child = parent.child();
        CancellationToken sibling = parent.child();

        child.cancel();
        assertFalse(parent.isCancelled());
        assertFalse(sibling.isCancelled());

        parent.cancel();
        assertTrue(sibling.isCancelled());
    }
}
