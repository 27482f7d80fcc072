package com.acme.devtools.flowtap.coordinator;

import com.acme.devtools.flowtap.transport.api.ControlTransport;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlowtapMainTest {

    @Test
    void shouldRollbackWhenProxyStartFails() throws Exception {
        InspectorSession session = new InspectorSession(config());
        IllegalStateException failure = new IllegalStateException("proxy port in use");
        AtomicBoolean rolledBack = new AtomicBoolean(false);

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
            () -> FlowtapMain.startWithRollback(session, new FakeTransport(failure), () -> {
                rolledBack.set(true);
                session.stop();
            }));

        assertSame(failure, thrown);
        assertTrue(rolledBack.get());
        assertFalse(session.isRunning());
    }

    @Test
    void shouldNotRollbackWhenEverythingStarts() throws Exception {
        InspectorSession session = new InspectorSession(config());
        FakeTransport proxy = new FakeTransport(null);
        AtomicBoolean rolledBack = new AtomicBoolean(false);
        try {
            FlowtapMain.startWithRollback(session, proxy, () -> rolledBack.set(true));

            assertTrue(session.isRunning());
            assertEquals(1, proxy.starts);
            assertFalse(rolledBack.get());
        } finally {
            session.stop();
        }
    }

    @Test
    void shouldStartSessionAloneWithoutProxy() throws Exception {
        InspectorSession session = new InspectorSession(config());
        try {
            FlowtapMain.startWithRollback(session, null, () -> { });
            assertTrue(session.isRunning());
        } finally {
            session.stop();
        }
    }

    private static SessionConfig config() {
        return new SessionConfig("127.0.0.1", 0, InterceptMode.RECORDING, 100, 0L, null, 0, 0);
    }

    private static final class FakeTransport implements ControlTransport {
        private final RuntimeException failure;
        private int starts;

        private FakeTransport(RuntimeException failure) {
            this.failure = failure;
        }

        @Override
        public String name() {
            return "fake";
        }

        @Override
        public void start() {
            starts++;
            if (failure != null) {
                throw failure;
            }
        }

        @Override
        public void stop() {
        }

        @Override
        public int port() {
            return 0;
        }
    }
}
