package com.acme.devtools.flowtap.coordinator;

import com.acme.devtools.flowtap.collab.AppInfo;
import com.acme.devtools.flowtap.collab.CertInstallResult;
import com.acme.devtools.flowtap.collab.DeviceAttachment;
import com.acme.devtools.flowtap.collab.DeviceCollaborators;
import com.acme.devtools.flowtap.collab.DeviceDiscovery;
import com.acme.devtools.flowtap.collab.DeviceInfo;
import com.acme.devtools.flowtap.collab.TrafficRedirector;
import com.acme.devtools.flowtap.flow.ResponseSnapshot;
import com.acme.devtools.flowtap.mock.MockRuleRepository;
import com.acme.devtools.flowtap.transport.api.SubmitOutcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InspectorSessionTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldStartOnEphemeralPortAndStopIdempotently() throws Exception {
        InspectorSession session = new InspectorSession(config(null));
        session.start();
        try {
            assertTrue(session.isRunning());
            assertNotEquals(0, session.controlPort());
            assertTrue(session.coordinator().ping());
        } finally {
            session.stop();
        }
        session.stop();
        assertFalse(session.isRunning());
        assertThrows(IllegalStateException.class, session::start);
    }

    @Test
    void stopShouldReleasePausedFlowsAndSaveRules() throws Exception {
        Path rulesFile = tempDir.resolve("rules.json");
        InspectorSession session = new InspectorSession(config(rulesFile).withMode(InterceptMode.DEBUG));
        session.start();
        session.rules().create("users", "GET", "https://api.example.com/users", 200, "[]");
        SubmitOutcome outcome = session.coordinator().submit(FlowCoordinatorTest.submission(
            "GET", "https://api.example.com/a", new ResponseSnapshot(200, "OK", Map.of(), "ok")));

        session.stop();

        assertTrue(outcome.decision().get(2, TimeUnit.SECONDS).isPassThrough());
        assertTrue(Files.exists(rulesFile));
        MockRuleRepository reloaded = new MockRuleRepository();
        assertEquals(1, reloaded.loadFrom(rulesFile));
        assertEquals("users", reloaded.list().get(0).name());
    }

    @Test
    void startShouldLoadExistingRulesFile() throws Exception {
        Path rulesFile = tempDir.resolve("rules.json");
        MockRuleRepository seed = new MockRuleRepository();
        seed.create("login", "POST", "https://api.example.com/login", 201, "{}");
        seed.saveTo(rulesFile);

        try (InspectorSession session = new InspectorSession(config(rulesFile))) {
            session.start();
            assertEquals(1, session.rules().size());
            assertEquals(1, session.coordinator().status().rules());
        }
    }

    @Test
    void attachShouldInstallCaAndRedirectApp() throws Exception {
        FakeRedirector redirector = new FakeRedirector(true);
        DeviceCollaborators devices = devices(CertInstallResult.REQUIRES_MANUAL_INSTALL, redirector);

        try (InspectorSession session = new InspectorSession(config(null), devices)) {
            session.start();
            DeviceAttachment attachment = session.attachDevice("emulator-5554", "com.example.shop");

            assertEquals(10123, attachment.app().uid());
            assertEquals(8888, attachment.proxyPort());
            assertEquals(CertInstallResult.REQUIRES_MANUAL_INSTALL, attachment.certificate());
            assertEquals(List.of("enable emulator-5554 10123 8888"), redirector.calls);
            assertEquals(1, session.attachments().size());

            assertTrue(session.detachDevice("emulator-5554"));
            assertFalse(session.detachDevice("emulator-5554"));
            assertEquals("disable emulator-5554 10123 8888", redirector.calls.get(1));
        }
    }

    @Test
    void stopShouldDetachEveryDevice() throws Exception {
        FakeRedirector redirector = new FakeRedirector(true);
        InspectorSession session = new InspectorSession(config(null), devices(CertInstallResult.INSTALLED_AUTOMATICALLY, redirector));
        session.start();
        session.attachDevice("emulator-5554", "com.example.shop");

        session.stop();

        assertEquals(2, redirector.calls.size());
        assertTrue(redirector.calls.get(1).startsWith("disable emulator-5554"));
        assertTrue(session.attachments().isEmpty());
    }

    @Test
    void attachShouldRejectUnknownDevicesAndApps() throws Exception {
        FakeRedirector redirector = new FakeRedirector(true);
        try (InspectorSession session = new InspectorSession(config(null), devices(CertInstallResult.FAILED, redirector))) {
            assertThrows(IllegalStateException.class, () -> session.attachDevice("emulator-5554", "com.example.shop"));
            session.start();

            assertThrows(IllegalArgumentException.class, () -> session.attachDevice("missing", "com.example.shop"));
            assertThrows(IllegalArgumentException.class, () -> session.attachDevice("emulator-5556", "com.example.shop"));
            assertThrows(IllegalArgumentException.class, () -> session.attachDevice("emulator-5554", "com.example.none"));
            assertTrue(redirector.calls.isEmpty());
        }
    }

    @Test
    void attachShouldFailWhenRedirectionFails() throws Exception {
        FakeRedirector redirector = new FakeRedirector(false);
        try (InspectorSession session = new InspectorSession(config(null), devices(CertInstallResult.INSTALLED_AUTOMATICALLY, redirector))) {
            session.start();

            assertThrows(IllegalStateException.class, () -> session.attachDevice("emulator-5554", "com.example.shop"));
            assertTrue(session.attachments().isEmpty());
        }
    }

    private static SessionConfig config(Path rulesFile) {
        return new SessionConfig("127.0.0.1", 0, InterceptMode.RECORDING, 100, 0L, rulesFile, 8888, 0);
    }

    private static DeviceCollaborators devices(CertInstallResult certificate, TrafficRedirector redirector) {
        DeviceDiscovery discovery = new DeviceDiscovery() {
            @Override
            public List<DeviceInfo> listDevices() {
                return List.of(
                    new DeviceInfo("emulator-5554", "Pixel 7", 34, true),
                    new DeviceInfo("emulator-5556", "Pixel 4", 30, false));
            }

            @Override
            public List<AppInfo> listApps(String deviceId) {
                return List.of(new AppInfo("com.example.shop", "Shop", 10123, false));
            }
        };
        return new DeviceCollaborators(discovery, deviceId -> certificate, redirector);
    }

    private static final class FakeRedirector implements TrafficRedirector {
        private final boolean result;
        private final List<String> calls = new ArrayList<>();

        private FakeRedirector(boolean result) {
            this.result = result;
        }

        @Override
        public boolean enable(String deviceId, int appUid, int proxyPort) {
            calls.add("enable " + deviceId + " " + appUid + " " + proxyPort);
            return result;
        }

        @Override
        public boolean disable(String deviceId, int appUid, int proxyPort) {
            calls.add("disable " + deviceId + " " + appUid + " " + proxyPort);
            return true;
        }
    }
}
