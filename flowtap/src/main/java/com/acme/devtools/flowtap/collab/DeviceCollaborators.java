package com.acme.devtools.flowtap.collab;

import java.util.List;
import java.util.Objects;

/**
 * Platform services a session needs to attach to a device. {@link #NONE} leaves the session
 * usable for in-process and proxy capture only.
 */
public record DeviceCollaborators(DeviceDiscovery discovery,
                                  CertificateInstaller certificates,
                                  TrafficRedirector redirector) {

    public static final DeviceCollaborators NONE = new DeviceCollaborators(
        new DeviceDiscovery() {
            @Override
            public List<DeviceInfo> listDevices() {
                return List.of();
            }

            @Override
            public List<AppInfo> listApps(String deviceId) {
                return List.of();
            }
        },
        deviceId -> CertInstallResult.FAILED,
        new TrafficRedirector() {
            @Override
            public boolean enable(String deviceId, int appUid, int proxyPort) {
                return false;
            }

            @Override
            public boolean disable(String deviceId, int appUid, int proxyPort) {
                return false;
            }
        }
    );

    public DeviceCollaborators {
        Objects.requireNonNull(discovery, "discovery");
        Objects.requireNonNull(certificates, "certificates");
        Objects.requireNonNull(redirector, "redirector");
    }
}
