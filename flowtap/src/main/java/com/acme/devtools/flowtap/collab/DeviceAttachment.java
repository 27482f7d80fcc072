package com.acme.devtools.flowtap.collab;

public record DeviceAttachment(DeviceInfo device, AppInfo app, int proxyPort, CertInstallResult certificate) {
}
