package com.acme.devtools.flowtap.collab;

public interface CertificateInstaller {
    CertInstallResult install(String deviceId);
}
