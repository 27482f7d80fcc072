package com.acme.devtools.flowtap.collab;

/**
 * One way of installing the CA, tried in order by {@link TieredCertificateInstaller}.
 */
public interface CertificateInstallStrategy {
    String name();

    /**
     * @return {@code true} when the certificate is in place after this call
     * @throws Exception when the attempt broke; the installer moves on to the next tier
     */
    boolean tryInstall(String deviceId) throws Exception;

    /** What a successful attempt means for the caller. */
    default CertInstallResult successResult() {
        return CertInstallResult.INSTALLED_AUTOMATICALLY;
    }
}
