package com.acme.devtools.flowtap.collab;

/**
 * Outcome of putting the interception CA on a device.
 */
public enum CertInstallResult {
    /** Trusted without user action (system or user store). */
    INSTALLED_AUTOMATICALLY,
    /** Copied to the device; the user still has to confirm it. */
    REQUIRES_MANUAL_INSTALL,
    FAILED;

    public boolean isUsable() {
        return this != FAILED;
    }
}
