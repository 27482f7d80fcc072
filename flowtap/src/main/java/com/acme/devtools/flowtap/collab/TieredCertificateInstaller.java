package com.acme.devtools.flowtap.collab;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tries strategies in order and reports the first success. A strategy that throws counts
 * as a failed tier.
 */
public final class TieredCertificateInstaller implements CertificateInstaller {
    private static final Logger LOG = Logger.getLogger(TieredCertificateInstaller.class.getName());

    private final List<CertificateInstallStrategy> tiers;

    public TieredCertificateInstaller(List<CertificateInstallStrategy> tiers) {
        this.tiers = List.copyOf(Objects.requireNonNull(tiers, "tiers"));
    }

    @Override
    public CertInstallResult install(String deviceId) {
        for (CertificateInstallStrategy tier : tiers) {
            try {
                if (tier.tryInstall(deviceId)) {
                    CertInstallResult result = tier.successResult();
                    LOG.info(() -> "Certificate on " + deviceId + " via " + tier.name() + ": " + result);
                    return result;
                }
                LOG.fine(() -> "Certificate tier " + tier.name() + " declined on " + deviceId);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return CertInstallResult.FAILED;
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Certificate tier " + tier.name() + " failed on " + deviceId, e);
            }
        }
        LOG.warning("No certificate tier succeeded on " + deviceId);
        return CertInstallResult.FAILED;
    }
}
