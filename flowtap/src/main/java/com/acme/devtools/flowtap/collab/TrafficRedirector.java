package com.acme.devtools.flowtap.collab;

/**
 * Routes one application's traffic on a device through the proxy agent and back.
 */
public interface TrafficRedirector {
    boolean enable(String deviceId, int appUid, int proxyPort);

    boolean disable(String deviceId, int appUid, int proxyPort);
}
