package com.acme.devtools.flowtap.collab;

import java.util.Objects;

/**
 * Installed application. {@code uid} is the OS user id traffic redirection filters on.
 */
public record AppInfo(String packageName, String appName, int uid, boolean systemApp) {
    public AppInfo {
        Objects.requireNonNull(packageName, "packageName");
    }

    public String displayName() {
        return appName == null || appName.isBlank() ? packageName : appName;
    }
}
