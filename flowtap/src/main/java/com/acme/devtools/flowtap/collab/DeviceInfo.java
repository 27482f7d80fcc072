package com.acme.devtools.flowtap.collab;

import java.util.Objects;

public record DeviceInfo(String id, String name, int apiLevel, boolean online) {
    public DeviceInfo {
        Objects.requireNonNull(id, "id");
    }

    public String displayName() {
        return name == null || name.isBlank() ? id : name;
    }
}
