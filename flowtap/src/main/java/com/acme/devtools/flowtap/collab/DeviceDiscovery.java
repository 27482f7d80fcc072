package com.acme.devtools.flowtap.collab;

import java.util.List;

public interface DeviceDiscovery {
    List<DeviceInfo> listDevices();

    List<AppInfo> listApps(String deviceId);
}
