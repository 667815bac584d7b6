package com.securityops.devicesync.client.impl;

/**
 * Entra ID device ids shared by the mock catalogs.
 */
public final class MockDeviceKeys {

    public static final String SHARED_LAPTOP = "5f0c3e6a-1b2d-4c8e-9a7f-0d1e2f3a4b5c";
    public static final String SHARED_DESKTOP = "8a9b0c1d-2e3f-4a5b-8c7d-9e0f1a2b3c4d";
    public static final String INTUNE_ONLY_PHONE = "c4d5e6f7-0819-4a2b-bc3d-4e5f60718293";
    public static final String DEFENDER_ONLY_SERVER = "e1f2a3b4-c5d6-4e7f-8091-a2b3c4d5e6f7";

    private MockDeviceKeys() {
    }
}
